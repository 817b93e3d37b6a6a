package io.github.yok.secondq.core.tensor;

import com.google.common.base.Preconditions;
import java.util.Arrays;
import lombok.Getter;
import org.apache.commons.math3.complex.Complex;
import org.ejml.data.DMatrixRMaj;

/**
 * 全次元が同じ大きさ（モード数）を持つ、密な複素テンソルです。
 *
 * <p>
 * 階数 r、次元 n のテンソルを行優先（最後の添字が最も速く変わる）の平坦な配列で保持します。 インスタンスは不変です。
 * </p>
 */
public final class DenseTensor {

    /**
     * 階数です（0 はスカラー）。
     */
    @Getter
    private final int rank;

    /**
     * 各添字の大きさ（モード数）です（スカラーの場合は 0）。
     */
    @Getter
    private final int dimension;

    private final double[] real;

    private final double[] imaginary;

    private DenseTensor(int rank, int dimension, double[] real, double[] imaginary) {
        this.rank = rank;
        this.dimension = dimension;
        this.real = real;
        this.imaginary = imaginary;
    }

    /**
     * 階数 0（スカラー）のテンソルを返します。
     *
     * @param value 値です
     * @return スカラーテンソルです
     */
    public static DenseTensor scalar(Complex value) {
        Preconditions.checkNotNull(value, "value は null 不可です");
        return new DenseTensor(0, 0, new double[] {value.getReal()},
                new double[] {value.getImaginary()});
    }

    /**
     * 実正方行列（1 体積分など）から階数 2 のテンソルを生成します。
     *
     * @param matrix 実正方行列です
     * @return 階数 2 のテンソルです
     * @throws IllegalArgumentException 正方行列でない場合に発生します
     */
    public static DenseTensor fromMatrix(DMatrixRMaj matrix) {
        Preconditions.checkNotNull(matrix, "matrix は null 不可です");
        Preconditions.checkArgument(matrix.numRows == matrix.numCols, "正方行列が必要です: %sx%s",
                matrix.numRows, matrix.numCols);
        int n = matrix.numRows;
        Builder b = builder(2, n);
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                b.set(matrix.get(i, j), i, j);
            }
        }
        return b.build();
    }

    /**
     * 全要素 0 から値を設定していくビルダを返します。
     *
     * @param rank 階数です（1 以上）
     * @param dimension 各添字の大きさです（1 以上）
     * @return ビルダです
     */
    public static Builder builder(int rank, int dimension) {
        Preconditions.checkArgument(rank >= 1, "rank は 1 以上が必要です: %s", rank);
        Preconditions.checkArgument(dimension >= 1, "dimension は 1 以上が必要です: %s", dimension);
        long size = 1;
        for (int i = 0; i < rank; i++) {
            size *= dimension;
            Preconditions.checkArgument(size <= Integer.MAX_VALUE, "テンソルが大きすぎます: n=%s, r=%s",
                    dimension, rank);
        }
        return new Builder(rank, dimension, (int) size);
    }

    /**
     * 要素数を返します。
     *
     * @return 要素数です
     */
    public int size() {
        return real.length;
    }

    /**
     * 要素を返します。
     *
     * @param indices 添字です（個数は階数と一致が必要です）
     * @return 要素です
     */
    public Complex get(int... indices) {
        int offset = offsetOf(rank, dimension, indices);
        return new Complex(real[offset], imaginary[offset]);
    }

    /**
     * 要素を行優先の順に走査します。
     *
     * @param includeZeros true の場合は 0 の要素も渡します
     * @param consumer 添字と値を受け取る処理です（添字配列は呼び出しごとに新しく生成します）
     */
    public void forEachEntry(boolean includeZeros, EntryConsumer consumer) {
        Preconditions.checkNotNull(consumer, "consumer は null 不可です");
        for (int offset = 0; offset < real.length; offset++) {
            if (!includeZeros && real[offset] == 0.0 && imaginary[offset] == 0.0) {
                continue;
            }
            consumer.accept(indicesOf(offset), new Complex(real[offset], imaginary[offset]));
        }
    }

    private int[] indicesOf(int offset) {
        int[] idx = new int[rank];
        int rest = offset;
        for (int axis = rank - 1; axis >= 0; axis--) {
            idx[axis] = rest % dimension;
            rest /= dimension;
        }
        return idx;
    }

    private static int offsetOf(int rank, int dimension, int[] indices) {
        Preconditions.checkArgument(indices.length == rank, "添字の個数が階数と一致しません: %s != %s",
                indices.length, rank);
        int offset = 0;
        for (int idx : indices) {
            Preconditions.checkElementIndex(idx, dimension, "index");
            offset = offset * dimension + idx;
        }
        return offset;
    }

    @Override
    public String toString() {
        return "DenseTensor(rank=" + rank + ", dimension=" + dimension + ", real="
                + Arrays.toString(real) + ", imaginary=" + Arrays.toString(imaginary) + ")";
    }

    /**
     * 添字と値を受け取る処理です。
     */
    @FunctionalInterface
    public interface EntryConsumer {

        /**
         * 要素を受け取ります。
         *
         * @param indices 添字です
         * @param value 値です
         */
        void accept(int[] indices, Complex value);
    }

    /**
     * {@link DenseTensor} のビルダです。
     */
    public static final class Builder {

        private final int rank;
        private final int dimension;
        private final double[] real;
        private final double[] imaginary;

        private Builder(int rank, int dimension, int size) {
            this.rank = rank;
            this.dimension = dimension;
            this.real = new double[size];
            this.imaginary = new double[size];
        }

        /**
         * 実数の要素を設定します。
         *
         * @param value 値です
         * @param indices 添字です
         * @return このビルダです
         */
        public Builder set(double value, int... indices) {
            return set(new Complex(value), indices);
        }

        /**
         * 複素数の要素を設定します。
         *
         * @param value 値です
         * @param indices 添字です
         * @return このビルダです
         */
        public Builder set(Complex value, int... indices) {
            Preconditions.checkNotNull(value, "value は null 不可です");
            int offset = offsetOf(rank, dimension, indices);
            real[offset] = value.getReal();
            imaginary[offset] = value.getImaginary();
            return this;
        }

        /**
         * テンソルを生成します（配列はコピーします）。
         *
         * @return テンソルです
         */
        public DenseTensor build() {
            return new DenseTensor(rank, dimension, real.clone(), imaginary.clone());
        }
    }
}
