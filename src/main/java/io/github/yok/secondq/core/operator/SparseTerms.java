package io.github.yok.secondq.core.operator;

import com.google.common.base.Preconditions;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import org.apache.commons.math3.complex.Complex;

/**
 * ラベル文字列から複素係数への疎な写像と、レジスタ長を保持する不変クラスです。
 *
 * <p>
 * 演算子の種類（フェルミオン等）に依存しないベクトル空間としての演算（和・スカラー倍・複素共役・等価判定）を提供します。 各演算子クラスはこのクラスを内部に保持し（合成）、ラベル固有の演算のみを自前で実装します。
 * </p>
 *
 * <p>
 * ラベルの順序は挿入順を保持します。係数がちょうど 0 の項も明示的に保持されます（{@code prune} で除去できます）。
 * </p>
 */
public final class SparseTerms implements Iterable<String> {

    /**
     * ラベル → 係数の写像です（変更不可ビュー）。
     */
    private final Map<String, Complex> data;

    /**
     * レジスタ長（モード数）です。
     */
    private final int registerLength;

    /**
     * インスタンスを生成します。
     *
     * @param data ラベル → 係数の写像です（このインスタンスが所有します）
     * @param registerLength レジスタ長です
     */
    private SparseTerms(Map<String, Complex> data, int registerLength) {
        this.data = Collections.unmodifiableMap(data);
        this.registerLength = registerLength;
    }

    /**
     * 呼び出し側の写像をコピーしてインスタンスを生成します。
     *
     * @param data ラベル → 係数の写像です（null 不可、値に null 不可）
     * @param registerLength レジスタ長です（0 以上）
     * @return 生成したインスタンスです
     * @throws IllegalArgumentException registerLength が負の場合に発生します
     * @throws NullPointerException data またはその要素が null の場合に発生します
     */
    public static SparseTerms of(Map<String, ? extends Complex> data, int registerLength) {
        Preconditions.checkNotNull(data, "data は null 不可です");
        Map<String, Complex> copy = new LinkedHashMap<>(Math.max(16, data.size() * 2));
        for (Map.Entry<String, ? extends Complex> e : data.entrySet()) {
            copy.put(Preconditions.checkNotNull(e.getKey(), "ラベルに null は使えません"),
                    Preconditions.checkNotNull(e.getValue(), "係数に null は使えません: %s",
                            e.getKey()));
        }
        return wrap(copy, registerLength);
    }

    /**
     * 呼び出し側の写像をコピーせずにインスタンスを生成します。
     *
     * <p>
     * 呼び出し側は、渡した写像を以後変更しないことを保証する必要があります。 変更した場合の動作は未定義です。
     * </p>
     *
     * @param data ラベル → 係数の写像です（null 不可）
     * @param registerLength レジスタ長です（0 以上）
     * @return 生成したインスタンスです
     */
    public static SparseTerms wrap(Map<String, Complex> data, int registerLength) {
        Preconditions.checkNotNull(data, "data は null 不可です");
        Preconditions.checkArgument(registerLength >= 0, "registerLength は 0 以上が必要です: %s",
                registerLength);
        return new SparseTerms(data, registerLength);
    }

    /**
     * 項を持たない（零）インスタンスを返します。
     *
     * @param registerLength レジスタ長です
     * @return 零です
     */
    public static SparseTerms zero(int registerLength) {
        return wrap(new LinkedHashMap<>(), registerLength);
    }

    /**
     * 恒等ラベル {@code ""} に係数 1.0 を持つインスタンスを返します。
     *
     * @param registerLength レジスタ長です
     * @return 単位元です
     */
    public static SparseTerms one(int registerLength) {
        Map<String, Complex> m = new LinkedHashMap<>();
        m.put("", Complex.ONE);
        return wrap(m, registerLength);
    }

    /**
     * 同一ラベルの係数を加算しながら項を積み上げるビルダを返します。
     *
     * @param registerLength レジスタ長です
     * @return ビルダです
     */
    public static Builder builder(int registerLength) {
        return new Builder(registerLength);
    }

    /**
     * レジスタ長を返します。
     *
     * @return レジスタ長です
     */
    public int registerLength() {
        return registerLength;
    }

    /**
     * 保持している項数を返します。
     *
     * @return 項数です
     */
    public int size() {
        return data.size();
    }

    /**
     * ラベルを保持しているかを返します。
     *
     * @param label ラベルです
     * @return 保持している場合は true です
     */
    public boolean contains(String label) {
        return data.containsKey(label);
    }

    /**
     * ラベルの係数を返します。
     *
     * @param label ラベルです
     * @return 係数です
     * @throws LabelNotFoundException ラベルが存在しない場合に発生します
     */
    public Complex get(String label) {
        Complex c = data.get(label);
        if (c == null) {
            throw new LabelNotFoundException(label);
        }
        return c;
    }

    /**
     * ラベルの係数を返します。存在しない場合は 0 を返します。
     *
     * @param label ラベルです
     * @return 係数です
     */
    public Complex getOrZero(String label) {
        return data.getOrDefault(label, Complex.ZERO);
    }

    /**
     * ラベル → 係数の変更不可ビューを返します（挿入順）。
     *
     * @return 変更不可ビューです
     */
    public Map<String, Complex> asMap() {
        return data;
    }

    /**
     * ラベルを挿入順に返します。
     *
     * @return ラベルのイテレータです
     */
    @Override
    public Iterator<String> iterator() {
        return data.keySet().iterator();
    }

    /**
     * 2 つの写像の和を返します。片方にしかないラベルは、もう片方の係数を 0 とみなします。
     *
     * @param other 加える側です
     * @return 和です
     * @throws MismatchedRegisterLengthException レジスタ長が異なる場合に発生します
     */
    public SparseTerms plus(SparseTerms other) {
        Preconditions.checkNotNull(other, "other は null 不可です");
        requireSameRegisterLength(other);
        Builder b = builder(registerLength);
        data.forEach(b::add);
        other.data.forEach(b::add);
        return b.build();
    }

    /**
     * 全係数にスカラーを掛けた写像を返します。
     *
     * @param scalar スカラーです
     * @return スカラー倍です
     */
    public SparseTerms times(Complex scalar) {
        Preconditions.checkNotNull(scalar, "scalar は null 不可です");
        Map<String, Complex> m = new LinkedHashMap<>(Math.max(16, data.size() * 2));
        data.forEach((label, c) -> m.put(label, c.multiply(scalar)));
        return wrap(m, registerLength);
    }

    /**
     * 全係数を複素共役にした写像を返します。
     *
     * @return 複素共役です
     */
    public SparseTerms conjugate() {
        Map<String, Complex> m = new LinkedHashMap<>(Math.max(16, data.size() * 2));
        data.forEach((label, c) -> m.put(label, c.conjugate()));
        return wrap(m, registerLength);
    }

    /**
     * 絶対値が atol 以下の項を取り除いた写像を返します。
     *
     * @param atol 絶対許容誤差です（0 以上）
     * @return 取り除いた後の写像です
     */
    public SparseTerms prune(double atol) {
        Preconditions.checkArgument(atol >= 0.0, "atol は 0 以上が必要です: %s", atol);
        Map<String, Complex> m = new LinkedHashMap<>(Math.max(16, data.size() * 2));
        data.forEach((label, c) -> {
            if (!(c.abs() <= atol)) {
                m.put(label, c);
            }
        });
        return wrap(m, registerLength);
    }

    /**
     * 許容誤差付きで等価かどうかを判定します。
     *
     * <p>
     * 両者のラベルの和集合上で、存在しないラベルの係数を 0 とみなし、 各ラベルの係数差の絶対値が atol 以下なら等価とします。 レジスタ長が異なる場合は例外ではなく false を返します。
     * </p>
     *
     * @param other 比較対象です（null の場合は false）
     * @param atol 絶対許容誤差です
     * @return 等価な場合は true です
     */
    public boolean equiv(SparseTerms other, double atol) {
        if (other == null || other.registerLength != registerLength) {
            return false;
        }
        for (String label : unionOfLabels(other)) {
            Complex diff = getOrZero(label).subtract(other.getOrZero(label));
            if (!(diff.abs() <= atol)) {
                return false;
            }
        }
        return true;
    }

    /**
     * 誤差を許容せずに等しいかを判定します（明示的な 0 と欠落したラベルは等しいとみなします）。
     *
     * @param o 比較対象です
     * @return 等しい場合は true です
     */
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SparseTerms)) {
            return false;
        }
        SparseTerms other = (SparseTerms) o;
        if (other.registerLength != registerLength) {
            return false;
        }
        for (String label : unionOfLabels(other)) {
            if (!exactlyEqual(getOrZero(label), other.getOrZero(label))) {
                return false;
            }
        }
        return true;
    }

    /**
     * {@link #equals(Object)} と整合するハッシュ値を返します（係数 0 の項は無視します）。
     *
     * @return ハッシュ値です
     */
    @Override
    public int hashCode() {
        int h = 0;
        for (Map.Entry<String, Complex> e : data.entrySet()) {
            Complex c = e.getValue();
            if (c.getReal() == 0.0 && c.getImaginary() == 0.0) {
                continue;
            }
            // -0.0 を 0.0 に揃えてから計算します
            int ch = 31 * Double.hashCode(c.getReal() + 0.0) + Double.hashCode(c.getImaginary() + 0.0);
            h += e.getKey().hashCode() ^ ch;
        }
        return 31 * h + registerLength;
    }

    /**
     * 文字列表現を返します。
     *
     * @return 文字列表現です
     */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("{");
        boolean first = true;
        for (Map.Entry<String, Complex> e : data.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            first = false;
            Complex c = e.getValue();
            sb.append('\'').append(e.getKey()).append("': ").append(c.getReal());
            if (c.getImaginary() != 0.0) {
                sb.append(c.getImaginary() < 0 ? " - " : " + ").append(Math.abs(c.getImaginary()))
                        .append('i');
            }
        }
        return sb.append("}, registerLength=").append(registerLength).toString();
    }

    /**
     * レジスタ長が一致することを確認します。
     *
     * @param other 比較対象です
     * @throws MismatchedRegisterLengthException 一致しない場合に発生します
     */
    void requireSameRegisterLength(SparseTerms other) {
        if (other.registerLength != registerLength) {
            throw new MismatchedRegisterLengthException(registerLength, other.registerLength);
        }
    }

    private Set<String> unionOfLabels(SparseTerms other) {
        Set<String> labels = new LinkedHashSet<>(data.keySet());
        labels.addAll(other.data.keySet());
        return labels;
    }

    private static boolean exactlyEqual(Complex a, Complex b) {
        return a.getReal() == b.getReal() && a.getImaginary() == b.getImaginary();
    }

    /**
     * 同一ラベルの係数を加算しながら項を積み上げるビルダです。
     *
     * <p>
     * {@link #build()} 後は再利用できません。
     * </p>
     */
    public static final class Builder {

        private final int registerLength;

        private Map<String, Complex> data = new LinkedHashMap<>();

        private Builder(int registerLength) {
            this.registerLength = registerLength;
        }

        /**
         * 項を加えます。既にあるラベルの場合は係数を加算します。
         *
         * @param label ラベルです
         * @param coefficient 係数です
         * @return このビルダです
         */
        public Builder add(String label, Complex coefficient) {
            Preconditions.checkState(data != null, "build() 済みのビルダは使用できません");
            data.merge(label, coefficient, Complex::add);
            return this;
        }

        /**
         * 積み上げた項から不変インスタンスを生成します。
         *
         * @return 生成したインスタンスです
         */
        public SparseTerms build() {
            Preconditions.checkState(data != null, "build() 済みのビルダは使用できません");
            SparseTerms terms = wrap(data, registerLength);
            data = null;
            return terms;
        }
    }
}
