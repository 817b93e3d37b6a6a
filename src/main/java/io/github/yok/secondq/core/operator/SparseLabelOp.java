package io.github.yok.secondq.core.operator;

import java.util.Iterator;
import org.apache.commons.math3.complex.Complex;

/**
 * ラベル文字列をキーとする疎な演算子（第二量子化演算子）の代数を表すインタフェースです。
 *
 * <p>
 * 和・スカラー倍・複素共役・等価判定などのベクトル空間としての演算は {@link SparseTerms} に委譲した既定実装を持ちます。
 * 合成・テンソル積・エルミート共役・転置・簡約といったラベル固有の演算は、演算子の種類ごとに実装します。
 * </p>
 *
 * <p>
 * 実装クラスは不変である必要があります。すべての演算は新しいインスタンスを返します。
 * </p>
 *
 * @param <T> 実装クラス自身の型です
 */
public interface SparseLabelOp<T extends SparseLabelOp<T>> extends Iterable<String> {

    /**
     * 簡約と等価判定で用いる既定の絶対許容誤差です。
     */
    double DEFAULT_ATOL = 1e-8;

    /**
     * 保持している項（ラベル → 係数）を返します。
     *
     * @return 項です
     */
    SparseTerms terms();

    /**
     * 同じ種類の演算子を、指定した項で生成します。
     *
     * @param terms 項です
     * @return 生成した演算子です
     */
    T withTerms(SparseTerms terms);

    /**
     * 合成（ラベルの連結）を返します。
     *
     * @param other 合成する演算子です
     * @param front true の場合は other のラベルを前に置きます
     * @return 合成した演算子です
     */
    T compose(T other, boolean front);

    /**
     * テンソル積を返します。other のモード番号はこの演算子のレジスタ長だけずらします。
     *
     * @param other 右側の演算子です
     * @return テンソル積です
     */
    T tensor(T other);

    /**
     * 逆順のテンソル積（{@code other.tensor(this)}）を返します。
     *
     * @param other 左側の演算子です
     * @return テンソル積です
     */
    T expand(T other);

    /**
     * エルミート共役を返します。
     *
     * @return エルミート共役です
     */
    T adjoint();

    /**
     * 転置を返します。
     *
     * @return 転置です
     */
    T transpose();

    /**
     * 重複・相殺する項をまとめ、絶対値が atol 以下の項を取り除いた演算子を返します。
     *
     * @param atol 絶対許容誤差です
     * @return 簡約した演算子です
     */
    T simplify(double atol);

    /**
     * 既定の許容誤差で簡約した演算子を返します。
     *
     * @return 簡約した演算子です
     */
    default T simplify() {
        return simplify(DEFAULT_ATOL);
    }

    /**
     * 合成（{@code front=false}）を返します。
     *
     * @param other 合成する演算子です
     * @return 合成した演算子です
     */
    default T compose(T other) {
        return compose(other, false);
    }

    /**
     * レジスタ長（モード数）を返します。
     *
     * @return レジスタ長です
     */
    default int registerLength() {
        return terms().registerLength();
    }

    /**
     * 和を返します。
     *
     * @param other 加える演算子です
     * @return 和です
     * @throws MismatchedRegisterLengthException レジスタ長が異なる場合に発生します
     * @throws UnsupportedOperandTypeException 種類の異なる演算子の場合に発生します
     */
    default T add(T other) {
        requireSameKind("add", other);
        requireSameLayout(other);
        return withTerms(terms().plus(other.terms()));
    }

    /**
     * 差を返します。
     *
     * @param other 引く演算子です
     * @return 差です
     * @throws MismatchedRegisterLengthException レジスタ長が異なる場合に発生します
     * @throws UnsupportedOperandTypeException 種類の異なる演算子の場合に発生します
     */
    default T subtract(T other) {
        requireSameKind("subtract", other);
        requireSameLayout(other);
        return withTerms(terms().plus(other.terms().times(Complex.ONE.negate())));
    }

    /**
     * 複素スカラー倍を返します。
     *
     * @param scalar スカラーです
     * @return スカラー倍です
     */
    default T scale(Complex scalar) {
        if (scalar == null) {
            throw new UnsupportedOperandTypeException("scale", null);
        }
        return withTerms(terms().times(scalar));
    }

    /**
     * 実スカラー倍を返します。
     *
     * @param scalar スカラーです
     * @return スカラー倍です
     */
    default T scale(double scalar) {
        return scale(new Complex(scalar));
    }

    /**
     * 型の決まっていないスカラーでスカラー倍を返します。
     *
     * @param scalar {@link Complex} または {@link Number} です
     * @return スカラー倍です
     * @throws UnsupportedOperandTypeException 数値でない場合に発生します
     */
    default T scale(Object scalar) {
        if (scalar instanceof Complex) {
            return scale((Complex) scalar);
        }
        if (scalar instanceof Number) {
            return scale(((Number) scalar).doubleValue());
        }
        throw new UnsupportedOperandTypeException("scale", scalar);
    }

    /**
     * 符号を反転した演算子を返します。
     *
     * @return -1 倍です
     */
    default T negate() {
        return scale(-1.0);
    }

    /**
     * 係数のみを複素共役にした演算子を返します。
     *
     * @return 複素共役です
     */
    default T conjugate() {
        return withTerms(terms().conjugate());
    }

    /**
     * 既定の許容誤差で等価かどうかを判定します。
     *
     * @param other 比較対象です
     * @return 等価な場合は true です
     */
    default boolean equiv(T other) {
        return equiv(other, DEFAULT_ATOL);
    }

    /**
     * 許容誤差付きで等価かどうかを判定します。レジスタ長の不一致は false です。
     *
     * @param other 比較対象です
     * @param atol 絶対許容誤差です
     * @return 等価な場合は true です
     */
    default boolean equiv(T other, double atol) {
        if (other == null || other.getClass() != getClass()) {
            return false;
        }
        return hasSameLayout(other) && terms().equiv(other.terms(), atol);
    }

    /**
     * レジスタ長以外のレジスタの構成（モードごとのモーダル数など）が一致するかを返します。
     *
     * <p>
     * 同じ種類の演算子であることを確認した後に呼び出します。既定では常に true です。
     * </p>
     *
     * @param other 比較対象です（同じ種類）
     * @return 一致する場合は true です
     */
    default boolean hasSameLayout(T other) {
        return true;
    }

    /**
     * ラベルの係数を返します。
     *
     * @param label ラベルです
     * @return 係数です
     * @throws LabelNotFoundException ラベルが存在しない場合に発生します
     */
    default Complex get(String label) {
        return terms().get(label);
    }

    /**
     * ラベルを保持しているかを返します。
     *
     * @param label ラベルです
     * @return 保持している場合は true です
     */
    default boolean containsLabel(String label) {
        return terms().contains(label);
    }

    /**
     * 項数を返します。
     *
     * @return 項数です
     */
    default int size() {
        return terms().size();
    }

    /**
     * ラベルを挿入順に返します。
     *
     * @return ラベルのイテレータです
     */
    @Override
    default Iterator<String> iterator() {
        return terms().iterator();
    }

    /**
     * レジスタの構成が一致することを確認します。
     *
     * @param other 相手の演算子です（同じ種類）
     * @throws MismatchedRegisterLengthException 一致しない場合に発生します
     */
    private void requireSameLayout(T other) {
        if (!hasSameLayout(other)) {
            throw new MismatchedRegisterLengthException(
                    "レジスタの構成が一致しません: " + this + " / " + other, registerLength(),
                    other.registerLength());
        }
    }

    /**
     * 同じ種類の演算子であることを確認します。
     *
     * @param operation 演算名です
     * @param other 相手のオペランドです
     * @throws UnsupportedOperandTypeException 種類が異なる、または null の場合に発生します
     */
    private void requireSameKind(String operation, Object other) {
        if (other == null || other.getClass() != getClass()) {
            throw new UnsupportedOperandTypeException(operation, other);
        }
    }
}
