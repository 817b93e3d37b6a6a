package io.github.yok.secondq.core.operator;

import com.google.common.base.Preconditions;
import io.github.yok.secondq.core.tensor.PolynomialTensor;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.Value;
import org.apache.commons.math3.complex.Complex;

/**
 * フェルミオンの生成・消滅演算子の積を項とする疎な演算子です。
 *
 * <p>
 * ラベルは {@code "+_i"}（モード i の生成）と {@code "-_i"}（モード i の消滅）を半角空白で連結したものです。
 * 空文字列は恒等演算子を表します。例: {@code "+_0 -_2"}
 * </p>
 *
 * <p>
 * 合成はラベルを連結するだけで並べ替えを行いません。反交換関係に基づく並べ替えは {@link #simplify(double)} と
 * {@link #normalOrder()} で明示的に行います。
 * </p>
 */
public final class FermionicOp implements SparseLabelOp<FermionicOp> {

    /**
     * ラベルを構成するトークンの書式です。
     */
    private static final Pattern TOKEN = Pattern.compile("([+\\-])_(\\d+)");

    /**
     * 項です。
     */
    private final SparseTerms terms;

    /**
     * 係数の写像をコピーして演算子を生成します。
     *
     * @param data ラベル → 係数の写像です
     * @param registerLength レジスタ長です
     * @throws InvalidLabelException ラベルが不正な場合に発生します
     */
    public FermionicOp(Map<String, ? extends Complex> data, int registerLength) {
        this(SparseTerms.of(data, registerLength));
    }

    /**
     * 項から演算子を生成します（コピーしません）。
     *
     * @param terms 項です
     * @throws InvalidLabelException ラベルが不正な場合に発生します
     */
    public FermionicOp(SparseTerms terms) {
        Preconditions.checkNotNull(terms, "terms は null 不可です");
        for (String label : terms) {
            parse(label, terms.registerLength());
        }
        this.terms = terms;
    }

    /**
     * 係数の写像から演算子を生成します。レジスタ長はラベル中の最大モード番号 + 1 とします。
     *
     * @param data ラベル → 係数の写像です
     * @return 演算子です
     * @throws InvalidLabelException ラベルが不正な場合に発生します
     */
    public static FermionicOp of(Map<String, ? extends Complex> data) {
        Preconditions.checkNotNull(data, "data は null 不可です");
        int registerLength = 0;
        for (String label : data.keySet()) {
            for (Token t : parse(label, Integer.MAX_VALUE)) {
                registerLength = Math.max(registerLength, t.getIndex() + 1);
            }
        }
        return new FermionicOp(data, registerLength);
    }

    /**
     * 実係数の写像から演算子を生成します。
     *
     * @param data ラベル → 実係数の写像です
     * @param registerLength レジスタ長です
     * @return 演算子です
     */
    public static FermionicOp ofReal(Map<String, Double> data, int registerLength) {
        Preconditions.checkNotNull(data, "data は null 不可です");
        SparseTerms.Builder b = SparseTerms.builder(registerLength);
        data.forEach((label, c) -> b.add(label, new Complex(c)));
        return new FermionicOp(b.build());
    }

    /**
     * 零演算子を返します。
     *
     * @param registerLength レジスタ長です
     * @return 零演算子です
     */
    public static FermionicOp zero(int registerLength) {
        return new FermionicOp(SparseTerms.zero(registerLength));
    }

    /**
     * 恒等演算子を返します。
     *
     * @param registerLength レジスタ長です
     * @return 恒等演算子です
     */
    public static FermionicOp one(int registerLength) {
        return new FermionicOp(SparseTerms.one(registerLength));
    }

    /**
     * 多項式テンソルから演算子を生成します（非零要素のみを項にします）。
     *
     * @param tensor 多項式テンソルです
     * @return 演算子です
     */
    public static FermionicOp fromPolynomialTensor(PolynomialTensor tensor) {
        return fromPolynomialTensor(tensor, false);
    }

    /**
     * 多項式テンソルから演算子を生成します。
     *
     * <p>
     * キー（{@code "+-"}, {@code "++--"} など）ごとに演算子を作り、和を取ります。
     * </p>
     *
     * @param tensor 多項式テンソルです
     * @param dense true の場合は係数 0 の要素も項にします
     * @return 演算子です
     * @throws InvalidLabelException キーに {@code +}/{@code -} 以外の記号がある場合に発生します
     */
    public static FermionicOp fromPolynomialTensor(PolynomialTensor tensor, boolean dense) {
        Preconditions.checkNotNull(tensor, "tensor は null 不可です");
        FermionicOp result = zero(tensor.getRegisterLength());
        for (String key : tensor.keys()) {
            result = result.add(new FermionicOp(tensor.termsOf(key, dense)));
        }
        return result;
    }

    @Override
    public SparseTerms terms() {
        return terms;
    }

    @Override
    public FermionicOp withTerms(SparseTerms newTerms) {
        return new FermionicOp(newTerms);
    }

    /**
     * 合成を返します。
     *
     * <p>
     * {@code front=false} の場合は {@code "self other"}、{@code front=true} の場合は {@code "other self"}
     * の順にラベルを連結し、係数は積とします。
     * </p>
     *
     * @param other 合成する演算子です
     * @param front true の場合は other のラベルを前に置きます
     * @return 合成した演算子です
     * @throws MismatchedRegisterLengthException レジスタ長が異なる場合に発生します
     */
    @Override
    public FermionicOp compose(FermionicOp other, boolean front) {
        Preconditions.checkNotNull(other, "other は null 不可です");
        terms.requireSameRegisterLength(other.terms);

        FermionicOp first = front ? other : this;
        FermionicOp second = front ? this : other;

        SparseTerms.Builder b = SparseTerms.builder(registerLength());
        first.terms.asMap().forEach((l1, c1) -> second.terms.asMap()
                .forEach((l2, c2) -> b.add(concat(l1, l2), c1.multiply(c2))));
        return new FermionicOp(b.build());
    }

    @Override
    public FermionicOp tensor(FermionicOp other) {
        Preconditions.checkNotNull(other, "other は null 不可です");
        int offset = registerLength();

        SparseTerms.Builder b = SparseTerms.builder(offset + other.registerLength());
        terms.asMap().forEach((l1, c1) -> other.terms.asMap().forEach(
                (l2, c2) -> b.add(concat(l1, shift(l2, offset)), c1.multiply(c2))));
        return new FermionicOp(b.build());
    }

    @Override
    public FermionicOp expand(FermionicOp other) {
        Preconditions.checkNotNull(other, "other は null 不可です");
        return other.tensor(this);
    }

    /**
     * エルミート共役を返します（トークンを逆順にし、生成と消滅を入れ替え、係数を複素共役にします）。
     *
     * @return エルミート共役です
     */
    @Override
    public FermionicOp adjoint() {
        SparseTerms.Builder b = SparseTerms.builder(registerLength());
        terms.asMap().forEach((label, c) -> {
            List<Token> tokens = parse(label, registerLength());
            Collections.reverse(tokens);
            List<Token> swapped = new ArrayList<>(tokens.size());
            for (Token t : tokens) {
                swapped.add(new Token(!t.isCreation(), t.getIndex()));
            }
            b.add(format(swapped), c.conjugate());
        });
        return new FermionicOp(b.build());
    }

    /**
     * 転置を返します（トークンを逆順にするのみで、記号と係数はそのままです）。
     *
     * @return 転置です
     */
    @Override
    public FermionicOp transpose() {
        SparseTerms.Builder b = SparseTerms.builder(registerLength());
        terms.asMap().forEach((label, c) -> {
            List<Token> tokens = parse(label, registerLength());
            Collections.reverse(tokens);
            b.add(format(tokens), c);
        });
        return new FermionicOp(b.build());
    }

    /**
     * 項の並びを保ったまま簡約します。
     *
     * <ul>
     * <li>同じモードに同じ演算が（他モードの演算を挟んでも）連続する項は 0 になります</li>
     * <li>同じモードの交互の並びは縮約します（{@code + - +} → {@code +}, {@code + - + -} → {@code + -}）</li>
     * <li>縮約後に同じラベルになった項は係数を加算します</li>
     * <li>絶対値が atol 以下の項は取り除きます</li>
     * </ul>
     *
     * @param atol 絶対許容誤差です
     * @return 簡約した演算子です
     */
    @Override
    public FermionicOp simplify(double atol) {
        SparseTerms.Builder b = SparseTerms.builder(registerLength());
        terms.asMap().forEach((label, c) -> {
            List<Token> tokens = parse(label, registerLength());
            int sign = reduceInPlace(tokens);
            if (sign != 0) {
                b.add(format(tokens), sign > 0 ? c : c.negate());
            }
        });
        return new FermionicOp(b.build().prune(atol));
    }

    /**
     * 正規順序に並べ替えた演算子を返します。
     *
     * <p>
     * 生成演算子を左（モード番号の降順）、消滅演算子を右（モード番号の降順）に並べます。 隣接する演算子の入れ替えごとに符号を反転し、同じモードの
     * {@code - +} の入れ替えでは {@code a_i a_i^+ = 1 - a_i^+ a_i} による縮約項を加えます。
     * </p>
     *
     * @return 正規順序の演算子です
     */
    public FermionicOp normalOrder() {
        SparseTerms.Builder b = SparseTerms.builder(registerLength());
        terms.asMap().forEach(
                (label, c) -> normalOrderTerm(parse(label, registerLength()), c, b));
        return new FermionicOp(b.build()).simplify();
    }

    /**
     * 既定の許容誤差でエルミートかどうかを判定します。
     *
     * @return エルミートの場合は true です
     */
    public boolean isHermitian() {
        return isHermitian(DEFAULT_ATOL);
    }

    /**
     * エルミートかどうかを判定します（{@code op - op^+} を正規順序にして 0 と等価か）。
     *
     * @param atol 絶対許容誤差です
     * @return エルミートの場合は true です
     */
    public boolean isHermitian(double atol) {
        FermionicOp diff = subtract(adjoint()).normalOrder();
        return diff.equiv(zero(registerLength()), atol);
    }

    /**
     * 交換子 {@code [this, other]} を正規順序にして 0 と等価かを判定します。
     *
     * @param other 相手の演算子です
     * @param atol 絶対許容誤差です
     * @return 交換する場合は true です
     * @throws MismatchedRegisterLengthException レジスタ長が異なる場合に発生します
     */
    public boolean commutesWith(FermionicOp other, double atol) {
        FermionicOp commutator = compose(other).subtract(other.compose(this)).normalOrder();
        return commutator.equiv(zero(registerLength()), atol);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FermionicOp)) {
            return false;
        }
        return terms.equals(((FermionicOp) o).terms);
    }

    @Override
    public int hashCode() {
        return terms.hashCode();
    }

    @Override
    public String toString() {
        return "FermionicOp(" + terms + ")";
    }

    /**
     * ラベルをトークン列に分解し、書式とモード番号を検証します。
     *
     * @param label ラベルです
     * @param registerLength レジスタ長です
     * @return トークン列です（変更可能なリスト）
     * @throws InvalidLabelException 書式が不正、またはモード番号が範囲外の場合に発生します
     */
    static List<Token> parse(String label, int registerLength) {
        List<Token> tokens = new ArrayList<>();
        if (label.isEmpty()) {
            return tokens;
        }
        for (String part : label.split(" ", -1)) {
            Matcher m = TOKEN.matcher(part);
            if (!m.matches()) {
                throw new InvalidLabelException("ラベルの書式が不正です: '" + label + "'");
            }
            int index;
            try {
                index = Integer.parseInt(m.group(2));
            } catch (NumberFormatException e) {
                throw new InvalidLabelException("モード番号が大きすぎます: '" + label + "'");
            }
            if (index >= registerLength) {
                throw new InvalidLabelException("モード番号がレジスタ長 " + registerLength
                        + " の範囲外です: '" + label + "'");
            }
            tokens.add(new Token("+".equals(m.group(1)), index));
        }
        return tokens;
    }

    /**
     * トークン列をラベル文字列にします。
     *
     * @param tokens トークン列です
     * @return ラベルです
     */
    static String format(List<Token> tokens) {
        StringBuilder sb = new StringBuilder(tokens.size() * 4);
        for (Token t : tokens) {
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(t.isCreation() ? '+' : '-').append('_').append(t.getIndex());
        }
        return sb.toString();
    }

    private static String concat(String a, String b) {
        if (a.isEmpty()) {
            return b;
        }
        if (b.isEmpty()) {
            return a;
        }
        return a + " " + b;
    }

    private static String shift(String label, int offset) {
        List<Token> tokens = parse(label, Integer.MAX_VALUE);
        List<Token> shifted = new ArrayList<>(tokens.size());
        for (Token t : tokens) {
            shifted.add(new Token(t.isCreation(), t.getIndex() + offset));
        }
        return format(shifted);
    }

    /**
     * 同じモードに作用する演算子を、並びを保ったまま縮約します。
     *
     * <p>
     * モード i の演算子の位置を p0 &lt; p1 &lt; ... とすると、pk を p0 の隣へ移すときに 間にある他モードの演算子の数
     * {@code pk - p0 - k} だけ符号が反転します。取り除く演算子についてこれを合計します。
     * </p>
     *
     * @param tokens トークン列です（縮約結果で上書きします）
     * @return 符号（+1 / -1）、項が 0 になる場合は 0 です
     */
    private static int reduceInPlace(List<Token> tokens) {
        Set<Integer> indices = new LinkedHashSet<>();
        for (Token t : tokens) {
            indices.add(t.getIndex());
        }

        int sign = 1;
        for (int index : indices) {
            List<Integer> positions = new ArrayList<>();
            for (int p = 0; p < tokens.size(); p++) {
                if (tokens.get(p).getIndex() == index) {
                    positions.add(p);
                }
            }
            for (int k = 1; k < positions.size(); k++) {
                if (tokens.get(positions.get(k)).isCreation() == tokens
                        .get(positions.get(k - 1)).isCreation()) {
                    // パウリの排他律
                    return 0;
                }
            }
            int keep = (positions.size() % 2 == 1) ? 1 : 2;
            int p0 = positions.get(0);
            int moves = 0;
            for (int k = keep; k < positions.size(); k++) {
                moves += positions.get(k) - p0 - k;
            }
            if (moves % 2 != 0) {
                sign = -sign;
            }
            for (int k = positions.size() - 1; k >= keep; k--) {
                tokens.remove((int) positions.get(k));
            }
        }
        return sign;
    }

    /**
     * 1 つの項を正規順序に展開し、ビルダへ加えます。
     *
     * @param tokens トークン列です
     * @param coefficient 係数です
     * @param out 出力先です
     */
    private static void normalOrderTerm(List<Token> tokens, Complex coefficient,
            SparseTerms.Builder out) {
        Deque<PendingTerm> work = new ArrayDeque<>();
        work.push(new PendingTerm(tokens, coefficient));

        while (!work.isEmpty()) {
            PendingTerm term = work.pop();
            List<Token> ts = new ArrayList<>(term.getTokens());
            Complex c = term.getCoefficient();
            boolean vanished = false;

            boolean swapped = true;
            while (swapped && !vanished) {
                swapped = false;
                for (int i = 0; i + 1 < ts.size(); i++) {
                    Token left = ts.get(i);
                    Token right = ts.get(i + 1);
                    int cmp = compareNormalOrder(left, right);
                    if (cmp == 0) {
                        vanished = true;
                        break;
                    }
                    if (cmp > 0) {
                        if (left.getIndex() == right.getIndex()) {
                            // a_i a_i^+ = 1 - a_i^+ a_i の縮約項
                            List<Token> contracted = new ArrayList<>(ts.subList(0, i));
                            contracted.addAll(ts.subList(i + 2, ts.size()));
                            work.push(new PendingTerm(contracted, c));
                        }
                        ts.set(i, right);
                        ts.set(i + 1, left);
                        c = c.negate();
                        swapped = true;
                    }
                }
            }
            if (!vanished) {
                out.add(format(ts), c);
            }
        }
    }

    /**
     * 正規順序での前後関係を比較します。
     *
     * @param a 左のトークンです
     * @param b 右のトークンです
     * @return a を先に置く場合は負、後に置く場合は正、同一の場合は 0 です
     */
    private static int compareNormalOrder(Token a, Token b) {
        if (a.isCreation() != b.isCreation()) {
            return a.isCreation() ? -1 : 1;
        }
        return Integer.compare(b.getIndex(), a.getIndex());
    }

    /**
     * ラベルを構成する 1 つの演算（生成または消滅とモード番号）です。
     */
    @Value
    static class Token {

        /**
         * 生成演算子の場合は true、消滅演算子の場合は false です。
         */
        boolean creation;

        /**
         * モード番号です。
         */
        int index;
    }

    /**
     * 正規順序化の途中の項です。
     */
    @Value
    private static class PendingTerm {

        List<Token> tokens;

        Complex coefficient;
    }
}
