package io.github.yok.secondq.core.operator;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.Getter;
import lombok.Value;
import org.apache.commons.math3.complex.Complex;

/**
 * 振動モードのモーダル（1 つの振動モードに属する基底関数）に作用する、生成・消滅演算子の積を項とする疎な演算子です。
 *
 * <p>
 * ラベルは {@code "+_m_k"}（モード m のモーダル k の生成）と {@code "-_m_k"}（消滅）を半角空白で連結したものです。
 * 空文字列は恒等演算子を表します。例: {@code "+_0_1 -_0_0"}
 * </p>
 *
 * <p>
 * モードごとのモーダル数を保持し、レジスタ長はその総和です。 異なる (モード, モーダル) に作用する演算子は交換し、同じ (モード, モーダル)
 * の占有数は 0 か 1 です。
 * </p>
 */
public final class VibrationalOp implements SparseLabelOp<VibrationalOp> {

    /**
     * ラベルを構成するトークンの書式です。
     */
    private static final Pattern TOKEN = Pattern.compile("([+\\-])_(\\d+)_(\\d+)");

    /**
     * 項です。
     */
    private final SparseTerms terms;

    /**
     * モードごとのモーダル数です。
     */
    @Getter
    private final ImmutableList<Integer> numModals;

    /**
     * 係数の写像をコピーして演算子を生成します。
     *
     * @param data ラベル → 係数の写像です
     * @param numModals モードごとのモーダル数です（各 1 以上）
     * @throws InvalidLabelException ラベルが不正な場合に発生します
     */
    public VibrationalOp(Map<String, ? extends Complex> data, List<Integer> numModals) {
        this(SparseTerms.of(data, totalModals(numModals)), numModals);
    }

    /**
     * 項から演算子を生成します（コピーしません）。
     *
     * @param terms 項です（レジスタ長はモーダル数の総和と一致が必要です）
     * @param numModals モードごとのモーダル数です（各 1 以上）
     * @throws InvalidLabelException ラベルが不正な場合に発生します
     */
    public VibrationalOp(SparseTerms terms, List<Integer> numModals) {
        Preconditions.checkNotNull(terms, "terms は null 不可です");
        int total = totalModals(numModals);
        Preconditions.checkArgument(terms.registerLength() == total,
                "レジスタ長 %s がモーダル数の総和 %s と一致しません", terms.registerLength(), total);
        this.numModals = ImmutableList.copyOf(numModals);
        for (String label : terms) {
            parse(label, this.numModals);
        }
        this.terms = terms;
    }

    /**
     * 実係数の写像から演算子を生成します。
     *
     * @param data ラベル → 実係数の写像です
     * @param numModals モードごとのモーダル数です
     * @return 演算子です
     */
    public static VibrationalOp ofReal(Map<String, Double> data, List<Integer> numModals) {
        Preconditions.checkNotNull(data, "data は null 不可です");
        SparseTerms.Builder b = SparseTerms.builder(totalModals(numModals));
        data.forEach((label, c) -> b.add(label, new Complex(c)));
        return new VibrationalOp(b.build(), numModals);
    }

    /**
     * 零演算子を返します。
     *
     * @param numModals モードごとのモーダル数です
     * @return 零演算子です
     */
    public static VibrationalOp zero(List<Integer> numModals) {
        return new VibrationalOp(SparseTerms.zero(totalModals(numModals)), numModals);
    }

    /**
     * 恒等演算子を返します。
     *
     * @param numModals モードごとのモーダル数です
     * @return 恒等演算子です
     */
    public static VibrationalOp one(List<Integer> numModals) {
        return new VibrationalOp(SparseTerms.one(totalModals(numModals)), numModals);
    }

    @Override
    public SparseTerms terms() {
        return terms;
    }

    @Override
    public VibrationalOp withTerms(SparseTerms newTerms) {
        return new VibrationalOp(newTerms, numModals);
    }

    /**
     * モードごとのモーダル数が一致するかを返します。
     *
     * @param other 比較対象です
     * @return 一致する場合は true です
     */
    @Override
    public boolean hasSameLayout(VibrationalOp other) {
        return numModals.equals(other.numModals);
    }

    /**
     * 合成を返します（{@code front=false} は {@code "self other"}、{@code front=true} は
     * {@code "other self"}）。
     *
     * @param other 合成する演算子です
     * @param front true の場合は other のラベルを前に置きます
     * @return 合成した演算子です
     * @throws MismatchedRegisterLengthException モーダル数が異なる場合に発生します
     */
    @Override
    public VibrationalOp compose(VibrationalOp other, boolean front) {
        Preconditions.checkNotNull(other, "other は null 不可です");
        requireSameModals(other);

        VibrationalOp first = front ? other : this;
        VibrationalOp second = front ? this : other;

        SparseTerms.Builder b = SparseTerms.builder(registerLength());
        first.terms.asMap().forEach((l1, c1) -> second.terms.asMap()
                .forEach((l2, c2) -> b.add(concat(l1, l2), c1.multiply(c2))));
        return new VibrationalOp(b.build(), numModals);
    }

    /**
     * テンソル積を返します。other のモード番号はこの演算子のモード数だけずらします。
     *
     * @param other 右側の演算子です
     * @return テンソル積です
     */
    @Override
    public VibrationalOp tensor(VibrationalOp other) {
        Preconditions.checkNotNull(other, "other は null 不可です");
        int offset = numModals.size();
        List<Integer> modals = ImmutableList.<Integer>builder().addAll(numModals)
                .addAll(other.numModals).build();

        SparseTerms.Builder b = SparseTerms.builder(totalModals(modals));
        terms.asMap().forEach((l1, c1) -> other.terms.asMap().forEach(
                (l2, c2) -> b.add(concat(l1, shiftModes(l2, offset)), c1.multiply(c2))));
        return new VibrationalOp(b.build(), modals);
    }

    @Override
    public VibrationalOp expand(VibrationalOp other) {
        Preconditions.checkNotNull(other, "other は null 不可です");
        return other.tensor(this);
    }

    @Override
    public VibrationalOp adjoint() {
        SparseTerms.Builder b = SparseTerms.builder(registerLength());
        terms.asMap().forEach((label, c) -> {
            List<Token> tokens = parse(label, numModals);
            Collections.reverse(tokens);
            List<Token> swapped = new ArrayList<>(tokens.size());
            for (Token t : tokens) {
                swapped.add(new Token(!t.isCreation(), t.getMode(), t.getModal()));
            }
            b.add(format(swapped), c.conjugate());
        });
        return new VibrationalOp(b.build(), numModals);
    }

    @Override
    public VibrationalOp transpose() {
        SparseTerms.Builder b = SparseTerms.builder(registerLength());
        terms.asMap().forEach((label, c) -> {
            List<Token> tokens = parse(label, numModals);
            Collections.reverse(tokens);
            b.add(format(tokens), c);
        });
        return new VibrationalOp(b.build(), numModals);
    }

    /**
     * 項の並びを保ったまま簡約します。
     *
     * <p>
     * 同じ (モード, モーダル) に同じ演算が連続する項は 0 になり、交互の並びは縮約します。 異なる (モード, モーダル)
     * の演算子は交換するため、符号は変わりません。
     * </p>
     *
     * @param atol 絶対許容誤差です
     * @return 簡約した演算子です
     */
    @Override
    public VibrationalOp simplify(double atol) {
        SparseTerms.Builder b = SparseTerms.builder(registerLength());
        terms.asMap().forEach((label, c) -> {
            List<Token> tokens = parse(label, numModals);
            if (reduceInPlace(tokens)) {
                b.add(format(tokens), c);
            }
        });
        return new VibrationalOp(b.build().prune(atol), numModals);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof VibrationalOp)) {
            return false;
        }
        VibrationalOp other = (VibrationalOp) o;
        return numModals.equals(other.numModals) && terms.equals(other.terms);
    }

    @Override
    public int hashCode() {
        return 31 * terms.hashCode() + numModals.hashCode();
    }

    @Override
    public String toString() {
        return "VibrationalOp(" + terms + ", numModals=" + numModals + ")";
    }

    /**
     * ラベルをトークン列に分解し、書式とモード・モーダル番号を検証します。
     *
     * @param label ラベルです
     * @param numModals モードごとのモーダル数です
     * @return トークン列です（変更可能なリスト）
     * @throws InvalidLabelException 書式が不正、または番号が範囲外の場合に発生します
     */
    static List<Token> parse(String label, List<Integer> numModals) {
        List<Token> tokens = new ArrayList<>();
        if (label.isEmpty()) {
            return tokens;
        }
        for (String part : label.split(" ", -1)) {
            Matcher m = TOKEN.matcher(part);
            if (!m.matches()) {
                throw new InvalidLabelException("ラベルの書式が不正です: '" + label + "'");
            }
            int mode;
            int modal;
            try {
                mode = Integer.parseInt(m.group(2));
                modal = Integer.parseInt(m.group(3));
            } catch (NumberFormatException e) {
                throw new InvalidLabelException("モード番号またはモーダル番号が大きすぎます: '" + label + "'");
            }
            if (mode >= numModals.size()) {
                throw new InvalidLabelException(
                        "モード番号がモード数 " + numModals.size() + " の範囲外です: '" + label + "'");
            }
            if (modal >= numModals.get(mode)) {
                throw new InvalidLabelException("モード " + mode + " のモーダル番号がモーダル数 "
                        + numModals.get(mode) + " の範囲外です: '" + label + "'");
            }
            tokens.add(new Token("+".equals(m.group(1)), mode, modal));
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
        StringBuilder sb = new StringBuilder(tokens.size() * 6);
        for (Token t : tokens) {
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(t.isCreation() ? '+' : '-').append('_').append(t.getMode()).append('_')
                    .append(t.getModal());
        }
        return sb.toString();
    }

    private void requireSameModals(VibrationalOp other) {
        if (other != null && !numModals.equals(other.numModals)) {
            throw new MismatchedRegisterLengthException(
                    "モードごとのモーダル数が一致しません: " + numModals + " != " + other.numModals,
                    registerLength(), other.registerLength());
        }
    }

    private static int totalModals(List<Integer> numModals) {
        Preconditions.checkNotNull(numModals, "numModals は null 不可です");
        int total = 0;
        for (Integer n : numModals) {
            Preconditions.checkArgument(n != null && n >= 1, "モーダル数は 1 以上が必要です: %s",
                    numModals);
            total += n;
        }
        return total;
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

    private static String shiftModes(String label, int offset) {
        List<Token> shifted = new ArrayList<>();
        if (label.isEmpty()) {
            return label;
        }
        for (String part : label.split(" ")) {
            Matcher m = TOKEN.matcher(part);
            Preconditions.checkState(m.matches(), "検証済みのラベルが不正です: %s", label);
            shifted.add(new Token("+".equals(m.group(1)), Integer.parseInt(m.group(2)) + offset,
                    Integer.parseInt(m.group(3))));
        }
        return format(shifted);
    }

    /**
     * 同じ (モード, モーダル) に作用する演算子を、並びを保ったまま縮約します。
     *
     * @param tokens トークン列です（縮約結果で上書きします）
     * @return 項が 0 になる場合は false です
     */
    private static boolean reduceInPlace(List<Token> tokens) {
        Set<Site> sites = new LinkedHashSet<>();
        for (Token t : tokens) {
            sites.add(t.site());
        }
        for (Site site : sites) {
            List<Integer> positions = new ArrayList<>();
            for (int p = 0; p < tokens.size(); p++) {
                if (tokens.get(p).site().equals(site)) {
                    positions.add(p);
                }
            }
            for (int k = 1; k < positions.size(); k++) {
                if (tokens.get(positions.get(k)).isCreation() == tokens
                        .get(positions.get(k - 1)).isCreation()) {
                    return false;
                }
            }
            int keep = (positions.size() % 2 == 1) ? 1 : 2;
            for (int k = positions.size() - 1; k >= keep; k--) {
                tokens.remove((int) positions.get(k));
            }
        }
        return true;
    }

    /**
     * ラベルを構成する 1 つの演算です。
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
        int mode;

        /**
         * モーダル番号です。
         */
        int modal;

        Site site() {
            return new Site(mode, modal);
        }
    }

    /**
     * 演算子が作用する (モード, モーダル) の組です。
     */
    @Value
    private static class Site {

        int mode;

        int modal;
    }
}
