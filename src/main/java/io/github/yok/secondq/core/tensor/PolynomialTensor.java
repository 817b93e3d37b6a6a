package io.github.yok.secondq.core.tensor;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableMap;
import io.github.yok.secondq.core.operator.SparseTerms;
import java.util.Map;
import java.util.Set;
import lombok.Getter;

/**
 * 演算子キーごとの数値テンソル（1 体・2 体・k 体積分など）をまとめたクラスです。
 *
 * <p>
 * キーは演算子の記号列で、{@code "+-"} が 1 体、{@code "++--"} が 2 体、{@code ""} が定数項を表します。
 * キーの長さはテンソルの階数と一致し、各添字の大きさはレジスタ長と一致する必要があります。
 * </p>
 *
 * <p>
 * 数値データを演算子のラベルへ変換する唯一の入口です。物理的な処理はせず、ラベルの構成のみを行います。
 * </p>
 */
public final class PolynomialTensor {

    /**
     * キー → テンソルの写像です（挿入順）。
     */
    private final ImmutableMap<String, DenseTensor> tensors;

    /**
     * レジスタ長（モード数）です。
     */
    @Getter
    private final int registerLength;

    /**
     * 多項式テンソルを生成します。
     *
     * @param tensors キー → テンソルの写像です
     * @param registerLength レジスタ長です（1 以上）
     * @throws IllegalArgumentException キー・階数・次元が不整合な場合に発生します
     */
    public PolynomialTensor(Map<String, DenseTensor> tensors, int registerLength) {
        Preconditions.checkNotNull(tensors, "tensors は null 不可です");
        Preconditions.checkArgument(registerLength >= 1, "registerLength は 1 以上が必要です: %s",
                registerLength);
        for (Map.Entry<String, DenseTensor> e : tensors.entrySet()) {
            String key = e.getKey();
            DenseTensor t = e.getValue();
            Preconditions.checkArgument(key.matches("[+\\-]*"), "キーは + と - のみで構成してください: '%s'",
                    key);
            Preconditions.checkNotNull(t, "テンソルが null です: '%s'", key);
            Preconditions.checkArgument(t.getRank() == key.length(),
                    "キー '%s' の長さとテンソルの階数 %s が一致しません", key, t.getRank());
            Preconditions.checkArgument(t.getRank() == 0 || t.getDimension() == registerLength,
                    "キー '%s' のテンソルの次元 %s がレジスタ長 %s と一致しません", key, t.getDimension(),
                    registerLength);
        }
        this.tensors = ImmutableMap.copyOf(tensors);
        this.registerLength = registerLength;
    }

    /**
     * 体数（1, 2, ...）ごとのテンソルから多項式テンソルを生成します。
     *
     * <p>
     * 体数 k はキー {@code "+"×k + "-"×k} に対応させます（階数 2k のテンソルが必要です）。
     * </p>
     *
     * @param byBodyOrder 体数 → テンソルの写像です
     * @param registerLength レジスタ長です
     * @return 多項式テンソルです
     */
    public static PolynomialTensor ofBodyOrders(Map<Integer, DenseTensor> byBodyOrder,
            int registerLength) {
        Preconditions.checkNotNull(byBodyOrder, "byBodyOrder は null 不可です");
        ImmutableMap.Builder<String, DenseTensor> b = ImmutableMap.builder();
        byBodyOrder.entrySet().stream().sorted(Map.Entry.comparingByKey()).forEach(e -> {
            int order = e.getKey();
            Preconditions.checkArgument(order >= 0, "体数は 0 以上が必要です: %s", order);
            b.put(keyOfBodyOrder(order), e.getValue());
        });
        return new PolynomialTensor(b.build(), registerLength);
    }

    /**
     * 体数に対応するキーを返します。
     *
     * @param order 体数です
     * @return キー（例: 2 → {@code "++--"}）です
     */
    public static String keyOfBodyOrder(int order) {
        return Strings.repeat("+", order) + Strings.repeat("-", order);
    }

    /**
     * キーの集合を返します（挿入順）。
     *
     * @return キーの集合です
     */
    public Set<String> keys() {
        return tensors.keySet();
    }

    /**
     * キーに対応するテンソルを返します。
     *
     * @param key キーです
     * @return テンソルです
     * @throws IllegalArgumentException キーが存在しない場合に発生します
     */
    public DenseTensor get(String key) {
        DenseTensor t = tensors.get(key);
        Preconditions.checkArgument(t != null, "キーが存在しません: '%s'", key);
        return t;
    }

    /**
     * キーに対応するテンソルの要素を、ラベル → 係数の項に変換します。
     *
     * <p>
     * 添字 (i, j, ...) の要素は、キーの各記号と添字を組にしたラベル（例: キー {@code "+-"} の (0, 2) は {@code "+_0 -_2"}）
     * になります。
     * </p>
     *
     * @param key キーです
     * @param dense true の場合は 0 の要素も項にします
     * @return 項です
     */
    public SparseTerms termsOf(String key, boolean dense) {
        DenseTensor t = get(key);
        SparseTerms.Builder b = SparseTerms.builder(registerLength);
        t.forEachEntry(dense, (indices, value) -> b.add(labelOf(key, indices), value));
        return b.build();
    }

    private static String labelOf(String key, int[] indices) {
        StringBuilder sb = new StringBuilder(key.length() * 4);
        for (int i = 0; i < indices.length; i++) {
            if (i > 0) {
                sb.append(' ');
            }
            sb.append(key.charAt(i)).append('_').append(indices[i]);
        }
        return sb.toString();
    }
}
