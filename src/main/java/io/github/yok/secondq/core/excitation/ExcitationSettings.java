package io.github.yok.secondq.core.excitation;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSortedSet;
import java.util.Locale;
import lombok.Builder;
import lombok.Value;

/**
 * 励起プールの生成条件を保持するクラスです。
 *
 * <ul>
 * <li>orders: 生成する励起次数の集合です（例: {1, 2} で一電子・二電子励起）</li>
 * <li>generalized: 占有/非占有の区別をせず、任意の互いに素なモード組の間の励起を許すかどうかです</li>
 * <li>preserveSpin: 移動元と移動先でスピンブロックの構成が一致することを要求するかどうかです</li>
 * <li>alphaSpin / betaSpin: α / β ブロックに触れる励起を含めるかどうかです</li>
 * <li>maxSpinExcitation: 1 つのスピンブロックから動かせる粒子数の上限です（null は無制限）</li>
 * </ul>
 */
@Value
@Builder(toBuilder = true)
public class ExcitationSettings {

    /**
     * 生成する励起次数の集合です（昇順）。
     */
    ImmutableSortedSet<Integer> orders;

    /**
     * 一般化励起を生成するかどうかです。
     */
    @Builder.Default
    boolean generalized = false;

    /**
     * スピンを保存するかどうかです。
     */
    @Builder.Default
    boolean preserveSpin = true;

    /**
     * α ブロックに触れる励起を含めるかどうかです。
     */
    @Builder.Default
    boolean alphaSpin = true;

    /**
     * β ブロックに触れる励起を含めるかどうかです。
     */
    @Builder.Default
    boolean betaSpin = true;

    /**
     * 1 つのスピンブロックから動かせる粒子数の上限です（null は無制限）。
     */
    Integer maxSpinExcitation;

    /**
     * 1 次から指定次数までの励起を生成する設定を返します。
     *
     * @param maxOrder 最大励起次数です（1 以上）
     * @return 設定です
     */
    public static ExcitationSettings upTo(int maxOrder) {
        Preconditions.checkArgument(maxOrder >= 1, "励起次数は 1 以上が必要です: %s", maxOrder);
        ImmutableSortedSet.Builder<Integer> b = ImmutableSortedSet.naturalOrder();
        for (int k = 1; k <= maxOrder; k++) {
            b.add(k);
        }
        return builder().orders(b.build()).build();
    }

    /**
     * 指定した次数の励起を生成する設定を返します。
     *
     * @param orders 励起次数です（各 1 以上）
     * @return 設定です
     */
    public static ExcitationSettings ofOrders(int... orders) {
        Preconditions.checkArgument(orders.length > 0, "励起次数を 1 つ以上指定してください");
        ImmutableSortedSet.Builder<Integer> b = ImmutableSortedSet.naturalOrder();
        for (int k : orders) {
            Preconditions.checkArgument(k >= 1, "励起次数は 1 以上が必要です: %s", k);
            b.add(k);
        }
        return builder().orders(b.build()).build();
    }

    /**
     * 励起の略記（{@code s}=1, {@code d}=2, {@code t}=3, {@code q}=4）から設定を返します。
     *
     * <p>
     * 例: {@code "sd"} → 一電子・二電子励起（UCCSD 相当）
     * </p>
     *
     * @param excitations 略記です
     * @return 設定です
     * @throws IllegalArgumentException 略記が空、または未知の文字を含む場合に発生します
     */
    public static ExcitationSettings parse(String excitations) {
        Preconditions.checkArgument(excitations != null && !excitations.isBlank(),
                "excitations は必須です（例: sd）");
        String s = excitations.trim().toLowerCase(Locale.ROOT);
        int[] orders = new int[s.length()];
        for (int i = 0; i < s.length(); i++) {
            orders[i] = orderOf(s.charAt(i));
        }
        return ofOrders(orders);
    }

    private static int orderOf(char c) {
        switch (c) {
            case 's':
                return 1;
            case 'd':
                return 2;
            case 't':
                return 3;
            case 'q':
                return 4;
            default:
                throw new IllegalArgumentException("未知の励起略記です: '" + c + "'（s/d/t/q を指定してください）");
        }
    }
}
