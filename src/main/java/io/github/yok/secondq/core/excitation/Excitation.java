package io.github.yok.secondq.core.excitation;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.Value;

/**
 * 1 つの励起（移動元モードの組 → 移動先モードの組）を表すクラスです。
 *
 * <p>
 * 移動元・移動先はいずれもモード番号の昇順で、同じ個数（励起次数）を持ちます。
 * </p>
 */
@Value
public class Excitation {

    /**
     * 移動元（消滅させる）モード番号の組です。
     */
    ImmutableList<Integer> sources;

    /**
     * 移動先（生成する）モード番号の組です。
     */
    ImmutableList<Integer> targets;

    /**
     * 励起を生成します。
     *
     * @param sources 移動元モード番号の組です
     * @param targets 移動先モード番号の組です
     * @throws IllegalArgumentException 個数が異なる、または空の場合に発生します
     */
    public Excitation(List<Integer> sources, List<Integer> targets) {
        Preconditions.checkArgument(!sources.isEmpty(), "励起次数は 1 以上が必要です");
        Preconditions.checkArgument(sources.size() == targets.size(),
                "移動元と移動先の個数が一致しません: %s -> %s", sources, targets);
        this.sources = ImmutableList.copyOf(sources);
        this.targets = ImmutableList.copyOf(targets);
    }

    /**
     * 励起次数（1 = 一電子励起, 2 = 二電子励起, ...）を返します。
     *
     * @return 励起次数です
     */
    public int order() {
        return sources.size();
    }

    @Override
    public String toString() {
        return sources + " -> " + targets;
    }
}
