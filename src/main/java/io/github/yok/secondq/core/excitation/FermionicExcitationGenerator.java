package io.github.yok.secondq.core.excitation;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * スピン軌道の占有状況から、フェルミオンの励起の一覧を生成するクラスです。
 *
 * <p>
 * モード {@code [0, n/2)} を α ブロック、{@code [n/2, n)} を β ブロックとし、 各ブロックの先頭から粒子数ぶんを占有軌道とみなします。
 * </p>
 *
 * <p>
 * 出力順は、励起次数の昇順、同じ次数の中では（移動元の組, 移動先の組）の辞書式昇順です。
 * </p>
 */
@Slf4j
public final class FermionicExcitationGenerator implements ExcitationGenerator {

    /**
     * 励起の一覧を生成します。
     *
     * @param numSpinOrbitals スピン軌道数です（正の偶数）
     * @param particles スピンごとの粒子数です
     * @param settings 生成条件です
     * @return 励起の一覧です（該当なしの場合は空）
     * @throws IllegalArgumentException スピン軌道数が正の偶数でない場合に発生します
     * @throws InvalidParticleCountException 粒子数が不正な場合に発生します
     */
    @Override
    public List<Excitation> generate(int numSpinOrbitals, ParticleCounts particles,
            ExcitationSettings settings) {
        Preconditions.checkArgument(numSpinOrbitals > 0 && numSpinOrbitals % 2 == 0,
                "numSpinOrbitals は正の偶数が必要です: %s", numSpinOrbitals);
        Preconditions.checkNotNull(particles, "particles は null 不可です");
        Preconditions.checkNotNull(settings, "settings は null 不可です");
        Preconditions.checkNotNull(settings.getOrders(), "settings.orders は null 不可です");

        int half = numSpinOrbitals / 2;
        validateParticles(particles, half);

        List<Integer> sourcePool = new ArrayList<>();
        List<Integer> targetPool = new ArrayList<>();
        for (int mode = 0; mode < numSpinOrbitals; mode++) {
            boolean occupied = (mode < half) ? mode < particles.getAlpha()
                    : mode - half < particles.getBeta();
            if (settings.isGeneralized() || occupied) {
                sourcePool.add(mode);
            }
            if (settings.isGeneralized() || !occupied) {
                targetPool.add(mode);
            }
        }

        ImmutableList.Builder<Excitation> result = ImmutableList.builder();
        int total = 0;
        for (int order : settings.getOrders()) {
            int count = 0;
            for (List<Integer> sources : combinations(sourcePool, order)) {
                for (List<Integer> targets : combinations(targetPool, order)) {
                    if (accept(sources, targets, half, settings)) {
                        result.add(new Excitation(sources, targets));
                        count++;
                    }
                }
            }
            log.debug("励起次数 {} の励起を {} 個生成しました", order, count);
            total += count;
        }

        log.info("励起を生成しました。スピン軌道数={}、粒子数=({}, {})、次数={}、一般化={}、スピン保存={}、励起数={}",
                numSpinOrbitals, particles.getAlpha(), particles.getBeta(), settings.getOrders(),
                settings.isGeneralized(), settings.isPreserveSpin(), total);
        return result.build();
    }

    /**
     * 粒子数を検証します。
     *
     * @param particles 粒子数です
     * @param half スピンブロックの大きさです
     * @throws InvalidParticleCountException 負、またはブロックの大きさを超える場合に発生します
     */
    private static void validateParticles(ParticleCounts particles, int half) {
        if (particles.getAlpha() < 0 || particles.getBeta() < 0) {
            throw new InvalidParticleCountException("粒子数は 0 以上が必要です: (" + particles.getAlpha()
                    + ", " + particles.getBeta() + ")");
        }
        if (particles.getAlpha() > half || particles.getBeta() > half) {
            throw new InvalidParticleCountException("粒子数がスピンブロックの大きさ " + half + " を超えています: ("
                    + particles.getAlpha() + ", " + particles.getBeta() + ")");
        }
    }

    /**
     * 移動元と移動先の組が条件を満たすかを判定します。
     *
     * @param sources 移動元です（昇順）
     * @param targets 移動先です（昇順）
     * @param half スピンブロックの大きさです
     * @param settings 生成条件です
     * @return 条件を満たす場合は true です
     */
    private static boolean accept(List<Integer> sources, List<Integer> targets, int half,
            ExcitationSettings settings) {
        for (int s : sources) {
            if (targets.contains(s)) {
                return false;
            }
        }
        int order = sources.size();
        int alphaSources = countAlpha(sources, half);
        int alphaTargets = countAlpha(targets, half);

        // 一般化励起では、各スピンブロック内で移動元が移動先より辞書式で前にあるものだけを採用します
        if (settings.isGeneralized() && !ascendingWithinBlocks(sources, targets, half,
                alphaSources == alphaTargets)) {
            return false;
        }

        if (settings.isPreserveSpin() && alphaSources != alphaTargets) {
            return false;
        }
        if (!settings.isAlphaSpin() && (alphaSources > 0 || alphaTargets > 0)) {
            return false;
        }
        if (!settings.isBetaSpin() && (alphaSources < order || alphaTargets < order)) {
            return false;
        }
        Integer max = settings.getMaxSpinExcitation();
        return max == null || (alphaSources <= max && order - alphaSources <= max);
    }

    /**
     * 一般化励起の向きを判定します。
     *
     * <p>
     * 各スピンブロックの移動元・移動先の個数が一致する場合は、粒子を含むブロックごとに移動元が移動先より辞書式で前にあることを要求します。
     * 一致しない場合（スピン反転を含む励起）は、組全体で比較します。
     * </p>
     *
     * @param sources 移動元です（昇順）
     * @param targets 移動先です（昇順）
     * @param half スピンブロックの大きさです
     * @param blocksMatch 各ブロックの個数が一致する場合は true です
     * @return 採用する向きの場合は true です
     */
    private static boolean ascendingWithinBlocks(List<Integer> sources, List<Integer> targets,
            int half, boolean blocksMatch) {
        if (!blocksMatch) {
            return compareLexicographically(sources, targets) < 0;
        }
        int alpha = countAlpha(sources, half);
        List<Integer> alphaSources = sources.subList(0, alpha);
        List<Integer> alphaTargets = targets.subList(0, alpha);
        List<Integer> betaSources = sources.subList(alpha, sources.size());
        List<Integer> betaTargets = targets.subList(alpha, targets.size());
        return (alphaSources.isEmpty() || compareLexicographically(alphaSources, alphaTargets) < 0)
                && (betaSources.isEmpty()
                        || compareLexicographically(betaSources, betaTargets) < 0);
    }

    private static int countAlpha(List<Integer> modes, int half) {
        int n = 0;
        for (int m : modes) {
            if (m < half) {
                n++;
            }
        }
        return n;
    }

    private static int compareLexicographically(List<Integer> a, List<Integer> b) {
        for (int i = 0; i < Math.min(a.size(), b.size()); i++) {
            int c = Integer.compare(a.get(i), b.get(i));
            if (c != 0) {
                return c;
            }
        }
        return Integer.compare(a.size(), b.size());
    }

    /**
     * 昇順に並んだ要素から k 個を選ぶ組合せを、辞書式昇順で返します。
     *
     * @param pool 要素です（昇順）
     * @param k 選ぶ個数です
     * @return 組合せの一覧です（各組合せは昇順）
     */
    static List<List<Integer>> combinations(List<Integer> pool, int k) {
        List<List<Integer>> out = new ArrayList<>();
        int n = pool.size();
        if (k <= 0 || k > n) {
            return out;
        }
        int[] idx = new int[k];
        for (int i = 0; i < k; i++) {
            idx[i] = i;
        }
        while (true) {
            List<Integer> combo = new ArrayList<>(k);
            for (int i : idx) {
                combo.add(pool.get(i));
            }
            out.add(combo);

            // 右端から、まだ進められる位置を探します
            int i = k - 1;
            while (i >= 0 && idx[i] == n - k + i) {
                i--;
            }
            if (i < 0) {
                return out;
            }
            idx[i]++;
            for (int j = i + 1; j < k; j++) {
                idx[j] = idx[j - 1] + 1;
            }
        }
    }
}
