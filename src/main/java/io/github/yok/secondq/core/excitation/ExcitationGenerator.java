package io.github.yok.secondq.core.excitation;

import java.util.List;

/**
 * 励起の一覧を生成するインタフェースです。
 *
 * <p>
 * 返す一覧の個数と順序は、同じ入力に対して常に同じである必要があります（外部の回路パラメータが位置で対応付けられるためです）。
 * </p>
 */
public interface ExcitationGenerator {

    /**
     * 励起の一覧を生成します。
     *
     * @param numSpinOrbitals スピン軌道数です（正の偶数、前半が α、後半が β ブロック）
     * @param particles スピンごとの粒子数です
     * @param settings 生成条件です
     * @return 励起の一覧です（該当なしの場合は空）
     * @throws InvalidParticleCountException 粒子数がスピンブロックの大きさを超える、または負の場合に発生します
     */
    List<Excitation> generate(int numSpinOrbitals, ParticleCounts particles,
            ExcitationSettings settings);
}
