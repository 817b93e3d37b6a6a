package io.github.yok.secondq.core.excitation;

import lombok.Value;

/**
 * スピンごとの粒子数（α, β）を保持するクラスです。
 */
@Value
public class ParticleCounts {

    /**
     * α スピンの粒子数です。
     */
    int alpha;

    /**
     * β スピンの粒子数です。
     */
    int beta;

    /**
     * 総粒子数（α + β）を返します。
     *
     * @return 総粒子数です
     */
    public int total() {
        return alpha + beta;
    }
}
