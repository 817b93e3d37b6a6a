package io.github.yok.secondq.app;

import io.github.yok.secondq.core.excitation.ExcitationGenerator;
import io.github.yok.secondq.core.excitation.ExcitationPoolGenerator;
import io.github.yok.secondq.core.excitation.ExcitationSettings;
import io.github.yok.secondq.core.excitation.FermionicExcitationGenerator;
import io.github.yok.secondq.core.excitation.ParticleCounts;
import io.github.yok.secondq.out.CsvPoolWriter;
import io.github.yok.secondq.out.PoolWriter;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * フェルミオン励起プール生成の Bean 定義を行う設定クラスです。
 *
 * <p>
 * 設定値（secondq.*）から生成条件と粒子数を組み立て、励起生成・生成子構築・CSV 出力の一式を用意します。
 * </p>
 */
@Configuration
@RequiredArgsConstructor
public class ExcitationPoolConfiguration {

    /**
     * secondq-algebra の設定値（secondq.*）です。
     */
    private final SecondQProperties p;

    /**
     * スピンごとの粒子数を生成します。
     *
     * @return 粒子数です
     */
    @Bean
    public ParticleCounts particleCounts() {
        SecondQProperties.SystemSettings.NumParticles n = p.getSystem().getNumParticles();
        return new ParticleCounts(n.getAlpha(), n.getBeta());
    }

    /**
     * 励起プールの生成条件を生成します。
     *
     * @return 生成条件です
     */
    @Bean
    public ExcitationSettings excitationSettings() {
        SecondQProperties.Pool pool = p.getPool();
        return ExcitationSettings.parse(pool.getExcitations()).toBuilder()
                .generalized(pool.isGeneralized())
                .preserveSpin(pool.isPreserveSpin())
                .alphaSpin(pool.isAlphaSpin())
                .betaSpin(pool.isBetaSpin())
                .maxSpinExcitation(pool.getMaxSpinExcitation())
                .build();
    }

    /**
     * 励起の一覧を生成するロジックを生成します。
     *
     * @return 励起生成ロジックです
     */
    @Bean
    public ExcitationGenerator excitationGenerator() {
        return new FermionicExcitationGenerator();
    }

    /**
     * 生成子（演算子プール）を組み立てるロジックを生成します。
     *
     * @param excitationGenerator 励起生成ロジックです
     * @return 生成子の構築ロジックです
     */
    @Bean
    public ExcitationPoolGenerator excitationPoolGenerator(ExcitationGenerator excitationGenerator) {
        return new ExcitationPoolGenerator(excitationGenerator);
    }

    /**
     * 結果出力ロジックを生成します。
     *
     * @return 結果出力ロジックです
     */
    @Bean
    public PoolWriter poolWriter() {
        return new CsvPoolWriter(p.getOutput().getDir());
    }
}
