package io.github.yok.secondq.app;

import io.github.yok.secondq.core.excitation.Excitation;
import io.github.yok.secondq.core.excitation.ExcitationPoolGenerator;
import io.github.yok.secondq.core.excitation.ExcitationSettings;
import io.github.yok.secondq.core.excitation.ParticleCounts;
import io.github.yok.secondq.core.operator.FermionicOp;
import io.github.yok.secondq.core.property.Magnetization;
import io.github.yok.secondq.core.property.ParticleNumber;
import io.github.yok.secondq.out.PoolWriter;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.complex.Complex;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

/**
 * CLI で励起プールを生成するクラスです。
 *
 * <p>
 * 設定されたスピン軌道数・粒子数・生成条件から生成子の一覧を作り、各生成子の性質を確認してから出力します。
 * </p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PoolCliRunner implements CommandLineRunner {

    /**
     * secondq-algebra の設定値（secondq.*）です。
     */
    private final SecondQProperties properties;

    /**
     * スピンごとの粒子数です。
     */
    private final ParticleCounts particleCounts;

    /**
     * 励起プールの生成条件です。
     */
    private final ExcitationSettings excitationSettings;

    /**
     * 生成子の構築ロジックです。
     */
    private final ExcitationPoolGenerator excitationPoolGenerator;

    /**
     * 結果出力ロジックです。
     */
    private final PoolWriter poolWriter;

    /**
     * CLI 実行を開始します。
     *
     * @param args 起動引数です
     */
    @Override
    public void run(String... args) {
        System.out.println("=== secondq start: build excitation pool ===");
        System.out.print(properties.toMultilineString());

        int n = properties.getSystem().getNumSpinOrbitals();
        double atol = properties.getAlgebra().getAtol();

        List<Excitation> excitations =
                excitationPoolGenerator.excitations(n, particleCounts, excitationSettings);
        List<FermionicOp> generators =
                excitationPoolGenerator.generate(n, particleCounts, excitationSettings);

        FermionicOp number = new ParticleNumber(n).secondQOps().get("ParticleNumber");
        FermionicOp sz = new Magnetization(n).secondQOps().get("Magnetization");
        boolean preserveSpin = excitationSettings.isPreserveSpin();

        // 生成子 i(F - F^+) はエルミート、F - F^+ は反エルミートであることを確認します
        // 粒子数は常に、S_z はスピン保存時に保存されます
        for (int i = 0; i < generators.size(); i++) {
            FermionicOp g = generators.get(i);
            if (!g.isHermitian(atol)) {
                throw new IllegalStateException("生成子がエルミートではありません: index=" + i + ", " + g);
            }
            FermionicOp antiHermitian = g.scale(Complex.I.negate());
            if (!antiHermitian.adjoint().equiv(antiHermitian.negate(), atol)) {
                throw new IllegalStateException("F - F^+ が反エルミートではありません: index=" + i);
            }
            if (!g.commutesWith(number, atol)) {
                throw new IllegalStateException("生成子が粒子数を保存しません: index=" + i + ", " + g);
            }
            if (preserveSpin && !g.commutesWith(sz, atol)) {
                throw new IllegalStateException("生成子が S_z を保存しません: index=" + i + ", " + g);
            }
        }

        System.out.println("=== 生成子の一覧 ===");
        for (int i = 0; i < excitations.size(); i++) {
            System.out.println("[" + i + "] " + excitations.get(i) + " : " + generators.get(i));
        }

        if (properties.getOutput().isEnabled()) {
            poolWriter.write(n, particleCounts, properties.getPool().getExcitations(), excitations,
                    generators);
            log.info("演算子プールを出力しました。出力先={}", properties.getOutput().getDir());
        }

        System.out.println("結果: 生成子数=" + generators.size());
    }
}
