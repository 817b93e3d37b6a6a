package io.github.yok.secondq.core.excitation;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import io.github.yok.secondq.core.operator.FermionicOp;
import java.util.Collections;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.complex.Complex;

/**
 * 励起の一覧から、変分アンザッツ用の生成子（演算子プール）を組み立てるクラスです。
 *
 * <p>
 * 励起 (S → T) ごとに前進項 {@code F = +_t1 ... +_tk -_s1 ... -_sk} を作り、 {@code i F - i F^+}（= i × 反エルミートな
 * {@code F - F^+}）を 1 つの生成子とします。
 * </p>
 */
@Slf4j
@RequiredArgsConstructor
public final class ExcitationPoolGenerator {

    /**
     * 励起の一覧を生成するロジックです。
     */
    private final ExcitationGenerator excitationGenerator;

    /**
     * 励起の一覧を返します（生成子と同じ順序です）。
     *
     * @param numSpinOrbitals スピン軌道数です
     * @param particles スピンごとの粒子数です
     * @param settings 生成条件です
     * @return 励起の一覧です
     */
    public List<Excitation> excitations(int numSpinOrbitals, ParticleCounts particles,
            ExcitationSettings settings) {
        return excitationGenerator.generate(numSpinOrbitals, particles, settings);
    }

    /**
     * 生成子の一覧を返します。
     *
     * @param numSpinOrbitals スピン軌道数です
     * @param particles スピンごとの粒子数です
     * @param settings 生成条件です
     * @return 生成子の一覧です（該当なしの場合は空）
     */
    public List<FermionicOp> generate(int numSpinOrbitals, ParticleCounts particles,
            ExcitationSettings settings) {
        List<Excitation> excitations = excitations(numSpinOrbitals, particles, settings);
        if (excitations.isEmpty()) {
            log.warn("条件を満たす励起がないため、生成子の一覧は空です。スピン軌道数={}、粒子数=({}, {})",
                    numSpinOrbitals, particles.getAlpha(), particles.getBeta());
            return Collections.emptyList();
        }
        ImmutableList.Builder<FermionicOp> ops = ImmutableList.builder();
        for (Excitation excitation : excitations) {
            ops.add(toGenerator(excitation, numSpinOrbitals));
        }
        return ops.build();
    }

    /**
     * 1 つの励起を生成子に変換します。
     *
     * @param excitation 励起です
     * @param numSpinOrbitals スピン軌道数（レジスタ長）です
     * @return 生成子 {@code i F - i F^+} です
     */
    public static FermionicOp toGenerator(Excitation excitation, int numSpinOrbitals) {
        Preconditions.checkNotNull(excitation, "excitation は null 不可です");
        FermionicOp forward = forwardTerm(excitation, numSpinOrbitals);
        return forward.scale(Complex.I).add(forward.adjoint().scale(Complex.I.negate()));
    }

    /**
     * 励起の前進項 {@code +_t1 ... +_tk -_s1 ... -_sk}（係数 1）を返します。
     *
     * @param excitation 励起です
     * @param numSpinOrbitals スピン軌道数（レジスタ長）です
     * @return 前進項です
     */
    public static FermionicOp forwardTerm(Excitation excitation, int numSpinOrbitals) {
        StringBuilder label = new StringBuilder();
        for (int t : excitation.getTargets()) {
            label.append(label.length() == 0 ? "" : " ").append("+_").append(t);
        }
        for (int s : excitation.getSources()) {
            label.append(' ').append("-_").append(s);
        }
        return new FermionicOp(Collections.singletonMap(label.toString(), Complex.ONE),
                numSpinOrbitals);
    }
}
