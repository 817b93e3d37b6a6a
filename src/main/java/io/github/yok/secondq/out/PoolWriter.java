package io.github.yok.secondq.out;

import io.github.yok.secondq.core.excitation.Excitation;
import io.github.yok.secondq.core.excitation.ParticleCounts;
import io.github.yok.secondq.core.operator.FermionicOp;
import java.util.List;

/**
 * 生成した演算子プールを出力する処理のインタフェースです。
 *
 * <p>
 * 励起と生成子は同じ順序で渡されます（i 番目の生成子が i 番目の励起に対応します）。
 * </p>
 */
public interface PoolWriter {

    /**
     * 演算子プールを出力します。
     *
     * @param numSpinOrbitals スピン軌道数です
     * @param particles スピンごとの粒子数です
     * @param excitationLabel 励起の略記（例: sd）です
     * @param excitations 励起の一覧です
     * @param generators 生成子の一覧です
     */
    void write(int numSpinOrbitals, ParticleCounts particles, String excitationLabel,
            List<Excitation> excitations, List<FermionicOp> generators);
}
