package io.github.yok.secondq.core.property;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import io.github.yok.secondq.core.operator.FermionicOp;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Getter;

/**
 * 総粒子数演算子 N = Σ n_o を表す物理量です。
 */
@Getter
public final class ParticleNumber implements SecondQuantizedProperty {

    /**
     * スピン軌道数です。
     */
    private final int numSpinOrbitals;

    /**
     * 総粒子数演算子を生成します。
     *
     * @param numSpinOrbitals スピン軌道数です（1 以上）
     */
    public ParticleNumber(int numSpinOrbitals) {
        Preconditions.checkArgument(numSpinOrbitals > 0, "numSpinOrbitals は 1 以上が必要です: %s",
                numSpinOrbitals);
        this.numSpinOrbitals = numSpinOrbitals;
    }

    @Override
    public String name() {
        return "ParticleNumber";
    }

    @Override
    public Map<String, FermionicOp> secondQOps() {
        Map<String, Double> data = new LinkedHashMap<>();
        for (int o = 0; o < numSpinOrbitals; o++) {
            data.put("+_" + o + " -_" + o, 1.0);
        }
        return ImmutableMap.of(name(), FermionicOp.ofReal(data, numSpinOrbitals));
    }
}
