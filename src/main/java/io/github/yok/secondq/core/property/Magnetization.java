package io.github.yok.secondq.core.property;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import io.github.yok.secondq.core.operator.FermionicOp;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Getter;

/**
 * 磁化 S_z を表す物理量です。
 *
 * <p>
 * α ブロックの数演算子に 0.5、β ブロックの数演算子に -0.5 を掛けた和です。
 * </p>
 */
@Getter
public final class Magnetization implements SecondQuantizedProperty {

    /**
     * スピン軌道数です。
     */
    private final int numSpinOrbitals;

    /**
     * 磁化を生成します。
     *
     * @param numSpinOrbitals スピン軌道数です（正の偶数）
     */
    public Magnetization(int numSpinOrbitals) {
        Preconditions.checkArgument(numSpinOrbitals > 0 && numSpinOrbitals % 2 == 0,
                "numSpinOrbitals は正の偶数が必要です: %s", numSpinOrbitals);
        this.numSpinOrbitals = numSpinOrbitals;
    }

    @Override
    public String name() {
        return "Magnetization";
    }

    @Override
    public Map<String, FermionicOp> secondQOps() {
        Map<String, Double> data = new LinkedHashMap<>();
        for (int o = 0; o < numSpinOrbitals; o++) {
            data.put("+_" + o + " -_" + o, o < numSpinOrbitals / 2 ? 0.5 : -0.5);
        }
        return ImmutableMap.of(name(), FermionicOp.ofReal(data, numSpinOrbitals));
    }

    @Override
    public String toString() {
        return name() + ":\n\t" + numSpinOrbitals + " SOs";
    }
}
