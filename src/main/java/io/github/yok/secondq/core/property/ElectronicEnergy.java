package io.github.yok.secondq.core.property;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import io.github.yok.secondq.core.operator.FermionicOp;
import io.github.yok.secondq.core.tensor.PolynomialTensor;
import java.util.Map;
import lombok.Getter;

/**
 * 電子積分（1 体・2 体など）から構成するハミルトニアンを表す物理量です。
 *
 * <p>
 * 積分の計算そのものは行いません。外部から与えられた {@link PolynomialTensor} をラベルへ変換するのみです。
 * </p>
 */
@Getter
public final class ElectronicEnergy implements SecondQuantizedProperty {

    /**
     * 電子積分です。
     */
    private final PolynomialTensor integrals;

    /**
     * 電子エネルギーを生成します。
     *
     * @param integrals 電子積分です（null 不可）
     */
    public ElectronicEnergy(PolynomialTensor integrals) {
        this.integrals = Preconditions.checkNotNull(integrals, "integrals は null 不可です");
    }

    @Override
    public String name() {
        return "ElectronicEnergy";
    }

    @Override
    public Map<String, FermionicOp> secondQOps() {
        return ImmutableMap.of(name(), FermionicOp.fromPolynomialTensor(integrals));
    }
}
