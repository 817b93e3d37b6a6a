package io.github.yok.secondq.core.property;

import io.github.yok.secondq.core.operator.FermionicOp;
import java.util.Map;

/**
 * 第二量子化演算子として表せる物理量を表すインタフェースです。
 *
 * <p>
 * 永続化（HDF5 など）や固有値結果の解釈は、このインタフェースの外側で扱います。
 * </p>
 */
public interface SecondQuantizedProperty {

    /**
     * 物理量の名前を返します。
     *
     * @return 名前です
     */
    String name();

    /**
     * 名前 → 演算子の写像を返します。
     *
     * @return 演算子の写像です
     */
    Map<String, FermionicOp> secondQOps();
}
