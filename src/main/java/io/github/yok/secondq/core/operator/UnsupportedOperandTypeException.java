package io.github.yok.secondq.core.operator;

/**
 * 数値でないスカラー、または演算子でないオペランドが渡された場合に発生する例外です。
 */
public class UnsupportedOperandTypeException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    /**
     * 例外を生成します。
     *
     * @param operation 演算名です
     * @param operand 受け取ったオペランドです（null 可）
     */
    public UnsupportedOperandTypeException(String operation, Object operand) {
        super(operation + " に対応しないオペランドです: "
                + (operand == null ? "null" : operand.getClass().getName()));
    }
}
