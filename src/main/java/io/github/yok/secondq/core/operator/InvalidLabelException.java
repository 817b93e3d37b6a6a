package io.github.yok.secondq.core.operator;

/**
 * ラベルの書式が不正、またはモード番号がレジスタ長の範囲外である場合に発生する例外です。
 */
public class InvalidLabelException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    /**
     * 例外を生成します。
     *
     * @param message メッセージです
     */
    public InvalidLabelException(String message) {
        super(message);
    }
}
