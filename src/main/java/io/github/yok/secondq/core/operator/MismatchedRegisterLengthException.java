package io.github.yok.secondq.core.operator;

import lombok.Getter;

/**
 * レジスタ長（モード数）が異なる演算子同士で演算しようとした場合に発生する例外です。
 */
@Getter
public class MismatchedRegisterLengthException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    /**
     * 左オペランドのレジスタ長です。
     */
    private final int left;

    /**
     * 右オペランドのレジスタ長です。
     */
    private final int right;

    /**
     * 例外を生成します。
     *
     * @param left 左オペランドのレジスタ長です
     * @param right 右オペランドのレジスタ長です
     */
    public MismatchedRegisterLengthException(int left, int right) {
        this("レジスタ長が一致しません: " + left + " != " + right, left, right);
    }

    /**
     * メッセージを指定して例外を生成します。
     *
     * @param message メッセージです
     * @param left 左オペランドのレジスタ長です
     * @param right 右オペランドのレジスタ長です
     */
    public MismatchedRegisterLengthException(String message, int left, int right) {
        super(message);
        this.left = left;
        this.right = right;
    }
}
