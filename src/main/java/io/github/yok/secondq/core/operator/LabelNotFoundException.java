package io.github.yok.secondq.core.operator;

import java.util.NoSuchElementException;
import lombok.Getter;

/**
 * 演算子に存在しないラベルを参照した場合に発生する例外です。
 */
@Getter
public class LabelNotFoundException extends NoSuchElementException {

    private static final long serialVersionUID = 1L;

    /**
     * 見つからなかったラベルです。
     */
    private final String label;

    /**
     * 例外を生成します。
     *
     * @param label 見つからなかったラベルです
     */
    public LabelNotFoundException(String label) {
        super("ラベルが存在しません: '" + label + "'");
        this.label = label;
    }
}
