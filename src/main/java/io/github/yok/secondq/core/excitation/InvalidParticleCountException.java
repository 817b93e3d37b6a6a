package io.github.yok.secondq.core.excitation;

/**
 * 粒子数がスピン軌道数（スピンブロックの大きさ）と整合しない場合に発生する例外です。
 */
public class InvalidParticleCountException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    /**
     * 例外を生成します。
     *
     * @param message メッセージです
     */
    public InvalidParticleCountException(String message) {
        super(message);
    }
}
