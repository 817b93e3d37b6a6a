package io.github.yok.secondq.app;

import javax.validation.Valid;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotBlank;
import javax.validation.constraints.PositiveOrZero;
import lombok.Data;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * secondq-algebra の設定値（secondq.*）を保持するクラスです。
 *
 * <p>
 * application.yml などから読み込まれ、CLI 実行時の初期化に使用します。
 * </p>
 */
@Data
@ToString(onlyExplicitlyIncluded = true)
@Validated
@ConfigurationProperties(prefix = "secondq")
public class SecondQProperties {

    /**
     * 系（スピン軌道数・粒子数）の設定です。
     */
    @Valid
    private SystemSettings system = new SystemSettings();

    /**
     * 励起プールの設定です。
     */
    @Valid
    private Pool pool = new Pool();

    /**
     * 演算子代数の設定です。
     */
    @Valid
    private Algebra algebra = new Algebra();

    /**
     * 出力設定です。
     */
    @Valid
    private Output output = new Output();

    /**
     * 設定値を YAML 風の複数行文字列に整形して返します。
     *
     * @return 設定値の整形文字列です
     */
    @ToString.Include(name = "secondq")
    public String toMultilineString() {
        String nl = System.lineSeparator();

        SystemSettings s = getSystem();
        Pool p = getPool();
        Algebra a = getAlgebra();
        Output o = getOutput();

        // 先頭改行を入れて、ログの可読性を上げます。
        StringBuilder sb = new StringBuilder(256).append(nl);

        appendSection(sb, nl, "system",
                // numSpinOrbitals: スピン軌道数（前半 α、後半 β）
                "numSpinOrbitals", s.getNumSpinOrbitals(),
                // numParticles: スピンごとの粒子数
                "numParticles.alpha", s.getNumParticles().getAlpha(),
                "numParticles.beta", s.getNumParticles().getBeta());

        appendSection(sb, nl, "pool",
                // excitations: 励起の略記（s/d/t/q）
                "excitations", p.getExcitations(),
                // generalized: 占有/非占有の区別をしない一般化励起
                "generalized", p.isGeneralized(),
                // preserveSpin: スピンブロックの構成を保存する
                "preserveSpin", p.isPreserveSpin(),
                "alphaSpin", p.isAlphaSpin(),
                "betaSpin", p.isBetaSpin(),
                // maxSpinExcitation: 1 ブロックから動かせる粒子数の上限（空は無制限）
                "maxSpinExcitation", p.getMaxSpinExcitation());

        appendSection(sb, nl, "algebra",
                // atol: 簡約・エルミート性判定の絶対許容誤差
                "atol", a.getAtol());

        appendSection(sb, nl, "output",
                // enabled: CSV を出力するかどうか
                "enabled", o.isEnabled(),
                // dir: 出力先ディレクトリ
                "dir", o.getDir());

        return sb.toString();
    }

    /**
     * セクション名と (key, value) ペア列を、YAML 風の複数行テキストとして追記します。
     *
     * @param sb 追記先バッファです
     * @param nl 改行文字列です
     * @param section セクション名です
     * @param kvPairs key1, value1, key2, value2, ... の順で渡すペア列です
     */
    private static void appendSection(StringBuilder sb, String nl, String section,
            Object... kvPairs) {
        sb.append("  ").append(section).append(":").append(nl);
        for (int i = 0; i < kvPairs.length; i += 2) {
            String key = String.valueOf(kvPairs[i]);
            Object val = (i + 1 < kvPairs.length) ? kvPairs[i + 1] : null;
            sb.append("    ").append(key).append(": ").append(val).append(nl);
        }
    }

    @Data
    public static class SystemSettings {

        /**
         * スピン軌道数です（正の偶数）。
         */
        @Min(2)
        private int numSpinOrbitals = 4;

        /**
         * スピンごとの粒子数です。
         */
        @Valid
        private NumParticles numParticles = new NumParticles();

        @Data
        public static class NumParticles {

            /**
             * α スピンの粒子数です。
             */
            @PositiveOrZero
            private int alpha = 1;

            /**
             * β スピンの粒子数です。
             */
            @PositiveOrZero
            private int beta = 1;
        }
    }

    @Data
    public static class Pool {

        /**
         * 励起の略記です（例: sd）。
         */
        @NotBlank
        private String excitations = "sd";

        /**
         * 一般化励起を生成するかどうかです。
         */
        private boolean generalized = false;

        /**
         * スピンを保存するかどうかです。
         */
        private boolean preserveSpin = true;

        /**
         * α ブロックに触れる励起を含めるかどうかです。
         */
        private boolean alphaSpin = true;

        /**
         * β ブロックに触れる励起を含めるかどうかです。
         */
        private boolean betaSpin = true;

        /**
         * 1 つのスピンブロックから動かせる粒子数の上限です（未設定は無制限）。
         */
        @Min(1)
        private Integer maxSpinExcitation;
    }

    @Data
    public static class Algebra {

        /**
         * 簡約・エルミート性判定の絶対許容誤差です。
         */
        @PositiveOrZero
        private double atol = 1e-8;
    }

    @Data
    public static class Output {

        /**
         * CSV を出力するかどうかです。
         */
        private boolean enabled = true;

        /**
         * 出力先ディレクトリです。
         */
        @NotBlank
        private String dir = "./out";
    }
}
