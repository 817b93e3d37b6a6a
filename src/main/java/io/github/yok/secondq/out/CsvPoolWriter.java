package io.github.yok.secondq.out;

import io.github.yok.secondq.core.excitation.Excitation;
import io.github.yok.secondq.core.excitation.ParticleCounts;
import io.github.yok.secondq.core.operator.FermionicOp;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.math3.complex.Complex;

/**
 * 演算子プールを CSV に出力するクラスです。
 *
 * <p>
 * 出力ファイル名は、以下の命名規約に従います（n はスピン軌道数、exc は励起の略記）。
 * </p>
 *
 * <ul>
 * <li>{@code secondq_pool_n=8_sd.csv}（生成子の各項を 1 行で出力します）</li>
 * <li>{@code secondq_meta_n=8_sd.csv}（粒子数や生成子数などの補助情報）</li>
 * </ul>
 */
public final class CsvPoolWriter implements PoolWriter {

    /**
     * ファイル名の先頭固定文字列です。
     */
    private static final String FILE_HEAD = "secondq";

    /**
     * 出力先ディレクトリです。
     */
    private final Path outputDir;

    /**
     * CSV 出力を生成します。
     *
     * @param outputDir 出力先ディレクトリです
     * @throws IllegalArgumentException outputDir が空の場合に発生します
     */
    public CsvPoolWriter(String outputDir) {
        if (outputDir == null || outputDir.isEmpty()) {
            throw new IllegalArgumentException("output.dir は必須です");
        }
        this.outputDir = Paths.get(outputDir);
    }

    /**
     * 演算子プールを出力します。
     *
     * @param numSpinOrbitals スピン軌道数です
     * @param particles スピンごとの粒子数です
     * @param excitationLabel 励起の略記です
     * @param excitations 励起の一覧です
     * @param generators 生成子の一覧です
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     * @throws IllegalStateException 出力に失敗した場合に発生します
     */
    @Override
    public void write(int numSpinOrbitals, ParticleCounts particles, String excitationLabel,
            List<Excitation> excitations, List<FermionicOp> generators) {
        if (particles == null) {
            throw new IllegalArgumentException("particles は null 不可です");
        }
        if (excitations == null || generators == null) {
            throw new IllegalArgumentException("excitations/generators は null 不可です");
        }
        if (excitations.size() != generators.size()) {
            throw new IllegalArgumentException("励起数と生成子数が一致しません: excitations="
                    + excitations.size() + ", generators=" + generators.size());
        }

        try {
            Files.createDirectories(outputDir);

            // 1) 生成子の各項
            writePoolCsv(numSpinOrbitals, excitationLabel, excitations, generators);

            // 2) メタ情報
            writeMetaCsv(numSpinOrbitals, particles, excitationLabel, excitations, generators);

        } catch (IOException e) {
            throw new IllegalStateException("CSV 出力に失敗しました: " + outputDir, e);
        }
    }

    /**
     * 生成子の各項を出力します。
     *
     * @param numSpinOrbitals スピン軌道数です
     * @param excitationLabel 励起の略記です
     * @param excitations 励起の一覧です
     * @param generators 生成子の一覧です
     * @throws IOException 出力に失敗した場合に発生します
     */
    private void writePoolCsv(int numSpinOrbitals, String excitationLabel,
            List<Excitation> excitations, List<FermionicOp> generators) throws IOException {

        Path file = outputDir.resolve(buildFileName("pool", numSpinOrbitals, excitationLabel));

        try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
                CSVPrinter pr = CSVFormat.Builder.create(CSVFormat.DEFAULT)
                        .setHeader("index", "order", "sources", "targets", "label", "real",
                                "imag")
                        .build().print(w)) {

            for (int i = 0; i < generators.size(); i++) {
                Excitation exc = excitations.get(i);
                for (Map.Entry<String, Complex> term : generators.get(i).terms().asMap()
                        .entrySet()) {
                    // -0.0 は 0.0 として出力します
                    pr.printRecord(i, exc.order(), join(exc.getSources()), join(exc.getTargets()),
                            term.getKey(), term.getValue().getReal() + 0.0,
                            term.getValue().getImaginary() + 0.0);
                }
            }
        }
    }

    /**
     * メタ情報を出力します。
     *
     * @param numSpinOrbitals スピン軌道数です
     * @param particles スピンごとの粒子数です
     * @param excitationLabel 励起の略記です
     * @param excitations 励起の一覧です
     * @param generators 生成子の一覧です
     * @throws IOException 出力に失敗した場合に発生します
     */
    private void writeMetaCsv(int numSpinOrbitals, ParticleCounts particles,
            String excitationLabel, List<Excitation> excitations, List<FermionicOp> generators)
            throws IOException {

        Path file = outputDir.resolve(buildFileName("meta", numSpinOrbitals, excitationLabel));

        Map<Integer, Long> perOrder = excitations.stream()
                .collect(Collectors.groupingBy(Excitation::order, TreeMap::new,
                        Collectors.counting()));

        try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
                CSVPrinter pr = CSVFormat.Builder.create(CSVFormat.DEFAULT)
                        .setHeader("key", "value").build().print(w)) {

            pr.printRecord("numSpinOrbitals", numSpinOrbitals);
            pr.printRecord("numParticles.alpha", particles.getAlpha());
            pr.printRecord("numParticles.beta", particles.getBeta());
            pr.printRecord("excitations", excitationLabel);
            pr.printRecord("generators", generators.size());
            for (Map.Entry<Integer, Long> e : perOrder.entrySet()) {
                pr.printRecord("generators.order" + e.getKey(), e.getValue());
            }
        }
    }

    /**
     * 命名規約に従ってファイル名を作成します。
     *
     * <p>
     * 例: {@code secondq_pool_n=8_sd.csv}
     * </p>
     *
     * @param kind 種類（pool/meta）です
     * @param numSpinOrbitals スピン軌道数です
     * @param excitationLabel 励起の略記です
     * @return ファイル名です
     */
    static String buildFileName(String kind, int numSpinOrbitals, String excitationLabel) {
        return FILE_HEAD + "_" + kind + "_n=" + numSpinOrbitals + "_" + excitationLabel + ".csv";
    }

    private static String join(List<Integer> modes) {
        return modes.stream().map(String::valueOf).collect(Collectors.joining(" "));
    }
}
