package io.github.yok.secondq.out;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.yok.secondq.core.excitation.Excitation;
import io.github.yok.secondq.core.excitation.ExcitationPoolGenerator;
import io.github.yok.secondq.core.excitation.ExcitationSettings;
import io.github.yok.secondq.core.excitation.FermionicExcitationGenerator;
import io.github.yok.secondq.core.excitation.ParticleCounts;
import io.github.yok.secondq.core.operator.FermionicOp;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CsvPoolWriterTest {

    @TempDir
    Path tempDir;

    private final ParticleCounts particles = new ParticleCounts(1, 1);

    private List<Excitation> excitations;

    private List<FermionicOp> generators;

    @BeforeEach
    void setUp() {
        ExcitationPoolGenerator pool =
                new ExcitationPoolGenerator(new FermionicExcitationGenerator());
        ExcitationSettings s = ExcitationSettings.parse("sd");
        excitations = pool.excitations(4, particles, s);
        generators = pool.generate(4, particles, s);
    }

    @Test
    void writesPoolTerms() throws IOException {
        Path out = tempDir.resolve("nested");
        new CsvPoolWriter(out.toString()).write(4, particles, "sd", excitations, generators);

        List<String> lines =
                Files.readAllLines(out.resolve("secondq_pool_n=4_sd.csv"), StandardCharsets.UTF_8);
        assertEquals("index,order,sources,targets,label,real,imag", lines.get(0));
        // 生成子 3 個 × 2 項
        assertEquals(7, lines.size());
        assertEquals("0,1,0,1,+_1 -_0,0.0,1.0", lines.get(1));
        assertEquals("0,1,0,1,+_0 -_1,0.0,-1.0", lines.get(2));
        assertEquals("2,2,0 2,1 3,+_1 +_3 -_0 -_2,0.0,1.0", lines.get(5));
    }

    @Test
    void writesMeta() throws IOException {
        new CsvPoolWriter(tempDir.toString()).write(4, particles, "sd", excitations, generators);

        List<String> lines = Files.readAllLines(tempDir.resolve("secondq_meta_n=4_sd.csv"),
                StandardCharsets.UTF_8);
        assertEquals(List.of("key,value", "numSpinOrbitals,4", "numParticles.alpha,1",
                "numParticles.beta,1", "excitations,sd", "generators,3", "generators.order1,2",
                "generators.order2,1"), lines);
    }

    @Test
    void writesEmptyPool() throws IOException {
        new CsvPoolWriter(tempDir.toString()).write(4, new ParticleCounts(2, 2), "sd",
                Collections.emptyList(), Collections.emptyList());

        List<String> pool = Files.readAllLines(tempDir.resolve("secondq_pool_n=4_sd.csv"));
        assertEquals(1, pool.size());
        assertTrue(Files.readAllLines(tempDir.resolve("secondq_meta_n=4_sd.csv"))
                .contains("generators,0"));
    }

    @Test
    void rejectsMismatchedLists() {
        CsvPoolWriter w = new CsvPoolWriter(tempDir.toString());
        assertThrows(IllegalArgumentException.class,
                () -> w.write(4, particles, "sd", excitations, generators.subList(0, 1)));
    }

    @Test
    void rejectsEmptyDirectory() {
        assertThrows(IllegalArgumentException.class, () -> new CsvPoolWriter(""));
    }

    @Test
    void failsWhenDirectoryIsAFile() throws IOException {
        Path file = Files.createFile(tempDir.resolve("occupied"));
        CsvPoolWriter w = new CsvPoolWriter(file.toString());
        assertThrows(IllegalStateException.class,
                () -> w.write(4, particles, "sd", excitations, generators));
    }

    @Test
    void fileNameConvention() {
        assertEquals("secondq_pool_n=8_sd.csv", CsvPoolWriter.buildFileName("pool", 8, "sd"));
    }
}
