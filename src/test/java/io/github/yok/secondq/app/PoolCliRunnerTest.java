package io.github.yok.secondq.app;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.yok.secondq.core.excitation.ExcitationSettings;
import io.github.yok.secondq.core.excitation.ParticleCounts;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest(properties = {"secondq.output.enabled=true",
        "secondq.output.dir=target/test-output/cli"})
class PoolCliRunnerTest {

    @Autowired
    PoolCliRunner runner;

    @Autowired
    ParticleCounts particleCounts;

    @Autowired
    ExcitationSettings excitationSettings;

    @Test
    void writesCsvOnStartup() throws IOException {
        Path dir = Paths.get("target/test-output/cli");
        assertTrue(Files.exists(dir.resolve("secondq_pool_n=4_sd.csv")));
        assertTrue(Files.readAllLines(dir.resolve("secondq_meta_n=4_sd.csv"))
                .contains("generators,3"));
    }

    @Test
    void usesDefaultSystem() {
        assertEquals(new ParticleCounts(1, 1), particleCounts);
        assertEquals(2, excitationSettings.getOrders().size());
    }

    @Test
    void canRunAgain() {
        runner.run();
        assertTrue(Files.exists(Paths.get("target/test-output/cli/secondq_pool_n=4_sd.csv")));
    }
}
