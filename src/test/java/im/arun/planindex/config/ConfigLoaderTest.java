package im.arun.planindex.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ConfigLoaderTest {

    @Test
    void loadsBundledDefaults() {
        PlanIndexConfig config = new ConfigLoader().load();

        assertThat(config.getDpi()).isEqualTo(150);
        assertThat(config.getIouThreshold()).isEqualTo(0.5);
        assertThat(config.getMaxPairingDistancePx()).isEqualTo(200);
        assertThat(config.getRelationTolerancePx()).isEqualTo(50);
        assertThat(config.getBucketSizePx()).isEqualTo(50);
        assertThat(config.isUseFallback()).isTrue();
        assertThat(config.getFallbackEndpoint()).isNull();
    }

    @Test
    void overridesAcceptBothKeyStyles() {
        Map<String, Object> overrides = new HashMap<>();
        overrides.put("max_pairing_distance_px", 120);
        overrides.put("iouThreshold", "0.6");
        overrides.put("use_fallback", "no");
        overrides.put("fallbackEndpoint", "http://localhost:9000/detect");

        PlanIndexConfig config = new ConfigLoader().load(overrides);

        assertThat(config.getMaxPairingDistancePx()).isEqualTo(120);
        assertThat(config.getIouThreshold()).isEqualTo(0.6);
        assertThat(config.isUseFallback()).isFalse();
        assertThat(config.getFallbackEndpoint()).isEqualTo("http://localhost:9000/detect");
    }

    @Test
    void badValuesAndUnknownKeysLeaveDefaults() {
        Map<String, Object> overrides = new HashMap<>();
        overrides.put("dpi", "high");
        overrides.put("colour", "blue");

        PlanIndexConfig config = new ConfigLoader().load(overrides);

        assertThat(config.getDpi()).isEqualTo(150);
    }

    @Test
    void overridesDoNotLeakBetweenLoads() {
        ConfigLoader loader = new ConfigLoader();
        loader.load(Map.of("dpi", 300));

        assertThat(loader.load().getDpi()).isEqualTo(150);
    }

    @Test
    void explicitFileWinsOverClasspath(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("custom.yaml");
        Files.writeString(file, "dpi: 72\nbucketSizePx: 25\nwriteRunLog: true\n");

        PlanIndexConfig config = new ConfigLoader(file.toString()).load();

        assertThat(config.getDpi()).isEqualTo(72);
        assertThat(config.getBucketSizePx()).isEqualTo(25);
        assertThat(config.isWriteRunLog()).isTrue();
        assertThat(config.getMaxPairingDistancePx()).isEqualTo(200);
    }

    @Test
    void missingFileFallsBackToClasspath(@TempDir Path dir) {
        PlanIndexConfig config = new ConfigLoader(dir.resolve("absent.yaml").toString()).load();

        assertThat(config.getDpi()).isEqualTo(150);
    }
}
