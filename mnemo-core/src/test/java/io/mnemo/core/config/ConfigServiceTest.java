package io.mnemo.core.config;

import static org.assertj.core.api.Assertions.assertThat;

import io.mnemo.core.config.model.MnemoConfig;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigServiceTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldLoadDefaultsWhenConfigMissing() throws Exception {
        ConfigService service = new ConfigService();

        MnemoConfig config = service.load(tempDir.resolve("config.json"));

        assertThat(config.vector().url()).isEqualTo("http://localhost:6333");
        assertThat(config.vector().collectionPrefix()).isEqualTo("mnemo");
        assertThat(config.embedding().dimensions()).isEqualTo(384);
        assertThat(config.retrieval().rrfK()).isEqualTo(60);
        assertThat(config.cache().ttlSeconds()).isEqualTo(60);
        assertThat(config.embedding().configured()).isFalse();
    }

    @Test
    void shouldMergeExistingValuesOverDefaults() throws Exception {
        ConfigService service = new ConfigService();
        Path configPath = tempDir.resolve("config.json");
        Files.writeString(configPath, """
            {
              "vector": {
                "backend": "memory",
                "collectionPrefix": "agent42"
              },
              "retrieval": {
                "sortScope": "page"
              },
              "cache": {
                "ttl_seconds": 5
              }
            }
            """);

        MnemoConfig config = service.load(configPath);

        assertThat(config.vector().inMemory()).isTrue();
        assertThat(config.vector().collectionPrefix()).isEqualTo("agent42");
        assertThat(config.vector().distance()).isEqualTo("cosine");
        assertThat(config.retrieval().sortScope()).isEqualTo("page");
        assertThat(config.retrieval().candidateDepth()).isEqualTo(50);
        assertThat(config.cache().ttlSeconds()).isEqualTo(5);
    }

    @Test
    void shouldApplyEnvironmentOverrides() {
        ConfigService service = new ConfigService();

        MnemoConfig config = service.applyEnvironment(MnemoConfig.defaults(), Map.of(
            "MNEMO_QDRANT_URL", "https://qdrant.internal:6333",
            "QDRANT_API_KEY", "qd-secret"
        ));

        assertThat(config.vector().url()).isEqualTo("https://qdrant.internal:6333");
        assertThat(config.vector().apiKey()).isEqualTo("qd-secret");
        assertThat(service.applyEnvironment(MnemoConfig.defaults(), Map.of()).vector())
            .isEqualTo(MnemoConfig.defaults().vector());
    }

    @Test
    void initShouldWriteDefaultsOnceAndKeepExistingValues() throws Exception {
        ConfigService service = new ConfigService();
        Path configPath = tempDir.resolve(".mnemo/config.json");

        InitResult created = service.init(configPath, false);
        Files.writeString(configPath, Files.readString(configPath).replace("\"mnemo\"", "\"custom\""));
        InitResult refreshed = service.init(configPath, false);

        assertThat(created.createdConfig()).isTrue();
        assertThat(refreshed.createdConfig()).isFalse();
        assertThat(refreshed.overwrittenConfig()).isFalse();
        assertThat(service.load(configPath).vector().collectionPrefix()).isEqualTo("custom");
    }
}
