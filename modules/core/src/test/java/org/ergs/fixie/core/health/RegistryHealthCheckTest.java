package org.ergs.fixie.core.health;

import org.eclipse.microprofile.health.HealthCheckResponse;
import org.ergs.fixie.core.config.FixieConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

class RegistryHealthCheckTest {

    @TempDir
    Path tempDir;

    private HealthCheckResponse check(Path pathsDir, Path simsDir) {
        RegistryHealthCheck check = new RegistryHealthCheck();
        check.config = FixieConfig.of(pathsDir, simsDir);
        return check.call();
    }

    @Test
    void upWhenBothRootsExist() throws Exception {
        HealthCheckResponse response = check(
                Files.createDirectories(tempDir.resolve("paths")),
                Files.createDirectories(tempDir.resolve("sims")));

        assertThat(response.getStatus()).isEqualTo(HealthCheckResponse.Status.UP);
        assertThat(response.getName()).isEqualTo("fixie-registry");
    }

    @Test
    void downWhenArtifactRootIsMissing() throws Exception {
        HealthCheckResponse response = check(
                Files.createDirectories(tempDir.resolve("paths")),
                tempDir.resolve("missing"));

        assertThat(response.getStatus()).isEqualTo(HealthCheckResponse.Status.DOWN);
        assertThat(response.getData()).isPresent();
        assertThat(response.getData().get().get("error").toString()).contains("sims directory");
    }
}
