package org.ergs.fixie.core.health;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.HealthCheckResponseBuilder;
import org.eclipse.microprofile.health.Readiness;
import org.ergs.fixie.core.config.FixieConfig;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Ready when both the registry root and the artifact root are writable directories.
 */
@Readiness
@ApplicationScoped
public class RegistryHealthCheck implements HealthCheck {

    @Inject
    FixieConfig config;

    @Override
    public HealthCheckResponse call() {
        HealthCheckResponseBuilder response = HealthCheckResponse.named("fixie-registry")
                .withData("pathsDir", config.pathsDir().toString())
                .withData("simsDir", config.simsDir().toString());
        String problem = problem("paths", config.pathsDir());
        if (problem == null) {
            problem = problem("sims", config.simsDir());
        }
        if (problem != null) {
            return response.down().withData("error", problem).build();
        }
        return response.up().build();
    }

    private static String problem(String name, Path dir) {
        if (!Files.isDirectory(dir)) {
            return name + " directory " + dir + " does not exist";
        }
        if (!Files.isWritable(dir)) {
            return name + " directory " + dir + " is not writable";
        }
        return null;
    }
}
