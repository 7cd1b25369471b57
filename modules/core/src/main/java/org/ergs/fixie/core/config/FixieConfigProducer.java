package org.ergs.fixie.core.config;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

@ApplicationScoped
public class FixieConfigProducer {

    private static final Logger log = Logger.getLogger(FixieConfigProducer.class);

    @ConfigProperty(name = "fixie.paths.dir")
    String pathsDir;

    @ConfigProperty(name = "fixie.sims.dir")
    String simsDir;

    @ConfigProperty(name = "fixie.lock.timeout", defaultValue = "10s")
    Duration lockTimeout;

    @ConfigProperty(name = "fixie.fetch.url-prefix", defaultValue = FixieConfig.DEFAULT_FETCH_URL_PREFIX)
    String fetchUrlPrefix;

    @Produces
    @Singleton
    public FixieConfig fixieConfig() {
        FixieConfig config = new FixieConfig(Path.of(pathsDir), Path.of(simsDir),
                lockTimeout, fetchUrlPrefix);
        try {
            Files.createDirectories(config.pathsDir());
            Files.createDirectories(config.simsDir());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create fixie directories", e);
        }
        log.infof("Registry root %s, artifact root %s, lock timeout %s",
                config.pathsDir(), config.simsDir(), config.lockTimeout());
        return config;
    }
}
