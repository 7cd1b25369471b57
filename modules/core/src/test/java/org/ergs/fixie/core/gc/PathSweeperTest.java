package org.ergs.fixie.core.gc;

import org.ergs.fixie.core.RegistryFixture;
import org.ergs.fixie.core.lock.RegistryLock;
import org.ergs.fixie.core.paths.Outcome;
import org.ergs.fixie.core.paths.PathEntry;
import org.ergs.fixie.core.paths.RegistryStore;
import org.ergs.fixie.core.storage.ArtifactException;
import org.ergs.fixie.core.storage.ArtifactStorage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

class PathSweeperTest {

    private static final Instant NOW = Instant.ofEpochSecond(2000);

    @TempDir
    Path tempDir;

    private RegistryFixture fixture;
    private PathSweeper sweeper;

    @BeforeEach
    void setUp() {
        fixture = new RegistryFixture(tempDir, Duration.ofMillis(200));
        sweeper = new PathSweeper(fixture.registryStore, fixture.artifacts, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void removesOnlyExpiredEntriesWhoseArtifactWasDeleted() throws Exception {
        fixture.initUserPaths("valerie", 1000.0, 1000.0);
        Path as = fixture.artifact("0.txt", "as you wish");
        Path you = fixture.artifact("1.h5", "as you wish");

        Outcome<Void> result = sweeper.gc();

        assertThat(result.ok()).as(result.message()).isTrue();
        assertThat(as).exists();
        assertThat(you).doesNotExist();
        Map<String, PathEntry> remaining = fixture.registryStore.load("valerie").value();
        // /wish is expired but its artifact was already gone, so nothing was deleted for it
        assertThat(remaining).containsOnlyKeys("/as", "/wish");
    }

    @Test
    void expiredEntryWithArtifactIsRemoved() throws Exception {
        fixture.initUserPaths("valerie", 1000.0, 1000.0);
        Path wish = fixture.artifact("2.txt", "as you wish");

        assertThat(sweeper.gc().ok()).isTrue();

        assertThat(wish).doesNotExist();
        assertThat(fixture.registryStore.load("valerie").value()).doesNotContainKey("/wish");
    }

    @Test
    void entryHeldExactlyItsHoldingTimeIsExpired() throws Exception {
        fixture.initUserPaths("valerie", 1000.0, 2000.0 - 42.0);
        Path wish = fixture.artifact("2.txt", "as you wish");

        sweeper.gc();

        assertThat(wish).doesNotExist();
    }

    @Test
    void unexpiredEntriesAreUntouched() throws Exception {
        fixture.initUserPaths("valerie", 1000.0, 1999.0);
        Path wish = fixture.artifact("2.txt", "as you wish");
        byte[] before = Files.readAllBytes(fixture.registryStore.registryFile("valerie"));

        assertThat(sweeper.gc().ok()).isTrue();

        assertThat(wish).exists();
        assertThat(Files.readAllBytes(fixture.registryStore.registryFile("valerie"))).isEqualTo(before);
    }

    @Test
    void sweepsEveryUser() throws Exception {
        fixture.initUserPaths("valerie", 1000.0, 1000.0);
        fixture.initUserPaths("max", 1000.0, 1000.0);
        fixture.artifact("1.h5", "shared");

        assertThat(sweeper.gc().ok()).isTrue();

        // the first sweep deletes the shared artifact, the second finds it already gone
        long withYou = fixture.registryStore.listRegistryFiles().stream()
                .map(f -> fixture.registryStore.load(RegistryStore.userOf(f)).value())
                .filter(paths -> paths.containsKey("/you"))
                .count();
        assertThat(withYou).isEqualTo(1);
    }

    @Test
    void busyUserIsReportedAndOthersAreStillSwept() throws Exception {
        fixture.initUserPaths("valerie", 1000.0, 1000.0);
        fixture.initUserPaths("max", 1000.0, 1000.0);
        Path wish = fixture.artifact("2.txt", "as you wish");

        try (RegistryLock held = fixture.registryStore.lock("max")) {
            assertThat(held.isAcquired()).isTrue();
            Outcome<Void> result = CompletableFuture.supplyAsync(sweeper::gc).get(10, TimeUnit.SECONDS);

            assertThat(result.ok()).isFalse();
            assertThat(result.message()).contains("Could not acquire lock on").contains("max.json");
        }
        assertThat(wish).doesNotExist();
        assertThat(fixture.registryStore.load("valerie").value()).doesNotContainKey("/wish");
        assertThat(fixture.registryStore.load("max").value()).containsKey("/wish");
    }

    @Test
    void corruptRegistryIsReportedAndOthersAreStillSwept() throws Exception {
        Files.writeString(fixture.registryStore.registryFile("humperdinck"), "{\"/a\": null}");
        fixture.initUserPaths("valerie", 1000.0, 1000.0);
        Path wish = fixture.artifact("2.txt", "as you wish");

        Outcome<Void> result = sweeper.gc();

        assertThat(result.ok()).isFalse();
        assertThat(result.message()).contains("humperdinck");
        assertThat(wish).doesNotExist();
        assertThat(fixture.registryStore.load("valerie").value()).doesNotContainKey("/wish");
    }

    @Test
    void unexpectedErrorForOneUserDoesNotStopTheSweep() throws Exception {
        fixture.initUserPaths("max", 1000.0, 1000.0);
        fixture.initUserPaths("valerie", 1000.0, 1000.0);
        Path wish = fixture.artifact("2.txt", "as you wish");
        RegistryStore failingForMax = new RegistryStore(fixture.config, fixture.lockManager, fixture.objectMapper) {
            @Override
            public Outcome<Map<String, PathEntry>> read(RegistryLock lock) {
                if (RegistryStore.userOf(lock.resource()).equals("max")) {
                    throw new IllegalStateException("disk on fire");
                }
                return super.read(lock);
            }
        };
        PathSweeper isolated = new PathSweeper(failingForMax, fixture.artifacts, Clock.fixed(NOW, ZoneOffset.UTC));

        Outcome<Void> result = isolated.gc();

        assertThat(result.ok()).isFalse();
        assertThat(result.message()).contains("max.json").contains("disk on fire");
        assertThat(wish).doesNotExist();
        assertThat(fixture.registryStore.load("valerie").value()).doesNotContainKey("/wish");
    }

    @Test
    void failedArtifactDeleteKeepsEntryAndOthersAreStillProcessed() throws Exception {
        fixture.initUserPaths("valerie", 1000.0, 1000.0);
        Path you = fixture.artifact("1.h5", "stuck");
        Path wish = fixture.artifact("2.txt", "as you wish");
        ArtifactStorage stuck = new ArtifactStorage(fixture.config) {
            @Override
            public void delete(Path artifact) {
                if (artifact.equals(you)) {
                    throw new ArtifactException("Failed to delete " + artifact + ": device busy");
                }
                super.delete(artifact);
            }
        };
        PathSweeper partial = new PathSweeper(fixture.registryStore, stuck, Clock.fixed(NOW, ZoneOffset.UTC));

        Outcome<Void> result = partial.gc();

        assertThat(result.ok()).isFalse();
        assertThat(result.message()).isEqualTo("Failed to delete " + you + ": device busy");
        assertThat(you).exists();
        assertThat(wish).doesNotExist();
        assertThat(fixture.registryStore.load("valerie").value()).containsOnlyKeys("/as", "/you");
    }

    @Test
    void nothingToSweepSucceeds() {
        Outcome<Void> result = sweeper.gc();

        assertThat(result.ok()).isTrue();
        assertThat(result.message()).isEqualTo("Garbage collection complete");
    }
}
