package org.ergs.fixie.core.paths;

import org.ergs.fixie.core.RegistryFixture;
import org.ergs.fixie.core.paths.PendingPathStore.PendingRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class PendingPathStoreTest {

    @TempDir
    Path tempDir;

    private RegistryFixture fixture;
    private PendingPathStore store;

    @BeforeEach
    void setUp() {
        fixture = new RegistryFixture(tempDir);
        store = fixture.pendingStore;
    }

    @Test
    void registerWritesAReadableDescriptor() {
        Path file = store.register(new PendingPath("/as", "sims/0.txt", "inigo", "42", Double.POSITIVE_INFINITY));

        assertThat(file.getParent()).isEqualTo(fixture.pathsDir());
        assertThat(file.getFileName().toString()).startsWith("inigo-").endsWith("-pending-path.json");
        assertThat(PendingPathStore.isPendingFile(file)).isTrue();

        List<PendingRecord> pending = store.pending("inigo");
        assertThat(pending).hasSize(1);
        assertThat(pending.get(0).file()).isEqualTo(file);
        assertThat(pending.get(0).path().holding()).isInfinite();
    }

    @Test
    void registerRequiresUserPathAndHolding() {
        assertThatThrownBy(() -> store.register(new PendingPath("/as", "f", null, "1", 1.0)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> store.register(new PendingPath(null, "f", "inigo", "1", 1.0)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> store.register(new PendingPath("/as", "f", "inigo", "1", null)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void readsDescriptorsFromExternalWriters() throws Exception {
        fixture.pendingJson("inigo", "0a", """
                {"path": "/as", "file": "x.txt", "user": "inigo", "jobid": 42, "holding": "inf"}""");
        fixture.pendingJson("inigo", "0b", """
                {"path": "/you", "file": "y.txt", "user": "inigo", "jobid": 43, "holding": 42.0}""");
        fixture.pendingJson("inigo", "0c", """
                {"path": "/wish", "file": "z.txt", "user": "inigo", "jobid": 44, "holding": "1e300"}""");

        assertThat(store.pending("inigo"))
                .extracting(r -> r.path().path(), r -> r.path().holding(), r -> r.path().jobid())
                .containsExactly(
                        tuple("/as", Double.POSITIVE_INFINITY, "42"),
                        tuple("/you", 42.0, "43"),
                        tuple("/wish", 1e300, "44"));
    }

    @Test
    void skipsUnreadableDescriptorsAndLeavesThemOnDisk() throws Exception {
        Path garbage = fixture.pendingJson("inigo", "bad", "{this is not json");
        Path pathless = fixture.pendingJson("inigo", "nopath", "{\"file\": \"a\", \"holding\": 1}");
        Path holdless = fixture.pendingJson("inigo", "nohold", "{\"path\": \"/a\", \"file\": \"a\"}");
        fixture.pendingJson("inigo", "good", "{\"path\": \"/ok\", \"user\": \"inigo\", \"holding\": 1}");

        assertThat(store.pending("inigo")).extracting(r -> r.path().path()).containsExactly("/ok");
        assertThat(garbage).exists();
        assertThat(pathless).exists();
        assertThat(holdless).exists();
    }

    @Test
    void prefixSharingUsersKeepTheirOwnRecords() throws Exception {
        fixture.pendingJson("miracle", "1", "{\"path\": \"/a\", \"user\": \"miracle\", \"holding\": 1}");
        fixture.pendingJson("miracle-max", "2", "{\"path\": \"/b\", \"user\": \"miracle-max\", \"holding\": 1}");

        assertThat(store.pending("miracle")).extracting(r -> r.path().path()).containsExactly("/a");
        assertThat(store.pending("miracle-max")).extracting(r -> r.path().path()).containsExactly("/b");
    }

    @Test
    void ignoresOtherUsersAndRegistryFiles() throws Exception {
        fixture.initUserPaths("inigo", 1.0, 1.0);
        fixture.pendingJson("fezzik", "1", "{\"path\": \"/a\", \"user\": \"fezzik\", \"holding\": 1}");

        assertThat(store.pending("inigo")).isEmpty();
    }

    @Test
    void removeDeletesDescriptor() throws Exception {
        Path file = fixture.pendingJson("inigo", "1", "{\"path\": \"/a\", \"holding\": 1}");

        assertThat(store.remove(file)).isTrue();
        assertThat(file).doesNotExist();
        assertThat(store.remove(file)).isTrue();
        assertThat(Files.exists(file)).isFalse();
    }
}
