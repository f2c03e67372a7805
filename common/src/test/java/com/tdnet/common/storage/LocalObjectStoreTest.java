package com.tdnet.common.storage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class LocalObjectStoreTest {

    @TempDir
    Path root;

    @TempDir
    Path scratch;

    @Test
    void storesFilesAndTextUnderKeys() throws Exception {
        LocalObjectStore store = new LocalObjectStore(root);
        Path source = Files.writeString(scratch.resolve("a.pdf"), "%PDF-1.4");

        store.put("tdnet/2024/01/01/tanshin/7203_a.pdf", source);
        store.putText("tdnet/2024/01/01/metadata_20240101.json", "{}", "application/json");

        assertThat(store.exists("tdnet/2024/01/01/tanshin/7203_a.pdf")).isTrue();
        assertThat(store.readText("tdnet/2024/01/01/metadata_20240101.json")).isEqualTo("{}");
        assertThat(store.list("tdnet/2024/01/01/")).containsExactly(
            "tdnet/2024/01/01/metadata_20240101.json",
            "tdnet/2024/01/01/tanshin/7203_a.pdf");
        assertThat(store.list("tdnet/2024/02/")).isEmpty();

        Path copy = scratch.resolve("copy.pdf");
        store.download("tdnet/2024/01/01/tanshin/7203_a.pdf", copy);
        assertThat(copy).hasContent("%PDF-1.4");
    }

    @Test
    void rejectsKeysOutsideRoot() {
        LocalObjectStore store = new LocalObjectStore(root);

        assertThatThrownBy(() -> store.putText("../escape.txt", "x", "text/plain"))
            .isInstanceOf(StorageException.class);
    }

    @Test
    void missingObjectSurfacesAsStorageException() {
        LocalObjectStore store = new LocalObjectStore(root);

        assertThat(store.exists("nope.json")).isFalse();
        assertThatThrownBy(() -> store.readText("nope.json")).isInstanceOf(StorageException.class);
    }
}
