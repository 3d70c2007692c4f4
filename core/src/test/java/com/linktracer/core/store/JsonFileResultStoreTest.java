package com.linktracer.core.store;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonFileResultStoreTest {

    @TempDir
    Path tmp;

    @Test
    void contents_survive_reopen_with_set_order() {
        Path file = tmp.resolve("nested/store.json");

        try (JsonFileResultStore s = JsonFileResultStore.open(file)) {
            s.ping();
            s.putFields("url:1", Map.of("status", "200"));
            s.addToSet("sources:1", "https://ex.com/z");
            s.addToSet("sources:1", "https://ex.com/a");
        }
        assertThat(file).exists();

        JsonFileResultStore reopened = JsonFileResultStore.open(file);
        assertThat(reopened.getFields("url:1")).containsEntry("status", "200");
        assertThat(reopened.members("sources:1")).containsExactly("https://ex.com/z", "https://ex.com/a");
        assertThat(tmp.resolve("nested/store.json.tmp")).doesNotExist();
    }

    @Test
    void missing_file_opens_empty() {
        JsonFileResultStore s = JsonFileResultStore.open(tmp.resolve("none.json"));
        assertThat(s.keys("")).isEmpty();
        assertThat(s.getFile()).isEqualTo(tmp.resolve("none.json"));
    }

    @Test
    void corrupt_snapshot_is_a_store_exception() throws Exception {
        Path file = tmp.resolve("bad.json");
        Files.writeString(file, "{ not json", StandardCharsets.UTF_8);
        assertThatThrownBy(() -> JsonFileResultStore.open(file))
                .isInstanceOf(StoreException.class)
                .hasMessageContaining("bad.json");
    }
}
