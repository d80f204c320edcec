package com.bbthechange.gallery.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class StorageKeysTest {

    @Test
    void photoKey_ShouldGroupUnderEventAndMapJpeg() {
        assertThat(StorageKeys.photoKey("e1", "p1", "image/jpeg")).isEqualTo("events/e1/photos/p1.jpg");
        assertThat(StorageKeys.photoKey("e1", "p1", "image/png")).isEqualTo("events/e1/photos/p1.png");
    }

    @Test
    void coverKey_ShouldBeUniquePerUpload() {
        String first = StorageKeys.coverKey("e1", "image/webp");
        String second = StorageKeys.coverKey("e1", "image/webp");

        assertThat(first).startsWith("events/e1/cover/").endsWith(".webp");
        assertThat(first).isNotEqualTo(second);
    }

    @Test
    void exportKey_ShouldBeZipUnderExports() {
        assertThat(StorageKeys.exportKey("e1", "j1")).isEqualTo("exports/e1/j1.zip");
    }

    @Test
    void extension_ShouldStripParametersAndSuffixes() {
        assertThat(StorageKeys.extension("image/svg+xml")).isEqualTo(".svg");
        assertThat(StorageKeys.extension("image/PNG; charset=binary")).isEqualTo(".png");
    }

    @Test
    void extension_ShouldBeEmptyForUnusableContentTypes() {
        assertThat(StorageKeys.extension(null)).isEmpty();
        assertThat(StorageKeys.extension("image")).isEmpty();
        assertThat(StorageKeys.extension("image/")).isEmpty();
        assertThat(StorageKeys.extension("image/../../etc")).isEmpty();
    }
}
