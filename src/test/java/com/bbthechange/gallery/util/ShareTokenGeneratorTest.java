package com.bbthechange.gallery.util;

import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

class ShareTokenGeneratorTest {

    @Test
    void generate_ShouldProduceValidShareTokens() {
        String token = ShareTokenGenerator.generate();

        assertThat(token).hasSize(16).matches("[a-z0-9]+");
        assertThat(GalleryKeyFactory.isValidShareToken(token)).isTrue();
    }

    @Test
    void generateUnique_ShouldRetryWhileTokenIsTaken() {
        // Given
        AtomicInteger checks = new AtomicInteger();

        // When
        String token = ShareTokenGenerator.generateUnique(candidate -> checks.incrementAndGet() < 3);

        // Then
        assertThat(token).isNotNull();
        assertThat(checks.get()).isEqualTo(3);
    }
}
