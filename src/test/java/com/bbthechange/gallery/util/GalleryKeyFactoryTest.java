package com.bbthechange.gallery.util;

import com.bbthechange.gallery.exception.InvalidKeyException;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;

class GalleryKeyFactoryTest {

    private static final String EVENT_ID = "12345678-1234-1234-1234-123456789012";

    @Test
    void getEventPk_WithValidId_ShouldReturnPrefixedKey() {
        // When
        String pk = GalleryKeyFactory.getEventPk(EVENT_ID);

        // Then
        assertThat(pk).isEqualTo("EVENT#" + EVENT_ID);
    }

    @Test
    void getEventPk_WithNonUuid_ShouldThrowException() {
        // When/Then
        assertThatThrownBy(() -> GalleryKeyFactory.getEventPk("not-a-uuid"))
            .isInstanceOf(InvalidKeyException.class)
            .hasMessageContaining("Invalid Event ID format");
    }

    @Test
    void getHostPk_WithNullId_ShouldThrowException() {
        // When/Then
        assertThatThrownBy(() -> GalleryKeyFactory.getHostPk(null))
            .isInstanceOf(InvalidKeyException.class)
            .hasMessageContaining("Host ID cannot be null or empty");
    }

    @Test
    void getSubjectPk_AcceptsProviderIdsButRejectsDelimiter() {
        // When/Then
        assertThat(GalleryKeyFactory.getSubjectPk("fb-UID_abc123")).isEqualTo("SUBJECT#fb-UID_abc123");
        assertThatThrownBy(() -> GalleryKeyFactory.getSubjectPk("evil#HOST"))
            .isInstanceOf(InvalidKeyException.class);
        assertThatThrownBy(() -> GalleryKeyFactory.getSubjectPk(" "))
            .isInstanceOf(InvalidKeyException.class);
    }

    @Test
    void getPhotoSk_ShouldLiveUnderPhotoPrefix() {
        // Given
        String photoId = UUID.randomUUID().toString();

        // When
        String sk = GalleryKeyFactory.getPhotoSk(photoId);

        // Then
        assertThat(sk).startsWith(GalleryKeyFactory.getPhotoPrefix());
        assertThat(GalleryKeyFactory.isPhotoItem(sk)).isTrue();
        assertThat(GalleryKeyFactory.isExportItem(sk)).isFalse();
    }

    @Test
    void getExportSk_ShouldBeRecognisedAsExportItem() {
        String sk = GalleryKeyFactory.getExportSk(UUID.randomUUID().toString());

        assertThat(GalleryKeyFactory.isExportItem(sk)).isTrue();
        assertThat(GalleryKeyFactory.isPhotoItem(sk)).isFalse();
    }

    @Test
    void getCreatedSk_ShouldSortChronologically() {
        // Given
        Instant earlier = Instant.parse("2024-01-01T10:00:00Z");
        Instant later = Instant.parse("2024-06-01T10:00:00Z");

        // When
        String first = GalleryKeyFactory.getCreatedSk(earlier);
        String second = GalleryKeyFactory.getCreatedSk(later);

        // Then
        assertThat(first).isEqualTo("CREATED#2024-01-01T10:00:00Z");
        assertThat(first).isLessThan(second);
    }

    @Test
    void getShareTokenGsi2pk_WithMalformedToken_ShouldThrowException() {
        assertThat(GalleryKeyFactory.getShareTokenGsi2pk("abc123def456ghi7")).isEqualTo("SHARE#abc123def456ghi7");
        assertThatThrownBy(() -> GalleryKeyFactory.getShareTokenGsi2pk("ABC#123"))
            .isInstanceOf(InvalidKeyException.class);
        assertThat(GalleryKeyFactory.isValidShareToken(null)).isFalse();
        assertThat(GalleryKeyFactory.isValidShareToken("abc")).isFalse();
    }

    @Test
    void isValidId_ShouldOnlyAcceptUuids() {
        assertThat(GalleryKeyFactory.isValidId(EVENT_ID)).isTrue();
        assertThat(GalleryKeyFactory.isValidId("12345")).isFalse();
        assertThat(GalleryKeyFactory.isValidId(null)).isFalse();
    }
}
