package com.bbthechange.gallery.util;

import com.bbthechange.gallery.exception.ValidationException;
import org.junit.jupiter.api.Test;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class PageTokenCodecTest {

    @Test
    void encode_WithLastEvaluatedKey_ShouldDecodeToSameKey() {
        // Given
        Map<String, AttributeValue> key = Map.of(
            "pk", AttributeValue.builder().s("EVENT#abc").build(),
            "sk", AttributeValue.builder().s("PHOTO#def").build());

        // When
        String token = PageTokenCodec.encode(key);

        // Then
        assertThat(token).doesNotContain("=", "+", "/");
        assertThat(PageTokenCodec.decode(token)).isEqualTo(key);
    }

    @Test
    void encode_WithNoMorePages_ShouldReturnNull() {
        assertThat(PageTokenCodec.encode(null)).isNull();
        assertThat(PageTokenCodec.encode(Map.of())).isNull();
        assertThat(PageTokenCodec.decode(null)).isNull();
        assertThat(PageTokenCodec.decode(" ")).isNull();
    }

    @Test
    void decode_WithGarbage_ShouldThrowValidationException() {
        assertThatThrownBy(() -> PageTokenCodec.decode("%%%not-base64"))
            .isInstanceOf(ValidationException.class)
            .hasMessage("Invalid page token");
    }
}
