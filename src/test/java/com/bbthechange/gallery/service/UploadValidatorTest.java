package com.bbthechange.gallery.service;

import com.bbthechange.gallery.config.UploadProperties;
import com.bbthechange.gallery.exception.ValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.util.unit.DataSize;

import static org.assertj.core.api.Assertions.*;

@DisplayName("UploadValidator Tests")
class UploadValidatorTest {

    private UploadValidator uploadValidator;

    @BeforeEach
    void setUp() {
        UploadProperties properties = new UploadProperties();
        properties.setMaxFileSize(DataSize.ofKilobytes(1));
        properties.setMaxCaptionLength(10);
        uploadValidator = new UploadValidator(properties);
    }

    @Nested
    @DisplayName("validateImage")
    class ValidateImageTests {

        @Test
        void acceptsSmallImage() {
            MockMultipartFile file = new MockMultipartFile("file", "a.jpg", "image/jpeg", new byte[512]);

            assertThatCode(() -> uploadValidator.validateImage(file)).doesNotThrowAnyException();
        }

        @Test
        void rejectsEmptyFile() {
            MockMultipartFile file = new MockMultipartFile("file", "a.jpg", "image/jpeg", new byte[0]);

            assertThatThrownBy(() -> uploadValidator.validateImage(file))
                .isInstanceOf(ValidationException.class)
                .hasMessage("File is empty");
            assertThatThrownBy(() -> uploadValidator.validateImage(null))
                .isInstanceOf(ValidationException.class);
        }

        @Test
        void rejectsNonImage() {
            MockMultipartFile file = new MockMultipartFile("file", "a.pdf", "application/pdf", new byte[10]);

            assertThatThrownBy(() -> uploadValidator.validateImage(file))
                .isInstanceOf(ValidationException.class)
                .hasMessage("File must be an image");
        }

        @Test
        void rejectsOversizedFile() {
            MockMultipartFile file = new MockMultipartFile("file", "a.png", "image/png", new byte[2048]);

            assertThatThrownBy(() -> uploadValidator.validateImage(file))
                .isInstanceOf(ValidationException.class)
                .hasMessageStartingWith("File size must be less than");
        }
    }

    @Nested
    @DisplayName("normalizeCaption")
    class NormalizeCaptionTests {

        @Test
        void trimsCaption() {
            assertThat(uploadValidator.normalizeCaption("  cake  ")).isEqualTo("cake");
        }

        @Test
        void blankCaptionBecomesNull() {
            assertThat(uploadValidator.normalizeCaption("   ")).isNull();
            assertThat(uploadValidator.normalizeCaption(null)).isNull();
        }

        @Test
        void rejectsTooLongCaption() {
            assertThatThrownBy(() -> uploadValidator.normalizeCaption("a much too long caption"))
                .isInstanceOf(ValidationException.class);
        }
    }
}
