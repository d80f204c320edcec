package com.bbthechange.gallery.controller;

import com.bbthechange.gallery.dto.PhotoDTO;
import com.bbthechange.gallery.dto.PublicEventInfo;
import com.bbthechange.gallery.dto.PublicPhotoDTO;
import com.bbthechange.gallery.exception.QuotaExceededException;
import com.bbthechange.gallery.model.Event;
import com.bbthechange.gallery.model.EventStatus;
import com.bbthechange.gallery.model.Photo;
import com.bbthechange.gallery.model.PhotoStatus;
import com.bbthechange.gallery.security.ShareAccessDecision;
import com.bbthechange.gallery.security.ShareDenial;
import com.bbthechange.gallery.service.PhotoModerationService;
import com.bbthechange.gallery.service.ShareAccessGate;
import com.bbthechange.gallery.testutil.GalleryTestData;
import com.bbthechange.gallery.util.PaginatedResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("PublicController Tests")
class PublicControllerTest {

    @Mock
    private ShareAccessGate shareAccessGate;

    @Mock
    private PhotoModerationService photoModerationService;

    private MockMvc mockMvc;
    private Event event;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new PublicController(shareAccessGate, photoModerationService))
                .setMessageConverters(new MappingJackson2HttpMessageConverter())
                .build();
        event = GalleryTestData.event("host-1", EventStatus.ACTIVE);
    }

    @Test
    void getEventInfo_ShouldNotAskForPassword() throws Exception {
        when(shareAccessGate.publicInfo(event.getShareToken())).thenReturn(new PublicEventInfo(event, null, 3));

        mockMvc.perform(get("/public/events/{shareToken}", event.getShareToken()))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.title").value("Summer Party"))
            .andExpect(jsonPath("$.approvedPhotoCount").value(3));
    }

    @Test
    void listPhotos_WrongPassword_ShouldBe401() throws Exception {
        when(shareAccessGate.evaluate(event.getShareToken(), "nope"))
            .thenReturn(ShareAccessDecision.denied(ShareDenial.WRONG_PASSWORD));

        mockMvc.perform(get("/public/events/{shareToken}/photos", event.getShareToken())
                .header(PublicController.PASSWORD_HEADER, "nope"))
            .andExpect(status().isUnauthorized())
            .andExpect(jsonPath("$.error").value("WRONG_PASSWORD"));

        verifyNoInteractions(photoModerationService);
    }

    @Test
    void listPhotos_UnavailableEvent_ShouldBe404() throws Exception {
        when(shareAccessGate.evaluate("gone123", null)).thenReturn(ShareAccessDecision.denied(ShareDenial.NOT_AVAILABLE));

        mockMvc.perform(get("/public/events/{shareToken}/photos", "gone123"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error").value("NOT_AVAILABLE"));
    }

    @Test
    void listPhotos_Granted_ShouldReturnApprovedPhotos() throws Exception {
        Photo photo = GalleryTestData.photo(event.getEventId(), PhotoStatus.APPROVED);
        when(shareAccessGate.evaluate(event.getShareToken(), "secret")).thenReturn(ShareAccessDecision.granted(event));
        when(photoModerationService.listApproved(event, 20, null)).thenReturn(
            new PaginatedResult<>(List.of(new PublicPhotoDTO(photo, "https://cdn/photo.jpg")), null));

        mockMvc.perform(get("/public/events/{shareToken}/photos", event.getShareToken())
                .header(PublicController.PASSWORD_HEADER, "secret"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.results[0].photoId").value(photo.getPhotoId()))
            .andExpect(jsonPath("$.results[0].url").value("https://cdn/photo.jpg"))
            .andExpect(jsonPath("$.results[0].approvalStatus").doesNotExist());
    }

    @Test
    void verifyPassword_ShouldAcceptBodyPassword() throws Exception {
        when(shareAccessGate.evaluate(event.getShareToken(), "secret")).thenReturn(ShareAccessDecision.granted(event));

        mockMvc.perform(post("/public/events/{shareToken}/verify-password", event.getShareToken())
                .contentType("application/json")
                .content("{\"password\":\"secret\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.granted").value(true));
    }

    @Test
    void uploadPhoto_ShouldCreatePendingPhoto() throws Exception {
        MockMultipartFile file = new MockMultipartFile("file", "party.jpg", "image/jpeg", new byte[] {1, 2, 3});
        Photo photo = GalleryTestData.photo(event.getEventId(), PhotoStatus.PENDING);
        when(shareAccessGate.requireUploadAccess(event.getShareToken(), "secret")).thenReturn(event);
        when(photoModerationService.submitPublicPhoto(eq(event), any(), eq("Cheers")))
            .thenReturn(new PhotoDTO(photo, null));

        mockMvc.perform(multipart("/public/events/{shareToken}/photos", event.getShareToken())
                .file(file)
                .param("caption", "Cheers")
                .param("password", "secret"))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.approvalStatus").value("PENDING"));
    }

    @Test
    void uploadPhoto_QuotaExceeded_ShouldBe413() throws Exception {
        MockMultipartFile file = new MockMultipartFile("file", "party.jpg", "image/jpeg", new byte[] {1, 2, 3});
        when(shareAccessGate.requireUploadAccess(event.getShareToken(), null)).thenReturn(event);
        when(photoModerationService.submitPublicPhoto(eq(event), any(), isNull()))
            .thenThrow(new QuotaExceededException("Host storage quota exceeded"));

        mockMvc.perform(multipart("/public/events/{shareToken}/photos", event.getShareToken()).file(file))
            .andExpect(status().isPayloadTooLarge())
            .andExpect(jsonPath("$.error").value("QUOTA_EXCEEDED"));
    }
}
