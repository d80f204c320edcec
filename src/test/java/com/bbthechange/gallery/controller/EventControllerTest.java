package com.bbthechange.gallery.controller;

import com.bbthechange.gallery.dto.BulkItemResult;
import com.bbthechange.gallery.dto.BulkOutcome;
import com.bbthechange.gallery.dto.CreateEventRequest;
import com.bbthechange.gallery.dto.EventDTO;
import com.bbthechange.gallery.exception.AccessDeniedException;
import com.bbthechange.gallery.exception.EventNotFoundException;
import com.bbthechange.gallery.exception.IllegalStateTransitionException;
import com.bbthechange.gallery.exception.ValidationException;
import com.bbthechange.gallery.model.Event;
import com.bbthechange.gallery.model.EventStatus;
import com.bbthechange.gallery.model.EventTransition;
import com.bbthechange.gallery.model.Host;
import com.bbthechange.gallery.security.Actor;
import com.bbthechange.gallery.security.DenyReason;
import com.bbthechange.gallery.service.EventLifecycleService;
import com.bbthechange.gallery.testutil.GalleryTestData;
import com.bbthechange.gallery.util.PaginatedResult;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Unit tests for EventController
 *
 * Test Coverage:
 * - POST /events, GET /events, GET/PATCH/DELETE /events/{id}
 * - POST /events/{id}/publish and bulk actions
 * - Error to status mapping shared through BaseController
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("EventController Tests")
class EventControllerTest {

    @Mock
    private EventLifecycleService eventLifecycleService;

    private MockMvc mockMvc;
    private ObjectMapper objectMapper;
    private Actor actor;
    private Event event;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new EventController(eventLifecycleService))
                .setMessageConverters(new MappingJackson2HttpMessageConverter())
                .build();
        objectMapper = new ObjectMapper();

        Host host = GalleryTestData.host("host@example.com");
        actor = GalleryTestData.hostActor(host);
        event = GalleryTestData.event(host.getHostId(), EventStatus.DRAFT);
    }

    @Nested
    @DisplayName("POST /events - Create Event Tests")
    class CreateEventTests {

        @Test
        @DisplayName("Should create a draft event")
        void createEvent_Success() throws Exception {
            // Given
            Map<String, Object> body = Map.of("title", "Summer Party");
            when(eventLifecycleService.create(eq(actor), any(CreateEventRequest.class))).thenReturn(new EventDTO(event));

            // When & Then
            mockMvc.perform(post("/events")
                    .requestAttr(Actor.REQUEST_ATTRIBUTE, actor)
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(objectMapper.writeValueAsString(body)))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.eventId").value(event.getEventId()))
                .andExpect(jsonPath("$.status").value("DRAFT"))
                .andExpect(jsonPath("$.shareToken").value(event.getShareToken()));
        }

        @Test
        @DisplayName("Should reject a blank title")
        void createEvent_BlankTitle() throws Exception {
            Map<String, Object> body = Map.of("title", " ");

            mockMvc.perform(post("/events")
                    .requestAttr(Actor.REQUEST_ATTRIBUTE, actor)
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(objectMapper.writeValueAsString(body)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("VALIDATION_ERROR"));

            verifyNoInteractions(eventLifecycleService);
        }

        @Test
        @DisplayName("Should require an authenticated actor")
        void createEvent_NoActor() throws Exception {
            mockMvc.perform(post("/events")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(objectMapper.writeValueAsString(Map.of("title", "Party"))))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error").value("AUTHENTICATION_REQUIRED"));
        }

        @Test
        @DisplayName("Should map a suspended host to 403")
        void createEvent_SuspendedHost() throws Exception {
            when(eventLifecycleService.create(eq(actor), any(CreateEventRequest.class)))
                .thenThrow(new AccessDeniedException(DenyReason.HOST_SUSPENDED, "Host is suspended"));

            mockMvc.perform(post("/events")
                    .requestAttr(Actor.REQUEST_ATTRIBUTE, actor)
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(objectMapper.writeValueAsString(Map.of("title", "Party"))))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.error").value("HOST_SUSPENDED"));
        }
    }

    @Nested
    @DisplayName("GET /events - List Events Tests")
    class ListEventsTests {

        @Test
        @DisplayName("Should use the default page size")
        void listEvents_DefaultLimit() throws Exception {
            when(eventLifecycleService.listOwn(actor, 20, null))
                .thenReturn(new PaginatedResult<>(List.of(new EventDTO(event)), "next-page"));

            mockMvc.perform(get("/events").requestAttr(Actor.REQUEST_ATTRIBUTE, actor))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.results[0].eventId").value(event.getEventId()))
                .andExpect(jsonPath("$.nextToken").value("next-page"));
        }

        @Test
        @DisplayName("Should reject a page size above the maximum")
        void listEvents_LimitTooLarge() throws Exception {
            mockMvc.perform(get("/events").param("limit", "500").requestAttr(Actor.REQUEST_ATTRIBUTE, actor))
                .andExpect(status().isBadRequest());

            verifyNoInteractions(eventLifecycleService);
        }
    }

    @Nested
    @DisplayName("Event transitions")
    class TransitionTests {

        @Test
        @DisplayName("Should publish through the lifecycle service")
        void publishEvent_Success() throws Exception {
            event.setStatus(EventStatus.ACTIVE);
            when(eventLifecycleService.transition(actor, event.getEventId(), EventTransition.PUBLISH))
                .thenReturn(new EventDTO(event));

            mockMvc.perform(post("/events/{eventId}/publish", event.getEventId())
                    .requestAttr(Actor.REQUEST_ATTRIBUTE, actor))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ACTIVE"));
        }

        @Test
        @DisplayName("Should map an illegal transition to 409")
        void publishEvent_IllegalState() throws Exception {
            when(eventLifecycleService.transition(actor, event.getEventId(), EventTransition.PUBLISH))
                .thenThrow(new IllegalStateTransitionException("Cannot publish an ACTIVE event"));

            mockMvc.perform(post("/events/{eventId}/publish", event.getEventId())
                    .requestAttr(Actor.REQUEST_ATTRIBUTE, actor))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("ILLEGAL_STATE"));
        }

        @Test
        @DisplayName("Should soft delete on DELETE")
        void deleteEvent_Success() throws Exception {
            event.setStatus(EventStatus.DELETED);
            when(eventLifecycleService.transition(actor, event.getEventId(), EventTransition.DELETE))
                .thenReturn(new EventDTO(event));

            mockMvc.perform(delete("/events/{eventId}", event.getEventId())
                    .requestAttr(Actor.REQUEST_ATTRIBUTE, actor))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("DELETED"));
        }

        @Test
        @DisplayName("Should map a missing event to 404")
        void getEvent_NotFound() throws Exception {
            when(eventLifecycleService.get(actor, "missing"))
                .thenThrow(new EventNotFoundException("Event not found: missing"));

            mockMvc.perform(get("/events/{eventId}", "missing").requestAttr(Actor.REQUEST_ATTRIBUTE, actor))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("EVENT_NOT_FOUND"));
        }

        @Test
        @DisplayName("Should map another host's event to NOT_OWNER")
        void updateEvent_NotOwner() throws Exception {
            when(eventLifecycleService.updateMetadata(eq(actor), eq(event.getEventId()), any()))
                .thenThrow(new AccessDeniedException(DenyReason.NOT_OWNER, "Not the event owner"));

            mockMvc.perform(patch("/events/{eventId}", event.getEventId())
                    .requestAttr(Actor.REQUEST_ATTRIBUTE, actor)
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(objectMapper.writeValueAsString(Map.of("title", "Renamed"))))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.error").value("NOT_OWNER"));
        }
    }

    @Nested
    @DisplayName("POST /events/actions/bulk - Bulk Action Tests")
    class BulkActionTests {

        @Test
        @DisplayName("Should return one outcome per event id")
        void bulkAction_PerItemOutcomes() throws Exception {
            List<String> ids = List.of(event.getEventId(), "other");
            when(eventLifecycleService.bulk(actor, "publish", ids, false)).thenReturn(List.of(
                new BulkItemResult(event.getEventId(), BulkOutcome.APPLIED),
                new BulkItemResult("other", BulkOutcome.NOT_FOUND)));

            mockMvc.perform(post("/events/actions/bulk")
                    .requestAttr(Actor.REQUEST_ATTRIBUTE, actor)
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(objectMapper.writeValueAsString(Map.of("action", "publish", "eventIds", ids))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].outcome").value("APPLIED"))
                .andExpect(jsonPath("$[1].outcome").value("NOT_FOUND"));
        }

        @Test
        @DisplayName("Should map an unknown action to 400")
        void bulkAction_UnknownAction() throws Exception {
            when(eventLifecycleService.bulk(actor, "suspend", List.of("a"), false))
                .thenThrow(new ValidationException("Unknown action: suspend"));

            mockMvc.perform(post("/events/actions/bulk")
                    .requestAttr(Actor.REQUEST_ATTRIBUTE, actor)
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(objectMapper.writeValueAsString(Map.of("action", "suspend", "eventIds", List.of("a")))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("VALIDATION_ERROR"));
        }
    }
}
