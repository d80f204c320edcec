package com.bbthechange.gallery.controller;

import com.bbthechange.gallery.dto.ProfileResponse;
import com.bbthechange.gallery.dto.SignInRequest;
import com.bbthechange.gallery.exception.AccessDeniedException;
import com.bbthechange.gallery.exception.InvalidCredentialException;
import com.bbthechange.gallery.model.Host;
import com.bbthechange.gallery.security.Actor;
import com.bbthechange.gallery.security.DenyReason;
import com.bbthechange.gallery.security.VerifiedIdentity;
import com.bbthechange.gallery.service.ActorResolver;
import com.bbthechange.gallery.service.AuthorizationGuard;
import com.bbthechange.gallery.service.IdentityVerifier;
import com.bbthechange.gallery.testutil.GalleryTestData;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for AuthController and AdminAuthController
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("Sign-in Controller Tests")
class AuthControllerTest {

    @Mock
    private IdentityVerifier identityVerifier;

    @Mock
    private ActorResolver actorResolver;

    @Mock
    private AuthorizationGuard authorizationGuard;

    private AuthController authController;
    private AdminAuthController adminAuthController;
    private VerifiedIdentity identity;
    private SignInRequest signInRequest;
    private Host host;

    @BeforeEach
    void setUp() {
        authController = new AuthController(identityVerifier, actorResolver);
        adminAuthController = new AdminAuthController(identityVerifier, actorResolver, authorizationGuard);

        host = GalleryTestData.host("host@example.com");
        identity = new VerifiedIdentity(host.getSubjectId(), "host@example.com", true, "Host",
            Instant.now(), Instant.now().plusSeconds(3600));
        signInRequest = new SignInRequest();
        signInRequest.setToken("firebase-token");
    }

    @Nested
    @DisplayName("POST /auth/signin")
    class HostSignInTests {

        @Test
        @DisplayName("Should return the resolved host profile")
        void signIn_Success() {
            // Arrange
            when(identityVerifier.verify("firebase-token")).thenReturn(identity);
            when(actorResolver.resolve(identity)).thenReturn(new Actor(host, false));

            // Act
            ResponseEntity<ProfileResponse> response = authController.signIn(signInRequest);

            // Assert
            assertEquals(HttpStatus.OK, response.getStatusCode());
            assertNotNull(response.getBody());
            assertEquals(host.getHostId(), response.getBody().getHostId());
            assertFalse(response.getBody().isAdmin());
        }

        @Test
        @DisplayName("Sign-up behaves like sign-in")
        void signUp_SameAsSignIn() {
            when(identityVerifier.verify("firebase-token")).thenReturn(identity);
            when(actorResolver.resolve(identity)).thenReturn(new Actor(host, false));

            ResponseEntity<ProfileResponse> response = authController.signUp(signInRequest);

            assertEquals(host.getEmail(), response.getBody().getEmail());
        }

        @Test
        @DisplayName("Should propagate an invalid token")
        void signIn_InvalidToken() {
            when(identityVerifier.verify("firebase-token")).thenThrow(new InvalidCredentialException("Token expired"));

            assertThrows(InvalidCredentialException.class, () -> authController.signIn(signInRequest));
            verifyNoInteractions(actorResolver);
        }

        @Test
        @DisplayName("Sign-out is a stateless acknowledgement")
        void signOut_Ok() {
            assertEquals(HttpStatus.OK, authController.signOut().getStatusCode());
        }
    }

    @Nested
    @DisplayName("POST /admin/auth/signin")
    class AdminSignInTests {

        @Test
        @DisplayName("Should admit allow-listed admins")
        void adminSignIn_Success() {
            Actor admin = new Actor(host, true);
            when(identityVerifier.verify("firebase-token")).thenReturn(identity);
            when(actorResolver.resolve(identity)).thenReturn(admin);

            ResponseEntity<ProfileResponse> response = adminAuthController.signIn(signInRequest);

            assertTrue(response.getBody().isAdmin());
            verify(authorizationGuard).requireAdmin(admin);
        }

        @Test
        @DisplayName("Should refuse hosts that are not on the allow-list")
        void adminSignIn_NotAdmin() {
            Actor actor = new Actor(host, false);
            when(identityVerifier.verify("firebase-token")).thenReturn(identity);
            when(actorResolver.resolve(identity)).thenReturn(actor);
            doThrow(new AccessDeniedException(DenyReason.ADMIN_REQUIRED, "Admin required"))
                .when(authorizationGuard).requireAdmin(actor);

            AccessDeniedException thrown = assertThrows(AccessDeniedException.class,
                () -> adminAuthController.signIn(signInRequest));
            assertEquals(DenyReason.ADMIN_REQUIRED, thrown.getReason());
        }
    }
}
