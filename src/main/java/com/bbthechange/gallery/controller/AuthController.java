package com.bbthechange.gallery.controller;

import com.bbthechange.gallery.dto.ProfileResponse;
import com.bbthechange.gallery.dto.SignInRequest;
import com.bbthechange.gallery.security.Actor;
import com.bbthechange.gallery.service.ActorResolver;
import com.bbthechange.gallery.service.IdentityVerifier;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Sign-in with an identity-provider token. Sign-up and sign-in behave the same: the host
 * record is created the first time a subject is seen.
 */
@RestController
@RequestMapping("/auth")
@Tag(name = "Authentication", description = "Host sign-in with an identity provider token")
public class AuthController extends BaseController {

    private static final Logger logger = LoggerFactory.getLogger(AuthController.class);

    private final IdentityVerifier identityVerifier;
    private final ActorResolver actorResolver;

    @Autowired
    public AuthController(IdentityVerifier identityVerifier, ActorResolver actorResolver) {
        this.identityVerifier = identityVerifier;
        this.actorResolver = actorResolver;
    }

    @PostMapping("/signup")
    @Operation(summary = "Sign up", description = "Creates the host account for a verified identity if it does not exist yet")
    public ResponseEntity<ProfileResponse> signUp(@Valid @RequestBody SignInRequest request) {
        return ResponseEntity.ok(signIn(request.getToken()));
    }

    @PostMapping("/signin")
    @Operation(summary = "Sign in", description = "Verifies the identity token and returns the host profile")
    public ResponseEntity<ProfileResponse> signIn(@Valid @RequestBody SignInRequest request) {
        return ResponseEntity.ok(signIn(request.getToken()));
    }

    @PostMapping("/signout")
    @Operation(summary = "Sign out", description = "Stateless acknowledgement; the client discards its token")
    public ResponseEntity<Map<String, String>> signOut() {
        return ResponseEntity.ok(Map.of("message", "Signed out"));
    }

    private ProfileResponse signIn(String token) {
        Actor actor = actorResolver.resolve(identityVerifier.verify(token));
        logger.info("Host {} signed in", actor.getHostId());
        return new ProfileResponse(actor);
    }
}
