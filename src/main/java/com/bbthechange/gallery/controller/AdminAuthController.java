package com.bbthechange.gallery.controller;

import com.bbthechange.gallery.dto.ProfileResponse;
import com.bbthechange.gallery.dto.SignInRequest;
import com.bbthechange.gallery.security.Actor;
import com.bbthechange.gallery.service.ActorResolver;
import com.bbthechange.gallery.service.AuthorizationGuard;
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

@RestController
@RequestMapping("/admin/auth")
@Tag(name = "Admin Authentication", description = "Administrator sign-in")
public class AdminAuthController extends BaseController {

    private static final Logger logger = LoggerFactory.getLogger(AdminAuthController.class);

    private final IdentityVerifier identityVerifier;
    private final ActorResolver actorResolver;
    private final AuthorizationGuard authorizationGuard;

    @Autowired
    public AdminAuthController(IdentityVerifier identityVerifier, ActorResolver actorResolver,
                               AuthorizationGuard authorizationGuard) {
        this.identityVerifier = identityVerifier;
        this.actorResolver = actorResolver;
        this.authorizationGuard = authorizationGuard;
    }

    @PostMapping("/signin")
    @Operation(summary = "Admin sign in", description = "Succeeds only for e-mails on the admin allow-list")
    public ResponseEntity<ProfileResponse> signIn(@Valid @RequestBody SignInRequest request) {
        Actor actor = actorResolver.resolve(identityVerifier.verify(request.getToken()));
        authorizationGuard.requireAdmin(actor);
        logger.info("Admin {} signed in", actor.getEmail());
        return ResponseEntity.ok(new ProfileResponse(actor));
    }
}
