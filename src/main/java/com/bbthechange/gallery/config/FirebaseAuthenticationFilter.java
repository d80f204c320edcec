package com.bbthechange.gallery.config;

import com.bbthechange.gallery.exception.IdentityProviderUnavailableException;
import com.bbthechange.gallery.exception.InvalidCredentialException;
import com.bbthechange.gallery.security.Actor;
import com.bbthechange.gallery.security.VerifiedIdentity;
import com.bbthechange.gallery.service.ActorResolver;
import com.bbthechange.gallery.service.IdentityVerifier;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns a bearer identity token into an {@link Actor} for the rest of the request.
 * Failures leave the request unauthenticated and record the reason for the entry point.
 */
@Component
public class FirebaseAuthenticationFilter extends OncePerRequestFilter {

    private static final Logger logger = LoggerFactory.getLogger(FirebaseAuthenticationFilter.class);

    public static final String AUTH_ERROR_ATTRIBUTE = "authError";
    public static final String INVALID_CREDENTIAL = "INVALID_CREDENTIAL";
    public static final String PROVIDER_UNAVAILABLE = "IDENTITY_PROVIDER_UNAVAILABLE";

    private final IdentityVerifier identityVerifier;
    private final ActorResolver actorResolver;

    @Autowired
    public FirebaseAuthenticationFilter(IdentityVerifier identityVerifier, ActorResolver actorResolver) {
        this.identityVerifier = identityVerifier;
        this.actorResolver = actorResolver;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String path = request.getRequestURI();
        // Sign-in endpoints carry the token in the body; public endpoints are anonymous
        return path.startsWith("/auth/") || path.startsWith("/admin/auth/") || path.startsWith("/public/");
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String authHeader = request.getHeader("Authorization");
        if (authHeader != null && authHeader.startsWith("Bearer ")) {
            String token = authHeader.substring(7).trim();
            try {
                VerifiedIdentity identity = identityVerifier.verify(token);
                Actor actor = actorResolver.resolve(identity);

                UsernamePasswordAuthenticationToken authentication =
                    new UsernamePasswordAuthenticationToken(actor, null, authoritiesFor(actor));
                SecurityContextHolder.getContext().setAuthentication(authentication);
                request.setAttribute(Actor.REQUEST_ATTRIBUTE, actor);

            } catch (InvalidCredentialException e) {
                logger.warn("Rejected identity token for {} {}: {}", request.getMethod(), request.getRequestURI(), e.getMessage());
                request.setAttribute(AUTH_ERROR_ATTRIBUTE, INVALID_CREDENTIAL);
            } catch (IdentityProviderUnavailableException e) {
                logger.error("Identity provider unavailable for {} {}", request.getMethod(), request.getRequestURI(), e);
                request.setAttribute(AUTH_ERROR_ATTRIBUTE, PROVIDER_UNAVAILABLE);
            }
        }

        filterChain.doFilter(request, response);
    }

    private static List<GrantedAuthority> authoritiesFor(Actor actor) {
        List<GrantedAuthority> authorities = new ArrayList<>();
        if (actor.getHost() != null) {
            authorities.add(new SimpleGrantedAuthority("ROLE_HOST"));
        }
        if (actor.isAdmin()) {
            authorities.add(new SimpleGrantedAuthority("ROLE_ADMIN"));
        }
        return authorities;
    }
}
