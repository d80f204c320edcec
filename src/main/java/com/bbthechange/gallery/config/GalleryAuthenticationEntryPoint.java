package com.bbthechange.gallery.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

@Component
public class GalleryAuthenticationEntryPoint implements AuthenticationEntryPoint {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Override
    public void commence(HttpServletRequest request, HttpServletResponse response,
                         AuthenticationException authException) throws IOException {

        Object authError = request.getAttribute(FirebaseAuthenticationFilter.AUTH_ERROR_ATTRIBUTE);

        Map<String, Object> errorResponse = new LinkedHashMap<>();
        if (FirebaseAuthenticationFilter.PROVIDER_UNAVAILABLE.equals(authError)) {
            response.setStatus(HttpServletResponse.SC_SERVICE_UNAVAILABLE);
            errorResponse.put("error", FirebaseAuthenticationFilter.PROVIDER_UNAVAILABLE);
            errorResponse.put("message", "Identity provider is temporarily unavailable");
        } else if (FirebaseAuthenticationFilter.INVALID_CREDENTIAL.equals(authError)) {
            response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
            errorResponse.put("error", FirebaseAuthenticationFilter.INVALID_CREDENTIAL);
            errorResponse.put("message", "Invalid or expired credential");
        } else {
            response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
            errorResponse.put("error", "AUTHENTICATION_REQUIRED");
            errorResponse.put("message", "Authentication required");
        }
        errorResponse.put("timestamp", System.currentTimeMillis());

        response.setContentType("application/json;charset=UTF-8");
        response.getWriter().write(objectMapper.writeValueAsString(errorResponse));
    }
}
