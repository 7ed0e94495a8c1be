package com.strata.hierarchy.infrastructure.security;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.strata.hierarchy.api.dto.ErrorResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.oauth2.server.resource.web.BearerTokenAuthenticationEntryPoint;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.security.web.access.AccessDeniedHandler;
import org.springframework.stereotype.Component;

/**
 * Writes the failure envelope for requests the security filter chain rejects, before any
 * controller runs. The {@code WWW-Authenticate} header is still set the standard way.
 */
@Component
public class JsonSecurityErrorHandler implements AuthenticationEntryPoint, AccessDeniedHandler {

    private static final Logger log = LoggerFactory.getLogger(JsonSecurityErrorHandler.class);

    private final ObjectMapper objectMapper;
    private final BearerTokenAuthenticationEntryPoint bearer =
            new BearerTokenAuthenticationEntryPoint();

    public JsonSecurityErrorHandler(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public void commence(
            HttpServletRequest request,
            HttpServletResponse response,
            AuthenticationException authException)
            throws IOException {
        log.debug(
                "Unauthenticated request to {}: {}",
                request.getRequestURI(),
                authException.getMessage());
        bearer.commence(request, response, authException);
        write(
                response,
                HttpServletResponse.SC_UNAUTHORIZED,
                ErrorResponse.of("unauthenticated", "Authentication required"));
    }

    @Override
    public void handle(
            HttpServletRequest request,
            HttpServletResponse response,
            AccessDeniedException accessDeniedException)
            throws IOException {
        log.debug("Access denied to {}", request.getRequestURI());
        write(
                response,
                HttpServletResponse.SC_FORBIDDEN,
                ErrorResponse.of("forbidden", "Access denied"));
    }

    private void write(HttpServletResponse response, int status, ErrorResponse body)
            throws IOException {
        response.setStatus(status);
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        objectMapper.writeValue(response.getOutputStream(), body);
    }
}
