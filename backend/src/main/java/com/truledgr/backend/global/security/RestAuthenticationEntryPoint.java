package com.truledgr.backend.global.security;

import java.io.IOException;

import com.truledgr.backend.global.error.ProblemResponse;
import com.truledgr.backend.modules.auth.application.AuthFailure;

import com.fasterxml.jackson.databind.ObjectMapper;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.springframework.http.MediaType;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.stereotype.Component;

/**
 * Every authentication failure gets the same body, whatever the underlying cause.
 */
@Component
public class RestAuthenticationEntryPoint implements AuthenticationEntryPoint {

    private final ObjectMapper objectMapper;

    public RestAuthenticationEntryPoint(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public void commence(HttpServletRequest request, HttpServletResponse response, AuthenticationException authException)
            throws IOException {
        AuthFailure failure = AuthFailure.UNAUTHORIZED;
        ProblemResponse body = ProblemResponse.of(failure.status(), failure.name(), failure.message(), request.getRequestURI());

        response.setStatus(failure.status().value());
        response.setContentType(MediaType.APPLICATION_PROBLEM_JSON_VALUE);
        response.getWriter().write(objectMapper.writeValueAsString(body));
    }
}
