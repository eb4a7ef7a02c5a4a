package com.latchkey.backend.global.security;

import java.io.IOException;

import com.latchkey.backend.global.error.ProblemResponse;

import com.fasterxml.jackson.databind.ObjectMapper;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.web.access.AccessDeniedHandler;
import org.springframework.security.web.csrf.CsrfException;
import org.springframework.stereotype.Component;

@Component
public class RestAccessDeniedHandler implements AccessDeniedHandler {

    static final String INVALID_CSRF_TOKEN = "INVALID_CSRF_TOKEN";
    static final String ACCESS_DENIED = "ACCESS_DENIED";

    private final ObjectMapper objectMapper;

    public RestAccessDeniedHandler(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public void handle(HttpServletRequest request, HttpServletResponse response, AccessDeniedException accessDeniedException)
            throws IOException {
        ProblemResponse body = accessDeniedException instanceof CsrfException
                ? ProblemResponse.of(HttpStatus.FORBIDDEN, INVALID_CSRF_TOKEN, "Missing or invalid CSRF token.", request.getRequestURI())
                : ProblemResponse.of(HttpStatus.FORBIDDEN, ACCESS_DENIED, "Access denied.", request.getRequestURI());

        response.setStatus(HttpStatus.FORBIDDEN.value());
        response.setContentType(MediaType.APPLICATION_PROBLEM_JSON_VALUE);
        response.getWriter().write(objectMapper.writeValueAsString(body));
    }
}
