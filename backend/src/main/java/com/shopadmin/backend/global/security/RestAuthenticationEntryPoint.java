package com.shopadmin.backend.global.security;

import java.io.IOException;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.springframework.http.HttpStatus;
import org.springframework.security.authentication.BadCredentialsException;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.stereotype.Component;

/**
 * 401 for requests without a usable actor. A missing token and a rejected token get distinct codes so
 * clients know whether to log in or to drop a stale token.
 */
@Component
public class RestAuthenticationEntryPoint implements AuthenticationEntryPoint {

    static final String CODE_UNAUTHORIZED = "unauthorized";
    static final String CODE_INVALID_TOKEN = "token.invalid";

    private final ProblemResponseWriter problemResponseWriter;

    public RestAuthenticationEntryPoint(ProblemResponseWriter problemResponseWriter) {
        this.problemResponseWriter = problemResponseWriter;
    }

    @Override
    public void commence(HttpServletRequest request, HttpServletResponse response, AuthenticationException authException)
            throws IOException {
        if (authException instanceof BadCredentialsException) {
            problemResponseWriter.write(request, response, HttpStatus.UNAUTHORIZED, CODE_INVALID_TOKEN,
                    "Access token is invalid or expired");
            return;
        }
        problemResponseWriter.write(request, response, HttpStatus.UNAUTHORIZED, CODE_UNAUTHORIZED,
                "Authentication is required");
    }
}
