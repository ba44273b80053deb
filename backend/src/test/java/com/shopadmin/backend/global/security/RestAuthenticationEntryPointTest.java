package com.shopadmin.backend.global.security;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.security.authentication.BadCredentialsException;
import org.springframework.security.authentication.InsufficientAuthenticationException;

class RestAuthenticationEntryPointTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final RestAuthenticationEntryPoint entryPoint =
            new RestAuthenticationEntryPoint(new ProblemResponseWriter(objectMapper));

    @Test
    void missingCredentialsYieldUnauthorizedCode() throws Exception {
        MockHttpServletResponse response = new MockHttpServletResponse();

        entryPoint.commence(new MockHttpServletRequest("GET", "/admin/roles"), response,
                new InsufficientAuthenticationException("Full authentication is required"));

        JsonNode body = objectMapper.readTree(response.getContentAsString());
        assertThat(response.getStatus()).isEqualTo(401);
        assertThat(response.getContentType()).isEqualTo("application/problem+json");
        assertThat(body.path("code").asText()).isEqualTo("unauthorized");
        assertThat(body.path("instance").asText()).isEqualTo("/admin/roles");
    }

    @Test
    void rejectedTokenIsDistinguishedFromMissingOne() throws Exception {
        MockHttpServletResponse response = new MockHttpServletResponse();

        entryPoint.commence(new MockHttpServletRequest("GET", "/admin/roles"), response,
                new BadCredentialsException("Invalid access token"));

        JsonNode body = objectMapper.readTree(response.getContentAsString());
        assertThat(response.getStatus()).isEqualTo(401);
        assertThat(body.path("code").asText()).isEqualTo("token.invalid");
        assertThat(body.path("detail").asText()).isEqualTo("Access token is invalid or expired");
    }
}
