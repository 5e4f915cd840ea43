package com.civicintake.authservice.infrastructure.ratelimit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.civicintake.authservice.infrastructure.metrics.AuthMetrics;
import io.micrometer.core.instrument.MeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.request.MockHttpServletRequestBuilder;

/**
 * Tests for the rate limit on the credential-issuing endpoints, with a budget of three requests
 * per client address.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@TestPropertySource(properties = "civic.auth.rate-limit.max-requests=3")
@DisplayName("Credential endpoint rate limit")
class CredentialEndpointRateLimitTest {

    @Autowired private MockMvc mockMvc;
    @Autowired private MeterRegistry meterRegistry;

    private static MockHttpServletRequestBuilder login(String clientAddress) {
        return post("/api/auth/login")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"email\": \"nobody@example.org\", \"password\": \"wrong-password\"}")
                .with(request -> {
                    request.setRemoteAddr(clientAddress);
                    return request;
                });
    }

    @Test
    @DisplayName("the request after the budget is answered with 429 and Retry-After")
    void fourthRequestIsLimited() throws Exception {
        for (int i = 0; i < 3; i++) {
            mockMvc.perform(login("203.0.113.10")).andExpect(status().isUnauthorized());
        }

        mockMvc.perform(login("203.0.113.10"))
                .andExpect(status().isTooManyRequests())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error").value("RATE_LIMITED"))
                .andExpect(header().exists(HttpHeaders.RETRY_AFTER));

        var counter = meterRegistry.find(AuthMetrics.RATE_LIMITED).counter();
        assertThat(counter).isNotNull();
        assertThat(counter.count()).isGreaterThanOrEqualTo(1.0);
    }

    @Test
    @DisplayName("other client addresses keep their own budget")
    void addressesAreIndependent() throws Exception {
        for (int i = 0; i < 4; i++) {
            mockMvc.perform(login("203.0.113.20"));
        }

        mockMvc.perform(login("203.0.113.21")).andExpect(status().isUnauthorized());
    }

    @Test
    @DisplayName("login, signup and refresh share one budget")
    void endpointsShareBudget() throws Exception {
        String client = "203.0.113.30";
        mockMvc.perform(login(client)).andExpect(status().isUnauthorized());
        mockMvc.perform(post("/api/auth/refresh").with(request -> {
            request.setRemoteAddr(client);
            return request;
        })).andExpect(status().isUnauthorized());
        mockMvc.perform(post("/api/auth/signup")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}")
                        .with(request -> {
                            request.setRemoteAddr(client);
                            return request;
                        }))
                .andExpect(status().isBadRequest());

        mockMvc.perform(login(client)).andExpect(status().isTooManyRequests());
    }

    @Test
    @DisplayName("other endpoints are not limited")
    void otherEndpointsUnlimited() throws Exception {
        for (int i = 0; i < 5; i++) {
            mockMvc.perform(get("/api/v1/info").with(request -> {
                request.setRemoteAddr("203.0.113.40");
                return request;
            })).andExpect(status().isOk());
        }
    }
}
