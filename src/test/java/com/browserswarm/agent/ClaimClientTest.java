package com.browserswarm.agent;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class ClaimClientTest {

    private MockRestServiceServer server;
    private ClaimClient client;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        client = new ClaimClient(builder.build(), "http://orchestrator:8100/");
    }

    @Test
    void testApprovedClaim() {
        server.expect(requestTo("http://orchestrator:8100/api/swarm/claim"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.agentId").value(3))
                .andExpect(jsonPath("$.label").value("Stripe"))
                .andRespond(withSuccess("{\"approved\":true,\"label\":\"Stripe\"}", MediaType.APPLICATION_JSON));

        ClaimDecision decision = client.claim(3, "Stripe");

        assertTrue(decision.approved());
        assertTrue(decision.reachable());
    }

    @Test
    void testRejectedClaim() {
        server.expect(requestTo("http://orchestrator:8100/api/swarm/claim"))
                .andRespond(withSuccess("{\"approved\":false,\"label\":\"Stripe\"}", MediaType.APPLICATION_JSON));

        ClaimDecision decision = client.claim(3, "Stripe");

        assertFalse(decision.approved());
        assertTrue(decision.reachable());
    }

    @Test
    void testCoordinatorDown() {
        server.expect(requestTo("http://orchestrator:8100/api/swarm/claim"))
                .andRespond(withStatus(HttpStatus.SERVICE_UNAVAILABLE));

        ClaimDecision decision = client.claim(3, "Stripe");

        assertFalse(decision.reachable());
    }
}
