package com.browserswarm.pool;

import com.browserswarm.config.SwarmProperties;
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
import static org.springframework.test.web.client.response.MockRestResponseCreators.withException;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class RestClientWorkerTransportTest {

    private MockRestServiceServer server;
    private RestClientWorkerTransport transport;
    private final WorkerEndpoint endpoint = WorkerEndpoint.forWorker(2, new SwarmProperties.Pool());

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        transport = new RestClientWorkerTransport(builder.build());
    }

    @Test
    void testProbeReturnsStatusCode() {
        server.expect(requestTo("http://worker-2:8000/health"))
                .andExpect(method(HttpMethod.GET))
                .andRespond(withStatus(HttpStatus.SERVICE_UNAVAILABLE));

        assertEquals(503, transport.probe(endpoint));
        server.verify();
    }

    @Test
    void testExecutePostsInstruction() {
        server.expect(requestTo("http://worker-2:8000/execute"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.instruction").value("Find Stripe's valuation"))
                .andRespond(withSuccess("{\"response\":\"$50B\",\"status\":\"success\"}", MediaType.APPLICATION_JSON));

        WorkerResponse response = transport.execute(endpoint, "Find Stripe's valuation");

        assertTrue(response.isOk());
        assertEquals("$50B", response.responseText());
        assertEquals("success", response.status());
    }

    @Test
    void testExecuteReturnsNonOkWithoutThrowing() {
        server.expect(requestTo("http://worker-2:8000/execute"))
                .andRespond(withStatus(HttpStatus.CONFLICT).body("{\"response\":\"busy\",\"status\":\"error\"}")
                        .contentType(MediaType.APPLICATION_JSON));

        WorkerResponse response = transport.execute(endpoint, "anything");

        assertEquals(409, response.statusCode());
        assertFalse(response.isOk());
    }

    @Test
    void testIoFailureBecomesTransportException() {
        server.expect(requestTo("http://worker-2:8000/health"))
                .andRespond(withException(new java.net.ConnectException("Connection refused")));

        assertThrows(WorkerTransportException.class, () -> transport.probe(endpoint));
    }

    @Test
    void testClosedTransportRejectsCalls() {
        transport.close();
        assertThrows(WorkerTransportException.class, () -> transport.probe(endpoint));
    }
}
