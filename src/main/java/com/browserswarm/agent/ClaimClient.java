package com.browserswarm.agent;

import com.browserswarm.api.ClaimRequest;
import com.browserswarm.api.ClaimResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * Posts claims from this worker's agent to the coordinator.
 */
@Slf4j
public class ClaimClient {

    private final RestClient restClient;
    private final String claimUrl;

    public ClaimClient(RestClient restClient, String coordinatorUrl) {
        this.restClient = restClient;
        String base = coordinatorUrl.endsWith("/") ? coordinatorUrl.substring(0, coordinatorUrl.length() - 1) : coordinatorUrl;
        this.claimUrl = base + "/api/swarm/claim";
    }

    public ClaimDecision claim(int agentId, String label) {
        try {
            ClaimResponse response = restClient.post()
                    .uri(claimUrl)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(new ClaimRequest(agentId, label))
                    .retrieve()
                    .body(ClaimResponse.class);
            boolean approved = response != null && response.approved();
            log.info("Claim for '{}' {}.", label, approved ? "approved" : "rejected");
            return new ClaimDecision(approved, true);
        } catch (RestClientException ex) {
            log.warn("Coordinator unreachable for claim '{}': {}", label, ex.getMessage());
            return ClaimDecision.unreachable();
        }
    }
}
