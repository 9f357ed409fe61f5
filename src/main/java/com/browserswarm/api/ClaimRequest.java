package com.browserswarm.api;

import com.fasterxml.jackson.annotation.JsonAlias;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

public record ClaimRequest(
        @NotNull @Positive @JsonAlias("agent_id") Integer agentId,
        @NotBlank @JsonAlias("item") String label
) {
}
