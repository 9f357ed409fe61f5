package com.browserswarm.api;

import com.fasterxml.jackson.annotation.JsonAlias;
import jakarta.validation.constraints.NotBlank;

public record SwarmExecuteRequest(
        @NotBlank @JsonAlias({"prompt", "message"}) String instruction
) {
}
