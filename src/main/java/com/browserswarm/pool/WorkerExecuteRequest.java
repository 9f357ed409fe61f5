package com.browserswarm.pool;

import com.fasterxml.jackson.annotation.JsonAlias;
import jakarta.validation.constraints.NotBlank;

public record WorkerExecuteRequest(
        @NotBlank @JsonAlias("prompt") String instruction
) {
}
