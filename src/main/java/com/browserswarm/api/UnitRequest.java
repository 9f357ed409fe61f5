package com.browserswarm.api;

import jakarta.validation.constraints.NotBlank;

public record UnitRequest(
        String label,
        @NotBlank String instruction
) {
}
