package com.browserswarm.api;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;

import java.util.List;

public record UnitBatchRequest(
        @NotEmpty List<@Valid UnitRequest> units
) {
}
