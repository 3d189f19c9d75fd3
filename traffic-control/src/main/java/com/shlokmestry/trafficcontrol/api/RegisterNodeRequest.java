package com.shlokmestry.trafficcontrol.api;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

public record RegisterNodeRequest(
        @NotBlank
        @Pattern(regexp = "^https?://\\S+$", message = "must be an absolute http(s) url")
        String url,             // e.g. http://10.0.0.12:8000
        Integer weight          // clamped to [1, 10]; defaults to 1
) {}
