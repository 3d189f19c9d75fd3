package com.shlokmestry.trafficcontrol.api;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;

public record UpdateNodeStatusRequest(
        Boolean healthy,
        @DecimalMin("0.0") Double responseTimeSeconds,
        @Min(0) Integer connections
) {}
