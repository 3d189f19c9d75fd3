package com.shlokmestry.trafficcontrol.api;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;

public record ReportMetricsRequest(
        @NotNull @DecimalMin("0.0") Double responseTimeSeconds
) {}
