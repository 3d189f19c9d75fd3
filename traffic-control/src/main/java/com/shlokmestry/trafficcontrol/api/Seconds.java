package com.shlokmestry.trafficcontrol.api;

import java.time.Duration;

/**
 * Response times travel over the API as fractional seconds.
 */
final class Seconds {

    private Seconds() {}

    static double of(Duration duration) {
        return duration.toNanos() / 1_000_000_000.0;
    }

    static Duration toDuration(double seconds) {
        return Duration.ofNanos(Math.round(seconds * 1_000_000_000.0));
    }
}
