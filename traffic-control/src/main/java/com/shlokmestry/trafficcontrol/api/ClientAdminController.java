package com.shlokmestry.trafficcontrol.api;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.shlokmestry.trafficcontrol.ratelimit.AdaptiveRateLimiter;

import jakarta.validation.constraints.NotBlank;

@RestController
@RequestMapping("/v1/admin/clients")
public class ClientAdminController {

    private final AdaptiveRateLimiter limiter;

    public ClientAdminController(AdaptiveRateLimiter limiter) {
        this.limiter = limiter;
    }

    @GetMapping("/{ip}")
    public ClientStatusResponse get(@PathVariable @NotBlank String ip) {
        return new ClientStatusResponse(ip, limiter.isBlocked(ip), limiter.suspicionScore(ip));
    }

    @DeleteMapping("/{ip}/block")
    public ResponseEntity<Void> unblock(@PathVariable @NotBlank String ip) {
        limiter.unblock(ip);
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping("/{ip}/suspicion")
    public ResponseEntity<Void> resetSuspicion(@PathVariable @NotBlank String ip) {
        limiter.resetSuspicion(ip);
        return ResponseEntity.noContent().build();
    }
}
