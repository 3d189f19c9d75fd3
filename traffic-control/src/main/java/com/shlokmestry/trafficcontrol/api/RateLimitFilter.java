package com.shlokmestry.trafficcontrol.api;

import java.io.IOException;
import java.time.Clock;
import java.util.Collections;
import java.util.List;

import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.AntPathMatcher;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.util.UrlPathHelper;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.shlokmestry.trafficcontrol.ratelimit.AdaptiveRateLimiter;
import com.shlokmestry.trafficcontrol.ratelimit.InboundRequest;
import com.shlokmestry.trafficcontrol.ratelimit.RateLimitDecision;
import com.shlokmestry.trafficcontrol.ratelimit.RateLimitProperties;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

@Component
public class RateLimitFilter extends OncePerRequestFilter {

    private static final long RETRY_AFTER_SECONDS = 60;
    private static final UrlPathHelper PATH_HELPER = new UrlPathHelper();

    private final AdaptiveRateLimiter limiter;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final List<String> excludedPaths;
    private final AntPathMatcher pathMatcher = new AntPathMatcher();

    public RateLimitFilter(
            AdaptiveRateLimiter limiter,
            ObjectMapper objectMapper,
            Clock clock,
            RateLimitProperties properties
    ) {
        this.limiter = limiter;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.excludedPaths = properties.excludedPaths();
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String path = normalizedPath(request);
        return excludedPaths.stream().anyMatch(pattern -> pathMatcher.match(pattern, path));
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {
        RateLimitDecision decision = limiter.decide(toInboundRequest(request), clock.instant());
        if (!decision.limited()) {
            chain.doFilter(request, response);
            return;
        }

        response.setStatus(HttpStatus.TOO_MANY_REQUESTS.value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setHeader(HttpHeaders.RETRY_AFTER, String.valueOf(RETRY_AFTER_SECONDS));
        response.setHeader("X-RateLimit-Limit", String.valueOf(decision.quota()));
        response.setHeader("X-RateLimit-Reset", String.valueOf(clock.instant().getEpochSecond() + RETRY_AFTER_SECONDS));
        objectMapper.writeValue(response.getOutputStream(),
                new ErrorBody("Too many requests", "Rate limit exceeded. Please try again later."));
    }

    // Decoded, without context path, ";params" or a trailing slash, so variants share one quota.
    static String normalizedPath(HttpServletRequest request) {
        String path = PATH_HELPER.getPathWithinApplication(request);
        while (path.length() > 1 && path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }
        return path.isEmpty() ? "/" : path;
    }

    private static InboundRequest toInboundRequest(HttpServletRequest request) {
        HttpHeaders headers = new HttpHeaders();
        for (String name : Collections.list(request.getHeaderNames())) {
            headers.addAll(name, Collections.list(request.getHeaders(name)));
        }
        return new InboundRequest(request.getRemoteAddr(), normalizedPath(request), request.getMethod(), headers);
    }
}
