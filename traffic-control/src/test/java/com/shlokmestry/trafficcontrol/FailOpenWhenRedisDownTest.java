package com.shlokmestry.trafficcontrol;

import static org.assertj.core.api.Assertions.assertThat;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;

import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.http.HttpHeaders;
import org.springframework.test.context.TestPropertySource;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@TestPropertySource(properties = {
        // Redis is unreachable, so the limiter has to fall back to local counting
        "spring.data.redis.host=127.0.0.1",
        "spring.data.redis.port=6390",
        "traffic.balancer.health-check.enabled=false"
})
class FailOpenWhenRedisDownTest {

    @LocalServerPort
    int port;

    private final HttpClient http = HttpClient.newHttpClient();

    private HttpResponse<String> getProducts() throws Exception {
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create("http://localhost:" + port + "/api/products"))
                .header(HttpHeaders.USER_AGENT, "Mozilla/5.0 (X11; Linux x86_64)")
                .header(HttpHeaders.ACCEPT, "application/json")
                .GET()
                .build();
        return http.send(req, HttpResponse.BodyHandlers.ofString());
    }

    @Test
    void requestsAreAdmittedUpToQuota_thenRejectedWith429_whenRedisUnavailable() throws Exception {
        // 60 is the default quota; an unaligned window could split the run, so allow one restart.
        // No product routes live here, so an admitted request ends in 404.
        int admitted = 0;
        HttpResponse<String> resp = getProducts();
        while (resp.statusCode() != 429 && admitted < 200) {
            assertThat(resp.statusCode()).isEqualTo(404);
            admitted++;
            resp = getProducts();
        }

        assertThat(admitted).isBetween(60, 120);
        assertThat(resp.statusCode()).isEqualTo(429);
        assertThat(resp.headers().firstValue(HttpHeaders.RETRY_AFTER)).contains("60");
        assertThat(resp.headers().firstValue("X-RateLimit-Limit")).contains("60");
        assertThat(resp.headers().firstValue("X-RateLimit-Reset")).isPresent();
        assertThat(resp.body()).contains("Too many requests");
    }
}
