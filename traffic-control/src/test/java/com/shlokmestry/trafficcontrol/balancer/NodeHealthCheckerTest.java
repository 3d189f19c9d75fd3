package com.shlokmestry.trafficcontrol.balancer;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.client.RestClient;

import com.shlokmestry.trafficcontrol.MutableClock;
import com.shlokmestry.trafficcontrol.observability.TrafficMetrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

class NodeHealthCheckerTest {

    private final Set<String> down = new HashSet<>();
    private final List<String> requested = new ArrayList<>();

    private MutableClock clock;
    private LoadBalancer balancer;
    private NodeHealthChecker checker;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        balancer = new LoadBalancer(clock, new TrafficMetrics(new SimpleMeterRegistry()));
        BalancerProperties properties = new BalancerProperties("round_robin",
                new BalancerProperties.HealthCheck(true, "/health", Duration.ofSeconds(5), 3));
        NodeHealthClient client = url -> {
            requested.add(url);
            return down.stream().noneMatch(url::startsWith);
        };
        checker = new NodeHealthChecker(balancer, client, properties);

        balancer.addNode("a", "http://a:8000/");
        balancer.addNode("b", "http://b:8000");
    }

    @Test
    void checksHealthPathOfEveryNode() {
        checker.checkAll();

        assertThat(requested).containsExactly("http://a:8000/health", "http://b:8000/health");
        assertThat(balancer.getNodeStatus().get("a").lastCheck()).isEqualTo(clock.instant());
    }

    @Test
    void failedCheckMarksNodeUnhealthy_andRecoveryClearsIt() {
        down.add("http://b:8000");

        checker.checkAll();
        assertThat(balancer.getNode("b").orElseThrow().healthy()).isFalse();
        assertThat(balancer.getNextNode(LoadBalancingStrategy.ROUND_ROBIN).orElseThrow().id()).isEqualTo("a");

        down.clear();
        checker.checkAll();
        assertThat(balancer.getNode("b").orElseThrow().healthy()).isTrue();
        assertThat(checker.failures("b")).isZero();
    }

    @Test
    void countsConsecutiveFailures() {
        down.add("http://b:8000");

        for (int i = 0; i < 4; i++) {
            checker.checkAll();
        }

        assertThat(checker.failures("b")).isEqualTo(4);
        assertThat(checker.failures("a")).isZero();
    }

    @Test
    void checkerErrorOnOneNode_doesNotStopTheRest() {
        BalancerProperties properties = new BalancerProperties("round_robin",
                new BalancerProperties.HealthCheck(true, "/health", Duration.ofSeconds(5), 3));
        NodeHealthClient failing = url -> {
            if (url.startsWith("http://a")) {
                throw new IllegalArgumentException("URI is not absolute");
            }
            return true;
        };
        NodeHealthChecker checker = new NodeHealthChecker(balancer, failing, properties);

        checker.checkAll();

        assertThat(balancer.getNode("a").orElseThrow().healthy()).isFalse();
        assertThat(checker.failures("a")).isEqualTo(1);
        assertThat(balancer.getNodeStatus().get("b").lastCheck()).isEqualTo(clock.instant());
        assertThat(balancer.getNode("b").orElseThrow().healthy()).isTrue();
    }

    @Test
    void httpCheck_treatsUrlWithoutSchemeAsUnhealthy() {
        BalancerProperties properties = new BalancerProperties("round_robin",
                new BalancerProperties.HealthCheck(true, "/health", Duration.ofMillis(200), 3));
        HttpNodeHealthClient http = new HttpNodeHealthClient(RestClient.builder(), properties);

        assertThat(http.isHealthy("backend-1/health")).isFalse();
    }

    @Test
    void forgetsNodesThatWereDeregistered() {
        down.add("http://b:8000");
        checker.checkAll();

        balancer.removeNode("b");
        checker.checkAll();

        assertThat(checker.failures("b")).isZero();
    }
}
