package com.shlokmestry.trafficcontrol.api;

import java.util.LinkedHashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import com.shlokmestry.trafficcontrol.balancer.BalancerProperties;
import com.shlokmestry.trafficcontrol.balancer.LoadBalancer;
import com.shlokmestry.trafficcontrol.balancer.NodeStatusUpdate;
import com.shlokmestry.trafficcontrol.balancer.ServiceNode;
import com.shlokmestry.trafficcontrol.balancer.UnsupportedStrategyException;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;

@RestController
@RequestMapping("/v1/nodes")
public class NodeController {

    private static final Logger log = LoggerFactory.getLogger(NodeController.class);

    private final LoadBalancer balancer;
    private final BalancerProperties properties;

    public NodeController(LoadBalancer balancer, BalancerProperties properties) {
        this.balancer = balancer;
        this.properties = properties;
    }

    @PutMapping("/{nodeId}")
    @ResponseStatus(HttpStatus.OK)
    public NodeResponse register(
            @PathVariable @NotBlank String nodeId,
            @Valid @RequestBody RegisterNodeRequest req
    ) {
        balancer.addNode(nodeId, req.url(), req.weight() == null ? 1 : req.weight());
        return balancer.getNode(nodeId)
                .map(NodeResponse::from)
                .orElseThrow(() -> new NodeNotFoundException(nodeId));
    }

    @DeleteMapping("/{nodeId}")
    public ResponseEntity<Void> deregister(@PathVariable @NotBlank String nodeId) {
        if (!balancer.removeNode(nodeId)) {
            throw new NodeNotFoundException(nodeId);
        }
        return ResponseEntity.noContent().build();
    }

    @GetMapping
    public Map<String, NodeStatusResponse> status() {
        Map<String, NodeStatusResponse> body = new LinkedHashMap<>();
        balancer.getNodeStatus().forEach((id, status) -> body.put(id, NodeStatusResponse.from(status)));
        return body;
    }

    @GetMapping("/next")
    public ResponseEntity<?> next(@RequestParam(required = false) String strategy) {
        String name = strategy == null ? properties.defaultStrategy() : strategy;
        ServiceNode node = balancer.getNextNode(name).orElse(null);
        if (node == null) {
            log.warn("balancer no_healthy_node strategy={}", name);
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(new ErrorBody("service_unavailable", "No healthy node available"));
        }
        return ResponseEntity.ok(NodeResponse.from(node));
    }

    @PostMapping("/{nodeId}/metrics")
    public ResponseEntity<Void> reportMetrics(
            @PathVariable @NotBlank String nodeId,
            @Valid @RequestBody ReportMetricsRequest req
    ) {
        if (!balancer.updateMetrics(nodeId, Seconds.toDuration(req.responseTimeSeconds()))) {
            throw new NodeNotFoundException(nodeId);
        }
        return ResponseEntity.noContent().build();
    }

    @PatchMapping("/{nodeId}/status")
    public ResponseEntity<Void> updateStatus(
            @PathVariable @NotBlank String nodeId,
            @Valid @RequestBody UpdateNodeStatusRequest req
    ) {
        NodeStatusUpdate update = new NodeStatusUpdate(
                req.healthy(),
                req.responseTimeSeconds() == null ? null : Seconds.toDuration(req.responseTimeSeconds()),
                req.connections()
        );
        if (!balancer.updateNodeStatus(nodeId, update)) {
            throw new NodeNotFoundException(nodeId);
        }
        return ResponseEntity.noContent().build();
    }

    @ExceptionHandler(UnsupportedStrategyException.class)
    public ResponseEntity<ErrorBody> unsupportedStrategy(UnsupportedStrategyException e) {
        return ResponseEntity.badRequest().body(new ErrorBody("unsupported_strategy", e.getMessage()));
    }
}
