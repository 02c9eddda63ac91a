package io.github.drompincen.tabsensei.gateway.controller;

import io.github.drompincen.tabsensei.protocol.api.QueryOutcome;
import io.github.drompincen.tabsensei.protocol.api.QueryRequest;
import io.github.drompincen.tabsensei.runtime.coordinator.Coordinator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

@RestController
@RequestMapping("/api/query")
public class QueryController {

    private static final Logger log = LoggerFactory.getLogger(QueryController.class);

    private final Coordinator coordinator;

    public QueryController(Coordinator coordinator) {
        this.coordinator = coordinator;
    }

    /** Always answers 200 with a typed outcome once the query is accepted; the outcome carries failures. */
    @PostMapping
    public CompletableFuture<ResponseEntity<?>> query(@RequestBody QueryRequest req) {
        if (req.query() == null || req.query().isBlank()) {
            return CompletableFuture.completedFuture(ResponseEntity.badRequest().body(Map.of("error", "query is required")));
        }
        return coordinator.handleQuery(req.query().trim(), req.transcript())
                .<ResponseEntity<?>>thenApply(ResponseEntity::ok)
                .exceptionally(e -> {
                    log.error("Query dispatch failed", e);
                    return ResponseEntity.ok(new QueryOutcome.Failed(Coordinator.FAILURE_MESSAGE));
                });
    }
}
