package com.timemarket.api.health;

import com.timemarket.core.ledger.OfferLedger;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.Map;

/**
 * Health check endpoints.
 */
@RestController
@RequestMapping("/api/v1")
public class HealthController {

    private final OfferLedger ledger;

    public HealthController(OfferLedger ledger) {
        this.ledger = ledger;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        return ResponseEntity.ok(Map.of(
            "status", "UP",
            "timestamp", Instant.now().toString()
        ));
    }

    @GetMapping("/info")
    public ResponseEntity<Map<String, Object>> info() {
        return ResponseEntity.ok(Map.of(
            "name", "TimeMarket Platform API",
            "version", "0.1.0-SNAPSHOT",
            "contract", ledger.getContractAddress(),
            "latestBlock", ledger.getEventLog().latestBlock(),
            "timestamp", Instant.now().toString()
        ));
    }
}
