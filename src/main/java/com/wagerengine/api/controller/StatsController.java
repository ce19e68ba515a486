package com.wagerengine.api.controller;

import com.wagerengine.common.EngineConstants;
import com.wagerengine.engine.WagerEngine;
import com.wagerengine.ledger.EngineEvent;
import com.wagerengine.treasury.PlatformStatsView;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * REST API for platform aggregates.
 */
@RestController
@RequestMapping("/api/v1/stats")
@RequiredArgsConstructor
@Tag(name = "Stats", description = "Platform statistics API")
public class StatsController {

    private final WagerEngine wagerEngine;

    @GetMapping
    @Operation(summary = "Get platform statistics")
    public ResponseEntity<PlatformStatsView> getStats() {
        return ResponseEntity.ok(wagerEngine.platformStats());
    }

    @GetMapping("/constants")
    @Operation(summary = "Get fixed economic parameters")
    public ResponseEntity<Map<String, Long>> getConstants() {
        return ResponseEntity.ok(Map.of(
            "HOUSE_EDGE_BPS", EngineConstants.HOUSE_EDGE_BPS,
            "RATIO", EngineConstants.RATIO,
            "BASIS_POINTS_DENOM", EngineConstants.BASIS_POINTS_DENOM));
    }

    @GetMapping("/events")
    @Operation(summary = "Get the most recent engine events")
    public ResponseEntity<List<EngineEvent>> getRecentEvents() {
        return ResponseEntity.ok(wagerEngine.recentEvents());
    }
}
