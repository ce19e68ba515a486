package com.wagerengine.api.controller;

import com.wagerengine.api.dto.PlayGameRequest;
import com.wagerengine.engine.WagerEngine;
import com.wagerengine.games.GameConfig;
import com.wagerengine.settlement.SettlementResult;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST API for game configs and wager settlement.
 */
@RestController
@RequestMapping("/api/v1/games")
@RequiredArgsConstructor
@Tag(name = "Games", description = "Game configuration and wager settlement API")
public class GameController {

    private final WagerEngine wagerEngine;

    @GetMapping
    @Operation(summary = "List game configurations")
    public ResponseEntity<List<GameConfig>> listGames() {
        return ResponseEntity.ok(wagerEngine.listGameConfigs());
    }

    @GetMapping("/{gameType}")
    @Operation(summary = "Get a game configuration")
    public ResponseEntity<GameConfig> getGame(@PathVariable String gameType) {
        return ResponseEntity.ok(wagerEngine.getGameConfig(gameType));
    }

    @PostMapping("/{gameType}/play")
    @Operation(summary = "Settle a wager for the calling identity")
    public ResponseEntity<SettlementResult> play(
            @RequestHeader(CallerHeaders.CALLER) String caller,
            @PathVariable String gameType,
            @Valid @RequestBody PlayGameRequest request) {
        SettlementResult result = wagerEngine.playGame(
            caller, gameType, request.getBetAmount(), request.getWon());
        return ResponseEntity.ok(result);
    }
}
