package com.wagerengine.api.controller;

import com.wagerengine.api.dto.CapabilityRequest;
import com.wagerengine.api.dto.GameConfigRequest;
import com.wagerengine.api.dto.LinkRequest;
import com.wagerengine.banking.TransferReceipt;
import com.wagerengine.engine.WagerEngine;
import com.wagerengine.games.GameConfig;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * REST API for owner operations. The owner check happens in the engine.
 */
@RestController
@RequestMapping("/api/v1/admin")
@RequiredArgsConstructor
@Tag(name = "Admin", description = "Owner-only configuration and treasury API")
public class AdminController {

    private final WagerEngine wagerEngine;

    @PutMapping("/games/{gameType}")
    @Operation(summary = "Replace a game configuration")
    public ResponseEntity<GameConfig> setGameConfig(
            @RequestHeader(CallerHeaders.CALLER) String caller,
            @PathVariable String gameType,
            @Valid @RequestBody GameConfigRequest request) {
        GameConfig config = wagerEngine.setGameConfig(caller, gameType,
            request.getMinBet(), request.getMaxBet(), request.getPayoutMultiplierBps(),
            request.getActive(), request.getDisplayName());
        return ResponseEntity.ok(config);
    }

    @PostMapping("/capabilities")
    @Operation(summary = "Grant a capability")
    public ResponseEntity<Void> authorize(
            @RequestHeader(CallerHeaders.CALLER) String caller,
            @Valid @RequestBody CapabilityRequest request) {
        wagerEngine.authorize(caller, request.getRole(), request.getIdentity());
        return ResponseEntity.ok().build();
    }

    @DeleteMapping("/capabilities")
    @Operation(summary = "Revoke a capability")
    public ResponseEntity<Void> revoke(
            @RequestHeader(CallerHeaders.CALLER) String caller,
            @Valid @RequestBody CapabilityRequest request) {
        wagerEngine.revoke(caller, request.getRole(), request.getIdentity());
        return ResponseEntity.ok().build();
    }

    @PostMapping("/pause")
    @Operation(summary = "Stop deposits, withdrawals and wagers")
    public ResponseEntity<Void> pause(@RequestHeader(CallerHeaders.CALLER) String caller) {
        wagerEngine.pause(caller);
        return ResponseEntity.ok().build();
    }

    @PostMapping("/unpause")
    @Operation(summary = "Resume deposits, withdrawals and wagers")
    public ResponseEntity<Void> unpause(@RequestHeader(CallerHeaders.CALLER) String caller) {
        wagerEngine.unpause(caller);
        return ResponseEntity.ok().build();
    }

    @PutMapping("/treasury")
    @Operation(summary = "Set the fee treasury sink")
    public ResponseEntity<Void> setTreasury(
            @RequestHeader(CallerHeaders.CALLER) String caller,
            @RequestParam String treasury) {
        wagerEngine.setTreasury(caller, treasury);
        return ResponseEntity.ok().build();
    }

    @PutMapping("/links")
    @Operation(summary = "Link or unlink the minter and identity registry")
    public ResponseEntity<Void> link(
            @RequestHeader(CallerHeaders.CALLER) String caller,
            @RequestBody LinkRequest request) {
        wagerEngine.linkCollaborators(caller, request.getMinter(), request.getRegistry());
        return ResponseEntity.ok().build();
    }

    @PutMapping("/owner")
    @Operation(summary = "Transfer ownership")
    public ResponseEntity<Void> transferOwnership(
            @RequestHeader(CallerHeaders.CALLER) String caller,
            @RequestParam String newOwner) {
        wagerEngine.transferOwnership(caller, newOwner);
        return ResponseEntity.ok().build();
    }

    @PostMapping("/fees/withdraw")
    @Operation(summary = "Disburse accrued fees to the treasury")
    public ResponseEntity<Map<String, Long>> withdrawFees(@RequestHeader(CallerHeaders.CALLER) String caller) {
        long nativeAmount = wagerEngine.withdrawFees(caller);
        return ResponseEntity.ok(Map.of("nativeAmount", nativeAmount));
    }

    @PostMapping("/house/fund")
    @Operation(summary = "Add native bankroll backing winning payouts")
    public ResponseEntity<TransferReceipt> fundHouse(
            @RequestHeader(CallerHeaders.CALLER) String caller,
            @RequestParam long nativeAmount) {
        return ResponseEntity.ok(wagerEngine.fundHouse(caller, nativeAmount));
    }
}
