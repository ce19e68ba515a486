package com.wagerengine.api.controller;

import com.wagerengine.banking.TransferReceipt;
import com.wagerengine.engine.WagerEngine;
import com.wagerengine.ledger.EngineEvent;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * REST API for player balances, deposits and withdrawals.
 */
@RestController
@RequestMapping("/api/v1/accounts")
@RequiredArgsConstructor
@Tag(name = "Accounts", description = "Pegged balance, deposit and withdrawal API")
public class AccountController {

    private final WagerEngine wagerEngine;

    @GetMapping("/{identity}")
    @Operation(summary = "Get the pegged balance of an identity")
    public ResponseEntity<Map<String, Object>> getBalance(@PathVariable String identity) {
        return ResponseEntity.ok(Map.of(
            "identity", identity,
            "balance", wagerEngine.balanceOf(identity)));
    }

    @PostMapping("/{identity}/deposit")
    @Operation(summary = "Convert native asset into pegged balance")
    public ResponseEntity<TransferReceipt> deposit(
            @RequestHeader(CallerHeaders.CALLER) String caller,
            @PathVariable String identity,
            @RequestParam long nativeAmount) {
        CallerHeaders.requireSelf(caller, identity);
        return ResponseEntity.ok(wagerEngine.deposit(identity, nativeAmount));
    }

    @PostMapping("/{identity}/withdraw")
    @Operation(summary = "Convert pegged balance back into native asset")
    public ResponseEntity<TransferReceipt> withdraw(
            @RequestHeader(CallerHeaders.CALLER) String caller,
            @PathVariable String identity,
            @RequestParam long peggedAmount) {
        CallerHeaders.requireSelf(caller, identity);
        return ResponseEntity.ok(wagerEngine.withdraw(identity, peggedAmount));
    }

    @GetMapping("/{identity}/events")
    @Operation(summary = "Get events recorded for an identity")
    public ResponseEntity<List<EngineEvent>> getEvents(@PathVariable String identity) {
        return ResponseEntity.ok(wagerEngine.eventsFor(identity));
    }
}
