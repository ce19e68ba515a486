package com.wagerengine.engine;

import com.wagerengine.access.AccessGate;
import com.wagerengine.access.Role;
import com.wagerengine.access.SerialExecutionGuard;
import com.wagerengine.accounts.AccountBalanceStore;
import com.wagerengine.banking.DepositWithdrawalProcessor;
import com.wagerengine.banking.TransferReceipt;
import com.wagerengine.games.GameConfig;
import com.wagerengine.games.GameConfigRegistry;
import com.wagerengine.ledger.EngineEvent;
import com.wagerengine.ledger.EventLog;
import com.wagerengine.settlement.SettlementResult;
import com.wagerengine.settlement.WagerSettlementEngine;
import com.wagerengine.treasury.FeeTreasury;
import com.wagerengine.treasury.PlatformStatsView;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Public entry points of the engine.
 *
 * Every state-mutating call is admitted through the {@link SerialExecutionGuard} and
 * then runs as one transaction in the service it delegates to. The guard is held until
 * that transaction has committed or rolled back.
 */
@Service
@RequiredArgsConstructor
public class WagerEngine {

    private final SerialExecutionGuard guard;
    private final DepositWithdrawalProcessor depositWithdrawalProcessor;
    private final WagerSettlementEngine settlementEngine;
    private final GameConfigRegistry gameConfigRegistry;
    private final FeeTreasury feeTreasury;
    private final AccessGate accessGate;
    private final AccountBalanceStore balanceStore;
    private final EventLog eventLog;

    // Money-moving operations

    public TransferReceipt deposit(String identity, long nativeAmount) {
        try (SerialExecutionGuard.Permit permit = guard.enter("deposit")) {
            return depositWithdrawalProcessor.deposit(identity, nativeAmount);
        }
    }

    public TransferReceipt withdraw(String identity, long peggedAmount) {
        try (SerialExecutionGuard.Permit permit = guard.enter("withdraw")) {
            return depositWithdrawalProcessor.withdraw(identity, peggedAmount);
        }
    }

    public SettlementResult playGame(String identity, String gameType, long betAmount, boolean won) {
        try (SerialExecutionGuard.Permit permit = guard.enter("playGame")) {
            return settlementEngine.playGame(identity, gameType, betAmount, won);
        }
    }

    // Owner operations

    public GameConfig setGameConfig(String caller, String gameType, long minBet, long maxBet,
                                    long payoutMultiplierBps, boolean active, String displayName) {
        try (SerialExecutionGuard.Permit permit = guard.enter("setGameConfig")) {
            return gameConfigRegistry.setGameConfig(caller, gameType, minBet, maxBet,
                payoutMultiplierBps, active, displayName);
        }
    }

    public long withdrawFees(String caller) {
        try (SerialExecutionGuard.Permit permit = guard.enter("withdrawFees")) {
            return feeTreasury.withdrawFees(caller);
        }
    }

    public TransferReceipt fundHouse(String caller, long nativeAmount) {
        try (SerialExecutionGuard.Permit permit = guard.enter("fundHouse")) {
            return depositWithdrawalProcessor.fundHouse(caller, nativeAmount);
        }
    }

    public void pause(String caller) {
        try (SerialExecutionGuard.Permit permit = guard.enter("pause")) {
            accessGate.pause(caller);
        }
    }

    public void unpause(String caller) {
        try (SerialExecutionGuard.Permit permit = guard.enter("unpause")) {
            accessGate.unpause(caller);
        }
    }

    public void authorize(String caller, Role role, String identity) {
        try (SerialExecutionGuard.Permit permit = guard.enter("authorize")) {
            accessGate.authorize(caller, role, identity);
        }
    }

    public void revoke(String caller, Role role, String identity) {
        try (SerialExecutionGuard.Permit permit = guard.enter("revoke")) {
            accessGate.revoke(caller, role, identity);
        }
    }

    public void setTreasury(String caller, String treasury) {
        try (SerialExecutionGuard.Permit permit = guard.enter("setTreasury")) {
            accessGate.setTreasury(caller, treasury);
        }
    }

    public void linkCollaborators(String caller, String minterRef, String registryRef) {
        try (SerialExecutionGuard.Permit permit = guard.enter("linkCollaborators")) {
            accessGate.linkCollaborators(caller, minterRef, registryRef);
        }
    }

    public void transferOwnership(String caller, String newOwner) {
        try (SerialExecutionGuard.Permit permit = guard.enter("transferOwnership")) {
            accessGate.transferOwnership(caller, newOwner);
        }
    }

    // Views

    public long balanceOf(String identity) {
        return balanceStore.balanceOf(identity);
    }

    public GameConfig getGameConfig(String gameType) {
        return gameConfigRegistry.getGameConfig(gameType);
    }

    public List<GameConfig> listGameConfigs() {
        return gameConfigRegistry.listGameConfigs();
    }

    public PlatformStatsView platformStats() {
        return feeTreasury.view();
    }

    public boolean hasCapability(String identity, Role role) {
        return accessGate.hasCapability(identity, role);
    }

    public boolean isPaused() {
        return accessGate.control().isPaused();
    }

    public List<EngineEvent> eventsFor(String identity) {
        return eventLog.eventsFor(identity);
    }

    public List<EngineEvent> recentEvents() {
        return eventLog.recentEvents();
    }
}
