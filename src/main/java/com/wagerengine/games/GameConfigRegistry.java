package com.wagerengine.games;

import com.wagerengine.access.AccessGate;
import com.wagerengine.common.Amounts;
import com.wagerengine.common.exception.BetRejectedException;
import com.wagerengine.common.exception.GameConfigNotFoundException;
import com.wagerengine.common.exception.InvalidAmountException;
import com.wagerengine.ledger.EventLog;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Per-game-type parameters.
 *
 * Writes are owner-only and replace the whole tuple. Bounds are checked only when a
 * bet is placed.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GameConfigRegistry {

    private final GameConfigRepository configRepository;
    private final AccessGate accessGate;
    private final EventLog eventLog;

    @Transactional
    public GameConfig setGameConfig(String caller, String gameType, long minBet, long maxBet,
                                    long multiplierBps, boolean active, String displayName) {
        accessGate.requireOwner(caller, "setGameConfig");
        return store(gameType, minBet, maxBet, multiplierBps, active, displayName);
    }

    /**
     * Write a config without the owner check. Used for seeding defaults at startup.
     */
    @Transactional
    public GameConfig store(String gameType, long minBet, long maxBet, long multiplierBps,
                            boolean active, String displayName) {
        if (gameType == null || gameType.isBlank()) {
            throw new InvalidAmountException("gameType must not be blank");
        }
        Amounts.requireNonNegative(minBet, "minBet");
        Amounts.requireNonNegative(maxBet, "maxBet");
        Amounts.requireNonNegative(multiplierBps, "payoutMultiplierBps");

        GameConfig config = configRepository.findById(gameType)
            .orElseGet(() -> new GameConfig(gameType, minBet, maxBet, multiplierBps, active, displayName));
        config.replace(minBet, maxBet, multiplierBps, active, displayName);
        configRepository.save(config);

        if (minBet > maxBet) {
            log.warn("Game {} configured with minBet {} above maxBet {}; no bet can be placed",
                gameType, minBet, maxBet);
        }

        eventLog.recordConfigUpdated(config);
        log.info("Game {} configured: bet [{}, {}], multiplier {} bps, active={}",
            gameType, minBet, maxBet, multiplierBps, active);
        return config;
    }

    @Transactional(readOnly = true)
    public GameConfig getGameConfig(String gameType) {
        return configRepository.findById(gameType)
            .orElseThrow(() -> new GameConfigNotFoundException(gameType));
    }

    @Transactional(readOnly = true)
    public List<GameConfig> listGameConfigs() {
        return configRepository.findAllByOrderByGameTypeAsc();
    }

    /**
     * Resolve the config a bet is played against, rejecting inactive games and
     * out-of-bounds amounts.
     */
    @Transactional
    public GameConfig requirePlayable(String gameType, long betAmount) {
        GameConfig config = getGameConfig(gameType);
        if (!config.isActive()) {
            throw new BetRejectedException(gameType, "game is not active");
        }
        if (!config.accepts(betAmount)) {
            throw new BetRejectedException(gameType, String.format(
                "bet %d outside [%d, %d]", betAmount, config.getMinBet(), config.getMaxBet()));
        }
        return config;
    }
}
