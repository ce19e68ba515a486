package com.wagerengine.engine;

import com.wagerengine.access.CapabilitySet;
import com.wagerengine.access.EngineControl;
import com.wagerengine.access.EngineControlRepository;
import com.wagerengine.access.Role;
import com.wagerengine.config.WagerEngineProperties;
import com.wagerengine.games.GameConfigRegistry;
import com.wagerengine.games.GameConfigRepository;
import com.wagerengine.ledger.EventLog;
import com.wagerengine.providers.Collaborators;
import com.wagerengine.treasury.PlatformStats;
import com.wagerengine.treasury.PlatformStatsRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Creates the control record, platform stats and default game configs on first start.
 *
 * Existing rows are left untouched, so restarting against a persistent database keeps
 * the owner, links and configs set at runtime.
 */
@Component
@Slf4j
public class EngineBootstrap implements ApplicationRunner {

    private final WagerEngineProperties properties;
    private final EngineControlRepository controlRepository;
    private final PlatformStatsRepository statsRepository;
    private final GameConfigRepository gameConfigRepository;
    private final GameConfigRegistry gameConfigRegistry;
    private final CapabilitySet capabilitySet;
    private final Collaborators collaborators;
    private final EventLog eventLog;
    private final TransactionTemplate transactionTemplate;

    public EngineBootstrap(WagerEngineProperties properties,
                           EngineControlRepository controlRepository,
                           PlatformStatsRepository statsRepository,
                           GameConfigRepository gameConfigRepository,
                           GameConfigRegistry gameConfigRegistry,
                           CapabilitySet capabilitySet,
                           Collaborators collaborators,
                           EventLog eventLog,
                           PlatformTransactionManager transactionManager) {
        this.properties = properties;
        this.controlRepository = controlRepository;
        this.statsRepository = statsRepository;
        this.gameConfigRepository = gameConfigRepository;
        this.gameConfigRegistry = gameConfigRegistry;
        this.capabilitySet = capabilitySet;
        this.collaborators = collaborators;
        this.eventLog = eventLog;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    @Override
    public void run(ApplicationArguments args) {
        initialize();
    }

    public void initialize() {
        transactionTemplate.executeWithoutResult(status -> {
            initializeControl();
            if (!statsRepository.existsById(PlatformStats.SINGLETON_ID)) {
                statsRepository.save(PlatformStats.initial());
            }
            seedGames();
        });
    }

    private void initializeControl() {
        if (controlRepository.existsById(EngineControl.SINGLETON_ID)) {
            return;
        }
        String engineIdentity = properties.getEngineIdentity();
        EngineControl control = new EngineControl(properties.getOwner(), blankToNull(properties.getTreasury()));

        String minter = blankToNull(properties.getLinks().getMinter());
        String registry = blankToNull(properties.getLinks().getRegistry());
        collaborators.requireKnownMinter(minter);
        collaborators.requireKnownRegistry(registry);
        control.setLinkedMinter(minter);
        control.setLinkedRegistry(registry);
        controlRepository.save(control);

        capabilitySet.grant(engineIdentity, Role.GAME_MANAGER);
        capabilitySet.grant(engineIdentity, Role.MINTER);

        if (minter != null || registry != null) {
            eventLog.recordLinked(minter, registry);
        }
        log.info("Engine initialized: owner={}, treasury={}, engineIdentity={}, minter={}, registry={}",
            control.getOwner(), control.getTreasury(), engineIdentity, minter, registry);
    }

    private void seedGames() {
        properties.getGames().forEach((gameType, defaults) -> {
            if (gameConfigRepository.existsById(gameType)) {
                return;
            }
            gameConfigRegistry.store(gameType, defaults.getMinBet(), defaults.getMaxBet(),
                defaults.getPayoutMultiplierBps(), defaults.isActive(),
                defaults.getDisplayName() != null ? defaults.getDisplayName() : gameType);
        });
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
