package com.wagerengine.providers.local;

import com.wagerengine.access.CapabilitySet;
import com.wagerengine.access.Role;
import com.wagerengine.common.Amounts;
import com.wagerengine.common.exception.UnauthorizedCallerException;
import com.wagerengine.config.WagerEngineProperties;
import com.wagerengine.providers.IdentityRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * In-database identity registry.
 *
 * An identity is valid once registered and while not banned. Stat updates come from
 * the engine and require it to hold {@link Role#GAME_MANAGER}.
 */
@Component(LocalIdentityRegistry.BEAN_NAME)
@Slf4j
public class LocalIdentityRegistry implements IdentityRegistry {

    public static final String BEAN_NAME = "localIdentityRegistry";

    private final PlayerProfileRepository profileRepository;
    private final CapabilitySet capabilitySet;
    private final String engineIdentity;

    public LocalIdentityRegistry(PlayerProfileRepository profileRepository,
                                 CapabilitySet capabilitySet,
                                 WagerEngineProperties properties) {
        this.profileRepository = profileRepository;
        this.capabilitySet = capabilitySet;
        this.engineIdentity = properties.getEngineIdentity();
    }

    @Override
    @Transactional
    public boolean isValid(String identity) {
        return profileRepository.findById(identity)
            .map(profile -> !profile.isBanned())
            .orElse(false);
    }

    @Override
    @Transactional
    public void recordGameStat(String identity, boolean won, long amount) {
        requireGameManager();
        PlayerProfile profile = profile(identity);
        profile.setGamesPlayed(Amounts.add(profile.getGamesPlayed(), 1));
        if (won) {
            profile.setGamesWon(Amounts.add(profile.getGamesWon(), 1));
        }
        profile.setTotalWagered(Amounts.add(profile.getTotalWagered(), amount));
        profileRepository.save(profile);
    }

    @Override
    @Transactional
    public void recordDepositStat(String identity, long amount, boolean isDeposit) {
        requireGameManager();
        PlayerProfile profile = profile(identity);
        if (isDeposit) {
            profile.setTotalDeposited(Amounts.add(profile.getTotalDeposited(), amount));
        } else {
            profile.setTotalWithdrawn(Amounts.add(profile.getTotalWithdrawn(), amount));
        }
        profileRepository.save(profile);
    }

    @Transactional
    public PlayerProfile register(String identity) {
        PlayerProfile profile = profileRepository.findById(identity)
            .orElseGet(() -> profileRepository.save(new PlayerProfile(identity)));
        log.info("Registered identity {}", identity);
        return profile;
    }

    @Transactional
    public void ban(String identity) {
        PlayerProfile profile = profile(identity);
        profile.setBanned(true);
        profileRepository.save(profile);
        log.info("Banned identity {}", identity);
    }

    @Transactional
    public void unban(String identity) {
        PlayerProfile profile = profile(identity);
        profile.setBanned(false);
        profileRepository.save(profile);
        log.info("Unbanned identity {}", identity);
    }

    @Transactional(readOnly = true)
    public Optional<PlayerProfile> findProfile(String identity) {
        return profileRepository.findById(identity);
    }

    private PlayerProfile profile(String identity) {
        return profileRepository.findById(identity).orElseGet(() -> new PlayerProfile(identity));
    }

    private void requireGameManager() {
        if (!capabilitySet.hasCapability(engineIdentity, Role.GAME_MANAGER)) {
            throw new UnauthorizedCallerException(engineIdentity, "missing capability " + Role.GAME_MANAGER);
        }
    }
}
