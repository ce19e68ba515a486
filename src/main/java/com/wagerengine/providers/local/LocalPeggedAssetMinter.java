package com.wagerengine.providers.local;

import com.wagerengine.access.CapabilitySet;
import com.wagerengine.access.Role;
import com.wagerengine.common.Amounts;
import com.wagerengine.common.EngineConstants;
import com.wagerengine.common.exception.InsolventReserveException;
import com.wagerengine.common.exception.UnauthorizedCallerException;
import com.wagerengine.config.WagerEngineProperties;
import com.wagerengine.providers.PeggedAssetMinter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * In-database pegged asset issuer.
 *
 * Stands in for an external token contract. Holdings live in the same database as the
 * engine, so mints and burns roll back together with the request that issued them.
 * Only the engine identity, and only while it holds {@link Role#MINTER}, may mint or burn.
 */
@Component(LocalPeggedAssetMinter.BEAN_NAME)
@Slf4j
public class LocalPeggedAssetMinter implements PeggedAssetMinter {

    public static final String BEAN_NAME = "localMinter";

    private final PeggedHoldingRepository holdingRepository;
    private final CapabilitySet capabilitySet;
    private final String engineIdentity;

    public LocalPeggedAssetMinter(PeggedHoldingRepository holdingRepository,
                                  CapabilitySet capabilitySet,
                                  WagerEngineProperties properties) {
        this.holdingRepository = holdingRepository;
        this.capabilitySet = capabilitySet;
        this.engineIdentity = properties.getEngineIdentity();
    }

    @Override
    @Transactional
    public void mint(String holder, long amount) {
        requireMinter();
        Amounts.requirePositive(amount, "mint amount");
        PeggedHolding holding = holdingRepository.findById(holder).orElseGet(() -> new PeggedHolding(holder));
        holding.setUnits(Amounts.add(holding.getUnits(), amount));
        holdingRepository.save(holding);
        log.debug("Minted {} pegged units to {}", amount, holder);
    }

    @Override
    @Transactional
    public void burn(String holder, long amount) {
        requireMinter();
        Amounts.requirePositive(amount, "burn amount");
        PeggedHolding holding = holdingRepository.findById(holder).orElseGet(() -> new PeggedHolding(holder));
        if (holding.getUnits() < amount) {
            throw new InsolventReserveException("pegged units held by " + holder, amount, holding.getUnits());
        }
        holding.setUnits(holding.getUnits() - amount);
        holdingRepository.save(holding);
        log.debug("Burned {} pegged units from {}", amount, holder);
    }

    @Override
    @Transactional
    public long balanceOf(String holder) {
        return holdingRepository.findById(holder).map(PeggedHolding::getUnits).orElse(0L);
    }

    @Override
    @Transactional
    public long totalSupply() {
        return holdingRepository.sumUnits();
    }

    @Override
    public long nativeToGameUnits(long nativeAmount) {
        return Amounts.multiply(nativeAmount, EngineConstants.RATIO);
    }

    @Override
    public long gameUnitsToNative(long gameUnits) {
        return gameUnits / EngineConstants.RATIO;
    }

    private void requireMinter() {
        if (!capabilitySet.hasCapability(engineIdentity, Role.MINTER)) {
            throw new UnauthorizedCallerException(engineIdentity, "missing capability " + Role.MINTER);
        }
    }
}
