package com.wagerengine.ledger;

import com.wagerengine.games.GameConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Append-only log of engine events.
 *
 * Recording methods join the caller's transaction, so an event exists only if the
 * operation that produced it committed.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EventLog {

    private final EngineEventRepository eventRepository;

    @Transactional(propagation = Propagation.MANDATORY)
    public EngineEvent recordDeposit(String identity, long nativeAmount, long peggedAmount) {
        EngineEvent event = next(EventType.DEPOSIT, identity);
        event.setNativeAmount(nativeAmount);
        event.setPeggedAmount(peggedAmount);
        return save(event);
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public EngineEvent recordWithdrawal(String identity, long peggedAmount, long nativeAmount) {
        EngineEvent event = next(EventType.WITHDRAWAL, identity);
        event.setPeggedAmount(peggedAmount);
        event.setNativeAmount(nativeAmount);
        return save(event);
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public EngineEvent recordSettlement(String identity, String gameType, long betAmount,
                                        boolean won, long payout, long fee) {
        EngineEvent event = next(EventType.SETTLEMENT, identity);
        event.setGameType(gameType);
        event.setBetAmount(betAmount);
        event.setWon(won);
        event.setPayout(payout);
        event.setFee(fee);
        return save(event);
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public EngineEvent recordFeeCollected(String treasury, long peggedAmount, long nativeAmount) {
        EngineEvent event = next(EventType.FEE_COLLECTED, treasury);
        event.setPeggedAmount(peggedAmount);
        event.setNativeAmount(nativeAmount);
        return save(event);
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public EngineEvent recordConfigUpdated(GameConfig config) {
        EngineEvent event = next(EventType.CONFIG_UPDATED, null);
        event.setGameType(config.getGameType());
        event.setDetail(String.format("minBet=%d maxBet=%d multiplierBps=%d active=%s name=%s",
            config.getMinBet(), config.getMaxBet(), config.getPayoutMultiplierBps(),
            config.isActive(), config.getDisplayName()));
        return save(event);
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public EngineEvent recordTreasuryUpdated(String oldTreasury, String newTreasury) {
        EngineEvent event = next(EventType.TREASURY_UPDATED, newTreasury);
        event.setDetail("old=" + oldTreasury + " new=" + newTreasury);
        return save(event);
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public EngineEvent recordLinked(String minterRef, String registryRef) {
        EngineEvent event = next(EventType.LINKED, null);
        event.setDetail("minter=" + minterRef + " registry=" + registryRef);
        return save(event);
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public EngineEvent recordAdminChange(EventType type, String subject, String detail) {
        EngineEvent event = next(type, subject);
        event.setDetail(detail);
        return save(event);
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public EngineEvent recordHouseFunded(String owner, long nativeAmount, long peggedAmount) {
        EngineEvent event = next(EventType.HOUSE_FUNDED, owner);
        event.setNativeAmount(nativeAmount);
        event.setPeggedAmount(peggedAmount);
        return save(event);
    }

    @Transactional(readOnly = true)
    public List<EngineEvent> eventsFor(String identity) {
        return eventRepository.findByIdentityOrderBySequenceDesc(identity);
    }

    @Transactional(readOnly = true)
    public List<EngineEvent> eventsOfType(EventType type) {
        return eventRepository.findByEventTypeOrderBySequenceAsc(type);
    }

    @Transactional(readOnly = true)
    public List<EngineEvent> recentEvents() {
        return eventRepository.findTop50ByOrderBySequenceDesc();
    }

    private EngineEvent next(EventType type, String identity) {
        // Callers hold the serial execution guard, so max+1 cannot race.
        return new EngineEvent(eventRepository.findMaxSequence() + 1, type, identity);
    }

    private EngineEvent save(EngineEvent event) {
        eventRepository.save(event);
        log.debug("Recorded {} #{} for {}", event.getEventType(), event.getSequence(), event.getIdentity());
        return event;
    }
}
