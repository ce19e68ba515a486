package com.wagerengine.treasury;

import com.wagerengine.access.AccessGate;
import com.wagerengine.access.EngineControl;
import com.wagerengine.accounts.AccountBalanceStore;
import com.wagerengine.common.Amounts;
import com.wagerengine.common.EngineConstants;
import com.wagerengine.common.exception.EngineStateException;
import com.wagerengine.common.exception.InsolventReserveException;
import com.wagerengine.ledger.EventLog;
import com.wagerengine.providers.Collaborators;
import com.wagerengine.providers.NativeAssetTransfer;
import com.wagerengine.providers.PeggedAssetMinter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Platform fee accrual and disbursement, plus the native reserve that backs withdrawals.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FeeTreasury {

    private final PlatformStatsRepository statsRepository;
    private final AccessGate accessGate;
    private final Collaborators collaborators;
    private final AccountBalanceStore balanceStore;
    private final NativeAssetTransfer nativeAssetTransfer;
    private final EventLog eventLog;

    /**
     * Load the stats row for update. Created by {@link com.wagerengine.engine.EngineBootstrap}.
     */
    @Transactional
    public PlatformStats stats() {
        return statsRepository.findById(PlatformStats.SINGLETON_ID)
            .orElseGet(() -> statsRepository.save(PlatformStats.initial()));
    }

    /**
     * Disburse all accrued fees to the treasury sink. Owner only, callable while paused.
     *
     * The pegged fee counter is converted with the minter's floor conversion; any
     * sub-unit remainder is forfeited with the counter reset. The matching pegged units
     * are burned from custody, and the reserve left behind must still redeem every
     * account balance.
     *
     * @return native units transferred
     */
    @Transactional
    public long withdrawFees(String caller) {
        EngineControl control = accessGate.requireOwner(caller, "withdrawFees");
        String treasury = control.getTreasury();
        PeggedAssetMinter minter = collaborators.resolve(control).requireMinter();
        if (treasury == null || treasury.isBlank()) {
            throw new EngineStateException("Treasury is not set");
        }
        PlatformStats stats = stats();
        long fees = stats.getTotalFeesCollected();
        if (fees <= 0) {
            throw new EngineStateException("No fees to withdraw");
        }
        long nativeAmount = minter.gameUnitsToNative(fees);
        if (stats.getNativeReserve() < nativeAmount) {
            throw new InsolventReserveException("native reserve", nativeAmount, stats.getNativeReserve());
        }
        long backing = nativeBacking(balanceStore.totalLiabilities());
        long required = Amounts.add(nativeAmount, backing);
        if (stats.getNativeReserve() < required) {
            throw new InsolventReserveException("native reserve after fee withdrawal", required, stats.getNativeReserve());
        }

        stats.drainFees();
        stats.removeReserve(nativeAmount);
        statsRepository.save(stats);

        if (nativeAmount > 0) {
            minter.burn(accessGate.engineIdentity(), Amounts.toPegged(nativeAmount));
            nativeAssetTransfer.transfer(treasury, nativeAmount, "fee withdrawal");
        }
        eventLog.recordFeeCollected(treasury, fees, nativeAmount);
        log.info("Withdrew {} pegged fees as {} native to treasury {}", fees, nativeAmount, treasury);
        return nativeAmount;
    }

    /**
     * Native units needed to redeem {@code peggedAmount}, rounded up.
     */
    static long nativeBacking(long peggedAmount) {
        return Amounts.add(peggedAmount, EngineConstants.RATIO - 1) / EngineConstants.RATIO;
    }

    @Transactional(readOnly = true)
    public PlatformStatsView view() {
        PlatformStats stats = stats();
        EngineControl control = accessGate.control();
        long custody = collaborators.resolve(control).minter()
            .map(minter -> minter.balanceOf(accessGate.engineIdentity()))
            .orElse(0L);
        return PlatformStatsView.builder()
            .totalGamesPlayed(stats.getTotalGamesPlayed())
            .totalVolumeWagered(stats.getTotalVolumeWagered())
            .totalPayouts(stats.getTotalPayouts())
            .totalFeesCollected(stats.getTotalFeesCollected())
            .nativeReserve(stats.getNativeReserve())
            .custodyBalance(custody)
            .totalLiabilities(balanceStore.totalLiabilities())
            .build();
    }

    @Transactional
    public void addReserve(long nativeAmount) {
        PlatformStats stats = stats();
        stats.addReserve(nativeAmount);
        statsRepository.save(stats);
    }

    /**
     * Take native asset out of the reserve, failing if it cannot cover the amount.
     */
    @Transactional
    public void takeReserve(long nativeAmount) {
        PlatformStats stats = stats();
        if (stats.getNativeReserve() < nativeAmount) {
            throw new InsolventReserveException("native reserve", nativeAmount, stats.getNativeReserve());
        }
        stats.removeReserve(nativeAmount);
        statsRepository.save(stats);
    }

    @Transactional
    public void recordGame(long betAmount, long fee, long payout) {
        PlatformStats stats = stats();
        stats.recordGame(betAmount, fee, payout);
        statsRepository.save(stats);
    }
}
