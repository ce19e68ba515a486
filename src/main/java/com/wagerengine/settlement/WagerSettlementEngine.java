package com.wagerengine.settlement;

import com.wagerengine.access.AccessGate;
import com.wagerengine.access.EngineControl;
import com.wagerengine.accounts.AccountBalanceStore;
import com.wagerengine.accounts.PlayerAccount;
import com.wagerengine.common.Amounts;
import com.wagerengine.common.EngineConstants;
import com.wagerengine.common.exception.InsolventReserveException;
import com.wagerengine.games.GameConfig;
import com.wagerengine.games.GameConfigRegistry;
import com.wagerengine.ledger.EventLog;
import com.wagerengine.providers.Collaborators;
import com.wagerengine.providers.IdentityRegistry;
import com.wagerengine.providers.PeggedAssetMinter;
import com.wagerengine.treasury.FeeTreasury;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Settles a single wager against the account balance.
 *
 * Settlement flow:
 * 1. Admission, game config and bet bounds
 * 2. Identity check and stake debit (always taken, win or lose)
 * 3. House edge fee accrued on the stake
 * 4. If won, payout credited from custody after a solvency check: custody must hold
 *    the payout and, once it is credited, still cover the sum of every account balance
 * 5. Platform counters, registry stats and the settlement event
 *
 * The outcome {@code won} is supplied by the caller. The engine does not derive or
 * verify it; whoever calls playGame is trusted to report the result.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WagerSettlementEngine {

    private final AccessGate accessGate;
    private final Collaborators collaborators;
    private final GameConfigRegistry gameConfigRegistry;
    private final AccountBalanceStore balanceStore;
    private final FeeTreasury feeTreasury;
    private final EventLog eventLog;

    @Transactional
    public SettlementResult playGame(String identity, String gameType, long betAmount, boolean won) {
        EngineControl control = accessGate.admit("playGame");
        Amounts.requireNonNegative(betAmount, "betAmount");
        GameConfig config = gameConfigRegistry.requirePlayable(gameType, betAmount);

        Collaborators.Linked links = collaborators.resolve(control);
        PeggedAssetMinter minter = links.requireMinter();
        IdentityRegistry registry = links.registry();
        accessGate.requireEligible(identity, registry);

        PlayerAccount account = balanceStore.debit(identity, betAmount);

        long fee = Amounts.applyBasisPoints(betAmount, EngineConstants.HOUSE_EDGE_BPS);
        long payout = 0L;
        if (won) {
            payout = Amounts.applyBasisPoints(betAmount, config.getPayoutMultiplierBps());
            requireCustodyCovers(minter, payout);
            if (payout > 0) {
                account = balanceStore.credit(identity, payout);
            }
        }

        feeTreasury.recordGame(betAmount, fee, payout);
        registry.recordGameStat(identity, won, betAmount);
        eventLog.recordSettlement(identity, gameType, betAmount, won, payout, fee);

        log.info("Settled {} bet {} for {}: won={}, payout={}, fee={}, balance={}",
            gameType, betAmount, identity, won, payout, fee, account.getBalance());

        return SettlementResult.builder()
            .identity(identity)
            .gameType(gameType)
            .betAmount(betAmount)
            .won(won)
            .payout(payout)
            .fee(fee)
            .balance(account.getBalance())
            .build();
    }

    /**
     * Custody must hold the payout and, after it is credited, still cover every
     * account balance.
     */
    private void requireCustodyCovers(PeggedAssetMinter minter, long payout) {
        long custody = minter.balanceOf(accessGate.engineIdentity());
        if (custody < payout) {
            throw new InsolventReserveException("custody pool", payout, custody);
        }
        long liabilities = Amounts.add(balanceStore.totalLiabilities(), payout);
        if (custody < liabilities) {
            throw new InsolventReserveException("custody pool after payout", liabilities, custody);
        }
    }
}
