package com.wagerengine.banking;

import com.wagerengine.access.AccessGate;
import com.wagerengine.access.EngineControl;
import com.wagerengine.accounts.AccountBalanceStore;
import com.wagerengine.accounts.PlayerAccount;
import com.wagerengine.common.Amounts;
import com.wagerengine.common.EngineConstants;
import com.wagerengine.common.exception.InvalidAmountException;
import com.wagerengine.ledger.EventLog;
import com.wagerengine.providers.Collaborators;
import com.wagerengine.providers.IdentityRegistry;
import com.wagerengine.providers.NativeAssetTransfer;
import com.wagerengine.providers.PeggedAssetMinter;
import com.wagerengine.treasury.FeeTreasury;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Converts native asset into pegged balance and back.
 *
 * Pegged units are minted to the engine's own custody, not to the depositor, so a
 * wager only ever touches account rows. Each method is one transaction: a failure at
 * any step leaves balances, custody, reserve and the event log untouched.
 *
 * Deposit flow:
 * 1. Admission (pause) and amount checks
 * 2. Resolve minter (required) and registry (optional), check identity
 * 3. Mint pegged units into custody, grow the native reserve, credit the account
 * 4. Report the deposit stat and record the event
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DepositWithdrawalProcessor {

    private final AccessGate accessGate;
    private final Collaborators collaborators;
    private final AccountBalanceStore balanceStore;
    private final FeeTreasury feeTreasury;
    private final NativeAssetTransfer nativeAssetTransfer;
    private final EventLog eventLog;

    @Transactional
    public TransferReceipt deposit(String identity, long nativeAmount) {
        EngineControl control = accessGate.admit("deposit");
        Amounts.requirePositive(nativeAmount, "nativeAmount");

        Collaborators.Linked links = collaborators.resolve(control);
        PeggedAssetMinter minter = links.requireMinter();
        IdentityRegistry registry = links.registry();
        accessGate.requireEligible(identity, registry);

        long peggedAmount = Amounts.toPegged(nativeAmount);

        minter.mint(accessGate.engineIdentity(), peggedAmount);
        feeTreasury.addReserve(nativeAmount);
        PlayerAccount account = balanceStore.credit(identity, peggedAmount);

        registry.recordDepositStat(identity, nativeAmount, true);
        eventLog.recordDeposit(identity, nativeAmount, peggedAmount);

        log.info("Deposit: {} native -> {} pegged for {}, balance {}",
            nativeAmount, peggedAmount, identity, account.getBalance());
        return receipt(identity, nativeAmount, peggedAmount, account.getBalance());
    }

    @Transactional
    public TransferReceipt withdraw(String identity, long peggedAmount) {
        EngineControl control = accessGate.admit("withdraw");
        Amounts.requirePositive(peggedAmount, "peggedAmount");
        if (peggedAmount % EngineConstants.RATIO != 0) {
            throw new InvalidAmountException(String.format(
                "peggedAmount %d is not a multiple of %d", peggedAmount, EngineConstants.RATIO));
        }

        Collaborators.Linked links = collaborators.resolve(control);
        PeggedAssetMinter minter = links.requireMinter();
        IdentityRegistry registry = links.registry();
        accessGate.requireEligible(identity, registry);

        long nativeAmount = Amounts.toNative(peggedAmount);

        PlayerAccount account = balanceStore.debit(identity, peggedAmount);
        feeTreasury.takeReserve(nativeAmount);
        minter.burn(accessGate.engineIdentity(), peggedAmount);
        nativeAssetTransfer.transfer(identity, nativeAmount, "withdrawal");

        registry.recordDepositStat(identity, nativeAmount, false);
        eventLog.recordWithdrawal(identity, peggedAmount, nativeAmount);

        log.info("Withdrawal: {} pegged -> {} native for {}, balance {}",
            peggedAmount, nativeAmount, identity, account.getBalance());
        return receipt(identity, nativeAmount, peggedAmount, account.getBalance());
    }

    /**
     * Owner adds native bankroll. The matching pegged units go to custody without
     * crediting any account, so they back winning payouts.
     */
    @Transactional
    public TransferReceipt fundHouse(String caller, long nativeAmount) {
        EngineControl control = accessGate.requireOwner(caller, "fundHouse");
        Amounts.requirePositive(nativeAmount, "nativeAmount");
        PeggedAssetMinter minter = collaborators.resolve(control).requireMinter();

        long peggedAmount = Amounts.toPegged(nativeAmount);
        minter.mint(accessGate.engineIdentity(), peggedAmount);
        feeTreasury.addReserve(nativeAmount);
        eventLog.recordHouseFunded(caller, nativeAmount, peggedAmount);

        log.info("House funded by {}: {} native, {} pegged into custody", caller, nativeAmount, peggedAmount);
        return receipt(caller, nativeAmount, peggedAmount, balanceStore.balanceOf(caller));
    }

    private static TransferReceipt receipt(String identity, long nativeAmount, long peggedAmount, long balance) {
        return TransferReceipt.builder()
            .identity(identity)
            .nativeAmount(nativeAmount)
            .peggedAmount(peggedAmount)
            .balance(balance)
            .build();
    }
}
