package com.wagerengine.banking;

import com.wagerengine.EngineTestSupport;
import com.wagerengine.common.exception.CollaboratorNotLinkedException;
import com.wagerengine.common.exception.EnginePausedException;
import com.wagerengine.common.exception.IdentityNotEligibleException;
import com.wagerengine.common.exception.InsufficientFundsException;
import com.wagerengine.common.exception.InvalidAmountException;
import com.wagerengine.ledger.EventLog;
import com.wagerengine.ledger.EventType;
import com.wagerengine.providers.local.LocalIdentityRegistry;
import com.wagerengine.providers.local.LocalPeggedAssetMinter;
import com.wagerengine.providers.local.PlayerProfile;
import com.wagerengine.providers.local.RecordingNativeAssetTransfer;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests for deposits and withdrawals.
 */
@SpringBootTest
@ActiveProfiles("test")
class DepositWithdrawalProcessorTest extends EngineTestSupport {

    @Autowired
    private LocalPeggedAssetMinter localMinter;

    @Autowired
    private LocalIdentityRegistry localRegistry;

    @Autowired
    private RecordingNativeAssetTransfer nativeTransfer;

    @Autowired
    private EventLog eventLog;

    @Test
    void testDepositCreditsPeggedBalance() {
        TransferReceipt receipt = wagerEngine.deposit(ALICE, 1);

        assertEquals(100, receipt.getPeggedAmount());
        assertEquals(100, receipt.getBalance());
        assertEquals(100, wagerEngine.balanceOf(ALICE));
        assertEquals(100, localMinter.balanceOf(ENGINE_IDENTITY));
        assertEquals(0, localMinter.balanceOf(ALICE));
        assertEquals(1, wagerEngine.platformStats().getNativeReserve());
        assertEquals(1, eventLog.eventsOfType(EventType.DEPOSIT).size());
        assertLedgerConsistent();
    }

    @Test
    void testDepositThenWithdrawReturnsNativeAmount() {
        wagerEngine.deposit(ALICE, 5);

        TransferReceipt receipt = wagerEngine.withdraw(ALICE, 500);

        assertEquals(5, receipt.getNativeAmount());
        assertEquals(0, receipt.getBalance());
        assertEquals(0, wagerEngine.balanceOf(ALICE));
        assertEquals(5, nativeTransfer.totalTransferredTo(ALICE));
        assertEquals(0, localMinter.balanceOf(ENGINE_IDENTITY));
        assertEquals(0, wagerEngine.platformStats().getNativeReserve());
        assertLedgerConsistent();
    }

    @Test
    void testWithdrawNonMultipleOfRatioRejected() {
        wagerEngine.deposit(ALICE, 2);

        assertThrows(InvalidAmountException.class, () -> wagerEngine.withdraw(ALICE, 150));

        assertEquals(200, wagerEngine.balanceOf(ALICE));
        assertEquals(2, wagerEngine.platformStats().getNativeReserve());
        assertEquals(0, nativeTransfer.totalTransferredTo(ALICE));
        assertTrue(eventLog.eventsOfType(EventType.WITHDRAWAL).isEmpty());
    }

    @Test
    void testWithdrawMoreThanBalanceRejected() {
        wagerEngine.deposit(ALICE, 1);

        assertThrows(InsufficientFundsException.class, () -> wagerEngine.withdraw(ALICE, 200));

        assertEquals(100, wagerEngine.balanceOf(ALICE));
        assertEquals(100, localMinter.balanceOf(ENGINE_IDENTITY));
    }

    @Test
    void testZeroAmountsRejected() {
        assertThrows(InvalidAmountException.class, () -> wagerEngine.deposit(ALICE, 0));
        assertThrows(InvalidAmountException.class, () -> wagerEngine.withdraw(ALICE, 0));
        assertEquals(0, wagerEngine.balanceOf(ALICE));
    }

    @Test
    void testDepositOverflowAborts() {
        assertThrows(RuntimeException.class, () -> wagerEngine.deposit(ALICE, Long.MAX_VALUE / 10));

        assertEquals(0, wagerEngine.balanceOf(ALICE));
        assertEquals(0, wagerEngine.platformStats().getNativeReserve());
    }

    @Test
    void testDepositRequiresLinkedMinter() {
        wagerEngine.linkCollaborators(OWNER, null, null);

        assertThrows(CollaboratorNotLinkedException.class, () -> wagerEngine.deposit(ALICE, 1));

        assertEquals(0, wagerEngine.balanceOf(ALICE));
        assertEquals(0, localMinter.totalSupply());
    }

    @Test
    void testRegistryRejectsUnregisteredAndBannedIdentities() {
        wagerEngine.linkCollaborators(OWNER, LocalPeggedAssetMinter.BEAN_NAME, LocalIdentityRegistry.BEAN_NAME);

        assertThrows(IdentityNotEligibleException.class, () -> wagerEngine.deposit(ALICE, 1));
        assertEquals(0, wagerEngine.balanceOf(ALICE));

        localRegistry.register(ALICE);
        wagerEngine.deposit(ALICE, 3);
        PlayerProfile profile = localRegistry.findProfile(ALICE).orElseThrow();
        assertEquals(3, profile.getTotalDeposited());

        localRegistry.ban(ALICE);
        assertThrows(IdentityNotEligibleException.class, () -> wagerEngine.withdraw(ALICE, 100));
        assertEquals(300, wagerEngine.balanceOf(ALICE));

        localRegistry.unban(ALICE);
        wagerEngine.withdraw(ALICE, 100);
        assertEquals(1, localRegistry.findProfile(ALICE).orElseThrow().getTotalWithdrawn());
    }

    @Test
    void testPausedEngineRejectsDepositAndWithdraw() {
        wagerEngine.deposit(ALICE, 1);
        wagerEngine.pause(OWNER);

        assertThrows(EnginePausedException.class, () -> wagerEngine.deposit(ALICE, 1));
        assertThrows(EnginePausedException.class, () -> wagerEngine.withdraw(ALICE, 100));
        assertEquals(100, wagerEngine.balanceOf(ALICE));

        wagerEngine.unpause(OWNER);
        wagerEngine.withdraw(ALICE, 100);
        assertEquals(0, wagerEngine.balanceOf(ALICE));
    }

    @Test
    void testFundHouseAddsCustodyWithoutCreditingAccounts() {
        TransferReceipt receipt = wagerEngine.fundHouse(OWNER, 10);

        assertEquals(1000, receipt.getPeggedAmount());
        assertEquals(0, wagerEngine.balanceOf(OWNER));
        assertEquals(1000, wagerEngine.platformStats().getCustodyBalance());
        assertEquals(10, wagerEngine.platformStats().getNativeReserve());
        assertEquals(1, eventLog.eventsOfType(EventType.HOUSE_FUNDED).size());
    }
}
