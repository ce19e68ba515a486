package com.wagerengine.access;

import com.wagerengine.EngineTestSupport;
import com.wagerengine.common.exception.InvalidIdentityException;
import com.wagerengine.common.exception.UnauthorizedCallerException;
import com.wagerengine.common.exception.UnknownCollaboratorException;
import com.wagerengine.games.GameConfig;
import com.wagerengine.ledger.EngineEvent;
import com.wagerengine.ledger.EventLog;
import com.wagerengine.ledger.EventType;
import com.wagerengine.providers.local.LocalPeggedAssetMinter;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests for owner operations and the circuit breaker.
 */
@SpringBootTest
@ActiveProfiles("test")
class AccessGateTest extends EngineTestSupport {

    @Autowired
    private AccessGate accessGate;

    @Autowired
    private EventLog eventLog;

    @Test
    void testBootstrapGrantsEngineCapabilities() {
        assertTrue(wagerEngine.hasCapability(ENGINE_IDENTITY, Role.MINTER));
        assertTrue(wagerEngine.hasCapability(ENGINE_IDENTITY, Role.GAME_MANAGER));
        assertFalse(wagerEngine.hasCapability(ALICE, Role.MINTER));
        assertEquals(LocalPeggedAssetMinter.BEAN_NAME, accessGate.control().getLinkedMinter());
    }

    @Test
    void testNonOwnerRejectedFromAdminOperations() {
        assertThrows(UnauthorizedCallerException.class,
            () -> wagerEngine.setGameConfig(ALICE, "coin-flip", 1, 2, 3, true, "x"));
        assertThrows(UnauthorizedCallerException.class, () -> wagerEngine.pause(ALICE));
        assertThrows(UnauthorizedCallerException.class, () -> wagerEngine.setTreasury(ALICE, ALICE));
        assertThrows(UnauthorizedCallerException.class, () -> wagerEngine.authorize(ALICE, Role.MINTER, ALICE));
        assertThrows(UnauthorizedCallerException.class, () -> wagerEngine.linkCollaborators(ALICE, null, null));
        assertThrows(UnauthorizedCallerException.class, () -> wagerEngine.transferOwnership(ALICE, ALICE));
        assertThrows(UnauthorizedCallerException.class, () -> wagerEngine.withdrawFees(ALICE));
        assertThrows(UnauthorizedCallerException.class, () -> wagerEngine.fundHouse(ALICE, 1));

        assertEquals(10, wagerEngine.getGameConfig("coin-flip").getMinBet());
        assertFalse(wagerEngine.isPaused());
        assertEquals(TREASURY, accessGate.control().getTreasury());
    }

    @Test
    void testPausedEngineStillAcceptsConfigChanges() {
        wagerEngine.pause(OWNER);

        GameConfig config = wagerEngine.setGameConfig(OWNER, "coin-flip", 50, 5000, 19500, true, "Coin Flip");
        wagerEngine.setTreasury(OWNER, "new-treasury");

        assertTrue(wagerEngine.isPaused());
        assertEquals(19500, config.getPayoutMultiplierBps());
        assertEquals("new-treasury", accessGate.control().getTreasury());
    }

    @Test
    void testPauseAndUnpauseAreIdempotent() {
        wagerEngine.pause(OWNER);
        wagerEngine.pause(OWNER);
        assertTrue(wagerEngine.isPaused());
        assertEquals(1, eventLog.eventsOfType(EventType.PAUSED).size());

        wagerEngine.unpause(OWNER);
        wagerEngine.unpause(OWNER);
        assertFalse(wagerEngine.isPaused());
        assertEquals(1, eventLog.eventsOfType(EventType.UNPAUSED).size());
    }

    @Test
    void testTransferOwnership() {
        wagerEngine.transferOwnership(OWNER, ALICE);

        assertThrows(UnauthorizedCallerException.class, () -> wagerEngine.pause(OWNER));
        wagerEngine.pause(ALICE);
        assertTrue(wagerEngine.isPaused());
    }

    @Test
    void testLinkingUnknownCollaboratorRejected() {
        assertThrows(UnknownCollaboratorException.class,
            () -> wagerEngine.linkCollaborators(OWNER, "missingMinter", null));

        assertEquals(LocalPeggedAssetMinter.BEAN_NAME, accessGate.control().getLinkedMinter());
    }

    @Test
    void testCapabilityChangesAreRecorded() {
        wagerEngine.authorize(OWNER, Role.GAME_MANAGER, BOB);
        wagerEngine.authorize(OWNER, Role.GAME_MANAGER, BOB);
        assertTrue(wagerEngine.hasCapability(BOB, Role.GAME_MANAGER));

        wagerEngine.revoke(OWNER, Role.GAME_MANAGER, BOB);
        assertFalse(wagerEngine.hasCapability(BOB, Role.GAME_MANAGER));

        List<EngineEvent> granted = eventLog.eventsOfType(EventType.CAPABILITY_GRANTED);
        assertEquals(1, granted.size());
        assertEquals(BOB, granted.get(0).getIdentity());
        assertEquals(1, eventLog.eventsOfType(EventType.CAPABILITY_REVOKED).size());
    }

    @Test
    void testBlankIdentitiesRejected() {
        assertThrows(InvalidIdentityException.class, () -> wagerEngine.setTreasury(OWNER, " "));
        assertThrows(InvalidIdentityException.class, () -> wagerEngine.transferOwnership(OWNER, ""));
        assertThrows(InvalidIdentityException.class, () -> wagerEngine.authorize(OWNER, Role.MINTER, " "));
        assertThrows(InvalidIdentityException.class, () -> wagerEngine.deposit(" ", 1));

        assertEquals(TREASURY, accessGate.control().getTreasury());
        assertTrue(accessGate.control().isOwner(OWNER));
    }
}
