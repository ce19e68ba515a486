package com.wagerengine.games;

import com.wagerengine.access.AccessGate;
import com.wagerengine.common.exception.BetRejectedException;
import com.wagerengine.common.exception.GameConfigNotFoundException;
import com.wagerengine.common.exception.InvalidAmountException;
import com.wagerengine.common.exception.UnauthorizedCallerException;
import com.wagerengine.ledger.EventLog;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class GameConfigRegistryTest {

    @Mock
    private GameConfigRepository configRepository;

    @Mock
    private AccessGate accessGate;

    @Mock
    private EventLog eventLog;

    @InjectMocks
    private GameConfigRegistry registry;

    @Test
    void testSetGameConfigReplacesWholeTuple() {
        GameConfig existing = new GameConfig("dice", 100, 1000, 58000, true, "Dice");
        when(configRepository.findById("dice")).thenReturn(Optional.of(existing));

        GameConfig updated = registry.setGameConfig("owner", "dice", 200, 2000, 50000, false, "Dice v2");

        assertSame(existing, updated);
        assertEquals(200, updated.getMinBet());
        assertEquals(2000, updated.getMaxBet());
        assertEquals(50000, updated.getPayoutMultiplierBps());
        assertFalse(updated.isActive());
        assertEquals("Dice v2", updated.getDisplayName());
        verify(accessGate).requireOwner("owner", "setGameConfig");
        verify(configRepository).save(existing);
        verify(eventLog).recordConfigUpdated(existing);
    }

    @Test
    void testNonOwnerWriteStoresNothing() {
        when(accessGate.requireOwner("mallory", "setGameConfig"))
            .thenThrow(new UnauthorizedCallerException("mallory", "setGameConfig requires the owner"));

        assertThrows(UnauthorizedCallerException.class,
            () -> registry.setGameConfig("mallory", "dice", 1, 2, 3, true, "x"));

        verify(configRepository, never()).save(any());
        verifyNoInteractions(eventLog);
    }

    @Test
    void testInvertedBoundsStoredAsGiven() {
        when(configRepository.findById("broken")).thenReturn(Optional.empty());

        GameConfig config = registry.store("broken", 500, 100, 19000, true, "Broken");

        assertEquals(500, config.getMinBet());
        assertEquals(100, config.getMaxBet());
        assertFalse(config.accepts(300));
    }

    @Test
    void testNegativeValuesRejected() {
        assertThrows(InvalidAmountException.class, () -> registry.store("dice", -1, 10, 100, true, "Dice"));
        assertThrows(InvalidAmountException.class, () -> registry.store(" ", 1, 10, 100, true, "Dice"));
        verifyNoInteractions(configRepository);
    }

    @Test
    void testRequirePlayable() {
        when(configRepository.findById("coin-flip"))
            .thenReturn(Optional.of(new GameConfig("coin-flip", 10, 100, 19000, true, "Coin Flip")));
        when(configRepository.findById("retired"))
            .thenReturn(Optional.of(new GameConfig("retired", 10, 100, 19000, false, "Retired")));
        when(configRepository.findById("poker")).thenReturn(Optional.empty());

        assertNotNull(registry.requirePlayable("coin-flip", 10));
        assertNotNull(registry.requirePlayable("coin-flip", 100));
        assertThrows(BetRejectedException.class, () -> registry.requirePlayable("coin-flip", 9));
        assertThrows(BetRejectedException.class, () -> registry.requirePlayable("coin-flip", 101));
        assertThrows(BetRejectedException.class, () -> registry.requirePlayable("retired", 50));
        assertThrows(GameConfigNotFoundException.class, () -> registry.requirePlayable("poker", 50));
    }
}
