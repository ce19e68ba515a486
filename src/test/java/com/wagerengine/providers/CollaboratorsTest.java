package com.wagerengine.providers;

import com.wagerengine.access.EngineControl;
import com.wagerengine.common.exception.CollaboratorNotLinkedException;
import com.wagerengine.common.exception.UnknownCollaboratorException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class CollaboratorsTest {

    @Mock
    private PeggedAssetMinter minter;

    @Mock
    private IdentityRegistry registry;

    private Collaborators collaborators;

    @BeforeEach
    void setUp() {
        collaborators = new Collaborators(Map.of("minter", minter), Map.of("registry", registry));
    }

    @Test
    void testResolveLinkedCollaborators() {
        EngineControl control = new EngineControl("owner", null);
        control.setLinkedMinter("minter");
        control.setLinkedRegistry("registry");

        Collaborators.Linked linked = collaborators.resolve(control);

        assertSame(minter, linked.requireMinter());
        assertSame(registry, linked.registry());
        assertTrue(linked.registryLinked());
    }

    @Test
    void testUnlinkedRegistryAcceptsEveryone() {
        EngineControl control = new EngineControl("owner", null);
        control.setLinkedMinter("minter");

        Collaborators.Linked linked = collaborators.resolve(control);

        assertFalse(linked.registryLinked());
        assertTrue(linked.registry().isValid("anyone"));
        linked.registry().recordGameStat("anyone", true, 10);
        verifyNoInteractions(registry);
    }

    @Test
    void testMissingMinterRejected() {
        Collaborators.Linked linked = collaborators.resolve(new EngineControl("owner", null));

        assertTrue(linked.minter().isEmpty());
        assertThrows(CollaboratorNotLinkedException.class, linked::requireMinter);
    }

    @Test
    void testUnknownReferencesRejected() {
        assertThrows(UnknownCollaboratorException.class, () -> collaborators.requireKnownMinter("other"));
        assertThrows(UnknownCollaboratorException.class, () -> collaborators.requireKnownRegistry("other"));
        assertDoesNotThrow(() -> collaborators.requireKnownMinter(""));
        assertDoesNotThrow(() -> collaborators.requireKnownRegistry(null));
    }
}
