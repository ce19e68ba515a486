package com.wagerengine.access;

import com.wagerengine.common.exception.EnginePausedException;
import com.wagerengine.common.exception.IdentityNotEligibleException;
import com.wagerengine.common.exception.InvalidIdentityException;
import com.wagerengine.common.exception.UnauthorizedCallerException;
import com.wagerengine.config.WagerEngineProperties;
import com.wagerengine.ledger.EventLog;
import com.wagerengine.ledger.EventType;
import com.wagerengine.providers.Collaborators;
import com.wagerengine.providers.IdentityRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Objects;

/**
 * Admission gate and owner operations.
 *
 * Money-moving entry points call {@link #admit} first; administrative entry points call
 * {@link #requireOwner}. Both run inside the caller's transaction.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AccessGate {

    private final EngineControlRepository controlRepository;
    private final CapabilitySet capabilitySet;
    private final Collaborators collaborators;
    private final EventLog eventLog;
    private final WagerEngineProperties properties;

    @Transactional
    public EngineControl control() {
        return controlRepository.findById(EngineControl.SINGLETON_ID)
            .orElseThrow(() -> new IllegalStateException("Engine control record is missing"));
    }

    /**
     * Admission check for deposit, withdraw and playGame.
     *
     * @return the control record, for resolving collaborators
     * @throws EnginePausedException while paused
     */
    @Transactional
    public EngineControl admit(String operation) {
        EngineControl control = control();
        if (control.isPaused()) {
            log.info("Rejected {} while paused", operation);
            throw new EnginePausedException(operation);
        }
        return control;
    }

    @Transactional
    public EngineControl requireOwner(String caller, String operation) {
        EngineControl control = control();
        if (!control.isOwner(caller)) {
            log.warn("Rejected {} from non-owner {}", operation, caller);
            throw new UnauthorizedCallerException(caller, operation + " requires the owner");
        }
        return control;
    }

    /**
     * Identity check against the linked registry. With no registry linked the
     * {@link IdentityRegistry#UNLINKED} stand-in accepts everyone.
     */
    public void requireEligible(String identity, IdentityRegistry registry) {
        if (identity == null || identity.isBlank()) {
            throw new InvalidIdentityException("identity");
        }
        if (!registry.isValid(identity)) {
            throw new IdentityNotEligibleException(identity);
        }
    }

    public boolean hasCapability(String identity, Role role) {
        return capabilitySet.hasCapability(identity, role);
    }

    public String engineIdentity() {
        return properties.getEngineIdentity();
    }

    @Transactional
    public void pause(String caller) {
        EngineControl control = requireOwner(caller, "pause");
        if (control.isPaused()) {
            return;
        }
        control.setPaused(true);
        control.touch();
        controlRepository.save(control);
        eventLog.recordAdminChange(EventType.PAUSED, caller, null);
        log.warn("Engine paused by {}", caller);
    }

    @Transactional
    public void unpause(String caller) {
        EngineControl control = requireOwner(caller, "unpause");
        if (!control.isPaused()) {
            return;
        }
        control.setPaused(false);
        control.touch();
        controlRepository.save(control);
        eventLog.recordAdminChange(EventType.UNPAUSED, caller, null);
        log.warn("Engine unpaused by {}", caller);
    }

    @Transactional
    public void setTreasury(String caller, String treasury) {
        EngineControl control = requireOwner(caller, "setTreasury");
        if (treasury == null || treasury.isBlank()) {
            throw new InvalidIdentityException("treasury");
        }
        String old = control.getTreasury();
        control.setTreasury(treasury);
        control.touch();
        controlRepository.save(control);
        eventLog.recordTreasuryUpdated(old, treasury);
        log.info("Treasury changed from {} to {}", old, treasury);
    }

    @Transactional
    public void transferOwnership(String caller, String newOwner) {
        EngineControl control = requireOwner(caller, "transferOwnership");
        if (newOwner == null || newOwner.isBlank()) {
            throw new InvalidIdentityException("new owner");
        }
        control.setOwner(newOwner);
        control.touch();
        controlRepository.save(control);
        eventLog.recordAdminChange(EventType.OWNERSHIP_TRANSFERRED, newOwner, "old=" + caller + " new=" + newOwner);
        log.warn("Ownership transferred from {} to {}", caller, newOwner);
    }

    /**
     * Point the engine at a minter and an identity registry by bean name.
     * A blank name unlinks that collaborator.
     */
    @Transactional
    public void linkCollaborators(String caller, String minterRef, String registryRef) {
        EngineControl control = requireOwner(caller, "linkCollaborators");
        collaborators.requireKnownMinter(minterRef);
        collaborators.requireKnownRegistry(registryRef);
        control.setLinkedMinter(blankToNull(minterRef));
        control.setLinkedRegistry(blankToNull(registryRef));
        control.touch();
        controlRepository.save(control);
        eventLog.recordLinked(control.getLinkedMinter(), control.getLinkedRegistry());
        log.info("Linked minter={} registry={}", control.getLinkedMinter(), control.getLinkedRegistry());
    }

    @Transactional
    public void authorize(String caller, Role role, String identity) {
        requireOwner(caller, "authorize");
        Objects.requireNonNull(role, "role");
        if (identity == null || identity.isBlank()) {
            throw new InvalidIdentityException("identity");
        }
        if (capabilitySet.grant(identity, role)) {
            eventLog.recordAdminChange(EventType.CAPABILITY_GRANTED, identity, role.name());
        }
    }

    @Transactional
    public void revoke(String caller, Role role, String identity) {
        requireOwner(caller, "revoke");
        Objects.requireNonNull(role, "role");
        if (capabilitySet.revoke(identity, role)) {
            eventLog.recordAdminChange(EventType.CAPABILITY_REVOKED, identity, role.name());
        }
    }

    private static String blankToNull(String ref) {
        return ref == null || ref.isBlank() ? null : ref;
    }
}
