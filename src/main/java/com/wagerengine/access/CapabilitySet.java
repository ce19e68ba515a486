package com.wagerengine.access;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Capability set keyed by identity. {@link #hasCapability} is the only predicate
 * used for role checks anywhere in the engine.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CapabilitySet {

    private final CapabilityGrantRepository grantRepository;

    @Transactional
    public boolean hasCapability(String identity, Role role) {
        if (identity == null) {
            return false;
        }
        return grantRepository.existsByIdentityAndRole(identity, role);
    }

    /**
     * @return true if the grant was added, false if the identity already held the role
     */
    @Transactional
    public boolean grant(String identity, Role role) {
        if (grantRepository.existsByIdentityAndRole(identity, role)) {
            return false;
        }
        grantRepository.save(new CapabilityGrant(identity, role));
        log.info("Granted {} to {}", role, identity);
        return true;
    }

    /**
     * @return true if a grant was removed
     */
    @Transactional
    public boolean revoke(String identity, Role role) {
        boolean removed = grantRepository.deleteByIdentityAndRole(identity, role) > 0;
        if (removed) {
            log.info("Revoked {} from {}", role, identity);
        }
        return removed;
    }
}
