package com.wagerengine.access;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * Repository for capability grants.
 */
@Repository
public interface CapabilityGrantRepository extends JpaRepository<CapabilityGrant, Long> {

    boolean existsByIdentityAndRole(String identity, Role role);

    long deleteByIdentityAndRole(String identity, Role role);
}
