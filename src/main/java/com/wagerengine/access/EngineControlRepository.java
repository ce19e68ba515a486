package com.wagerengine.access;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * Repository for the engine control record.
 */
@Repository
public interface EngineControlRepository extends JpaRepository<EngineControl, String> {
}
