package com.wagerengine.ledger;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for engine events.
 */
@Repository
public interface EngineEventRepository extends JpaRepository<EngineEvent, String> {

    List<EngineEvent> findByIdentityOrderBySequenceDesc(String identity);

    List<EngineEvent> findByEventTypeOrderBySequenceAsc(EventType eventType);

    List<EngineEvent> findTop50ByOrderBySequenceDesc();

    @Query("select coalesce(max(e.sequence), 0) from EngineEvent e")
    long findMaxSequence();
}
