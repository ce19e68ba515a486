package com.wagerengine.ledger;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Immutable record of an accepted engine operation.
 *
 * Events are never updated or deleted - they are append-only. Fields that do not
 * apply to an event type are left null.
 */
@Entity
@Table(name = "engine_events", indexes = {
    @Index(name = "idx_event_identity", columnList = "identity"),
    @Index(name = "idx_event_type", columnList = "event_type"),
    @Index(name = "idx_event_created_at", columnList = "created_at")
})
@Data
@NoArgsConstructor
public class EngineEvent {

    @Id
    private String eventId;

    /**
     * Monotonic position in the log, used for stable ordering.
     */
    @Column(name = "sequence_no", unique = true)
    private Long sequence;

    @Enumerated(EnumType.STRING)
    @Column(name = "event_type", nullable = false, updatable = false)
    private EventType eventType;

    /**
     * Account the event concerns, or the subject of an admin change.
     */
    private String identity;

    private String gameType;

    private Long nativeAmount;

    private Long peggedAmount;

    private Long betAmount;

    private Boolean won;

    private Long payout;

    private Long fee;

    /**
     * Free-form detail, e.g. old and new values of an admin change.
     */
    @Column(length = 1024)
    private String detail;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public EngineEvent(long sequence, EventType eventType, String identity) {
        this.eventId = UUID.randomUUID().toString();
        this.sequence = sequence;
        this.eventType = eventType;
        this.identity = identity;
        this.createdAt = Instant.now();
    }
}
