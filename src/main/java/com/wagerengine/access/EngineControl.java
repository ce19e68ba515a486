package com.wagerengine.access;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Administrative state of the engine: owner, fee sink, pause flag and linked collaborators.
 *
 * There is exactly one row. It is mutated only through the owner operations of
 * {@link AccessGate} and read at the start of every entry point.
 */
@Entity
@Table(name = "engine_control")
@Data
@NoArgsConstructor
public class EngineControl {

    public static final String SINGLETON_ID = "engine";

    @Id
    private String id;

    private String owner;

    private String treasury;

    private boolean paused;

    /**
     * Bean name of the linked pegged-asset minter, null when unlinked.
     */
    private String linkedMinter;

    /**
     * Bean name of the linked identity registry, null when unlinked.
     */
    private String linkedRegistry;

    @Column(name = "updated_at")
    private Instant updatedAt;

    public EngineControl(String owner, String treasury) {
        this.id = SINGLETON_ID;
        this.owner = owner;
        this.treasury = treasury;
        this.paused = false;
        this.updatedAt = Instant.now();
    }

    public boolean isOwner(String identity) {
        return owner != null && owner.equals(identity);
    }

    public void touch() {
        this.updatedAt = Instant.now();
    }
}
