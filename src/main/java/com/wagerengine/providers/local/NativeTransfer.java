package com.wagerengine.providers.local;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Native asset sent out of the engine. Append-only.
 */
@Entity
@Table(name = "native_transfers", indexes = {
    @Index(name = "idx_native_transfer_recipient", columnList = "recipient")
})
@Data
@NoArgsConstructor
public class NativeTransfer {

    @Id
    private String transferId;

    private String recipient;

    private long amount;

    private String reason;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public NativeTransfer(String recipient, long amount, String reason) {
        this.transferId = UUID.randomUUID().toString();
        this.recipient = recipient;
        this.amount = amount;
        this.reason = reason;
        this.createdAt = Instant.now();
    }
}
