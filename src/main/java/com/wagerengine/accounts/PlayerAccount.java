package com.wagerengine.accounts;

import com.wagerengine.common.Amounts;
import com.wagerengine.common.exception.InsufficientFundsException;
import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Pegged-asset balance of one identity.
 *
 * The pegged units themselves sit in the engine's custody pool; this row is the
 * identity's claim on that pool. Accounts are created on first credit and never deleted.
 */
@Entity
@Table(name = "player_accounts")
@Data
@NoArgsConstructor
public class PlayerAccount {

    @Id
    private String identity;

    private long balance;

    @Version
    private Long version;

    @Column(name = "created_at")
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    public PlayerAccount(String identity) {
        this.identity = identity;
        this.balance = 0L;
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    public void credit(long amount) {
        Amounts.requireNonNegative(amount, "credit");
        this.balance = Amounts.add(balance, amount);
        this.updatedAt = Instant.now();
    }

    public void debit(long amount) {
        Amounts.requireNonNegative(amount, "debit");
        if (amount > balance) {
            throw new InsufficientFundsException(identity, amount, balance);
        }
        this.balance = balance - amount;
        this.updatedAt = Instant.now();
    }
}
