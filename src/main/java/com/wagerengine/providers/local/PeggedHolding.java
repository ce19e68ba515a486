package com.wagerengine.providers.local;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Pegged units held by one holder in the local minter.
 */
@Entity
@Table(name = "pegged_holdings")
@Data
@NoArgsConstructor
public class PeggedHolding {

    @Id
    private String holder;

    private long units;

    public PeggedHolding(String holder) {
        this.holder = holder;
    }
}
