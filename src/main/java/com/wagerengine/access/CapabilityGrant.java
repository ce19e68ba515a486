package com.wagerengine.access;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One (identity, role) entry of the capability set.
 */
@Entity
@Table(name = "capability_grants", uniqueConstraints = {
    @UniqueConstraint(name = "uk_capability_identity_role", columnNames = {"identity", "role"})
})
@Data
@NoArgsConstructor
public class CapabilityGrant {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    private String identity;

    @Enumerated(EnumType.STRING)
    private Role role;

    @Column(name = "granted_at")
    private Instant grantedAt;

    public CapabilityGrant(String identity, Role role) {
        this.identity = identity;
        this.role = role;
        this.grantedAt = Instant.now();
    }
}
