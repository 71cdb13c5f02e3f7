package com.flagship.gate_ledger.identity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * JPA entity for the identity master table.
 *
 * Students and staff live in one table with a discriminator column, so the
 * primary key alone keeps a regNo out of both variants at once.
 *
 * No setters: the variant is fixed at insert, only name and department
 * change through {@link #updateFromDomain(Identity)}.
 */
@Entity
@Table(
    name = "identities",
    indexes = {
        @Index(name = "idx_identities_type", columnList = "identity_type")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class IdentityEntity {

    @Id
    @Column(name = "reg_no", nullable = false, updatable = false, length = 64)
    private String regNo;

    @Column(nullable = false)
    private String name;

    @Column(nullable = false)
    private String department;

    @Enumerated(EnumType.STRING)
    @Column(name = "identity_type", nullable = false, updatable = false, length = 16)
    private IdentityType type;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    static IdentityEntity fromDomain(Identity identity) {
        return new IdentityEntity(
            identity.getRegNo(),
            identity.getName(),
            identity.getDepartment(),
            identity.getType(),
            null, // createdAt - set by @PrePersist
            null  // updatedAt - set by @PrePersist
        );
    }

    public Identity toDomain() {
        return new Identity(regNo, name, department, type);
    }

    /**
     * Overwrites the mutable fields. The caller has already checked that the
     * variant matches.
     */
    void updateFromDomain(Identity identity) {
        if (identity.getType() != this.type) {
            throw new IllegalStateException(
                "Cannot change identity type of " + regNo + " from " + this.type + " to " + identity.getType());
        }
        this.name = identity.getName();
        this.department = identity.getDepartment();
    }
}
