package com.flagship.gate_ledger.ledger;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for ledger entries.
 *
 * No setters. Closing and resolving are done with conditional bulk updates
 * in {@link LedgerEntryRepository}, so a row can never be closed or
 * resolved twice even under concurrent writers. The partial unique index
 * on open rows is created by the migration, JPA cannot express it.
 */
@Entity
@Table(
    name = "ledger_entries",
    indexes = {
        @Index(name = "idx_ledger_entries_reg_no", columnList = "reg_no"),
        @Index(name = "idx_ledger_entries_check_in_time", columnList = "check_in_time")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class LedgerEntryEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "reg_no", nullable = false, updatable = false, length = 64)
    private String regNo;

    @Column(name = "name")
    private String name;

    @Column(name = "department")
    private String department;

    @Enumerated(EnumType.STRING)
    @Column(name = "user_type", nullable = false, length = 16)
    private UserType userType;

    @Column(name = "check_in_time", nullable = false, updatable = false)
    private Instant checkInTime;

    @Column(name = "check_out_time")
    private Instant checkOutTime;

    static LedgerEntryEntity fromDomain(LedgerEntry entry) {
        if (!entry.isOpen()) {
            throw new IllegalArgumentException("Only open entries can be inserted: " + entry.getId());
        }
        return new LedgerEntryEntity(
            entry.getId(),
            entry.getRegNo(),
            entry.getName(),
            entry.getDepartment(),
            entry.getUserType(),
            entry.getCheckInTime(),
            null
        );
    }

    public LedgerEntry toDomain() {
        return new LedgerEntry(id, regNo, name, department, userType, checkInTime, checkOutTime);
    }
}
