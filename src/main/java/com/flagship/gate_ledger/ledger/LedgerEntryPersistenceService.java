package com.flagship.gate_ledger.ledger;

import com.flagship.gate_ledger.exception.EntryNotFoundException;
import com.flagship.gate_ledger.identity.Identity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.ResultSetExtractor;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Ledger store: persistence of check-in/check-out records.
 *
 * Bridges the domain {@link LedgerEntry} and {@link LedgerEntryEntity}.
 * Entries are never deleted; the only updates are closing an open entry and
 * resolving an unknown one, both done as conditional updates.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LedgerEntryPersistenceService {

    private final LedgerEntryRepository ledgerEntryRepository;
    private final JdbcTemplate jdbcTemplate;

    /**
     * Serializes scans of one regNo until the surrounding transaction ends.
     *
     * Uses a transaction-scoped PostgreSQL advisory lock, so scans of
     * different regNos never wait on each other (barring hash collisions).
     * Must run inside the caller's transaction.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void lockRegNo(String regNo) {
        jdbcTemplate.query(
            "SELECT pg_advisory_xact_lock(hashtext(?))",
            (ResultSetExtractor<Void>) rs -> null,
            regNo
        );
        log.debug("Acquired scan lock for {}", regNo);
    }

    @Transactional(readOnly = true)
    public Optional<LedgerEntry> findOpenEntry(String regNo) {
        return ledgerEntryRepository.findFirstByRegNoAndCheckOutTimeIsNull(regNo)
            .map(LedgerEntryEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public Optional<LedgerEntry> findById(UUID entryId) {
        return ledgerEntryRepository.findById(entryId)
            .map(LedgerEntryEntity::toDomain);
    }

    /**
     * Persists a new open entry.
     */
    @Transactional
    public LedgerEntry create(LedgerEntry entry) {
        LedgerEntryEntity saved = ledgerEntryRepository.save(LedgerEntryEntity.fromDomain(entry));
        log.debug("Created ledger entry {} for {}", saved.getId(), saved.getRegNo());
        return saved.toDomain();
    }

    /**
     * Closes one entry.
     *
     * @throws EntryNotFoundException if no entry has this id
     * @throws IllegalStateException if the entry is already closed, including
     *         when a concurrent writer closed it first
     */
    @Transactional
    public LedgerEntry close(UUID entryId, Instant at) {
        LedgerEntry entry = findById(entryId)
            .orElseThrow(() -> new EntryNotFoundException(entryId));

        LedgerEntry closed = entry.checkOut(at);

        int updated = ledgerEntryRepository.closeIfOpen(entryId, at);
        if (updated == 0) {
            throw new IllegalStateException("Ledger entry " + entryId + " was checked out concurrently");
        }

        log.debug("Closed ledger entry {} at {}", entryId, at);
        return closed;
    }

    /**
     * Closes every open entry in a single statement. An entry checked in after
     * {@code at} (a concurrent scan, or a scan stamped ahead of this node's
     * clock) is closed at its own check-in time.
     *
     * @return the entries closed by this call; empty if none were open
     */
    @Transactional
    public List<LedgerEntry> closeAllOpen(Instant at) {
        List<LedgerEntry> closed = jdbcTemplate.query(
            "UPDATE ledger_entries SET check_out_time = GREATEST(?, check_in_time) " +
            "WHERE check_out_time IS NULL " +
            "RETURNING id, reg_no, name, department, user_type, check_in_time, check_out_time",
            ledgerEntryRowMapper(),
            Timestamp.from(at)
        );
        log.debug("Closed {} open ledger entries at {}", closed.size(), at);
        return closed;
    }

    /**
     * Fills identity fields on every unresolved entry of the identity's regNo.
     *
     * @return number of rows resolved; 0 if none were unresolved
     */
    @Transactional
    public int resolveUnknown(Identity identity) {
        int updated = ledgerEntryRepository.resolveUnknownEntries(
            identity.getRegNo(),
            identity.getName(),
            identity.getDepartment(),
            UserType.of(identity.getType())
        );
        log.debug("Resolved {} unknown entries for {}", updated, identity.getRegNo());
        return updated;
    }

    @Transactional(readOnly = true)
    public List<LedgerEntry> findAll() {
        return toDomain(ledgerEntryRepository.findAllByOrderByCheckInTimeAsc());
    }

    @Transactional(readOnly = true)
    public List<LedgerEntry> findOpen() {
        return toDomain(ledgerEntryRepository.findByCheckOutTimeIsNullOrderByCheckInTimeAsc());
    }

    @Transactional(readOnly = true)
    public List<LedgerEntry> findByRegNo(String regNo) {
        return toDomain(ledgerEntryRepository.findByRegNoOrderByCheckInTimeAsc(regNo));
    }

    @Transactional(readOnly = true)
    public List<LedgerEntry> findUnresolved() {
        return toDomain(ledgerEntryRepository.findByNameIsNullOrderByCheckInTimeAsc());
    }

    @Transactional(readOnly = true)
    public List<String> findUnresolvedRegNos() {
        return ledgerEntryRepository.findDistinctUnresolvedRegNos();
    }

    private RowMapper<LedgerEntry> ledgerEntryRowMapper() {
        return (rs, rowNum) -> new LedgerEntry(
            rs.getObject("id", UUID.class),
            rs.getString("reg_no"),
            rs.getString("name"),
            rs.getString("department"),
            UserType.valueOf(rs.getString("user_type")),
            rs.getTimestamp("check_in_time").toInstant(),
            rs.getTimestamp("check_out_time").toInstant()
        );
    }

    private static List<LedgerEntry> toDomain(List<LedgerEntryEntity> entities) {
        return entities.stream()
            .map(LedgerEntryEntity::toDomain)
            .toList();
    }
}
