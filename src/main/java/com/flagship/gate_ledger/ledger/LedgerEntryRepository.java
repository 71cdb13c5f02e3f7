package com.flagship.gate_ledger.ledger;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface LedgerEntryRepository extends JpaRepository<LedgerEntryEntity, UUID> {

    /**
     * The open entry for a regNo. Backed by the partial unique index
     * {@code uq_ledger_entries_open_reg_no}, so there is at most one.
     */
    Optional<LedgerEntryEntity> findFirstByRegNoAndCheckOutTimeIsNull(String regNo);

    List<LedgerEntryEntity> findAllByOrderByCheckInTimeAsc();

    List<LedgerEntryEntity> findByCheckOutTimeIsNullOrderByCheckInTimeAsc();

    List<LedgerEntryEntity> findByRegNoOrderByCheckInTimeAsc(String regNo);

    List<LedgerEntryEntity> findByNameIsNullOrderByCheckInTimeAsc();

    @Query("SELECT DISTINCT l.regNo FROM LedgerEntryEntity l WHERE l.name IS NULL ORDER BY l.regNo")
    List<String> findDistinctUnresolvedRegNos();

    long countByCheckOutTimeIsNull();

    long countByNameIsNull();

    /**
     * Closes one entry only if it is still open.
     *
     * @return 1 if the entry was closed by this call, 0 if it was already closed
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE LedgerEntryEntity l SET l.checkOutTime = :at WHERE l.id = :id AND l.checkOutTime IS NULL")
    int closeIfOpen(@Param("id") UUID id, @Param("at") Instant at);

    /**
     * Copies identity fields onto the unresolved rows of one regNo.
     * Rows that already carry a name are never touched.
     *
     * @return number of rows resolved
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
        UPDATE LedgerEntryEntity l
        SET l.name = :name, l.department = :department, l.userType = :userType
        WHERE l.regNo = :regNo AND l.name IS NULL
        """)
    int resolveUnknownEntries(@Param("regNo") String regNo,
                              @Param("name") String name,
                              @Param("department") String department,
                              @Param("userType") UserType userType);
}
