package com.flagship.gate_ledger.identity;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface IdentityRepository extends JpaRepository<IdentityEntity, String> {

    List<IdentityEntity> findByTypeOrderByRegNoAsc(IdentityType type);

    /**
     * Inserts the identity unless the regNo is already registered. Waits for
     * a concurrent insert of the same regNo to finish instead of failing.
     *
     * @return 1 if inserted, 0 if the regNo already existed
     */
    @Modifying
    @Query(value = """
        INSERT INTO identities (reg_no, name, department, identity_type, created_at, updated_at)
        VALUES (:regNo, :name, :department, :type, now(), now())
        ON CONFLICT (reg_no) DO NOTHING
        """, nativeQuery = true)
    int insertIfAbsent(@Param("regNo") String regNo,
                       @Param("name") String name,
                       @Param("department") String department,
                       @Param("type") String type);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT i FROM IdentityEntity i WHERE i.regNo = :regNo")
    Optional<IdentityEntity> findByRegNoForUpdate(@Param("regNo") String regNo);

    /**
     * Removes every listed regNo whatever its variant. Missing regNos are ignored.
     */
    @Modifying
    @Query("DELETE FROM IdentityEntity i WHERE i.regNo IN :regNos")
    int deleteByRegNoIn(@Param("regNos") Collection<String> regNos);
}
