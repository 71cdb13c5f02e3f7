package com.flagship.gate_ledger.identity;

import com.flagship.gate_ledger.exception.IdentityConflictException;
import com.flagship.gate_ledger.exception.StoreUnavailableException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Identity store: the student and staff master data keyed by regNo.
 *
 * Students and staff form one keyspace. An upsert of a regNo that is
 * already registered under the other variant is rejected instead of
 * creating a second record.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IdentityService {

    private final IdentityRepository identityRepository;
    private final IdentityLookupCache lookupCache;

    /**
     * Looks up a registration number in the master data.
     *
     * @param regNo Registration number
     * @return the identity tagged with its variant, or empty if it is not registered
     * @throws StoreUnavailableException if the database cannot be reached
     */
    @Transactional(readOnly = true)
    public Optional<Identity> lookup(String regNo) {
        String key = normalize(regNo);

        Optional<Identity> cached = lookupCache.get(key);
        if (cached.isPresent()) {
            return cached;
        }

        Optional<Identity> found;
        try {
            found = identityRepository.findById(key).map(IdentityEntity::toDomain);
        } catch (DataAccessResourceFailureException | CannotCreateTransactionException e) {
            throw new StoreUnavailableException("Identity store unavailable while looking up " + key, e);
        }

        found.ifPresent(lookupCache::put);
        return found;
    }

    /**
     * Inserts or overwrites an identity under its variant.
     *
     * The first registration of a regNo is a single conditional insert, so
     * concurrent registrations never race into a duplicate key. An existing
     * row is locked before its variant is checked.
     *
     * @param identity validated identity
     * @return the stored identity
     * @throws IdentityConflictException if the regNo is registered under the other variant
     */
    @Transactional
    public Identity upsert(Identity identity) {
        String regNo = identity.getRegNo();

        int inserted = identityRepository.insertIfAbsent(
            regNo, identity.getName(), identity.getDepartment(), identity.getType().name());
        if (inserted == 1) {
            log.debug("Registered {} identity {}", identity.getType(), regNo);
            lookupCache.evictAfterCommit(regNo);
            return identity;
        }

        IdentityEntity entity = identityRepository.findByRegNoForUpdate(regNo)
            .orElseThrow(() -> new IllegalStateException("Identity " + regNo + " was deleted concurrently"));
        if (entity.getType() != identity.getType()) {
            throw new IdentityConflictException(regNo, entity.getType(), identity.getType());
        }
        entity.updateFromDomain(identity);
        IdentityEntity saved = identityRepository.save(entity);
        log.debug("Updated {} identity {}", identity.getType(), regNo);

        lookupCache.evictAfterCommit(regNo);
        return saved.toDomain();
    }

    /**
     * Bulk import. All records are written in one transaction: one invalid or
     * conflicting record rejects the whole batch.
     *
     * @return number of identities written
     */
    @Transactional
    public int upsertAll(List<Identity> identities) {
        for (Identity identity : identities) {
            upsert(identity);
        }
        log.info("Imported {} identities", identities.size());
        return identities.size();
    }

    /**
     * Removes each regNo from the master data whatever its variant.
     *
     * @return the number of regNos processed, not the number that existed
     */
    @Transactional
    public int deleteMany(Collection<String> regNos) {
        if (regNos == null || regNos.isEmpty()) {
            return 0;
        }
        Set<String> keys = new LinkedHashSet<>();
        for (String regNo : regNos) {
            if (regNo != null && !regNo.isBlank()) {
                keys.add(regNo.trim());
            }
        }

        int removed = keys.isEmpty() ? 0 : identityRepository.deleteByRegNoIn(keys);
        keys.forEach(lookupCache::evictAfterCommit);

        log.info("Bulk delete processed {} registration numbers ({} records removed)", regNos.size(), removed);
        return regNos.size();
    }

    public IdentityType classify(String regNo) {
        return IdentityType.classify(normalize(regNo));
    }

    @Transactional(readOnly = true)
    public List<Identity> findAllByType(IdentityType type) {
        return identityRepository.findByTypeOrderByRegNoAsc(type)
            .stream()
            .map(IdentityEntity::toDomain)
            .toList();
    }

    private static String normalize(String regNo) {
        if (regNo == null || regNo.isBlank()) {
            throw new IllegalArgumentException("Registration number is required");
        }
        return regNo.trim();
    }
}
