package com.bluequee.tabconfig.domain.port;

import com.bluequee.tabconfig.domain.TabFilter;
import com.bluequee.tabconfig.domain.TabRecord;
import com.bluequee.tabconfig.domain.TabScope;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Persistence port for tab configuration records.
 *
 * <p>Implementations assign {@code id}, {@code createdAt} and {@code updatedAt}. Reads inside
 * {@link #inKeyTransaction} observe the locked state, so read-validate-write sequences for one key
 * are serialized.
 */
public interface TabConfigStore {

    /** Records matching the filter, ordered by display order then key. */
    List<TabRecord> find(TabFilter filter);

    Optional<TabRecord> findById(long id);

    /** Records for the ids that exist; missing ids are silently skipped. */
    List<TabRecord> findAllById(Collection<Long> ids);

    Optional<TabRecord> findInSlot(String key, TabScope scope, Long ownerId);

    /**
     * Inserts an unsaved record.
     *
     * @throws com.bluequee.tabconfig.domain.error.DuplicateTabKeyException if the slot is taken
     */
    TabRecord insert(TabRecord record);

    /**
     * Overwrites the mutable columns of an existing record.
     *
     * @throws com.bluequee.tabconfig.domain.error.TabNotFoundException if the id is gone
     */
    TabRecord update(TabRecord record);

    /** @return false if nothing was deleted */
    boolean delete(long id);

    /** Deletes every non-system record at {@code scope} owned by {@code ownerId}. */
    int deleteOverrides(TabScope scope, long ownerId);

    /**
     * Runs {@code work} atomically while holding an exclusive lock on every record with
     * {@code key}. A runtime exception from {@code work} rolls back all its writes.
     */
    <T> T inKeyTransaction(String key, Supplier<T> work);

    /** Runs {@code work} atomically. */
    <T> T inTransaction(Supplier<T> work);
}
