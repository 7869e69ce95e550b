package io.quirrel.storage;

import java.util.List;
import java.util.Optional;

/**
 * Boundary to the store that persists due times and fires deliveries.
 *
 * <p>Every method may throw {@link RegistryUnavailableException} when the store cannot be reached.
 * Implementations are shared by concurrent callers.
 */
public interface DurableScheduler extends AutoCloseable {

    /**
     * Atomically removes any entry named {@code entry.name()} and creates {@code entry}.
     * A concurrent reader sees either the old entry or the new one, never both and never neither
     * once this returns.
     *
     * @return id of the created entry
     * @throws UnsupportedScheduleException if this backend cannot express the schedule
     */
    long replace(ScheduledEntry entry);

    /**
     * Creates {@code entry} unless an entry named {@code entry.name()} exists. The check and the
     * write happen in one store transaction.
     *
     * @return id of the created entry, empty when an entry was already present
     * @throws UnsupportedScheduleException if this backend cannot express the schedule
     */
    Optional<Long> createIfAbsent(ScheduledEntry entry);

    Optional<StoredJob> findById(long id);

    Optional<StoredJob> findByName(String name);

    /**
     * Keyset page of the entries of {@code route}, ordered by id.
     *
     * @param route null for every entry this scheduler owns
     */
    List<StoredJob> page(String route, long afterId, int limit);

    int unscheduleByName(String name);

    boolean unscheduleById(long id);

    /**
     * Removes every entry this scheduler instance owns.
     *
     * @return number of removed entries
     */
    int unscheduleAll();

    /**
     * Makes an existing entry due now. Repeating entries keep their schedule afterwards.
     *
     * @return false if the entry does not exist
     */
    boolean triggerNow(long id);

    @Override
    void close();
}
