package io.syncbeat.core;

import java.util.Map;

/**
 * Shared key-value collection holding one serialized {@link JobSpec} per job name.
 *
 * <p>Written by API-facing collaborators and read by the scheduler. No locking: readers see
 * whatever is currently stored.
 *
 * <p>Implementations translate backend failures into {@link ScheduleStoreUnavailableException}.
 */
public interface ScheduleStore {

    /**
     * Insert or overwrite the entry stored under {@code name}.
     */
    void addOrReplace(String name, String serializedSpec);

    /**
     * @return true if an entry was deleted
     */
    boolean remove(String name);

    /**
     * Full current contents, keyed by job name. Values are returned as stored (possibly unparsable).
     */
    Map<String, String> listAll();
}
