package io.syncbeat.mirror;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Local table holding one entity kind. Calls are expected to join the caller's transaction.
 */
public interface MirrorStore<E extends MirroredRecord> {

    /**
     * Largest page {@link #findPage(int, int)} returns.
     */
    int MAX_PAGE_SIZE = 1000;

    List<E> findAll();

    /**
     * Rows ordered by local id.
     *
     * @param offset rows to skip, not negative
     * @param limit  page size, positive; capped at {@link #MAX_PAGE_SIZE}
     */
    List<E> findPage(int offset, int limit);

    Optional<E> findById(long id);

    void insertAll(List<E> records);

    void updateAll(List<E> records);

    /**
     * @return number of rows deleted
     */
    int deleteByRemoteIds(Collection<Long> remoteIds);
}
