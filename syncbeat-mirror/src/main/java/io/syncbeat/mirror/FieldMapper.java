package io.syncbeat.mirror;

import java.util.Map;

/**
 * Copies remote field values onto a local entity.
 */
public interface FieldMapper<E extends MirroredRecord> {

    E create();

    /**
     * Overwrites every mirrored attribute of {@code target} from {@code remote}.
     * Identity and audit timestamps are left alone.
     */
    void apply(Map<String, Object> remote, E target);
}
