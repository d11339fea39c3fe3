package io.syncbeat.core;

import java.time.Instant;

/**
 * Next-fire predicate of a plan entry.
 */
public interface Timing {

    /**
     * @param lastRunAt last dispatch of the entry, or {@code null} if it never ran
     * @param now       current scheduler time
     */
    boolean isDue(Instant lastRunAt, Instant now);
}
