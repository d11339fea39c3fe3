package io.syncbeat.core;

/**
 * The schedule store could not be reached. Transient: callers retry on their next cycle.
 */
public class ScheduleStoreUnavailableException extends RuntimeException {

    public ScheduleStoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
