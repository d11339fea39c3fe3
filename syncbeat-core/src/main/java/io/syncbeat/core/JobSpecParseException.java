package io.syncbeat.core;

/**
 * A schedule store entry could not be turned into a {@link JobSpec} or a {@link Timing}.
 */
public class JobSpecParseException extends RuntimeException {

    private final String jobName;

    public JobSpecParseException(String jobName, String message) {
        this(jobName, message, null);
    }

    public JobSpecParseException(String jobName, String message, Throwable cause) {
        super(jobName == null ? message : "job '" + jobName + "': " + message, cause);
        this.jobName = jobName;
    }

    public String getJobName() {
        return jobName;
    }
}
