package io.heartbeat4j.exception;

/**
 * Thrown when a cron spec cannot be parsed or never fires.
 */
public class InvalidCronSpecException extends IllegalArgumentException {

    private final String cronSpec;

    public InvalidCronSpecException(String cronSpec, String reason) {
        super("Invalid cron spec (" + cronSpec + "): " + reason);
        this.cronSpec = cronSpec;
    }

    public InvalidCronSpecException(String cronSpec, Throwable cause) {
        super("Invalid cron spec (" + cronSpec + "): " + cause.getMessage(), cause);
        this.cronSpec = cronSpec;
    }

    public String getCronSpec() {
        return cronSpec;
    }
}
