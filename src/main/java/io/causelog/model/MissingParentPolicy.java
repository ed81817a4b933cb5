package io.causelog.model;

/**
 * What {@code store} does when a request names a causation id that is not in the log
 * and carries no correlation id of its own.
 */
public enum MissingParentPolicy {
    /**
     * Persist the event under a freshly generated correlation id and log an integrity warning.
     * The broken reference stays visible to the orphan query.
     */
    NEW_CORRELATION,
    /**
     * Refuse the event as a validation error; nothing is persisted.
     */
    REJECT;

    public static MissingParentPolicy fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return NEW_CORRELATION;
        }
        String normalized = raw.trim().replace('-', '_');
        for (MissingParentPolicy value : values()) {
            if (value.name().equalsIgnoreCase(normalized)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown missing parent policy: " + raw);
    }
}
