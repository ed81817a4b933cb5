package io.causelog.storage;

/**
 * Parameters for {@link EventStore#streamEvents}. At most one of {@code correlationId},
 * {@code actor} and {@code command} may be set. {@code endId} is inclusive.
 */
public record StreamQuery(
        int batchSize,
        long startId,
        Long endId,
        String correlationId,
        String actor,
        String command
) {
    public static final int DEFAULT_BATCH_SIZE = 1000;

    public StreamQuery {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive");
        }
        int filters = (blank(correlationId) ? 0 : 1) + (blank(actor) ? 0 : 1) + (blank(command) ? 0 : 1);
        if (filters > 1) {
            throw new IllegalArgumentException("streamEvents accepts at most one of correlationId, actor, command");
        }
    }

    public static StreamQuery all() {
        return new StreamQuery(DEFAULT_BATCH_SIZE, 0L, null, null, null, null);
    }

    public StreamQuery withBatchSize(int batchSize) {
        return new StreamQuery(batchSize, startId, endId, correlationId, actor, command);
    }

    public StreamQuery from(long startId) {
        return new StreamQuery(batchSize, startId, endId, correlationId, actor, command);
    }

    public StreamQuery until(Long endId) {
        return new StreamQuery(batchSize, startId, endId, correlationId, actor, command);
    }

    public StreamQuery forCorrelation(String correlationId) {
        return new StreamQuery(batchSize, startId, endId, correlationId, actor, command);
    }

    public StreamQuery forActor(String actor) {
        return new StreamQuery(batchSize, startId, endId, correlationId, actor, command);
    }

    public StreamQuery forCommand(String command) {
        return new StreamQuery(batchSize, startId, endId, correlationId, actor, command);
    }

    static boolean blank(String value) {
        return value == null || value.isBlank();
    }
}
