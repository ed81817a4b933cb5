package io.causelog.pattern;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.causelog.util.Jsons;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A primary correlation id plus named secondary correlations, stored under
 * {@code metadata.correlations}.
 */
public final class CorrelationContext {
    private final String primary;
    private final Map<String, String> secondary = new LinkedHashMap<>();

    private CorrelationContext(String primary) {
        this.primary = primary;
    }

    public static CorrelationContext of(String primary) {
        return new CorrelationContext(primary);
    }

    public CorrelationContext add(String name, String correlationId) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("correlation name must not be blank");
        }
        secondary.put(name, correlationId);
        return this;
    }

    public CorrelationContext addRule(String ruleId) {
        return add("ruleCorrelationId", "RULE-" + ruleId + "-history");
    }

    public CorrelationContext addUser(String userId) {
        return add("userCorrelationId", "USER-" + userId + "-activity");
    }

    public CorrelationContext addBatch(String batchId) {
        return add("batchCorrelationId", batchId);
    }

    public CorrelationContext addTransaction(String transactionId) {
        return add("transactionCorrelationId", transactionId);
    }

    public String primary() {
        return primary;
    }

    public Map<String, String> secondary() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(secondary));
    }

    /**
     * {@code primary} first, then the secondary correlations in the order they were added.
     */
    public Map<String, String> build() {
        Map<String, String> out = new LinkedHashMap<>();
        out.put("primary", primary);
        out.putAll(secondary);
        return out;
    }

    public ObjectNode toMetadata() {
        ObjectNode correlations = Jsons.object();
        secondary.forEach(correlations::put);
        ObjectNode metadata = Jsons.object();
        metadata.set("correlations", correlations);
        return metadata;
    }
}
