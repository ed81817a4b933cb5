package io.causelog.lineage;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.causelog.model.Event;

import java.util.List;
import java.util.stream.Collectors;

/**
 * One root-to-node causation path inside a correlation. {@code depth} is the number of hops
 * from the root, so a root's own branch has depth 0.
 */
public record Branch(Event event, long rootId, List<Long> path, int depth) {
    public Branch {
        path = List.copyOf(path);
    }

    @JsonProperty
    public String pathString() {
        return path.stream().map(String::valueOf).collect(Collectors.joining("->"));
    }
}
