package io.causelog.model;

import java.util.List;

public record Page(List<Event> events, long totalCount, boolean hasMore, Integer nextOffset) {
    public static Page of(List<Event> events, long totalCount, int limit, int offset) {
        boolean more = (long) offset + limit < totalCount;
        return new Page(List.copyOf(events), totalCount, more, more ? offset + limit : null);
    }
}
