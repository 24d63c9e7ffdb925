package com.abbacchio.store;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Filter for {@link LogStore#query} and {@link LogStore#count}. Unset fields do not filter.
 */
@Data
@Builder
public class LogQuery {

    public static final int DEFAULT_LIMIT = 100;

    private String channel;
    /** Matched against the message and the serialised extra data. */
    private String search;
    @Builder.Default
    private boolean useRegex = false;
    @Builder.Default
    private boolean caseSensitive = false;
    /** Level labels, e.g. {@code ["warn", "error"]}. */
    private List<String> levels;
    private List<String> namespaces;
    /** Inclusive lower bound on {@link LogEntry#getTime()}. */
    private Long minTime;
    /** Inclusive upper bound on {@link LogEntry#getTime()}. */
    private Long maxTime;
    @Builder.Default
    private int limit = DEFAULT_LIMIT;
    @Builder.Default
    private int offset = 0;

    public static LogQuery all() {
        return LogQuery.builder().build();
    }

    public static LogQuery forChannel(String channel) {
        return LogQuery.builder().channel(channel).build();
    }

    /**
     * Entries of {@code channel} within {@code halfWindowMs} of {@code centerTime},
     * both ends inclusive. Further filters can be added to the returned builder.
     */
    public static LogQueryBuilder timeWindow(String channel, long centerTime, long halfWindowMs) {
        return LogQuery.builder()
                .channel(channel)
                .minTime(centerTime - halfWindowMs)
                .maxTime(centerTime + halfWindowMs);
    }
}
