package com.abbacchio.store;

import java.util.List;
import java.util.Map;

/**
 * Storage for log entries received over the gateway.
 */
public interface LogStore {

    /** Insert entries, replacing any stored entry with the same id. */
    void insert(List<LogEntry> entries);

    /**
     * Matching entries, newest first, paged by the query's limit and offset.
     *
     * @throws IllegalArgumentException if the query uses an invalid regex
     */
    List<LogEntry> query(LogQuery query);

    /** Number of matching entries, ignoring limit and offset. */
    long count(LogQuery query);

    /** Per-level counts for a channel ({@code null} for all) since {@code minTime} (nullable). */
    LevelCounts countByLevel(String channel, Long minTime);

    /** Entry count per namespace, sorted by namespace; entries without one are skipped. */
    Map<String, Long> namespaceCounts(String channel, Long minTime);

    /** Entry counts per hour bucket for a channel, oldest bucket first. */
    List<HourlyCount> hourlyCounts(String channel, Long minTime);

    /** Earliest and latest entry time of a channel. */
    TimeRange timeRange(String channel);

    /**
     * Position {@code time} would have in the newest-first result of {@code query}:
     * the number of matching entries strictly newer than it. Paging is ignored.
     */
    long indexOfTime(LogQuery query, long time);

    /** Distinct namespaces, sorted. {@code null} channel means all channels. */
    List<String> namespaces(String channel);

    /** Distinct channels, sorted. */
    List<String> channels();

    /** Remove entries older than {@code maxAgeMs}; returns how many were removed. */
    int prune(long maxAgeMs);

    /** Remove the entries of one channel, or all entries for {@code null}. */
    int clear(String channel);

    long size();
}
