package com.abbacchio.store;

import com.abbacchio.common.config.AbbacchioConfig;
import com.abbacchio.common.config.ConfigDefaults;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.LongSummaryStatistics;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Predicate;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Thread-safe {@link LogStore} kept in memory, keyed by entry id.
 * Entries with equal timestamps are returned newest-inserted first.
 */
@Slf4j
public class InMemoryLogStore implements LogStore {

    private record Stored(LogEntry entry, long sequence) {
    }

    private static final Comparator<Stored> NEWEST_FIRST = Comparator
            .comparingLong((Stored s) -> s.entry().getTime())
            .thenComparingLong(Stored::sequence)
            .reversed();

    private final Map<String, Stored> entries = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();
    private final Clock clock;
    private final long maxAgeMs;

    public InMemoryLogStore() {
        this(Clock.systemUTC(), ConfigDefaults.DEFAULT_STORE_MAX_AGE_MS);
    }

    public InMemoryLogStore(Clock clock, long maxAgeMs) {
        this.clock = clock;
        this.maxAgeMs = maxAgeMs;
    }

    public static InMemoryLogStore fromConfig(AbbacchioConfig config) {
        Long maxAge = config != null && config.getStore() != null ? config.getStore().getMaxAgeMs() : null;
        return new InMemoryLogStore(Clock.systemUTC(),
                maxAge != null && maxAge > 0 ? maxAge : ConfigDefaults.DEFAULT_STORE_MAX_AGE_MS);
    }

    public long getMaxAgeMs() {
        return maxAgeMs;
    }

    // ==================== Writes ====================

    @Override
    public void insert(List<LogEntry> batch) {
        for (LogEntry entry : batch) {
            Objects.requireNonNull(entry.getId(), "entry id");
            entries.put(entry.getId(), new Stored(entry, sequence.incrementAndGet()));
        }
    }

    /** Prune with the configured retention. */
    public int pruneExpired() {
        return prune(maxAgeMs);
    }

    @Override
    public int prune(long maxAgeMs) {
        long cutoff = clock.millis() - maxAgeMs;
        int removed = removeIf(s -> s.entry().getTime() < cutoff);
        if (removed > 0) {
            log.debug("Pruned {} entries older than {} ms", removed, maxAgeMs);
        }
        return removed;
    }

    @Override
    public int clear(String channel) {
        if (channel == null) {
            int removed = entries.size();
            entries.clear();
            return removed;
        }
        return removeIf(s -> channel.equals(s.entry().getChannel()));
    }

    private int removeIf(Predicate<Stored> predicate) {
        int removed = 0;
        for (Map.Entry<String, Stored> e : entries.entrySet()) {
            if (predicate.test(e.getValue()) && entries.remove(e.getKey(), e.getValue())) {
                removed++;
            }
        }
        return removed;
    }

    // ==================== Reads ====================

    @Override
    public List<LogEntry> query(LogQuery query) {
        if (query.getLimit() <= 0) {
            return List.of();
        }
        return matching(query)
                .sorted(NEWEST_FIRST)
                .skip(Math.max(0, query.getOffset()))
                .limit(query.getLimit())
                .map(Stored::entry)
                .collect(Collectors.toList());
    }

    @Override
    public long count(LogQuery query) {
        return matching(query).count();
    }

    @Override
    public LevelCounts countByLevel(String channel, Long minTime) {
        LevelCounts counts = new LevelCounts();
        LogQuery query = LogQuery.builder().channel(channel).minTime(minTime).build();
        matching(query).forEach(s -> counts.increment(s.entry().getLevelLabel()));
        return counts;
    }

    @Override
    public Map<String, Long> namespaceCounts(String channel, Long minTime) {
        return matching(LogQuery.builder().channel(channel).minTime(minTime).build())
                .map(s -> s.entry().getNamespace())
                .filter(Objects::nonNull)
                .collect(Collectors.groupingBy(ns -> ns, TreeMap::new, Collectors.counting()));
    }

    @Override
    public List<HourlyCount> hourlyCounts(String channel, Long minTime) {
        Map<Long, Long> buckets = matching(LogQuery.builder().channel(channel).minTime(minTime).build())
                .collect(Collectors.groupingBy(s -> HourlyCount.bucketOf(s.entry().getTime()),
                        TreeMap::new, Collectors.counting()));
        List<HourlyCount> counts = new ArrayList<>(buckets.size());
        buckets.forEach((hour, count) -> counts.add(new HourlyCount(hour, count)));
        return counts;
    }

    @Override
    public TimeRange timeRange(String channel) {
        LongSummaryStatistics stats = matching(LogQuery.forChannel(channel))
                .mapToLong(s -> s.entry().getTime())
                .summaryStatistics();
        if (stats.getCount() == 0) {
            return new TimeRange(null, null);
        }
        return new TimeRange(stats.getMin(), stats.getMax());
    }

    @Override
    public long indexOfTime(LogQuery query, long time) {
        return matching(query).filter(s -> s.entry().getTime() > time).count();
    }

    @Override
    public List<String> namespaces(String channel) {
        return entries.values().stream()
                .map(Stored::entry)
                .filter(e -> channel == null || channel.equals(e.getChannel()))
                .map(LogEntry::getNamespace)
                .filter(Objects::nonNull)
                .distinct()
                .sorted()
                .collect(Collectors.toList());
    }

    @Override
    public List<String> channels() {
        return entries.values().stream()
                .map(s -> s.entry().getChannel())
                .filter(Objects::nonNull)
                .distinct()
                .sorted()
                .collect(Collectors.toList());
    }

    @Override
    public long size() {
        return entries.size();
    }

    private Stream<Stored> matching(LogQuery query) {
        Predicate<LogEntry> filter = compile(query);
        return entries.values().stream().filter(s -> filter.test(s.entry()));
    }

    private static Predicate<LogEntry> compile(LogQuery query) {
        Predicate<LogEntry> filter = e -> true;
        if (query.getChannel() != null) {
            filter = filter.and(e -> query.getChannel().equals(e.getChannel()));
        }
        if (notEmpty(query.getLevels())) {
            filter = filter.and(e -> query.getLevels().contains(e.getLevelLabel()));
        }
        if (notEmpty(query.getNamespaces())) {
            filter = filter.and(e -> query.getNamespaces().contains(e.getNamespace()));
        }
        if (query.getMinTime() != null) {
            long minTime = query.getMinTime();
            filter = filter.and(e -> e.getTime() >= minTime);
        }
        if (query.getMaxTime() != null) {
            long maxTime = query.getMaxTime();
            filter = filter.and(e -> e.getTime() <= maxTime);
        }
        if (query.getSearch() != null && !query.getSearch().isEmpty()) {
            Predicate<String> text = textMatcher(query);
            filter = filter.and(e -> text.test(e.getMsg())
                    || (e.getData() != null && !e.getData().isEmpty() && text.test(e.getData().toString())));
        }
        return filter;
    }

    private static Predicate<String> textMatcher(LogQuery query) {
        if (query.isUseRegex()) {
            Pattern pattern = Pattern.compile(query.getSearch(),
                    query.isCaseSensitive() ? 0 : Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
            return s -> s != null && pattern.matcher(s).find();
        }
        if (query.isCaseSensitive()) {
            return s -> s != null && s.contains(query.getSearch());
        }
        String needle = query.getSearch().toLowerCase(Locale.ROOT);
        return s -> s != null && s.toLowerCase(Locale.ROOT).contains(needle);
    }

    private static boolean notEmpty(Collection<?> values) {
        return values != null && !values.isEmpty();
    }
}
