package com.abbacchio.store;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Entry count for one hour bucket; {@code hour} is the bucket start in epoch millis.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class HourlyCount {

    public static final long HOUR_MS = 3_600_000L;

    private long hour;
    private long count;

    public static long bucketOf(long time) {
        return Math.floorDiv(time, HOUR_MS) * HOUR_MS;
    }
}
