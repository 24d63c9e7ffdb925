package com.abbacchio.store;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Earliest and latest entry time of a channel; both null when it has no entries.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TimeRange {

    private Long minTime;
    private Long maxTime;

    public boolean isEmpty() {
        return minTime == null;
    }
}
