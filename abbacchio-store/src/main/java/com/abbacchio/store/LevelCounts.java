package com.abbacchio.store;

import lombok.Data;

/**
 * Entry counts per level label.
 */
@Data
public class LevelCounts {

    private long all;
    private long trace;
    private long debug;
    private long info;
    private long warn;
    private long error;
    private long fatal;

    void increment(String levelLabel) {
        all++;
        switch (levelLabel == null ? "" : levelLabel) {
            case "trace" -> trace++;
            case "debug" -> debug++;
            case "info" -> info++;
            case "warn" -> warn++;
            case "error" -> error++;
            case "fatal" -> fatal++;
            default -> {
            }
        }
    }
}
