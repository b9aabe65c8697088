package com.comparo.core.model;

import java.io.Serializable;

/**
 * Summary statistics over the targets of one aggregate.
 * Response times are measured from the start of aggregation; null until a target completes.
 */
public record ResponseStats(
    int successCount,
    int errorCount,
    int pendingCount,
    double averageResponseLength,
    Long fastestResponseMs,
    Long slowestResponseMs
) implements Serializable {

    public static ResponseStats initial(int pendingCount) {
        return new ResponseStats(0, 0, pendingCount, 0.0, null, null);
    }
}
