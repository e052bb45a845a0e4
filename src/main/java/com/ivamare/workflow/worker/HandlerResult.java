package com.ivamare.workflow.worker;

import java.time.Instant;
import java.util.Map;

/**
 * Outcome of a successful handler call.
 *
 * @param partial Whether only some stages were done
 * @param stage Last stage attempted, for partial results (nullable)
 * @param data Result metadata when complete, or partial results to resume from
 * @param resumeAt Earliest resume time for partial results (nullable)
 */
public record HandlerResult(
    boolean partial,
    String stage,
    Map<String, Object> data,
    Instant resumeAt
) {
    public HandlerResult {
        data = data != null ? data : Map.of();
    }

    public static HandlerResult completed() {
        return new HandlerResult(false, null, Map.of(), null);
    }

    public static HandlerResult completed(Map<String, Object> resultMetadata) {
        return new HandlerResult(false, null, resultMetadata, null);
    }

    public static HandlerResult partial(String stage, Map<String, Object> partialResults, Instant resumeAt) {
        return new HandlerResult(true, stage, partialResults, resumeAt);
    }
}
