package com.openforge.memkeep.stream;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Bound from application.yml under "agent.stream".
 *
 * <pre>
 * agent:
 *   stream:
 *     context-cap: 64000          # tokens
 *     capacity-fraction: 0.85     # consolidate above cap × fraction
 *     recent-turn-window: 12      # turns sent with each inference
 *     rolling-overlap: 3          # turns kept after a successful flush
 *     fallback-retain-turns: 15   # turns kept after a failed sift
 *     stream-file: data/stream_state.json
 *     snapshot-file: data/last_snapshot.txt
 *     vision-enabled: true
 * </pre>
 */
@ConfigurationProperties(prefix = "agent.stream")
public record StreamProperties(
        @DefaultValue("64000")                   int contextCap,
        @DefaultValue("0.85")                    double capacityFraction,
        @DefaultValue("12")                      int recentTurnWindow,
        @DefaultValue("3")                       int rollingOverlap,
        @DefaultValue("15")                      int fallbackRetainTurns,
        @DefaultValue("data/stream_state.json")  String streamFile,
        @DefaultValue("data/last_snapshot.txt")  String snapshotFile,
        @DefaultValue("true")                    boolean visionEnabled
) {

    /** Token count above which the stream must be consolidated. */
    public double budgetThreshold() {
        return contextCap * capacityFraction;
    }
}
