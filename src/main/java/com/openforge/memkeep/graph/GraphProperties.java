package com.openforge.memkeep.graph;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Bound from application.yml under "agent.graph".
 *
 * Reinforcement and decay constants of associative memory.  With the defaults
 * a node seen once survives 44 consolidations and is forgotten on the 45th.
 */
@ConfigurationProperties(prefix = "agent.graph")
public record GraphProperties(
        @DefaultValue("0.5")  double nodeIncrement,
        @DefaultValue("1.0")  double edgeIncrement,
        @DefaultValue("0.95") double decayFactor,
        @DefaultValue("0.1")  double forgetThreshold,
        @DefaultValue("1.0")  double recallMinStrength,
        @DefaultValue("0.5")  double recallMinWeight,
        @DefaultValue("15")   int recallNodeLimit,
        @DefaultValue("8")    int recallEdgeLimit,
        @DefaultValue("3")    int minTermLength,
        @DefaultValue("8")    int topNodeCount,
        @DefaultValue("5")    int recentEdgeCount
) {

    public static GraphProperties defaults() {
        return new GraphProperties(0.5, 1.0, 0.95, 0.1, 1.0, 0.5, 15, 8, 3, 8, 5);
    }
}
