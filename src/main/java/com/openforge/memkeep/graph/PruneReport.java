package com.openforge.memkeep.graph;

/**
 * Outcome of one decay pass.
 *
 * @param nodesDecayed   nodes whose strength was multiplied down
 * @param edgesDecayed   edges whose weight was multiplied down
 * @param nodesForgotten nodes deleted below the forget threshold
 * @param edgesForgotten edges deleted below the threshold, plus edges left dangling by node deletion
 */
public record PruneReport(int nodesDecayed, int edgesDecayed, int nodesForgotten, int edgesForgotten) {}
