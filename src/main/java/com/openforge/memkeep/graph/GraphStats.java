package com.openforge.memkeep.graph;

import java.util.List;

public record GraphStats(long nodeCount, long edgeCount, List<NodeView> topNodes, List<EdgeView> recentEdges) {}
