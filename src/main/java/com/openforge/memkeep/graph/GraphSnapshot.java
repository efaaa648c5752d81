package com.openforge.memkeep.graph;

import java.util.List;

/** Every node and edge, for visualisation. */
public record GraphSnapshot(List<NodeView> nodes, List<EdgeView> edges) {}
