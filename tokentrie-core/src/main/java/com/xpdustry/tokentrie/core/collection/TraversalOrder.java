package com.xpdustry.tokentrie.core.collection;

public enum TraversalOrder {
    BREADTH_FIRST,
    DEPTH_FIRST
}
