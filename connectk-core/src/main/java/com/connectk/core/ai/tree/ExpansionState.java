package com.connectk.core.ai.tree;

/**
 * Expansion progress of a {@link SearchNode}. {@link #TERMINAL} is fixed when the node is created
 * and never changes.
 */
public enum ExpansionState {
    UNEXPANDED,
    PARTIALLY_EXPANDED,
    FULLY_EXPANDED,
    TERMINAL
}
