package com.connectk.core.ai.policy;

import com.connectk.core.ai.tree.SearchNode;
import com.connectk.core.ai.tree.SearchTree;
import java.util.SplittableRandom;

/**
 * Chooses which child to descend into during the selection phase.
 */
public interface SelectionPolicy {

    /**
     * Returns one of the children of {@code parent}.
     *
     * @param tree   the tree that owns {@code parent}
     * @param parent a non-terminal node with at least one child
     * @param random the search's seeded generator, used for tie-breaks
     * @return the selected child
     */
    SearchNode select(SearchTree tree, SearchNode parent, SplittableRandom random);
}
