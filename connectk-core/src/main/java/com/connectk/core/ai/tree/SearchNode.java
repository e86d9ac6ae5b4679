package com.connectk.core.ai.tree;

import com.connectk.core.GameState;
import com.connectk.core.Player;
import it.unimi.dsi.fastutil.ints.Int2IntFunction;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;

/**
 * A single vertex of a {@link SearchTree}.
 *
 * <p>Nodes live in the tree's arena and refer to each other by index: the children list holds
 * arena indices and the parent index is a plain back-reference. The reward is accumulated from the
 * point of view of {@link #mover()}, the player whose move led into this node.
 */
public final class SearchNode {

    public static final int NO_PARENT = -1;
    public static final int NO_MOVE = -1;

    private final int move;
    private final GameState state;
    private final boolean terminal;
    private final IntArrayList unexpandedMoves;
    private final IntArrayList children;

    private int index;
    private int parent;
    private long visits;
    private double reward;

    SearchNode(int index, int parent, int move, GameState state) {
        this.index = index;
        this.parent = parent;
        this.move = move;
        this.state = state;
        this.terminal = state.isTerminal();
        this.unexpandedMoves = new IntArrayList(state.legalMoves());
        this.children = new IntArrayList(unexpandedMoves.size());
    }

    /**
     * Returns this node's position in the arena.
     */
    public int index() {
        return index;
    }

    /**
     * Returns the arena index of the parent, or {@link #NO_PARENT} for the root.
     */
    public int parent() {
        return parent;
    }

    /**
     * Returns the column played to reach this node, or {@link #NO_MOVE} for a root created from
     * a state.
     */
    public int move() {
        return move;
    }

    public GameState state() {
        return state;
    }

    public boolean isTerminal() {
        return terminal;
    }

    /**
     * Returns the player who made the move into this node, which is the perspective of
     * {@link #reward()}.
     */
    public Player mover() {
        return state.getCurrentPlayer().opponent();
    }

    public long visits() {
        return visits;
    }

    public double reward() {
        return reward;
    }

    /**
     * Returns {@code reward / visits}, or 0 for a node that has not been visited.
     */
    public double averageReward() {
        return visits == 0L ? 0.0 : reward / visits;
    }

    /**
     * Returns a read-only view of the legal moves that have no child yet.
     */
    public IntList unexpandedMoves() {
        return IntLists.unmodifiable(unexpandedMoves);
    }

    public boolean hasUnexpandedMoves() {
        return !unexpandedMoves.isEmpty();
    }

    /**
     * Returns a read-only view of the children's arena indices, in expansion order.
     */
    public IntList children() {
        return IntLists.unmodifiable(children);
    }

    public ExpansionState expansionState() {
        if (terminal) {
            return ExpansionState.TERMINAL;
        }
        if (children.isEmpty()) {
            return ExpansionState.UNEXPANDED;
        }
        return unexpandedMoves.isEmpty() ? ExpansionState.FULLY_EXPANDED : ExpansionState.PARTIALLY_EXPANDED;
    }

    void attachChild(int childIndex, int childMove) {
        if (!unexpandedMoves.rem(childMove)) {
            throw new IllegalStateException("Move " + childMove + " is not unexpanded at node " + index);
        }
        children.add(childIndex);
    }

    void record(long addedVisits, double addedReward) {
        if (addedVisits <= 0L) {
            throw new IllegalStateException("Visit increment must be positive, was " + addedVisits);
        }
        long updated = visits + addedVisits;
        if (updated < visits) {
            throw new IllegalStateException("Visit count overflow at node " + index);
        }
        visits = updated;
        reward += addedReward;
    }

    void relink(int newIndex, int newParent, Int2IntFunction remap) {
        index = newIndex;
        parent = newParent;
        for (int i = 0; i < children.size(); i++) {
            children.set(i, remap.get(children.getInt(i)));
        }
    }

    @Override
    public String toString() {
        return String.format("SearchNode[index=%d, move=%d, visits=%d, avg=%.4f, state=%s]",
                index, move, visits, averageReward(), expansionState());
    }
}
