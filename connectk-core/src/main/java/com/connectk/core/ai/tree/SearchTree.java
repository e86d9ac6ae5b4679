package com.connectk.core.ai.tree;

import com.connectk.core.GameState;
import com.connectk.core.InvalidMoveException;
import com.connectk.core.Player;
import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntArrayFIFOQueue;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntSet;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;
import java.util.Objects;
import java.util.function.ToDoubleFunction;
import java.util.logging.Logger;

/**
 * Arena-backed Monte Carlo search tree.
 *
 * <p>The tree exclusively owns its nodes. Parents always precede their children in the arena, so
 * index order is a valid top-down traversal. Committing a real move with {@link #advanceRoot(int)}
 * keeps only the chosen subtree and compacts the arena.
 */
public final class SearchTree {

    private static final Logger LOGGER = Logger.getLogger(SearchTree.class.getName());
    private static final int ROOT_INDEX = 0;

    private ObjectArrayList<SearchNode> nodes = new ObjectArrayList<>();

    private SearchTree(GameState rootState) {
        nodes.add(new SearchNode(ROOT_INDEX, SearchNode.NO_PARENT, SearchNode.NO_MOVE, rootState));
    }

    /**
     * Builds a tree holding a single unvisited root for {@code state}, which may be any position.
     */
    public static SearchTree createRoot(GameState state) {
        return new SearchTree(Objects.requireNonNull(state, "state"));
    }

    public SearchNode root() {
        return nodes.get(ROOT_INDEX);
    }

    public SearchNode node(int index) {
        return nodes.get(index);
    }

    /**
     * Returns the number of live nodes.
     */
    public int size() {
        return nodes.size();
    }

    /**
     * Returns the number of edges on the longest root-to-leaf path.
     */
    public int depth() {
        int[] depths = new int[nodes.size()];
        int max = 0;
        for (int i = 1; i < nodes.size(); i++) {
            depths[i] = depths[nodes.get(i).parent()] + 1;
            max = Math.max(max, depths[i]);
        }
        return max;
    }

    /**
     * Returns the child of {@code parent} reached by {@code move}, or {@code null} if it has not been
     * expanded.
     */
    public SearchNode child(SearchNode parent, int move) {
        IntList children = parent.children();
        for (int i = 0; i < children.size(); i++) {
            SearchNode candidate = nodes.get(children.getInt(i));
            if (candidate.move() == move) {
                return candidate;
            }
        }
        return null;
    }

    /**
     * Creates the child of {@code parent} for one of its unexpanded moves.
     *
     * @throws IllegalStateException if {@code move} is not an unexpanded move of {@code parent}
     */
    public SearchNode expand(SearchNode parent, int move) {
        if (!parent.unexpandedMoves().contains(move)) {
            throw new IllegalStateException("Move " + move + " cannot be expanded at " + parent);
        }
        SearchNode child = new SearchNode(nodes.size(), parent.index(), move, parent.state().applyMove(move));
        parent.attachChild(child.index(), move);
        nodes.add(child);
        return child;
    }

    /**
     * Adds {@code visits} to every node from {@code leaf} up to the root and credits each node with
     * the reward its mover earns, as computed by {@code rewardForMover}.
     */
    public void backpropagate(SearchNode leaf, long visits, ToDoubleFunction<Player> rewardForMover) {
        Objects.requireNonNull(rewardForMover, "rewardForMover");
        double firstReward = rewardForMover.applyAsDouble(Player.FIRST);
        double secondReward = rewardForMover.applyAsDouble(Player.SECOND);
        int index = leaf.index();
        while (index != SearchNode.NO_PARENT) {
            SearchNode node = nodes.get(index);
            node.record(visits, node.mover() == Player.FIRST ? firstReward : secondReward);
            index = node.parent();
        }
    }

    /**
     * Commits a real move: its child becomes the root, keeping the statistics gathered so far,
     * and every sibling subtree is discarded. A move that was never expanded gets a fresh root.
     *
     * @throws InvalidMoveException if {@code move} is not legal at the current root
     */
    public void advanceRoot(int move) {
        SearchNode root = root();
        if (!root.state().isLegal(move)) {
            throw new InvalidMoveException(move, "Move " + move + " is not legal at the search root");
        }
        SearchNode next = child(root, move);
        if (next == null) {
            next = expand(root, move);
        }
        int before = nodes.size();
        compactFrom(next.index());
        int kept = nodes.size();
        LOGGER.fine(() -> String.format("Advanced root by move %d: kept %d nodes, pruned %d", move, kept,
                before - kept));
    }

    private void compactFrom(int newRootIndex) {
        ObjectArrayList<SearchNode> kept = new ObjectArrayList<>();
        Int2IntOpenHashMap remap = new Int2IntOpenHashMap();
        remap.defaultReturnValue(SearchNode.NO_PARENT);

        IntArrayFIFOQueue queue = new IntArrayFIFOQueue();
        queue.enqueue(newRootIndex);
        while (!queue.isEmpty()) {
            int oldIndex = queue.dequeueInt();
            remap.put(oldIndex, kept.size());
            SearchNode node = nodes.get(oldIndex);
            kept.add(node);
            IntList children = node.children();
            for (int i = 0; i < children.size(); i++) {
                queue.enqueue(children.getInt(i));
            }
        }

        for (int i = 0; i < kept.size(); i++) {
            SearchNode node = kept.get(i);
            int newParent = i == ROOT_INDEX ? SearchNode.NO_PARENT : remap.get(node.parent());
            node.relink(i, newParent, remap);
        }
        nodes = kept;
    }

    /**
     * Checks every structural and statistical invariant of the tree.
     *
     * @throws IllegalStateException describing the first violation found
     */
    public void verifyConsistency() {
        for (int i = 0; i < nodes.size(); i++) {
            SearchNode node = nodes.get(i);
            if (node.index() != i) {
                throw new IllegalStateException("Node at arena slot " + i + " reports index " + node.index());
            }
            if (node.visits() < 0L) {
                throw new IllegalStateException("Negative visit count at " + node);
            }
            if ((i == ROOT_INDEX) != (node.parent() == SearchNode.NO_PARENT)) {
                throw new IllegalStateException("Only the root may lack a parent: " + node);
            }
            if (node.isTerminal() && (node.hasUnexpandedMoves() || !node.children().isEmpty())) {
                throw new IllegalStateException("Terminal node has moves: " + node);
            }

            IntSet covered = new IntOpenHashSet(node.unexpandedMoves());
            long childVisits = 0L;
            IntList children = node.children();
            for (int c = 0; c < children.size(); c++) {
                SearchNode child = nodes.get(children.getInt(c));
                if (child.parent() != i) {
                    throw new IllegalStateException("Child " + child + " does not point back to " + node);
                }
                if (!covered.add(child.move())) {
                    throw new IllegalStateException("Move " + child.move() + " appears twice under " + node);
                }
                childVisits += child.visits();
            }
            if (childVisits > node.visits()) {
                throw new IllegalStateException("Children of " + node + " have " + childVisits + " visits");
            }
            int[] legal = node.state().legalMoves();
            if (covered.size() != legal.length) {
                throw new IllegalStateException("Move set of " + node + " does not match its legal moves");
            }
            for (int move : legal) {
                if (!covered.contains(move)) {
                    throw new IllegalStateException("Legal move " + move + " missing under " + node);
                }
            }
        }
    }
}
