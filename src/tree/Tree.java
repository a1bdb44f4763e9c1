package tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Tree: arena-backed rooted binary phylogenetic tree.
 *
 * All vertices live in one list and refer to each other by position. Trees
 * are built bottom-up while a tree description is parsed:
 *
 * 1. Leaves are appended with their parent unset
 * 2. Each internal vertex is appended after both of its children and links them
 * 3. The root is appended last, links its two children and seals the tree
 *
 * Once the root is in place the tree is read-only. Children always have a
 * smaller position than their parent, so the structure cannot contain cycles.
 */
public class Tree {

    private static final int NO_ROOT = -1;

    private final ArrayList<Vertex> nodes;      // All vertices (internal + leaves + root)
    private int root = NO_ROOT;                 // Arena position of the root
    private int leavesCount;                    // Number of leaves appended

    /**
     * Creates an empty tree.
     *
     * @param numLeaves expected number of leaves, used to size the arena
     */
    public Tree(int numLeaves) {
        // a rooted binary tree with n leaves has 2n - 1 vertices
        this.nodes = new ArrayList<>(Math.max(1, 2 * numLeaves - 1));
    }

    /**
     * Appends a leaf whose parent is linked later.
     *
     * @return arena position of the new leaf
     */
    public int addLeaf(BranchLength branchLength, int labelIndex) {
        checkNotFinalized();
        int index = nodes.size();
        nodes.add(Vertex.newLeaf(index, branchLength, labelIndex));
        leavesCount++;
        return index;
    }

    /**
     * Appends an internal vertex and links both children to it.
     *
     * @return arena position of the new vertex
     */
    public int addInternalVertex(int left, int right, BranchLength branchLength) {
        checkNotFinalized();
        int index = nodes.size();
        checkChildren(left, right, index);
        nodes.add(Vertex.newInternal(index, left, right, branchLength));
        linkChildren(left, right, index);
        return index;
    }

    /**
     * Appends the root, links both children to it and seals the tree.
     *
     * @return arena position of the root
     */
    public int addRoot(int left, int right) {
        checkNotFinalized();
        int index = nodes.size();
        checkChildren(left, right, index);
        nodes.add(Vertex.newRoot(index, left, right));
        linkChildren(left, right, index);
        this.root = index;
        return index;
    }

    private void checkNotFinalized() {
        if (root != NO_ROOT) {
            throw new IllegalStateException("Tree already has a root; no more vertices can be added");
        }
    }

    private void checkChildren(int left, int right, int parentIndex) {
        if (left == right) {
            throw new IllegalArgumentException("Both children of vertex " + parentIndex + " are vertex " + left);
        }
        for (int child : new int[] { left, right }) {
            if (child < 0 || child >= parentIndex) {
                throw new IllegalArgumentException("Child index " + child + " out of range for vertex " + parentIndex);
            }
            if (nodes.get(child).hasParent()) {
                throw new IllegalArgumentException("Vertex " + child + " already has a parent");
            }
        }
    }

    private void linkChildren(int left, int right, int parentIndex) {
        nodes.get(left).setParent(parentIndex);
        nodes.get(right).setParent(parentIndex);
    }

    /**
     * Arena position of the root.
     *
     * @throws IllegalStateException if the root has not been appended yet
     */
    public int getRootIndex() {
        if (root == NO_ROOT) {
            throw new IllegalStateException("Tree has no root yet");
        }
        return root;
    }

    /**
     * The root vertex.
     *
     * @throws IllegalStateException if the root has not been appended yet
     */
    public Vertex getRoot() {
        return nodes.get(getRootIndex());
    }

    /**
     * Vertex stored at arena position {@code index}.
     *
     * Positions are stable: a vertex keeps the position it was appended at,
     * and the parent and child references of other vertices use it.
     *
     * @throws IndexOutOfBoundsException if no vertex has that position
     */
    public Vertex getVertex(int index) {
        return nodes.get(index);
    }

    /**
     * Read-only view of all vertices in arena order.
     *
     * Leaves and internal vertices appear in the order the tree description
     * completes them, so every child precedes its parent and the root, once
     * appended, is last.
     */
    public List<Vertex> vertices() {
        return Collections.unmodifiableList(nodes);
    }

    /**
     * Number of vertices appended so far; 2n - 1 for a finished tree with n leaves.
     */
    public int size() {
        return nodes.size();
    }

    /**
     * Number of leaves appended so far.
     */
    public int numLeaves() {
        return leavesCount;
    }

    /**
     * Whether the root has been appended. A finalized tree accepts no further vertices.
     */
    public boolean isFinalized() {
        return root != NO_ROOT;
    }

    /**
     * Structural validity check.
     *
     * Verifies that there is exactly one root, that every other vertex has its
     * parent set and is listed among that parent's children, that every child
     * position is in range and smaller than its parent's, and that the leaf
     * count matches the leaves actually stored.
     */
    public boolean isValid() {
        if (root == NO_ROOT) {
            return false;
        }

        int roots = 0;
        int leaves = 0;
        for (int i = 0; i < nodes.size(); i++) {
            Vertex v = nodes.get(i);
            if (v.index() != i) {
                return false;
            }

            if (v.isRoot()) {
                roots++;
                if (i != root) return false;
            } else {
                if (!v.hasParent()) return false;
                int p = v.parentIndex().getAsInt();
                if (p <= i || p >= nodes.size()) return false;
                int[] siblings = nodes.get(p).children();
                if (siblings == null || (siblings[0] != i && siblings[1] != i)) return false;
            }

            if (v.isLeaf()) {
                leaves++;
            } else {
                for (int child : v.children()) {
                    if (child < 0 || child >= i) return false;
                }
            }
        }

        return roots == 1 && leaves == leavesCount;
    }

    @Override
    public String toString() {
        return "Tree[vertices=" + nodes.size() + ", leaves=" + leavesCount + ", root=" + root + "]";
    }
}
