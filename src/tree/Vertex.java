package tree;

import java.util.Optional;
import java.util.OptionalInt;

/**
 * Vertex: one node of a phylogenetic tree, stored in the tree's arena.
 *
 * A vertex is one of three shapes, told apart by its {@link VertexType}:
 *
 * 1. Root: two children, no parent, no branch length
 * 2. Internal: two children, a parent, optional branch length
 * 3. Leaf: no children, a parent, a label index and optional branch length
 *
 * Children and parent are positions in the owning {@link Tree}, not references.
 * During construction the parent of an internal vertex or leaf is not known yet;
 * it is filled in exactly once, when the parent vertex is appended.
 */
public final class Vertex {

    /** Marker for a parent that has not been linked yet. */
    static final int NO_PARENT_SET = -1;

    private static final int NO_CHILD = -1;
    private static final int NO_LABEL = -1;

    private final VertexType type;
    private final int index;
    private final int left;
    private final int right;
    private final int labelIndex;
    private final BranchLength branchLength;    // null when absent
    private int parent = NO_PARENT_SET;

    private Vertex(VertexType type, int index, int left, int right, int labelIndex, BranchLength branchLength) {
        if (index < 0) {
            throw new IllegalArgumentException("Vertex index must be non-negative, got " + index);
        }
        this.type = type;
        this.index = index;
        this.left = left;
        this.right = right;
        this.labelIndex = labelIndex;
        this.branchLength = branchLength;
    }

    /**
     * Creates a root vertex.
     *
     * @param index position of this vertex in the arena
     * @param left  arena position of the first child
     * @param right arena position of the second child
     */
    public static Vertex newRoot(int index, int left, int right) {
        return new Vertex(VertexType.ROOT, index, left, right, NO_LABEL, null);
    }

    /**
     * Creates an internal vertex whose parent is not linked yet.
     *
     * @param branchLength distance to the parent, may be null
     */
    public static Vertex newInternal(int index, int left, int right, BranchLength branchLength) {
        return new Vertex(VertexType.INTERNAL, index, left, right, NO_LABEL, branchLength);
    }

    /**
     * Creates a leaf whose parent is not linked yet.
     *
     * @param branchLength distance to the parent, may be null
     * @param labelIndex   index of the leaf's taxon in the shared {@code TaxonMap}
     */
    public static Vertex newLeaf(int index, BranchLength branchLength, int labelIndex) {
        if (labelIndex < 0) {
            throw new IllegalArgumentException("Label index must be non-negative, got " + labelIndex);
        }
        return new Vertex(VertexType.LEAF, index, NO_CHILD, NO_CHILD, labelIndex, branchLength);
    }

    /** Which of root, internal vertex or leaf this is. */
    public VertexType type() {
        return type;
    }

    /** Own position in the tree's arena. */
    public int index() {
        return index;
    }

    /** Branch length to the parent; always empty for the root. */
    public Optional<BranchLength> branchLength() {
        return Optional.ofNullable(branchLength);
    }

    /** Label index; present only for leaves. */
    public OptionalInt labelIndex() {
        return type == VertexType.LEAF ? OptionalInt.of(labelIndex) : OptionalInt.empty();
    }

    /**
     * Returns the two child positions, or null for a leaf.
     */
    public int[] children() {
        switch (type) {
            case ROOT:
            case INTERNAL:
                return new int[] { left, right };
            case LEAF:
            default:
                return null;
        }
    }

    /**
     * Parent position. Empty for the root and for a vertex whose parent has not
     * been appended yet.
     */
    public OptionalInt parentIndex() {
        return hasParent() ? OptionalInt.of(parent) : OptionalInt.empty();
    }

    /** Whether a parent has been linked; never true for the root. */
    public boolean hasParent() {
        return type != VertexType.ROOT && parent != NO_PARENT_SET;
    }

    public boolean isRoot() {
        return type == VertexType.ROOT;
    }

    public boolean isInternal() {
        return type == VertexType.INTERNAL;
    }

    public boolean isLeaf() {
        return type == VertexType.LEAF;
    }

    /**
     * Links this vertex to its parent. Only the owning tree calls this, once.
     */
    void setParent(int parentIndex) {
        if (type == VertexType.ROOT) {
            throw new IllegalStateException("Cannot set parent on root vertex " + index);
        }
        if (parent != NO_PARENT_SET) {
            throw new IllegalStateException("Parent of vertex " + index + " already set to " + parent);
        }
        this.parent = parentIndex;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(type).append('#').append(index);
        if (type != VertexType.LEAF) {
            sb.append(" children=(").append(left).append(',').append(right).append(')');
        } else {
            sb.append(" label=").append(labelIndex);
        }
        if (hasParent()) {
            sb.append(" parent=").append(parent);
        }
        if (branchLength != null) {
            sb.append(" length=").append(branchLength);
        }
        return sb.toString();
    }
}
