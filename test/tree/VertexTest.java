package tree;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class VertexTest {

    @Test
    void internal_vertex_exposes_branch_length_and_children() {
        Vertex vertex = Vertex.newInternal(5, 1, 2, BranchLength.of(1.234));

        assertEquals(5, vertex.index());
        assertEquals(1.234, vertex.branchLength().get().value());
        assertArrayEquals(new int[] { 1, 2 }, vertex.children());
        assertTrue(vertex.labelIndex().isEmpty());
    }

    @Test
    void exactly_one_type_predicate_holds() {
        Vertex leaf = Vertex.newLeaf(0, BranchLength.of(0.5), 10);
        Vertex internal = Vertex.newInternal(0, 1, 2, BranchLength.of(0.5));
        Vertex root = Vertex.newRoot(2, 0, 1);

        assertTrue(leaf.isLeaf() && !leaf.isInternal() && !leaf.isRoot());
        assertTrue(internal.isInternal() && !internal.isLeaf() && !internal.isRoot());
        assertTrue(root.isRoot() && !root.isLeaf() && !root.isInternal());
        assertEquals(VertexType.LEAF, leaf.type());
    }

    @Test
    void parent_is_unset_until_linked() {
        Vertex internal = Vertex.newInternal(0, 1, 2, null);
        Vertex leaf = Vertex.newLeaf(1, null, 0);
        Vertex root = Vertex.newRoot(2, 0, 1);

        assertFalse(internal.hasParent());
        assertTrue(internal.parentIndex().isEmpty());
        assertFalse(leaf.hasParent());
        assertTrue(leaf.parentIndex().isEmpty());
        assertFalse(root.hasParent());
        assertTrue(root.parentIndex().isEmpty());

        leaf.setParent(7);
        assertTrue(leaf.hasParent());
        assertEquals(7, leaf.parentIndex().getAsInt());
    }

    @Test
    void parent_can_be_set_only_once_and_never_on_root() {
        Vertex leaf = Vertex.newLeaf(0, null, 3);
        leaf.setParent(4);
        assertThrows(IllegalStateException.class, () -> leaf.setParent(5));

        Vertex root = Vertex.newRoot(2, 0, 1);
        assertThrows(IllegalStateException.class, () -> root.setParent(3));
    }

    @Test
    void leaf_has_label_but_no_children() {
        Vertex leaf = Vertex.newLeaf(0, null, 42);

        assertNull(leaf.children());
        assertEquals(42, leaf.labelIndex().getAsInt());
        assertTrue(leaf.branchLength().isEmpty());
    }

    @Test
    void root_has_no_branch_length() {
        assertTrue(Vertex.newRoot(2, 0, 1).branchLength().isEmpty());
    }

    @Test
    void negative_label_index_is_rejected() {
        assertThrows(IllegalArgumentException.class, () -> Vertex.newLeaf(0, null, -1));
    }
}
