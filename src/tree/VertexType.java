package tree;

/**
 * The three shapes a vertex can take in a rooted binary tree.
 */
public enum VertexType {
    ROOT,       // two children, no parent, no branch length
    INTERNAL,   // two children, a parent, optional branch length
    LEAF        // no children, a parent, a label, optional branch length
}
