package parser;

import taxon.TaxonMap;
import tree.BranchLength;
import tree.Tree;
import utils.Config;

/**
 * NewickParser: recursive-descent parser for rooted binary Newick strings.
 *
 * Grammar:
 *
 *   root          := children (':' branch_length)? ';'
 *   children      := '(' vertex ',' vertex ')'
 *   vertex        := children branch_length?      (internal vertex)
 *                  | label branch_length?         (leaf)
 *   branch_length := ':' decimal or scientific literal
 *
 * Whitespace and bracketed comments may appear between any two tokens, which
 * covers rooting annotations such as [&R] and per-node annotations written by
 * BEAST and MrBayes. Vertices are appended to the tree as soon as they are
 * complete, so children always precede their parent in the arena. The root's
 * branch length is consumed and dropped.
 */
public final class NewickParser {

    /** Newick label delimiters: parentheses, comma, colon, semicolon, whitespace */
    static final byte[] NEWICK_LABEL_DELIMITERS = { '(', ')', ',', ':', ';', ' ', '\t', '\n', '\r', '\f', 0x0B };

    private final ByteScanner scanner;
    private final Tree tree;
    private final LabelResolver resolver;

    private NewickParser(ByteScanner scanner, Tree tree, LabelResolver resolver) {
        this.scanner = scanner;
        this.tree = tree;
        this.resolver = resolver;
    }

    /**
     * A tree together with the taxon map built while parsing it.
     */
    public static final class ParsedTree {
        private final Tree tree;
        private final TaxonMap taxonMap;

        ParsedTree(Tree tree, TaxonMap taxonMap) {
            this.tree = tree;
            this.taxonMap = taxonMap;
        }

        public Tree getTree() {
            return tree;
        }

        public TaxonMap getTaxonMap() {
            return taxonMap;
        }
    }

    /**
     * Parses a single self-contained Newick string.
     */
    public static ParsedTree parse(String newick) throws ParsingException {
        return parse(ByteScanner.of(newick), Config.DEFAULT_LEAF_HINT);
    }

    /**
     * Parses one tree at the scanner's position into a fresh taxon map, taking
     * leaf tokens as labels.
     *
     * @param numLeaves expected number of leaves, used for sizing only
     */
    public static ParsedTree parse(ByteScanner scanner, int numLeaves) throws ParsingException {
        TaxonMap taxonMap = new TaxonMap(numLeaves);
        Tree tree = parse(scanner, numLeaves, LabelResolver.labelToIndex(taxonMap));
        return new ParsedTree(tree, taxonMap);
    }

    /**
     * Parses one tree at the scanner's position, resolving leaf tokens through
     * {@code resolver}. Used when many trees share one taxon map or translation
     * table. The terminating ';' is consumed.
     */
    public static Tree parse(ByteScanner scanner, int numLeaves, LabelResolver resolver) throws ParsingException {
        NewickParser parser = new NewickParser(scanner, new Tree(numLeaves), resolver);
        parser.parseRoot();
        return parser.tree;
    }

    private void parseRoot() throws ParsingException {
        int[] children = parseChildren(1);

        // Root may carry a branch length; a root has no parent edge so it is dropped
        parseBranchLength();

        scanner.skipWhitespaceAndComments();
        if (!scanner.consumeIf((byte) ';')) {
            throw unexpected("';' at end of tree");
        }

        tree.addRoot(children[0], children[1]);
    }

    /**
     * Parses one child of the vertex at nesting level {@code depth}.
     */
    private int parseVertex(int depth) throws ParsingException {
        scanner.skipWhitespaceAndComments();
        if (scanner.peekIs((byte) '(')) {
            int[] children = parseChildren(depth + 1);
            BranchLength branchLength = parseBranchLength();
            return tree.addInternalVertex(children[0], children[1], branchLength);
        }
        return parseLeaf();
    }

    /**
     * Parses a parenthesized pair of children. {@code depth} counts the
     * parentheses enclosing this pair, the root's pair being level 1.
     */
    private int[] parseChildren(int depth) throws ParsingException {
        scanner.skipWhitespaceAndComments();
        if (depth > Config.MAX_NEWICK_DEPTH) {
            throw ParsingException.invalidNewickString(scanner,
                    "Tree is nested deeper than " + Config.MAX_NEWICK_DEPTH + " levels");
        }
        if (!scanner.consumeIf((byte) '(')) {
            throw unexpected("'(' before children");
        }
        int left = parseVertex(depth);

        scanner.skipWhitespaceAndComments();
        if (!scanner.consumeIf((byte) ',')) {
            throw unexpected("',' between children");
        }
        int right = parseVertex(depth);

        scanner.skipWhitespaceAndComments();
        if (!scanner.consumeIf((byte) ')')) {
            throw unexpected("')' after children");
        }
        return new int[] { left, right };
    }

    private int parseLeaf() throws ParsingException {
        String label = scanner.parseLabel(NEWICK_LABEL_DELIMITERS);
        if (label.isEmpty()) {
            throw unexpected("leaf label");
        }
        int labelIndex = resolver.resolve(label, scanner);
        BranchLength branchLength = parseBranchLength();
        return tree.addLeaf(branchLength, labelIndex);
    }

    /**
     * Parses an optional ":length" suffix.
     *
     * @return the branch length, or null if there is none
     */
    private BranchLength parseBranchLength() throws ParsingException {
        scanner.skipWhitespaceAndComments();
        if (!scanner.consumeIf((byte) ':')) {
            return null;
        }
        scanner.skipWhitespaceAndComments();

        int start = scanner.position();
        StringBuilder literal = new StringBuilder();
        while (isNumeralByte(scanner.peek())) {
            literal.append((char) scanner.next());
        }
        if (literal.length() == 0) {
            throw unexpected("branch length after ':'");
        }

        double value;
        try {
            value = Double.parseDouble(literal.toString());
        } catch (NumberFormatException e) {
            throw invalidAt(start, "Invalid branch length: " + literal, e);
        }
        try {
            return BranchLength.of(value);
        } catch (IllegalArgumentException e) {
            throw invalidAt(start, e.getMessage(), e);
        }
    }

    // Valid characters for a float: digits, '.', '-', '+', 'e', 'E'
    private static boolean isNumeralByte(int b) {
        return (b >= '0' && b <= '9') || b == '.' || b == '-' || b == '+' || b == 'e' || b == 'E';
    }

    private ParsingException unexpected(String expected) {
        return ParsingException.invalidNewickString(scanner,
                "Expected " + expected + " but found " + ByteScanner.describe(scanner.peek()));
    }

    private ParsingException invalidAt(int position, String detail, Throwable cause) {
        return new ParsingException(ParsingErrorType.INVALID_NEWICK_STRING, position, detail,
                scanner.contextAsString(position, Config.CONTEXT_LENGTH), cause);
    }
}
