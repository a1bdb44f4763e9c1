package parser;

import java.util.HashMap;
import java.util.Map;

import org.junit.jupiter.api.Test;

import taxon.TaxonMap;
import tree.Tree;
import tree.Vertex;
import utils.Config;

import static org.junit.jupiter.api.Assertions.*;

class NewickParserTest {

    @Test
    void two_leaf_tree_with_branch_lengths() throws ParsingException {
        NewickParser.ParsedTree parsed = NewickParser.parse("(A:1.0,B:2.0);");
        Tree tree = parsed.getTree();
        TaxonMap map = parsed.getTaxonMap();

        assertEquals(2, tree.numLeaves());
        assertEquals(3, tree.size());
        assertTrue(tree.isValid());

        int[] children = tree.getRoot().children();
        assertEquals(1.0, tree.getVertex(children[0]).branchLength().get().value());
        assertEquals(2.0, tree.getVertex(children[1]).branchLength().get().value());

        assertEquals(2, map.size());
        assertEquals(0, map.getIndex("A").getAsInt());
        assertEquals(1, map.getIndex("B").getAsInt());
    }

    @Test
    void nested_tree_appends_children_before_parents() throws ParsingException {
        Tree tree = NewickParser.parse("((A:0.1,B:0.2):0.3,(C,(D:1e-3,E:2.5E+1)));").getTree();

        assertEquals(5, tree.numLeaves());
        assertEquals(9, tree.size());
        assertEquals(8, tree.getRootIndex());
        assertTrue(tree.isValid());

        int roots = 0;
        for (Vertex v : tree.vertices()) {
            if (v.isRoot()) {
                roots++;
            } else {
                assertTrue(v.hasParent());
                assertTrue(v.parentIndex().getAsInt() > v.index());
            }
        }
        assertEquals(1, roots);

        // (A,B) is the first internal vertex and carries the 0.3 edge
        Vertex ab = tree.getVertex(2);
        assertTrue(ab.isInternal());
        assertEquals(0.3, ab.branchLength().get().value());
        assertEquals(25.0, tree.getVertex(5).branchLength().get().value());
    }

    @Test
    void whitespace_comments_and_root_length_are_tolerated() throws ParsingException {
        Tree tree = NewickParser.parse(" [&R] ( A [note] : 0.5 ,\n ( 'B c' , D ) : 1 ) : 7.0 ;").getTree();

        assertEquals(3, tree.numLeaves());
        assertTrue(tree.isValid());
        assertTrue(tree.getRoot().branchLength().isEmpty());
    }

    @Test
    void quoted_labels_keep_spaces() throws ParsingException {
        NewickParser.ParsedTree parsed = NewickParser.parse("('Homo sapiens','Pan troglodytes');");
        assertEquals(0, parsed.getTaxonMap().getIndex("Homo sapiens").getAsInt());
    }

    @Test
    void parser_stops_after_the_terminator() throws ParsingException {
        ByteScanner scanner = ByteScanner.of("(A,B); rest");
        NewickParser.parse(scanner, 2);
        assertEquals(6, scanner.position());
    }

    @Test
    void shared_resolver_writes_into_one_taxon_map() throws ParsingException {
        TaxonMap map = new TaxonMap();
        LabelResolver resolver = LabelResolver.labelToIndex(map);

        Tree first = NewickParser.parse(ByteScanner.of("(A,B);"), 2, resolver);
        Tree second = NewickParser.parse(ByteScanner.of("(C,(B,A));"), 3, resolver);

        assertEquals(3, map.size());
        assertEquals(2, second.getVertex(0).labelIndex().getAsInt());
        assertEquals(first.getVertex(0).labelIndex(), second.getVertex(2).labelIndex());
    }

    @Test
    void translated_leaves_resolve_to_labels() throws ParsingException {
        Map<String, String> translation = new HashMap<>();
        translation.put("1", "Lucanus");
        translation.put("2", "Dynastes");
        TaxonMap map = new TaxonMap();

        Tree tree = NewickParser.parse(ByteScanner.of("(2:0.1,1:0.2);"), 2,
                LabelResolver.keyToLabelToIndex(translation, map));

        assertEquals("Dynastes", map.getLabel(tree.getVertex(0).labelIndex().getAsInt()));
    }

    @Test
    void missing_translation_key_is_reported() {
        Map<String, String> translation = Map.of("1", "Lucanus");
        ParsingException e = assertThrows(ParsingException.class, () ->
                NewickParser.parse(ByteScanner.of("(1,7);"), 2, LabelResolver.keyToLabelToIndex(translation, new TaxonMap())));

        assertEquals(ParsingErrorType.INVALID_NEWICK_STRING, e.getType());
        assertTrue(e.getMessage().contains("'7'"));
    }

    @Test
    void unterminated_tree_fails() {
        ParsingException e = assertThrows(ParsingException.class, () -> NewickParser.parse("(A,B"));

        assertEquals(ParsingErrorType.INVALID_NEWICK_STRING, e.getType());
        assertTrue(e.getMessage().contains("end of input"));
        assertEquals(4, e.getPosition());
    }

    @Test
    void missing_terminator_fails() {
        ParsingException e = assertThrows(ParsingException.class, () -> NewickParser.parse("(A,B)"));
        assertTrue(e.getDetail().contains("';'"));
    }

    @Test
    void polytomies_are_rejected() {
        ParsingException e = assertThrows(ParsingException.class, () -> NewickParser.parse("(A,B,C);"));

        assertEquals(ParsingErrorType.INVALID_NEWICK_STRING, e.getType());
        assertEquals("Expected ')' after children but found ','", e.getDetail());
    }

    @Test
    void single_leaf_and_empty_labels_are_rejected() {
        assertThrows(ParsingException.class, () -> NewickParser.parse("A;"));
        assertThrows(ParsingException.class, () -> NewickParser.parse("(A);"));
        assertThrows(ParsingException.class, () -> NewickParser.parse("(,B);"));
    }

    @Test
    void malformed_branch_lengths_are_rejected() {
        for (String newick : new String[] { "(A:,B);", "(A:1.2.3,B);", "(A:1e,B);", "(A:abc,B);" }) {
            ParsingException e = assertThrows(ParsingException.class, () -> NewickParser.parse(newick), newick);
            assertEquals(ParsingErrorType.INVALID_NEWICK_STRING, e.getType());
        }
    }

    @Test
    void negative_branch_length_is_an_invariant_violation() {
        ParsingException e = assertThrows(ParsingException.class, () -> NewickParser.parse("(A:-0.5,B);"));

        assertEquals(ParsingErrorType.INVALID_NEWICK_STRING, e.getType());
        assertTrue(e.getCause() instanceof IllegalArgumentException);
        assertEquals(3, e.getPosition());
    }

    private static String caterpillar(int numLeaves) {
        StringBuilder sb = new StringBuilder("(".repeat(numLeaves - 1));
        sb.append("t0,t1)");
        for (int i = 2; i < numLeaves; i++) {
            sb.append(",t").append(i).append(')');
        }
        return sb.append(';').toString();
    }

    @Test
    void deep_caterpillar_within_the_nesting_limit() throws ParsingException {
        Tree tree = NewickParser.parse(caterpillar(2000)).getTree();

        assertEquals(2000, tree.numLeaves());
        assertEquals(3999, tree.size());
        assertEquals(3998, tree.getRootIndex());
        assertTrue(tree.isValid());
    }

    @Test
    void nesting_beyond_the_limit_is_a_parsing_error() {
        ParsingException e = assertThrows(ParsingException.class, () -> NewickParser.parse(caterpillar(5000)));

        assertEquals(ParsingErrorType.INVALID_NEWICK_STRING, e.getType());
        assertTrue(e.getDetail().contains("nested deeper than " + Config.MAX_NEWICK_DEPTH));
        assertEquals(Config.MAX_NEWICK_DEPTH, e.getPosition());
    }
}
