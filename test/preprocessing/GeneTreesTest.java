package preprocessing;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import parser.ParsingErrorType;
import parser.ParsingException;
import tree.Tree;

import static org.junit.jupiter.api.Assertions.*;

class GeneTreesTest {

    @TempDir
    Path tmp;

    private Path copyFixture(String name) throws IOException {
        Path target = tmp.resolve(name);
        try (InputStream in = GeneTreesTest.class.getResourceAsStream("/" + name)) {
            assertNotNull(in, "missing fixture " + name);
            Files.copy(in, target);
        }
        return target;
    }

    @Test
    void loads_trees_from_file() throws Exception {
        GeneTrees geneTrees = GeneTrees.fromFile(copyFixture("nexus_t11_n20_translate.trees"));

        assertEquals(11, geneTrees.size());
        assertEquals(20, geneTrees.taxonMap.size());
        Tree first = geneTrees.getTree(0);
        assertTrue(first.isValid());

        String[] labels = geneTrees.taxonIdToLabel();
        assertEquals(20, labels.length);
        int leafLabel = first.getVertex(0).labelIndex().getAsInt();
        assertEquals(geneTrees.taxonMap.getLabel(leafLabel), labels[leafLabel]);
    }

    @Test
    void missing_file_is_an_io_error_not_a_parsing_error() {
        assertThrows(NoSuchFileException.class, () -> GeneTrees.fromFile(tmp.resolve("absent.trees")));
    }

    @Test
    void malformed_content_is_a_parsing_error() throws IOException {
        Path bad = tmp.resolve("bad.trees");
        Files.write(bad, "#NEXUS\nBEGIN TREES; TREE t = (A,B".getBytes(StandardCharsets.UTF_8));

        ParsingException e = assertThrows(ParsingException.class, () -> GeneTrees.fromFile(bad));
        assertEquals(ParsingErrorType.INVALID_NEWICK_STRING, e.getType());
    }

    @Test
    void parses_in_memory_buffers() throws ParsingException {
        GeneTrees geneTrees = GeneTrees.fromBytes("#NEXUS\nBEGIN TREES; TREE t = ((A,B),C); END;".getBytes(StandardCharsets.UTF_8));

        assertEquals(1, geneTrees.size());
        assertEquals(3, geneTrees.getTree(0).numLeaves());
    }
}
