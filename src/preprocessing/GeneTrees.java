package preprocessing;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

import parser.NexusParser;
import parser.ParsingException;
import taxon.TaxonMap;
import tree.Tree;

/**
 * GeneTrees: the gene trees of one NEXUS file and the taxon map they share.
 *
 * This is the entry point for downstream analyses. Loading happens in two
 * separate steps so that I/O problems and format problems stay distinguishable:
 *
 * 1. {@link #fromFile(Path)} reads the whole file into memory and reports
 *    missing or unreadable files as {@link IOException}
 * 2. {@link #fromBytes(byte[])} parses the buffer and reports malformed
 *    content as {@link ParsingException}
 *
 * All trees use consistent taxon ids, so leaf label indices can be compared
 * across trees directly.
 */
public class GeneTrees {

    private static final Logger log = Logger.getLogger(GeneTrees.class.getName());

    // Core data structures
    public final List<Tree> geneTrees;              // Parsed gene trees in file order
    public final TaxonMap taxonMap;                 // Label to taxon id mapping shared by all trees

    private GeneTrees(List<Tree> geneTrees, TaxonMap taxonMap) {
        this.geneTrees = geneTrees;
        this.taxonMap = taxonMap;
    }

    /**
     * Reads and parses a NEXUS tree file.
     *
     * @throws IOException      if the file cannot be read
     * @throws ParsingException if the file content is not a valid NEXUS tree collection
     */
    public static GeneTrees fromFile(Path path) throws IOException, ParsingException {
        byte[] contents = Files.readAllBytes(path);
        log.log(Level.FINE, "Read {0} bytes from {1}", new Object[] { contents.length, path });
        return fromBytes(contents);
    }

    /**
     * Parses a NEXUS tree collection held in memory.
     */
    public static GeneTrees fromBytes(byte[] contents) throws ParsingException {
        NexusParser.Result result = NexusParser.parse(contents);
        if (result.getTrees().isEmpty()) {
            log.warning("No gene trees found in input");
        }
        log.log(Level.FINE, "Parsed {0} gene trees over {1} taxa",
                new Object[] { result.getTrees().size(), result.getTaxonMap().size() });
        return new GeneTrees(result.getTrees(), result.getTaxonMap());
    }

    public int size() {
        return geneTrees.size();
    }

    public Tree getTree(int i) {
        return geneTrees.get(i);
    }

    /**
     * Builds the id to label lookup array used when writing results.
     */
    public String[] taxonIdToLabel() {
        return taxonMap.labels().toArray(new String[0]);
    }
}
