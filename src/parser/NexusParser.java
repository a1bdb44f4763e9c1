package parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

import taxon.TaxonMap;
import tree.Tree;
import utils.Config;

/**
 * NexusParser: reads a NEXUS tree collection into trees sharing one taxon map.
 *
 * The file must start with the #NEXUS header and is then read block by block
 * ({@code BEGIN name; ... END;}). Two blocks are understood:
 *
 * 1. TAXA: DIMENSIONS NTAX=n; TAXLABELS ...; seeds the taxon map in order
 * 2. TREES: an optional TRANSLATE table followed by TREE name = newick; statements
 *
 * Every other block is skipped. A translation table applies to the TREES block
 * it appears in. The first tree after a table resolves keys through the
 * label-keyed taxon map; from then on the block uses a precomputed key to id
 * mapping (see {@link LabelResolver}).
 */
public final class NexusParser {

    private static final Logger log = Logger.getLogger(NexusParser.class.getName());

    /** Delimiters for NEXUS words: statement terminator, '=', ',', whitespace */
    static final byte[] WORD_DELIMITERS = { ';', '=', ',', ' ', '\t', '\n', '\r', '\f', 0x0B };

    private final ByteScanner scanner;
    private final TaxonMap taxonMap;
    private final List<Tree> trees;

    private NexusParser(ByteScanner scanner) {
        this.scanner = scanner;
        this.taxonMap = new TaxonMap();
        this.trees = new ArrayList<>();
    }

    /**
     * Trees of one file in file order, together with their shared taxon map.
     */
    public static final class Result {
        private final List<Tree> trees;
        private final TaxonMap taxonMap;

        Result(List<Tree> trees, TaxonMap taxonMap) {
            this.trees = Collections.unmodifiableList(trees);
            this.taxonMap = taxonMap;
        }

        public List<Tree> getTrees() {
            return trees;
        }

        public TaxonMap getTaxonMap() {
            return taxonMap;
        }
    }

    /**
     * Parses a whole NEXUS file held in memory.
     *
     * @throws ParsingException if the content is not a valid NEXUS tree collection
     */
    public static Result parse(byte[] contents) throws ParsingException {
        return parse(new ByteScanner(contents));
    }

    /**
     * Parses a whole NEXUS file from the scanner's position to the end of input.
     * Either every tree is returned or an exception is thrown; partial results
     * are never exposed.
     */
    public static Result parse(ByteScanner scanner) throws ParsingException {
        NexusParser parser = new NexusParser(scanner);
        parser.parseHeader();
        while (true) {
            scanner.skipWhitespaceAndComments();
            if (scanner.isAtEnd()) {
                break;
            }
            parser.parseBlock();
        }
        return new Result(parser.trees, parser.taxonMap);
    }

    private void parseHeader() throws ParsingException {
        skipByteOrderMark();
        scanner.skipWhitespaceAndComments();
        int start = scanner.position();
        String header = scanner.parseLabel(WORD_DELIMITERS);
        if (!header.equalsIgnoreCase(Config.NEXUS_HEADER)) {
            throw errorAt(ParsingErrorType.MISSING_NEXUS_HEADER, start, null);
        }
    }

    private void skipByteOrderMark() throws ParsingException {
        if (scanner.peek() == 0xEF) {
            int start = scanner.position();
            if (scanner.next() != 0xEF || scanner.next() != 0xBB || scanner.next() != 0xBF) {
                throw errorAt(ParsingErrorType.MISSING_NEXUS_HEADER, start, "Malformed byte order mark");
            }
        }
    }

    private void parseBlock() throws ParsingException {
        int start = scanner.position();
        String begin = scanner.parseLabel(WORD_DELIMITERS);
        if (!begin.equalsIgnoreCase("BEGIN")) {
            String found = begin.isEmpty() ? ByteScanner.describe(scanner.peek()) : "'" + begin + "'";
            throw errorAt(ParsingErrorType.INVALID_FORMATTING, start, "Expected BEGIN but found " + found);
        }

        scanner.skipWhitespaceAndComments();
        checkNotAtEnd();
        String name = scanner.parseLabel(WORD_DELIMITERS);
        if (name.isEmpty()) {
            throw ParsingException.invalidBlockName(scanner,
                    "Missing block name, found " + ByteScanner.describe(scanner.peek()));
        }
        scanner.skipWhitespaceAndComments();
        checkNotAtEnd();
        if (!scanner.consumeIf((byte) ';')) {
            throw ParsingException.invalidBlockName(scanner,
                    "Expected ';' after block name '" + name + "' but found " + ByteScanner.describe(scanner.peek()));
        }

        switch (name.toUpperCase(Locale.ROOT)) {
            case "TAXA":
                parseTaxaBlock();
                break;
            case "TREES":
                parseTreesBlock();
                break;
            default:
                log.log(Level.FINE, "Skipping {0} block at position {1}", new Object[] { name, start });
                skipBlock();
        }
    }

    // ----------------------------------------------------------------------
    // TAXA

    private void parseTaxaBlock() throws ParsingException {
        int ntax = -1;
        List<String> labels = null;

        while (true) {
            String command = readCommand(ParsingErrorType.INVALID_TAXA_BLOCK);
            switch (command.toUpperCase(Locale.ROOT)) {
                case "END":
                case "ENDBLOCK":
                    expectStatementEnd(ParsingErrorType.INVALID_TAXA_BLOCK);
                    if (ntax >= 0 && labels == null) {
                        throw ParsingException.invalidTaxaBlock(scanner, "DIMENSIONS declared but no TAXLABELS given");
                    }
                    return;
                case "DIMENSIONS":
                    ntax = parseDimensions();
                    break;
                case "TAXLABELS":
                    if (ntax < 0) {
                        throw ParsingException.invalidTaxaBlock(scanner, "TAXLABELS must follow DIMENSIONS NTAX=n");
                    }
                    if (labels != null) {
                        throw ParsingException.invalidTaxaBlock(scanner, "Only one TAXLABELS statement allowed");
                    }
                    labels = parseTaxLabels(ntax);
                    for (String label : labels) {
                        taxonMap.getOrInsert(label);
                    }
                    break;
                default:
                    log.log(Level.FINE, "Skipping {0} statement in TAXA block", command);
                    skipStatement();
            }
        }
    }

    /**
     * Reads {@code key=value} pairs up to ';' and returns the NTAX value.
     */
    private int parseDimensions() throws ParsingException {
        int ntax = -1;
        while (true) {
            scanner.skipWhitespaceAndComments();
            checkNotAtEnd();
            if (scanner.consumeIf((byte) ';')) {
                break;
            }
            String key = scanner.parseLabel(WORD_DELIMITERS);
            if (key.isEmpty()) {
                throw ParsingException.invalidTaxaBlock(scanner,
                        "Unexpected " + ByteScanner.describe(scanner.peek()) + " in DIMENSIONS");
            }
            scanner.skipWhitespaceAndComments();
            if (!scanner.consumeIf((byte) '=')) {
                continue;  // flag without a value
            }
            scanner.skipWhitespaceAndComments();
            checkNotAtEnd();
            int valueStart = scanner.position();
            String value = scanner.parseLabel(WORD_DELIMITERS);
            if (key.equalsIgnoreCase("NTAX")) {
                ntax = parseTaxonCount(value, valueStart);
            }
        }
        if (ntax < 0) {
            throw ParsingException.invalidTaxaBlock(scanner, "DIMENSIONS must declare NTAX");
        }
        return ntax;
    }

    private int parseTaxonCount(String value, int position) throws ParsingException {
        try {
            int n = Integer.parseInt(value);
            if (n > 0) {
                return n;
            }
        } catch (NumberFormatException e) {
            throw new ParsingException(ParsingErrorType.INVALID_TAXA_BLOCK, position,
                    "Invalid NTAX value " + describeWord(value), scanner.contextAsString(position, Config.CONTEXT_LENGTH), e);
        }
        throw errorAt(ParsingErrorType.INVALID_TAXA_BLOCK, position, "NTAX must be positive, got " + value);
    }

    private List<String> parseTaxLabels(int ntax) throws ParsingException {
        List<String> labels = new ArrayList<>(Math.min(ntax, 1024));  // NTAX is not trusted until counted
        Set<String> seen = new HashSet<>();
        while (true) {
            scanner.skipWhitespaceAndComments();
            checkNotAtEnd();
            if (scanner.consumeIf((byte) ';')) {
                break;
            }
            int start = scanner.position();
            String label = scanner.parseLabel(WORD_DELIMITERS);
            if (label.isEmpty()) {
                throw ParsingException.invalidTaxaBlock(scanner,
                        "Unexpected " + ByteScanner.describe(scanner.peek()) + " in TAXLABELS");
            }
            if (!seen.add(label)) {
                throw errorAt(ParsingErrorType.INVALID_TAXA_BLOCK, start, "Duplicate taxon label '" + label + "'");
            }
            labels.add(label);
        }
        if (labels.size() != ntax) {
            throw ParsingException.invalidTaxaBlock(scanner,
                    "Expected " + ntax + " taxa but TAXLABELS lists " + labels.size());
        }
        return labels;
    }

    // ----------------------------------------------------------------------
    // TREES

    private void parseTreesBlock() throws ParsingException {
        Map<String, String> translation = null;
        LabelResolver resolver = null;
        int treesBefore = trees.size();

        while (true) {
            String command = readCommand(ParsingErrorType.INVALID_TREES_BLOCK);
            switch (command.toUpperCase(Locale.ROOT)) {
                case "END":
                case "ENDBLOCK":
                    expectStatementEnd(ParsingErrorType.INVALID_TREES_BLOCK);
                    log.log(Level.FINE, "Parsed {0} trees from TREES block", trees.size() - treesBefore);
                    return;
                case "TRANSLATE":
                    if (translation != null) {
                        throw ParsingException.invalidTreesBlock(scanner, "Only one TRANSLATE table allowed per TREES block");
                    }
                    if (trees.size() > treesBefore) {
                        throw ParsingException.invalidTreesBlock(scanner, "TRANSLATE must precede all TREE statements");
                    }
                    translation = parseTranslate();
                    resolver = LabelResolver.keyToLabelToIndex(translation, taxonMap);
                    break;
                case "TREE":
                case "UTREE":
                    if (resolver == null) {
                        resolver = LabelResolver.labelToIndex(taxonMap);
                    }
                    int numLeaves = translation != null ? translation.size() : Math.max(taxonMap.size(), Config.DEFAULT_LEAF_HINT);
                    trees.add(parseTreeStatement(numLeaves, resolver));
                    if (resolver.getMode() == LabelResolver.Mode.KEY_TO_LABEL_TO_INDEX) {
                        resolver = LabelResolver.keyToIndex(translation, taxonMap);
                    }
                    break;
                default:
                    log.log(Level.FINE, "Skipping {0} statement in TREES block", command);
                    skipStatement();
            }
        }
    }

    /**
     * Reads {@code key label, key label, ...;} into an insertion-ordered map.
     */
    private Map<String, String> parseTranslate() throws ParsingException {
        Map<String, String> translation = new LinkedHashMap<>();
        while (true) {
            scanner.skipWhitespaceAndComments();
            checkNotAtEnd();
            if (scanner.consumeIf((byte) ';')) {
                break;  // empty table or trailing comma
            }
            int start = scanner.position();
            String key = scanner.parseLabel(WORD_DELIMITERS);
            if (key.isEmpty()) {
                throw ParsingException.invalidTreesBlock(scanner,
                        "Expected translation key but found " + ByteScanner.describe(scanner.peek()));
            }
            scanner.skipWhitespaceAndComments();
            checkNotAtEnd();
            String label = scanner.parseLabel(WORD_DELIMITERS);
            if (label.isEmpty()) {
                throw ParsingException.invalidTreesBlock(scanner,
                        "Missing label for translation key '" + key + "'");
            }
            if (translation.put(key, label) != null) {
                throw errorAt(ParsingErrorType.INVALID_TREES_BLOCK, start, "Duplicate translation key '" + key + "'");
            }

            scanner.skipWhitespaceAndComments();
            checkNotAtEnd();
            if (scanner.consumeIf((byte) ';')) {
                break;
            }
            if (!scanner.consumeIf((byte) ',')) {
                throw ParsingException.invalidTreesBlock(scanner,
                        "Expected ',' or ';' after translation of '" + key + "' but found " + ByteScanner.describe(scanner.peek()));
            }
        }
        return translation;
    }

    /**
     * Parses {@code [*] name = newick;} following a TREE keyword.
     */
    private Tree parseTreeStatement(int numLeaves, LabelResolver resolver) throws ParsingException {
        scanner.skipWhitespaceAndComments();
        scanner.consumeIf((byte) '*');  // default tree marker
        scanner.skipWhitespaceAndComments();
        checkNotAtEnd();
        String name = scanner.parseLabel(WORD_DELIMITERS);
        if (name.isEmpty()) {
            throw ParsingException.invalidTreesBlock(scanner,
                    "Missing tree name, found " + ByteScanner.describe(scanner.peek()));
        }
        scanner.skipWhitespaceAndComments();
        checkNotAtEnd();
        if (!scanner.consumeIf((byte) '=')) {
            throw ParsingException.invalidTreesBlock(scanner,
                    "Expected '=' after tree name '" + name + "' but found " + ByteScanner.describe(scanner.peek()));
        }

        int start = scanner.position();
        Tree tree = NewickParser.parse(scanner, numLeaves, resolver);
        if (Config.VALIDATE_TREES && !tree.isValid()) {
            throw errorAt(ParsingErrorType.INVALID_NEWICK_STRING, start, "Tree '" + name + "' failed validity check");
        }
        return tree;
    }

    // ----------------------------------------------------------------------
    // Shared statement handling

    /**
     * Reads the keyword that starts the next statement of a block.
     */
    private String readCommand(ParsingErrorType blockError) throws ParsingException {
        scanner.skipWhitespaceAndComments();
        checkNotAtEnd();
        String command = scanner.parseLabel(WORD_DELIMITERS);
        if (command.isEmpty()) {
            throw ParsingException.from(blockError, scanner,
                    "Expected a command but found " + ByteScanner.describe(scanner.peek()));
        }
        return command;
    }

    private void expectStatementEnd(ParsingErrorType blockError) throws ParsingException {
        scanner.skipWhitespaceAndComments();
        checkNotAtEnd();
        if (!scanner.consumeIf((byte) ';')) {
            throw ParsingException.from(blockError, scanner,
                    "Expected ';' but found " + ByteScanner.describe(scanner.peek()));
        }
    }

    /**
     * Discards statements until END; or ENDBLOCK;
     */
    private void skipBlock() throws ParsingException {
        while (true) {
            scanner.skipWhitespaceAndComments();
            checkNotAtEnd();
            boolean quoted = scanner.peekIs(ByteScanner.QUOTE);
            String command = scanner.parseLabel(WORD_DELIMITERS);
            if (!quoted && (command.equalsIgnoreCase("END") || command.equalsIgnoreCase("ENDBLOCK"))) {
                expectStatementEnd(ParsingErrorType.INVALID_FORMATTING);
                return;
            }
            skipStatement();
        }
    }

    /**
     * Discards input up to and including the next ';' that is neither inside a
     * comment nor inside a quoted token.
     */
    private void skipStatement() throws ParsingException {
        while (true) {
            scanner.skipWhitespaceAndComments();
            checkNotAtEnd();
            if (scanner.peekIs(ByteScanner.QUOTE)) {
                scanner.parseLabel(WORD_DELIMITERS);
            } else if (scanner.next() == ';') {
                return;
            }
        }
    }

    private void checkNotAtEnd() throws ParsingException {
        if (scanner.isAtEnd()) {
            throw ParsingException.unexpectedEof(scanner);
        }
    }

    private ParsingException errorAt(ParsingErrorType type, int position, String detail) {
        return new ParsingException(type, position, detail, scanner.contextAsString(position, Config.CONTEXT_LENGTH));
    }

    private static String describeWord(String word) {
        return word.isEmpty() ? "nothing" : "'" + word + "'";
    }
}
