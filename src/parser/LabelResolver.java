package parser;

import java.util.HashMap;
import java.util.Map;

import taxon.TaxonMap;

/**
 * LabelResolver: maps a leaf token from a Newick string to a taxon id.
 *
 * NEXUS files name leaves in one of three ways, each with its own mode:
 *
 * 1. LABEL_TO_INDEX: the token is the taxon label itself ("Scarabaeus" -> 17)
 * 2. KEY_TO_LABEL_TO_INDEX: the token is a TRANSLATE key that is first mapped
 *    to its label, which is then looked up or inserted ("42" -> "Scarabaeus" -> 17)
 * 3. KEY_TO_INDEX: the token is a TRANSLATE key mapped straight to an id built
 *    once from the translation table ("42" -> 17)
 *
 * The third mode exists because one translation table is typically shared by
 * thousands of trees; after the first tree every label is known, so the label
 * lookups can be done once instead of once per leaf per tree.
 */
public final class LabelResolver {

    public enum Mode {
        LABEL_TO_INDEX,
        KEY_TO_LABEL_TO_INDEX,
        KEY_TO_INDEX
    }

    private final Mode mode;
    private final TaxonMap taxonMap;                    // null in KEY_TO_INDEX mode
    private final Map<String, String> translation;      // null unless KEY_TO_LABEL_TO_INDEX
    private final Map<String, Integer> indexMap;        // null unless KEY_TO_INDEX

    private LabelResolver(Mode mode, TaxonMap taxonMap, Map<String, String> translation, Map<String, Integer> indexMap) {
        this.mode = mode;
        this.taxonMap = taxonMap;
        this.translation = translation;
        this.indexMap = indexMap;
    }

    /**
     * Resolver for trees whose leaves carry their labels directly.
     */
    public static LabelResolver labelToIndex(TaxonMap taxonMap) {
        return new LabelResolver(Mode.LABEL_TO_INDEX, taxonMap, null, null);
    }

    /**
     * Resolver for the first tree that uses a translation table.
     */
    public static LabelResolver keyToLabelToIndex(Map<String, String> translation, TaxonMap taxonMap) {
        return new LabelResolver(Mode.KEY_TO_LABEL_TO_INDEX, taxonMap, translation, null);
    }

    /**
     * Resolver for every later tree sharing the same translation table.
     *
     * Builds the key to id mapping once. Labels the first tree did not reference
     * are inserted into {@code taxonMap} here so their keys stay resolvable.
     */
    public static LabelResolver keyToIndex(Map<String, String> translation, TaxonMap taxonMap) {
        Map<String, Integer> indexMap = new HashMap<>(translation.size() * 4 / 3 + 1);
        for (Map.Entry<String, String> e : translation.entrySet()) {
            indexMap.put(e.getKey(), taxonMap.getOrInsert(e.getValue()));
        }
        return new LabelResolver(Mode.KEY_TO_INDEX, null, null, indexMap);
    }

    public Mode getMode() {
        return mode;
    }

    /**
     * Resolves a parsed leaf token to a taxon id.
     *
     * @param scanner used only to locate the error if the token is unknown
     * @throws ParsingException if a translation mode does not know the token
     */
    public int resolve(String token, ByteScanner scanner) throws ParsingException {
        switch (mode) {
            case LABEL_TO_INDEX:
                return taxonMap.getOrInsert(token);
            case KEY_TO_LABEL_TO_INDEX: {
                String label = translation.get(token);
                if (label == null) {
                    throw ParsingException.invalidNewickString(scanner,
                            "Label '" + token + "' not found in translation map");
                }
                return taxonMap.getOrInsert(label);
            }
            case KEY_TO_INDEX: {
                Integer index = indexMap.get(token);
                if (index == null) {
                    throw ParsingException.invalidNewickString(scanner,
                            "Label '" + token + "' not found in index map");
                }
                return index;
            }
            default:
                throw new IllegalStateException("Unknown resolver mode " + mode);
        }
    }

    @Override
    public String toString() {
        switch (mode) {
            case KEY_TO_LABEL_TO_INDEX:
                return "LabelResolver(" + mode + ", " + translation.size() + " keys)";
            case KEY_TO_INDEX:
                return "LabelResolver(" + mode + ", " + indexMap.size() + " keys)";
            default:
                return "LabelResolver(" + mode + ")";
        }
    }
}
