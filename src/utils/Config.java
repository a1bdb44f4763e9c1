package utils;

/**
 * Configuration class for NEXUS tree parsing.
 * This class holds global configuration parameters used throughout the parser.
 */
public class Config {

    /**
     * Literal token every NEXUS file must start with (matched case-insensitively)
     */
    public static String NEXUS_HEADER = "#NEXUS";

    /**
     * Number of upcoming bytes rendered into parsing error messages
     */
    public static int CONTEXT_LENGTH = 50;

    /**
     * Whether to run the structural validity check on every parsed tree.
     * Meant as a debugging aid; the parser never builds an invalid tree.
     */
    public static boolean VALIDATE_TREES = false;

    /**
     * Leaf count hint used when nothing better is known about the tree size
     */
    public static int DEFAULT_LEAF_HINT = 16;

    /**
     * Maximum parenthesis nesting accepted in a tree description.
     * The Newick parser recurses once per level, so this bounds its stack use;
     * deeper trees are rejected with a parsing error.
     */
    public static int MAX_NEWICK_DEPTH = 2048;
}
