package parser;

/**
 * Kinds of errors that can occur while parsing NEXUS files and Newick strings.
 */
public enum ParsingErrorType {

    UNEXPECTED_EOF("Unexpected end of file"),
    MISSING_NEXUS_HEADER("File does not start with #NEXUS header"),
    INVALID_BLOCK_NAME("Invalid block name"),
    INVALID_TAXA_BLOCK("Invalid TAXA block format"),
    INVALID_TREES_BLOCK("Invalid TREES block format"),
    UNCLOSED_COMMENT("Unclosed comment"),
    INVALID_NEWICK_STRING("Invalid newick string"),
    INVALID_FORMATTING("Invalid formatting");

    private final String description;

    ParsingErrorType(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }
}
