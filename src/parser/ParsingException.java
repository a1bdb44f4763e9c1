package parser;

/**
 * Thrown when a NEXUS file or Newick string is malformed.
 *
 * Carries the kind of error, the byte offset at which it was detected and the
 * bytes that followed that offset, so callers can point at the problem without
 * the parser doing any line or column bookkeeping.
 */
public class ParsingException extends Exception {

    private static final long serialVersionUID = 1L;

    private final ParsingErrorType type;
    private final int position;
    private final String detail;
    private final String context;

    public ParsingException(ParsingErrorType type, int position, String detail, String context) {
        this(type, position, detail, context, null);
    }

    public ParsingException(ParsingErrorType type, int position, String detail, String context, Throwable cause) {
        super(render(type, position, detail, context), cause);
        this.type = type;
        this.position = position;
        this.detail = detail;
        this.context = context == null ? "" : context;
    }

    private static String render(ParsingErrorType type, int position, String detail, String context) {
        StringBuilder sb = new StringBuilder(type.description());
        if (detail != null && !detail.isEmpty()) {
            sb.append(" - ").append(detail);
        }
        sb.append(" at position ").append(position);
        if (context != null && !context.isEmpty()) {
            sb.append("\n  Context (next ").append(context.length()).append(" chars): ").append(context);
        }
        return sb.toString();
    }

    // Factories capturing position and context from the scanner at detection time

    static ParsingException from(ParsingErrorType type, ByteScanner scanner, String detail) {
        return new ParsingException(type, scanner.position(), detail, scanner.contextAsString());
    }

    static ParsingException unexpectedEof(ByteScanner scanner) {
        return from(ParsingErrorType.UNEXPECTED_EOF, scanner, null);
    }

    static ParsingException invalidBlockName(ByteScanner scanner, String detail) {
        return from(ParsingErrorType.INVALID_BLOCK_NAME, scanner, detail);
    }

    static ParsingException invalidTaxaBlock(ByteScanner scanner, String detail) {
        return from(ParsingErrorType.INVALID_TAXA_BLOCK, scanner, detail);
    }

    static ParsingException invalidTreesBlock(ByteScanner scanner, String detail) {
        return from(ParsingErrorType.INVALID_TREES_BLOCK, scanner, detail);
    }

    static ParsingException invalidNewickString(ByteScanner scanner, String detail) {
        return from(ParsingErrorType.INVALID_NEWICK_STRING, scanner, detail);
    }

    public ParsingErrorType getType() {
        return type;
    }

    /** Byte offset into the input at which the error was detected. */
    public int getPosition() {
        return position;
    }

    /** Kind-specific detail text, or null. */
    public String getDetail() {
        return detail;
    }

    /** Rendered bytes following {@link #getPosition()}. */
    public String getContext() {
        return context;
    }
}
