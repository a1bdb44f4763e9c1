package parser;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;

import utils.Config;

/**
 * ByteScanner: cursor over an in-memory input buffer.
 *
 * Provides single byte lookahead, whitespace and comment skipping, label
 * tokenization and the context snippets used in error messages. The buffer is
 * never copied or modified; the cursor only moves forward.
 *
 * Comments are enclosed in square brackets and may nest.
 */
public class ByteScanner {

    /** Returned by {@link #peek()} and {@link #next()} once the input is exhausted. */
    public static final int END_OF_INPUT = -1;

    static final byte COMMENT_OPEN = '[';
    static final byte COMMENT_CLOSE = ']';
    static final byte QUOTE = '\'';

    private final byte[] bytes;
    private int position;

    public ByteScanner(byte[] bytes) {
        if (bytes == null) {
            throw new IllegalArgumentException("Input bytes must not be null");
        }
        this.bytes = bytes;
        this.position = 0;
    }

    /**
     * Scanner over the UTF-8 encoding of {@code text}.
     */
    public static ByteScanner of(String text) {
        return new ByteScanner(text.getBytes(StandardCharsets.UTF_8));
    }

    /** Current byte as an unsigned value, or {@link #END_OF_INPUT}. */
    public int peek() {
        return position < bytes.length ? bytes[position] & 0xFF : END_OF_INPUT;
    }

    /**
     * Whether the current byte equals {@code b}. Always false at the end of input.
     */
    public boolean peekIs(byte b) {
        return position < bytes.length && bytes[position] == b;
    }

    /** Consumes and returns the current byte, or returns {@link #END_OF_INPUT}. */
    public int next() {
        if (position >= bytes.length) {
            return END_OF_INPUT;
        }
        return bytes[position++] & 0xFF;
    }

    /** Consumes the current byte only if it equals {@code b}. */
    public boolean consumeIf(byte b) {
        if (peekIs(b)) {
            position++;
            return true;
        }
        return false;
    }

    /**
     * Whether every byte of the input has been consumed.
     */
    public boolean isAtEnd() {
        return position >= bytes.length;
    }

    /**
     * Byte offset of the cursor from the start of the input.
     *
     * This is the offset reported by parsing errors, so it counts bytes, not
     * characters, including any byte order mark.
     */
    public int position() {
        return position;
    }

    /**
     * Skips any run of whitespace and bracketed comments.
     *
     * @throws ParsingException if a comment is not closed before the input ends
     */
    public void skipWhitespaceAndComments() throws ParsingException {
        while (position < bytes.length) {
            byte b = bytes[position];
            if (isWhitespace(b)) {
                position++;
            } else if (b == COMMENT_OPEN) {
                skipComment();
            } else {
                return;
            }
        }
    }

    private void skipComment() throws ParsingException {
        int start = position;
        int depth = 0;
        while (position < bytes.length) {
            byte b = bytes[position++];
            if (b == COMMENT_OPEN) {
                depth++;
            } else if (b == COMMENT_CLOSE && --depth == 0) {
                return;
            }
        }
        throw new ParsingException(ParsingErrorType.UNCLOSED_COMMENT, start, null,
                contextAsString(start, Config.CONTEXT_LENGTH));
    }

    /**
     * Reads a label: either a single-quoted string (with {@code ''} standing for
     * one quote) or the bytes up to the first delimiter, comment opener or the
     * end of input. The cursor is left on the terminating byte.
     *
     * @return the label, possibly empty if a delimiter is the current byte
     * @throws ParsingException if a quoted label is not closed
     */
    public String parseLabel(byte[] delimiters) throws ParsingException {
        if (peekIs(QUOTE)) {
            return parseQuotedLabel();
        }
        int start = position;
        while (position < bytes.length) {
            byte b = bytes[position];
            if (b == COMMENT_OPEN || contains(delimiters, b)) {
                break;
            }
            position++;
        }
        return new String(bytes, start, position - start, StandardCharsets.UTF_8);
    }

    private String parseQuotedLabel() throws ParsingException {
        position++;  // opening quote
        ByteArrayOutputStream label = new ByteArrayOutputStream();
        while (position < bytes.length) {
            byte b = bytes[position++];
            if (b == QUOTE) {
                if (peekIs(QUOTE)) {
                    position++;
                    label.write(QUOTE);
                } else {
                    return new String(label.toByteArray(), StandardCharsets.UTF_8);
                }
            } else {
                label.write(b);
            }
        }
        throw ParsingException.unexpectedEof(this);
    }

    /**
     * Renders the next {@link Config#CONTEXT_LENGTH} bytes for error messages.
     */
    public String contextAsString() {
        return contextAsString(position, Config.CONTEXT_LENGTH);
    }

    /**
     * Renders up to {@code length} bytes from the cursor for error messages.
     *
     * Newlines, carriage returns and tabs are escaped so that the snippet
     * stays on one line. The snippet never ends in the middle of a multibyte
     * character, so it may be a few bytes shorter than requested.
     */
    public String contextAsString(int length) {
        return contextAsString(position, length);
    }

    String contextAsString(int from, int length) {
        int start = Math.min(Math.max(from, 0), bytes.length);
        int end = Math.min(bytes.length, start + Math.max(length, 0));
        // do not split a multibyte UTF-8 sequence at the cut
        while (end > start && end < bytes.length && (bytes[end] & 0xC0) == 0x80) {
            end--;
        }
        String raw = new String(bytes, start, end - start, StandardCharsets.UTF_8);
        StringBuilder sb = new StringBuilder(raw.length());
        for (int i = 0; i < raw.length(); i++) {
            char c = raw.charAt(i);
            switch (c) {
                case '\n': sb.append("\\n"); break;
                case '\r': sb.append("\\r"); break;
                case '\t': sb.append("\\t"); break;
                default: sb.append(c);
            }
        }
        return sb.toString();
    }

    /** Printable form of a value returned by {@link #peek()}, for messages. */
    static String describe(int b) {
        if (b == END_OF_INPUT) {
            return "end of input";
        }
        switch (b) {
            case '\n': return "'\\n'";
            case '\r': return "'\\r'";
            case '\t': return "'\\t'";
            default: return "'" + (char) b + "'";
        }
    }

    static boolean isWhitespace(byte b) {
        return b == ' ' || b == '\t' || b == '\n' || b == '\r' || b == '\f' || b == 0x0B;
    }

    private static boolean contains(byte[] set, byte b) {
        for (byte d : set) {
            if (d == b) return true;
        }
        return false;
    }
}
