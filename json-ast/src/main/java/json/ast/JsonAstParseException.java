package json.ast;

import java.util.Objects;

/// Exception thrown when text is not a valid JSON document.
/// Every grammar violation is fatal to the parse call that raised it.
public class JsonAstParseException extends RuntimeException {

    @java.io.Serial
    private static final long serialVersionUID = 1L;

    /// The category of grammar violation.
    public enum Kind {
        /// A specific character (or end of input) was required and something else was found.
        UNEXPECTED_CHARACTER,
        /// The lookahead character cannot start any value.
        INVALID_VALUE,
        /// End of input inside an open string.
        UNTERMINATED_STRING,
        /// An unrecognized character after `\`.
        INVALID_ESCAPE,
        /// Fewer than four hex digits in a unicode escape.
        INVALID_UNICODE_ESCAPE,
        /// A leading zero, or no digit where the integer part starts.
        INVALID_NUMBER,
        /// A `.` with no digit after it.
        INVALID_FRACTION,
        /// An `e`/`E` (and optional sign) with no digit after it.
        INVALID_EXPONENT,
        /// A `t`/`f` lookahead that does not begin a boolean literal.
        INVALID_BOOLEAN,
        /// Non-whitespace after the single top-level value.
        TRAILING_CONTENT
    }

    private final Kind kind;
    private final String detail;
    private final int offset;
    private final int line;
    private final int column;

    /// Creates a parse exception positioned at `offset` within `text`.
    /// @param kind the violation category
    /// @param detail the short description of the violation
    /// @param text the text being parsed
    /// @param offset the cursor offset where the violation was detected
    public JsonAstParseException(Kind kind, String detail, String text, int offset) {
        this(kind, detail, offset,
                lineOf(Objects.requireNonNull(text, "text must not be null"), offset),
                columnOf(text, offset));
    }

    private JsonAstParseException(Kind kind, String detail, int offset, int line, int column) {
        super(formatMessage(detail, line, column));
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.detail = detail;
        this.offset = offset;
        this.line = line;
        this.column = column;
    }

    /// Returns the violation category.
    public Kind kind() {
        return kind;
    }

    /// Returns the message without the line and column suffix.
    public String detail() {
        return detail;
    }

    /// Returns the offset in the input where the violation was detected.
    public int offset() {
        return offset;
    }

    /// Returns the 1-based line of [#offset()].
    public int line() {
        return line;
    }

    /// Returns the 1-based column of [#offset()].
    public int column() {
        return column;
    }

    private static String formatMessage(String detail, int line, int column) {
        return detail + ". Location: line " + line + ", column " + column + ".";
    }

    // Lines are split on \n, \r and \r\n.
    private static int lineOf(String text, int offset) {
        int line = 1;
        final int limit = Math.min(offset, text.length());
        for (int i = 0; i < limit; i++) {
            final char c = text.charAt(i);
            if (c == '\n' || (c == '\r' && (i + 1 >= text.length() || text.charAt(i + 1) != '\n'))) {
                line++;
            }
        }
        return line;
    }

    private static int columnOf(String text, int offset) {
        final int limit = Math.min(offset, text.length());
        int lineStart = 0;
        for (int i = 0; i < limit; i++) {
            final char c = text.charAt(i);
            if (c == '\n' || c == '\r') {
                lineStart = i + 1;
            }
        }
        return offset - lineStart + 1;
    }
}
