package json.ast;

/// Character classes used by the recognizers. Arguments are UTF-16 code units;
/// [JsonCursor#END] is never a member of any class.
final class JsonChars {

    private JsonChars() {
    }

    /// Whitespace accepted between tokens: form feed, line feed, carriage return, tabs,
    /// space, no-break space, U+1680, U+2000 through U+200A, U+2028, U+2029, U+202F,
    /// U+205F, U+3000 and the byte order mark U+FEFF.
    static boolean isWhitespace(int c) {
        switch (c) {
            case '\f':
            case '\n':
            case '\r':
            case '\t':
            case 0x000B:
            case 0x0020:
            case 0x00A0:
            case 0x1680:
            case 0x2028:
            case 0x2029:
            case 0x202F:
            case 0x205F:
            case 0x3000:
            case 0xFEFF:
                return true;
            default:
                return c >= 0x2000 && c <= 0x200A;
        }
    }

    static boolean isDigit(int c) {
        return c >= '0' && c <= '9';
    }

    static boolean isDigitNonZero(int c) {
        return c >= '1' && c <= '9';
    }

    static boolean isHexDigit(int c) {
        return (c >= '0' && c <= '9') || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }

    /// True for every character that can begin a value.
    static boolean isValueStart(int c) {
        return c == '{' || c == '[' || c == '"' || c == '-'
                || c == 't' || c == 'f' || c == 'n'
                || isDigit(c);
    }
}
