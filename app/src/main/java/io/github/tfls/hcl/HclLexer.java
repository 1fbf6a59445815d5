package io.github.tfls.hcl;

import io.github.tfls.indexer.Diagnostic;
import io.github.tfls.indexer.SourcePos;
import io.github.tfls.indexer.SourceRange;
import java.util.ArrayList;
import java.util.List;

/**
 * Splits native-syntax configuration text into tokens. Comments and insignificant whitespace are dropped; newlines
 * are kept because they terminate attributes. Positions are zero-based lines and UTF-16 columns.
 */
final class HclLexer {

    enum TokenType {
        IDENT,
        STRING,
        HEREDOC,
        NUMBER,
        LBRACE,
        RBRACE,
        OPEN, // ( or [
        CLOSE, // ) or ]
        EQUALS,
        OTHER,
        NEWLINE,
        EOF
    }

    /**
     * @param value unescaped string content for STRING and HEREDOC, the raw text otherwise
     * @param literal true for STRING and HEREDOC tokens without {@code ${...}} or {@code %{...}} templates
     */
    record Token(TokenType type, String value, boolean literal, int startOffset, int endOffset, SourcePos start, SourcePos end) {
        SourceRange range() {
            return new SourceRange(start, end);
        }
    }

    private final String text;
    private final List<Diagnostic> diagnostics;
    private int offset;
    private int line;
    private int column;

    HclLexer(String text, List<Diagnostic> diagnostics) {
        this.text = text;
        this.diagnostics = diagnostics;
    }

    List<Token> tokenize() {
        var tokens = new ArrayList<Token>();
        while (true) {
            var token = next();
            tokens.add(token);
            if (token.type() == TokenType.EOF) {
                return tokens;
            }
        }
    }

    private Token next() {
        skipTrivia();
        int startOffset = offset;
        var start = pos();
        if (offset >= text.length()) {
            return new Token(TokenType.EOF, "", false, startOffset, startOffset, start, start);
        }
        char c = text.charAt(offset);
        if (c == '\n') {
            advance();
            return token(TokenType.NEWLINE, "\n", startOffset, start);
        }
        if (c == '"') {
            return string(startOffset, start);
        }
        if (c == '<' && peek(1) == '<' && (isIdentStart(peek(2)) || (peek(2) == '-' && isIdentStart(peek(3))))) {
            return heredoc(startOffset, start);
        }
        if (isIdentStart(c)) {
            while (offset < text.length() && isIdentPart(text.charAt(offset))) {
                advance();
            }
            return token(TokenType.IDENT, text.substring(startOffset, offset), startOffset, start);
        }
        if (Character.isDigit(c)) {
            return number(startOffset, start);
        }
        advance();
        switch (c) {
            case '{' -> {
                return token(TokenType.LBRACE, "{", startOffset, start);
            }
            case '}' -> {
                return token(TokenType.RBRACE, "}", startOffset, start);
            }
            case '(', '[' -> {
                return token(TokenType.OPEN, String.valueOf(c), startOffset, start);
            }
            case ')', ']' -> {
                return token(TokenType.CLOSE, String.valueOf(c), startOffset, start);
            }
            case '=' -> {
                if (peek(0) == '=' || peek(0) == '>') {
                    advance();
                    return token(TokenType.OTHER, text.substring(startOffset, offset), startOffset, start);
                }
                return token(TokenType.EQUALS, "=", startOffset, start);
            }
            default -> {
                // two-character operators are kept together so "!=" or "<=" never looks like an assignment
                if ((c == '!' || c == '<' || c == '>') && peek(0) == '=') {
                    advance();
                }
                return token(TokenType.OTHER, text.substring(startOffset, offset), startOffset, start);
            }
        }
    }

    private void skipTrivia() {
        while (offset < text.length()) {
            char c = text.charAt(offset);
            if (c == ' ' || c == '\t' || c == '\r' || c == '\f') {
                advance();
            } else if (c == '#' || (c == '/' && peek(1) == '/')) {
                while (offset < text.length() && text.charAt(offset) != '\n') {
                    advance();
                }
            } else if (c == '/' && peek(1) == '*') {
                var start = pos();
                advance();
                advance();
                boolean closed = false;
                while (offset < text.length()) {
                    if (text.charAt(offset) == '*' && peek(1) == '/') {
                        advance();
                        advance();
                        closed = true;
                        break;
                    }
                    advance();
                }
                if (!closed) {
                    diagnostics.add(Diagnostic.error("Unterminated comment", new SourceRange(start, pos())));
                }
            } else {
                return;
            }
        }
    }

    private Token string(int startOffset, SourcePos start) {
        advance(); // opening quote
        var value = new StringBuilder();
        boolean literal = true;
        while (true) {
            if (offset >= text.length() || text.charAt(offset) == '\n') {
                diagnostics.add(Diagnostic.error("Unterminated string", new SourceRange(start, pos())));
                return new Token(TokenType.STRING, value.toString(), literal, startOffset, offset, start, pos());
            }
            char c = text.charAt(offset);
            if (c == '"') {
                advance();
                return new Token(TokenType.STRING, value.toString(), literal, startOffset, offset, start, pos());
            }
            if (c == '\\') {
                escape(value);
                continue;
            }
            if ((c == '$' || c == '%') && peek(1) == c && peek(2) == '{') {
                // "$${" and "%%{" are literal
                value.append(c).append('{');
                advance();
                advance();
                advance();
                continue;
            }
            if ((c == '$' || c == '%') && peek(1) == '{') {
                literal = false;
                int templateStart = offset;
                skipTemplate();
                value.append(text, templateStart, offset);
                continue;
            }
            value.append(c);
            advance();
        }
    }

    private void escape(StringBuilder value) {
        advance(); // backslash
        if (offset >= text.length()) {
            return;
        }
        char c = text.charAt(offset);
        advance();
        switch (c) {
            case 'n' -> value.append('\n');
            case 't' -> value.append('\t');
            case 'r' -> value.append('\r');
            case '"', '\\' -> value.append(c);
            case 'u' -> value.append(unicodeEscape(4));
            case 'U' -> value.append(unicodeEscape(8));
            default -> {
                diagnostics.add(Diagnostic.warning("Invalid escape sequence \\" + c, null));
                value.append('\\').append(c);
            }
        }
    }

    private String unicodeEscape(int digits) {
        int end = Math.min(text.length(), offset + digits);
        var hex = text.substring(offset, end);
        try {
            int codePoint = Integer.parseInt(hex, 16);
            while (offset < end) {
                advance();
            }
            return new String(Character.toChars(codePoint));
        } catch (IllegalArgumentException e) {
            diagnostics.add(Diagnostic.warning("Invalid unicode escape \\u" + hex, null));
            return "";
        }
    }

    /** Skips {@code ${ ... }} or {@code %{ ... }}, including nested braces and quoted strings. */
    private void skipTemplate() {
        advance(); // $ or %
        advance(); // {
        int depth = 1;
        while (offset < text.length() && depth > 0) {
            char c = text.charAt(offset);
            if (c == '\n') {
                // left for string() to report
                return;
            }
            if (c == '"') {
                advance();
                while (offset < text.length() && text.charAt(offset) != '"' && text.charAt(offset) != '\n') {
                    if (text.charAt(offset) == '\\') {
                        advance();
                    }
                    if (offset < text.length()) {
                        advance();
                    }
                }
                if (offset < text.length() && text.charAt(offset) == '"') {
                    advance();
                }
                continue;
            }
            if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
            }
            advance();
        }
    }

    private Token heredoc(int startOffset, SourcePos start) {
        advance();
        advance(); // <<
        boolean indented = peek(0) == '-';
        if (indented) {
            advance();
        }
        int markerStart = offset;
        while (offset < text.length() && isIdentPart(text.charAt(offset))) {
            advance();
        }
        var marker = text.substring(markerStart, offset);
        while (offset < text.length() && text.charAt(offset) != '\n') {
            advance();
        }
        if (offset < text.length()) {
            advance();
        }

        var lines = new ArrayList<String>();
        while (offset < text.length()) {
            int lineStart = offset;
            while (offset < text.length() && text.charAt(offset) != '\n') {
                advance();
            }
            var content = text.substring(lineStart, offset);
            if (content.strip().equals(marker)) {
                var value = joinHeredoc(lines, indented);
                return new Token(TokenType.HEREDOC, value, !hasTemplate(value), startOffset, offset, start, pos());
            }
            lines.add(content.endsWith("\r") ? content.substring(0, content.length() - 1) : content);
            if (offset < text.length()) {
                advance();
            }
        }
        diagnostics.add(Diagnostic.error("Unterminated heredoc, expected " + marker, new SourceRange(start, pos())));
        var value = joinHeredoc(lines, indented);
        return new Token(TokenType.HEREDOC, value, !hasTemplate(value), startOffset, offset, start, pos());
    }

    private static String joinHeredoc(List<String> lines, boolean indented) {
        if (!indented) {
            return lines.isEmpty() ? "" : String.join("\n", lines) + "\n";
        }
        int indent = Integer.MAX_VALUE;
        for (var line : lines) {
            if (line.isBlank()) {
                continue;
            }
            int i = 0;
            while (i < line.length() && (line.charAt(i) == ' ' || line.charAt(i) == '\t')) {
                i++;
            }
            indent = Math.min(indent, i);
        }
        var sb = new StringBuilder();
        for (var line : lines) {
            sb.append(line.length() >= indent && indent != Integer.MAX_VALUE ? line.substring(indent) : line.strip())
                    .append('\n');
        }
        return sb.toString();
    }

    private static boolean hasTemplate(String value) {
        return value.contains("${") || value.contains("%{");
    }

    private Token number(int startOffset, SourcePos start) {
        while (offset < text.length() && Character.isDigit(text.charAt(offset))) {
            advance();
        }
        if (peek(0) == '.' && Character.isDigit(peek(1))) {
            advance();
            while (offset < text.length() && Character.isDigit(text.charAt(offset))) {
                advance();
            }
        }
        if (peek(0) == 'e' || peek(0) == 'E') {
            int save = offset;
            int saveColumn = column;
            advance();
            if (peek(0) == '+' || peek(0) == '-') {
                advance();
            }
            if (!Character.isDigit(peek(0))) {
                offset = save;
                column = saveColumn;
            }
            while (offset < text.length() && Character.isDigit(text.charAt(offset))) {
                advance();
            }
        }
        return token(TokenType.NUMBER, text.substring(startOffset, offset), startOffset, start);
    }

    private Token token(TokenType type, String value, int startOffset, SourcePos start) {
        return new Token(type, value, false, startOffset, offset, start, pos());
    }

    private SourcePos pos() {
        return new SourcePos(line, column);
    }

    private char peek(int ahead) {
        int i = offset + ahead;
        return i < text.length() ? text.charAt(i) : '\0';
    }

    private void advance() {
        if (text.charAt(offset) == '\n') {
            line++;
            column = 0;
        } else {
            column++;
        }
        offset++;
    }

    private static boolean isIdentStart(char c) {
        return Character.isLetter(c) || c == '_';
    }

    private static boolean isIdentPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '-';
    }
}
