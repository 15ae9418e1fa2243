package org.ergoplatform.ergoscript.lang;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Hand-written scanner for the ErgoScript subset. Comments are dropped; string literals keep their
 * raw text since the language only uses them as arguments of {@code fromBase16}.
 */
final class Lexer {
    private static final Map<String, TokenType> KEYWORDS = Map.of(
        "val", TokenType.VAL,
        "def", TokenType.DEF,
        "if", TokenType.IF,
        "else", TokenType.ELSE,
        "true", TokenType.TRUE,
        "false", TokenType.FALSE
    );
    private static final BigInteger INT_MAX = BigInteger.valueOf(Integer.MAX_VALUE);
    private static final BigInteger LONG_MAX = BigInteger.valueOf(Long.MAX_VALUE);

    private final String source;
    private final String[] lines;
    private final List<Token> tokens = new ArrayList<>();
    private int start;
    private int current;
    private int line = 1;
    private int lineStart;
    private int tokenLine;
    private int tokenColumn;
    private boolean sawNewline = true;

    Lexer(String source) {
        this.source = source;
        this.lines = source.split("\n", -1);
    }

    List<Token> tokenize() {
        while (!isAtEnd()) {
            start = current;
            tokenLine = line;
            tokenColumn = current - lineStart + 1;
            scanToken();
        }
        tokens.add(new Token(TokenType.EOF, "", null, line, current - lineStart + 1, true));
        return tokens;
    }

    String lineText(int lineNumber) {
        return lineNumber >= 1 && lineNumber <= lines.length ? lines[lineNumber - 1].stripTrailing() : "";
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            case '(' -> add(TokenType.LEFT_PAREN);
            case ')' -> add(TokenType.RIGHT_PAREN);
            case '{' -> add(TokenType.LEFT_BRACE);
            case '}' -> add(TokenType.RIGHT_BRACE);
            case '[' -> add(TokenType.LEFT_BRACKET);
            case ']' -> add(TokenType.RIGHT_BRACKET);
            case ',' -> add(TokenType.COMMA);
            case ':' -> add(TokenType.COLON);
            case '.' -> add(TokenType.DOT);
            case ';' -> add(TokenType.SEMICOLON);
            case '@' -> add(TokenType.AT);
            case '+' -> add(TokenType.PLUS);
            case '-' -> add(TokenType.MINUS);
            case '*' -> add(TokenType.STAR);
            case '%' -> add(TokenType.PERCENT);
            case '/' -> slash();
            case '!' -> add(match('=') ? TokenType.BANG_EQUAL : TokenType.BANG);
            case '=' -> add(match('=') ? TokenType.EQUAL_EQUAL : match('>') ? TokenType.ARROW : TokenType.EQUAL);
            case '<' -> add(match('=') ? TokenType.LESS_EQUAL : TokenType.LESS);
            case '>' -> add(match('=') ? TokenType.GREATER_EQUAL : TokenType.GREATER);
            case '&' -> {
                if (!match('&')) {
                    throw error("Unexpected '&'");
                }
                add(TokenType.AND_AND);
            }
            case '|' -> {
                if (!match('|')) {
                    throw error("Unexpected '|'");
                }
                add(TokenType.OR_OR);
            }
            case ' ', '\r', '\t' -> {
            }
            case '\n' -> newline();
            case '"' -> string();
            default -> {
                if (isDigit(c)) {
                    number();
                } else if (isAlpha(c)) {
                    identifier();
                } else {
                    throw error("Unexpected character '" + c + "'");
                }
            }
        }
    }

    private void slash() {
        if (match('/')) {
            while (!isAtEnd() && peek() != '\n') {
                advance();
            }
        } else if (match('*')) {
            while (!isAtEnd() && !(peek() == '*' && peekNext() == '/')) {
                if (advance() == '\n') {
                    newline();
                }
            }
            if (isAtEnd()) {
                throw error("Unterminated block comment");
            }
            current += 2;
        } else {
            add(TokenType.SLASH);
        }
    }

    private void newline() {
        line++;
        lineStart = current;
        sawNewline = true;
    }

    private void identifier() {
        while (isAlphaNumeric(peek())) {
            advance();
        }
        add(KEYWORDS.getOrDefault(source.substring(start, current), TokenType.IDENTIFIER));
    }

    private void number() {
        while (isDigit(peek())) {
            advance();
        }
        var digits = new BigInteger(source.substring(start, current));
        if (peek() == 'L' || peek() == 'l') {
            advance();
            if (digits.compareTo(LONG_MAX) > 0) {
                throw error("Long literal out of range: " + digits);
            }
            add(TokenType.LONG, digits.longValue());
            return;
        }
        if (digits.compareTo(INT_MAX) > 0) {
            throw error("Int literal out of range: " + digits + " (use an L suffix for Long)");
        }
        add(TokenType.INT, digits.intValue());
    }

    private void string() {
        while (!isAtEnd() && peek() != '"' && peek() != '\n') {
            advance();
        }
        if (isAtEnd() || peek() == '\n') {
            throw error("Unterminated string");
        }
        advance();
        add(TokenType.STRING, source.substring(start + 1, current - 1));
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char advance() {
        return source.charAt(current++);
    }

    private boolean match(char expected) {
        if (isAtEnd() || source.charAt(current) != expected) {
            return false;
        }
        current++;
        return true;
    }

    private char peek() {
        return isAtEnd() ? '\0' : source.charAt(current);
    }

    private char peekNext() {
        return current + 1 >= source.length() ? '\0' : source.charAt(current + 1);
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private static boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }

    private void add(TokenType type) {
        add(type, null);
    }

    private void add(TokenType type, Object literal) {
        tokens.add(new Token(type, source.substring(start, current), literal, tokenLine, tokenColumn, sawNewline));
        sawNewline = false;
    }

    private CompilerException error(String message) {
        int column = current - lineStart;
        return new CompilerException(message, new SourceContext(line, Math.max(1, column), lineText(line)));
    }
}
