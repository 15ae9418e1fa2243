package org.ergoplatform.ergoscript.lang;

/**
 * Lexical token with its 1-based position and whether a line break separates it from the previous
 * token.
 */
record Token(TokenType type, String lexeme, Object literal, int line, int column, boolean newlineBefore) {
}
