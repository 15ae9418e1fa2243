package org.ergoplatform.ergoscript.lang;

enum TokenType {
    LEFT_PAREN, RIGHT_PAREN, LEFT_BRACE, RIGHT_BRACE, LEFT_BRACKET, RIGHT_BRACKET,
    COMMA, COLON, DOT, SEMICOLON, AT,
    PLUS, MINUS, STAR, SLASH, PERCENT,
    BANG, BANG_EQUAL, EQUAL, EQUAL_EQUAL, ARROW,
    LESS, LESS_EQUAL, GREATER, GREATER_EQUAL,
    AND_AND, OR_OR,
    IDENTIFIER, INT, LONG, STRING,
    VAL, DEF, IF, ELSE, TRUE, FALSE,
    EOF
}
