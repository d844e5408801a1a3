package io.github.cyfko.roaql.core.parsing;

/**
 * Lexical categories of the query language.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum TokenType {
    OPEN,
    CLOSE,
    COMMA,
    /** A registered operator keyword directly followed by {@code (}. */
    OPERATOR,
    /** Column name or value, possibly quoted or bracketed. */
    LITERAL,
    /** A literal whose quote or bracket is never closed. */
    MALFORMED_LITERAL,
    END
}
