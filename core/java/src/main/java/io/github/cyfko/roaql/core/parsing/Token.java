package io.github.cyfko.roaql.core.parsing;

import java.util.Objects;

/**
 * Lexical unit of a query expression.
 *
 * @param type     lexical category
 * @param text     source text of the token (empty for {@link TokenType#END})
 * @param position zero-based offset of the first character in the expression
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record Token(TokenType type, String text, int position) {

    /** Lookahead key shared by all literal tokens in the grammar table. */
    public static final String LITERAL_KEY = "<literal>";

    /** Lookahead key of the end-of-input marker. */
    public static final String END_KEY = "$";

    public Token {
        Objects.requireNonNull(type, "Token type is required");
        Objects.requireNonNull(text, "Token text is required");
    }

    /**
     * Key under which the grammar table looks this token up: the symbol or keyword itself,
     * {@link #LITERAL_KEY} for any literal and {@link #END_KEY} for the end marker.
     *
     * @return the lookahead key
     */
    public String key() {
        return switch (type) {
            case LITERAL, MALFORMED_LITERAL -> LITERAL_KEY;
            case END -> END_KEY;
            default -> text;
        };
    }

    /**
     * @return a human readable description for error messages
     */
    public String describe() {
        return type == TokenType.END ? "end of expression" : "token '" + text + "'";
    }
}
