package io.github.cyfko.roaql.core.model;

/**
 * Boolean combinators of the query language.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum CompoundKind {
    AND("and"),
    OR("or");

    private final String token;

    CompoundKind(String token) {
        this.token = token;
    }

    public String token() {
        return token;
    }
}
