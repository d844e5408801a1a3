package io.github.cyfko.roaql.core.model;

/**
 * Comparison operators of the query language.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum ComparisonOp {
    EQ("eq"),
    GT("gt"),
    GE("ge"),
    LT("lt"),
    LE("le"),
    LIKE("like"),
    /** Membership test, the only operator taking a sequence value. */
    IN("in");

    private final String token;

    ComparisonOp(String token) {
        this.token = token;
    }

    /**
     * @return the operator keyword as written in expressions
     */
    public String token() {
        return token;
    }
}
