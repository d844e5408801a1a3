package io.github.cyfko.roaql.core.parsing;

/**
 * Entry of the grammar stack: a terminal that must match the next token, or a rule expanded through
 * the {@link GrammarTable}.
 *
 * @param terminal {@code true} for terminals
 * @param name     lookahead key for terminals, rule name for rules
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record GrammarSymbol(boolean terminal, String name) {

    public static GrammarSymbol terminal(String key) {
        return new GrammarSymbol(true, key);
    }

    public static GrammarSymbol rule(String name) {
        return new GrammarSymbol(false, name);
    }

    @Override
    public String toString() {
        return terminal ? "'" + name + "'" : name;
    }
}
