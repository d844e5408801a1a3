package io.github.cyfko.roaql.core.parsing;

import java.util.List;

/**
 * Grammar production selected for a {@code (rule, lookahead)} pair.
 *
 * @param rule           the expanded rule
 * @param lookahead      the lookahead key, or {@link GrammarTable#ANY}
 * @param rightHandSide  symbols replacing the rule, in source order
 * @param action         semantic action run when the production is applied
 * @author Frank KOSSI
 * @since 1.0.0
 */
record Production(String rule, String lookahead, List<GrammarSymbol> rightHandSide, SemanticAction action) {

    Production {
        rightHandSide = List.copyOf(rightHandSide);
    }

    @Override
    public String toString() {
        return rule + " [" + lookahead + "] -> " + (rightHandSide.isEmpty() ? "ε" : rightHandSide);
    }
}
