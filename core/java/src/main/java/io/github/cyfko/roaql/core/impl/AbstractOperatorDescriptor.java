package io.github.cyfko.roaql.core.impl;

import io.github.cyfko.roaql.core.spi.GrammarContribution;
import io.github.cyfko.roaql.core.spi.OperatorDescriptor;
import io.github.cyfko.roaql.core.spi.OperatorKind;
import io.github.cyfko.roaql.core.spi.ParseContext;
import io.github.cyfko.roaql.core.utils.ValidationResult;

/**
 * Base class holding the static metadata of an operator.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public abstract class AbstractOperatorDescriptor implements OperatorDescriptor {

    private final String token;
    private final OperatorKind kind;
    private final int minArity;
    private final int maxArity;
    private final GrammarContribution grammarContribution;

    protected AbstractOperatorDescriptor(String token, OperatorKind kind, int minArity, int maxArity,
                                         GrammarContribution grammarContribution) {
        this.token = token;
        this.kind = kind;
        this.minArity = minArity;
        this.maxArity = maxArity;
        this.grammarContribution = grammarContribution;
    }

    @Override
    public String token() {
        return token;
    }

    @Override
    public OperatorKind kind() {
        return kind;
    }

    @Override
    public int minArity() {
        return minArity;
    }

    @Override
    public int maxArity() {
        return maxArity;
    }

    @Override
    public GrammarContribution grammarContribution() {
        return grammarContribution;
    }

    /**
     * Checks that the model exposes the given attribute.
     *
     * @param attributeName attribute name taken from the expression
     * @param context       the running parse
     * @return success, or a failure naming the attribute
     */
    protected ValidationResult checkColumn(String attributeName, ParseContext context) {
        if (context.model().findColumn(attributeName).isPresent()) {
            return ValidationResult.success();
        }
        return ValidationResult.failure("Resource model " + context.model().modelName()
                + " does not contain " + attributeName + " attribute.");
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + token + "]";
    }
}
