package io.github.cyfko.roaql.core.spi;

import io.github.cyfko.roaql.core.api.ModelSchema;
import io.github.cyfko.roaql.core.model.FilterNode;

/**
 * View of the running parse handed to {@link OperatorDescriptor}s.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public interface ParseContext {

    /**
     * @return the schema columns are resolved against
     */
    ModelSchema model();

    /**
     * @return nesting depth of the expression being parsed, {@code 0} for a top-level expression
     */
    int depth();

    /**
     * Parses a sub-expression through a fresh lexer and driver, one level deeper.
     *
     * @param expression the sub-expression
     * @return its node
     * @throws io.github.cyfko.roaql.core.exception.QueryExpressionException if the sub-expression is
     *         invalid or nesting exceeds the parser policy
     */
    FilterNode parseNested(String expression);
}
