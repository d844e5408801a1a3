package io.github.cyfko.roaql.core.spi;

import io.github.cyfko.roaql.core.model.FilterNode;
import io.github.cyfko.roaql.core.utils.ValidationResult;

import java.util.List;

/**
 * Declarative description of one operator of the query language.
 * <p>
 * A descriptor tells the grammar how the operator is written ({@link #token()},
 * {@link #grammarContribution()}), checks the arguments collected for an invocation
 * ({@link #validate}) and builds the resulting node ({@link #build}). Descriptors are stateless:
 * the arguments of an invocation live in the parse state, never in the descriptor, so a single
 * instance serves every concurrent parse.
 * </p>
 *
 * <h3>Example Implementation:</h3>
 * <pre>{@code
 * public class NotEqualsOperator implements OperatorDescriptor {
 *     public String token() { return "ne"; }
 *     public OperatorKind kind() { return OperatorKind.COMPARISON; }
 *     public int minArity() { return 2; }
 *     public int maxArity() { return 2; }
 *     public GrammarContribution grammarContribution() { return GrammarContribution.ARGUMENT_LIST; }
 *
 *     public ValidationResult validate(List<String> arguments, ParseContext context) {
 *         return context.model().findColumn(arguments.get(0)).isPresent()
 *                 ? ValidationResult.success()
 *                 : ValidationResult.failure("Unknown column " + arguments.get(0));
 *     }
 *
 *     public FilterNode build(List<String> arguments, ParseContext context) {
 *         ...
 *     }
 * }
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 * @see OperatorRegistry
 */
public interface OperatorDescriptor {

    /**
     * @return the keyword of the operator, a lower-case identifier unique within a registry
     */
    String token();

    /**
     * @return the family of nodes this operator builds
     */
    OperatorKind kind();

    /**
     * Minimum number of operands. For {@link GrammarContribution#ARGUMENT_LIST} operators this is
     * the number of arguments, for {@link GrammarContribution#RAW_ARGUMENT} operators the number of
     * sub-expressions.
     *
     * @return minimum operand count
     */
    int minArity();

    /**
     * @return maximum operand count, {@link Integer#MAX_VALUE} when unbounded
     */
    int maxArity();

    /**
     * @return how the text between the operator parentheses is tokenized
     */
    GrammarContribution grammarContribution();

    /**
     * Checks the arguments of one invocation against the model.
     *
     * @param arguments trimmed arguments in source order (a single raw argument for
     *                  {@link GrammarContribution#RAW_ARGUMENT} operators)
     * @param context   the running parse
     * @return success, or a failure carrying a message naming the operator
     */
    ValidationResult validate(List<String> arguments, ParseContext context);

    /**
     * Builds the node of an invocation whose arguments passed {@link #validate}.
     *
     * @param arguments the validated arguments
     * @param context   the running parse
     * @return the node
     */
    FilterNode build(List<String> arguments, ParseContext context);
}
