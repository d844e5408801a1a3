package io.github.cyfko.roaql.core.impl;

import io.github.cyfko.roaql.core.api.ModelSchema;
import io.github.cyfko.roaql.core.api.QueryParser;
import io.github.cyfko.roaql.core.config.ParserPolicy;
import io.github.cyfko.roaql.core.exception.DSLSyntaxException;
import io.github.cyfko.roaql.core.exception.FilterValidationException;
import io.github.cyfko.roaql.core.model.FilterNode;
import io.github.cyfko.roaql.core.model.Sort;
import io.github.cyfko.roaql.core.parsing.ExpressionLexer;
import io.github.cyfko.roaql.core.parsing.GrammarDriver;
import io.github.cyfko.roaql.core.parsing.GrammarTable;
import io.github.cyfko.roaql.core.spi.OperatorRegistry;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Default {@link QueryParser}: lexer, table-driven grammar driver and operator registry.
 *
 * <h2>Pipeline</h2>
 * <ol>
 *   <li>{@link ExpressionLexer#tokenize(String)} - token stream ending with an end marker</li>
 *   <li>{@link GrammarDriver#parse(String, List)} - stack-driven derivation against the
 *       {@link GrammarTable}, running operator validation and node construction on each closing
 *       parenthesis</li>
 *   <li>Compound operators re-enter the pipeline for each of their sub-expressions</li>
 * </ol>
 *
 * <h2>Thread safety</h2>
 * <p>
 * The registry, grammar table, lexer and policy held by this class are immutable. Every call creates
 * its own driver and parse state, so one instance can serve concurrent requests.
 * </p>
 *
 * <h2>DoS Protection (Complexity Limits)</h2>
 * <p>
 * Expression length, compound nesting depth and sort list size are bounded by the
 * {@link ParserPolicy}; violations raise a {@link DSLSyntaxException}.
 * </p>
 *
 * <h2>Usage examples</h2>
 * <pre>{@code
 * // Default configuration
 * QueryParser parser = new BasicQueryParser();
 * FilterNode filter = parser.parseFilter("and(gt(id,1),lt(id,5))", schema);
 *
 * // Strict configuration (for public APIs)
 * QueryParser strictParser = new BasicQueryParser(ParserPolicy.strict());
 *
 * // Custom operators
 * QueryParser extended = new BasicQueryParser(
 *     OperatorRegistry.builder().registerStandardOperators().register(new NotEqualsOperator()).build(),
 *     ParserPolicy.defaults());
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class BasicQueryParser implements QueryParser {

    private static final Logger log = Logger.getLogger(BasicQueryParser.class.getName());

    private final OperatorRegistry registry;
    private final ParserPolicy policy;
    private final GrammarTable table;
    private final ExpressionLexer lexer;

    /**
     * Default constructor using the standard operators and {@link ParserPolicy#defaults()}.
     */
    public BasicQueryParser() {
        this(OperatorRegistry.standard(), ParserPolicy.defaults());
    }

    /**
     * @param policy the complexity limits
     */
    public BasicQueryParser(ParserPolicy policy) {
        this(OperatorRegistry.standard(), policy);
    }

    /**
     * @param registry the operators
     * @param policy   the complexity limits
     * @throws IllegalArgumentException if an argument is null
     */
    public BasicQueryParser(OperatorRegistry registry, ParserPolicy policy) {
        if (registry == null) {
            throw new IllegalArgumentException("Operator registry is required");
        }
        if (policy == null) {
            throw new IllegalArgumentException("Parser policy is required");
        }

        this.registry = registry;
        this.policy = policy;
        this.table = GrammarTable.from(registry);
        this.lexer = new ExpressionLexer(registry);
    }

    /**
     * @return the operators known to this parser
     */
    public OperatorRegistry getRegistry() {
        return registry;
    }

    /**
     * @return the complexity limits of this parser
     */
    public ParserPolicy getPolicy() {
        return policy;
    }

    @Override
    public FilterNode parseFilter(String expression, ModelSchema model) {
        Objects.requireNonNull(model, "Model schema is required");
        if (expression == null || expression.isBlank()) {
            throw new DSLSyntaxException("Filter expression cannot be null or empty");
        }

        FilterNode node = parse(expression, model);
        if (node instanceof Sort) {
            throw new FilterValidationException("Sort expression " + expression.trim() + " cannot be used as a filter.");
        }

        log.fine(() -> String.format("Parsed filter on %s: %s", model.modelName(), node.toExpression()));
        return node;
    }

    @Override
    public List<Sort> parseSort(List<String> expressions, ModelSchema model) {
        Objects.requireNonNull(expressions, "Sort expressions are required");
        Objects.requireNonNull(model, "Model schema is required");

        if (expressions.size() > policy.maxSortExpressions()) {
            throw new DSLSyntaxException(String.format(
                    "Too many sort expressions (%d, max: %d). Policy applied: %s",
                    expressions.size(), policy.maxSortExpressions(), policy.policyName()));
        }

        List<Sort> sorts = new ArrayList<>(expressions.size());
        for (String expression : expressions) {
            if (expression == null || expression.isBlank()) {
                throw new DSLSyntaxException("Sort expression cannot be null or empty");
            }

            FilterNode node = parse(expression, model);
            if (!(node instanceof Sort sort)) {
                throw new FilterValidationException("Expression " + expression.trim() + " is not a sort expression.");
            }
            sorts.add(sort);
        }

        log.fine(() -> String.format("Parsed %d sort key(s) on %s", sorts.size(), model.modelName()));
        return List.copyOf(sorts);
    }

    private FilterNode parse(String expression, ModelSchema model) {
        String trimmed = expression.trim();

        // DoS protection
        if (trimmed.length() > policy.maxExpressionLength()) {
            throw new DSLSyntaxException(String.format(
                    "Expression too long (%d characters, max: %d). Policy applied: %s",
                    trimmed.length(), policy.maxExpressionLength(), policy.policyName()));
        }

        return new GrammarDriver(table, lexer, policy, model).parse(trimmed);
    }
}
