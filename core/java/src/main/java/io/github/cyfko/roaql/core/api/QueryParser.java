package io.github.cyfko.roaql.core.api;

import io.github.cyfko.roaql.core.exception.DSLLexicalException;
import io.github.cyfko.roaql.core.exception.DSLSyntaxException;
import io.github.cyfko.roaql.core.exception.FilterValidationException;
import io.github.cyfko.roaql.core.model.FilterNode;
import io.github.cyfko.roaql.core.model.Sort;

import java.util.List;

/**
 * Parser for the resource query language used by REST collection endpoints.
 *
 * <h2>Grammar</h2>
 * <table border="1">
 * <caption>Operator Reference</caption>
 * <thead>
 * <tr><th>Kind</th><th>Operators</th><th>Form</th><th>Example</th></tr>
 * </thead>
 * <tbody>
 * <tr><td>Comparison</td><td>eq, gt, ge, lt, le, like</td><td>op(column,value)</td><td>eq(name,"John")</td></tr>
 * <tr><td>Membership</td><td>in</td><td>in(column,[v1,v2,...])</td><td>in(id,[1,2,3])</td></tr>
 * <tr><td>Compound</td><td>and, or</td><td>op(expr,expr,...)</td><td>and(gt(id,1),lt(id,5))</td></tr>
 * <tr><td>Sort</td><td>asc, desc</td><td>op(column)</td><td>desc(id)</td></tr>
 * </tbody>
 * </table>
 *
 * <p>Values are JSON literals. Whitespace outside quoted literals is ignored.</p>
 *
 * <h2>Usage Examples</h2>
 * <pre>{@code
 * QueryParser parser = new BasicQueryParser();
 *
 * FilterNode filter = parser.parseFilter("or(eq(name,\"John\"),and(gt(id,1),lt(id,5)))", schema);
 * List<Sort> sorts = parser.parseSort(List.of("asc(name)", "desc(id)"), schema);
 * }</pre>
 *
 * <h2>Implementation Requirements</h2>
 * <ul>
 *   <li>Every call works on its own parse state: implementations may be shared across threads</li>
 *   <li>A call returns a complete, immutable tree or throws; there are no partial results</li>
 *   <li>Identical input yields structurally equal, independent trees</li>
 * </ul>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public interface QueryParser {

    /**
     * Parses a filter expression.
     * <p>
     * An empty expression is not a valid filter. Callers reading the filter from an optional request
     * parameter skip this method when the parameter is absent or blank and run the query without a
     * filter, e.g. by passing {@code null} to {@code JpaResourceQuery.fetch}.
     * </p>
     *
     * <pre>{@code
     * FilterNode filter = (raw == null || raw.isBlank()) ? null : parser.parseFilter(raw, schema);
     * }</pre>
     *
     * @param expression the filter expression, e.g. {@code and(gt(id,1),lt(id,5))}
     * @param model      the schema column names are resolved against
     * @return a {@code Comparison} or {@code Compound} node
     * @throws DSLLexicalException        if a literal is never terminated
     * @throws DSLSyntaxException         if the expression is empty, too long or malformed
     * @throws FilterValidationException  if an operator or column cannot be applied to the model
     */
    FilterNode parseFilter(String expression, ModelSchema model);

    /**
     * Parses an ordered list of sort expressions.
     *
     * @param expressions sort expressions such as {@code asc(name)}, primary key first
     * @param model       the schema column names are resolved against
     * @return sort nodes in input order
     * @throws DSLSyntaxException        if an expression is malformed or the list exceeds the policy
     * @throws FilterValidationException if an expression is not a sort or names an unknown column
     */
    List<Sort> parseSort(List<String> expressions, ModelSchema model);
}
