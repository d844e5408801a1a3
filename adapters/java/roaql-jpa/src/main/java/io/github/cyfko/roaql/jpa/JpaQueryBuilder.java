package io.github.cyfko.roaql.jpa;

import io.github.cyfko.roaql.core.api.ColumnRef;
import io.github.cyfko.roaql.core.api.QueryBuilder;
import io.github.cyfko.roaql.core.exception.FilterValidationException;
import io.github.cyfko.roaql.core.model.Comparison;
import io.github.cyfko.roaql.core.model.Compound;
import io.github.cyfko.roaql.core.model.FilterNode;
import io.github.cyfko.roaql.core.model.FilterNodeVisitor;
import io.github.cyfko.roaql.core.model.Sort;
import io.github.cyfko.roaql.core.model.SortDirection;
import io.github.cyfko.roaql.jpa.utils.TypeConversionUtils;
import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.Expression;
import jakarta.persistence.criteria.Order;
import jakarta.persistence.criteria.Path;
import jakarta.persistence.criteria.Predicate;
import jakarta.persistence.criteria.Root;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Translates parsed filter and sort trees into JPA Criteria {@link Predicate}s and {@link Order}s.
 * <p>
 * A builder is bound to one {@link CriteriaBuilder} and one query {@link Root}, so it is created per
 * query and is not meant to be shared between threads.
 * </p>
 *
 * <h2>Operator mapping</h2>
 * <ul>
 *   <li>{@code eq}: {@code cb.equal}, or {@code cb.isNull} when the literal is {@code null}</li>
 *   <li>{@code gt}, {@code ge}, {@code lt}, {@code le}: the ordering comparisons of {@link CriteriaBuilder}</li>
 *   <li>{@code like}: {@code cb.like} on the attribute read as a string, the literal is the pattern</li>
 *   <li>{@code in}: {@code path.in(values)}</li>
 *   <li>{@code and}, {@code or}: {@code cb.and} and {@code cb.or} over the translated children</li>
 *   <li>{@code asc}, {@code desc}: {@code cb.asc} and {@code cb.desc}</li>
 * </ul>
 *
 * <p>
 * Literals are converted to the attribute's Java type with {@link TypeConversionUtils}; a literal
 * that cannot represent such a value fails with {@link FilterValidationException}.
 * </p>
 *
 * <pre>{@code
 * CriteriaBuilder cb = em.getCriteriaBuilder();
 * CriteriaQuery<Person> query = cb.createQuery(Person.class);
 * Root<Person> root = query.from(Person.class);
 *
 * JpaQueryBuilder<Person> builder = new JpaQueryBuilder<>(cb, root);
 * query.where(builder.apply(filter)).orderBy(builder.applyAll(sorts));
 * }</pre>
 *
 * @param <E> the entity type
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class JpaQueryBuilder<E> implements QueryBuilder<Predicate, Order> {
    private static final Logger logger = Logger.getLogger(JpaQueryBuilder.class.getName());

    private final CriteriaBuilder cb;
    private final Root<E> root;

    /**
     * @param cb   criteria builder of the entity manager running the query
     * @param root query root the attribute paths are resolved against
     */
    public JpaQueryBuilder(CriteriaBuilder cb, Root<E> root) {
        this.cb = Objects.requireNonNull(cb, "CriteriaBuilder cannot be null");
        this.root = Objects.requireNonNull(root, "Root cannot be null");
    }

    @Override
    public Predicate apply(FilterNode filter) {
        Objects.requireNonNull(filter, "Filter cannot be null");
        Predicate predicate = filter.accept(new PredicateVisitor());
        logger.fine(() -> String.format("Translated filter %s", filter.toExpression()));
        return predicate;
    }

    @Override
    public Order apply(Sort sort) {
        Objects.requireNonNull(sort, "Sort cannot be null");
        Path<?> path = root.get(sort.column().name());
        return sort.direction() == SortDirection.ASC ? cb.asc(path) : cb.desc(path);
    }

    private final class PredicateVisitor implements FilterNodeVisitor<Predicate> {

        @Override
        public Predicate visitComparison(Comparison comparison) {
            ColumnRef column = comparison.column();
            Path<?> path = root.get(column.name());
            Object value = comparison.value();

            return switch (comparison.op()) {
                case EQ -> value == null ? cb.isNull(path) : cb.equal(path, convert(comparison, value));
                case GT -> cb.greaterThan(comparable(path), comparableValue(comparison));
                case GE -> cb.greaterThanOrEqualTo(comparable(path), comparableValue(comparison));
                case LT -> cb.lessThan(comparable(path), comparableValue(comparison));
                case LE -> cb.lessThanOrEqualTo(comparable(path), comparableValue(comparison));
                case LIKE -> cb.like(path.as(String.class), nonNullValue(comparison).toString());
                case IN -> path.in(convertAll(comparison));
            };
        }

        @Override
        public Predicate visitCompound(Compound compound) {
            List<Predicate> predicates = new ArrayList<>(compound.children().size());
            for (FilterNode child : compound.children()) {
                predicates.add(child.accept(this));
            }
            Predicate[] array = predicates.toArray(new Predicate[0]);
            return switch (compound.kind()) {
                case AND -> cb.and(array);
                case OR -> cb.or(array);
            };
        }

        @Override
        public Predicate visitSort(Sort sort) {
            throw new FilterValidationException("Sort expression " + sort.toExpression() + " cannot be used as a filter.");
        }
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private static Expression<Comparable> comparable(Path<?> path) {
        return (Expression<Comparable>) (Expression) path;
    }

    @SuppressWarnings("rawtypes")
    private static Comparable comparableValue(Comparison comparison) {
        Object converted = convert(comparison, nonNullValue(comparison));
        if (!(converted instanceof Comparable<?> c)) {
            throw new FilterValidationException(String.format(
                    "Binary operation %s cannot order attribute %s of type %s.",
                    comparison.op().token(), comparison.column().name(), comparison.column().javaType().getSimpleName()));
        }
        return c;
    }

    private static Object nonNullValue(Comparison comparison) {
        if (comparison.value() == null) {
            throw new FilterValidationException(String.format(
                    "Binary operation %s cannot compare attribute %s with null.",
                    comparison.op().token(), comparison.column().name()));
        }
        return comparison.value();
    }

    private static Object convert(Comparison comparison, Object value) {
        try {
            return TypeConversionUtils.convertValue(comparison.column().javaType(), value);
        } catch (IllegalArgumentException e) {
            throw new FilterValidationException(String.format(
                    "Binary operation %s value %s does not fit attribute %s of type %s.",
                    comparison.op().token(), value, comparison.column().name(),
                    comparison.column().javaType().getSimpleName()), e);
        }
    }

    private static List<Object> convertAll(Comparison comparison) {
        List<?> values = (List<?>) comparison.value();
        if (values.contains(null)) {
            throw new FilterValidationException(String.format(
                    "Membership operation in cannot match attribute %s against null.", comparison.column().name()));
        }
        try {
            return TypeConversionUtils.convertAll(comparison.column().javaType(), values);
        } catch (IllegalArgumentException e) {
            throw new FilterValidationException(String.format(
                    "Membership operation in values %s do not fit attribute %s of type %s.",
                    values, comparison.column().name(), comparison.column().javaType().getSimpleName()), e);
        }
    }
}
