package io.github.cyfko.roaql.jpa;

import io.github.cyfko.roaql.core.model.FilterNode;
import io.github.cyfko.roaql.core.model.Sort;
import jakarta.persistence.EntityManager;
import jakarta.persistence.TypedQuery;
import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.CriteriaQuery;
import jakarta.persistence.criteria.Root;

import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Runs parsed filter and sort trees against an entity through the Criteria API.
 * <p>
 * A {@code null} filter means no restriction; an empty sort list leaves the result order to the
 * database. Sort keys are applied in list order, the first one being the primary key.
 * </p>
 *
 * <pre>{@code
 * JpaModelSchema schema = JpaModelSchema.of(em.getMetamodel(), Person.class);
 * FilterNode filter = parser.parseFilter("and(ge(age,18),like(name,\"J%\"))", schema);
 * List<Sort> sorts = parser.parseSort(List.of("desc(age)", "asc(name)"), schema);
 *
 * List<Person> page = JpaResourceQuery.fetch(em, Person.class, filter, sorts);
 * List<Person> second = JpaResourceQuery.fetch(em, Person.class, filter, sorts, 20, 20);
 * long total = JpaResourceQuery.count(em, Person.class, filter);
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class JpaResourceQuery {
    private static final Logger logger = Logger.getLogger(JpaResourceQuery.class.getName());

    private JpaResourceQuery() {
        throw new UnsupportedOperationException("Utility class - cannot be instantiated");
    }

    /**
     * Loads the entities matching a filter, in sort order.
     *
     * @param em          entity manager
     * @param entityClass entity to query
     * @param filter      filter tree, or {@code null} for all rows
     * @param sorts       sort keys, may be empty
     * @param <E>         entity type
     * @return matching entities
     */
    public static <E> List<E> fetch(EntityManager em, Class<E> entityClass, FilterNode filter, List<Sort> sorts) {
        return select(em, entityClass, filter, sorts, null, null);
    }

    /**
     * Loads one window of the entities matching a filter, in sort order.
     * <p>
     * Rows are numbered from zero in sort order; the result holds at most {@code limit} rows starting
     * at row {@code offset}. Without sort keys the window is taken over the database's own order.
     * </p>
     *
     * <pre>{@code
     * // rows 20 to 29
     * List<Person> page = JpaResourceQuery.fetch(em, Person.class, filter, sorts, 20, 10);
     * }</pre>
     *
     * @param em          entity manager
     * @param entityClass entity to query
     * @param filter      filter tree, or {@code null} for all rows
     * @param sorts       sort keys, may be empty
     * @param offset      index of the first row to return, {@code >= 0}
     * @param limit       maximum number of rows to return, {@code > 0}
     * @param <E>         entity type
     * @return matching entities within the window
     * @throws IllegalArgumentException if {@code offset < 0} or {@code limit <= 0}
     */
    public static <E> List<E> fetch(EntityManager em, Class<E> entityClass, FilterNode filter, List<Sort> sorts,
                                    int offset, int limit) {
        if (offset < 0) {
            throw new IllegalArgumentException("Offset cannot be negative. Provided: " + offset);
        }
        if (limit <= 0) {
            throw new IllegalArgumentException("Limit must be positive. Provided: " + limit);
        }
        return select(em, entityClass, filter, sorts, offset, limit);
    }

    private static <E> List<E> select(EntityManager em, Class<E> entityClass, FilterNode filter, List<Sort> sorts,
                                      Integer offset, Integer limit) {
        Objects.requireNonNull(em, "EntityManager cannot be null");
        Objects.requireNonNull(entityClass, "Entity class cannot be null");
        Objects.requireNonNull(sorts, "Sort list cannot be null");
        long startTime = System.nanoTime();

        CriteriaBuilder cb = em.getCriteriaBuilder();
        CriteriaQuery<E> query = cb.createQuery(entityClass);
        Root<E> root = query.from(entityClass);
        JpaQueryBuilder<E> builder = new JpaQueryBuilder<>(cb, root);

        query.select(root);
        if (filter != null) {
            query.where(builder.apply(filter));
        }
        if (!sorts.isEmpty()) {
            query.orderBy(builder.applyAll(sorts));
        }

        TypedQuery<E> typedQuery = em.createQuery(query);
        if (offset != null) {
            typedQuery.setFirstResult(offset).setMaxResults(limit);
        }
        List<E> results = typedQuery.getResultList();

        long durationMs = (System.nanoTime() - startTime) / 1_000_000;
        logger.info(() -> String.format("Fetch query on %s completed in %dms: %d rows%s",
                entityClass.getSimpleName(), durationMs, results.size(),
                offset != null ? String.format(" (offset %d, limit %d)", offset, limit) : ""));
        return results;
    }

    /**
     * Counts the entities matching a filter.
     *
     * @param em          entity manager
     * @param entityClass entity to query
     * @param filter      filter tree, or {@code null} for all rows
     * @return number of matching rows
     */
    public static long count(EntityManager em, Class<?> entityClass, FilterNode filter) {
        Objects.requireNonNull(em, "EntityManager cannot be null");
        Objects.requireNonNull(entityClass, "Entity class cannot be null");
        long startTime = System.nanoTime();

        CriteriaBuilder cb = em.getCriteriaBuilder();
        CriteriaQuery<Long> countQuery = cb.createQuery(Long.class);
        Root<?> root = countQuery.from(entityClass);

        countQuery.select(cb.count(root));
        if (filter != null) {
            countQuery.where(new JpaQueryBuilder<>(cb, root).apply(filter));
        }

        Long count = em.createQuery(countQuery).getSingleResult();

        long durationMs = (System.nanoTime() - startTime) / 1_000_000;
        logger.info(() -> String.format("Count query on %s completed in %dms: %d matches",
                entityClass.getSimpleName(), durationMs, count));
        return count;
    }
}
