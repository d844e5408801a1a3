package io.github.cyfko.roaql.jpa;

import io.github.cyfko.roaql.core.api.QueryParser;
import io.github.cyfko.roaql.core.exception.FilterValidationException;
import io.github.cyfko.roaql.core.impl.BasicQueryParser;
import io.github.cyfko.roaql.core.model.FilterNode;
import io.github.cyfko.roaql.core.model.Sort;
import io.github.cyfko.roaql.jpa.entities.Person;
import io.github.cyfko.roaql.jpa.entities.Person.Status;
import jakarta.persistence.EntityManager;
import jakarta.persistence.EntityManagerFactory;
import jakarta.persistence.Persistence;
import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.CriteriaQuery;
import jakarta.persistence.criteria.Root;
import org.junit.jupiter.api.*;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.LocalDate;
import java.util.List;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests: expressions are parsed against the entity metamodel and run on H2.
 */
@DisplayName("JPA Query Builder Test")
class JpaQueryBuilderTest {

    private static EntityManagerFactory emf;
    private static JpaModelSchema schema;
    private static QueryParser parser;

    @BeforeAll
    static void setup() {
        emf = Persistence.createEntityManagerFactory("testPU");
        schema = JpaModelSchema.of(emf.getMetamodel(), Person.class);
        parser = new BasicQueryParser();

        EntityManager em = emf.createEntityManager();
        try {
            em.getTransaction().begin();
            Person carol = new Person("Carol", 45, false, "F", Status.SUSPENDED, LocalDate.of(1979, 11, 23));
            Person alice = new Person("Alice", 30, true, "F", Status.ACTIVE, LocalDate.of(1994, 5, 1));
            alice.setManager(carol);
            em.persist(carol);
            em.persist(alice);
            em.persist(new Person("Bob", 17, true, "M", Status.ACTIVE, LocalDate.of(2007, 2, 10)));
            em.persist(new Person("Dave", null, true, "M", Status.CLOSED, null));
            em.persist(new Person("Eve", 30, false, "F", Status.ACTIVE, LocalDate.of(1994, 8, 15)));
            em.getTransaction().commit();
        } finally {
            em.close();
        }
    }

    @AfterAll
    static void teardown() {
        if (emf != null) emf.close();
    }

    private static <T> T withEntityManager(Function<EntityManager, T> work) {
        EntityManager em = emf.createEntityManager();
        try {
            return work.apply(em);
        } finally {
            em.close();
        }
    }

    private static Set<String> names(String filterExpression) {
        FilterNode filter = parser.parseFilter(filterExpression, schema);
        List<Person> people = withEntityManager(em -> JpaResourceQuery.fetch(em, Person.class, filter, List.of()));
        return people.stream().map(Person::getName).collect(Collectors.toSet());
    }

    @Nested
    @DisplayName("Comparison operators")
    class Comparisons {

        @ParameterizedTest(name = "{0}")
        @CsvSource(delimiter = '|', value = {
                "eq(name,\"Alice\")|Alice",
                "gt(age,18)|Alice,Carol,Eve",
                "ge(age,30)|Alice,Carol,Eve",
                "lt(age,30)|Bob",
                "le(age,17)|Bob",
                "like(name,\"%e\")|Alice,Dave,Eve",
                "in(name,[\"Bob\",\"Eve\"])|Bob,Eve",
                "in(age,[30,45])|Alice,Carol,Eve",
                "eq(gender,\"F\")|Alice,Carol,Eve",
                "eq(active,true)|Alice,Bob,Dave"
        })
        @DisplayName("Operators select the expected rows")
        void testOperators(String expression, String expected) {
            assertEquals(Set.of(expected.split(",")), names(expression));
        }

        @Test
        @DisplayName("eq with null matches missing values")
        void testEqNull() {
            assertEquals(Set.of("Dave"), names("eq(age,null)"));
        }

        @Test
        @DisplayName("Enum attribute matches its constant name ignoring case")
        void testEnumConversion() {
            assertEquals(Set.of("Carol"), names("eq(status,\"suspended\")"));
            assertEquals(Set.of("Alice", "Bob", "Eve"), names("in(status,[\"ACTIVE\"])"));
        }

        @Test
        @DisplayName("ISO date strings are compared as dates")
        void testDateConversion() {
            assertEquals(Set.of("Alice", "Bob", "Eve"), names("gt(birthDate,\"1990-01-01\")"));
        }
    }

    @Nested
    @DisplayName("Compound operators")
    class Compounds {

        @Test
        void testAnd() {
            assertEquals(Set.of("Alice"), names("and(eq(active,true),ge(age,18))"));
        }

        @Test
        void testNestedOrAnd() {
            assertEquals(Set.of("Bob", "Carol"),
                    names("or(eq(name,\"Bob\"),and(eq(gender,\"F\"),gt(age,40)))"));
        }

        @Test
        void testThreeWayOr() {
            assertEquals(Set.of("Alice", "Bob", "Dave"),
                    names("or(eq(name,\"Alice\"),eq(name,\"Bob\"),eq(age,null))"));
        }
    }

    @Nested
    @DisplayName("Sorting and counting")
    class SortingAndCounting {

        @Test
        @DisplayName("Sort keys apply in order")
        void testSortOrder() {
            FilterNode filter = parser.parseFilter("ge(age,0)", schema);
            List<Sort> sorts = parser.parseSort(List.of("desc(age)", "asc(name)"), schema);

            List<Person> people = withEntityManager(em -> JpaResourceQuery.fetch(em, Person.class, filter, sorts));

            assertEquals(List.of("Carol", "Alice", "Eve", "Bob"),
                    people.stream().map(Person::getName).collect(Collectors.toList()));
        }

        @Test
        @DisplayName("Null filter returns every row")
        void testNullFilter() {
            List<Sort> sorts = parser.parseSort(List.of("asc(name)"), schema);

            List<Person> people = withEntityManager(em -> JpaResourceQuery.fetch(em, Person.class, null, sorts));

            assertEquals(List.of("Alice", "Bob", "Carol", "Dave", "Eve"),
                    people.stream().map(Person::getName).collect(Collectors.toList()));
        }

        @ParameterizedTest(name = "offset {0}, limit {1}")
        @CsvSource(delimiter = '|', value = {
                "0|2|Alice,Bob",
                "1|2|Bob,Carol",
                "3|10|Dave,Eve",
                "4|1|Eve",
                "5|3|''"
        })
        @DisplayName("Offset and limit select a window of the sorted rows")
        void testPagedFetch(int offset, int limit, String expected) {
            List<Sort> sorts = parser.parseSort(List.of("asc(name)"), schema);

            List<Person> people = withEntityManager(
                    em -> JpaResourceQuery.fetch(em, Person.class, null, sorts, offset, limit));

            List<String> expectedNames = expected.isEmpty() ? List.of() : List.of(expected.split(","));
            assertEquals(expectedNames, people.stream().map(Person::getName).collect(Collectors.toList()));
        }

        @Test
        @DisplayName("Window applies after the filter")
        void testPagedFetchWithFilter() {
            FilterNode filter = parser.parseFilter("eq(active,true)", schema);
            List<Sort> sorts = parser.parseSort(List.of("desc(name)"), schema);

            List<Person> people = withEntityManager(
                    em -> JpaResourceQuery.fetch(em, Person.class, filter, sorts, 1, 5));

            assertEquals(List.of("Bob", "Alice"), people.stream().map(Person::getName).collect(Collectors.toList()));
        }

        @Test
        @DisplayName("Invalid window bounds are rejected")
        void testPagedFetchBounds() {
            IllegalArgumentException negativeOffset = assertThrows(IllegalArgumentException.class,
                    () -> withEntityManager(em -> JpaResourceQuery.fetch(em, Person.class, null, List.of(), -1, 5)));
            assertEquals("Offset cannot be negative. Provided: -1", negativeOffset.getMessage());

            IllegalArgumentException zeroLimit = assertThrows(IllegalArgumentException.class,
                    () -> withEntityManager(em -> JpaResourceQuery.fetch(em, Person.class, null, List.of(), 0, 0)));
            assertEquals("Limit must be positive. Provided: 0", zeroLimit.getMessage());
        }

        @Test
        void testCount() {
            FilterNode filter = parser.parseFilter("eq(active,true)", schema);

            long active = withEntityManager(em -> JpaResourceQuery.count(em, Person.class, filter));
            long all = withEntityManager(em -> JpaResourceQuery.count(em, Person.class, null));

            assertEquals(3L, active);
            assertEquals(5L, all);
        }

        @Test
        @DisplayName("Builder can be used directly with a criteria query")
        void testDirectBuilderUse() {
            FilterNode filter = parser.parseFilter("lt(age,40)", schema);
            List<Sort> sorts = parser.parseSort(List.of("asc(birthDate)"), schema);

            List<String> names = withEntityManager(em -> {
                CriteriaBuilder cb = em.getCriteriaBuilder();
                CriteriaQuery<Person> query = cb.createQuery(Person.class);
                Root<Person> root = query.from(Person.class);
                JpaQueryBuilder<Person> builder = new JpaQueryBuilder<>(cb, root);

                query.select(root).where(builder.apply(filter)).orderBy(builder.applyAll(sorts));
                return em.createQuery(query).getResultList().stream()
                        .map(Person::getName)
                        .collect(Collectors.toList());
            });

            assertEquals(List.of("Alice", "Eve", "Bob"), names);
        }
    }

    @Nested
    @DisplayName("Translation errors")
    class TranslationErrors {

        private void assertRejected(String expression, String messagePart) {
            FilterNode filter = parser.parseFilter(expression, schema);

            FilterValidationException ex = assertThrows(FilterValidationException.class,
                    () -> withEntityManager(em -> JpaResourceQuery.fetch(em, Person.class, filter, List.of())));
            assertTrue(ex.getMessage().contains(messagePart), ex.getMessage());
        }

        @Test
        void testOrderingAgainstNull() {
            assertRejected("gt(age,null)", "Binary operation gt cannot compare attribute age with null.");
        }

        @Test
        void testLikeAgainstNull() {
            assertRejected("like(name,null)", "Binary operation like cannot compare attribute name with null.");
        }

        @Test
        void testValueOfWrongType() {
            assertRejected("eq(age,\"abc\")", "does not fit attribute age of type Integer");
        }

        @Test
        @DisplayName("Number too large for the attribute is rejected, not wrapped")
        void testValueOutOfIntegerRange() {
            assertRejected("gt(age,3000000000)",
                    "Binary operation gt value 3000000000 does not fit attribute age of type Integer.");
        }

        @Test
        @DisplayName("Fraction against an integral attribute is rejected, not truncated")
        void testFractionAgainstIntegerAttribute() {
            assertRejected("eq(age,17.9)", "Binary operation eq value 17.9 does not fit attribute age of type Integer.");
            assertRejected("in(age,[30,17.5])", "Membership operation in values [30, 17.5] do not fit attribute age");
        }

        @Test
        void testUnknownEnumConstant() {
            assertRejected("eq(status,\"deleted\")", "does not fit attribute status of type Status");
        }

        @Test
        void testNullInsideMembership() {
            assertRejected("in(name,[\"Bob\",null])", "Membership operation in cannot match attribute name against null.");
        }
    }
}
