package io.github.cyfko.roaql.core.impl;

import io.github.cyfko.roaql.core.api.ColumnRef;
import io.github.cyfko.roaql.core.api.ModelSchema;
import io.github.cyfko.roaql.core.exception.DSLLexicalException;
import io.github.cyfko.roaql.core.exception.DSLSyntaxException;
import io.github.cyfko.roaql.core.exception.FilterValidationException;
import io.github.cyfko.roaql.core.model.*;
import org.junit.jupiter.api.*;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * Tests of the default query parser against an in-memory person model.
 * <p>
 * Covers the accepted grammar surface, the tree shapes produced for each operator, and the three
 * error families: syntax, lexical and validation errors.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
class BasicQueryParserTest {

    private static final ModelSchema PERSON = ModelSchema.of("person", Map.of(
            "id", Long.class,
            "name", String.class,
            "gender", String.class,
            "active", Boolean.class));

    private BasicQueryParser parser;

    @BeforeEach
    void setUp() {
        parser = new BasicQueryParser();
    }

    private static ColumnRef column(String name) {
        return PERSON.resolve(name);
    }

    @Nested
    @DisplayName("Valid Expressions")
    class ValidExpressions {

        @Test
        @DisplayName("Equality on a string column")
        void testEqString() {
            FilterNode node = parser.parseFilter("eq(name,\"John\")", PERSON);

            assertEquals(new Comparison(column("name"), ComparisonOp.EQ, "John"), node);
        }

        @ParameterizedTest(name = "{0}(id,1)")
        @CsvSource({"eq,EQ", "gt,GT", "ge,GE", "lt,LT", "le,LE", "like,LIKE"})
        @DisplayName("Every binary operator maps to its comparison")
        void testBinaryOperators(String token, ComparisonOp expected) {
            Comparison node = (Comparison) parser.parseFilter(token + "(id,1)", PERSON);

            assertEquals(expected, node.op());
            assertEquals(column("id"), node.column());
            assertEquals(1, node.value());
        }

        @Test
        @DisplayName("Membership test decodes a list value")
        void testIn() {
            Comparison node = (Comparison) parser.parseFilter("in(id,[1,2,3])", PERSON);

            assertEquals(ComparisonOp.IN, node.op());
            assertEquals(List.of(1, 2, 3), node.value());
        }

        @Test
        @DisplayName("JSON scalars: null, boolean, decimal, negative number")
        void testScalarLiterals() {
            assertNull(((Comparison) parser.parseFilter("eq(name,null)", PERSON)).value());
            assertEquals(true, ((Comparison) parser.parseFilter("eq(active,true)", PERSON)).value());
            assertEquals(2.5, ((Comparison) parser.parseFilter("gt(id,2.5)", PERSON)).value());
            assertEquals(-3, ((Comparison) parser.parseFilter("gt(id,-3)", PERSON)).value());
        }

        @Test
        @DisplayName("Quoted values keep their commas and parentheses")
        void testQuotedStructuralCharacters() {
            Comparison node = (Comparison) parser.parseFilter("eq(name,\"a,b(c)\")", PERSON);

            assertEquals("a,b(c)", node.value());
        }

        @Test
        @DisplayName("Whitespace around tokens is ignored")
        void testWhitespace() {
            FilterNode node = parser.parseFilter("  eq ( name , \"John Doe\" )  ", PERSON);

            assertEquals(new Comparison(column("name"), ComparisonOp.EQ, "John Doe"), node);
        }

        @Test
        @DisplayName("Column starting with an operator keyword is not split")
        void testColumnPrefixedByKeyword() {
            Comparison node = (Comparison) parser.parseFilter("eq(gender,\"F\")", PERSON);

            assertEquals("gender", node.column().name());
            assertEquals("F", node.value());
        }

        @Test
        @DisplayName("Column named like an operator keyword")
        void testColumnNamedLikeKeyword() {
            ModelSchema schema = ModelSchema.of("tag", Map.of("like", String.class));

            Comparison node = (Comparison) parser.parseFilter("like(like,\"%a%\")", schema);

            assertEquals(ComparisonOp.LIKE, node.op());
            assertEquals("like", node.column().name());
        }

        @Test
        @DisplayName("Compound keeps its children in textual order")
        void testAnd() {
            Compound node = (Compound) parser.parseFilter("and(gt(id,1),lt(id,5))", PERSON);

            assertEquals(CompoundKind.AND, node.kind());
            assertEquals(List.of(
                    new Comparison(column("id"), ComparisonOp.GT, 1),
                    new Comparison(column("id"), ComparisonOp.LT, 5)), node.children());
        }

        @Test
        @DisplayName("Compound accepts more than two children")
        void testOrWithThreeChildren() {
            Compound node = (Compound) parser.parseFilter(
                    "or(eq(id,1),eq(id,2),in(id,[3,4]))", PERSON);

            assertEquals(CompoundKind.OR, node.kind());
            assertEquals(3, node.children().size());
            assertEquals(ComparisonOp.IN, ((Comparison) node.children().get(2)).op());
        }

        @Test
        @DisplayName("Nested compounds")
        void testNestedCompounds() {
            Compound node = (Compound) parser.parseFilter(
                    "or(eq(name,\"a\"),and(gt(id,1),or(lt(id,5),eq(active,false))))", PERSON);

            Compound and = (Compound) node.children().get(1);
            Compound innerOr = (Compound) and.children().get(1);
            assertEquals(CompoundKind.AND, and.kind());
            assertEquals(CompoundKind.OR, innerOr.kind());
            assertEquals(false, ((Comparison) innerOr.children().get(1)).value());
        }

        @Test
        @DisplayName("Compound children may contain quoted commas and lists")
        void testCompoundChildrenWithCommas() {
            Compound node = (Compound) parser.parseFilter(
                    "and(eq(name,\"x,y\"),in(id,[1,2]))", PERSON);

            assertEquals("x,y", ((Comparison) node.children().get(0)).value());
            assertEquals(List.of(1, 2), ((Comparison) node.children().get(1)).value());
        }

        @ParameterizedTest
        @ValueSource(strings = {
                "eq(name,\"John\")",
                "in(id,[1,2,3])",
                "and(gt(id,1),lt(id,5))",
                "or(eq(active,true),and(ge(id,10),le(id,20)),eq(name,null))",
                "like(name,\"J%\")",
                "gt(id,1.0E300)",
                "lt(id,123456789012345678901234567890)"
        })
        @DisplayName("Canonical text parses back to an equal tree")
        void testRoundTrip(String expression) {
            FilterNode node = parser.parseFilter(expression, PERSON);

            assertEquals(expression, node.toExpression());
            assertEquals(node, parser.parseFilter(node.toExpression(), PERSON));
        }

        @Test
        @DisplayName("Every parse returns a new tree")
        void testIndependentResults() {
            FilterNode first = parser.parseFilter("eq(id,1)", PERSON);
            FilterNode second = parser.parseFilter("eq(id,1)", PERSON);

            assertEquals(first, second);
            assertNotSame(first, second);
        }
    }

    @Nested
    @DisplayName("Sort Expressions")
    class SortExpressions {

        @Test
        @DisplayName("Sort keys keep their order")
        void testSortOrder() {
            List<Sort> sorts = parser.parseSort(List.of("desc(id)", "asc(name)"), PERSON);

            assertEquals(List.of(
                    new Sort(column("id"), SortDirection.DESC),
                    new Sort(column("name"), SortDirection.ASC)), sorts);
        }

        @Test
        @DisplayName("Empty sort list gives an empty result")
        void testEmptySortList() {
            assertTrue(parser.parseSort(List.of(), PERSON).isEmpty());
        }

        @Test
        @DisplayName("Returned list is unmodifiable")
        void testUnmodifiable() {
            List<Sort> sorts = parser.parseSort(List.of("asc(id)"), PERSON);

            assertThrows(UnsupportedOperationException.class, () -> sorts.add(sorts.get(0)));
        }

        @Test
        @DisplayName("A filter is not a sort")
        void testFilterInSortList() {
            FilterValidationException ex = assertThrows(FilterValidationException.class,
                    () -> parser.parseSort(List.of("asc(id)", "eq(id,1)"), PERSON));

            assertEquals("Expression eq(id,1) is not a sort expression.", ex.getMessage());
        }

        @Test
        @DisplayName("A sort is not a filter")
        void testSortAsFilter() {
            FilterValidationException ex = assertThrows(FilterValidationException.class,
                    () -> parser.parseFilter("asc(name)", PERSON));

            assertEquals("Sort expression asc(name) cannot be used as a filter.", ex.getMessage());
        }

        @Test
        @DisplayName("Sort on unknown attribute")
        void testUnknownSortColumn() {
            FilterValidationException ex = assertThrows(FilterValidationException.class,
                    () -> parser.parseSort(List.of("asc(age)"), PERSON));

            assertEquals("Resource model person does not contain age attribute.", ex.getMessage());
        }

        @Test
        @DisplayName("Sort arity")
        void testSortArity() {
            assertEquals("Sort operation asc requires exactly one argument.",
                    assertThrows(FilterValidationException.class,
                            () -> parser.parseSort(List.of("asc(id,name)"), PERSON)).getMessage());
            assertEquals("Sort operation desc argument is empty.",
                    assertThrows(FilterValidationException.class,
                            () -> parser.parseSort(List.of("desc()"), PERSON)).getMessage());
        }

        @ParameterizedTest
        @ValueSource(strings = {"", "   "})
        @DisplayName("Blank sort entry")
        void testBlankSortEntry(String entry) {
            assertThrows(DSLSyntaxException.class, () -> parser.parseSort(List.of(entry), PERSON));
        }
    }

    @Nested
    @DisplayName("Validation Errors")
    class ValidationErrors {

        @ParameterizedTest(name = "{0}")
        @CsvSource(delimiter = '|', value = {
                "eq(name)|Binary operation eq requires two arguments.",
                "gt(id,1,2)|Binary operation gt requires two arguments.",
                "eq(,1)|Binary operation eq first argument is empty.",
                "le(id,)|Binary operation le second argument is empty.",
                "eq(unknown_attr,1)|Resource model person does not contain unknown_attr attribute.",
                "eq(name,John)|Binary operation eq value John is not a valid literal.",
                "eq(name,[1])|Binary operation eq requires a scalar value, got [1].",
                "in(id,1)|Membership operation in requires a non-empty sequence value, got 1.",
                "in(id,[])|Membership operation in requires a non-empty sequence value, got [].",
                "in(id,[[1]])|Membership operation in requires a sequence of scalar values, got [[1]].",
                "and(eq(id,1))|and operation takes at least two arguments.",
                "or()|or operation takes at least two arguments.",
                "and(eq(id,1),)|and operation argument 2 is empty.",
                "gt(id,1e400)|Binary operation gt value 1e400 is not a valid literal.",
                "lt(id,-1e400)|Binary operation lt value -1e400 is not a valid literal.",
                "in(id,[1,1e400])|Membership operation in value [1,1e400] is not a valid literal."
        })
        @DisplayName("Semantic errors carry a precise message")
        void testValidationMessages(String expression, String message) {
            FilterValidationException ex = assertThrows(FilterValidationException.class,
                    () -> parser.parseFilter(expression, PERSON));

            assertEquals(message, ex.getMessage());
        }

        @Test
        @DisplayName("Compound cannot combine sort expressions")
        void testSortInsideCompound() {
            FilterValidationException ex = assertThrows(FilterValidationException.class,
                    () -> parser.parseFilter("and(eq(id,1),asc(name))", PERSON));

            assertTrue(ex.getMessage().contains("cannot combine sort expression asc(name)"));
        }

        @Test
        @DisplayName("Errors inside nested children surface unchanged")
        void testNestedValidationError() {
            FilterValidationException ex = assertThrows(FilterValidationException.class,
                    () -> parser.parseFilter("or(eq(id,1),and(eq(id,2),eq(age,3)))", PERSON));

            assertEquals("Resource model person does not contain age attribute.", ex.getMessage());
        }
    }

    @Nested
    @DisplayName("Syntax Errors")
    class SyntaxErrors {

        @ParameterizedTest
        @ValueSource(strings = {"", "  ", "\t"})
        @DisplayName("Blank expression")
        void testBlank(String expression) {
            DSLSyntaxException ex = assertThrows(DSLSyntaxException.class,
                    () -> parser.parseFilter(expression, PERSON));

            assertEquals("Filter expression cannot be null or empty", ex.getMessage());
        }

        @Test
        @DisplayName("Null expression")
        void testNull() {
            assertThrows(DSLSyntaxException.class, () -> parser.parseFilter(null, PERSON));
        }

        @Test
        @DisplayName("Unknown operator reports its position")
        void testUnknownOperator() {
            DSLSyntaxException ex = assertThrows(DSLSyntaxException.class,
                    () -> parser.parseFilter("foo(id,1)", PERSON));

            assertTrue(ex.getMessage().startsWith("Unknown operator 'foo' at position 0"));
            assertEquals("foo", ex.getToken());
            assertEquals(0, ex.getPosition());
        }

        @Test
        @DisplayName("Operator keywords are case-sensitive")
        void testUpperCaseKeyword() {
            assertThrows(DSLSyntaxException.class, () -> parser.parseFilter("EQ(id,1)", PERSON));
        }

        @Test
        @DisplayName("Missing closing parenthesis")
        void testMissingClose() {
            DSLSyntaxException ex = assertThrows(DSLSyntaxException.class,
                    () -> parser.parseFilter("eq(id,1", PERSON));

            assertTrue(ex.getMessage().contains("Unexpected end of expression at position 7"));
            assertEquals(7, ex.getPosition());
        }

        @Test
        @DisplayName("Unbalanced compound")
        void testUnbalancedCompound() {
            DSLSyntaxException ex = assertThrows(DSLSyntaxException.class,
                    () -> parser.parseFilter("and(eq(id,1),eq(id,2)", PERSON));

            assertTrue(ex.getMessage().startsWith("Unbalanced parentheses"));
            assertEquals(3, ex.getPosition());
        }

        @ParameterizedTest
        @ValueSource(strings = {
                "eq(id,1))",
                "eq(id,1),eq(id,2)",
                "eq(id,1)x",
                "eq(eq(id,1),1)",
                "()",
                "eq id 1",
                "name"
        })
        @DisplayName("Malformed structure")
        void testMalformedStructure(String expression) {
            assertThrows(DSLSyntaxException.class, () -> parser.parseFilter(expression, PERSON));
        }

        @Test
        @DisplayName("Trailing token reports what was expected")
        void testTrailingToken() {
            DSLSyntaxException ex = assertThrows(DSLSyntaxException.class,
                    () -> parser.parseFilter("eq(id,1),eq(id,2)", PERSON));

            assertTrue(ex.getMessage().contains("Unexpected token ',' at position 8, expected end of expression"));
        }
    }

    @Nested
    @DisplayName("Lexical Errors")
    class LexicalErrors {

        @Test
        @DisplayName("Unterminated string")
        void testUnterminatedString() {
            DSLLexicalException ex = assertThrows(DSLLexicalException.class,
                    () -> parser.parseFilter("eq(name,\"John)", PERSON));

            assertEquals(8, ex.getPosition());
        }

        @Test
        @DisplayName("Unterminated list")
        void testUnterminatedList() {
            assertThrows(DSLLexicalException.class, () -> parser.parseFilter("in(id,[1,2)", PERSON));
        }

        @Test
        @DisplayName("Unterminated string inside a compound")
        void testUnterminatedInCompound() {
            assertThrows(DSLLexicalException.class,
                    () -> parser.parseFilter("and(eq(id,1),eq(name,\"x)", PERSON));
        }
    }

    @Nested
    @DisplayName("Model Schema Interaction")
    class ModelSchemaInteraction {

        @Mock
        private ModelSchema mockSchema;

        @BeforeEach
        void setUpSchema() {
            MockitoAnnotations.openMocks(this);
            when(mockSchema.modelName()).thenReturn("order");
            when(mockSchema.findColumn(anyString())).thenReturn(Optional.empty());
            when(mockSchema.findColumn("total")).thenReturn(Optional.of(new ColumnRef("total", Double.class)));
            when(mockSchema.resolve(anyString())).thenCallRealMethod();
        }

        @Test
        @DisplayName("Columns are resolved through the schema")
        void testResolvesThroughSchema() {
            Comparison node = (Comparison) parser.parseFilter("gt(total,10.5)", mockSchema);

            assertEquals(Double.class, node.column().javaType());
            verify(mockSchema, atLeastOnce()).findColumn("total");
        }

        @Test
        @DisplayName("Unknown column message uses the schema name")
        void testUnknownColumn() {
            FilterValidationException ex = assertThrows(FilterValidationException.class,
                    () -> parser.parseFilter("eq(status,\"open\")", mockSchema));

            assertEquals("Resource model order does not contain status attribute.", ex.getMessage());
        }

        @Test
        @DisplayName("Schema is not consulted for syntax errors")
        void testSyntaxErrorSkipsSchema() {
            assertThrows(DSLSyntaxException.class, () -> parser.parseFilter("eq(total,1", mockSchema));

            verify(mockSchema, never()).findColumn(anyString());
        }
    }

    @Nested
    @DisplayName("Construction")
    class Construction {

        @Test
        @DisplayName("Null collaborators are rejected")
        void testNullArguments() {
            assertThrows(IllegalArgumentException.class, () -> new BasicQueryParser(null));
            assertThrows(IllegalArgumentException.class,
                    () -> new BasicQueryParser(null, parser.getPolicy()));
        }

        @Test
        @DisplayName("Default parser uses the standard registry")
        void testDefaults() {
            assertSame(io.github.cyfko.roaql.core.spi.OperatorRegistry.standard(), parser.getRegistry());
            assertEquals("DEFAULT_POLICY", parser.getPolicy().policyName());
        }
    }
}
