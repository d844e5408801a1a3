package io.github.cyfko.roaql.core.spi;

import io.github.cyfko.roaql.core.exception.OperatorDefinitionException;
import io.github.cyfko.roaql.core.impl.StandardOperators;

import java.util.*;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * Closed set of operators known to a parser.
 * <p>
 * A registry is assembled once through its {@link Builder} and is read-only afterwards: it has no
 * mutator, so any number of threads may resolve operators concurrently without synchronization.
 * Registration order is preserved and decides the order of the grammar table productions.
 * </p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>{@code
 * // Built-in operators: eq, gt, ge, lt, le, like, in, and, or, asc, desc
 * OperatorRegistry registry = OperatorRegistry.standard();
 *
 * // Built-in operators plus a custom one, assembled at application start
 * OperatorRegistry extended = OperatorRegistry.builder()
 *     .registerStandardOperators()
 *     .register(new NotEqualsOperator())
 *     .build();
 *
 * Optional<OperatorDescriptor> eq = registry.resolve("eq");
 * }</pre>
 *
 * <p>Configuration errors (duplicate or malformed tokens) raise an {@link OperatorDefinitionException}
 * during registration, never during parsing.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class OperatorRegistry {

    private static final Logger log = Logger.getLogger(OperatorRegistry.class.getName());

    private static final Pattern TOKEN_PATTERN = Pattern.compile("[a-z][a-z_]*");

    private final Map<String, OperatorDescriptor> descriptors;
    private final int maxTokenLength;

    private OperatorRegistry(Map<String, OperatorDescriptor> descriptors) {
        this.descriptors = Collections.unmodifiableMap(new LinkedHashMap<>(descriptors));
        this.maxTokenLength = descriptors.keySet().stream().mapToInt(String::length).max().orElse(0);
    }

    /**
     * Returns the shared registry holding the built-in operators.
     *
     * @return the standard registry
     */
    public static OperatorRegistry standard() {
        return StandardHolder.INSTANCE;
    }

    /**
     * @return a new, empty builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Looks an operator up by keyword. Keywords are case-sensitive.
     *
     * @param token the keyword
     * @return the descriptor, or empty if the keyword is not registered
     */
    public Optional<OperatorDescriptor> resolve(String token) {
        if (token == null) return Optional.empty();
        return Optional.ofNullable(descriptors.get(token));
    }

    /**
     * @param text candidate keyword
     * @return {@code true} if the text is a registered keyword
     */
    public boolean isOperator(String text) {
        return text != null && descriptors.containsKey(text);
    }

    /**
     * @return registered keywords in registration order
     */
    public Set<String> tokens() {
        return descriptors.keySet();
    }

    /**
     * @return registered descriptors in registration order
     */
    public Collection<OperatorDescriptor> descriptors() {
        return descriptors.values();
    }

    /**
     * Length of the longest registered keyword. The lexer treats longer words as free text.
     *
     * @return the maximum keyword length
     */
    public int maxTokenLength() {
        return maxTokenLength;
    }

    @Override
    public String toString() {
        return "OperatorRegistry" + descriptors.keySet();
    }

    /**
     * Assembles a registry. Builders are meant for single-threaded startup code.
     */
    public static final class Builder {
        private final Map<String, OperatorDescriptor> descriptors = new LinkedHashMap<>();

        private Builder() {}

        /**
         * Registers one operator.
         *
         * @param descriptor the operator
         * @return this builder
         * @throws OperatorDefinitionException if the keyword is malformed or already registered,
         *                                     or the arity bounds are inconsistent
         */
        public Builder register(OperatorDescriptor descriptor) {
            Objects.requireNonNull(descriptor, "Operator descriptor is required");
            String token = descriptor.token();

            if (token == null || !TOKEN_PATTERN.matcher(token).matches()) {
                throw new OperatorDefinitionException(
                        "Operator token [" + token + "] must be a lower-case identifier.");
            }
            if (descriptor.kind() == null || descriptor.grammarContribution() == null) {
                throw new OperatorDefinitionException("Operator [" + token + "] must declare its kind and grammar.");
            }
            if (descriptor.minArity() < 1 || descriptor.maxArity() < descriptor.minArity()) {
                throw new OperatorDefinitionException(String.format(
                        "Operator [%s] has invalid arity bounds [%d, %d].",
                        token, descriptor.minArity(), descriptor.maxArity()));
            }

            var previous = descriptors.putIfAbsent(token, descriptor);
            if (previous != null) {
                throw new OperatorDefinitionException("Operator [" + token + "] is already registered.");
            }
            return this;
        }

        /**
         * Registers the built-in operators in their canonical order.
         *
         * @return this builder
         */
        public Builder registerStandardOperators() {
            StandardOperators.all().forEach(this::register);
            return this;
        }

        /**
         * @return the read-only registry
         * @throws OperatorDefinitionException if no operator was registered
         */
        public OperatorRegistry build() {
            if (descriptors.isEmpty()) {
                throw new OperatorDefinitionException("An operator registry requires at least one operator.");
            }
            OperatorRegistry registry = new OperatorRegistry(descriptors);
            log.config(() -> "Operator registry built with operators " + registry.tokens());
            return registry;
        }
    }

    private static final class StandardHolder {
        private static final OperatorRegistry INSTANCE = builder().registerStandardOperators().build();
    }
}
