package io.github.cyfko.roaql.jpa;

import io.github.cyfko.roaql.core.api.ColumnRef;
import io.github.cyfko.roaql.core.api.ModelSchema;
import jakarta.persistence.metamodel.EntityType;
import jakarta.persistence.metamodel.Metamodel;
import jakarta.persistence.metamodel.SingularAttribute;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * {@link ModelSchema} backed by the JPA metamodel of one entity.
 * <p>
 * Every singular attribute of the entity (including inherited ones and the identifier) is exposed
 * under its attribute name. Collection attributes and associations to other entities are not
 * queryable through expressions and are left out.
 * </p>
 *
 * <pre>{@code
 * ModelSchema schema = JpaModelSchema.of(em.getMetamodel(), Person.class);
 * FilterNode filter = parser.parseFilter("gt(age,18)", schema);
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class JpaModelSchema implements ModelSchema {
    private static final Logger logger = Logger.getLogger(JpaModelSchema.class.getName());

    private final Class<?> entityClass;
    private final String modelName;
    private final Map<String, ColumnRef> columns;

    private JpaModelSchema(Class<?> entityClass, String modelName, Map<String, ColumnRef> columns) {
        this.entityClass = entityClass;
        this.modelName = modelName;
        this.columns = Collections.unmodifiableMap(columns);
    }

    /**
     * Reads the queryable attributes of an entity from the metamodel.
     *
     * @param metamodel   the persistence unit metamodel
     * @param entityClass a managed entity class
     * @return the schema
     * @throws IllegalArgumentException if the class is not a managed entity
     */
    public static JpaModelSchema of(Metamodel metamodel, Class<?> entityClass) {
        Objects.requireNonNull(metamodel, "Metamodel cannot be null");
        Objects.requireNonNull(entityClass, "Entity class cannot be null");

        EntityType<?> entityType = metamodel.entity(entityClass);
        Map<String, ColumnRef> columns = new LinkedHashMap<>();
        for (SingularAttribute<?, ?> attribute : entityType.getSingularAttributes()) {
            if (attribute.isAssociation()) {
                continue;
            }
            columns.put(attribute.getName(), new ColumnRef(attribute.getName(), attribute.getJavaType()));
        }

        logger.fine(() -> String.format("Schema of %s exposes attributes %s", entityType.getName(), columns.keySet()));
        return new JpaModelSchema(entityClass, entityType.getName(), columns);
    }

    /**
     * @return the entity class this schema describes
     */
    public Class<?> entityClass() {
        return entityClass;
    }

    @Override
    public String modelName() {
        return modelName;
    }

    @Override
    public Optional<ColumnRef> findColumn(String attributeName) {
        if (attributeName == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(columns.get(attributeName));
    }
}
