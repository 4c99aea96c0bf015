package com.ryuqq.mnemo.core.model;

import com.ryuqq.mnemo.core.query.Relation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 영속 entity type의 런타임 메타데이터.
 *
 * <p>순서 있는 property 목록, 식별자 property (없을 수도 있음),
 * 식별자 {@link Sequencer}, path별 association, 선택적인 {@link UnitHooks}를 선언합니다.</p>
 *
 * <p><strong>동등성:</strong> 이름으로만 비교합니다. {@link #withProperty(Property)} 등으로
 * 스키마를 바꾼 사본도 같은 논리 타입이므로 같은 storage와 캐시 항목을 가리킵니다.</p>
 *
 * <p><strong>사용 예:</strong></p>
 * <pre>{@code
 * EntityType animal = EntityType.builder("Animal")
 *     .property("ID", Integer.class)
 *     .property("Species", String.class)
 *     .property(Property.of("Legs", Integer.class).withDefault(4))
 *     .identifiers("ID")
 *     .sequencer(Sequencer.integer())
 *     .associate(Association.toOne("ZooID", "Zoo", "ID"))
 *     .build();
 * }</pre>
 *
 * @author Mnemo Team
 * @since 1.0.0
 */
public final class EntityType implements Relation {

    private final String name;
    private final List<Property> properties;
    private final Map<String, Property> propertiesByName;
    private final List<String> identifiers;
    private final Sequencer sequencer;
    private final Map<String, Association> associations;
    private final UnitHooks hooks;

    private EntityType(
        String name,
        List<Property> properties,
        List<String> identifiers,
        Sequencer sequencer,
        Map<String, Association> associations,
        UnitHooks hooks
    ) {
        Map<String, Property> byName = new LinkedHashMap<>();
        for (Property property : properties) {
            if (byName.put(property.name(), property) != null) {
                throw new IllegalArgumentException(name + " declares property '" + property.name() + "' twice");
            }
        }
        for (String identifier : identifiers) {
            if (!byName.containsKey(identifier)) {
                throw new IllegalArgumentException(name + " has no property for identifier '" + identifier + "'");
            }
        }
        this.name = name;
        this.properties = Collections.unmodifiableList(new ArrayList<>(properties));
        this.propertiesByName = Collections.unmodifiableMap(byName);
        this.identifiers = Collections.unmodifiableList(new ArrayList<>(identifiers));
        this.sequencer = sequencer;
        this.associations = Collections.unmodifiableMap(new LinkedHashMap<>(associations));
        this.hooks = hooks;
    }

    /**
     * Starts declaring a type.
     *
     * @param name type name, unique per storage manager
     * @return new Builder
     * @throws IllegalArgumentException if name is null or blank
     */
    public static Builder builder(String name) {
        return new Builder(name);
    }

    /**
     * @return type name
     */
    public String name() {
        return name;
    }

    /**
     * @return properties in declared order
     */
    public List<Property> properties() {
        return properties;
    }

    /**
     * @return property names in declared order
     */
    public List<String> propertyNames() {
        return new ArrayList<>(propertiesByName.keySet());
    }

    /**
     * @param propertyName property name
     * @return true if declared
     */
    public boolean hasProperty(String propertyName) {
        return propertiesByName.containsKey(propertyName);
    }

    /**
     * @param propertyName property name
     * @return declared property
     * @throws IllegalArgumentException if not declared
     */
    public Property property(String propertyName) {
        Property property = propertiesByName.get(propertyName);
        if (property == null) {
            throw new IllegalArgumentException(name + " has no property '" + propertyName + "'");
        }
        return property;
    }

    /**
     * @return identifier property names, empty for identifier-less types
     */
    public List<String> identifiers() {
        return identifiers;
    }

    /**
     * @return true if this type declares at least one identifier
     */
    public boolean hasIdentifiers() {
        return !identifiers.isEmpty();
    }

    /**
     * @return identifier assignment strategy
     */
    public Sequencer sequencer() {
        return sequencer;
    }

    /**
     * @return associations keyed by path
     */
    public Map<String, Association> associations() {
        return associations;
    }

    /**
     * @param path association path
     * @return association reachable under the path
     */
    public Optional<Association> association(String path) {
        return Optional.ofNullable(associations.get(path));
    }

    /**
     * @return lifecycle hooks
     */
    public UnitHooks hooks() {
        return hooks;
    }

    /**
     * 선언된 기본값을 가진 unbound, clean unit 생성.
     *
     * @return new Unit
     */
    public Unit newUnit() {
        return new Unit(this);
    }

    /**
     * unbound unit을 만들고 주어진 값을 설정.
     *
     * @param values property name to value
     * @return new Unit, dirty if any value differs from its default
     * @throws IllegalArgumentException if a property is not declared
     */
    public Unit newUnit(Map<String, ?> values) {
        return new Unit(this).setAll(values);
    }

    /**
     * @param property property to add
     * @return evolved copy with the property appended
     */
    public EntityType withProperty(Property property) {
        List<Property> evolved = new ArrayList<>(properties);
        evolved.add(property);
        return new EntityType(name, evolved, identifiers, sequencer, associations, hooks);
    }

    /**
     * @param propertyName property to remove
     * @return evolved copy without the property
     * @throws IllegalArgumentException if the property is an identifier or not declared
     */
    public EntityType withoutProperty(String propertyName) {
        property(propertyName);
        if (identifiers.contains(propertyName)) {
            throw new IllegalArgumentException("Cannot remove identifier '" + propertyName + "' from " + name);
        }
        List<Property> evolved = new ArrayList<>();
        for (Property property : properties) {
            if (!property.name().equals(propertyName)) {
                evolved.add(property);
            }
        }
        return new EntityType(name, evolved, identifiers, sequencer, associations, hooks);
    }

    /**
     * @param oldName current property name
     * @param newName new property name
     * @return evolved copy with the property renamed in place
     * @throws IllegalArgumentException if oldName is not declared
     */
    public EntityType withRenamedProperty(String oldName, String newName) {
        property(oldName);
        List<Property> evolved = new ArrayList<>();
        for (Property property : properties) {
            evolved.add(property.name().equals(oldName) ? property.withName(newName) : property);
        }
        List<String> ids = new ArrayList<>();
        for (String identifier : identifiers) {
            ids.add(identifier.equals(oldName) ? newName : identifier);
        }
        return new EntityType(name, evolved, ids, sequencer, associations, hooks);
    }

    @Override
    public List<EntityType> types() {
        return List.of(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof EntityType)) {
            return false;
        }
        return name.equals(((EntityType) o).name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return name;
    }

    /**
     * Builder for {@link EntityType}.
     */
    public static final class Builder {

        private final String name;
        private final List<Property> properties = new ArrayList<>();
        private final Set<String> identifiers = new LinkedHashSet<>();
        private final Map<String, Association> associations = new LinkedHashMap<>();
        private Sequencer sequencer = Sequencer.manual();
        private UnitHooks hooks = UnitHooks.NONE;

        private Builder(String name) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("name cannot be null or blank");
            }
            this.name = name;
        }

        /**
         * @param propertyName property name
         * @param type value type
         * @return this builder
         */
        public Builder property(String propertyName, Class<?> type) {
            return property(Property.of(propertyName, type));
        }

        /**
         * @param property property declaration
         * @return this builder
         */
        public Builder property(Property property) {
            if (property == null) {
                throw new IllegalArgumentException("property cannot be null");
            }
            properties.add(property);
            return this;
        }

        /**
         * @param names identifier property names, in identity order
         * @return this builder
         */
        public Builder identifiers(String... names) {
            identifiers.clear();
            identifiers.addAll(List.of(names));
            return this;
        }

        /**
         * @param sequencer identifier strategy, defaults to manual
         * @return this builder
         */
        public Builder sequencer(Sequencer sequencer) {
            if (sequencer == null) {
                throw new IllegalArgumentException("sequencer cannot be null");
            }
            this.sequencer = sequencer;
            return this;
        }

        /**
         * @param association association to add under its path
         * @return this builder
         */
        public Builder associate(Association association) {
            if (association == null) {
                throw new IllegalArgumentException("association cannot be null");
            }
            associations.put(association.path(), association);
            return this;
        }

        /**
         * @param hooks lifecycle hooks
         * @return this builder
         */
        public Builder hooks(UnitHooks hooks) {
            if (hooks == null) {
                throw new IllegalArgumentException("hooks cannot be null");
            }
            this.hooks = hooks;
            return this;
        }

        /**
         * @return the declared type
         * @throws IllegalArgumentException if identifiers reference undeclared or duplicate properties
         */
        public EntityType build() {
            return new EntityType(name, properties, new ArrayList<>(identifiers), sequencer, associations, hooks);
        }
    }
}
