package com.ryuqq.mnemo.core.model;

import com.ryuqq.mnemo.core.sandbox.Sandbox;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * {@link EntityType}의 인스턴스. dirty 추적을 하는 property 묶음.
 *
 * <p><strong>생명주기:</strong></p>
 * <pre>
 * newUnit()  → unbound, clean, 선언된 기본값
 * set(...)   → 값이 실제로 바뀌면 dirty
 * memorize   → sandbox에 bind, 저장소에 reserve (식별자 할당)
 * save       → 저장, clean
 * forget / repress / flush → 다시 unbound (참조가 남아 있으면 "zombie")
 * </pre>
 *
 * <p><strong>Identity 규칙:</strong> unit은 참조 동등성을 사용합니다. 식별자 값이 같은
 * 두 unit은 다른 객체이며, sandbox가 identity당 살아 있는 객체를 최대 하나로 보장합니다.</p>
 *
 * <p><strong>Thread-safety:</strong> thread-safe하지 않습니다. unit은 sandbox 하나에,
 * sandbox는 하나의 실행 흐름에 속합니다.</p>
 *
 * @author Mnemo Team
 * @since 1.0.0
 */
public final class Unit {

    private final EntityType type;
    private final Map<String, Object> values;
    private boolean dirty;
    private Sandbox sandbox;

    Unit(EntityType type) {
        this.type = type;
        this.values = new LinkedHashMap<>();
        for (Property property : type.properties()) {
            values.put(property.name(), property.defaultValue());
        }
    }

    /**
     * @return the entity type of this unit
     */
    public EntityType type() {
        return type;
    }

    /**
     * Returns a property value.
     *
     * @param name declared property name
     * @return the value, possibly null
     * @throws IllegalArgumentException if the property is not declared
     */
    public Object get(String name) {
        requireDeclared(name);
        return values.get(name);
    }

    /**
     * Returns a property value cast to the expected type.
     *
     * @param name declared property name
     * @param as expected value type
     * @param <T> value type
     * @return the value, possibly null
     * @throws IllegalArgumentException if the property is not declared
     * @throws ClassCastException if the value is not an instance of {@code as}
     */
    public <T> T get(String name, Class<T> as) {
        return as.cast(get(name));
    }

    /**
     * Sets a property value, marking the unit dirty if the value changed.
     *
     * @param name declared property name
     * @param value new value, may be null
     * @return this unit
     * @throws IllegalArgumentException if the property is not declared or the
     *         value does not match the declared type
     */
    public Unit set(String name, Object value) {
        Property property = requireDeclared(name);
        if (!property.accepts(value)) {
            throw new IllegalArgumentException(
                type.name() + "." + name + " expects " + property.type().getSimpleName()
                    + " but got " + value.getClass().getSimpleName());
        }
        Object previous = values.put(name, value);
        if (!Objects.equals(previous, value)) {
            dirty = true;
        }
        return this;
    }

    /**
     * Sets several property values.
     *
     * @param changes property name to value
     * @return this unit
     * @throws IllegalArgumentException if any property is not declared
     */
    public Unit setAll(Map<String, ?> changes) {
        for (Map.Entry<String, ?> entry : changes.entrySet()) {
            set(entry.getKey(), entry.getValue());
        }
        return this;
    }

    /**
     * Overwrites the values of this unit with stored ones and cleanses it.
     *
     * <p>Used by codecs when materializing a unit. Keys that are not declared
     * are ignored; declared properties missing from the map keep their default.</p>
     *
     * @param stored stored property values
     * @return this unit
     */
    public Unit load(Map<String, ?> stored) {
        for (Property property : type.properties()) {
            if (stored.containsKey(property.name())) {
                set(property.name(), stored.get(property.name()));
            }
        }
        cleanse();
        return this;
    }

    /**
     * @return snapshot of all property values in declared order
     */
    public Map<String, Object> values() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    /**
     * @return the identifier values, empty for identifier-less types
     */
    public Identity identity() {
        List<String> identifiers = type.identifiers();
        if (identifiers.isEmpty()) {
            return Identity.empty();
        }
        List<Object> ids = new ArrayList<>(identifiers.size());
        for (String name : identifiers) {
            ids.add(values.get(name));
        }
        return Identity.of(ids);
    }

    /**
     * @return identifier name to value, in declared identifier order
     */
    public Map<String, Object> identityValues() {
        Map<String, Object> ids = new LinkedHashMap<>();
        for (String name : type.identifiers()) {
            ids.put(name, values.get(name));
        }
        return ids;
    }

    /**
     * @return true if a value changed since the last save or load
     */
    public boolean isDirty() {
        return dirty;
    }

    /**
     * Marks the current values as persisted.
     */
    public void cleanse() {
        dirty = false;
    }

    /**
     * Forces the unit to be treated as modified.
     */
    public void touch() {
        dirty = true;
    }

    /**
     * @return the sandbox this unit lives in, or null for a zombie
     */
    public Sandbox sandbox() {
        return sandbox;
    }

    /**
     * Binds or unbinds this unit. Called by sandboxes only.
     *
     * @param sandbox new owner, or null to unbind
     */
    public void bindTo(Sandbox sandbox) {
        this.sandbox = sandbox;
    }

    /**
     * @return true if the unit is not bound to any sandbox
     */
    public boolean isZombie() {
        return sandbox == null;
    }

    /**
     * Removes this unit from its sandbox and destroys it in storage.
     *
     * @throws IllegalStateException if the unit is not bound to a sandbox
     */
    public void forget() {
        requireSandbox("forget").forget(this);
    }

    /**
     * Saves this unit and evicts it from its sandbox.
     *
     * @throws IllegalStateException if the unit is not bound to a sandbox
     */
    public void repress() {
        requireSandbox("repress").repress(this);
    }

    private Sandbox requireSandbox(String operation) {
        if (sandbox == null) {
            throw new IllegalStateException("Cannot " + operation + " " + this + ": unit is not in a sandbox");
        }
        return sandbox;
    }

    private Property requireDeclared(String name) {
        if (!type.hasProperty(name)) {
            throw new IllegalArgumentException(type.name() + " has no property '" + name + "'");
        }
        return type.property(name);
    }

    @Override
    public String toString() {
        if (type.hasIdentifiers()) {
            return type.name() + identityValues();
        }
        return type.name() + values;
    }
}
