package com.ryuqq.mnemo.core.storage;

import com.ryuqq.mnemo.core.model.EntityType;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Registered entity types of one storage manager.
 *
 * <p>Keyed by type name: registering a schema-evolved copy replaces the earlier
 * declaration in place.</p>
 *
 * @author Mnemo Team
 * @since 1.0.0
 */
public final class TypeRegistry {

    private final Map<String, EntityType> types = new LinkedHashMap<>();

    /**
     * @param type type to add or replace
     * @throws IllegalArgumentException if type is null
     */
    public synchronized void register(EntityType type) {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        types.put(type.name(), type);
    }

    /**
     * @param type type to remove
     * @return true if it was registered
     */
    public synchronized boolean unregister(EntityType type) {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        return types.remove(type.name()) != null;
    }

    /**
     * @param type type to look up
     * @return true if registered
     */
    public synchronized boolean contains(EntityType type) {
        return type != null && types.containsKey(type.name());
    }

    /**
     * @return registered types in registration order
     */
    public synchronized Set<EntityType> snapshot() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(types.values()));
    }
}
