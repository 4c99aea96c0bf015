package com.ryuqq.mnemo.core.model;

/**
 * near unit 하나에서 도달할 수 있는 far unit 수.
 *
 * @author Mnemo Team
 * @since 1.0.0
 */
public enum Cardinality {

    /** At most one far unit (near key references a far identifier). */
    ONE,

    /** Any number of far units (far key references the near identifier). */
    MANY
}
