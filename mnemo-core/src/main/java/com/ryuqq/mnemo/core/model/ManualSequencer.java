package com.ryuqq.mnemo.core.model;

import java.util.Collection;

/**
 * 애플리케이션이 항상 식별자를 지정하는 타입의 sequencer.
 *
 * @author Mnemo Team
 * @since 1.0.0
 */
public final class ManualSequencer implements Sequencer {

    static final ManualSequencer INSTANCE = new ManualSequencer();

    private ManualSequencer() {
    }

    @Override
    public boolean validId(Identity identity) {
        return !identity.hasNulls();
    }

    @Override
    public void assign(Unit unit, Collection<Identity> existing) {
        throw new IllegalStateException(
            unit.type().name() + " uses manual identifiers; set " + unit.type().identifiers()
                + " before reserving the unit");
    }

    @Override
    public String toString() {
        return "ManualSequencer";
    }
}
