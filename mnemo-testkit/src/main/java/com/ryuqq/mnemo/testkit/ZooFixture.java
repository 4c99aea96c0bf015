package com.ryuqq.mnemo.testkit;

import com.ryuqq.mnemo.core.model.Association;
import com.ryuqq.mnemo.core.model.EntityType;
import com.ryuqq.mnemo.core.model.Property;
import com.ryuqq.mnemo.core.model.Sequencer;
import com.ryuqq.mnemo.core.model.Unit;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * contract test가 공유하는 entity type과 샘플 unit.
 *
 * <p><strong>타입:</strong></p>
 * <ul>
 *   <li>{@link #ZOO} - 정수 식별자, 날짜와 decimal, Animal로 one-to-many</li>
 *   <li>{@link #ANIMAL} - 정수 식별자, 기본값 property, Zoo로 many-to-one (path "Home")</li>
 *   <li>{@link #EXHIBIT} - 수동 복합 식별자 (ZooID, Name)</li>
 *   <li>{@link #LOG_ENTRY} - 식별자 없음</li>
 * </ul>
 *
 * @author Mnemo Team
 * @since 1.0.0
 */
public final class ZooFixture {

    public static final EntityType ZOO = EntityType.builder("Zoo")
        .property("ID", Integer.class)
        .property(Property.of("Name", String.class).withMaxBytes(100))
        .property("Founded", LocalDate.class)
        .property(Property.of("Admission", BigDecimal.class).withPrecision(4, 2))
        .property("LastEscape", LocalDateTime.class)
        .identifiers("ID")
        .sequencer(Sequencer.integer())
        .associate(Association.toMany("ID", "Animal", "ZooID"))
        .build();

    public static final EntityType ANIMAL = EntityType.builder("Animal")
        .property("ID", Integer.class)
        .property("Species", String.class)
        .property("ZooID", Integer.class)
        .property(Property.of("Legs", Integer.class).withDefault(4))
        .property("Lifespan", Double.class)
        .identifiers("ID")
        .sequencer(Sequencer.integer())
        .associate(Association.toOne("ZooID", "Zoo", "ID").named("Home"))
        .build();

    public static final EntityType EXHIBIT = EntityType.builder("Exhibit")
        .property("ZooID", Integer.class)
        .property("Name", String.class)
        .property("Acreage", Double.class)
        .identifiers("ZooID", "Name")
        .build();

    public static final EntityType LOG_ENTRY = EntityType.builder("LogEntry")
        .property("Message", String.class)
        .property("Level", Integer.class)
        .build();

    private ZooFixture() {
    }

    /**
     * @return every fixture type, in dependency order
     */
    public static List<EntityType> types() {
        return List.of(ZOO, ANIMAL, EXHIBIT, LOG_ENTRY);
    }

    /**
     * @param name zoo name
     * @param founded founding date
     * @param admission ticket price
     * @return new unit without identifier
     */
    public static Unit zoo(String name, LocalDate founded, BigDecimal admission) {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("Name", name);
        values.put("Founded", founded);
        values.put("Admission", admission);
        return ZOO.newUnit(values);
    }

    /**
     * @param species species name
     * @param zooId owning zoo, may be null
     * @param legs number of legs
     * @param lifespan expected lifespan in years, may be null
     * @return new unit without identifier
     */
    public static Unit animal(String species, Integer zooId, int legs, Double lifespan) {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("Species", species);
        values.put("ZooID", zooId);
        values.put("Legs", legs);
        values.put("Lifespan", lifespan);
        return ANIMAL.newUnit(values);
    }

    /**
     * @param zooId owning zoo
     * @param name exhibit name
     * @param acreage area
     * @return new unit with its full composite identifier
     */
    public static Unit exhibit(int zooId, String name, double acreage) {
        return EXHIBIT.newUnit(Map.of("ZooID", zooId, "Name", name, "Acreage", acreage));
    }

    /**
     * @param message log text
     * @param level severity
     * @return new identifier-less unit
     */
    public static Unit logEntry(String message, int level) {
        return LOG_ENTRY.newUnit(Map.of("Message", message, "Level", level));
    }
}
