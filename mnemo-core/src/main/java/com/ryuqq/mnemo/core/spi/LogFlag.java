package com.ryuqq.mnemo.core.spi;

import java.util.EnumSet;
import java.util.Set;

/**
 * 저장소가 남길 수 있는 작업별 DEBUG 로그 분류.
 *
 * <p>저장소에서 해당 분류가 켜져 있고 저장소의 SLF4J logger가 DEBUG일 때만 메시지를 남깁니다.</p>
 *
 * @author Mnemo Team
 * @since 1.0.0
 */
public enum LogFlag {

    DDL,
    REGISTER,
    RESERVE,
    RECALL,
    VIEW,
    SAVE,
    DESTROY;

    /**
     * @return every storage category
     */
    public static Set<LogFlag> all() {
        return EnumSet.allOf(LogFlag.class);
    }

    /**
     * @return schema-level categories only
     */
    public static Set<LogFlag> schema() {
        return EnumSet.of(DDL, REGISTER);
    }

    /**
     * @return no category
     */
    public static Set<LogFlag> none() {
        return EnumSet.noneOf(LogFlag.class);
    }
}
