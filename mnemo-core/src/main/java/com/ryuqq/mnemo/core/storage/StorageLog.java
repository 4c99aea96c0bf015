package com.ryuqq.mnemo.core.storage;

import com.ryuqq.mnemo.core.expr.Expr;
import com.ryuqq.mnemo.core.model.EntityType;
import com.ryuqq.mnemo.core.model.Unit;
import com.ryuqq.mnemo.core.query.Relation;
import com.ryuqq.mnemo.core.query.Statement;
import com.ryuqq.mnemo.core.spi.LogFlag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumSet;
import java.util.Set;

/**
 * Per-operation DEBUG logging of a storage manager, gated by {@link LogFlag}s.
 *
 * <p>Each manager owns one instance bound to its own SLF4J logger, so output can
 * be tuned per class through the logging backend as well as per category here.</p>
 *
 * @author Mnemo Team
 * @since 1.0.0
 */
public final class StorageLog {

    private final Logger logger;
    private final String owner;
    private volatile EnumSet<LogFlag> flags = EnumSet.of(LogFlag.DDL, LogFlag.REGISTER);

    /**
     * @param ownerType class of the owning manager
     */
    public StorageLog(Class<?> ownerType) {
        this.logger = LoggerFactory.getLogger(ownerType);
        this.owner = ownerType.getSimpleName();
    }

    /**
     * @param newFlags categories to emit
     */
    public void setFlags(Set<LogFlag> newFlags) {
        if (newFlags == null) {
            throw new IllegalArgumentException("flags cannot be null");
        }
        EnumSet<LogFlag> copy = EnumSet.noneOf(LogFlag.class);
        copy.addAll(newFlags);
        this.flags = copy;
    }

    /**
     * @return enabled categories
     */
    public Set<LogFlag> flags() {
        return EnumSet.copyOf(flags);
    }

    /**
     * @param flag category
     * @return true if messages of the category are emitted
     */
    public boolean enabled(LogFlag flag) {
        return flags.contains(flag) && logger.isDebugEnabled();
    }

    public void ddl(String action, Object subject) {
        if (enabled(LogFlag.DDL)) {
            logger.debug("[{}] {} {}", owner, action, subject);
        }
    }

    public void register(EntityType type) {
        if (enabled(LogFlag.REGISTER)) {
            logger.debug("[{}] register {}", owner, type);
        }
    }

    public void reserve(Unit unit) {
        if (enabled(LogFlag.RESERVE)) {
            logger.debug("[{}] reserve {}", owner, unit);
        }
    }

    public void recall(Relation relation, Expr restriction) {
        if (enabled(LogFlag.RECALL)) {
            logger.debug("[{}] recall {} where {}", owner, relation, restriction);
        }
    }

    public void view(Statement statement) {
        if (enabled(LogFlag.VIEW)) {
            logger.debug("[{}] view {}", owner, statement);
        }
    }

    public void save(Unit unit, boolean force) {
        if (enabled(LogFlag.SAVE)) {
            logger.debug("[{}] save {}{}", owner, unit, force ? " (forced)" : "");
        }
    }

    public void destroy(Unit unit) {
        if (enabled(LogFlag.DESTROY)) {
            logger.debug("[{}] destroy {}", owner, unit);
        }
    }
}
