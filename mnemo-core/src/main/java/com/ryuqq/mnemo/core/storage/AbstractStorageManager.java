package com.ryuqq.mnemo.core.storage;

import com.ryuqq.mnemo.core.expr.Expr;
import com.ryuqq.mnemo.core.expr.Exprs;
import com.ryuqq.mnemo.core.model.EntityType;
import com.ryuqq.mnemo.core.model.Unit;
import com.ryuqq.mnemo.core.query.Join;
import com.ryuqq.mnemo.core.query.Order;
import com.ryuqq.mnemo.core.query.Statement;
import com.ryuqq.mnemo.core.spi.Conflicts;
import com.ryuqq.mnemo.core.spi.LogFlag;
import com.ryuqq.mnemo.core.spi.StorageManager;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;

/**
 * leaf 저장소의 기반 클래스.
 *
 * <p>하위 클래스는 unit 저장 ({@code reserve}, {@code save}, {@code destroy}, {@code xrecall})과
 * 지원하는 DDL을 구현합니다. 나머지는 메모리 기반 기본 구현을 사용합니다:</p>
 *
 * <ul>
 *   <li>{@code unit} - 동등 조건 {@code xrecall}의 첫 결과</li>
 *   <li>{@code xmultirecall} - {@link Joins#combine} 후 {@link Paginator}</li>
 *   <li>{@code xview}, {@code count}, {@code range}, {@code sum} - {@link Views}</li>
 *   <li>{@code map} - 타입별 storage 확인, REPAIR 모드에서는 생성</li>
 *   <li>DDL - conflict mode와 무관하게 {@link UnsupportedOperationException}</li>
 * </ul>
 *
 * @author Mnemo Team
 * @since 1.0.0
 */
public abstract class AbstractStorageManager implements StorageManager {

    protected final StorageLog storageLog;
    private final TypeRegistry registry = new TypeRegistry();

    protected AbstractStorageManager() {
        this.storageLog = new StorageLog(getClass());
    }

    /**
     * @param flags logging categories to emit at DEBUG
     */
    public void setLogFlags(Set<LogFlag> flags) {
        storageLog.setFlags(flags);
    }

    // ========================================
    // Registration
    // ========================================

    @Override
    public void register(EntityType type) {
        registry.register(type);
        storageLog.register(type);
    }

    @Override
    public void unregister(EntityType type) {
        registry.unregister(type);
    }

    @Override
    public Set<EntityType> classes() {
        return registry.snapshot();
    }

    @Override
    public boolean handles(EntityType type) {
        return registry.contains(type);
    }

    @Override
    public void map(Collection<EntityType> types, Conflicts conflicts) {
        for (EntityType type : types) {
            if (hasStorage(type)) {
                continue;
            }
            if (conflicts.repairing()) {
                storageLog.ddl("repair: create storage", type);
                createStorage(type, Conflicts.error());
            } else {
                conflicts.report(getClass().getSimpleName() + ": no storage found for " + type.name() + ".");
            }
        }
    }

    @Override
    public void shutdown(Conflicts conflicts) {
    }

    // ========================================
    // DDL (unsupported unless overridden)
    // ========================================

    @Override
    public void createDatabase(Conflicts conflicts) {
        throw unsupported("createDatabase");
    }

    @Override
    public boolean hasDatabase() {
        throw unsupported("hasDatabase");
    }

    @Override
    public void dropDatabase(Conflicts conflicts) {
        throw unsupported("dropDatabase");
    }

    @Override
    public void createStorage(EntityType type, Conflicts conflicts) {
        throw unsupported("createStorage");
    }

    @Override
    public boolean hasStorage(EntityType type) {
        throw unsupported("hasStorage");
    }

    @Override
    public void dropStorage(EntityType type, Conflicts conflicts) {
        throw unsupported("dropStorage");
    }

    @Override
    public void addProperty(EntityType type, String name, Conflicts conflicts) {
        throw unsupported("addProperty");
    }

    @Override
    public boolean hasProperty(EntityType type, String name) {
        throw unsupported("hasProperty");
    }

    @Override
    public void dropProperty(EntityType type, String name, Conflicts conflicts) {
        throw unsupported("dropProperty");
    }

    @Override
    public void renameProperty(EntityType type, String oldName, String newName, Conflicts conflicts) {
        throw unsupported("renameProperty");
    }

    @Override
    public void addIndex(EntityType type, String name, Conflicts conflicts) {
        throw unsupported("addIndex");
    }

    @Override
    public boolean hasIndex(EntityType type, String name) {
        throw unsupported("hasIndex");
    }

    @Override
    public void dropIndex(EntityType type, String name, Conflicts conflicts) {
        throw unsupported("dropIndex");
    }

    // ========================================
    // DML fallbacks
    // ========================================

    @Override
    public Unit unit(EntityType type, Map<String, ?> filter) {
        try (Stream<Unit> units = xrecall(type, Exprs.filter(filter), null, 1, null)) {
            return units.findFirst().orElse(null);
        }
    }

    @Override
    public Stream<List<Unit>> xmultirecall(Join join, Expr restriction, Order order, Integer limit, Integer offset) {
        Paginator.validate(order, limit, offset);
        storageLog.recall(join, restriction);
        if (Paginator.isEmptyLimit(limit)) {
            return Stream.empty();
        }
        Stream<List<Unit>> rows = Joins.combine(this, join).stream()
            .filter(row -> restriction == null || restriction.test(row));
        return Paginator.rows(rows, order, limit, offset);
    }

    @Override
    public Stream<List<Object>> xview(Statement statement) {
        storageLog.view(statement);
        return Views.view(this, statement);
    }

    @Override
    public long count(EntityType type, Expr restriction) {
        return Views.count(Views.of(this), type, restriction);
    }

    @Override
    public List<Object> range(EntityType type, String attribute, Expr restriction) {
        return Views.range(Views.of(this), type, attribute, restriction);
    }

    @Override
    public Number sum(EntityType type, String attribute, Expr restriction) {
        return Views.sum(Views.of(this), type, attribute, restriction);
    }

    /**
     * @param operation missing operation name
     * @return exception naming this class and the operation
     */
    protected UnsupportedOperationException unsupported(String operation) {
        return new UnsupportedOperationException(getClass().getSimpleName() + " has no " + operation + " method");
    }

    @Override
    public String toString() {
        return getClass().getSimpleName();
    }
}
