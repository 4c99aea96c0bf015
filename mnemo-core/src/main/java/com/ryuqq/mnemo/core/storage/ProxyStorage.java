package com.ryuqq.mnemo.core.storage;

import com.ryuqq.mnemo.core.expr.Expr;
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
 * 모든 호출을 {@code next} 저장소로 전달하는 독립 데코레이터.
 *
 * <p>호출을 가로채지 않고 그대로 전달하면서 {@link StorageLog}로 기록만 남깁니다.
 * 타입 등록은 proxy 자체의 registry에만 반영되며, next 저장소는 자신의
 * registry를 따로 유지합니다.</p>
 *
 * <p><strong>Database scope:</strong> {@code databaseScope}가 false이면
 * {@code createDatabase}와 {@code dropDatabase}는 이 proxy에서 멈춥니다.
 * 공유 데이터베이스 위에 둔 proxy가 데이터베이스를 생성하거나 삭제하지 못하게 할 때 사용합니다.</p>
 *
 * @author Mnemo Team
 * @since 1.0.0
 */
public class ProxyStorage implements StorageManager {

    protected final StorageManager next;
    protected final StorageLog storageLog;
    private final boolean databaseScope;
    private final TypeRegistry registry = new TypeRegistry();

    /**
     * 생성자. database DDL도 next 저장소로 전달합니다.
     *
     * @param next store to forward to
     */
    public ProxyStorage(StorageManager next) {
        this(next, true);
    }

    /**
     * @param next store to forward to
     * @param databaseScope true to forward createDatabase and dropDatabase
     * @throws IllegalArgumentException if next is null
     */
    public ProxyStorage(StorageManager next, boolean databaseScope) {
        if (next == null) {
            throw new IllegalArgumentException("next cannot be null");
        }
        this.next = next;
        this.databaseScope = databaseScope;
        this.storageLog = new StorageLog(getClass());
    }

    /**
     * @return the store this proxy forwards to
     */
    public StorageManager next() {
        return next;
    }

    /**
     * @return true if database DDL is forwarded
     */
    public boolean databaseScope() {
        return databaseScope;
    }

    /**
     * @param flags logging categories to emit at DEBUG
     */
    public void setLogFlags(Set<LogFlag> flags) {
        storageLog.setFlags(flags);
    }

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
        next.map(types, conflicts);
    }

    @Override
    public void shutdown(Conflicts conflicts) {
        next.shutdown(conflicts);
    }

    @Override
    public void createDatabase(Conflicts conflicts) {
        if (databaseScope) {
            storageLog.ddl("create database via", next);
            next.createDatabase(conflicts);
        }
    }

    @Override
    public boolean hasDatabase() {
        return next.hasDatabase();
    }

    @Override
    public void dropDatabase(Conflicts conflicts) {
        if (databaseScope) {
            storageLog.ddl("drop database via", next);
            next.dropDatabase(conflicts);
        }
    }

    @Override
    public void createStorage(EntityType type, Conflicts conflicts) {
        storageLog.ddl("create storage", type);
        next.createStorage(type, conflicts);
    }

    @Override
    public boolean hasStorage(EntityType type) {
        return next.hasStorage(type);
    }

    @Override
    public void dropStorage(EntityType type, Conflicts conflicts) {
        storageLog.ddl("drop storage", type);
        next.dropStorage(type, conflicts);
    }

    @Override
    public void addProperty(EntityType type, String name, Conflicts conflicts) {
        storageLog.ddl("add property", type.name() + "." + name);
        next.addProperty(type, name, conflicts);
    }

    @Override
    public boolean hasProperty(EntityType type, String name) {
        return next.hasProperty(type, name);
    }

    @Override
    public void dropProperty(EntityType type, String name, Conflicts conflicts) {
        storageLog.ddl("drop property", type.name() + "." + name);
        next.dropProperty(type, name, conflicts);
    }

    @Override
    public void renameProperty(EntityType type, String oldName, String newName, Conflicts conflicts) {
        storageLog.ddl("rename property", type.name() + "." + oldName + " to " + newName);
        next.renameProperty(type, oldName, newName, conflicts);
    }

    @Override
    public void addIndex(EntityType type, String name, Conflicts conflicts) {
        storageLog.ddl("add index", type.name() + "." + name);
        next.addIndex(type, name, conflicts);
    }

    @Override
    public boolean hasIndex(EntityType type, String name) {
        return next.hasIndex(type, name);
    }

    @Override
    public void dropIndex(EntityType type, String name, Conflicts conflicts) {
        storageLog.ddl("drop index", type.name() + "." + name);
        next.dropIndex(type, name, conflicts);
    }

    @Override
    public void reserve(Unit unit) {
        storageLog.reserve(unit);
        next.reserve(unit);
    }

    @Override
    public void save(Unit unit, boolean force) {
        storageLog.save(unit, force);
        next.save(unit, force);
    }

    @Override
    public void destroy(Unit unit) {
        storageLog.destroy(unit);
        next.destroy(unit);
    }

    @Override
    public Unit unit(EntityType type, Map<String, ?> filter) {
        return next.unit(type, filter);
    }

    @Override
    public Stream<Unit> xrecall(EntityType type, Expr restriction, Order order, Integer limit, Integer offset) {
        Paginator.validate(order, limit, offset);
        storageLog.recall(type, restriction);
        return next.xrecall(type, restriction, order, limit, offset);
    }

    @Override
    public Stream<List<Unit>> xmultirecall(Join join, Expr restriction, Order order, Integer limit, Integer offset) {
        Paginator.validate(order, limit, offset);
        storageLog.recall(join, restriction);
        return next.xmultirecall(join, restriction, order, limit, offset);
    }

    @Override
    public Stream<List<Object>> xview(Statement statement) {
        storageLog.view(statement);
        return next.xview(statement);
    }

    @Override
    public long count(EntityType type, Expr restriction) {
        return next.count(type, restriction);
    }

    @Override
    public List<Object> range(EntityType type, String attribute, Expr restriction) {
        return next.range(type, attribute, restriction);
    }

    @Override
    public Number sum(EntityType type, String attribute, Expr restriction) {
        return next.sum(type, attribute, restriction);
    }

    @Override
    public boolean supportsTransactions() {
        return next.supportsTransactions();
    }

    @Override
    public void start() {
        next.start();
    }

    @Override
    public void commit() {
        next.commit();
    }

    @Override
    public void rollback() {
        next.rollback();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(" + next + ")";
    }
}
