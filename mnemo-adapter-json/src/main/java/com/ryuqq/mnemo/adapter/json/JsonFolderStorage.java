package com.ryuqq.mnemo.adapter.json;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ryuqq.mnemo.core.expr.Expr;
import com.ryuqq.mnemo.core.model.EntityType;
import com.ryuqq.mnemo.core.model.Identity;
import com.ryuqq.mnemo.core.model.Property;
import com.ryuqq.mnemo.core.model.Unit;
import com.ryuqq.mnemo.core.query.Order;
import com.ryuqq.mnemo.core.spi.Conflicts;
import com.ryuqq.mnemo.core.storage.AbstractStorageManager;
import com.ryuqq.mnemo.core.storage.Paginator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Supplier;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * unit마다 JSON 파일 하나를 쓰는 StorageManager.
 *
 * <p><strong>Layout:</strong></p>
 * <pre>
 * root/
 *   Zoo/
 *     class.lock        (writer가 타입을 잡고 있는 동안만 존재)
 *     1.json
 *     2.json
 *   Exhibit/
 *     1_Aviary.json     (복합 식별자를 idSeparator로 연결)
 *   LogEntry/
 *     3f2a...-....json  (식별자 없음: 값에서 파일명 생성)
 * </pre>
 *
 * <p>식별자 atom은 URL 인코딩하므로 어떤 값이든 올바른 파일명이 됩니다. atom 안의 구분자 문자도
 * hex escape하므로 서로 다른 identity가 같은 파일을 쓰지 않습니다. 모든 atom이 빈 identity는
 * {@code __blank__.json}으로 저장합니다.</p>
 *
 * <p><strong>Locking:</strong> 타입 디렉토리의 모든 read-modify-write는 {@link Files#createFile}로
 * 원자적으로 만든 {@code class.lock}을 잡은 상태에서 실행됩니다. 경쟁자는
 * {@link JsonStorageConfig#lockPollInterval()}마다 재시도하고 {@link JsonStorageConfig#lockTimeout()}
 * 후 포기합니다. 같은 root를 공유하는 스레드와 프로세스 사이에서 모두 동작합니다.</p>
 *
 * <p>index와 트랜잭션은 지원하지 않습니다.</p>
 *
 * @author Mnemo Team
 * @since 1.0.0
 */
public class JsonFolderStorage extends AbstractStorageManager {

    private static final Logger log = LoggerFactory.getLogger(JsonFolderStorage.class);

    static final String LOCK_FILE = "class.lock";
    static final String EXTENSION = ".json";
    static final String BLANK = "__blank__";

    private final JsonStorageConfig config;
    private final JsonUnitCodec codec = new JsonUnitCodec();
    private final ObjectWriter writer;

    /**
     * @param config root directory and file settings
     * @throws IllegalArgumentException if config is null
     */
    public JsonFolderStorage(JsonStorageConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.config = config;
        this.writer = config.prettyPrint()
            ? codec.mapper().writerWithDefaultPrettyPrinter()
            : codec.mapper().writer();
    }

    /**
     * @return the configuration
     */
    public JsonStorageConfig config() {
        return config;
    }

    /**
     * @param type entity type
     * @return the directory holding the type's files
     */
    public Path shelf(EntityType type) {
        return config.root().resolve(type.name());
    }

    // ========================================
    // DML
    // ========================================

    /**
     * {@inheritDoc}
     *
     * <p>Missing identifiers are assigned from the identities encoded in the
     * existing file names, under the type's lock.</p>
     */
    @Override
    public void reserve(Unit unit) {
        if (unit == null) {
            throw new IllegalArgumentException("unit cannot be null");
        }
        EntityType type = unit.type();
        Path shelf = requireShelf(type);
        locked(type, () -> {
            if (type.hasIdentifiers() && !type.sequencer().validId(unit.identity())) {
                type.sequencer().assign(unit, identities(type, shelf));
            }
            push(shelf, unit);
            return null;
        });
        unit.cleanse();
        storageLog.reserve(unit);
    }

    @Override
    public void save(Unit unit, boolean force) {
        if (unit == null) {
            throw new IllegalArgumentException("unit cannot be null");
        }
        if (!force && !unit.isDirty()) {
            return;
        }
        Path shelf = requireShelf(unit.type());
        locked(unit.type(), () -> {
            push(shelf, unit);
            return null;
        });
        unit.cleanse();
        storageLog.save(unit, force);
    }

    @Override
    public void destroy(Unit unit) {
        if (unit == null) {
            throw new IllegalArgumentException("unit cannot be null");
        }
        Path shelf = requireShelf(unit.type());
        Path file = shelf.resolve(fileName(unit));
        locked(unit.type(), () -> {
            try {
                return Files.deleteIfExists(file);
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot delete " + file, e);
            }
        });
        storageLog.destroy(unit);
    }

    /**
     * {@inheritDoc}
     *
     * <p>Filters on exactly the identifiers read the one matching file.</p>
     */
    @Override
    public Unit unit(EntityType type, Map<String, ?> filter) {
        if (type.hasIdentifiers() && filter.keySet().equals(new HashSet<>(type.identifiers()))) {
            List<Object> ids = new ArrayList<>();
            for (String identifier : type.identifiers()) {
                ids.add(filter.get(identifier));
            }
            Path file = requireShelf(type).resolve(fileName(Identity.of(ids)));
            ObjectNode stored = locked(type, () -> Files.exists(file) ? pull(file) : null);
            return stored == null ? null : codec.decode(type, stored);
        }
        return super.unit(type, filter);
    }

    /**
     * {@inheritDoc}
     *
     * <p>Files are read under the lock, then decoded, filtered and paginated
     * without holding it.</p>
     */
    @Override
    public Stream<Unit> xrecall(EntityType type, Expr restriction, Order order, Integer limit, Integer offset) {
        Paginator.validate(order, limit, offset);
        storageLog.recall(type, restriction);
        if (Paginator.isEmptyLimit(limit)) {
            return Stream.empty();
        }
        Path shelf = requireShelf(type);
        List<ObjectNode> rows = locked(type, () -> pullAll(shelf));
        Stream<Unit> units = rows.stream()
            .map(row -> codec.decode(type, row))
            .filter(unit -> restriction == null || restriction.test(unit));
        return Paginator.units(units, order, limit, offset);
    }

    // ========================================
    // DDL
    // ========================================

    @Override
    public void createDatabase(Conflicts conflicts) {
        storageLog.ddl("create database", config.root());
        if (Files.isDirectory(config.root())) {
            if (!conflicts.repairing()) {
                conflicts.report(describe() + ": database " + config.root() + " already exists.");
            }
            return;
        }
        createDirectories(config.root());
    }

    @Override
    public boolean hasDatabase() {
        return Files.isDirectory(config.root());
    }

    @Override
    public void dropDatabase(Conflicts conflicts) {
        storageLog.ddl("drop database", config.root());
        if (!Files.isDirectory(config.root())) {
            conflicts.report(describe() + ": database " + config.root() + " not found.");
            return;
        }
        deleteTree(config.root());
    }

    /**
     * {@inheritDoc}
     *
     * <p>In REPAIR mode the files of an existing directory are rewritten with
     * exactly the declared properties, defaults filling the missing ones.</p>
     */
    @Override
    public void createStorage(EntityType type, Conflicts conflicts) {
        storageLog.ddl("create storage", type);
        Path shelf = shelf(type);
        if (!Files.isDirectory(shelf)) {
            createDirectories(shelf);
            return;
        }
        if (!conflicts.repairing()) {
            conflicts.report(describe() + ": storage for " + type.name() + " already exists.");
            return;
        }
        int repaired = locked(type, () -> {
            int count = 0;
            for (Path file : files(shelf)) {
                ObjectNode data = pull(file);
                ObjectNode reconciled = codec.mapper().createObjectNode();
                for (Property property : type.properties()) {
                    JsonNode field = data.get(property.name());
                    reconciled.set(property.name(),
                        field != null ? field : codec.mapper().valueToTree(property.defaultValue()));
                }
                write(file, reconciled);
                count++;
            }
            return count;
        });
        log.debug("Repaired {} files of {}", repaired, type.name());
    }

    @Override
    public boolean hasStorage(EntityType type) {
        return Files.isDirectory(shelf(type));
    }

    @Override
    public void dropStorage(EntityType type, Conflicts conflicts) {
        storageLog.ddl("drop storage", type);
        Path shelf = shelf(type);
        if (!Files.isDirectory(shelf)) {
            conflicts.report(describe() + ": no storage found for " + type.name() + ".");
            return;
        }
        deleteTree(shelf);
    }

    /**
     * {@inheritDoc}
     *
     * <p>Every file gets the property's default value.</p>
     */
    @Override
    public void addProperty(EntityType type, String name, Conflicts conflicts) {
        storageLog.ddl("add property " + name, type);
        Property property = type.property(name);
        String problem = rewrite(type, data -> {
            if (data.has(name)) {
                return type.name() + "." + name + " already exists.";
            }
            data.set(name, codec.mapper().valueToTree(property.defaultValue()));
            return null;
        });
        if (problem != null) {
            conflicts.report(describe() + ": " + problem);
        }
    }

    /**
     * {@inheritDoc}
     *
     * <p>Files carry no schema: the first file found decides. A type without
     * files has whatever properties it declares.</p>
     */
    @Override
    public boolean hasProperty(EntityType type, String name) {
        Path shelf = shelf(type);
        if (!Files.isDirectory(shelf)) {
            return false;
        }
        return locked(type, () -> {
            List<Path> files = files(shelf);
            return files.isEmpty() ? type.hasProperty(name) : pull(files.get(0)).has(name);
        });
    }

    @Override
    public void dropProperty(EntityType type, String name, Conflicts conflicts) {
        storageLog.ddl("drop property " + name, type);
        String problem = rewrite(type, data -> {
            if (data.remove(name) == null) {
                return type.name() + "." + name + " not found.";
            }
            return null;
        });
        if (problem != null) {
            conflicts.report(describe() + ": " + problem);
        }
    }

    @Override
    public void renameProperty(EntityType type, String oldName, String newName, Conflicts conflicts) {
        storageLog.ddl("rename property " + oldName + " to " + newName, type);
        String problem = rewrite(type, data -> {
            if (!data.has(oldName)) {
                return type.name() + "." + oldName + " not found.";
            }
            if (data.has(newName)) {
                return type.name() + "." + newName + " already exists.";
            }
            ObjectNode renamed = codec.mapper().createObjectNode();
            Iterator<Map.Entry<String, JsonNode>> fields = data.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                renamed.set(field.getKey().equals(oldName) ? newName : field.getKey(), field.getValue());
            }
            data.removeAll();
            data.setAll(renamed);
            return null;
        });
        if (problem != null) {
            conflicts.report(describe() + ": " + problem);
        }
    }

    @Override
    public void shutdown(Conflicts conflicts) {
        storageLog.ddl("shutdown", this);
    }

    // ========================================
    // Files
    // ========================================

    /**
     * @param unit unit to name
     * @return the file name of the unit within its type directory
     */
    String fileName(Unit unit) {
        if (!unit.type().hasIdentifiers()) {
            String json = codec.encode(unit).toString();
            return UUID.nameUUIDFromBytes(json.getBytes(StandardCharsets.UTF_8)) + EXTENSION;
        }
        return fileName(unit.identity());
    }

    private String fileName(Identity identity) {
        List<String> atoms = new ArrayList<>();
        for (Object value : identity.values()) {
            atoms.add(encodeAtom(value == null ? "" : String.valueOf(value)));
        }
        String joined = String.join(config.idSeparator(), atoms);
        return (joined.replace(config.idSeparator(), "").isEmpty() ? BLANK : joined) + EXTENSION;
    }

    /**
     * URL-encodes one identifier atom, then hex-escapes every separator
     * character left in it so the joined name splits back unambiguously.
     */
    String encodeAtom(String atom) {
        String separator = config.idSeparator();
        String encoded = URLEncoder.encode(atom, StandardCharsets.UTF_8);
        if (separator.indexOf('+') >= 0) {
            encoded = encoded.replace("+", "%20");
        }
        StringBuilder escaped = new StringBuilder(encoded.length());
        for (char c : encoded.toCharArray()) {
            if (c != '%' && separator.indexOf(c) >= 0) {
                escaped.append(String.format("%%%02X", (int) c));
            } else {
                escaped.append(c);
            }
        }
        return escaped.toString();
    }

    /**
     * Identities encoded in the file names of a type directory.
     */
    private List<Identity> identities(EntityType type, Path shelf) {
        List<Property> identifiers = type.identifiers().stream()
            .map(type::property)
            .collect(Collectors.toList());
        List<Identity> identities = new ArrayList<>();
        for (Path file : files(shelf)) {
            String name = file.getFileName().toString();
            String stem = name.substring(0, name.length() - EXTENSION.length());
            if (stem.equals(BLANK)) {
                continue;
            }
            String[] atoms = stem.split(Pattern.quote(config.idSeparator()), -1);
            if (atoms.length != identifiers.size()) {
                continue;
            }
            List<Object> values = new ArrayList<>();
            for (int i = 0; i < atoms.length; i++) {
                values.add(codec.fromText(URLDecoder.decode(atoms[i], StandardCharsets.UTF_8), identifiers.get(i)));
            }
            identities.add(Identity.of(values));
        }
        return identities;
    }

    private void push(Path shelf, Unit unit) {
        write(shelf.resolve(fileName(unit)), codec.encode(unit));
    }

    private void write(Path file, ObjectNode data) {
        try {
            writer.writeValue(file.toFile(), data);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write " + file, e);
        }
    }

    private ObjectNode pull(Path file) {
        try {
            return (ObjectNode) codec.mapper().readTree(file.toFile());
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + file, e);
        }
    }

    private List<ObjectNode> pullAll(Path shelf) {
        List<ObjectNode> rows = new ArrayList<>();
        for (Path file : files(shelf)) {
            rows.add(pull(file));
        }
        return rows;
    }

    /**
     * @return the unit files of a type directory, sorted by name
     */
    private List<Path> files(Path shelf) {
        try (Stream<Path> entries = Files.list(shelf)) {
            return entries
                .filter(path -> path.getFileName().toString().endsWith(EXTENSION))
                .sorted()
                .collect(Collectors.toList());
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot list " + shelf, e);
        }
    }

    /**
     * Applies an edit to every file of a type under its lock.
     *
     * @return the first problem an edit reported, or null
     */
    private String rewrite(EntityType type, FileEdit edit) {
        Path shelf = shelf(type);
        if (!Files.isDirectory(shelf)) {
            return "no storage found for " + type.name() + ".";
        }
        return locked(type, () -> {
            String problem = null;
            for (Path file : files(shelf)) {
                ObjectNode data = pull(file);
                String fileProblem = edit.apply(data);
                if (fileProblem == null) {
                    write(file, data);
                } else if (problem == null) {
                    problem = fileProblem;
                }
            }
            return problem;
        });
    }

    private Path requireShelf(EntityType type) {
        Path shelf = shelf(type);
        if (!Files.isDirectory(shelf)) {
            throw new IllegalStateException(describe() + " has no storage for " + type.name());
        }
        return shelf;
    }

    private static void createDirectories(Path directory) {
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create " + directory, e);
        }
    }

    private static void deleteTree(Path directory) {
        try (Stream<Path> walk = Files.walk(directory)) {
            for (Path path : walk.sorted(Comparator.reverseOrder()).collect(Collectors.toList())) {
                Files.deleteIfExists(path);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot delete " + directory, e);
        }
    }

    // ========================================
    // Locking
    // ========================================

    /**
     * Runs work while holding the type's {@code class.lock}.
     *
     * @throws IllegalStateException if the lock cannot be acquired in time, or
     *         the waiting thread is interrupted
     */
    <T> T locked(EntityType type, Supplier<T> work) {
        Path lock = shelf(type).resolve(LOCK_FILE);
        acquire(lock);
        try {
            return work.get();
        } finally {
            release(lock);
        }
    }

    private void acquire(Path lock) {
        long deadline = System.nanoTime() + config.lockTimeout().toNanos();
        while (true) {
            try {
                Files.createFile(lock);
                return;
            } catch (FileAlreadyExistsException e) {
                if (System.nanoTime() >= deadline) {
                    throw new IllegalStateException("Timed out after " + config.lockTimeout() + " waiting for " + lock, e);
                }
                log.trace("Waiting for {}", lock);
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot create " + lock, e);
            }
            try {
                Thread.sleep(config.lockPollInterval().toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Interrupted while waiting for " + lock, e);
            }
        }
    }

    private static void release(Path lock) {
        try {
            Files.delete(lock);
        } catch (NoSuchFileException e) {
            log.warn("Lock {} was already released", lock);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot release " + lock, e);
        }
    }

    private String describe() {
        return getClass().getSimpleName();
    }

    /**
     * Edit of one stored file; returns a problem description instead of editing.
     */
    @FunctionalInterface
    private interface FileEdit {
        String apply(ObjectNode data);
    }
}
