package com.nayem.tenancy.store;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Stream;

/**
 * Uncommitted writes to one table, layered over its committed rows.
 */
final class StagedTable<T> {

    private final Map<UUID, T> committed;
    private final Function<T, UUID> idOf;
    private final Map<UUID, T> upserts = new LinkedHashMap<>();
    private final Set<UUID> deletes = new HashSet<>();

    StagedTable(Map<UUID, T> committed, Function<T, UUID> idOf) {
        this.committed = committed;
        this.idOf = idOf;
    }

    void put(T row) {
        UUID id = idOf.apply(row);
        deletes.remove(id);
        upserts.put(id, row);
    }

    void remove(UUID id) {
        upserts.remove(id);
        deletes.add(id);
    }

    Optional<T> get(UUID id) {
        if (deletes.contains(id)) {
            return Optional.empty();
        }
        T staged = upserts.get(id);
        return staged != null ? Optional.of(staged) : Optional.ofNullable(committed.get(id));
    }

    /**
     * Rows as they would look after commit.
     */
    Stream<T> rows() {
        Stream<T> untouched = committed.entrySet().stream()
                .filter(e -> !deletes.contains(e.getKey()) && !upserts.containsKey(e.getKey()))
                .map(Map.Entry::getValue);
        return Stream.concat(untouched, upserts.values().stream());
    }

    List<T> merged() {
        return rows().toList();
    }

    void applyTo(Map<UUID, T> target) {
        deletes.forEach(target::remove);
        target.putAll(upserts);
    }

    void clear() {
        upserts.clear();
        deletes.clear();
    }
}
