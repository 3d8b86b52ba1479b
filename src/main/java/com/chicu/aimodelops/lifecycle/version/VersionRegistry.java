package com.chicu.aimodelops.lifecycle.version;

import com.chicu.aimodelops.common.enums.ModelStatus;
import com.chicu.aimodelops.lifecycle.model.ModelVersion;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Неизменяемый снимок известных версий. Подменяется целиком через AtomicReference,
 * поэтому читатель никогда не видит "две активные" или "ни одной" посреди promote.
 */
final class VersionRegistry {

    private static final VersionRegistry EMPTY = new VersionRegistry(new TreeMap<>());

    private final NavigableMap<String, ModelVersion> versions;
    private final ModelVersion active;

    private VersionRegistry(NavigableMap<String, ModelVersion> versions) {
        this.versions = Collections.unmodifiableNavigableMap(versions);

        ModelVersion found = null;
        for (ModelVersion v : versions.values()) {
            if (v.status() == ModelStatus.ACTIVE) {
                if (found != null) {
                    throw new IllegalStateException("two active versions: " + found.id() + " and " + v.id());
                }
                found = v;
            }
        }
        this.active = found;
    }

    static VersionRegistry empty() {
        return EMPTY;
    }

    static VersionRegistry of(Collection<ModelVersion> all) {
        TreeMap<String, ModelVersion> map = new TreeMap<>();
        for (ModelVersion v : all) {
            map.put(v.id(), v);
        }
        return new VersionRegistry(map);
    }

    VersionRegistry put(ModelVersion... updates) {
        TreeMap<String, ModelVersion> map = new TreeMap<>(versions);
        for (ModelVersion v : updates) {
            if (v != null) map.put(v.id(), v);
        }
        return new VersionRegistry(map);
    }

    VersionRegistry remove(Collection<String> ids) {
        if (ids.isEmpty()) return this;
        TreeMap<String, ModelVersion> map = new TreeMap<>(versions);
        ids.forEach(map::remove);
        return new VersionRegistry(map);
    }

    ModelVersion active() {
        return active;
    }

    Optional<ModelVersion> find(String id) {
        return Optional.ofNullable(id != null ? versions.get(id) : null);
    }

    /**
     * По возрастанию id (= по времени создания).
     */
    List<ModelVersion> all() {
        return List.copyOf(versions.values());
    }

    /**
     * Самая свежая RETIRED — цель одношагового отката.
     */
    Optional<ModelVersion> latestRetired() {
        for (ModelVersion v : versions.descendingMap().values()) {
            if (v.status() == ModelStatus.RETIRED) return Optional.of(v);
        }
        return Optional.empty();
    }
}
