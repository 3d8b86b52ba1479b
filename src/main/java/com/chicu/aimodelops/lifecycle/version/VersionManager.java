package com.chicu.aimodelops.lifecycle.version;

import com.chicu.aimodelops.common.enums.ModelStatus;
import com.chicu.aimodelops.common.util.AttemptIds;
import com.chicu.aimodelops.config.LifecycleProperties;
import com.chicu.aimodelops.lifecycle.exception.VersionNotFoundException;
import com.chicu.aimodelops.lifecycle.model.LifecycleStatus;
import com.chicu.aimodelops.lifecycle.model.ModelVersion;
import com.chicu.aimodelops.lifecycle.port.ArtifactStore;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Владелец указателя "current" и жизненного цикла версий (retire / prune).
 *
 * Пишущие операции сериализованы (synchronized), чтение — без блокировок
 * через неизменяемый {@link VersionRegistry}.
 */
@Slf4j
@Service
public class VersionManager {

    private final ArtifactStore store;
    private final LifecycleStatus status;
    private final LifecycleProperties props;
    private final Clock clock;

    private final AtomicReference<VersionRegistry> registry = new AtomicReference<>(VersionRegistry.empty());
    private final AtomicLong versionCounter = new AtomicLong();

    public VersionManager(ArtifactStore store, LifecycleStatus status, LifecycleProperties props, Clock clock) {
        this.store = store;
        this.status = status;
        this.props = props;
        this.clock = clock;
    }

    // ==============================================================
    // 🔄 RECOVERY
    // ==============================================================

    /**
     * Поднимает реестр из metadata.json + CURRENT.
     * CURRENT главнее статусов в метаданных (после падения посреди promote они могут разойтись).
     */
    @PostConstruct
    public synchronized void recover() {
        try {
            store.clearStaging();
        } catch (RuntimeException e) {
            log.warn("⚠️ staging cleanup failed: {}", e.getMessage());
        }

        String currentId = store.readCurrent().orElse(null);
        List<ModelVersion> restored = new ArrayList<>();
        long maxNumber = 0;

        for (ModelVersion v : store.loadMetadata()) {
            maxNumber = Math.max(maxNumber, AttemptIds.versionNumber(v.id()));

            if (!store.exists(v.artifactRef())) {
                log.warn("⚠️ version {} has metadata but no artifact ({}), skipped", v.id(), v.artifactRef());
                continue;
            }

            ModelVersion fixed = normalize(v, currentId);
            if (fixed != v) {
                log.warn("⚠️ version {} status {} -> {} (CURRENT={})", v.id(), v.status(), fixed.status(), currentId);
                store.saveMetadata(fixed);
            }
            restored.add(fixed);
        }

        for (String ref : store.list()) {
            String id = ref.substring(ref.lastIndexOf('/') + 1);
            maxNumber = Math.max(maxNumber, AttemptIds.versionNumber(id));
        }

        VersionRegistry r = VersionRegistry.of(restored);
        registry.set(r);
        versionCounter.set(maxNumber);
        status.setCurrentVersionId(r.active() != null ? r.active().id() : null);

        log.info("🗂 VersionManager recovered: versions={} active={} lastNumber={}",
                restored.size(), r.active() != null ? r.active().id() : "none", maxNumber);
    }

    private static ModelVersion normalize(ModelVersion v, String currentId) {
        if (v.id().equals(currentId)) {
            return v.status() == ModelStatus.ACTIVE ? v : v.withStatus(ModelStatus.ACTIVE);
        }
        if (v.status() == ModelStatus.ACTIVE) return v.withStatus(ModelStatus.RETIRED);
        if (v.status() == ModelStatus.CANDIDATE) return v.withStatus(ModelStatus.FAILED);
        return v;
    }

    // ==============================================================
    // READ (serving path)
    // ==============================================================

    public Optional<ModelVersion> current() {
        return Optional.ofNullable(registry.get().active());
    }

    public List<ModelVersion> versions() {
        return registry.get().all();
    }

    public Optional<ModelVersion> find(String versionId) {
        return registry.get().find(versionId);
    }

    public String nextVersionId() {
        return AttemptIds.versionId(versionCounter.incrementAndGet());
    }

    // ==============================================================
    // 🚀 PROMOTE
    // ==============================================================

    /**
     * Кандидат → новый версионный путь → атомарная смена CURRENT → прежняя активная RETIRED → prune.
     * Исключение на любом шаге до смены реестра оставляет реестр прежним;
     * вызывающий обязан сделать {@link #restore(ModelVersion, ModelVersion)}.
     */
    public synchronized ModelVersion promote(ModelVersion candidate) {
        if (candidate == null || candidate.status() != ModelStatus.CANDIDATE) {
            throw new IllegalArgumentException("promote expects a CANDIDATE, got " + candidate);
        }

        VersionRegistry before = registry.get();
        ModelVersion previous = before.active();

        String ref = store.copy(candidate.artifactRef(), candidate.id());
        ModelVersion promoted = candidate.withArtifactRef(ref).withStatus(ModelStatus.ACTIVE);

        store.saveMetadata(promoted);
        store.swapCurrent(promoted.id());

        ModelVersion retired = null;
        if (previous != null) {
            retired = previous.withStatus(ModelStatus.RETIRED);
            store.saveMetadata(retired);
        }

        registry.set(before.put(promoted, retired));
        status.setCurrentVersionId(promoted.id());

        log.info("🚀 PROMOTED {} (previous={}) metrics={}",
                promoted.id(), previous != null ? previous.id() : "none", promoted.metrics());

        discardQuietly(candidate.artifactRef());

        try {
            prune();
        } catch (RuntimeException e) {
            // promote уже состоялся, prune повторится на следующем promote
            log.warn("⚠️ prune after promote {} failed: {}", promoted.id(), e.getMessage());
        }

        return promoted;
    }

    /**
     * Вернуть указатель на previous после неудачного promote.
     * Бросает {@link com.chicu.aimodelops.lifecycle.exception.ArtifactStoreException}, если хранилище недоступно.
     */
    public synchronized void restore(ModelVersion previous, ModelVersion failedCandidate) {
        VersionRegistry r = registry.get();

        if (previous != null) {
            store.saveMetadata(previous);
            store.swapCurrent(previous.id());
        } else {
            store.clearCurrent();
        }

        List<String> drop = new ArrayList<>();
        if (failedCandidate != null) {
            discardQuietly(failedCandidate.artifactRef());
            discardQuietly(versionedRef(failedCandidate.id()));
            drop.add(failedCandidate.id());
        }

        VersionRegistry restored = r.remove(drop);
        if (previous != null) {
            restored = restored.put(previous);
        }
        registry.set(restored);
        status.setCurrentVersionId(previous != null ? previous.id() : null);

        log.warn("↩️ RESTORED current={} after failed promote of {}",
                previous != null ? previous.id() : "none",
                failedCandidate != null ? failedCandidate.id() : "?");
    }

    // ==============================================================
    // ↩️ ROLLBACK
    // ==============================================================

    /**
     * targetId == null — шаг назад к последней RETIRED; текущая помечается FAILED,
     * чтобы повторный откат не вернул её обратно.
     * Явная цель — текущая становится RETIRED.
     */
    public synchronized ModelVersion rollback(String targetId) {
        VersionRegistry r = registry.get();
        ModelVersion current = r.active();

        ModelVersion target;
        if (targetId == null || targetId.isBlank()) {
            target = r.latestRetired()
                    .orElseThrow(() -> new VersionNotFoundException("no retired version to roll back to"));
        } else {
            target = r.find(targetId)
                    .orElseThrow(() -> new VersionNotFoundException("version " + targetId + " not found (pruned or never existed)"));
        }

        if (target.status() == ModelStatus.ACTIVE) {
            log.info("↩️ ROLLBACK no-op: {} is already active", target.id());
            return target;
        }
        if (!store.exists(target.artifactRef())) {
            throw new VersionNotFoundException("artifact of version " + target.id() + " is gone (" + target.artifactRef() + ")");
        }

        boolean oneStepUndo = targetId == null || targetId.isBlank();
        ModelVersion activated = target.withStatus(ModelStatus.ACTIVE);
        ModelVersion demoted = current == null ? null
                : current.withStatus(oneStepUndo ? ModelStatus.FAILED : ModelStatus.RETIRED);

        store.saveMetadata(activated);
        store.swapCurrent(activated.id());
        if (demoted != null) {
            store.saveMetadata(demoted);
        }

        registry.set(r.put(activated, demoted));
        status.setCurrentVersionId(activated.id());

        log.warn("↩️ ROLLBACK {} -> {} (demoted as {})",
                current != null ? current.id() : "none", activated.id(),
                demoted != null ? demoted.status() : "-");
        return activated;
    }

    // ==============================================================
    // 🧹 PRUNE
    // ==============================================================

    /**
     * Удаляет неактивные версии сверх max-versions или старше retention-days.
     * Активная и самая свежая RETIRED не удаляются никогда.
     *
     * @return id удалённых версий
     */
    public synchronized List<String> prune() {
        VersionRegistry r = registry.get();
        ModelVersion protectedPrior = r.latestRetired().orElse(null);

        List<ModelVersion> inactive = r.all().stream()
                .filter(v -> v.status() != ModelStatus.ACTIVE)
                .sorted(Comparator.comparing(ModelVersion::id).reversed())
                .toList();

        int maxVersions = props.getRetention().getMaxVersions();
        Instant cutoff = clock.instant().minus(Duration.ofDays(props.getRetention().getRetentionDays()));

        int kept = protectedPrior != null ? 1 : 0;
        List<String> removed = new ArrayList<>();

        for (ModelVersion v : inactive) {
            if (protectedPrior != null && v.id().equals(protectedPrior.id())) continue;

            boolean expired = v.createdAt() != null && v.createdAt().isBefore(cutoff);
            if (kept >= maxVersions || expired) {
                try {
                    store.delete(v.artifactRef());
                    removed.add(v.id());
                } catch (RuntimeException e) {
                    log.warn("⚠️ prune: cannot delete {} ({}): {}", v.id(), v.artifactRef(), e.getMessage());
                }
            } else {
                kept++;
            }
        }

        if (!removed.isEmpty()) {
            registry.set(r.remove(removed));
            log.info("🧹 PRUNED {} (kept inactive={}, maxVersions={}, retentionDays={})",
                    removed, kept, maxVersions, props.getRetention().getRetentionDays());
        }
        return removed;
    }

    // ==============================================================
    // helpers
    // ==============================================================

    /**
     * Кандидат, не дошедший до promote (отклонён / ошибка).
     */
    public void discardCandidate(ModelVersion candidate) {
        if (candidate == null) return;
        discardQuietly(candidate.artifactRef());
    }

    private void discardQuietly(String ref) {
        if (ref == null) return;
        try {
            store.delete(ref);
        } catch (RuntimeException e) {
            log.warn("⚠️ cannot discard artifact {}: {}", ref, e.getMessage());
        }
    }

    private static String versionedRef(String versionId) {
        return "versions/" + versionId;
    }
}
