package com.chicu.aimodelops.lifecycle.store;

import com.chicu.aimodelops.config.LifecycleProperties;
import com.chicu.aimodelops.lifecycle.exception.ArtifactStoreException;
import com.chicu.aimodelops.lifecycle.model.ModelVersion;
import com.chicu.aimodelops.lifecycle.model.TrainedModel;
import com.chicu.aimodelops.lifecycle.port.ArtifactStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Артефакты на локальном диске / volume.
 *
 * <pre>
 * root/
 *   CURRENT                      id активной версии (пишется temp + atomic rename)
 *   staging/&lt;id&gt;/model.bin        кандидаты до promote
 *   versions/&lt;id&gt;/model.bin
 *   versions/&lt;id&gt;/model.json
 *   versions/&lt;id&gt;/metadata.json
 * </pre>
 *
 * Ссылка на артефакт — относительный путь: "staging/v000003", "versions/v000003".
 */
@Slf4j
@Component
public class FileSystemArtifactStore implements ArtifactStore {

    static final String STAGING = "staging";
    static final String VERSIONS = "versions";
    static final String CURRENT = "CURRENT";
    static final String MODEL_BIN = "model.bin";
    static final String MODEL_JSON = "model.json";
    static final String METADATA_JSON = "metadata.json";

    private final Path root;
    private final ObjectMapper objectMapper;

    @Autowired
    public FileSystemArtifactStore(LifecycleProperties props, ObjectMapper objectMapper) {
        this(Paths.get(props.getStorage().getRoot()), objectMapper);
    }

    public FileSystemArtifactStore(Path root, ObjectMapper objectMapper) {
        this.root = root.toAbsolutePath().normalize();
        this.objectMapper = objectMapper;
        log.info("💾 ArtifactStore root={}", this.root);
    }

    // ==============================================================
    // artifacts
    // ==============================================================

    @Override
    public String write(String versionId, TrainedModel model) {
        String ref = STAGING + "/" + checkId(versionId);
        Path dir = resolve(ref);
        try {
            Files.createDirectories(dir);
            writeAtomically(dir.resolve(MODEL_BIN), model.payload());
            ModelDescriptor descriptor = new ModelDescriptor(
                    model.modelKey(), model.schemaVersion(), model.payload().length, sha256(model.payload()));
            writeAtomically(dir.resolve(MODEL_JSON), objectMapper.writeValueAsBytes(descriptor));
            return ref;
        } catch (IOException e) {
            throw new ArtifactStoreException("write failed for " + ref + ": " + e.getMessage(), e);
        }
    }

    @Override
    public String copy(String artifactRef, String versionId) {
        Path src = resolve(artifactRef);
        String targetRef = VERSIONS + "/" + checkId(versionId);
        Path target = resolve(targetRef);

        if (!Files.isRegularFile(src.resolve(MODEL_BIN))) {
            throw new ArtifactStoreException("artifact not found: " + artifactRef);
        }

        try {
            Files.createDirectories(target);
            // сначала descriptor, model.bin последним — exists() смотрит на него
            writeAtomically(target.resolve(MODEL_JSON), Files.readAllBytes(src.resolve(MODEL_JSON)));
            writeAtomically(target.resolve(MODEL_BIN), Files.readAllBytes(src.resolve(MODEL_BIN)));
            return targetRef;
        } catch (IOException e) {
            throw new ArtifactStoreException("copy " + artifactRef + " -> " + targetRef + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public TrainedModel read(String artifactRef) {
        Path dir = resolve(artifactRef);
        Path bin = dir.resolve(MODEL_BIN);
        if (!Files.isRegularFile(bin)) {
            throw new ArtifactStoreException("artifact not found: " + artifactRef);
        }
        try {
            byte[] payload = Files.readAllBytes(bin);
            ModelDescriptor descriptor = objectMapper.readValue(dir.resolve(MODEL_JSON).toFile(), ModelDescriptor.class);
            if (descriptor.sha256() != null && !descriptor.sha256().equals(sha256(payload))) {
                throw new ArtifactStoreException("checksum mismatch for " + artifactRef);
            }
            return new TrainedModel(descriptor.modelKey(), descriptor.schemaVersion(), payload);
        } catch (IOException e) {
            throw new ArtifactStoreException("read failed for " + artifactRef + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void delete(String artifactRef) {
        Path dir = resolve(artifactRef);
        try {
            deleteRecursively(dir);
        } catch (IOException e) {
            throw new ArtifactStoreException("delete failed for " + artifactRef + ": " + e.getMessage(), e);
        }
    }

    @Override
    public boolean exists(String artifactRef) {
        return artifactRef != null && Files.isRegularFile(resolve(artifactRef).resolve(MODEL_BIN));
    }

    @Override
    public List<String> list() {
        Path versions = root.resolve(VERSIONS);
        if (!Files.isDirectory(versions)) return List.of();
        try (Stream<Path> dirs = Files.list(versions)) {
            return dirs.filter(d -> Files.isRegularFile(d.resolve(MODEL_BIN)))
                    .map(d -> VERSIONS + "/" + d.getFileName())
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new ArtifactStoreException("list failed: " + e.getMessage(), e);
        }
    }

    // ==============================================================
    // metadata
    // ==============================================================

    @Override
    public void saveMetadata(ModelVersion version) {
        Path dir = resolve(VERSIONS + "/" + checkId(version.id()));
        try {
            Files.createDirectories(dir);
            writeAtomically(dir.resolve(METADATA_JSON), objectMapper.writeValueAsBytes(version));
        } catch (IOException e) {
            throw new ArtifactStoreException("metadata write failed for " + version.id() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public List<ModelVersion> loadMetadata() {
        Path versions = root.resolve(VERSIONS);
        if (!Files.isDirectory(versions)) return List.of();

        List<ModelVersion> out = new ArrayList<>();
        try (Stream<Path> dirs = Files.list(versions)) {
            for (Path dir : dirs.sorted().toList()) {
                Path meta = dir.resolve(METADATA_JSON);
                if (!Files.isRegularFile(meta)) continue;
                out.add(objectMapper.readValue(meta.toFile(), ModelVersion.class));
            }
        } catch (IOException e) {
            throw new ArtifactStoreException("metadata load failed: " + e.getMessage(), e);
        }
        out.sort(Comparator.comparing(ModelVersion::id));
        return out;
    }

    // ==============================================================
    // current pointer
    // ==============================================================

    @Override
    public void swapCurrent(String versionId) {
        checkId(versionId);
        try {
            Files.createDirectories(root);
            writeAtomically(root.resolve(CURRENT), versionId.getBytes(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new ArtifactStoreException("CURRENT swap to " + versionId + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public Optional<String> readCurrent() {
        Path current = root.resolve(CURRENT);
        if (!Files.isRegularFile(current)) return Optional.empty();
        try {
            String id = Files.readString(current, StandardCharsets.UTF_8).trim();
            return id.isEmpty() ? Optional.empty() : Optional.of(id);
        } catch (IOException e) {
            throw new ArtifactStoreException("CURRENT read failed: " + e.getMessage(), e);
        }
    }

    @Override
    public void clearCurrent() {
        try {
            Files.deleteIfExists(root.resolve(CURRENT));
        } catch (IOException e) {
            throw new ArtifactStoreException("CURRENT clear failed: " + e.getMessage(), e);
        }
    }

    @Override
    public void clearStaging() {
        try {
            deleteRecursively(root.resolve(STAGING));
        } catch (IOException e) {
            throw new ArtifactStoreException("staging cleanup failed: " + e.getMessage(), e);
        }
    }

    // ==============================================================
    // helpers
    // ==============================================================

    /**
     * Пишем во временный файл рядом и переименовываем: читатель видит либо старое, либо новое.
     */
    private static void writeAtomically(Path target, byte[] bytes) throws IOException {
        Path tmp = Files.createTempFile(target.getParent(), "." + target.getFileName(), ".tmp");
        try {
            Files.write(tmp, bytes);
            try {
                Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                log.warn("⚠️ atomic move not supported for {}, falling back to replace", target);
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    private static void deleteRecursively(Path dir) throws IOException {
        if (!Files.exists(dir)) return;
        try (Stream<Path> walk = Files.walk(dir)) {
            for (Path p : walk.sorted(Comparator.reverseOrder()).toList()) {
                Files.deleteIfExists(p);
            }
        }
    }

    private Path resolve(String ref) {
        if (ref == null || ref.isBlank()) {
            throw new ArtifactStoreException("artifactRef is blank");
        }
        Path p = root.resolve(ref).normalize();
        if (!p.startsWith(root) || p.equals(root)) {
            throw new ArtifactStoreException("artifactRef escapes store root: " + ref);
        }
        return p;
    }

    private static String checkId(String versionId) {
        if (versionId == null || !versionId.matches("[A-Za-z0-9._-]{1,64}") || versionId.startsWith(".")) {
            throw new ArtifactStoreException("invalid version id: " + versionId);
        }
        return versionId;
    }

    private static String sha256(byte[] bytes) {
        try {
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(bytes));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }
}
