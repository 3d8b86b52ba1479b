package com.chicu.aimodelops.lifecycle.store;

import com.chicu.aimodelops.common.enums.ModelStatus;
import com.chicu.aimodelops.lifecycle.exception.ArtifactStoreException;
import com.chicu.aimodelops.lifecycle.model.ModelVersion;
import com.chicu.aimodelops.lifecycle.model.TrainedModel;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FileSystemArtifactStoreTest {

    @TempDir
    Path root;

    private FileSystemArtifactStore store;

    @BeforeEach
    void setUp() {
        store = new FileSystemArtifactStore(root, new ObjectMapper().findAndRegisterModules());
    }

    @Test
    void stagedCandidate_isCopiedIntoVersionedPath() {
        String staged = store.write("v000001", new TrainedModel("mk-1", "1", new byte[]{1, 2, 3}));
        assertEquals("staging/v000001", staged);

        String versioned = store.copy(staged, "v000001");
        assertEquals("versions/v000001", versioned);

        TrainedModel read = store.read(versioned);
        assertEquals("mk-1", read.modelKey());
        assertEquals("1", read.schemaVersion());
        assertArrayEquals(new byte[]{1, 2, 3}, read.payload());

        // list видит только версии, не staging
        assertEquals(List.of("versions/v000001"), store.list());
    }

    @Test
    void corruptedPayload_isDetected() throws Exception {
        String ref = store.copy(store.write("v000001", new TrainedModel("mk", "1", new byte[]{1, 2, 3})), "v000001");
        Files.write(root.resolve("versions/v000001/model.bin"), new byte[]{9, 9});

        assertThrows(ArtifactStoreException.class, () -> store.read(ref));
    }

    @Test
    void refsCannotEscapeRoot() {
        assertThrows(ArtifactStoreException.class, () -> store.read("../outside"));
        assertThrows(ArtifactStoreException.class, () -> store.delete("versions/../../x"));
        assertThrows(ArtifactStoreException.class, () -> store.write("../v1", new TrainedModel("m", "1", new byte[0])));
    }

    @Test
    void currentPointer_swapReadClear() {
        assertTrue(store.readCurrent().isEmpty());

        store.swapCurrent("v000001");
        store.swapCurrent("v000002");
        assertEquals("v000002", store.readCurrent().orElseThrow());

        store.clearCurrent();
        assertTrue(store.readCurrent().isEmpty());
    }

    @Test
    void metadataSurvivesReload_andDeleteRemovesWholeVersion() {
        store.copy(store.write("v000001", new TrainedModel("mk", "1", new byte[]{1})), "v000001");
        ModelVersion v = ModelVersion.builder()
                .id("v000001")
                .createdAt(Instant.parse("2026-01-01T00:00:00Z"))
                .artifactRef("versions/v000001")
                .metrics(Map.of("accuracy", 0.81))
                .status(ModelStatus.ACTIVE)
                .schemaVersion("1")
                .build();
        store.saveMetadata(v);

        List<ModelVersion> loaded = store.loadMetadata();
        assertEquals(List.of(v), loaded);

        store.delete("versions/v000001");
        assertFalse(store.exists("versions/v000001"));
        assertTrue(store.loadMetadata().isEmpty());
    }
}
