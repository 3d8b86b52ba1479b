package com.chicu.aimodelops.lifecycle.history;

import com.chicu.aimodelops.common.enums.RetrainOutcome;
import com.chicu.aimodelops.common.enums.RetrainReason;
import com.chicu.aimodelops.lifecycle.model.RetrainHistoryEntry;
import com.chicu.aimodelops.lifecycle.model.RetrainRequest;
import com.chicu.aimodelops.lifecycle.model.ValidatorReport;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.ImportAutoConfiguration;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DataJpaTest
@Import(RetrainHistoryService.class)
@ImportAutoConfiguration(JacksonAutoConfiguration.class)
class RetrainHistoryServiceTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    @Autowired
    private RetrainHistoryService service;

    @Test
    void append_thenFind_keepsReport() {
        ValidatorReport report = ValidatorReport.builder()
                .accepted(false)
                .failedGate("improvement")
                .reasons(List.of("improvement_gate_failed: accuracy delta=0.0020 < 0.0100"))
                .metrics(Map.of("candidate.accuracy", 0.842, "baseline.accuracy", 0.840))
                .build();

        service.append(entry("a-1", T0, RetrainOutcome.REJECTED, report));

        RetrainHistoryEntry back = service.find("a-1").orElseThrow();
        assertEquals(RetrainOutcome.REJECTED, back.outcome());
        assertEquals(RetrainReason.DATA_DRIFT, back.request().reason());
        assertEquals("v000003", back.candidateVersionId());
        assertEquals("improvement", back.validatorReport().failedGate());
        assertEquals(0.842, back.validatorReport().metrics().get("candidate.accuracy"), 1e-9);
    }

    @Test
    void append_sameAttemptTwice_rejected() {
        service.append(entry("a-2", T0, RetrainOutcome.ERROR, null));

        assertThrows(IllegalStateException.class,
                () -> service.append(entry("a-2", T0.plusSeconds(5), RetrainOutcome.DEPLOYED, null)));
        assertEquals(RetrainOutcome.ERROR, service.find("a-2").orElseThrow().outcome());
    }

    @Test
    void recent_newestFirstAndLimited() {
        service.append(entry("a-10", T0, RetrainOutcome.REJECTED, null));
        service.append(entry("a-11", T0.plusSeconds(60), RetrainOutcome.ABORTED, null));
        service.append(entry("a-12", T0.plusSeconds(120), RetrainOutcome.DEPLOYED, null));

        List<RetrainHistoryEntry> recent = service.recent(2);

        assertEquals(List.of("a-12", "a-11"), recent.stream().map(RetrainHistoryEntry::attemptId).toList());
    }

    @Test
    void find_unknown_empty() {
        assertTrue(service.find("nope").isEmpty());
    }

    private static RetrainHistoryEntry entry(String attemptId, Instant startedAt, RetrainOutcome outcome,
                                             ValidatorReport report) {
        return RetrainHistoryEntry.builder()
                .attemptId(attemptId)
                .request(RetrainRequest.of(RetrainReason.DATA_DRIFT, startedAt.minusSeconds(1), "psi=0.31"))
                .startedAt(startedAt)
                .finishedAt(startedAt.plusSeconds(30))
                .outcome(outcome)
                .candidateVersionId("v000003")
                .baselineVersionId("v000002")
                .validatorReport(report)
                .message("attempt " + attemptId)
                .build();
    }
}
