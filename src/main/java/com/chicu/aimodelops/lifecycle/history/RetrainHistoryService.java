package com.chicu.aimodelops.lifecycle.history;

import com.chicu.aimodelops.lifecycle.model.RetrainHistoryEntry;
import com.chicu.aimodelops.lifecycle.model.RetrainRequest;
import com.chicu.aimodelops.lifecycle.model.ValidatorReport;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class RetrainHistoryService {

    private static final int MAX_LIMIT = 500;
    private static final int MAX_MESSAGE = 2000;

    private final RetrainHistoryRepository repository;
    private final ObjectMapper objectMapper;

    @Transactional
    public void append(RetrainHistoryEntry entry) {
        if (entry == null || entry.attemptId() == null) {
            throw new IllegalArgumentException("history entry without attemptId");
        }
        if (repository.existsByAttemptId(entry.attemptId())) {
            throw new IllegalStateException("history entry " + entry.attemptId() + " already written");
        }

        RetrainRequest request = entry.request();
        RetrainHistoryEntity row = RetrainHistoryEntity.builder()
                .attemptId(entry.attemptId())
                .reason(request.reason())
                .requestDetail(truncate(request.detail(), 512))
                .submittedAt(request.submittedAt())
                .startedAt(entry.startedAt())
                .finishedAt(entry.finishedAt())
                .outcome(entry.outcome())
                .candidateVersionId(entry.candidateVersionId())
                .baselineVersionId(entry.baselineVersionId())
                .validatorReportJson(toJson(entry.validatorReport()))
                .message(truncate(entry.message(), MAX_MESSAGE))
                .build();

        repository.save(row);
        log.info("📝 HISTORY attempt={} outcome={} candidate={} baseline={}",
                entry.attemptId(), entry.outcome(), entry.candidateVersionId(), entry.baselineVersionId());
    }

    @Transactional(readOnly = true)
    public List<RetrainHistoryEntry> recent(int limit) {
        int size = Math.max(1, Math.min(limit, MAX_LIMIT));
        return repository.findAllByOrderByStartedAtDesc(PageRequest.of(0, size)).stream()
                .map(this::toEntry)
                .toList();
    }

    @Transactional(readOnly = true)
    public Optional<RetrainHistoryEntry> find(String attemptId) {
        return repository.findByAttemptId(attemptId).map(this::toEntry);
    }

    // =========================================================
    // mapping
    // =========================================================

    private RetrainHistoryEntry toEntry(RetrainHistoryEntity e) {
        return RetrainHistoryEntry.builder()
                .attemptId(e.getAttemptId())
                .request(new RetrainRequest(e.getReason(),
                        e.getSubmittedAt() != null ? e.getSubmittedAt() : e.getStartedAt(),
                        0L,
                        e.getRequestDetail()))
                .startedAt(e.getStartedAt())
                .finishedAt(e.getFinishedAt())
                .outcome(e.getOutcome())
                .candidateVersionId(e.getCandidateVersionId())
                .baselineVersionId(e.getBaselineVersionId())
                .validatorReport(fromJson(e.getValidatorReportJson()))
                .message(e.getMessage())
                .build();
    }

    private String toJson(ValidatorReport report) {
        if (report == null) return null;
        try {
            return objectMapper.writeValueAsString(report);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("ValidatorReport serialization failed: " + e.getOriginalMessage(), e);
        }
    }

    private ValidatorReport fromJson(String json) {
        if (json == null || json.isBlank()) return null;
        try {
            return objectMapper.readValue(json, ValidatorReport.class);
        } catch (JsonProcessingException e) {
            log.warn("⚠️ broken validator_report_json: {}", e.getOriginalMessage());
            return null;
        }
    }

    private static String truncate(String s, int max) {
        if (s == null) return null;
        return s.length() > max ? s.substring(0, max) : s;
    }
}
