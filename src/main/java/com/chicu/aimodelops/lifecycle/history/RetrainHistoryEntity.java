package com.chicu.aimodelops.lifecycle.history;

import com.chicu.aimodelops.common.enums.RetrainOutcome;
import com.chicu.aimodelops.common.enums.RetrainReason;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.Immutable;

import java.time.Instant;

/**
 * Append-only аудит попыток переобучения. Строка пишется один раз в конце попытки.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Immutable
@Table(
        name = "retrain_history",
        indexes = {
                @Index(name = "idx_retrain_history_started", columnList = "started_at DESC")
        }
)
public class RetrainHistoryEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "attempt_id", nullable = false, unique = true, length = 64)
    private String attemptId;

    @Enumerated(EnumType.STRING)
    @Column(name = "reason", nullable = false, length = 32)
    private RetrainReason reason;

    @Column(name = "request_detail", length = 512)
    private String requestDetail;

    @Column(name = "submitted_at")
    private Instant submittedAt;

    @Column(name = "started_at", nullable = false)
    private Instant startedAt;

    @Column(name = "finished_at")
    private Instant finishedAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "outcome", nullable = false, length = 16)
    private RetrainOutcome outcome;

    @Column(name = "candidate_version_id", length = 64)
    private String candidateVersionId;

    @Column(name = "baseline_version_id", length = 64)
    private String baselineVersionId;

    /**
     * ValidatorReport целиком, JSON. null — до валидации не дошли.
     */
    @Lob
    @Column(name = "validator_report_json")
    private String validatorReportJson;

    @Column(name = "message", length = 2000)
    private String message;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
}
