package com.chicu.aimodelops.lifecycle.model;

import com.chicu.aimodelops.common.enums.RetrainReason;

import java.time.Instant;
import java.util.Comparator;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Заявка на переобучение от наблюдателя (или оператора).
 * Порядок: приоритет причины, затем более ранний submittedAt, затем порядок подачи.
 */
public record RetrainRequest(
        RetrainReason reason,
        Instant submittedAt,
        long sequence,
        String detail
) implements Comparable<RetrainRequest> {

    private static final AtomicLong SEQUENCE = new AtomicLong();

    private static final Comparator<RetrainRequest> ORDER = Comparator
            .comparingInt(RetrainRequest::priority).reversed()
            .thenComparing(RetrainRequest::submittedAt)
            .thenComparingLong(RetrainRequest::sequence);

    public RetrainRequest {
        if (reason == null) throw new IllegalArgumentException("reason=null");
        if (submittedAt == null) throw new IllegalArgumentException("submittedAt=null");
    }

    public static RetrainRequest of(RetrainReason reason, Instant submittedAt, String detail) {
        return new RetrainRequest(reason, submittedAt, SEQUENCE.incrementAndGet(), detail);
    }

    public int priority() {
        return reason.priority();
    }

    @Override
    public int compareTo(RetrainRequest other) {
        return ORDER.compare(this, other);
    }
}
