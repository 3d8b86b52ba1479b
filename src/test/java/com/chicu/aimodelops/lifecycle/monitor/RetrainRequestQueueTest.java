package com.chicu.aimodelops.lifecycle.monitor;

import com.chicu.aimodelops.common.enums.RetrainReason;
import com.chicu.aimodelops.lifecycle.model.RetrainRequest;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RetrainRequestQueueTest {

    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    private final RetrainRequestQueue queue = new RetrainRequestQueue();

    @Test
    void sameReasonIsCoalescedWhileQueued() {
        assertTrue(queue.offer(RetrainRequest.of(RetrainReason.DATA_DRIFT, T0, "first")));
        assertFalse(queue.offer(RetrainRequest.of(RetrainReason.DATA_DRIFT, T0.plusSeconds(5), "second")));

        assertEquals(1, queue.size());
    }

    @Test
    void sameReasonIsCoalescedWhileInFlight_untilReleased() throws Exception {
        queue.offer(RetrainRequest.of(RetrainReason.PERFORMANCE_DEGRADATION, T0, null));
        RetrainRequest taken = queue.take();

        // заявка "в работе": причина всё ещё занята
        assertFalse(queue.offer(RetrainRequest.of(RetrainReason.PERFORMANCE_DEGRADATION, T0.plusSeconds(1), null)));
        assertEquals(0, queue.size());

        queue.release(taken.reason());
        assertTrue(queue.offer(RetrainRequest.of(RetrainReason.PERFORMANCE_DEGRADATION, T0.plusSeconds(2), null)));
    }

    @Test
    void takesByPriorityNotFifo() throws Exception {
        queue.offer(RetrainRequest.of(RetrainReason.SCHEDULED, T0, null));
        queue.offer(RetrainRequest.of(RetrainReason.DATA_DRIFT, T0.plusSeconds(1), null));
        queue.offer(RetrainRequest.of(RetrainReason.MANUAL, T0.plusSeconds(2), null));
        queue.offer(RetrainRequest.of(RetrainReason.PERFORMANCE_DEGRADATION, T0.plusSeconds(3), null));

        List<RetrainReason> order = List.of(
                queue.take().reason(), queue.take().reason(), queue.take().reason(), queue.take().reason());

        assertEquals(List.of(
                RetrainReason.MANUAL,
                RetrainReason.PERFORMANCE_DEGRADATION,
                RetrainReason.DATA_DRIFT,
                RetrainReason.SCHEDULED), order);
    }

    @Test
    void equalPriority_earlierSubmissionWins_thenSequence() {
        RetrainRequest early = RetrainRequest.of(RetrainReason.DATA_DRIFT, T0, "early");
        RetrainRequest late = RetrainRequest.of(RetrainReason.DATA_DRIFT, T0.plusSeconds(10), "late");
        assertTrue(early.compareTo(late) < 0);

        RetrainRequest a = RetrainRequest.of(RetrainReason.DATA_DRIFT, T0, "a");
        RetrainRequest b = RetrainRequest.of(RetrainReason.DATA_DRIFT, T0, "b");
        assertTrue(a.compareTo(b) < 0);
    }

    @Test
    void rejectsNull() {
        assertThrows(IllegalArgumentException.class, () -> queue.offer(null));
    }
}
