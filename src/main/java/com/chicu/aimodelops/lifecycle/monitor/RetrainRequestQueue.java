package com.chicu.aimodelops.lifecycle.monitor;

import com.chicu.aimodelops.common.enums.RetrainReason;
import com.chicu.aimodelops.lifecycle.model.RetrainRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.PriorityBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Очередь заявок на переобучение.
 * Не больше одной необработанной заявки на причину: повтор той же причины схлопывается,
 * пока координатор не вызовет {@link #release(RetrainReason)}.
 */
@Slf4j
@Component
public class RetrainRequestQueue {

    private final PriorityBlockingQueue<RetrainRequest> queue = new PriorityBlockingQueue<>();

    /** причины, чья заявка в очереди или в работе */
    private final Set<RetrainReason> admitted = ConcurrentHashMap.newKeySet();

    /**
     * @return false — заявка схлопнута с уже принятой по той же причине
     */
    public boolean offer(RetrainRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("request = null");
        }
        if (!admitted.add(request.reason())) {
            log.debug("🔁 COALESCED reason={} detail={}", request.reason(), request.detail());
            return false;
        }
        queue.offer(request);
        log.info("📥 QUEUED reason={} priority={} detail={} depth={}",
                request.reason(), request.priority(), request.detail(), queue.size());
        return true;
    }

    /**
     * Блокирует до появления заявки. Причина остаётся "занятой" до release.
     */
    public RetrainRequest take() throws InterruptedException {
        return queue.take();
    }

    public RetrainRequest poll(long timeout, TimeUnit unit) throws InterruptedException {
        return queue.poll(timeout, unit);
    }

    /**
     * Заявка по причине обработана (или отброшена) — следующая такая же снова принимается.
     */
    public void release(RetrainReason reason) {
        if (reason != null) {
            admitted.remove(reason);
        }
    }

    public boolean isAdmitted(RetrainReason reason) {
        return admitted.contains(reason);
    }

    public int size() {
        return queue.size();
    }
}
