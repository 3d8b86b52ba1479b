package com.chicu.aimodelops.lifecycle.monitor;

import com.chicu.aimodelops.common.enums.WatcherType;
import com.chicu.aimodelops.lifecycle.model.RetrainRequest;
import com.chicu.aimodelops.lifecycle.model.WatcherState;

import java.time.Duration;
import java.util.Optional;

public interface Watcher {

    WatcherType type();

    Duration interval();

    /**
     * Один тик. Не бросает: сбой источника отражается в {@link #state()}.
     */
    Optional<RetrainRequest> check();

    WatcherState state();
}
