package com.chicu.aimodelops.web.controller;

import com.chicu.aimodelops.lifecycle.exception.VersionNotFoundException;
import com.chicu.aimodelops.lifecycle.model.ModelVersion;
import com.chicu.aimodelops.lifecycle.model.RetrainHistoryEntry;
import com.chicu.aimodelops.lifecycle.model.WatcherState;
import com.chicu.aimodelops.runtime.LifecycleFacade;
import com.chicu.aimodelops.web.dto.CommandResponse;
import com.chicu.aimodelops.web.dto.LifecycleStatusView;
import com.chicu.aimodelops.web.dto.RetrainCommand;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Map;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/lifecycle")
public class LifecycleApiController {

    private final LifecycleFacade facade;

    @GetMapping("/status")
    public LifecycleStatusView status() {
        return facade.status();
    }

    @GetMapping("/versions")
    public List<ModelVersion> versions() {
        return facade.versions();
    }

    @GetMapping("/versions/current")
    public ModelVersion current() {
        return facade.currentVersion()
                .orElseThrow(() -> new VersionNotFoundException("no active version"));
    }

    /**
     * GET /api/lifecycle/history?limit=20
     */
    @GetMapping("/history")
    public List<RetrainHistoryEntry> history(@RequestParam(defaultValue = "20") int limit) {
        if (limit <= 0) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "limit must be > 0");
        }
        return facade.history(limit);
    }

    @GetMapping("/history/{attemptId}")
    public RetrainHistoryEntry attempt(@PathVariable String attemptId) {
        return facade.attempt(attemptId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "attempt " + attemptId + " not found"));
    }

    @GetMapping("/watchers")
    public Map<String, WatcherState> watchers() {
        return facade.watchers();
    }

    /**
     * POST /api/lifecycle/retrain  {"detail": "..."}
     * 202 — заявка принята, 200 + accepted=false — такая уже в очереди/в работе.
     */
    @PostMapping("/retrain")
    public ResponseEntity<CommandResponse> retrain(@RequestBody(required = false) RetrainCommand command) {
        boolean queued = facade.requestRetrain(command != null ? command.getDetail() : null);
        if (queued) {
            return ResponseEntity.status(HttpStatus.ACCEPTED)
                    .body(CommandResponse.accepted("Manual retrain queued", null));
        }
        return ResponseEntity.ok(CommandResponse.ignored("Manual retrain already queued or running"));
    }

    /**
     * POST /api/lifecycle/rollback            — шаг назад к предыдущей версии
     * POST /api/lifecycle/rollback?target=v000003
     */
    @PostMapping("/rollback")
    public CommandResponse rollback(@RequestParam(required = false) String target) {
        ModelVersion active = facade.rollback(target);
        return CommandResponse.accepted("Active version is now " + active.id(), active);
    }
}
