package com.phillippitts.frontdesk.presentation.controller;

import com.phillippitts.frontdesk.service.orchestration.SessionOrchestrator;
import com.phillippitts.frontdesk.service.session.CallSession;
import com.phillippitts.frontdesk.service.session.SessionRegistry;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;

/**
 * Operator view of active calls.
 */
@RestController
@RequestMapping("/api/sessions")
class SessionController {

    private final SessionRegistry registry;
    private final SessionOrchestrator orchestrator;

    SessionController(SessionRegistry registry, SessionOrchestrator orchestrator) {
        this.registry = registry;
        this.orchestrator = orchestrator;
    }

    @GetMapping
    List<SessionSummary> list() {
        return registry.active().stream()
                .sorted(Comparator.comparing(CallSession::startedAt))
                .map(SessionSummary::of)
                .toList();
    }

    /**
     * Hangs up our side of a call.
     */
    @DeleteMapping("/{id}")
    ResponseEntity<Void> end(@PathVariable("id") String id) {
        registry.require(id);
        orchestrator.endSession(id);
        return ResponseEntity.noContent().build();
    }

    record SessionSummary(String id, String callSid, Instant startedAt, long turn,
                          boolean generating, int pendingSynthesis, int queuedUtterances) {

        static SessionSummary of(CallSession s) {
            return new SessionSummary(s.id(), s.callSid(), s.startedAt(), s.currentTurn().turnId(),
                    s.isGenerating(), s.pendingSynthesis(), s.playback().pendingCount());
        }
    }
}
