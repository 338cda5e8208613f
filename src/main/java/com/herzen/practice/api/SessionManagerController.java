package com.herzen.practice.api;

import com.herzen.practice.domain.DomainModels.ContentType;
import com.herzen.practice.domain.DomainModels.SessionStatus;
import com.herzen.practice.manager.ManagerModels;
import com.herzen.practice.manager.SessionCoordinator;
import com.herzen.practice.manager.SessionManager;
import com.herzen.practice.session.SessionModels.SessionView;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/manager")
public class SessionManagerController {
    private final SessionManager manager;
    private final SessionCoordinator coordinator;

    public SessionManagerController(SessionManager manager, SessionCoordinator coordinator) {
        this.manager = manager;
        this.coordinator = coordinator;
    }

    @GetMapping("/active")
    public ResponseEntity<ManagerModels.ActiveSessionInfo> active() {
        return ResponseEntity.of(manager.getActiveSessionInfo());
    }

    @GetMapping("/stores")
    public ResponseEntity<Map<ContentType, SessionStatus>> stores() {
        return ResponseEntity.ok(coordinator.statuses());
    }

    @PostMapping("/recover")
    public ResponseEntity<SessionView> recover() {
        return ResponseEntity.of(coordinator.recoverSession());
    }

    @PostMapping("/switch/{type}")
    public ResponseEntity<SessionView> switchType(@PathVariable String type) {
        return ResponseEntity.ok(coordinator.switchSessionType(ContentType.fromLabel(type)));
    }

    @GetMapping("/history")
    public ResponseEntity<List<ManagerModels.SessionHistoryEntry>> history(@RequestParam(required = false) String type,
                                                                          @RequestParam(required = false) Instant start,
                                                                          @RequestParam(required = false) Instant end) {
        ContentType contentType = type == null || type.isBlank() ? null : ContentType.fromLabel(type);
        return ResponseEntity.ok(manager.getSessionHistory(new ManagerModels.HistoryFilter(contentType, start, end)));
    }

    @GetMapping("/history/{sessionId}")
    public ResponseEntity<ManagerModels.SessionHistoryEntry> historyEntry(@PathVariable String sessionId) {
        return ResponseEntity.of(manager.getSessionById(sessionId));
    }

    @DeleteMapping("/history/{sessionId}")
    public ResponseEntity<Void> deleteHistoryEntry(@PathVariable String sessionId) {
        return manager.deleteSession(sessionId) ? ResponseEntity.noContent().build() : ResponseEntity.notFound().build();
    }

    @GetMapping("/analytics")
    public ResponseEntity<ManagerModels.CrossSessionAnalytics> analytics() {
        return ResponseEntity.ok(manager.calculateAnalytics());
    }

    @GetMapping("/recommendations")
    public ResponseEntity<List<ManagerModels.Recommendation>> recommendations() {
        return ResponseEntity.ok(manager.generateRecommendations());
    }

    @GetMapping("/goal")
    public ResponseEntity<ManagerModels.GoalProgress> goal() {
        return ResponseEntity.ok(manager.checkGoalProgress());
    }

    @PutMapping("/goal")
    public ResponseEntity<ManagerModels.Preferences> setGoal(@RequestBody DailyGoalRequest request) {
        return ResponseEntity.ok(manager.setDailyGoal(request.sessions()));
    }

    @GetMapping("/preferences")
    public ResponseEntity<ManagerModels.Preferences> preferences() {
        return ResponseEntity.ok(manager.getPreferences());
    }

    @PatchMapping("/preferences")
    public ResponseEntity<ManagerModels.Preferences> updatePreferences(@RequestBody ManagerModels.Preferences patch) {
        return ResponseEntity.ok(manager.updatePreferences(patch));
    }

    public record DailyGoalRequest(int sessions) {}
}
