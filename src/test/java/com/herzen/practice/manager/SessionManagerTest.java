package com.herzen.practice.manager;

import com.herzen.practice.domain.DomainModels.ContentType;
import com.herzen.practice.domain.DomainModels.DifficultyFilter;
import com.herzen.practice.domain.DomainModels.FocusStrategy;
import com.herzen.practice.domain.DomainModels.PracticeMode;
import com.herzen.practice.domain.DomainModels.SessionConfig;
import com.herzen.practice.domain.DomainModels.SessionStatus;
import com.herzen.practice.error.SessionValidationException;
import com.herzen.practice.manager.ManagerModels.ActiveSessionInfo;
import com.herzen.practice.manager.ManagerModels.FinalStats;
import com.herzen.practice.manager.ManagerModels.GoalProgress;
import com.herzen.practice.manager.ManagerModels.HistoryFilter;
import com.herzen.practice.manager.ManagerModels.Preferences;
import com.herzen.practice.manager.ManagerModels.ReminderSettings;
import com.herzen.practice.manager.ManagerModels.SessionHistoryEntry;
import com.herzen.practice.repository.ManagerStateJdbcRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class SessionManagerTest {
    @Autowired
    private SessionManager manager;
    @Autowired
    private ManagerStateJdbcRepository stateRepository;
    @Autowired
    private JdbcTemplate jdbcTemplate;

    @BeforeEach
    void cleanState() {
        jdbcTemplate.update("DELETE FROM session_history");
        jdbcTemplate.update("DELETE FROM manager_state");
        manager.hydrate();
        manager.updatePreferences(Preferences.defaults(1));
    }

    private static SessionConfig config(String courseId) {
        return SessionConfig.preset(courseId, DifficultyFilter.MIXED, FocusStrategy.WEAK_AREAS, PracticeMode.PRACTICE);
    }

    private static FinalStats stats(double accuracy, Map<String, Double> topics) {
        return new FinalStats(120_000, 4, accuracy, accuracy / 100, topics);
    }

    @Test
    void startRegistersAndPersistsActiveSession() {
        ActiveSessionInfo info = manager.startSession(ContentType.CUECARDS, config("mgr-1"));

        assertEquals(SessionStatus.ACTIVE, info.status());
        assertTrue(info.id().startsWith("cuecards-"));
        assertEquals(info.id(), manager.getActiveSessionInfo().orElseThrow().id());
        assertEquals(info.id(), stateRepository.loadActiveSession().orElseThrow().id());
    }

    @Test
    void startingAnotherSessionArchivesTheActiveOneWithPartialStats() {
        ActiveSessionInfo first = manager.startSession(ContentType.CUECARDS, config("mgr-1"));
        manager.updateSessionProgress(first.id(), 2, 5);

        ActiveSessionInfo second = manager.startSession(ContentType.OPEN_QUESTIONS, config("mgr-1"));

        List<SessionHistoryEntry> history = manager.getSessionHistory(null);
        assertEquals(1, history.size());
        assertEquals(first.id(), history.get(0).id());
        assertEquals(2, history.get(0).finalStats().itemsCompleted());
        assertNull(history.get(0).finalStats().score());
        assertEquals(second.id(), manager.getActiveSessionInfo().orElseThrow().id());
    }

    @Test
    void endingArchivesWithSummaryAndClearsActive() {
        ActiveSessionInfo info = manager.startSession(ContentType.OPEN_QUESTIONS, config("mgr-2"));

        SessionHistoryEntry entry = manager.endSession(info.id(),
                stats(60, Map.of("caching", 0.9, "queues", 0.3, "indexes", 0.5))).orElseThrow();

        assertEquals(SessionStatus.COMPLETED, entry.status());
        assertEquals("mgr-2", entry.courseId());
        assertNotNull(entry.completedAt());
        assertEquals(List.of("caching"), entry.performance().strengths());
        assertEquals(List.of("queues", "indexes"), entry.performance().weaknesses());
        assertEquals(List.of("Review queues", "Review indexes"), entry.performance().recommendations());
        assertTrue(manager.getActiveSessionInfo().isEmpty());
        assertTrue(stateRepository.loadActiveSession().isEmpty());
    }

    @Test
    void endingAnotherIdIsIgnored() {
        ActiveSessionInfo info = manager.startSession(ContentType.CUECARDS, config("mgr-3"));

        assertTrue(manager.endSession("someone-else", stats(50, Map.of())).isEmpty());
        assertTrue(manager.pauseSession("someone-else").isEmpty());
        assertEquals(info.id(), manager.getActiveSessionInfo().orElseThrow().id());
        assertTrue(manager.getSessionHistory(null).isEmpty());
    }

    @Test
    void pauseAndResumeTrackStatus() {
        ActiveSessionInfo info = manager.startSession(ContentType.CUECARDS, config("mgr-3"));

        assertEquals(SessionStatus.PAUSED, manager.pauseSession(info.id()).orElseThrow().status());
        assertEquals(SessionStatus.PAUSED, manager.recoverSession().orElseThrow().status());
        assertEquals(SessionStatus.ACTIVE, manager.resumeSession(info.id()).orElseThrow().status());
    }

    @Test
    void historySurvivesRehydration() {
        ActiveSessionInfo info = manager.startSession(ContentType.MULTIPLE_CHOICE, config("mgr-4"));
        manager.endSession(info.id(), stats(80, Map.of("caching", 0.8)));
        ActiveSessionInfo stillRunning = manager.startSession(ContentType.CUECARDS, config("mgr-4"));

        manager.hydrate();

        SessionHistoryEntry restored = manager.getSessionById(info.id()).orElseThrow();
        assertEquals(ContentType.MULTIPLE_CHOICE, restored.type());
        assertEquals(80.0, restored.finalStats().accuracy(), 1e-9);
        assertEquals(Map.of("caching", 0.8), restored.finalStats().topicScores());
        assertEquals(config("mgr-4"), restored.config());
        assertEquals(stillRunning.id(), manager.recoverSession().orElseThrow().id());
    }

    @Test
    void historyFilterAndDelete() {
        ActiveSessionInfo a = manager.startSession(ContentType.CUECARDS, config("mgr-5"));
        manager.endSession(a.id(), stats(50, Map.of()));
        ActiveSessionInfo b = manager.startSession(ContentType.OPEN_QUESTIONS, config("mgr-5"));
        manager.endSession(b.id(), stats(70, Map.of()));

        assertEquals(List.of(b.id(), a.id()), manager.getSessionHistory(null).stream().map(SessionHistoryEntry::id).toList());
        assertEquals(List.of(a.id()), manager.getSessionHistory(new HistoryFilter(ContentType.CUECARDS, null, null))
                .stream().map(SessionHistoryEntry::id).toList());
        Instant tomorrow = Instant.now().plus(1, ChronoUnit.DAYS);
        assertTrue(manager.getSessionHistory(new HistoryFilter(null, tomorrow, null)).isEmpty());

        assertTrue(manager.deleteSession(a.id()));
        assertFalse(manager.deleteSession(a.id()));
        assertEquals(1, manager.getSessionHistory(null).size());
    }

    @Test
    void analyticsAndRecommendationsFollowHistory() {
        ActiveSessionInfo a = manager.startSession(ContentType.OPEN_QUESTIONS, config("mgr-6"));
        manager.endSession(a.id(), stats(40, Map.of("queues", 0.4)));

        var analytics = manager.calculateAnalytics();
        var recommendations = manager.generateRecommendations();

        assertEquals(1, analytics.totalSessions());
        assertEquals(List.of("queues"), analytics.learningPatterns().weakestTopics());
        assertFalse(recommendations.isEmpty());
        assertTrue(recommendations.size() <= 3);
        assertEquals(ContentType.OPEN_QUESTIONS, recommendations.get(0).type());
        assertEquals("mgr-6", recommendations.get(0).config().courseId());
    }

    @Test
    void dailyGoalIsValidatedPersistedAndTracked() {
        assertThrows(SessionValidationException.class, () -> manager.setDailyGoal(-1));

        manager.setDailyGoal(2);
        ActiveSessionInfo a = manager.startSession(ContentType.CUECARDS, config("mgr-7"));
        manager.endSession(a.id(), stats(50, Map.of()));

        GoalProgress progress = manager.checkGoalProgress();
        assertEquals(1, progress.completed());
        assertEquals(2, progress.target());
        assertEquals(50.0, progress.percentage(), 1e-9);
        assertEquals(2, stateRepository.loadPreferences().orElseThrow().dailyGoal());
    }

    @Test
    void preferencePatchKeepsUnsetFields() {
        Preferences updated = manager.updatePreferences(new Preferences(45, null, null, new ReminderSettings(true, null, null)));

        assertEquals(45, updated.defaultSessionLength());
        assertEquals(5, updated.autoSaveInterval());
        assertTrue(updated.reminderSettings().enabled());
        assertEquals(1, updated.dailyGoal());
        assertEquals(List.of("09:00", "18:00"), updated.reminderSettings().reminderTimes());
    }

    @Test
    void switchKeepsTheActiveCourse() {
        manager.startSession(ContentType.CUECARDS, config("mgr-8"));

        ActiveSessionInfo switched = manager.switchSessionType(ContentType.MULTIPLE_CHOICE);

        assertEquals(ContentType.MULTIPLE_CHOICE, switched.type());
        assertEquals("mgr-8", switched.config().courseId());
        assertEquals(FocusStrategy.COMPREHENSIVE, switched.config().focus());
        assertEquals(1, manager.getSessionHistory(null).size());
    }

    @Test
    void rejectsMissingTypeOrConfig() {
        assertThrows(SessionValidationException.class, () -> manager.startSession(null, config("x")));
        assertThrows(SessionValidationException.class, () -> manager.startSession(ContentType.CUECARDS, null));
    }
}
