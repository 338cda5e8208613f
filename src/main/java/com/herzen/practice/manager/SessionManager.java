package com.herzen.practice.manager;

import com.herzen.practice.analytics.CrossSessionAnalyticsCalculator;
import com.herzen.practice.config.SessionEngineProperties;
import com.herzen.practice.domain.DomainModels.ContentType;
import com.herzen.practice.domain.DomainModels.DifficultyFilter;
import com.herzen.practice.domain.DomainModels.FocusStrategy;
import com.herzen.practice.domain.DomainModels.PracticeMode;
import com.herzen.practice.domain.DomainModels.SessionConfig;
import com.herzen.practice.domain.DomainModels.SessionStatus;
import com.herzen.practice.domain.IdGenerator;
import com.herzen.practice.error.PersistenceException;
import com.herzen.practice.error.SessionValidationException;
import com.herzen.practice.manager.ManagerModels.ActiveSessionInfo;
import com.herzen.practice.manager.ManagerModels.CrossSessionAnalytics;
import com.herzen.practice.manager.ManagerModels.FinalStats;
import com.herzen.practice.manager.ManagerModels.GoalProgress;
import com.herzen.practice.manager.ManagerModels.HistoryFilter;
import com.herzen.practice.manager.ManagerModels.HistoryPerformance;
import com.herzen.practice.manager.ManagerModels.Preferences;
import com.herzen.practice.manager.ManagerModels.Recommendation;
import com.herzen.practice.manager.ManagerModels.ReminderSettings;
import com.herzen.practice.manager.ManagerModels.SessionHistoryEntry;
import com.herzen.practice.manager.ManagerModels.SessionProgressInfo;
import com.herzen.practice.recommendation.RecommendationGenerator;
import com.herzen.practice.repository.ManagerStateJdbcRepository;
import com.herzen.practice.repository.SessionHistoryJdbcRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Cross-session coordinator state: the single active session, the archive of finished sessions,
 * analytics derived from that archive, recommendations and user preferences.
 * <p>
 * History, the active-session record and preferences are written through to the database on every
 * change. A failed write is logged and the in-memory state stays authoritative.
 */
@Slf4j
@Service
public class SessionManager {
    static final String DEFAULT_COURSE = "current";

    private final SessionHistoryJdbcRepository historyRepository;
    private final ManagerStateJdbcRepository stateRepository;
    private final Clock clock;
    private final Executor insightsExecutor;

    private final Object lock = new Object();
    private final List<SessionHistoryEntry> history = new ArrayList<>();
    private ActiveSessionInfo activeSession;
    private CrossSessionAnalytics analytics;
    private List<Recommendation> recommendations = List.of();
    private Preferences preferences;

    public SessionManager(SessionHistoryJdbcRepository historyRepository,
                          ManagerStateJdbcRepository stateRepository,
                          SessionEngineProperties properties,
                          Clock clock,
                          @Qualifier("insightsExecutor") Executor insightsExecutor) {
        this.historyRepository = historyRepository;
        this.stateRepository = stateRepository;
        this.clock = clock;
        this.insightsExecutor = insightsExecutor;
        this.preferences = Preferences.defaults(properties.getDefaultDailyGoal());
        this.analytics = CrossSessionAnalytics.initial(properties.getDefaultDailyGoal());
    }

    // ==================== lifecycle ====================

    @EventListener(ApplicationReadyEvent.class)
    public void hydrate() {
        List<SessionHistoryEntry> storedHistory;
        Optional<ActiveSessionInfo> storedActive;
        Optional<Preferences> storedPreferences;
        try {
            storedHistory = historyRepository.loadAll();
            storedActive = stateRepository.loadActiveSession();
            storedPreferences = stateRepository.loadPreferences();
        } catch (PersistenceException e) {
            log.warn("Could not hydrate session manager, starting empty: {}", e.getMessage());
            return;
        }
        synchronized (lock) {
            history.clear();
            history.addAll(storedHistory);
            activeSession = storedActive.orElse(null);
            storedPreferences.ifPresent(p -> preferences = preferences.mergedWith(p));
        }
        log.info("Hydrated session manager: {} history entries, active session {}",
                storedHistory.size(), storedActive.map(ActiveSessionInfo::id).orElse("none"));
        refreshInsights();
    }

    /**
     * Registers a new active session. Any session that is still active is archived first with the
     * partial stats known here.
     */
    public ActiveSessionInfo startSession(ContentType type, SessionConfig config) {
        if (type == null) {
            throw new SessionValidationException("Session type is required");
        }
        if (config == null) {
            throw new SessionValidationException("Session config is required");
        }
        ActiveSessionInfo previous = getActiveSessionInfo().orElse(null);
        if (previous != null) {
            log.info("Ending active session {} before starting a new {} session", previous.id(), type.label());
            endSession(previous.id(), partialStats(previous));
        }

        Instant now = clock.instant();
        ActiveSessionInfo started = new ActiveSessionInfo(IdGenerator.withPrefix(type.label()), type, now, now,
                SessionStatus.ACTIVE, config, SessionProgressInfo.of(0, 0));
        synchronized (lock) {
            activeSession = started;
            writeThrough("active session", () -> stateRepository.saveActiveSession(started));
        }
        log.info("Registered {} session {} for course {}", type.label(), started.id(), config.courseId());
        return started;
    }

    /**
     * Makes a session reloaded from its snapshot the active one. A different session that is still
     * active is archived first with partial stats.
     */
    public ActiveSessionInfo adoptSession(String sessionId, ContentType type, SessionConfig config, Instant startedAt,
                                          SessionStatus status, SessionProgressInfo progress) {
        ActiveSessionInfo previous = getActiveSessionInfo().orElse(null);
        if (previous != null && !previous.id().equals(sessionId)) {
            log.info("Ending active session {} before resuming {} session {}", previous.id(), type.label(), sessionId);
            endSession(previous.id(), partialStats(previous));
        }

        Instant now = clock.instant();
        ActiveSessionInfo adopted = new ActiveSessionInfo(sessionId, type, startedAt == null ? now : startedAt, now,
                status, config, progress);
        synchronized (lock) {
            activeSession = adopted;
            writeThrough("active session", () -> stateRepository.saveActiveSession(adopted));
        }
        log.info("Resumed tracking of {} session {} at item {}/{}", type.label(), sessionId,
                progress.currentIndex(), progress.totalItems());
        return adopted;
    }

    /**
     * Archives the active session. Ignored when {@code sessionId} is not the active session.
     */
    public Optional<SessionHistoryEntry> endSession(String sessionId, FinalStats finalStats) {
        SessionHistoryEntry entry;
        synchronized (lock) {
            if (activeSession == null || !activeSession.id().equals(sessionId)) {
                return Optional.empty();
            }
            FinalStats stats = finalStats == null ? partialStats(activeSession) : finalStats;
            entry = new SessionHistoryEntry(sessionId, activeSession.type(), activeSession.config().courseId(),
                    activeSession.startedAt(), clock.instant(), SessionStatus.COMPLETED, activeSession.config(),
                    stats, summarize(stats));
            history.add(0, entry);
            activeSession = null;
            writeThrough("history entry " + sessionId, () -> historyRepository.save(entry));
            writeThrough("active session", () -> stateRepository.saveActiveSession(null));
        }
        log.info("Archived {} session {}: {} items, accuracy {}", entry.type().label(), sessionId,
                entry.finalStats().itemsCompleted(), String.format("%.1f", entry.finalStats().accuracy()));
        refreshInsightsAsync();
        return Optional.of(entry);
    }

    /**
     * Drops the active-session record without archiving it, for sessions that never got going.
     */
    public void abandonSession(String sessionId) {
        synchronized (lock) {
            if (activeSession == null || !activeSession.id().equals(sessionId)) {
                return;
            }
            activeSession = null;
            writeThrough("active session", () -> stateRepository.saveActiveSession(null));
        }
        log.info("Abandoned session {}", sessionId);
    }

    public Optional<ActiveSessionInfo> pauseSession(String sessionId) {
        return changeStatus(sessionId, SessionStatus.PAUSED);
    }

    public Optional<ActiveSessionInfo> resumeSession(String sessionId) {
        return changeStatus(sessionId, SessionStatus.ACTIVE);
    }

    /**
     * Ends whatever is active and registers a session of {@code type} with the default config.
     */
    public ActiveSessionInfo switchSessionType(ContentType type) {
        return startSession(type, defaultConfig(getActiveSessionInfo().orElse(null)));
    }

    /**
     * An interrupted session, if the last one never completed.
     */
    public Optional<ActiveSessionInfo> recoverSession() {
        return getActiveSessionInfo().filter(a -> a.status() != SessionStatus.COMPLETED);
    }

    public void updateSessionProgress(String sessionId, int currentIndex, int totalItems) {
        synchronized (lock) {
            if (activeSession == null || !activeSession.id().equals(sessionId)) {
                return;
            }
            ActiveSessionInfo updated = activeSession.withProgress(SessionProgressInfo.of(currentIndex, totalItems), clock.instant());
            activeSession = updated;
            writeThrough("active session", () -> stateRepository.saveActiveSession(updated));
        }
    }

    public Optional<ActiveSessionInfo> getActiveSessionInfo() {
        synchronized (lock) {
            return Optional.ofNullable(activeSession);
        }
    }

    // ==================== history ====================

    public List<SessionHistoryEntry> getSessionHistory(HistoryFilter filter) {
        synchronized (lock) {
            return history.stream().filter(e -> filter == null || filter.matches(e)).toList();
        }
    }

    public Optional<SessionHistoryEntry> getSessionById(String sessionId) {
        synchronized (lock) {
            return history.stream().filter(e -> e.id().equals(sessionId)).findFirst();
        }
    }

    public boolean deleteSession(String sessionId) {
        boolean removed;
        synchronized (lock) {
            removed = history.removeIf(e -> e.id().equals(sessionId));
            if (removed) {
                writeThrough("history entry " + sessionId, () -> historyRepository.delete(sessionId));
            }
        }
        if (removed) {
            refreshInsightsAsync();
        }
        return removed;
    }

    // ==================== insights ====================

    public CrossSessionAnalytics calculateAnalytics() {
        List<SessionHistoryEntry> snapshot;
        int dailyGoal;
        synchronized (lock) {
            snapshot = List.copyOf(history);
            dailyGoal = preferences.dailyGoal();
        }
        CrossSessionAnalytics computed = CrossSessionAnalyticsCalculator.calculate(snapshot, dailyGoal, now());
        synchronized (lock) {
            analytics = computed;
        }
        return computed;
    }

    public List<Recommendation> generateRecommendations() {
        CrossSessionAnalytics current;
        List<SessionHistoryEntry> snapshot;
        synchronized (lock) {
            current = analytics;
            snapshot = List.copyOf(history);
        }
        List<String> weakest = current.learningPatterns().weakestTopics();
        ContentType weakestType = weakest.isEmpty()
                ? null
                : CrossSessionAnalyticsCalculator.weakestTypeFor(snapshot, weakest.get(0)).orElse(null);
        String courseId = snapshot.isEmpty() ? DEFAULT_COURSE : snapshot.get(0).courseId();
        List<Recommendation> generated = RecommendationGenerator.generate(current, courseId, weakestType, now().getHour());
        synchronized (lock) {
            recommendations = generated;
        }
        return generated;
    }

    public CrossSessionAnalytics getAnalytics() {
        synchronized (lock) {
            return analytics;
        }
    }

    public List<Recommendation> getRecommendations() {
        synchronized (lock) {
            return recommendations;
        }
    }

    @Scheduled(fixedDelayString = "${session.analytics.recompute.fixed-delay-ms:300000}")
    public void scheduledRefresh() {
        refreshInsights();
    }

    void refreshInsights() {
        calculateAnalytics();
        generateRecommendations();
        log.debug("Refreshed analytics and recommendations");
    }

    private void refreshInsightsAsync() {
        try {
            insightsExecutor.execute(() -> {
                try {
                    refreshInsights();
                } catch (RuntimeException e) {
                    log.error("Insight refresh failed", e);
                }
            });
        } catch (RejectedExecutionException e) {
            log.warn("Insight refresh rejected, next scheduled run will pick it up: {}", e.getMessage());
        }
    }

    // ==================== goals and preferences ====================

    public Preferences setDailyGoal(int sessions) {
        if (sessions < 0) {
            throw new SessionValidationException("Daily goal must not be negative, got " + sessions);
        }
        return updatePreferences(new Preferences(null, null, null, new ReminderSettings(null, sessions, null)));
    }

    public GoalProgress checkGoalProgress() {
        synchronized (lock) {
            return CrossSessionAnalyticsCalculator.goalProgress(history, preferences.dailyGoal(), now());
        }
    }

    /**
     * Applies the non-null fields of {@code patch}.
     */
    public Preferences updatePreferences(Preferences patch) {
        Preferences updated;
        synchronized (lock) {
            updated = preferences.mergedWith(patch);
            preferences = updated;
            writeThrough("preferences", () -> stateRepository.savePreferences(updated));
        }
        refreshInsightsAsync();
        return updated;
    }

    public Preferences getPreferences() {
        synchronized (lock) {
            return preferences;
        }
    }

    // ==================== internals ====================

    static SessionConfig defaultConfig(ActiveSessionInfo current) {
        String courseId = current == null ? DEFAULT_COURSE : current.config().courseId();
        return SessionConfig.preset(courseId, DifficultyFilter.MIXED, FocusStrategy.COMPREHENSIVE, PracticeMode.PRACTICE);
    }

    private Optional<ActiveSessionInfo> changeStatus(String sessionId, SessionStatus status) {
        synchronized (lock) {
            if (activeSession == null || !activeSession.id().equals(sessionId)) {
                return Optional.empty();
            }
            ActiveSessionInfo updated = activeSession.withStatus(status, clock.instant());
            activeSession = updated;
            writeThrough("active session", () -> stateRepository.saveActiveSession(updated));
            return Optional.of(updated);
        }
    }

    private FinalStats partialStats(ActiveSessionInfo active) {
        return FinalStats.partial(Duration.between(active.startedAt(), clock.instant()).toMillis(), active.progress().currentIndex());
    }

    static HistoryPerformance summarize(FinalStats stats) {
        List<String> strengths = new ArrayList<>();
        List<String> weaknesses = new ArrayList<>();
        stats.topicScores().entrySet().stream()
                .sorted(Map.Entry.<String, Double>comparingByValue().reversed())
                .forEach(e -> {
                    if (e.getValue() >= 0.8) strengths.add(e.getKey());
                    else if (e.getValue() < 0.6) weaknesses.add(0, e.getKey());
                });
        List<String> advice = weaknesses.stream().map(t -> "Review " + t).toList();
        return new HistoryPerformance(strengths, weaknesses, advice);
    }

    private ZonedDateTime now() {
        return ZonedDateTime.now(clock);
    }

    private void writeThrough(String what, Runnable write) {
        try {
            write.run();
        } catch (PersistenceException e) {
            log.warn("Could not persist {}, keeping in-memory state: {}", what, e.getMessage());
        }
    }
}
