package com.herzen.practice.manager;

import com.herzen.practice.domain.DomainModels.ContentType;
import com.herzen.practice.domain.DomainModels.SessionConfig;
import com.herzen.practice.domain.DomainModels.SessionStatus;
import com.herzen.practice.manager.ManagerModels.ActiveSessionInfo;
import com.herzen.practice.manager.ManagerModels.FinalStats;
import com.herzen.practice.manager.ManagerModels.SessionProgressInfo;
import com.herzen.practice.session.SessionEvent;
import com.herzen.practice.session.SessionModels.Performance;
import com.herzen.practice.session.SessionModels.SessionView;
import com.herzen.practice.session.SessionStore;
import com.herzen.practice.session.SessionStoreFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Keeps one {@link SessionStore} per content type and mirrors their lifecycle into the
 * {@link SessionManager}, so that only one session is active at a time and every completed
 * session is archived with stats taken from its store.
 */
@Slf4j
@Service
public class SessionCoordinator {
    private final SessionManager manager;
    private final Map<ContentType, SessionStore> stores = new EnumMap<>(ContentType.class);

    public SessionCoordinator(SessionManager manager, SessionStoreFactory factory) {
        this.manager = manager;
        for (ContentType type : ContentType.values()) {
            SessionStore store = factory.create(type);
            store.addListener(this::onStoreEvent);
            stores.put(type, store);
        }
    }

    public SessionStore store(ContentType type) {
        return stores.get(type);
    }

    /**
     * Ends any running session, registers the new one with the manager and starts its store.
     * A store that fails to start leaves no active session behind.
     */
    public SessionView startSession(ContentType type, SessionConfig config) {
        endRunningSessions();
        ActiveSessionInfo info = manager.startSession(type, config);
        SessionView view = store(type).startSession(info.id(), config);
        if (view.status() == SessionStatus.FAILED) {
            manager.abandonSession(info.id());
        }
        return view;
    }

    public SessionView switchSessionType(ContentType type) {
        SessionConfig config = SessionManager.defaultConfig(manager.getActiveSessionInfo().orElse(null));
        return startSession(type, config);
    }

    /**
     * Reloads the interrupted session, if any, into its store.
     */
    public Optional<SessionView> recoverSession() {
        Optional<ActiveSessionInfo> interrupted = manager.recoverSession();
        if (interrupted.isEmpty()) {
            return Optional.empty();
        }
        ActiveSessionInfo info = interrupted.get();
        SessionStore store = store(info.type());
        if (info.id().equals(store.getSessionId())) {
            return Optional.of(store.snapshot());
        }
        Optional<SessionView> restored = store.restore(info.id());
        if (restored.isEmpty()) {
            log.warn("No snapshot for interrupted session {}, dropping it", info.id());
            manager.abandonSession(info.id());
        }
        return restored;
    }

    /**
     * Ends any running session and reloads {@code sessionId} into the store for {@code type}.
     * A restored session that is still running becomes the manager's active session, so that
     * ending it later archives it.
     */
    public Optional<SessionView> restore(ContentType type, String sessionId) {
        endRunningSessions();
        Optional<SessionView> restored = store(type).restore(sessionId);
        restored.filter(view -> view.status() == SessionStatus.ACTIVE || view.status() == SessionStatus.PAUSED)
                .ifPresent(view -> manager.adoptSession(view.id(), type, view.config(), view.startedAt(), view.status(),
                        SessionProgressInfo.of(view.progress().currentIndex(), view.progress().totalQuestions())));
        return restored;
    }

    public Map<ContentType, SessionStatus> statuses() {
        Map<ContentType, SessionStatus> out = new LinkedHashMap<>();
        stores.forEach((type, store) -> out.put(type, store.getStatus()));
        return out;
    }

    private void endRunningSessions() {
        for (SessionStore store : stores.values()) {
            SessionStatus status = store.getStatus();
            if (status == SessionStatus.ACTIVE || status == SessionStatus.PAUSED) {
                store.endSession();
            }
        }
    }

    void onStoreEvent(SessionEvent event) {
        switch (event.type()) {
            case SESSION_STARTED, SESSION_RESTORED, NAVIGATED ->
                    manager.updateSessionProgress(event.sessionId(), event.currentIndex(), event.totalQuestions());
            case SESSION_PAUSED -> manager.pauseSession(event.sessionId());
            case SESSION_RESUMED -> manager.resumeSession(event.sessionId());
            case SESSION_COMPLETED -> manager.endSession(event.sessionId(), finalStats(store(event.contentType()).snapshot()));
            case SESSION_RESET -> manager.abandonSession(event.sessionId());
            default -> {
            }
        }
    }

    /**
     * accuracy is the mean answer score as a percentage, score the overall performance score.
     */
    static FinalStats finalStats(SessionView view) {
        Performance performance = view.performance();
        Map<String, Double> topicScores = new LinkedHashMap<>();
        performance.topicBreakdown().forEach((topic, stats) -> topicScores.put(topic, stats.averageScore()));
        boolean scored = view.progress().answeredCount() > 0;
        return new FinalStats(
                view.progress().timeSpent(),
                view.progress().answeredCount(),
                view.progress().averageScore() * 100,
                scored ? performance.overallScore() : null,
                topicScores);
    }
}
