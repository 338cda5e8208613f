package com.herzen.practice.session;

import com.herzen.practice.config.SessionEngineProperties;
import com.herzen.practice.domain.DomainModels.ContentType;
import com.herzen.practice.evaluation.EvaluationCapability;
import com.herzen.practice.pool.QuestionPoolProvider;
import com.herzen.practice.snapshot.DurableSessionStore;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Random;
import java.util.concurrent.Executor;

@Component
public class SessionStoreFactory {
    private final QuestionPoolProvider pool;
    private final EvaluationCapability evaluator;
    private final DurableSessionStore durableStore;
    private final Executor evaluationExecutor;
    private final SessionEngineProperties properties;
    private final Clock clock;

    public SessionStoreFactory(QuestionPoolProvider pool,
                               EvaluationCapability evaluator,
                               DurableSessionStore durableStore,
                               @Qualifier("evaluationExecutor") Executor evaluationExecutor,
                               SessionEngineProperties properties,
                               Clock clock) {
        this.pool = pool;
        this.evaluator = evaluator;
        this.durableStore = durableStore;
        this.evaluationExecutor = evaluationExecutor;
        this.properties = properties;
        this.clock = clock;
    }

    public SessionStore create(ContentType contentType) {
        return new SessionStore(contentType, pool, evaluator, durableStore, evaluationExecutor, properties, clock, new Random());
    }
}
