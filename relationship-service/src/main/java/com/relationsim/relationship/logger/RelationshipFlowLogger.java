package com.relationsim.relationship.logger;

import com.relationsim.common.model.PersonalityState;
import com.relationsim.common.model.ResponseModifiers;
import com.relationsim.common.trace.SessionContextUtil;
import com.relationsim.relationship.persistence.LoadResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Signal;

import java.util.function.Consumer;

/**
 * Observability for the life of a relationship session. Pure side effects; never changes
 * what the coordinator does.
 *
 * <p>Stages:
 * <ol>
 *   <li>{@link #STATE_LOADED}         : saved state restored or defaults applied</li>
 *   <li>{@link #CONCURRENCY_OVERFLOW} : submission queue full</li>
 *   <li>{@link #BATCH_APPLIED}        : queued actions applied under the write lock</li>
 *   <li>{@link #STATE_SAVED}          : asynchronous save finished</li>
 * </ol>
 *
 * <p>Usage with {@code doOnEach} (reads the session id from the Reactor Context):
 * <pre>
 *     .doOnEach(flowLogger.stage(RelationshipFlowLogger.STATE_SAVED))
 * </pre>
 */
@Component
public class RelationshipFlowLogger {

    private static final Logger log = LoggerFactory.getLogger(RelationshipFlowLogger.class);

    public static final String STATE_LOADED         = "STATE_LOADED";
    public static final String CONCURRENCY_OVERFLOW = "CONCURRENCY_OVERFLOW";
    public static final String BATCH_APPLIED        = "BATCH_APPLIED";
    public static final String STATE_SAVED          = "STATE_SAVED";

    /**
     * Returns a {@code doOnEach} consumer that logs {@code stageName} on each {@code onNext}.
     * The session id is bridged from the Reactor Context into MDC for the log call only.
     */
    public <T> Consumer<Signal<T>> stage(String stageName) {
        return signal -> {
            if (!signal.isOnNext()) return;
            String sessionId = SessionContextUtil.getSessionId(signal.getContextView());
            SessionContextUtil.withMdc(sessionId, () ->
                log.info("[RelationshipFlow] stage={} result={} sessionId={}", stageName, signal.get(), sessionId)
            );
        };
    }

    public void logLoad(LoadResult result, String sessionId) {
        SessionContextUtil.withMdc(sessionId, () -> {
            if (result.isDefaulted() && result.error() != null) {
                log.warn("[RelationshipFlow] stage={} status={} error={} sessionId={}",
                    STATE_LOADED, result.status(), result.error(), sessionId);
            } else {
                log.info("[RelationshipFlow] stage={} status={} trust={} resentment={} sessionId={}",
                    STATE_LOADED, result.status(), result.snapshot().trustScore(),
                    result.snapshot().resentmentScore(), sessionId);
            }
        });
    }

    public void logOverflow(int queueDepth, long overflowCount, String sessionId) {
        SessionContextUtil.withMdc(sessionId, () ->
            log.warn("[RelationshipFlow] stage={} queueDepth={} overflowCount={} sessionId={}",
                CONCURRENCY_OVERFLOW, queueDepth, overflowCount, sessionId)
        );
    }

    /**
     * Compact summary after a batch: sizes, the consolidated scores and the modifiers handed
     * to the dialogue layer.
     */
    public void logBatch(int submitted, int accepted, PersonalityState state,
                         ResponseModifiers modifiers, String sessionId) {
        SessionContextUtil.withMdc(sessionId, () ->
            log.info("[RelationshipFlow] stage={} submitted={} accepted={} trust={} resentment={} "
                     + "withdrawal={} length={} initiation={} cooperation={} bias={} sessionId={}",
                     BATCH_APPLIED, submitted, accepted,
                     state.trustScore(), state.resentmentScore(), state.withdrawalSeverity(),
                     modifiers.responseLengthMultiplier(), modifiers.initiationProbability(),
                     modifiers.cooperationLevel(), modifiers.interpretationBias(), sessionId)
        );
    }
}
