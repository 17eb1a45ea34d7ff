package com.relationsim.common.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.util.context.ContextView;

/**
 * Carries the relationship session id into log lines.
 *
 * <p>Inside reactive pipelines the Reactor Context holds the id; MDC is only written
 * for the duration of a log statement and then restored.
 *
 * <pre>
 *     return SessionContextUtil.withSessionId(saveMono, sessionId);
 * </pre>
 */
public final class SessionContextUtil {

    public static final String SESSION_ID_KEY = "sessionId";

    private SessionContextUtil() {}

    public static <T> Mono<T> withSessionId(Mono<T> mono, String sessionId) {
        return mono.contextWrite(ctx -> ctx.put(SESSION_ID_KEY, sessionId));
    }

    /** Session id from the Reactor context, or {@code "unknown"}; never {@code null}. */
    public static String getSessionId(ContextView ctx) {
        return ctx.getOrDefault(SESSION_ID_KEY, "unknown");
    }

    /**
     * Runs {@code action} with {@code sessionId} bridged into MDC, restoring the previous
     * MDC value afterwards.
     */
    public static void withMdc(String sessionId, Runnable action) {
        String previous = MDC.get(SESSION_ID_KEY);
        MDC.put(SESSION_ID_KEY, sessionId);
        try {
            action.run();
        } finally {
            if (previous != null) {
                MDC.put(SESSION_ID_KEY, previous);
            } else {
                MDC.remove(SESSION_ID_KEY);
            }
        }
    }
}
