package com.ryuqq.statecheck.core.config;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation signal for a model-checking run.
 *
 * <p>The explorer checks the token at every frontier pop. Once cancelled, the run stops
 * and returns a partial result with status {@code CANCELLED}. Cancelling is idempotent
 * and thread-safe; a token cannot be reset.</p>
 *
 * <pre>{@code
 * CancellationToken token = new CancellationToken();
 * CheckerConfig config = new CheckerConfig().withCancellationToken(token);
 *
 * Future<ExplorationResult> result = pool.submit(() -> checker.run(config));
 * token.cancel(); // from any thread
 * }</pre>
 *
 * @author Statecheck Team
 * @since 1.0.0
 */
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    /**
     * Creates a token nobody else holds, so it is never cancelled.
     *
     * @return fresh token
     */
    public static CancellationToken none() {
        return new CancellationToken();
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    @Override
    public String toString() {
        return "CancellationToken{cancelled=" + cancelled.get() + '}';
    }
}
