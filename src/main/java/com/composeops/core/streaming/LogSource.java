package com.composeops.core.streaming;

import java.util.function.Consumer;

/**
 * A finite or following feed of log output bound to one stream session.
 * <p>
 * Implementations push chunks to {@code chunks} in order and return when the feed ends.
 * The consumer itself throws {@link StreamCancelledException} once the session is cancelled,
 * so a source that blocks between chunks should also check the token or register a
 * cancellation callback that unblocks it. Throwing {@link StreamFailureException} ends the
 * session with that message; any other exception ends it with a generic error.
 */
@FunctionalInterface
public interface LogSource {

    void stream(Consumer<String> chunks, CancellationToken token) throws Exception;

    /**
     * Short label used for metrics and logging.
     */
    default String describe() {
        return "custom";
    }
}
