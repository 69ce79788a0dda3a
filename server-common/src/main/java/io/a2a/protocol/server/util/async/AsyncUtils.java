package io.a2a.protocol.server.util.async;

import mutiny.zero.BackpressureStrategy;
import mutiny.zero.TubeConfiguration;

public final class AsyncUtils {

    private AsyncUtils() {
    }

    /**
     * @return the configuration of the tubes backing the streaming publishers. Events are produced
     *         without regard to demand, so the buffer is unbounded and a slow subscriber receives every event.
     */
    public static TubeConfiguration createTubeConfig() {
        return new TubeConfiguration()
                .withBackpressureStrategy(BackpressureStrategy.UNBOUNDED_BUFFER);
    }
}
