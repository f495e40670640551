package com.conduit.control;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Generation counter shared by a periodic task and its owner's shutdown. A tick remembers the
 * generation it started under and drops its results once {@link #close()} has bumped it.
 */
public class TickGuard {

    private final AtomicLong generation = new AtomicLong();
    private volatile boolean closed;

    /**
     * @return the generation to check against, or -1 when closed and the tick must not run
     */
    public long begin() {
        return closed ? -1 : generation.get();
    }

    public boolean isCurrent(long tickGeneration) {
        return !closed && tickGeneration >= 0 && generation.get() == tickGeneration;
    }

    public void close() {
        closed = true;
        generation.incrementAndGet();
    }

    public boolean isClosed() {
        return closed;
    }
}
