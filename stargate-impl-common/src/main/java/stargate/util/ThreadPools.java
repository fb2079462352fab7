package stargate.util;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

public class ThreadPools {
    private static final AtomicInteger THREAD_COUNTER = new AtomicInteger();

    private ThreadPools() {
    }

    /**
     * Creates a single-threaded scheduled executor whose tasks run strictly one at a
     * time, in submission order. Used as the event loop of a connection process or a
     * supervisor.
     *
     * @param name thread name prefix
     * @return the event loop
     */
    public static ScheduledExecutorService newEventLoop(String name) {
        return Executors.newSingleThreadScheduledExecutor(namedDaemon(name));
    }

    public static ThreadFactory namedDaemon(String prefix) {
        return r -> {
            Thread t = new Thread(r, prefix + "-" + THREAD_COUNTER.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
