package io.github.linepicker.util;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

public final class ExecutorServiceUtil {
    private static final Logger logger = LogManager.getLogger(ExecutorServiceUtil.class);

    private ExecutorServiceUtil() {}

    /** Single worker thread; tasks run strictly in submission order. */
    public static ExecutorService newSingleThreadExecutor(String threadPrefix) {
        return Executors.newSingleThreadExecutor(createNamedThreadFactory(threadPrefix));
    }

    public static ThreadFactory createNamedThreadFactory(String prefix) {
        var counter = new AtomicInteger(0);
        return r -> {
            var thread = new Thread(r);
            thread.setName(prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            thread.setUncaughtExceptionHandler(
                    (t, ex) -> logger.error("Uncaught exception on thread {}", t.getName(), ex));
            return thread;
        };
    }
}
