package com.phillippitts.tapguard.config.logging;

import org.apache.logging.log4j.ThreadContext;
import org.springframework.core.task.TaskDecorator;

import java.util.Map;

/**
 * Carries the submitting thread's Log4j2 ThreadContext ({@code cycleId}, {@code trigger},
 * {@code requestId}) onto the thread that runs the task, and restores the worker's own
 * context afterwards.
 *
 * <p>Installed on the recovery executor. One-shot timers on the task scheduler wrap their
 * runnable with {@link #propagating(Runnable)} at schedule time.
 */
public final class ThreadContextTaskDecorator implements TaskDecorator {

    public static final ThreadContextTaskDecorator INSTANCE = new ThreadContextTaskDecorator();

    private ThreadContextTaskDecorator() {
    }

    public static Runnable propagating(Runnable task) {
        return INSTANCE.decorate(task);
    }

    @Override
    public Runnable decorate(Runnable runnable) {
        Map<String, String> captured = ThreadContext.getImmutableContext();
        return () -> {
            Map<String, String> previous = ThreadContext.getImmutableContext();
            try {
                ThreadContext.clearMap();
                if (captured != null && !captured.isEmpty()) {
                    ThreadContext.putAll(captured);
                }
                runnable.run();
            } finally {
                ThreadContext.clearMap();
                if (previous != null && !previous.isEmpty()) {
                    ThreadContext.putAll(previous);
                }
            }
        };
    }
}
