package org.example.helpdesk.config;

import lombok.extern.slf4j.Slf4j;

/**
 * Terminates the JVM when a thread dies from an exception nobody handled.
 *
 * <p>Request handling faults never get here: they are mapped to HTTP 500 by the
 * global exception handler.
 */
@Slf4j
public class FatalErrorHandler implements Thread.UncaughtExceptionHandler {

    /** Exit code used for every fatal termination. */
    public static final int EXIT_CODE = 1;

    private final Runnable terminator;

    public FatalErrorHandler() {
        this(() -> Runtime.getRuntime().exit(EXIT_CODE));
    }

    FatalErrorHandler(Runnable terminator) {
        this.terminator = terminator;
    }

    public static void install() {
        Thread.setDefaultUncaughtExceptionHandler(new FatalErrorHandler());
    }

    @Override
    public void uncaughtException(Thread thread, Throwable error) {
        log.error("💥 Uncaught exception in thread {}, shutting down", thread.getName(), error);
        terminator.run();
    }
}
