package io.github.notecal.ingestion.audit;

import org.slf4j.Logger;
import org.slf4j.MDC;

public final class Log {

    public static final String EVENT_TYPE = "event.type";
    public static final String RUN_ID = "run.id";
    public static final String ITEM_ID = "item.id";

    private Log() {
    }

    public static void event(Logger logger, String eventType, String message, Object... args) {
        if (logger.isInfoEnabled()) {
            withEventType(eventType, () -> logger.info(message, args));
        }
    }

    public static void warn(Logger logger, String eventType, String message, Object... args) {
        if (logger.isWarnEnabled()) {
            withEventType(eventType, () -> logger.warn(message, args));
        }
    }

    public static void error(Logger logger, String eventType, String message, Throwable throwable) {
        if (logger.isErrorEnabled()) {
            withEventType(eventType, () -> logger.error(message, throwable));
        }
    }

    private static void withEventType(String eventType, Runnable call) {
        String previous = MDC.get(EVENT_TYPE);
        MDC.put(EVENT_TYPE, eventType);
        try {
            call.run();
        } finally {
            if (previous != null) {
                MDC.put(EVENT_TYPE, previous);
            } else {
                MDC.remove(EVENT_TYPE);
            }
        }
    }
}
