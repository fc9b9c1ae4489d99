package com.slashsync.common.logging;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * SLF4J wrapper that tags every line with a subsystem path and a fixed
 * context.
 *
 * <pre>
 * SubsystemLogger log = SubsystemLogger.create("sync").child("guild").with("scope", scope);
 * log.info("Synced commands", Map.of("created", 2));
 * // [sync/guild] Synced commands {scope=guild:42, created=2}
 * </pre>
 *
 * The subsystem and every context entry are also put into the MDC for the
 * duration of the call, context keys prefixed with {@code slashsync.}.
 */
public final class SubsystemLogger {

    static final String MDC_SUBSYSTEM = "subsystem";
    static final String MDC_PREFIX = "slashsync.";

    private final String subsystem;
    private final Map<String, Object> context;
    private final Logger logger;

    private SubsystemLogger(String subsystem, Map<String, Object> context) {
        this.subsystem = subsystem;
        this.context = context;
        // logger name follows the path so logback can tune each subsystem
        this.logger = LoggerFactory.getLogger("slashsync." + subsystem.replace('/', '.'));
    }

    public static SubsystemLogger create(String subsystem) {
        return new SubsystemLogger(subsystem, Map.of());
    }

    /**
     * Logger for a nested subsystem, e.g. {@code sync} to {@code sync/guild}.
     * The context is inherited.
     */
    public SubsystemLogger child(String name) {
        return new SubsystemLogger(subsystem + "/" + name, context);
    }

    /**
     * Logger with one more context entry.
     */
    public SubsystemLogger with(String key, Object value) {
        Map<String, Object> extended = new LinkedHashMap<>(context);
        extended.put(key, value);
        return new SubsystemLogger(subsystem, Collections.unmodifiableMap(extended));
    }

    public String getSubsystem() {
        return subsystem;
    }

    public Map<String, Object> getContext() {
        return context;
    }

    public void debug(String message) {
        emit(LogLevel.DEBUG, message, null, null);
    }

    public void debug(String message, Map<String, Object> meta) {
        emit(LogLevel.DEBUG, message, meta, null);
    }

    public void info(String message) {
        emit(LogLevel.INFO, message, null, null);
    }

    public void info(String message, Map<String, Object> meta) {
        emit(LogLevel.INFO, message, meta, null);
    }

    public void warn(String message) {
        emit(LogLevel.WARN, message, null, null);
    }

    public void warn(String message, Map<String, Object> meta) {
        emit(LogLevel.WARN, message, meta, null);
    }

    public void error(String message, Map<String, Object> meta) {
        emit(LogLevel.ERROR, message, meta, null);
    }

    public void error(String message, Throwable t) {
        emit(LogLevel.ERROR, message, null, t);
    }

    public boolean isEnabled(LogLevel level) {
        return switch (level) {
            case DEBUG -> logger.isDebugEnabled();
            case INFO -> logger.isInfoEnabled();
            case WARN -> logger.isWarnEnabled();
            case ERROR -> logger.isErrorEnabled();
        };
    }

    private void emit(LogLevel level, String message, Map<String, Object> meta, Throwable t) {
        if (!isEnabled(level))
            return;
        String formatted = formatMessage(message, meta);
        MDC.put(MDC_SUBSYSTEM, subsystem);
        context.forEach((key, value) -> MDC.put(MDC_PREFIX + key, String.valueOf(value)));
        try {
            switch (level) {
                case DEBUG -> logger.debug(formatted, t);
                case INFO -> logger.info(formatted, t);
                case WARN -> logger.warn(formatted, t);
                case ERROR -> logger.error(formatted, t);
            }
        } finally {
            MDC.remove(MDC_SUBSYSTEM);
            context.keySet().forEach(key -> MDC.remove(MDC_PREFIX + key));
        }
    }

    /**
     * {@code [subsystem] message {context..., meta...}}; meta wins on key
     * clashes.
     */
    String formatMessage(String message, Map<String, Object> meta) {
        Map<String, Object> fields = new LinkedHashMap<>(context);
        if (meta != null) {
            fields.putAll(meta);
        }
        StringBuilder sb = new StringBuilder("[").append(subsystem).append("] ").append(message);
        if (!fields.isEmpty()) {
            StringBuilder joined = new StringBuilder();
            fields.forEach((key, value) -> {
                if (joined.length() > 0)
                    joined.append(", ");
                joined.append(key).append('=').append(value);
            });
            sb.append(" {").append(joined).append('}');
        }
        return sb.toString();
    }
}
