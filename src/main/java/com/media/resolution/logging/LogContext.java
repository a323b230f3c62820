package com.media.resolution.logging;

import com.media.resolution.core.ResolutionContext;
import com.media.resolution.core.model.MediaEntry;
import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;

/**
 * AutoCloseable MDC wrapper for structured logging.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forPass(context)) {
 *     log.info("pass.completed resolved={}", count);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Tags log lines with the pass id, direction and media kind.
     */
    public static LogContext forPass(ResolutionContext context) {
        LogContext ctx = new LogContext();
        ctx.put("passId", context.getPassId());
        ctx.put("direction", context.getDirection().getLabel());
        ctx.put("mediaKind", context.getOptions().getMediaKind().getLabel());
        return ctx;
    }

    /**
     * Tags log lines with the source entry currently being resolved.
     */
    public static LogContext forSource(MediaEntry source) {
        LogContext ctx = new LogContext();
        ctx.put("source", source.getTitle());
        return ctx;
    }

    public LogContext with(String key, String value) {
        put(key, value);
        return this;
    }

    private void put(String key, String value) {
        keys.add(key);
        MDC.put(key, value);
    }

    @Override
    public void close() {
        for (String key : keys) {
            MDC.remove(key);
        }
        keys.clear();
    }
}
