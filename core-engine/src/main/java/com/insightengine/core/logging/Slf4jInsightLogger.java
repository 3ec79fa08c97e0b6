package com.insightengine.core.logging;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.spi.LoggingEventBuilder;

import java.util.Map;
import java.util.Objects;

/**
 * {@link InsightLogger} backed by SLF4J.
 *
 * <p>
 * Fields are attached with the SLF4J 2 fluent API
 * ({@link LoggingEventBuilder#addKeyValue(String, Object)}) so that structured
 * backends receive them as key/value pairs rather than as message text.
 * </p>
 *
 * @since 1.0.0
 */
public final class Slf4jInsightLogger implements InsightLogger {

    private final Logger delegate;

    public Slf4jInsightLogger(Logger delegate) {
        this.delegate = Objects.requireNonNull(delegate, "Logger must not be null");
    }

    /**
     * @param owner class whose name is used as the logger category
     * @return logger for {@code owner}
     */
    public static Slf4jInsightLogger forClass(Class<?> owner) {
        return new Slf4jInsightLogger(LoggerFactory.getLogger(owner));
    }

    @Override
    public void info(String event, Map<String, ?> fields) {
        if (delegate.isInfoEnabled()) {
            withFields(delegate.atInfo(), fields).log(event);
        }
    }

    @Override
    public void warn(String event, Map<String, ?> fields) {
        if (delegate.isWarnEnabled()) {
            withFields(delegate.atWarn(), fields).log(event);
        }
    }

    @Override
    public void error(String event, Map<String, ?> fields, Throwable cause) {
        LoggingEventBuilder builder = withFields(delegate.atError(), fields);
        if (cause != null) {
            builder = builder.setCause(cause);
        }
        builder.log(event);
    }

    private static LoggingEventBuilder withFields(LoggingEventBuilder builder, Map<String, ?> fields) {
        if (fields == null) {
            return builder;
        }
        LoggingEventBuilder result = builder;
        for (Map.Entry<String, ?> field : fields.entrySet()) {
            result = result.addKeyValue(field.getKey(), field.getValue());
        }
        return result;
    }
}
