package com.insightengine.core.logging;

import java.util.Map;

final class NoopInsightLogger implements InsightLogger {

    static final NoopInsightLogger INSTANCE = new NoopInsightLogger();

    private NoopInsightLogger() {
    }

    @Override
    public void info(String event, Map<String, ?> fields) {
        // discarded
    }

    @Override
    public void warn(String event, Map<String, ?> fields) {
        // discarded
    }

    @Override
    public void error(String event, Map<String, ?> fields, Throwable cause) {
        // discarded
    }
}
