package dev.evalset.run;

import io.opentelemetry.api.common.AttributeKey;

/** Span attribute keys shared by the runner and the task executor. */
final class TraceAttributes {
    static final AttributeKey<String> TASK = AttributeKey.stringKey("evalset.task");
    static final AttributeKey<String> MODEL = AttributeKey.stringKey("evalset.model");
    static final AttributeKey<String> STATUS = AttributeKey.stringKey("evalset.status");
    static final AttributeKey<Long> ROUND = AttributeKey.longKey("evalset.round");
    static final AttributeKey<Long> SEQUENCE = AttributeKey.longKey("evalset.sequence");
    static final AttributeKey<Long> ATTEMPT = AttributeKey.longKey("evalset.attempt");
    static final AttributeKey<String> LOG_DIR = AttributeKey.stringKey("evalset.log_dir");

    private TraceAttributes() {}
}
