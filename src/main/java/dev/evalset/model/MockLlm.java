package dev.evalset.model;

import java.util.Objects;
import java.util.function.UnaryOperator;

/** In-process model which answers every input without any network access. Used for tests. */
public final class MockLlm implements Model {
    public static final String PROVIDER = "mockllm";

    private final ModelRef ref;
    private final UnaryOperator<String> responder;

    public MockLlm(ModelRef ref) {
        this(ref, input -> "Default output from " + ref.id());
    }

    public MockLlm(ModelRef ref, UnaryOperator<String> responder) {
        this.ref = Objects.requireNonNull(ref);
        this.responder = Objects.requireNonNull(responder);
    }

    @Override
    public ModelRef ref() {
        return ref;
    }

    @Override
    public String generate(String input) {
        return responder.apply(input);
    }
}
