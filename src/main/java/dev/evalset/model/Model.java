package dev.evalset.model;

/**
 * A model backend. Implementations own transport, provider specific request translation and any
 * retrying of transient call failures.
 */
public interface Model {
    ModelRef ref();

    /**
     * Generate a completion for the given input.
     *
     * @throws Exception if the call fails. The failure is recorded against the sample being solved
     */
    String generate(String input) throws Exception;
}
