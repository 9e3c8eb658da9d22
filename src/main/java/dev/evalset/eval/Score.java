package dev.evalset.eval;

/**
 * Individual metric value assigned by a scorer.
 *
 * @param name name of the metric. Often, but not necessarily, the scorer name
 * @param value how well the sample was solved, between 0.0 (inclusive) and 1.0 (inclusive)
 */
public record Score(String name, double value) {}
