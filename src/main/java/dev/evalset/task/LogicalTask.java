package dev.evalset.task;

import dev.evalset.eval.Dataset;
import dev.evalset.eval.DatasetCase;
import dev.evalset.eval.Scorer;
import dev.evalset.eval.Solver;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * A benchmark definition, independent of the model it is evaluated against.
 *
 * <p>Its {@link #identity()} (name plus params) must be unique within one eval set.
 *
 * @param <INPUT> The type of sample input
 * @param <OUTPUT> The type of output produced by the solver
 */
@Getter
@Accessors(fluent = true)
public final class LogicalTask<INPUT, OUTPUT> {
    private final @Nonnull String name;
    private final @Nonnull TaskParams params;
    private final @Nonnull Dataset<INPUT, OUTPUT> dataset;
    private final @Nonnull Solver<INPUT, OUTPUT> solver;
    private final @Nonnull List<Scorer<INPUT, OUTPUT>> scorers;
    private final @Nonnull Optional<SandboxSpec> sandbox;
    private final @Nonnull Map<String, Object> metadata;

    private LogicalTask(Builder<INPUT, OUTPUT> builder) {
        this.name = builder.name;
        this.params = builder.params;
        this.dataset = builder.dataset;
        this.solver = builder.solver;
        this.scorers = List.copyOf(builder.scorers);
        this.sandbox = Optional.ofNullable(builder.sandbox);
        this.metadata = Map.copyOf(builder.metadata);
    }

    public TaskIdentity identity() {
        return new TaskIdentity(name, params);
    }

    @Override
    public String toString() {
        return identity().toString();
    }

    public static <INPUT, OUTPUT> Builder<INPUT, OUTPUT> builder() {
        return new Builder<>();
    }

    public static final class Builder<INPUT, OUTPUT> {
        private @Nullable String name;
        private @Nonnull TaskParams params = TaskParams.empty();
        private @Nonnull Dataset<INPUT, OUTPUT> dataset = Dataset.of(List.of());
        private @Nullable Solver<INPUT, OUTPUT> solver;
        private @Nonnull List<Scorer<INPUT, OUTPUT>> scorers = List.of();
        private @Nullable SandboxSpec sandbox;
        private @Nonnull Map<String, Object> metadata = Map.of();

        public LogicalTask<INPUT, OUTPUT> build() {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("task name is required");
            }
            Objects.requireNonNull(solver, "solver is required");
            return new LogicalTask<>(this);
        }

        public Builder<INPUT, OUTPUT> name(@Nonnull String name) {
            this.name = Objects.requireNonNull(name);
            return this;
        }

        public Builder<INPUT, OUTPUT> params(@Nonnull TaskParams params) {
            this.params = Objects.requireNonNull(params);
            return this;
        }

        public Builder<INPUT, OUTPUT> param(String key, @Nullable Object value) {
            this.params = params.with(key, value);
            return this;
        }

        public Builder<INPUT, OUTPUT> dataset(@Nonnull Dataset<INPUT, OUTPUT> dataset) {
            this.dataset = Objects.requireNonNull(dataset);
            return this;
        }

        @SafeVarargs
        public final Builder<INPUT, OUTPUT> cases(DatasetCase<INPUT, OUTPUT>... cases) {
            return dataset(Dataset.of(cases));
        }

        public Builder<INPUT, OUTPUT> solver(@Nonnull Solver<INPUT, OUTPUT> solver) {
            this.solver = Objects.requireNonNull(solver);
            return this;
        }

        @SafeVarargs
        public final Builder<INPUT, OUTPUT> scorers(Scorer<INPUT, OUTPUT>... scorers) {
            this.scorers = List.of(scorers);
            return this;
        }

        public Builder<INPUT, OUTPUT> sandbox(@Nullable SandboxSpec sandbox) {
            this.sandbox = sandbox;
            return this;
        }

        public Builder<INPUT, OUTPUT> metadata(Map<String, Object> metadata) {
            this.metadata = Map.copyOf(metadata);
            return this;
        }
    }
}
