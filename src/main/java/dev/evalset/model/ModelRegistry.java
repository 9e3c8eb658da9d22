package dev.evalset.model;

import dev.evalset.ConfigurationException;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import javax.annotation.concurrent.ThreadSafe;
import lombok.extern.slf4j.Slf4j;

/**
 * Resolves {@link ModelRef}s to {@link Model} instances by provider prefix.
 *
 * <p>A registry is passed explicitly to each eval set; there is no process-wide registry. Models built
 * by a provider factory are kept in a bounded cache: while cached, every task targeting the same
 * model shares one instance, and a model evicted after {@value #MAX_CACHED_MODELS} more recently
 * used ones is built again on its next use. Models registered with {@link #register(Model)} are
 * never evicted.
 */
@Slf4j
@ThreadSafe
public final class ModelRegistry {
    static final int MAX_CACHED_MODELS = 64;

    private final Map<String, Function<ModelRef, Model>> providers = new ConcurrentHashMap<>();
    private final Map<ModelRef, Model> instances = new ConcurrentHashMap<>();
    private final LRUCache<ModelRef, Model> models = new LRUCache<>(MAX_CACHED_MODELS);

    private ModelRegistry() {}

    /** An empty registry. */
    public static ModelRegistry create() {
        return new ModelRegistry();
    }

    /** A registry with the built-in {@code mockllm} provider. */
    public static ModelRegistry withDefaults() {
        return create().register(MockLlm.PROVIDER, MockLlm::new);
    }

    /** Register (or replace) the factory used for every model of the given provider. */
    public ModelRegistry register(String provider, Function<ModelRef, Model> factory) {
        Objects.requireNonNull(provider);
        Objects.requireNonNull(factory);
        if (providers.put(provider, factory) != null) {
            log.debug("replaced model provider {}", provider);
        }
        return this;
    }

    /** Register a concrete model instance. Takes precedence over its provider's factory. */
    public ModelRegistry register(Model model) {
        instances.put(model.ref(), model);
        models.invalidate(model.ref());
        return this;
    }

    public boolean canResolve(ModelRef ref) {
        return instances.containsKey(ref) || providers.containsKey(ref.provider());
    }

    /**
     * @throws ConfigurationException if no provider is registered for the model
     */
    public Model resolve(ModelRef ref) {
        var instance = instances.get(ref);
        if (instance != null) {
            return instance;
        }
        return models.getOrCompute(
                ref,
                () -> {
                    var factory = providers.get(ref.provider());
                    if (factory == null) {
                        throw new ConfigurationException(
                                "no model provider registered for '%s' (known providers: %s)"
                                        .formatted(ref, providers.keySet()));
                    }
                    log.debug("resolving model {}", ref);
                    return Objects.requireNonNull(factory.apply(ref), "factory returned null");
                });
    }
}
