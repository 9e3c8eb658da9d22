package dev.evalset.schedule;

import dev.evalset.model.ModelRef;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import javax.annotation.concurrent.Immutable;

/**
 * Duplicate-free sequence of models in first-encountered order, used as the key that batches
 * resolved tasks together.
 *
 * <p>Equality is by membership, so groups built by visiting the same models in a different order
 * are equal. Iteration order is always the encounter order of the instance at hand.
 */
@Immutable
public final class ModelGroup {
    private final Set<ModelRef> members;

    private ModelGroup(LinkedHashSet<ModelRef> members) {
        this.members = Collections.unmodifiableSet(members);
    }

    public static ModelGroup of(ModelRef... models) {
        return from(List.of(models));
    }

    public static ModelGroup from(Iterable<ModelRef> models) {
        var members = new LinkedHashSet<ModelRef>();
        models.forEach(members::add);
        return new ModelGroup(members);
    }

    /** models in encounter order */
    public List<ModelRef> models() {
        return new ArrayList<>(members);
    }

    public int size() {
        return members.size();
    }

    public boolean contains(ModelRef model) {
        return members.contains(model);
    }

    @Override
    public boolean equals(Object o) {
        // set equality ignores iteration order
        return this == o || (o instanceof ModelGroup other && members.equals(other.members));
    }

    @Override
    public int hashCode() {
        return members.hashCode();
    }

    @Override
    public String toString() {
        return members.toString();
    }
}
