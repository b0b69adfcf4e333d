package com.nayem.strata.worker;

import java.util.function.BiFunction;
import java.util.function.Consumer;

/**
 * A {@link LayerMutation} defined with lambdas.
 *
 * @param <S> the layer state type
 */
public class FunctionalLayerMutation<S> implements LayerMutation<S> {

    private final String viewKey;
    private final Consumer<S> applier;
    private final BiFunction<LayerMutation<S>, LayerMutation<S>, LayerMutation<S>> coalescer;

    private FunctionalLayerMutation(String viewKey, Consumer<S> applier,
            BiFunction<LayerMutation<S>, LayerMutation<S>, LayerMutation<S>> coalescer) {
        this.viewKey = viewKey;
        this.applier = applier;
        this.coalescer = coalescer;
    }

    /**
     * A mutation that, when a later one is queued behind it, runs both in
     * order.
     */
    public static <S> FunctionalLayerMutation<S> of(String viewKey, Consumer<S> applier) {
        return new FunctionalLayerMutation<>(viewKey, applier, null);
    }

    /**
     * A mutation whose {@code coalescer} decides how it absorbs a later one,
     * for instance by dropping an earlier load of the same source.
     */
    public static <S> FunctionalLayerMutation<S> of(String viewKey, Consumer<S> applier,
            BiFunction<LayerMutation<S>, LayerMutation<S>, LayerMutation<S>> coalescer) {
        return new FunctionalLayerMutation<>(viewKey, applier, coalescer);
    }

    @Override
    public String getViewKey() {
        return viewKey;
    }

    @Override
    public LayerMutation<S> coalesce(LayerMutation<S> other) {
        if (coalescer == null) {
            return new ChainedLayerMutation<>(this, other);
        }
        return coalescer.apply(this, other);
    }

    @Override
    public void apply(S state) {
        applier.accept(state);
    }
}
