package com.nayem.strata.worker;

/**
 * A change to the set of layers behind one merged view.
 * <p>
 * Mutations that queue up while the worker is busy are coalesced into one
 * before the worker applies them, so a burst of refreshes costs a single
 * re-merge.
 * </p>
 *
 * @param <S> the layer state the mutation applies to
 */
public interface LayerMutation<S> {

    /**
     * The merged view this mutation targets. Only mutations with the same view
     * key can be coalesced.
     */
    String getViewKey();

    /**
     * Combines this mutation with one that arrived after it. The result must
     * have the same effect as applying both in order.
     */
    default LayerMutation<S> coalesce(LayerMutation<S> other) {
        return new ChainedLayerMutation<>(this, other);
    }

    /**
     * Applies the change to the layer state.
     */
    void apply(S state);
}
