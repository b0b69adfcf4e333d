package com.nayem.strata.worker;

/**
 * Applies two mutations in order.
 */
public class ChainedLayerMutation<S> implements LayerMutation<S> {

    private final LayerMutation<S> first;
    private final LayerMutation<S> second;

    public ChainedLayerMutation(LayerMutation<S> first, LayerMutation<S> second) {
        this.first = first;
        this.second = second;
    }

    @Override
    public String getViewKey() {
        return first.getViewKey();
    }

    @Override
    public void apply(S state) {
        first.apply(state);
        second.apply(state);
    }
}
