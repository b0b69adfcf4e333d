package com.nayem.strata.worker;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FunctionalLayerMutationTest {

    @Test
    void testSimpleMutationAppliesLogic() {
        List<String> layers = new ArrayList<>();
        FunctionalLayerMutation<List<String>> mutation = FunctionalLayerMutation.of("view", state -> state.add("core"));

        assertEquals("view", mutation.getViewKey());
        mutation.apply(layers);
        assertEquals(List.of("core"), layers);
    }

    @Test
    void testDefaultCoalescingChainsBothInOrder() {
        FunctionalLayerMutation<List<String>> first = FunctionalLayerMutation.of("view", state -> state.add("core"));
        FunctionalLayerMutation<List<String>> second = FunctionalLayerMutation.of("view", state -> state.add("ios"));

        LayerMutation<List<String>> chained = first.coalesce(second);
        assertTrue(chained instanceof ChainedLayerMutation);
        assertEquals("view", chained.getViewKey());

        List<String> layers = new ArrayList<>();
        chained.apply(layers);
        assertEquals(List.of("core", "ios"), layers);
    }

    @Test
    void testSupersedingCoalescerKeepsOnlyTheLaterMutation() {
        FunctionalLayerMutation<List<String>> stale = FunctionalLayerMutation.of("view",
                state -> state.add("ios@1"),
                (current, next) -> next);
        FunctionalLayerMutation<List<String>> fresh = FunctionalLayerMutation.of("view", state -> state.add("ios@2"));

        LayerMutation<List<String>> merged = stale.coalesce(fresh);
        assertSame(fresh, merged);

        List<String> layers = new ArrayList<>();
        merged.apply(layers);
        assertEquals(List.of("ios@2"), layers);
    }
}
