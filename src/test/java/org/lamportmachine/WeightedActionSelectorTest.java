package org.lamportmachine;

import org.lamportmachine.machine.Action;
import org.lamportmachine.util.WeightedActionSelector;
import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.Map;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class WeightedActionSelectorTest {

    @Test
    void defaultProbabilityGivesOneInTenPerSendKind() {
        WeightedActionSelector s = WeightedActionSelector.withInternalProbability(0.7, new Random(1));
        assertEquals(0.1, s.probability(Action.SEND_ONE), 1e-9);
        assertEquals(0.1, s.probability(Action.SEND_OTHER), 1e-9);
        assertEquals(0.1, s.probability(Action.BROADCAST), 1e-9);
        assertEquals(0.7, s.probability(Action.INTERNAL), 1e-9);
    }

    @Test
    void drawsMapToContiguousSlicesInDeclarationOrder() {
        Map<Action, Integer> w = new EnumMap<>(Action.class);
        w.put(Action.SEND_ONE, 1);
        w.put(Action.SEND_OTHER, 1);
        w.put(Action.BROADCAST, 1);
        w.put(Action.INTERNAL, 7);
        WeightedActionSelector s = new WeightedActionSelector(w, new Random(1));

        assertEquals(10, s.totalWeight());
        assertEquals(Action.SEND_ONE, s.select(0));
        assertEquals(Action.SEND_OTHER, s.select(1));
        assertEquals(Action.BROADCAST, s.select(2));
        for (int d = 3; d < 10; d++) {
            assertEquals(Action.INTERNAL, s.select(d));
        }
        assertThrows(IllegalArgumentException.class, () -> s.select(10));
        assertThrows(IllegalArgumentException.class, () -> s.select(-1));
    }

    @Test
    void zeroWeightActionsAreNeverChosen() {
        WeightedActionSelector s = WeightedActionSelector.withInternalProbability(1.0, new Random(42));
        for (int i = 0; i < 1_000; i++) {
            assertEquals(Action.INTERNAL, s.next());
        }
    }

    @Test
    void observedFrequenciesFollowWeights() {
        WeightedActionSelector s = WeightedActionSelector.withInternalProbability(0.7, new Random(7));
        Map<Action, Integer> seen = new EnumMap<>(Action.class);
        int draws = 100_000;
        for (int i = 0; i < draws; i++) {
            seen.merge(s.next(), 1, Integer::sum);
        }
        assertEquals(0.7, seen.get(Action.INTERNAL) / (double) draws, 0.01);
        assertEquals(0.1, seen.get(Action.BROADCAST) / (double) draws, 0.01);
    }

    @Test
    void invalidWeightsAreRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> WeightedActionSelector.withInternalProbability(1.5, new Random()));
        assertThrows(IllegalArgumentException.class,
                () -> new WeightedActionSelector(new EnumMap<>(Action.class), new Random()));
        Map<Action, Integer> negative = new EnumMap<>(Action.class);
        negative.put(Action.INTERNAL, -1);
        assertThrows(IllegalArgumentException.class, () -> new WeightedActionSelector(negative, new Random()));
    }
}
