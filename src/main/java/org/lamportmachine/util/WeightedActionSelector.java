package org.lamportmachine.util;

import org.lamportmachine.interfaces.ActionSelector;
import org.lamportmachine.machine.Action;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Random;

/**
 * Weighted choice over the four local actions.
 * <p>
 * Each action owns a contiguous slice of {@code [0, totalWeight)}; a uniform draw
 * in that range selects the action whose slice contains it. The slices follow
 * {@link Action} declaration order, so the mapping can be checked with
 * {@link #select(int)} without touching the random source.
 * </p>
 */
public final class WeightedActionSelector implements ActionSelector {

    /** Resolution used when weights are derived from a probability. */
    static final int UNITS = 1000;

    private final Map<Action, Integer> weights;
    private final int totalWeight;
    private final Random random;

    public WeightedActionSelector(Map<Action, Integer> weights, Random random) {
        EnumMap<Action, Integer> copy = new EnumMap<>(Action.class);
        int total = 0;
        for (Action a : Action.values()) {
            int w = weights.getOrDefault(a, 0);
            if (w < 0) {
                throw new IllegalArgumentException("negative weight for " + a + ": " + w);
            }
            copy.put(a, w);
            total += w;
        }
        if (total <= 0) {
            throw new IllegalArgumentException("at least one action needs a positive weight");
        }
        this.weights = Collections.unmodifiableMap(copy);
        this.totalWeight = total;
        this.random = random;
    }

    /**
     * Builds a selector where the internal step has the given probability and
     * the remainder is split evenly across the three send actions.
     * A probability of 0.7 reproduces the classic 1-in-10 draw per send kind.
     */
    public static WeightedActionSelector withInternalProbability(double internalProbability, Random random) {
        if (Double.isNaN(internalProbability) || internalProbability < 0.0 || internalProbability > 1.0) {
            throw new IllegalArgumentException("internal probability must be in [0,1]: " + internalProbability);
        }
        int internal = (int) Math.round(internalProbability * UNITS);
        int remaining = UNITS - internal;
        int each = remaining / 3;

        Map<Action, Integer> w = new EnumMap<>(Action.class);
        w.put(Action.SEND_ONE, each + remaining % 3);
        w.put(Action.SEND_OTHER, each);
        w.put(Action.BROADCAST, each);
        w.put(Action.INTERNAL, internal);
        return new WeightedActionSelector(w, random);
    }

    @Override
    public Action next() {
        return select(random.nextInt(totalWeight));
    }

    /**
     * Maps a draw in {@code [0, totalWeight)} to its action.
     */
    public Action select(int draw) {
        if (draw < 0 || draw >= totalWeight) {
            throw new IllegalArgumentException("draw out of range [0," + totalWeight + "): " + draw);
        }
        int upper = 0;
        for (Map.Entry<Action, Integer> e : weights.entrySet()) {
            upper += e.getValue();
            if (draw < upper) {
                return e.getKey();
            }
        }
        throw new IllegalStateException("unreachable: draw " + draw);
    }

    public double probability(Action action) {
        return weights.get(action) / (double) totalWeight;
    }

    public int totalWeight() {
        return totalWeight;
    }
}
