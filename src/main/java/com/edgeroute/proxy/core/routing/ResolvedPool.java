package com.edgeroute.proxy.core.routing;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Health-filtered, weight-expanded backend pool of one route.
 * A target of weight {@code w} appears {@code w} times, in upstream list order.
 * An empty pool is a valid value; selecting from it fails.
 */
public final class ResolvedPool {

    private static final ResolvedPool EMPTY = new ResolvedPool(List.of());

    private final List<BackendTarget> slots;

    private ResolvedPool(List<BackendTarget> slots) {
        this.slots = slots;
    }

    /**
     * Expands healthy targets by weight.
     *
     * @param healthyTargets Targets that passed health filtering, in list order.
     * @return The expanded pool.
     */
    public static ResolvedPool expand(List<BackendTarget> healthyTargets) {
        List<BackendTarget> slots = new ArrayList<>();
        for (BackendTarget target : healthyTargets) {
            for (int i = 0; i < target.weight(); i++) {
                slots.add(target);
            }
        }
        return slots.isEmpty() ? EMPTY : new ResolvedPool(Collections.unmodifiableList(slots));
    }

    /**
     * Returns the shared empty pool.
     *
     * @return A pool with no targets.
     */
    public static ResolvedPool empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return slots.isEmpty();
    }

    public int size() {
        return slots.size();
    }

    /**
     * Returns the target at an expanded index.
     *
     * @param index Index in {@code [0, size())}.
     * @return The target occupying that slot.
     */
    public BackendTarget get(int index) {
        return slots.get(index);
    }

    /**
     * Returns all slots in order.
     *
     * @return Unmodifiable view of the expanded pool.
     */
    public List<BackendTarget> slots() {
        return slots;
    }

    @Override
    public String toString() {
        return slots.toString();
    }
}
