package com.edgeroute.proxy.config;

/**
 * Settings for backend selection.
 */
public class BalancerConfig {

    /**
     * How the random strategy seeds its generator.
     */
    public enum RandomSeeding {
        /** New generator per selection, seeded from wall clock millis plus pid. */
        PER_SELECTION,
        /** One generator seeded at startup and shared by all selections. */
        PROCESS
    }

    /**
     * Stable identifier of this process instance, mixed into the round robin
     * index. Give each instance behind the same engine a distinct value.
     */
    private int workerId = 0;

    private RandomSeeding randomSeeding = RandomSeeding.PER_SELECTION;

    public int getWorkerId() {
        return workerId;
    }

    public void setWorkerId(int workerId) {
        this.workerId = workerId;
    }

    public RandomSeeding getRandomSeeding() {
        return randomSeeding;
    }

    public void setRandomSeeding(RandomSeeding randomSeeding) {
        this.randomSeeding = randomSeeding;
    }
}
