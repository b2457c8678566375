package org.hpn.behavior;

/**
 * Scheduling record of a timed or stochastic transition.
 *
 * Lifecycle: empty, then enabled (enablement time set), then for stochastic
 * transitions scheduled (fire time, burst and rate sampled), then empty
 * again after a firing or {@link #clear()}.
 */
public class SchedulingState {

    private Double enablementTime;
    private Double scheduledFireTime;
    private Integer sampledBurst;
    private Double sampledRate;

    void enable(double time) {
        clear();
        this.enablementTime = time;
    }

    void schedule(double fireTime, int burst, double rate) {
        this.scheduledFireTime = fireTime;
        this.sampledBurst = burst;
        this.sampledRate = rate;
    }

    void setSampledBurst(int burst) {
        this.sampledBurst = burst;
    }

    void clear() {
        enablementTime = null;
        scheduledFireTime = null;
        sampledBurst = null;
        sampledRate = null;
    }

    public boolean isEnabled() {
        return enablementTime != null;
    }

    public boolean isScheduled() {
        return scheduledFireTime != null;
    }

    public Double getEnablementTime() {
        return enablementTime;
    }

    public Double getScheduledFireTime() {
        return scheduledFireTime;
    }

    public Integer getSampledBurst() {
        return sampledBurst;
    }

    public Double getSampledRate() {
        return sampledRate;
    }

    /**
     * Detached copy for callers outside the behavior
     */
    public SchedulingState snapshot() {
        SchedulingState copy = new SchedulingState();
        copy.enablementTime = enablementTime;
        copy.scheduledFireTime = scheduledFireTime;
        copy.sampledBurst = sampledBurst;
        copy.sampledRate = sampledRate;
        return copy;
    }

    @Override
    public String toString() {
        return String.format("SchedulingState[enabled=%s, fireTime=%s, burst=%s, rate=%s]",
            enablementTime, scheduledFireTime, sampledBurst, sampledRate);
    }
}
