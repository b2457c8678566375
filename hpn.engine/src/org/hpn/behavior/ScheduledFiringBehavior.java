package org.hpn.behavior;

import org.hpn.config.EngineSettings;
import org.hpn.exceptions.BehaviorConfigurationException;
import org.hpn.exceptions.InvalidRateException;
import org.hpn.logger.TransitionEventLogger;
import org.hpn.model.SimulationContext;
import org.hpn.model.Transition;

/**
 * Base of behaviors that measure time since enablement (timed, stochastic).
 *
 * The driver calls {@link #setEnablementTime(double)} when the transition
 * becomes structurally enabled and {@link #clearEnablement()} when it stops
 * being enabled before firing. Until an enablement time is set the behavior
 * reports itself not enabled.
 */
public abstract class ScheduledFiringBehavior extends FiringBehavior {

    protected final SchedulingState schedulingState = new SchedulingState();

    protected ScheduledFiringBehavior(Transition transition, SimulationContext context, EngineSettings settings)
            throws BehaviorConfigurationException {
        super(transition, context, settings, true);
    }

    /**
     * Record that the transition became enabled at the given time
     *
     * @throws InvalidRateException when a stochastic rate evaluates to a
     *         non-positive or non-finite value; the state is left unchanged
     */
    public abstract void setEnablementTime(double time) throws InvalidRateException;

    /**
     * Discard all scheduling state, including any sampled delay and burst
     */
    public void clearEnablement() {
        boolean wasEnabled = schedulingState.isEnabled();
        schedulingState.clear();
        TransitionEventLogger eventLogger = getEventLogger();
        if (wasEnabled && eventLogger != null) {
            eventLogger.logEnablementCleared(transition.getId(), currentTime());
        }
    }

    /**
     * @return the last enablement time, or null when not enabled
     */
    public Double getEnablementTime() {
        return schedulingState.getEnablementTime();
    }

    /**
     * Copy of the current scheduling record
     */
    public SchedulingState getSchedulingState() {
        return schedulingState.snapshot();
    }

    protected void logEnablementSet(double time) {
        TransitionEventLogger eventLogger = getEventLogger();
        if (eventLogger != null) {
            eventLogger.logEnablementSet(transition.getId(), time);
        }
    }
}
