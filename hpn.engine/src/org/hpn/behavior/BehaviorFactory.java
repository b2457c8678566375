package org.hpn.behavior;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Random;
import java.util.Set;

import org.apache.log4j.Logger;
import org.hpn.config.EngineSettings;
import org.hpn.exceptions.BehaviorConfigurationException;
import org.hpn.logger.TransitionEventLogger;
import org.hpn.model.SimulationContext;
import org.hpn.model.Transition;
import org.hpn.model.TransitionType;

/**
 * Builds the firing behavior matching a transition's declared type.
 *
 * A transition without a type tag is continuous. An unknown tag fails with a
 * {@link BehaviorConfigurationException} naming the transition and the
 * supported types.
 *
 * All stochastic behaviors created by one factory share its random source,
 * so a configured seed reproduces a whole run.
 */
public class BehaviorFactory {

    private static final Logger logger = Logger.getLogger(BehaviorFactory.class);

    private final EngineSettings settings;
    private final Random random;

    public BehaviorFactory() {
        this(EngineSettings.load());
    }

    public BehaviorFactory(EngineSettings settings) {
        this(settings, settings.newRandom());
    }

    public BehaviorFactory(EngineSettings settings, Random random) {
        this.settings = settings;
        this.random = random;
    }

    public FiringBehavior createBehavior(Transition transition, SimulationContext context)
            throws BehaviorConfigurationException {
        TransitionType type = TransitionType.lookup(transition.getTransitionType());
        if (type == null) {
            throw new BehaviorConfigurationException(
                String.format("Unknown transition type '%s' for %s, supported types: %s",
                    transition.getTransitionType(), transition.getId(), TransitionType.supportedTags()),
                transition.getId(), "transitionType", transition.getTransitionType());
        }

        FiringBehavior behavior;
        switch (type) {
            case IMMEDIATE:
                behavior = new ImmediateBehavior(transition, context, settings);
                break;
            case TIMED:
                behavior = new TimedBehavior(transition, context, settings);
                break;
            case STOCHASTIC:
                behavior = new StochasticBehavior(transition, context, settings, random);
                break;
            case CONTINUOUS:
                behavior = new ContinuousBehavior(transition, context, settings);
                break;
            default:
                throw new IllegalStateException("Unhandled transition type " + type);
        }

        TransitionEventLogger eventLogger = context.getEventLogger();
        if (eventLogger != null) {
            eventLogger.logBehaviorCreated(transition.getId(), behavior.getTypeName());
        }
        logger.debug(String.format("Created %s behavior for %s", behavior.getTypeName(), transition.getId()));
        return behavior;
    }

    public static Set<TransitionType> getSupportedTypes() {
        return Collections.unmodifiableSet(EnumSet.allOf(TransitionType.class));
    }

    public EngineSettings getSettings() {
        return settings;
    }
}
