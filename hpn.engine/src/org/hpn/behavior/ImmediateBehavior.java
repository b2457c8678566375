package org.hpn.behavior;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.log4j.Logger;
import org.hpn.config.EngineSettings;
import org.hpn.constants.EngineConstants;
import org.hpn.exceptions.BehaviorConfigurationException;
import org.hpn.model.Arc;
import org.hpn.model.ArcKind;
import org.hpn.model.Place;
import org.hpn.model.SimulationContext;
import org.hpn.model.Transition;
import org.hpn.model.TransitionType;

/**
 * Immediate (classical) firing: enabled purely by the current marking,
 * fires in zero time, moves each arc's weight once.
 *
 * Guards of immediate transitions are left to the driver.
 */
public class ImmediateBehavior extends FiringBehavior {

    private static final Logger logger = Logger.getLogger(ImmediateBehavior.class);

    public ImmediateBehavior(Transition transition, SimulationContext context, EngineSettings settings)
            throws BehaviorConfigurationException {
        super(transition, context, settings, false);
    }

    public ImmediateBehavior(Transition transition, SimulationContext context)
            throws BehaviorConfigurationException {
        this(transition, context, EngineSettings.defaults());
    }

    @Override
    public EnablementResult canFire() {
        List<Arc> inputArcs = getInputArcs();
        EnablementResult failure = checkInputArcs(inputArcs, 1, EngineConstants.REASON_INSUFFICIENT_TOKENS);
        if (failure != null) {
            return failure;
        }
        if (inputArcs.isEmpty()) {
            return EnablementResult.enabled(EngineConstants.REASON_ENABLED_NO_INPUTS);
        }
        if (transition.isSource()) {
            return EnablementResult.enabled(EngineConstants.REASON_ENABLED_SOURCE);
        }
        return EnablementResult.enabled(EngineConstants.REASON_ENABLED);
    }

    @Override
    public FiringResult fire(List<Arc> inputArcs, List<Arc> outputArcs) {
        try {
            FiringResult.Builder builder = resultBuilder().mode(EngineConstants.MODE_LOGICAL);
            Map<String, Double> consumed = new LinkedHashMap<>();
            Map<String, Double> produced = new LinkedHashMap<>();

            EnablementResult failure = transferTokens(inputArcs, outputArcs, 1,
                EngineConstants.REASON_INSUFFICIENT_TOKENS, consumed, produced);
            if (failure != null) {
                return reject(builder, failure.getReason());
            }

            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("transitionType", getTransitionType().getTag());
            recordEvent(EngineConstants.MODE_LOGICAL, consumed, produced, metadata);

            logger.debug(String.format("%s fired: consumed=%s, produced=%s", transition.getId(), consumed, produced));
            return builder.consumed(consumed).produced(produced)
                .detail("transitionType", getTransitionType().getTag())
                .success();
        } catch (RuntimeException e) {
            return errorResult("fire", e);
        }
    }

    /**
     * Required and available tokens per input place, keyed by place id
     */
    public Map<String, Map<String, Object>> getEnablementInfo() {
        Map<String, Map<String, Object>> info = new LinkedHashMap<>();
        for (Arc arc : getInputArcs()) {
            Place place = arc.getSourcePlace();
            if (place == null) {
                continue;
            }
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("kind", arc.getKind().getTag());
            entry.put("required", arc.getWeight());
            entry.put("available", place.getTokens());
            boolean satisfied;
            if (arc.getKind() == ArcKind.INHIBITOR) {
                satisfied = place.getTokens() < arc.getWeight();
            } else if (arc.getKind() == ArcKind.NORMAL && transition.isSource()) {
                satisfied = true;
            } else {
                satisfied = place.getTokens() >= arc.getWeight();
            }
            entry.put("sufficient", satisfied);
            info.put(place.getId(), entry);
        }
        return info;
    }

    @Override
    public String getTypeName() {
        return "Immediate";
    }

    @Override
    public TransitionType getTransitionType() {
        return TransitionType.IMMEDIATE;
    }
}
