package org.hpn.model;

import java.util.Objects;

/**
 * Directed, weighted arc between a place and a transition.
 *
 * Exactly one endpoint is a {@link Place}; the weight is positive and finite.
 */
public class Arc {

    private final NetNode source;
    private final NetNode target;
    private final double weight;
    private final ArcKind kind;

    public Arc(NetNode source, NetNode target, double weight, ArcKind kind) {
        this.source = Objects.requireNonNull(source, "source cannot be null");
        this.target = Objects.requireNonNull(target, "target cannot be null");
        if ((source instanceof Place) == (target instanceof Place)) {
            throw new IllegalArgumentException(String.format(
                "Arc %s -> %s must connect a place and a transition", source.getId(), target.getId()));
        }
        if (!(weight > 0) || Double.isInfinite(weight)) {
            throw new IllegalArgumentException(String.format(
                "Arc %s -> %s has invalid weight %s", source.getId(), target.getId(), weight));
        }
        kind = kind != null ? kind : ArcKind.NORMAL;
        if (kind != ArcKind.NORMAL && !(source instanceof Place)) {
            throw new IllegalArgumentException(String.format(
                "%s arc %s -> %s must start at a place", kind.getTag(), source.getId(), target.getId()));
        }
        this.weight = weight;
        this.kind = kind;
    }

    public Arc(NetNode source, NetNode target, double weight) {
        this(source, target, weight, ArcKind.NORMAL);
    }

    public NetNode getSource() {
        return source;
    }

    public NetNode getTarget() {
        return target;
    }

    public double getWeight() {
        return weight;
    }

    public ArcKind getKind() {
        return kind;
    }

    /**
     * @return the source as a place, or null when the arc starts at a transition
     */
    public Place getSourcePlace() {
        return source instanceof Place ? (Place) source : null;
    }

    /**
     * @return the target as a place, or null when the arc ends at a transition
     */
    public Place getTargetPlace() {
        return target instanceof Place ? (Place) target : null;
    }

    @Override
    public String toString() {
        return String.format("Arc[%s -> %s, weight=%s, kind=%s]",
            source.getId(), target.getId(), weight, kind.getTag());
    }
}
