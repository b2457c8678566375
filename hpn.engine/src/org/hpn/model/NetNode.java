package org.hpn.model;

/**
 * A node of the bipartite net graph: either a {@link Place} or a {@link Transition}.
 */
public interface NetNode {

    String getId();

    String getName();
}
