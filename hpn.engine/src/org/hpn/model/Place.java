package org.hpn.model;

import java.util.Objects;

/**
 * Place - holds a non-negative, real-valued token count
 *
 * Tokens are real-valued so the same place can be marked by discrete firings
 * (whole arc weights) and by continuous flow (fractions of a token per step).
 *
 * Expression symbol:
 * ==================
 * Rate and guard expressions address a place by its symbol: the id itself
 * when it already starts with "P" (e.g. "P105"), otherwise "P" + id
 * (id "3" becomes "P3").
 */
public class Place implements NetNode {

    private final String id;
    private final String name;
    private double tokens;

    public Place(String id, String name, double tokens) {
        this.id = Objects.requireNonNull(id, "id cannot be null");
        this.name = name != null ? name : id;
        if (tokens < 0 || Double.isNaN(tokens)) {
            throw new IllegalArgumentException(
                String.format("Place %s cannot start with %s tokens", id, tokens));
        }
        this.tokens = tokens;
    }

    public Place(String id, double tokens) {
        this(id, null, tokens);
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public String getName() {
        return name;
    }

    public double getTokens() {
        return tokens;
    }

    public void setTokens(double tokens) {
        this.tokens = tokens;
    }

    /**
     * Stable symbol used in rate and guard expressions
     */
    public String getSymbol() {
        return symbolFor(id);
    }

    public static String symbolFor(String placeId) {
        return placeId.startsWith("P") ? placeId : "P" + placeId;
    }

    @Override
    public String toString() {
        return String.format("Place[%s '%s']: tokens=%s", id, name, tokens);
    }
}
