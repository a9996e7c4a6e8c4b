package org.squadplanner.engine.domain.model;

/**
 * One cell of the cost matrix with the components it was summed from.
 * Rest cells carry their whole value in {@code utilityCost}.
 */
public final class CellCost {

    private final double utilityCost;
    private final double shadowCost;
    private final double stabilityCost;
    private final double total;
    private final String forbiddenReason;

    private CellCost(double utilityCost, double shadowCost, double stabilityCost, double total,
                     String forbiddenReason) {
        this.utilityCost = utilityCost;
        this.shadowCost = shadowCost;
        this.stabilityCost = stabilityCost;
        this.total = total;
        this.forbiddenReason = forbiddenReason;
    }

    public static CellCost play(double utilityCost, double shadowCost, double stabilityCost) {
        return new CellCost(utilityCost, shadowCost, stabilityCost, utilityCost + shadowCost + stabilityCost, null);
    }

    public static CellCost rest(double restCost) {
        return new CellCost(restCost, 0.0, 0.0, restCost, null);
    }

    /**
     * Same components, total replaced by the forbidden cost.
     */
    public CellCost forbid(double forbiddenCost, String reason) {
        return new CellCost(utilityCost, shadowCost, stabilityCost, forbiddenCost, reason);
    }

    /**
     * Same components, total forced to {@code value}.
     */
    public CellCost pin(double value) {
        return new CellCost(utilityCost, shadowCost, stabilityCost, value, null);
    }

    public double getUtilityCost() {
        return utilityCost;
    }

    public double getShadowCost() {
        return shadowCost;
    }

    public double getStabilityCost() {
        return stabilityCost;
    }

    public double getTotal() {
        return total;
    }

    public boolean isForbidden() {
        return forbiddenReason != null;
    }

    public String getForbiddenReason() {
        return forbiddenReason;
    }

    @Override
    public String toString() {
        if (isForbidden()) {
            return "forbidden(" + forbiddenReason + ")";
        }
        return String.format("%.2f [u=%.2f s=%.2f st=%.2f]", total, utilityCost, shadowCost, stabilityCost);
    }
}
