package com.tugochat.tugochat_api.engine;

/**
 * Engagement-weighted pull power.
 *
 * <pre>
 *   power = engagementRate * baseStrength * ln(uniquePullers + 1)
 * </pre>
 *
 * The rate term keeps small channels competitive; the log term still gives
 * larger absolute engagement a diminishing advantage. Both terms must stay.
 */
public final class FairnessFormula {

    private FairnessFormula() {
    }

    public static double pullPower(double engagementRate, int uniquePullers, double baseStrength) {
        return engagementRate * baseStrength * Math.log(uniquePullers + 1);
    }

    /** Positive values move the rope toward player1's goal (+boundary). */
    public static double displacement(double player1Power, double player2Power, double tickScale) {
        return (player1Power - player2Power) * tickScale;
    }

    public static double clamp(double position, double boundary) {
        return Math.max(-boundary, Math.min(boundary, position));
    }
}
