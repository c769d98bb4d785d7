package com.momentumshift.common.exception;

/**
 * The trailing performance window for a participant could not be filled.
 * Recoverable: the configured policy decides whether to fail the moment,
 * skip the player or continue with a flagged low-confidence context.
 */
public class InsufficientHistoryException extends MssException {

    private final String playerId;
    private final int availableAppearances;
    private final int requiredAppearances;

    public InsufficientHistoryException(String playerId, int availableAppearances, int requiredAppearances) {
        super("ContextEnricher", "Insufficient history for player=" + playerId
            + " available=" + availableAppearances + " required=" + requiredAppearances);
        this.playerId = playerId;
        this.availableAppearances = availableAppearances;
        this.requiredAppearances = requiredAppearances;
    }

    public String getPlayerId() {
        return playerId;
    }

    public int getAvailableAppearances() {
        return availableAppearances;
    }

    public int getRequiredAppearances() {
        return requiredAppearances;
    }
}
