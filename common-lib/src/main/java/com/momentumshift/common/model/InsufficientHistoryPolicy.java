package com.momentumshift.common.model;

/**
 * What the scorer does when a participant's trailing window cannot be filled.
 * <ul>
 *   <li>FAIL: the whole moment is rejected, no result is emitted for anyone</li>
 *   <li>FLAG: the player is scored from whatever history exists, result flagged</li>
 *   <li>SKIP: the player is dropped, the other participants are still scored</li>
 * </ul>
 */
public enum InsufficientHistoryPolicy {
    FAIL,
    FLAG,
    SKIP
}
