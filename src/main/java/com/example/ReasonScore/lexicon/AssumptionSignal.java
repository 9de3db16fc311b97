package com.example.ReasonScore.lexicon;

/**
 * Wording that raises or lowers the risk carried by an assumption.
 */
public enum AssumptionSignal {
    HIGH_RISK,
    LOW_RISK,
    UNCERTAINTY
}
