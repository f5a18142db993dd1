package com.phillippitts.plantdx.domain;

/**
 * Agreement summary produced by the consensus engine.
 *
 * @param agreementLevel         fraction of contributing providers voting for the winner
 * @param conflictingPredictions true when another disease id also received votes
 * @param reliabilityScore       agreement level discounted by the least confident provider
 */
public record Consensus(
        double agreementLevel,
        boolean conflictingPredictions,
        double reliabilityScore
) {
    public Consensus {
        if (agreementLevel < 0.0 || agreementLevel > 1.0) {
            throw new IllegalArgumentException("agreementLevel must be between 0.0 and 1.0, got: " + agreementLevel);
        }
        if (reliabilityScore < 0.0 || reliabilityScore > 1.0) {
            throw new IllegalArgumentException("reliabilityScore must be between 0.0 and 1.0, got: " + reliabilityScore);
        }
    }
}
