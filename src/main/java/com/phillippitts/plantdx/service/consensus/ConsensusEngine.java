package com.phillippitts.plantdx.service.consensus;

import com.phillippitts.plantdx.domain.EnsembleResult;
import com.phillippitts.plantdx.domain.ProviderResult;

import java.util.List;

/**
 * Combines several providers' results into one ensemble opinion.
 *
 * <p>Implementations must be deterministic and insensitive to the order in which provider
 * calls completed: callers pass results in registry order.
 */
public interface ConsensusEngine {

    /**
     * @param results successful provider results in registry order (non-empty)
     * @return combined result
     * @throws com.phillippitts.plantdx.exception.NoPredictionException if there is nothing to combine
     */
    EnsembleResult combine(List<ProviderResult> results);
}
