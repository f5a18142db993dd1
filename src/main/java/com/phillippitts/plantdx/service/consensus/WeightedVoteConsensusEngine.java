package com.phillippitts.plantdx.service.consensus;

import com.phillippitts.plantdx.domain.Consensus;
import com.phillippitts.plantdx.domain.EnsembleMetadata;
import com.phillippitts.plantdx.domain.EnsembleResult;
import com.phillippitts.plantdx.domain.Prediction;
import com.phillippitts.plantdx.domain.ProviderResult;
import com.phillippitts.plantdx.exception.NoPredictionException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Weighted-vote consensus across provider results.
 *
 * <p>Every prediction of every result casts one vote for its disease id, weighted by
 * {@code prediction.confidence × result.confidence}. A provider votes at most once per id.
 * Ids are ranked by vote count, then by average weighted confidence; full ties keep the order
 * in which ids first appear in the (registry-ordered) input.
 *
 * <ul>
 *   <li>agreement = winner's votes / contributing results</li>
 *   <li>conflicting = some other id also received a vote</li>
 *   <li>reliability = agreement × lowest provider confidence</li>
 * </ul>
 */
@Component
public class WeightedVoteConsensusEngine implements ConsensusEngine {

    private static final Logger LOG = LogManager.getLogger(WeightedVoteConsensusEngine.class);

    static final String ENSEMBLE_METHOD = "weighted_average";
    private static final String ENSEMBLE_PROVIDER = "ensemble";

    private static final Comparator<Tally> RANKING =
            Comparator.comparingInt(Tally::count).reversed()
                    .thenComparing(Comparator.comparingDouble(Tally::average).reversed());

    @Override
    public EnsembleResult combine(List<ProviderResult> results) {
        if (results == null || results.isEmpty()) {
            throw new NoPredictionException("No provider results to combine", ENSEMBLE_PROVIDER);
        }

        Map<String, Tally> tallies = new LinkedHashMap<>();
        for (ProviderResult result : results) {
            Set<String> voted = new HashSet<>();
            for (Prediction prediction : result.predictions()) {
                if (!voted.add(prediction.diseaseId())) {
                    continue;
                }
                tallies.computeIfAbsent(prediction.diseaseId(), id -> new Tally(prediction))
                        .add(prediction.confidence() * result.confidence());
            }
        }
        if (tallies.isEmpty()) {
            throw new NoPredictionException("No predictions to combine", ENSEMBLE_PROVIDER);
        }

        // List.sort is stable, so full ties keep first-appearance order
        List<Tally> ranked = new ArrayList<>(tallies.values());
        ranked.sort(RANKING);
        Tally winner = ranked.get(0);

        double agreement = (double) winner.count() / results.size();
        boolean conflicting = ranked.size() > 1 && ranked.get(1).count() > 0;
        double minConfidence = results.stream().mapToDouble(ProviderResult::confidence).min().orElse(0.0);
        double reliability = agreement * minConfidence;

        Prediction exemplar = winner.exemplar();
        Prediction finalPrediction = Prediction.builder(exemplar.diseaseId(), exemplar.diseaseName(),
                        clamp(winner.average()))
                .severity(exemplar.severity())
                .description(exemplar.description())
                .treatment(exemplar.treatment())
                .symptoms(exemplar.symptoms())
                .causes(exemplar.causes())
                .affectedAreas(exemplar.affectedAreas())
                .build();

        List<String> models = results.stream().map(ProviderResult::provider).toList();
        long totalTime = results.stream().mapToLong(r -> r.metadata().processingTimeMs()).max().orElse(0L);
        int imageCount = results.get(0).metadata().imageCount();

        LOG.debug("Consensus over {}: winner={} votes={}/{} conflicting={} reliability={}",
                models, exemplar.diseaseId(), winner.count(), results.size(), conflicting,
                String.format("%.3f", reliability));

        return new EnsembleResult(
                finalPrediction,
                results,
                new Consensus(agreement, conflicting, clamp(reliability)),
                new EnsembleMetadata(models, totalTime, imageCount, ENSEMBLE_METHOD));
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }

    /** Vote accumulator for one disease id. */
    private static final class Tally {
        private final Prediction exemplar;
        private int count;
        private double weighted;

        Tally(Prediction exemplar) {
            this.exemplar = exemplar;
        }

        void add(double weight) {
            count++;
            weighted += weight;
        }

        int count() {
            return count;
        }

        double average() {
            return count == 0 ? 0.0 : weighted / count;
        }

        Prediction exemplar() {
            return exemplar;
        }
    }
}
