package com.incoresoft.presenceTracker.domain.matching.service;

import com.incoresoft.presenceTracker.config.PresenceProps;
import com.incoresoft.presenceTracker.domain.identity.dto.Identity;
import com.incoresoft.presenceTracker.domain.identity.service.IdentityStore;
import com.incoresoft.presenceTracker.domain.matching.dto.MatchClass;
import com.incoresoft.presenceTracker.domain.matching.dto.MatchResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class MatchScorer {

    private final IdentityStore store;
    private final SimilarityFunction similarityFunction;
    private final PresenceProps props;

    /**
     * Scores the vector against every registered identity. Ties go to the earliest registration.
     */
    public MatchResult match(double[] observedVector) {
        List<Identity> candidates = store.snapshot();
        if (candidates.isEmpty()) return MatchResult.NO_MATCH;

        String bestName = null;
        double best = -1;
        for (Identity identity : candidates) {
            double score = similarityFunction.similarity(observedVector, identity.featureVector());
            log.trace("Similarity to {}: {}", identity.name(), score);
            if (score > best) {
                best = score;
                bestName = identity.name();
            }
        }
        return new MatchResult(bestName, Math.max(0, best));
    }

    public MatchClass classify(MatchResult result) {
        return MatchClass.of(result.similarity(), props.getKnownThreshold(), props.getUnknownThreshold());
    }
}
