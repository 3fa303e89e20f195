package com.vidnyan.dtc.domain.query;

import com.vidnyan.dtc.domain.index.TokenOccurrence;

import java.util.List;
import java.util.Map;

/**
 * Sum over matched query tokens of the weight of the best field containing the token.
 * Repeating a token inside a record does not raise its score.
 */
public class TokenSumScorer implements SearchScorer {

    private final FieldWeights weights;

    public TokenSumScorer(FieldWeights weights) {
        this.weights = weights;
    }

    @Override
    public double score(List<String> queryTokens, Map<String, List<TokenOccurrence>> matches) {
        double score = 0;
        for (String token : queryTokens) {
            List<TokenOccurrence> occurrences = matches.get(token);
            if (occurrences == null || occurrences.isEmpty()) {
                continue;
            }
            double best = 0;
            for (TokenOccurrence occurrence : occurrences) {
                best = Math.max(best, weights.weightOf(occurrence.field()));
            }
            score += best;
        }
        return score;
    }

    public FieldWeights weights() {
        return weights;
    }
}
