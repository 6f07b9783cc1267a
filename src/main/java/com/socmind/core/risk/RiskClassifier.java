package com.socmind.core.risk;

import com.socmind.core.model.RiskTier;
import org.springframework.stereotype.Service;

/**
 * Maps a triage risk score to a {@link RiskTier}. Boundaries belong to the higher tier.
 */
@Service
public class RiskClassifier {

    public static final int HIGH_THRESHOLD = 80;
    public static final int MEDIUM_THRESHOLD = 50;

    /**
     * @throws IllegalArgumentException if {@code score} lies outside 0..100
     */
    public RiskTier classify(int score) {
        if (score < 0 || score > 100) {
            throw new IllegalArgumentException("Risk score out of range 0..100: " + score);
        }
        if (score >= HIGH_THRESHOLD) {
            return RiskTier.HIGH;
        }
        if (score >= MEDIUM_THRESHOLD) {
            return RiskTier.MEDIUM;
        }
        return RiskTier.LOW;
    }

    public boolean isValidScore(Integer score) {
        return score != null && score >= 0 && score <= 100;
    }
}
