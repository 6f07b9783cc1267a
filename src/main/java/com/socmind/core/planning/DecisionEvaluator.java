package com.socmind.core.planning;

import com.socmind.core.model.AgentDecision;
import com.socmind.core.model.AgentResponse;
import com.socmind.core.model.DecisionPoint;
import com.socmind.core.model.RiskTier;
import com.socmind.core.model.TaskContext;
import com.socmind.core.risk.RiskClassifier;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Evaluates decision-point predicates against the recorded context.
 * <p>
 * An empty result means the predicate cannot be evaluated: the producing step has no
 * committed response, or the field the predicate reads is absent. Missing fields are
 * never defaulted.
 */
@Service
public class DecisionEvaluator {

    private final RiskClassifier riskClassifier;

    public DecisionEvaluator(RiskClassifier riskClassifier) {
        this.riskClassifier = riskClassifier;
    }

    public Optional<Boolean> evaluate(DecisionPoint decisionPoint, TaskContext context) {
        return context.latestResponseFor(decisionPoint.afterStepId())
                .flatMap(response -> test(decisionPoint, response));
    }

    private Optional<Boolean> test(DecisionPoint decisionPoint, AgentResponse response) {
        return switch (decisionPoint.condition()) {
            case APT_CONFIRMED -> Optional.ofNullable(response.decision())
                    .map(d -> d == AgentDecision.ESCALATE);
            case EMERGING_THREATS, INVESTIGATE_FURTHER -> Optional.ofNullable(response.decision())
                    .map(d -> d == AgentDecision.ESCALATE || d == AgentDecision.INVESTIGATE);
            case FINDINGS_PRESENT, THREATS_FOUND -> response.findings() == null
                    ? Optional.empty()
                    : Optional.of(response.hasFindings());
            case HIGH_RISK -> riskClassifier.isValidScore(response.riskScore())
                    ? Optional.of(riskClassifier.classify(response.riskScore()) == RiskTier.HIGH)
                    : Optional.empty();
        };
    }
}
