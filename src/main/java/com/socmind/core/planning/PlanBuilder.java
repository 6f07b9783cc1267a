package com.socmind.core.planning;

import com.socmind.core.model.AgentId;
import com.socmind.core.model.Condition;
import com.socmind.core.model.DecisionPoint;
import com.socmind.core.model.Plan;
import com.socmind.core.model.PlanStep;
import com.socmind.core.model.RiskTier;
import com.socmind.core.model.TaskType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Builds the plan skeleton for a task from its type and, for alert analysis, its risk tier.
 * <p>
 * The policy is a fixed table:
 * <pre>
 *   alert_analysis / HIGH    [response(contain) | intel(enrich)] -&gt; APT confirmed? -&gt; hunting
 *   alert_analysis / MEDIUM  [hunting(investigate) | intel(context)]
 *   alert_analysis / LOW     no steps, record + monitor
 *   threat_hunt              hunting -&gt; findings? -&gt; triage -&gt; high risk? -&gt; response; intel
 *   threat_brief             intel -&gt; emerging threats? -&gt; hunting -&gt; threats found? -&gt; triage
 *   incident_response        triage -&gt; response(contain) -&gt; investigate further? -&gt; hunting; intel
 * </pre>
 */
@Service
public class PlanBuilder {

    private static final Logger log = LoggerFactory.getLogger(PlanBuilder.class);

    static final String MONITOR_NOTE = "record + monitor";

    /**
     * @param tier risk tier from triage; required for alert analysis, ignored otherwise
     * @throws IllegalArgumentException if an alert-analysis plan is requested without a tier
     */
    public Plan build(TaskType taskType, RiskTier tier) {
        var plan = switch (taskType) {
            case ALERT_ANALYSIS -> alertPlan(tier);
            case THREAT_HUNT -> threatHuntPlan();
            case THREAT_BRIEF -> threatBriefPlan();
            case INCIDENT_RESPONSE -> incidentResponsePlan();
        };
        log.info("Built {} plan (tier {}): {} steps, {} decision points",
                taskType.wireName(), tier, plan.steps().size(), plan.decisionPoints().size());
        return plan;
    }

    private Plan alertPlan(RiskTier tier) {
        if (tier == null) {
            throw new IllegalArgumentException("Alert analysis plans require a risk tier");
        }
        return switch (tier) {
            case HIGH -> new Plan(
                    List.of(
                            new PlanStep("S1", AgentId.RESPONSE, PlanStep.CONTAIN,
                                    "High-risk alert: contain affected entities", 1),
                            new PlanStep("S2", AgentId.INTEL, "enrich",
                                    "Enrich indicators and check for APT attribution", 1),
                            new PlanStep("S3", AgentId.HUNTING, "hunt",
                                    "APT confirmed: hunt for related activity", null)),
                    List.of(new DecisionPoint("D1", Condition.APT_CONFIRMED, "S2",
                            List.of("S3"), List.of())),
                    "high-risk alert: contain and enrich",
                    0);
            case MEDIUM -> new Plan(
                    List.of(
                            new PlanStep("S1", AgentId.HUNTING, "investigate",
                                    "Medium-risk alert: look for related activity", 1),
                            new PlanStep("S2", AgentId.INTEL, "context",
                                    "Gather threat context for the alert", 1)),
                    List.of(),
                    "medium-risk alert: investigate",
                    0);
            case LOW -> new Plan(List.of(), List.of(), MONITOR_NOTE, 0);
        };
    }

    private Plan threatHuntPlan() {
        return new Plan(
                List.of(
                        new PlanStep("S1", AgentId.HUNTING, "generate+execute",
                                "Generate and execute hunting queries", null),
                        new PlanStep("S2", AgentId.TRIAGE, "assess",
                                "Findings present: assess their risk", null),
                        new PlanStep("S3", AgentId.RESPONSE, PlanStep.CONTAIN,
                                "High-risk findings: contain", null),
                        new PlanStep("S4", AgentId.INTEL, "context",
                                "Add threat context to the findings", null)),
                List.of(
                        new DecisionPoint("D1", Condition.FINDINGS_PRESENT, "S1",
                                List.of("S2", "S3", "S4"), List.of()),
                        new DecisionPoint("D2", Condition.HIGH_RISK, "S2",
                                List.of("S3"), List.of())),
                "threat hunt",
                0);
    }

    private Plan threatBriefPlan() {
        return new Plan(
                List.of(
                        new PlanStep("S1", AgentId.INTEL, "briefing",
                                "Compile the threat briefing", null),
                        new PlanStep("S2", AgentId.HUNTING, "hunt",
                                "Emerging threats: hunt for them in the environment", null),
                        new PlanStep("S3", AgentId.TRIAGE, "assess",
                                "Threats found: assess their risk", null)),
                List.of(
                        new DecisionPoint("D1", Condition.EMERGING_THREATS, "S1",
                                List.of("S2", "S3"), List.of()),
                        new DecisionPoint("D2", Condition.THREATS_FOUND, "S2",
                                List.of("S3"), List.of())),
                "threat brief",
                0);
    }

    private Plan incidentResponsePlan() {
        return new Plan(
                List.of(
                        new PlanStep("S1", AgentId.TRIAGE, "assess",
                                "Assess incident scope and risk", null),
                        new PlanStep("S2", AgentId.RESPONSE, PlanStep.CONTAIN,
                                "Contain the incident", null),
                        new PlanStep("S3", AgentId.HUNTING, "investigate",
                                "Investigate further for lateral movement", null),
                        new PlanStep("S4", AgentId.INTEL, "attribution",
                                "Attribute the incident", null)),
                List.of(new DecisionPoint("D1", Condition.INVESTIGATE_FURTHER, "S2",
                        List.of("S3"), List.of())),
                "incident response",
                0);
    }
}
