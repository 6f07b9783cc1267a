package com.socmind.core.graph;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "socmind.graph")
public class GraphProperties {

    /** Most steps, and most decision points, a reviewer's replacement plan may carry. */
    private int maxPlanSteps = 40;

    /**
     * Node executions allowed in one run. Each group costs a schedule and a dispatch, and
     * every decision point may add one re-dispatch group, so a plan at the size cap fits
     * alongside receive, triage, build, the last schedule and synthesize.
     */
    public int recursionLimit() {
        return 4 * maxPlanSteps + 10;
    }

    public int getMaxPlanSteps() { return maxPlanSteps; }
    public void setMaxPlanSteps(int maxPlanSteps) { this.maxPlanSteps = maxPlanSteps; }
}
