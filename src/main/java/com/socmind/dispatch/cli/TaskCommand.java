package com.socmind.dispatch.cli;

import com.socmind.core.audit.AuditStore;
import com.socmind.core.engine.OrchestrationEngine;
import com.socmind.core.model.Alert;
import com.socmind.core.model.Entity;
import com.socmind.core.model.InvalidTaskException;
import com.socmind.core.model.Severity;
import com.socmind.core.model.TaskSubmission;
import com.socmind.core.model.TaskType;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletionException;

/**
 * CLI command: socmind task --type alert_analysis --severity High ...
 * <p>
 * Runs one task in-process against the configured providers and prints its audit record,
 * or the escalation it halted on.
 */
@Command(name = "task", mixinStandardHelpOptions = true, description = "Run a task in-process")
@Component
public class TaskCommand implements Callable<Integer> {

    @Option(names = {"--type", "-t"}, required = true,
            description = "alert_analysis, threat_hunt, incident_response or threat_brief")
    String type;

    @Option(names = {"--description", "-d"}, description = "Free-text description of the work")
    String description;

    @Option(names = "--alert-id", description = "Alert id")
    String alertId;

    @Option(names = "--alert-name", description = "Alert rule name")
    String alertName;

    @Option(names = {"--severity", "-s"}, description = "Alert severity: Critical, High, Medium, Low, Informational")
    String severity;

    @Option(names = "--tactic", description = "MITRE ATT&CK tactic (repeatable)")
    List<String> tactics = new ArrayList<>();

    @Option(names = "--technique", description = "MITRE ATT&CK technique id (repeatable)")
    List<String> techniques = new ArrayList<>();

    @Option(names = {"--entity", "-e"},
            description = "Entity as type:name[:category], e.g. Host:DC-01:domain-controller (repeatable)")
    List<String> entities = new ArrayList<>();

    @Option(names = "--related-incident", description = "Related incident id (repeatable)")
    List<String> relatedIncidents = new ArrayList<>();

    @Option(names = "--on-escalation", defaultValue = "NONE",
            description = "Unattended decision on escalation: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})")
    EscalationPolicy onEscalation;

    @Option(names = "--reviewer", defaultValue = "cli", description = "Reviewer recorded for unattended decisions")
    String reviewer;

    @Option(names = "--json", description = "Print the audit record as JSON")
    boolean json;

    private final OrchestrationEngine engine;
    private final AuditStore auditStore;

    public TaskCommand(OrchestrationEngine engine, AuditStore auditStore) {
        this.engine = engine;
        this.auditStore = auditStore;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        TaskSubmission submission;
        try {
            submission = toSubmission();
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error(e.getMessage());
            return 2;
        }

        try {
            var state = engine.runTask(submission);
            state = onEscalation.settle(engine, state, reviewer);
            ConsoleOutput.result(state);
            if (json) {
                state.audit().ifPresent(a -> System.out.println(auditStore.toJson(a)));
            }
            return state.status().isHalted() ? 3 : 0;
        } catch (InvalidTaskException e) {
            ConsoleOutput.error("Invalid task: " + e.getMessage());
            return 2;
        } catch (CompletionException e) {
            ConsoleOutput.error("Task failed: " + (e.getCause() != null ? e.getCause().getMessage() : e.getMessage()));
            return 1;
        }
    }

    TaskSubmission toSubmission() {
        var taskType = TaskType.fromWire(type);
        Alert alert = null;
        if (severity != null || alertName != null || !entities.isEmpty()) {
            alert = new Alert(alertId, alertName, severity == null ? null : Severity.fromWire(severity),
                    description, Set.copyOf(tactics), Set.copyOf(techniques),
                    entities.stream().map(TaskCommand::parseEntity).toList());
        }
        return new TaskSubmission(taskType, description, alert, Set.copyOf(relatedIncidents));
    }

    static Entity parseEntity(String value) {
        String[] parts = value.split(":", 3);
        if (parts.length < 2 || parts[0].isBlank() || parts[1].isBlank()) {
            throw new IllegalArgumentException("Entity must be type:name[:category], got: " + value);
        }
        return new Entity(parts[0], parts[1], parts.length == 3 ? parts[2] : null);
    }
}
