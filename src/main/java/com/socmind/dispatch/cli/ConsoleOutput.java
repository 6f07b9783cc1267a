package com.socmind.dispatch.cli;

import com.socmind.core.model.AuditRecord;
import com.socmind.core.model.EscalationEvent;
import com.socmind.core.state.TaskState;
import picocli.CommandLine;

import java.util.List;

/**
 * ANSI-colored terminal output utilities for the SocMind CLI.
 */
public class ConsoleOutput {

    private static final String RULE = "──────────────────────────────────";

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) SOCMIND v0.1.0|@"));
        System.out.println(RULE);
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [SOCMIND]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void escalation(EscalationEvent event) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(red) [ESCALATION " + event.id() + "]|@ " + event.reason()
                        + " at " + event.triggeringStep() + " (" + event.severity() + ")"));
        System.out.println("  " + event.detail());
    }

    public static void audit(AuditRecord record) {
        System.out.println(RULE);
        String status = switch (record.finalStatus()) {
            case DONE -> "@|bold,fg(green) " + record.finalStatus() + "|@";
            case ABORTED -> "@|bold,fg(red) " + record.finalStatus() + "|@";
            default -> "@|bold,fg(yellow) " + record.finalStatus() + "|@";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold Task " + record.taskId() + "|@ " + status
                        + (record.riskTier() != null ? "  tier " + record.riskTier() : "")));
        System.out.println("  Final decision: " + record.finalDecision());
        System.out.println("  Reason:         " + record.terminationReason());

        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold Actions|@"));
        for (var action : record.previousActions()) {
            String outcome = action.succeeded()
                    ? "@|fg(green) OK  |@"
                    : "@|fg(red) FAIL|@";
            System.out.println(CommandLine.Help.Ansi.AUTO.string(String.format(
                    "  %s %-7s %-8s %-10s attempt %d%s", outcome, action.stepId(),
                    action.agentId().wireName(), action.action(), action.attempt(),
                    action.partialGroup() ? " (partial group)" : "")));
        }
        printList("Key findings", record.keyFindings());
        printList("Decisions", record.decisions());
        printList("Open risks", record.openRisks());
    }

    private static void printList(String title, List<String> items) {
        if (items.isEmpty()) {
            return;
        }
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold " + title + "|@"));
        for (var item : items) {
            System.out.println("  - " + item);
        }
    }

    /**
     * Prints the audit of a terminated run or the escalation a halted run is waiting on.
     */
    public static void result(TaskState state) {
        if (state.status().isHalted()) {
            info("Task " + state.taskId() + " halted in " + state.status());
            state.escalation().ifPresent(ConsoleOutput::escalation);
        } else {
            state.audit().ifPresentOrElse(ConsoleOutput::audit,
                    () -> info("Task " + state.taskId() + " is " + state.status()));
        }
    }

    public static void rule() {
        System.out.println(RULE);
    }
}
