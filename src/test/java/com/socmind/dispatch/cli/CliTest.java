package com.socmind.dispatch.cli;

import com.socmind.core.engine.EngineHarness;
import com.socmind.core.health.HealthCheckService;
import com.socmind.core.model.AgentId;
import com.socmind.core.model.Entity;
import com.socmind.core.model.TaskStatus;
import com.socmind.core.model.TaskType;
import com.socmind.provider.SimulatedCapabilityProvider;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Exercises the picocli commands directly, without a Spring context, against an
 * in-process engine wired with simulated providers.
 */
class CliTest {

    private record CliResult(int exitCode, String output) {}

    private EngineHarness harness;

    @AfterEach
    void tearDown() {
        if (harness != null) {
            harness.shutdown();
        }
    }

    private CommandLine.IFactory createFactory(EngineHarness h) {
        return new CommandLine.IFactory() {
            @Override
            @SuppressWarnings("unchecked")
            public <K> K create(Class<K> cls) throws Exception {
                if (cls == TaskCommand.class) {
                    return (K) new TaskCommand(h.engine, h.audits);
                }
                if (cls == ScenarioCommand.class) {
                    return (K) new ScenarioCommand(h.engine, h.providerProperties);
                }
                if (cls == HealthCommand.class) {
                    return (K) new HealthCommand(new HealthCheckService(h.graph, h.providerRegistry, h.taskRegistry));
                }
                return CommandLine.defaultFactory().create(cls);
            }
        };
    }

    private CliResult execute(String... args) throws Exception {
        if (harness == null) {
            harness = EngineHarness.withProviders();
        }
        return execute(harness, args);
    }

    private CliResult execute(EngineHarness h, String... args) {
        ByteArrayOutputStream capture = new ByteArrayOutputStream();
        PrintStream capturePrintStream = new PrintStream(capture, true);
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        System.setOut(capturePrintStream);
        System.setErr(capturePrintStream);
        try {
            CommandLine commandLine = new CommandLine(new SocmindCommand(), createFactory(h));
            int exitCode = commandLine.execute(args);
            capturePrintStream.flush();
            return new CliResult(exitCode, capture.toString());
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
    }

    // =====================================================================
    //  Help output
    // =====================================================================

    @Nested
    @DisplayName("Help output")
    class HelpTests {

        @Test
        @DisplayName("--help lists every subcommand")
        void helpListsSubcommands() throws Exception {
            CliResult result = execute("--help");
            assertEquals(0, result.exitCode());
            for (String name : new String[] {"task", "scenario", "serve", "health", "help"}) {
                assertTrue(result.output().contains(name), "Help should list '" + name + "'");
            }
        }

        @Test
        @DisplayName("--version shows version")
        void versionOutput() throws Exception {
            CliResult result = execute("--version");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("SocMind 0.1.0"));
        }
    }

    // =====================================================================
    //  task
    // =====================================================================

    @Nested
    @DisplayName("task command")
    class TaskCommandTests {

        @Test
        @DisplayName("runs a low-severity alert to completion and prints the audit")
        void lowAlertCompletes() throws Exception {
            CliResult result = execute("task", "--type", "alert_analysis", "--severity", "Low",
                    "--alert-name", "Failed logins", "--entity", "Account:employee@contoso.com");

            assertEquals(0, result.exitCode(), result.output());
            assertTrue(result.output().contains("DONE"));
            assertTrue(result.output().contains("triage"));
        }

        @Test
        @DisplayName("--json appends the audit record as JSON")
        void jsonAudit() throws Exception {
            CliResult result = execute("task", "--type", "threat_hunt", "--json",
                    "--description", "Hunt for Kerberoasting");

            assertEquals(0, result.exitCode(), result.output());
            assertTrue(result.output().contains("\"finalStatus\""));
        }

        @Test
        @DisplayName("exits 3 when containment on a domain controller halts the task")
        void haltedTaskExitCode() throws Exception {
            CliResult result = execute("task", "--type", "incident_response", "--severity", "High",
                    "--alert-name", "Lateral movement", "--entity", "Host:DC-01:domain-controller");

            assertEquals(3, result.exitCode(), result.output());
            assertTrue(result.output().contains("CRITICAL_CONTAINMENT"));
        }

        @Test
        @DisplayName("--on-escalation ABORT settles a halted task")
        void abortPolicy() throws Exception {
            CliResult result = execute("task", "--type", "incident_response", "--severity", "High",
                    "--alert-name", "Lateral movement", "--entity", "Host:DC-01:domain-controller",
                    "--on-escalation", "ABORT", "--reviewer", "night-shift");

            assertEquals(0, result.exitCode(), result.output());
            assertTrue(result.output().contains("ABORTED"));
            assertTrue(result.output().contains("night-shift"));
        }

        @Test
        @DisplayName("--on-escalation PROCEED lets containment run")
        void proceedPolicy() throws Exception {
            CliResult result = execute("task", "--type", "incident_response", "--severity", "High",
                    "--alert-name", "Lateral movement", "--entity", "Host:DC-01:domain-controller",
                    "--on-escalation", "PROCEED");

            assertEquals(0, result.exitCode(), result.output());
            assertTrue(result.output().contains("ESCALATED_RESOLVED"));
        }

        @Test
        @DisplayName("rejects an unknown task type with exit code 2")
        void unknownType() throws Exception {
            CliResult result = execute("task", "--type", "pentest");
            assertEquals(2, result.exitCode());
        }

        @Test
        @DisplayName("rejects an alert analysis without an alert")
        void alertAnalysisWithoutAlert() throws Exception {
            CliResult result = execute("task", "--type", "alert_analysis");
            assertEquals(2, result.exitCode());
            assertTrue(result.output().contains("Invalid task"));
        }

        @Test
        @DisplayName("missing --type is a usage error")
        void missingType() throws Exception {
            CliResult result = execute("task");
            assertEquals(2, result.exitCode());
            assertTrue(result.output().contains("--type"));
        }

        @Test
        @DisplayName("parses entities with and without a category")
        void parsesEntities() {
            assertEquals(new Entity("Host", "DC-01", "domain-controller"),
                    TaskCommand.parseEntity("Host:DC-01:domain-controller"));
            assertEquals(new Entity("IP", "10.0.0.1", null), TaskCommand.parseEntity("IP:10.0.0.1"));
            assertThrows(IllegalArgumentException.class, () -> TaskCommand.parseEntity("DC-01"));
        }

        @Test
        @DisplayName("builds a submission without an alert when no alert options are given")
        void submissionWithoutAlert() throws Exception {
            var command = new TaskCommand(null, null);
            new CommandLine(command).parseArgs("--type", "threat-brief", "--related-incident", "INC-1");

            var submission = command.toSubmission();

            assertEquals(TaskType.THREAT_BRIEF, submission.taskType());
            assertNull(submission.alert());
            assertEquals(Set.of("INC-1"), submission.relatedIncidents());
        }
    }

    // =====================================================================
    //  scenario
    // =====================================================================

    @Nested
    @DisplayName("scenario command")
    class ScenarioCommandTests {

        @Test
        @DisplayName("--list prints every scenario name")
        void listScenarios() throws Exception {
            CliResult result = execute("scenario", "--list");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("credential-theft"));
            assertTrue(result.output().contains("dc-incident"));
        }

        @Test
        @DisplayName("a named scenario that reaches its expected status exits 0")
        void namedScenario() throws Exception {
            CliResult result = execute("scenario", "dc-incident");
            assertEquals(0, result.exitCode(), result.output());
            assertTrue(result.output().contains("dc-incident ended " + TaskStatus.ESCALATED));
        }

        @Test
        @DisplayName("an unknown scenario exits 2")
        void unknownScenario() throws Exception {
            CliResult result = execute("scenario", "no-such-scenario");
            assertEquals(2, result.exitCode());
            assertTrue(result.output().contains("Unknown scenario"));
        }
    }

    // =====================================================================
    //  health
    // =====================================================================

    @Nested
    @DisplayName("health command")
    class HealthCommandTests {

        @Test
        @DisplayName("reports all components operational with every provider registered")
        void allUp() throws Exception {
            CliResult result = execute("health");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("all components operational"));
            assertTrue(result.output().contains("SimulatedCapabilityProvider"));
        }

        @Test
        @DisplayName("reports degraded providers when an agent has none")
        void degraded() throws Exception {
            harness = EngineHarness.withOnly(new SimulatedCapabilityProvider(AgentId.TRIAGE));
            CliResult result = execute(harness, "health");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("No provider for hunting"));
            assertTrue(result.output().contains("degraded or down"));
        }
    }
}
