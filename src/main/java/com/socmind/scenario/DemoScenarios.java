package com.socmind.scenario;

import com.socmind.core.model.Alert;
import com.socmind.core.model.Entity;
import com.socmind.core.model.Severity;
import com.socmind.core.model.TaskStatus;
import com.socmind.core.model.TaskSubmission;
import com.socmind.core.model.TaskType;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Catalog of demo scenarios. Alert content follows the mixed-severity triage batch
 * used for product demos.
 */
public final class DemoScenarios {

    private DemoScenarios() {
        // utility class
    }

    public static List<DemoScenario> all() {
        return List.of(
                criticalCredentialTheft(),
                mediumSuspiciousSignIn(),
                lowInformational(),
                emptyThreatHunt(),
                dailyThreatBrief(),
                domainControllerIncident());
    }

    public static Optional<DemoScenario> find(String name) {
        return all().stream().filter(s -> s.name().equalsIgnoreCase(name)).findFirst();
    }

    /** High tier, containment and enrichment in parallel, no APT so the hunt is dropped. */
    static DemoScenario criticalCredentialTheft() {
        var alert = new Alert("ALERT-1001",
                "Suspicious Data Transfer to External Cloud Service",
                Severity.CRITICAL,
                "Administrator account 'admin@contoso.com' transferred 2.5 GB of data to an external "
                        + "cloud storage service at 3:15 AM after accessing sensitive file shares.",
                Set.of("Exfiltration", "Collection", "CredentialAccess"),
                Set.of("T1048", "T1074"),
                List.of(new Entity("Account", "admin@contoso.com", null),
                        new Entity("IP", "192.168.1.50", null),
                        new Entity("URL", "https://dropbox.com", null)));
        return new DemoScenario("credential-theft",
                "Critical credential theft and exfiltration: High tier, APT not confirmed",
                new TaskSubmission(TaskType.ALERT_ANALYSIS, "Analyze critical exfiltration alert", alert, Set.of()),
                TaskStatus.DONE);
    }

    static DemoScenario mediumSuspiciousSignIn() {
        var alert = new Alert("ALERT-1002",
                "Suspicious PowerShell Execution After Sign-in",
                Severity.MEDIUM,
                "User 'marketing@contoso.com' signed in and executed a base64-encoded PowerShell "
                        + "payload on workstation WS-MARKETING-12.",
                Set.of("Execution"),
                Set.of("T1059.001"),
                List.of(new Entity("Account", "marketing@contoso.com", null),
                        new Entity("Host", "WS-MARKETING-12", "workstation"),
                        new Entity("Process", "powershell.exe", null)));
        return new DemoScenario("suspicious-sign-in",
                "Medium suspicious sign-in: hunting and intel in one parallel group",
                new TaskSubmission(TaskType.ALERT_ANALYSIS, "Analyze suspicious sign-in", alert, Set.of()),
                TaskStatus.DONE);
    }

    static DemoScenario lowInformational() {
        var alert = new Alert("ALERT-1003",
                "Multiple Failed Login Attempts",
                Severity.LOW,
                "User 'employee@contoso.com' had 3 failed login attempts from corporate IP 10.0.1.25 "
                        + "at 9:00 AM, followed by successful login.",
                Set.of("InitialAccess"),
                Set.of("T1078"),
                List.of(new Entity("Account", "employee@contoso.com", null),
                        new Entity("IP", "10.0.1.25", null)));
        return new DemoScenario("low-informational",
                "Low-severity false positive: triage only, then record and monitor",
                new TaskSubmission(TaskType.ALERT_ANALYSIS, "Analyze failed logins", alert, Set.of()),
                TaskStatus.DONE);
    }

    static DemoScenario emptyThreatHunt() {
        return new DemoScenario("empty-hunt",
                "Proactive hunt that finds nothing: the rest of the plan is dropped",
                new TaskSubmission(TaskType.THREAT_HUNT,
                        "Hunt for Kerberoasting activity in the last 7 days", null, Set.of()),
                TaskStatus.DONE);
    }

    static DemoScenario dailyThreatBrief() {
        return new DemoScenario("threat-brief",
                "Daily brief with an emerging campaign: hunt, then assess what was found",
                new TaskSubmission(TaskType.THREAT_BRIEF, "Daily threat intelligence brief", null, Set.of()),
                TaskStatus.DONE);
    }

    /** Containment on a domain controller stops for a reviewer. */
    static DemoScenario domainControllerIncident() {
        var alert = new Alert("ALERT-1004",
                "Brute Force Attack Followed by Lateral Movement",
                Severity.HIGH,
                "Account 'jdoe@contoso.com' had 45 failed logins from 203.0.113.42, then a successful "
                        + "login and SMB access to DC-01.",
                Set.of("InitialAccess", "LateralMovement"),
                Set.of("T1110", "T1021.002"),
                List.of(new Entity("Account", "jdoe@contoso.com", null),
                        new Entity("IP", "203.0.113.42", null),
                        new Entity("Host", "DC-01", "domain-controller")));
        return new DemoScenario("dc-incident",
                "Incident response on a domain controller: containment escalates for review",
                new TaskSubmission(TaskType.INCIDENT_RESPONSE, "Respond to lateral movement onto DC-01",
                        alert, Set.of("INC-2041")),
                TaskStatus.ESCALATED);
    }
}
