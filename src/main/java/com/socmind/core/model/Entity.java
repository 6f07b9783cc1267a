package com.socmind.core.model;

import java.io.Serializable;

/**
 * An entity referenced by an alert.
 *
 * @param type     entity kind: Account, Host, IP, File, Process, URL, MailMessage, CloudApplication
 * @param name     identifying value (host name, UPN, address, hash)
 * @param category asset class used by escalation policy (e.g. "domain-controller"); nullable
 */
public record Entity(
    String type,
    String name,
    String category
) implements Serializable {
}
