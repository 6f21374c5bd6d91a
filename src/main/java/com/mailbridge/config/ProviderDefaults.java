package com.mailbridge.config;

import java.util.Map;

/**
 * Well-known provider host table used to fill in unset server hosts.
 * Unknown domains fall back to imap./pop./smtp. + domain.
 */
public final class ProviderDefaults {

    record Hosts(String imap, String pop3, String smtp) {
    }

    private static final Map<String, Hosts> PROVIDERS = Map.of(
            "gmail.com", new Hosts("imap.gmail.com", "pop.gmail.com", "smtp.gmail.com"),
            "outlook.com", new Hosts("outlook.office365.com", "outlook.office365.com", "smtp-mail.outlook.com"),
            "hotmail.com", new Hosts("outlook.office365.com", "outlook.office365.com", "smtp-mail.outlook.com"),
            "yahoo.com", new Hosts("imap.mail.yahoo.com", "pop.mail.yahoo.com", "smtp.mail.yahoo.com"),
            "icloud.com", new Hosts("imap.mail.me.com", "pop.mail.me.com", "smtp.mail.me.com"),
            "163.com", new Hosts("imap.163.com", "pop.163.com", "smtp.163.com"),
            "126.com", new Hosts("imap.126.com", "pop.126.com", "smtp.126.com"),
            "qq.com", new Hosts("imap.qq.com", "pop.qq.com", "smtp.qq.com")
    );

    private ProviderDefaults() {}

    /**
     * Return a copy of the settings with blank hosts filled from the provider table
     */
    public static AccountSettings applyTo(AccountSettings settings) {
        String domain = settings.getDomain();
        if (domain == null) {
            return settings;
        }
        Hosts hosts = PROVIDERS.getOrDefault(domain,
                new Hosts("imap." + domain, "pop." + domain, "smtp." + domain));

        AccountSettings.AccountSettingsBuilder builder = settings.toBuilder();
        if (isBlank(settings.getImapHost())) {
            builder.imapHost(hosts.imap());
        }
        if (isBlank(settings.getPop3Host())) {
            builder.pop3Host(hosts.pop3());
        }
        if (isBlank(settings.getSmtpHost())) {
            builder.smtpHost(hosts.smtp());
        }
        return builder.build();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
