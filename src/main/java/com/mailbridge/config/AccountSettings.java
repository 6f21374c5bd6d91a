package com.mailbridge.config;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.mailbridge.util.StorageUtil;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * Connection settings for one configured mail account
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class AccountSettings {

    @JsonAlias("email_address")
    private String address;

    @ToString.Exclude
    @JsonProperty(access = JsonProperty.Access.WRITE_ONLY)
    private String password;

    @JsonAlias("display_name")
    private String displayName;

    @Builder.Default
    private MailProtocol protocol = MailProtocol.IMAP;

    @JsonAlias("imap_host")
    private String imapHost;
    @Builder.Default
    @JsonAlias("imap_port")
    private int imapPort = 993;
    @Builder.Default
    @JsonAlias("imap_use_ssl")
    private boolean imapSsl = true;

    @JsonAlias("pop3_host")
    private String pop3Host;
    @Builder.Default
    @JsonAlias("pop3_port")
    private int pop3Port = 995;
    @Builder.Default
    @JsonAlias("pop3_use_ssl")
    private boolean pop3Ssl = true;

    @JsonAlias("smtp_host")
    private String smtpHost;
    @Builder.Default
    @JsonAlias("smtp_port")
    private int smtpPort = 587;
    /** STARTTLS when true, implicit SSL when false */
    @Builder.Default
    @JsonAlias("smtp_use_tls")
    private boolean smtpStarttls = true;

    @Builder.Default
    private boolean enabled = true;

    @Builder.Default
    @JsonAlias("default_folder")
    private String defaultFolder = "INBOX";

    /**
     * Storage folder for this account's attachments: '@' -> '-', '.' -> '_'
     */
    public String accountFolder() {
        return StorageUtil.accountFolder(address);
    }

    public String getDomain() {
        if (address == null || !address.contains("@")) {
            return null;
        }
        return address.substring(address.indexOf('@') + 1).toLowerCase();
    }
}
