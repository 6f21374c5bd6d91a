package com.mailbridge;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * MailBridge mailbox retrieval service
 *
 * Multi-protocol mail retrieval and attachment archive
 * - IMAP (folder/UID) and POP3 (sequential) store clients, SMTP send
 * - Cursor-based keyword search over either store
 * - Content-compared local attachment storage
 * - Recursive, loop-safe archive extraction
 * - Jakarta Mail message parsing
 * - Reactor (Reactive) async tool boundary
 */
@SpringBootApplication
@EnableConfigurationProperties
public class MailBridgeApplication {

    public static void main(String[] args) {
        SpringApplication.run(MailBridgeApplication.class, args);
    }
}
