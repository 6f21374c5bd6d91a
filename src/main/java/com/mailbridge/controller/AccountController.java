package com.mailbridge.controller;

import com.mailbridge.config.AccountRegistry;
import com.mailbridge.config.AccountSettings;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Configured account REST API
 * - List accounts (GET /api/accounts)
 * - Get account (GET /api/accounts/{email})
 * - Reload configuration (POST /api/accounts/reload)
 */
@Slf4j
@RestController
@RequestMapping("/api/accounts")
@RequiredArgsConstructor
public class AccountController {

    private final AccountRegistry accountRegistry;

    /**
     * List accounts
     * GET /api/accounts
     */
    @GetMapping
    public ResponseEntity<Map<String, Object>> listAccounts() {
        List<Map<String, Object>> accounts = accountRegistry.listAccounts().stream()
                .map(AccountController::toMap)
                .collect(Collectors.toList());

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "success");
        response.put("count", accounts.size());
        response.put("accounts", accounts);
        return ResponseEntity.ok(response);
    }

    /**
     * Get account
     * GET /api/accounts/{email}
     */
    @GetMapping("/{email}")
    public ResponseEntity<Map<String, Object>> getAccount(@PathVariable String email) {
        if (!accountRegistry.isAvailable(email)) {
            return errorResponse(HttpStatus.NOT_FOUND, "Account not found or disabled: " + email);
        }
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "success");
        response.putAll(toMap(accountRegistry.resolve(email)));
        return ResponseEntity.ok(response);
    }

    /**
     * Reload configuration
     * POST /api/accounts/reload
     */
    @PostMapping("/reload")
    public ResponseEntity<Map<String, Object>> reload() {
        int count = accountRegistry.reload();
        log.info("Account configuration reloaded via API: {} accounts", count);

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "success");
        response.put("message", "Account configuration reloaded.");
        response.put("count", count);
        return ResponseEntity.ok(response);
    }

    private static Map<String, Object> toMap(AccountSettings account) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("email", account.getAddress());
        map.put("displayName", account.getDisplayName());
        map.put("protocol", account.getProtocol());
        map.put("enabled", account.isEnabled());
        map.put("imapServer", account.getImapHost() + ":" + account.getImapPort());
        map.put("pop3Server", account.getPop3Host() + ":" + account.getPop3Port());
        map.put("smtpServer", account.getSmtpHost() + ":" + account.getSmtpPort());
        map.put("defaultFolder", account.getDefaultFolder());
        return map;
    }

    private ResponseEntity<Map<String, Object>> errorResponse(HttpStatus status, String message) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "error");
        response.put("message", message);
        return ResponseEntity.status(status).body(response);
    }
}
