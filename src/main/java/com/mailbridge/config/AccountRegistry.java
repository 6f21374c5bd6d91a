package com.mailbridge.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mailbridge.exception.MailBridgeException;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Account resolver
 * - Accounts come from inline properties and an optional JSON accounts file
 * - Held as an immutable snapshot, replaced as a whole on reload()
 * - Absent or disabled accounts are rejected before any I/O
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AccountRegistry {

    private final MailBridgeProperties properties;
    private final ObjectMapper objectMapper;

    private final AtomicReference<Map<String, AccountSettings>> snapshot =
            new AtomicReference<>(Collections.emptyMap());

    @PostConstruct
    public void init() {
        reload();
    }

    /**
     * Rebuild the account snapshot from properties and the accounts file
     *
     * @return number of accounts loaded
     */
    public int reload() {
        Map<String, AccountSettings> accounts = new LinkedHashMap<>();

        for (AccountSettings inline : properties.getAccounts()) {
            register(accounts, inline);
        }

        String file = properties.getAccountsFile();
        if (file != null && !file.isBlank()) {
            for (AccountSettings fromFile : readAccountsFile(Paths.get(file))) {
                register(accounts, fromFile);
            }
        }

        snapshot.set(Collections.unmodifiableMap(accounts));
        log.info("Loaded {} email accounts", accounts.size());
        return accounts.size();
    }

    /**
     * Resolve an enabled account by address
     */
    public AccountSettings resolve(String address) {
        if (address == null || address.isBlank()) {
            throw MailBridgeException.validation("email_address is required");
        }
        AccountSettings account = snapshot.get().get(normalize(address));
        if (account == null) {
            throw MailBridgeException.validation("Account not configured: " + address);
        }
        if (!account.isEnabled()) {
            throw MailBridgeException.validation("Account is disabled: " + address);
        }
        return account;
    }

    public boolean isAvailable(String address) {
        AccountSettings account = address == null ? null : snapshot.get().get(normalize(address));
        return account != null && account.isEnabled();
    }

    public List<AccountSettings> listAccounts() {
        return new ArrayList<>(snapshot.get().values());
    }

    private void register(Map<String, AccountSettings> accounts, AccountSettings settings) {
        if (settings == null || settings.getAddress() == null || !settings.getAddress().contains("@")) {
            log.warn("Skipping account without a valid address: {}", settings);
            return;
        }
        accounts.put(normalize(settings.getAddress()), ProviderDefaults.applyTo(settings));
    }

    private List<AccountSettings> readAccountsFile(Path path) {
        List<AccountSettings> result = new ArrayList<>();
        if (!Files.exists(path)) {
            log.info("Accounts file {} not found, no file accounts loaded", path);
            return result;
        }
        try {
            JsonNode root = objectMapper.readTree(path.toFile());
            JsonNode accounts = root.path("accounts");
            if (accounts.isObject()) {
                Iterator<Map.Entry<String, JsonNode>> fields = accounts.fields();
                while (fields.hasNext()) {
                    Map.Entry<String, JsonNode> entry = fields.next();
                    try {
                        AccountSettings settings = objectMapper.treeToValue(entry.getValue(), AccountSettings.class);
                        if (settings.getAddress() == null) {
                            settings.setAddress(entry.getKey());
                        }
                        result.add(settings);
                    } catch (IOException | IllegalArgumentException e) {
                        log.error("Failed to load account config for {}: {}", entry.getKey(), e.getMessage());
                    }
                }
            } else if (accounts.isArray()) {
                for (JsonNode node : accounts) {
                    result.add(objectMapper.treeToValue(node, AccountSettings.class));
                }
            }
        } catch (IOException e) {
            log.error("Failed to load configuration from {}", path, e);
        }
        return result;
    }

    private static String normalize(String address) {
        return address.trim().toLowerCase(Locale.ROOT);
    }
}
