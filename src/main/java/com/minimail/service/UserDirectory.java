package com.minimail.service;

import com.minimail.config.ServerProperties;
import com.minimail.domain.MailUser;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Collections;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * User directory
 * - Loads the flat user registry once at startup
 * - Registry line format: {@code <username> <password>}
 * - Duplicate usernames: the first entry wins
 * - Passwords may be stored as {@code {SHA256}<hex>}
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class UserDirectory {

    static final String SHA256_PREFIX = "{SHA256}";

    private final ServerProperties properties;

    private volatile Map<String, MailUser> users = Collections.emptyMap();

    @PostConstruct
    public void load() {
        Path usersFile = properties.getStorage().getUsersFilePath();
        try {
            load(usersFile);
        } catch (IOException e) {
            log.error("Cannot read user registry {}: {} (no users registered)", usersFile, e.getMessage());
        }
    }

    /**
     * Load (or reload) the registry from the given file
     */
    public void load(Path usersFile) throws IOException {
        Map<String, MailUser> loaded = new LinkedHashMap<>();
        try (BufferedReader reader = Files.newBufferedReader(usersFile, StandardCharsets.UTF_8)) {
            String line;
            int lineNo = 0;
            while ((line = reader.readLine()) != null) {
                lineNo++;
                String trimmed = line.trim();
                if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                    continue;
                }
                String[] parts = trimmed.split("\\s+");
                if (parts.length != 2) {
                    log.warn("User registry {} line {}: malformed entry skipped", usersFile, lineNo);
                    continue;
                }
                if (loaded.containsKey(parts[0])) {
                    log.warn("User registry {} line {}: duplicate user '{}' ignored, first entry wins",
                            usersFile, lineNo, parts[0]);
                    continue;
                }
                loaded.put(parts[0], MailUser.builder()
                        .username(parts[0])
                        .password(parts[1])
                        .build());
            }
        }
        this.users = Collections.unmodifiableMap(loaded);
        log.info("User registry loaded: {} users from {}", loaded.size(), usersFile);
    }

    /**
     * Look up the stored password entry of a user
     */
    public Optional<String> lookup(String username) {
        MailUser user = username == null ? null : users.get(username);
        return Optional.ofNullable(user).map(MailUser::getPassword);
    }

    public boolean exists(String username) {
        return username != null && users.containsKey(username);
    }

    /**
     * Verify a username/password pair
     */
    public boolean verify(String username, String password) {
        Optional<String> stored = lookup(username);
        if (stored.isEmpty() || password == null) {
            log.debug("Authentication failed: user not found - {}", username);
            return false;
        }
        String entry = stored.get();
        boolean result;
        if (entry.startsWith(SHA256_PREFIX)) {
            result = sha256(password).equalsIgnoreCase(entry.substring(SHA256_PREFIX.length()));
        } else {
            result = MessageDigest.isEqual(entry.getBytes(StandardCharsets.UTF_8),
                    password.getBytes(StandardCharsets.UTF_8));
        }
        log.debug("Authentication result for {}: {}", username, result);
        return result;
    }

    public int size() {
        return users.size();
    }

    public Set<String> usernames() {
        return users.keySet();
    }

    static String sha256(String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(input.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }
}
