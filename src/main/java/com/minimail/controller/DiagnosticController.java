package com.minimail.controller;

import com.minimail.config.ServerProperties;
import com.minimail.pop3.Pop3Server;
import com.minimail.service.MailboxStore;
import com.minimail.service.UserDirectory;
import com.minimail.smtp.SmtpServer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Server diagnostic endpoint.
 * GET /api/diagnostic reports configuration, listener status, the loaded
 * user count and the mailboxes currently held by a POP3 session.
 */
@Slf4j
@RestController
@RequestMapping("/api/diagnostic")
@RequiredArgsConstructor
public class DiagnosticController {

    private final ServerProperties properties;
    private final UserDirectory userDirectory;
    private final MailboxStore mailboxStore;
    private final SmtpServer smtpServer;
    private final Pop3Server pop3Server;

    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public Map<String, Object> diagnostic() {
        Map<String, Object> result = new LinkedHashMap<>();

        Map<String, Object> config = new LinkedHashMap<>();
        config.put("domain", properties.getDomain());
        config.put("hostname", properties.getHostname());
        config.put("usersFile", properties.getStorage().getUsersFilePath().toString());
        config.put("mailboxDir", properties.getStorage().getMailboxDirPath().toString());
        config.put("maxMessageSize", properties.getSmtp().getMaxMessageSize());
        result.put("config", config);

        Map<String, Object> ports = new LinkedHashMap<>();
        ports.put("smtp", checkPort("SMTP", smtpServer.isRunning(), smtpServer.getPort()));
        ports.put("pop3", checkPort("POP3", pop3Server.isRunning(), pop3Server.getPort()));
        result.put("ports", ports);

        Map<String, Object> storage = new LinkedHashMap<>();
        storage.put("users", userDirectory.size());
        storage.put("lockedMailboxes", mailboxStore.lockedMailboxes());
        result.put("storage", storage);

        log.info("Diagnostic check performed");
        return result;
    }

    private Map<String, Object> checkPort(String name, boolean running, int port) {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("name", name);
        status.put("port", port);
        status.put("running", running);

        if (port <= 0) {
            status.put("localListening", false);
            status.put("status", "FAIL - not bound");
            return status;
        }
        try (Socket socket = new Socket()) {
            socket.connect(new InetSocketAddress("127.0.0.1", port), 2000);
            status.put("localListening", true);
            status.put("status", "OK - port is listening");
        } catch (IOException e) {
            status.put("localListening", false);
            status.put("status", "FAIL - " + e.getMessage());
        }
        return status;
    }
}
