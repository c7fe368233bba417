package com.minimail;

import com.minimail.controller.DiagnosticController;
import com.minimail.service.MailboxStore;
import com.minimail.service.UserDirectory;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Application context wiring
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.NONE)
@ActiveProfiles("test")
class MiniMailApplicationTest {

    @TempDir
    static Path storageRoot;

    @Autowired
    private UserDirectory userDirectory;

    @Autowired
    private MailboxStore mailboxStore;

    @Autowired
    private DiagnosticController diagnosticController;

    @BeforeAll
    static void writeRegistry() throws IOException {
        Files.writeString(storageRoot.resolve("users.txt"), "alice a\nbob b\n");
    }

    @DynamicPropertySource
    static void storageProperties(DynamicPropertyRegistry registry) {
        registry.add("minimail.storage.root", () -> storageRoot.toString());
    }

    @Test
    @DisplayName("Context loads the registry from the configured storage root")
    void testContextLoads() {
        assertThat(userDirectory.size()).isEqualTo(2);
        assertThat(mailboxStore.lockedMailboxes()).isEmpty();
    }

    @Test
    @DisplayName("Diagnostic report lists config and storage")
    @SuppressWarnings("unchecked")
    void testDiagnostic() {
        Map<String, Object> report = diagnosticController.diagnostic();

        assertThat(report).containsKeys("config", "ports", "storage");
        Map<String, Object> storage = (Map<String, Object>) report.get("storage");
        assertThat(storage).containsEntry("users", 2);
        Map<String, Object> config = (Map<String, Object>) report.get("config");
        assertThat(config).containsEntry("domain", "localhost");
    }
}
