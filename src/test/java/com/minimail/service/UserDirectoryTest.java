package com.minimail.service;

import com.minimail.config.ServerProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * UserDirectory unit tests
 */
class UserDirectoryTest {

    @TempDir
    Path tempDir;

    private ServerProperties properties;
    private UserDirectory userDirectory;

    @BeforeEach
    void setUp() {
        properties = new ServerProperties();
        properties.getStorage().setRoot(tempDir.toString());
        userDirectory = new UserDirectory(properties);
    }

    private void writeRegistry(String content) throws IOException {
        Files.writeString(properties.getStorage().getUsersFilePath(), content);
    }

    @Test
    @DisplayName("Load registry and look up users")
    void testLoadAndLookup() throws IOException {
        writeRegistry("alice secret\nbob hunter2\n");

        userDirectory.load();

        assertThat(userDirectory.size()).isEqualTo(2);
        assertThat(userDirectory.lookup("alice")).contains("secret");
        assertThat(userDirectory.lookup("carol")).isEmpty();
        assertThat(userDirectory.exists("bob")).isTrue();
        assertThat(userDirectory.usernames()).containsExactly("alice", "bob");
    }

    @Test
    @DisplayName("Malformed lines, comments and blank lines are skipped")
    void testMalformedLinesSkipped() throws IOException {
        writeRegistry("# comment\n\nalice secret\nbroken\ntoo many fields here\n  bob   pw  \n");

        userDirectory.load();

        assertThat(userDirectory.usernames()).containsExactly("alice", "bob");
        assertThat(userDirectory.verify("bob", "pw")).isTrue();
    }

    @Test
    @DisplayName("Duplicate username: first entry wins")
    void testDuplicateFirstWins() throws IOException {
        writeRegistry("alice first\nalice second\n");

        userDirectory.load();

        assertThat(userDirectory.size()).isEqualTo(1);
        assertThat(userDirectory.verify("alice", "first")).isTrue();
        assertThat(userDirectory.verify("alice", "second")).isFalse();
    }

    @Test
    @DisplayName("Verify plain and SHA-256 passwords")
    void testVerify() throws IOException {
        writeRegistry("alice secret\nbob " + UserDirectory.SHA256_PREFIX + UserDirectory.sha256("hashed") + "\n");

        userDirectory.load();

        assertThat(userDirectory.verify("alice", "secret")).isTrue();
        assertThat(userDirectory.verify("alice", "Secret")).isFalse();
        assertThat(userDirectory.verify("bob", "hashed")).isTrue();
        assertThat(userDirectory.verify("bob", "wrong")).isFalse();
        assertThat(userDirectory.verify("nobody", "secret")).isFalse();
        assertThat(userDirectory.verify("alice", null)).isFalse();
    }

    @Test
    @DisplayName("Missing registry at startup leaves the directory empty")
    void testMissingRegistry() {
        userDirectory.load();

        assertThat(userDirectory.size()).isZero();
        assertThat(userDirectory.exists("alice")).isFalse();
    }

    @Test
    @DisplayName("Explicit load of a missing file throws")
    void testExplicitLoadMissingFile() {
        assertThatThrownBy(() -> userDirectory.load(tempDir.resolve("absent.txt")))
                .isInstanceOf(IOException.class);
    }

    @Test
    @DisplayName("SHA-256 hex digest")
    void testSha256() {
        assertThat(UserDirectory.sha256("abc"))
                .isEqualTo("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad");
    }
}
