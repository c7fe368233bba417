package com.minimail.client;

import com.minimail.config.ServerProperties;
import com.minimail.pop3.Pop3Server;
import com.minimail.service.MailboxStore;
import com.minimail.service.UserDirectory;
import com.minimail.smtp.SmtpServer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import jakarta.mail.MessagingException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Jakarta Mail client against both servers on ephemeral ports
 */
class MailClientTest {

    @TempDir
    Path tempDir;

    private MailboxStore mailboxStore;
    private SmtpServer smtpServer;
    private Pop3Server pop3Server;
    private MailClient client;

    @BeforeEach
    void setUp() throws Exception {
        ServerProperties properties = new ServerProperties();
        properties.getStorage().setRoot(tempDir.toString());
        properties.getSmtp().setBindAddress("127.0.0.1");
        properties.getSmtp().setPort(0);
        properties.getPop3().setBindAddress("127.0.0.1");
        properties.getPop3().setPort(0);
        properties.getWorkers().setSessionThreads(2);
        Files.writeString(properties.getStorage().getUsersFilePath(), "alice a\nbob b\n");

        UserDirectory userDirectory = new UserDirectory(properties);
        userDirectory.load();
        mailboxStore = new MailboxStore(userDirectory, properties);
        SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();

        smtpServer = new SmtpServer(properties, userDirectory, mailboxStore, meterRegistry);
        pop3Server = new Pop3Server(properties, userDirectory, mailboxStore, meterRegistry);
        smtpServer.bind();
        pop3Server.bind();

        client = new MailClient("127.0.0.1", smtpServer.getPort(), pop3Server.getPort());
    }

    @AfterEach
    void tearDown() {
        smtpServer.stop();
        pop3Server.stop();
    }

    @Test
    @DisplayName("Send, fetch without deleting, then fetch and delete")
    void testSendAndFetch() throws Exception {
        client.send("carol@localhost", List.of("alice@localhost"), "Greetings", "Hello Alice\r\n.single dot line\r\n");

        List<RetrievedMessage> messages = client.fetchAll("alice", "a", false);
        assertThat(messages).hasSize(1);
        RetrievedMessage message = messages.get(0);
        assertThat(message.getNumber()).isEqualTo(1);
        assertThat(message.getSubject()).isEqualTo("Greetings");
        assertThat(message.getFrom()).isEqualTo("carol@localhost");
        assertThat(message.getText()).contains("Hello Alice", ".single dot line");
        assertThat(client.count("alice", "a")).isEqualTo(1);

        client.fetchAll("alice", "a", true);

        assertThat(client.count("alice", "a")).isZero();
        assertThat(mailboxStore.read("alice")).isEmpty();
    }

    @Test
    @DisplayName("Harness round trip succeeds")
    void testHarnessRoundTrip() throws Exception {
        MailClientHarness harness = new MailClientHarness(client, "localhost");

        assertThat(harness.roundTrip("bob", "b")).isTrue();
        assertThat(mailboxStore.read("bob")).isEmpty();
    }

    @Test
    @DisplayName("Wrong password fails to connect")
    void testWrongPassword() {
        assertThatThrownBy(() -> client.count("alice", "wrong"))
                .isInstanceOf(MessagingException.class);
        assertThat(mailboxStore.isLocked("alice")).isFalse();
    }

    @Test
    @DisplayName("Unknown recipient is refused by the server")
    void testUnknownRecipient() throws Exception {
        assertThatThrownBy(() -> client.send("carol@localhost", List.of("nobody@localhost"), "x", "x"))
                .isInstanceOf(MessagingException.class);
        assertThat(mailboxStore.read("alice")).isEmpty();
    }
}
