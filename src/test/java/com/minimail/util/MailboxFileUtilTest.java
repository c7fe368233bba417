package com.minimail.util;

import com.minimail.domain.StoredMessage;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * MailboxFileUtil unit tests
 */
class MailboxFileUtilTest {

    @TempDir
    Path tempDir;

    private static StoredMessage message(String body) {
        return StoredMessage.builder()
                .id(MailboxFileUtil.generateMessageId())
                .sender("sender@example.com")
                .recipient("alice")
                .body(body.getBytes(StandardCharsets.UTF_8))
                .receivedAt(Instant.ofEpochMilli(1_700_000_000_000L))
                .build();
    }

    @Test
    @DisplayName("Missing mailbox file reads as empty")
    void testReadMissingFile() throws IOException {
        assertThat(MailboxFileUtil.readMailbox(tempDir.resolve("none.mbox"))).isEmpty();
    }

    @Test
    @DisplayName("Append creates the directory and records in order")
    void testAppendInOrder() throws IOException {
        Path file = tempDir.resolve("mailboxes").resolve("alice.mbox");

        MailboxFileUtil.appendRecord(file, message("first"));
        MailboxFileUtil.appendRecord(file, message("second"));

        List<StoredMessage> messages = MailboxFileUtil.readMailbox(file);
        assertThat(messages).hasSize(2);
        assertThat(new String(messages.get(1).getBody(), StandardCharsets.UTF_8)).isEqualTo("second");
        assertThat(messages.get(0).getReceivedAt()).isEqualTo(Instant.ofEpochMilli(1_700_000_000_000L));
    }

    @Test
    @DisplayName("A torn trailing record is ignored")
    void testTornRecordIgnored() throws IOException {
        Path file = tempDir.resolve("alice.mbox");
        MailboxFileUtil.appendRecord(file, message("complete"));

        byte[] partial = MailboxFileUtil.encodeRecord(message("torn"));
        Files.write(file, Arrays.copyOf(partial, partial.length - 3), StandardOpenOption.APPEND);

        List<StoredMessage> messages = MailboxFileUtil.readMailbox(file);
        assertThat(messages).hasSize(1);
        assertThat(new String(messages.get(0).getBody(), StandardCharsets.UTF_8)).isEqualTo("complete");
    }

    @Test
    @DisplayName("A torn record header is ignored")
    void testTornHeaderIgnored() throws IOException {
        Path file = tempDir.resolve("alice.mbox");
        MailboxFileUtil.appendRecord(file, message("complete"));
        Files.write(file, new byte[] {0x4D, 0x4D}, StandardOpenOption.APPEND);

        assertThat(MailboxFileUtil.readMailbox(file)).hasSize(1);
    }

    @Test
    @DisplayName("Append after a torn trailing record cuts the torn bytes first")
    void testAppendAfterTornTail() throws IOException {
        Path file = tempDir.resolve("alice.mbox");
        MailboxFileUtil.appendRecord(file, message("first"));
        long firstLength = Files.size(file);

        byte[] partial = MailboxFileUtil.encodeRecord(message("torn"));
        Files.write(file, Arrays.copyOf(partial, partial.length - 3), StandardOpenOption.APPEND);

        StoredMessage second = message("second");
        MailboxFileUtil.appendRecord(file, second);

        List<StoredMessage> messages = MailboxFileUtil.readMailbox(file);
        assertThat(messages).extracting(m -> new String(m.getBody(), StandardCharsets.UTF_8))
                .containsExactly("first", "second");
        assertThat(Files.size(file)).isEqualTo(firstLength + MailboxFileUtil.encodeRecord(second).length);
    }

    @Test
    @DisplayName("Append after a torn record header cuts the header first")
    void testAppendAfterTornHeader() throws IOException {
        Path file = tempDir.resolve("alice.mbox");
        MailboxFileUtil.appendRecord(file, message("first"));
        Files.write(file, new byte[] {0x4D, 0x4D}, StandardOpenOption.APPEND);

        MailboxFileUtil.appendRecord(file, message("second"));

        assertThat(MailboxFileUtil.readMailbox(file)).hasSize(2);
    }

    @Test
    @DisplayName("Append refuses to write after a bad record magic")
    void testAppendAfterBadMagic() throws IOException {
        Path file = tempDir.resolve("alice.mbox");
        Files.write(file, new byte[] {1, 2, 3, 4, 0, 0, 0, 0});

        assertThatThrownBy(() -> MailboxFileUtil.appendRecord(file, message("second")))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("bad record magic");
        assertThat(Files.size(file)).isEqualTo(8);
    }

    @Test
    @DisplayName("A negative body length is reported as IOException")
    void testNegativeBodyLength() throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (DataOutputStream out = new DataOutputStream(bytes)) {
            out.writeUTF("id");
            out.writeLong(0L);
            out.writeUTF("sender@example.com");
            out.writeInt(0);
            out.writeInt(-5);
        }

        assertThatThrownBy(() -> MailboxFileUtil.decodePayload(bytes.toByteArray()))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("Bad body length");
    }

    @Test
    @DisplayName("A body length past the payload end is reported as IOException")
    void testOversizedBodyLength() throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (DataOutputStream out = new DataOutputStream(bytes)) {
            out.writeUTF("id");
            out.writeLong(0L);
            out.writeUTF("sender@example.com");
            out.writeInt(1);
            out.writeUTF("alice");
            out.writeInt(1000);
            out.write(new byte[] {'x'});
        }

        assertThatThrownBy(() -> MailboxFileUtil.decodePayload(bytes.toByteArray()))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("Bad body length");
    }

    @Test
    @DisplayName("Bad record magic is reported as corruption")
    void testBadMagic() throws IOException {
        Path file = tempDir.resolve("alice.mbox");
        Files.write(file, new byte[] {1, 2, 3, 4, 0, 0, 0, 0});

        assertThatThrownBy(() -> MailboxFileUtil.readMailbox(file))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("bad record magic");
    }

    @Test
    @DisplayName("Rewrite replaces the whole file and leaves no temp file")
    void testRewrite() throws IOException {
        Path file = tempDir.resolve("alice.mbox");
        StoredMessage keep = message("keep");
        MailboxFileUtil.appendRecord(file, message("drop"));
        MailboxFileUtil.appendRecord(file, keep);

        MailboxFileUtil.rewriteMailbox(file, List.of(keep));

        List<StoredMessage> messages = MailboxFileUtil.readMailbox(file);
        assertThat(messages).hasSize(1);
        assertThat(messages.get(0).getId()).isEqualTo(keep.getId());
        try (var entries = Files.list(tempDir)) {
            assertThat(entries).containsExactly(file);
        }
    }

    @Test
    @DisplayName("Message id: 32 hex characters, unique")
    void testGenerateMessageId() {
        String id = MailboxFileUtil.generateMessageId();

        assertThat(id).matches("[0-9a-f]{32}");
        assertThat(MailboxFileUtil.generateMessageId()).isNotEqualTo(id);
    }
}
