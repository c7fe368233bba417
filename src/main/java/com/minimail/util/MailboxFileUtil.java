package com.minimail.util;

import com.minimail.domain.StoredMessage;
import lombok.extern.slf4j.Slf4j;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Mailbox file storage utilities
 * File layout: a sequence of self-delimited records
 * <pre>
 *   int magic | int payloadLength | payload
 *   payload = UTF id, long receivedAt, UTF sender,
 *             int rcptCount, UTF rcpt..., int bodyLength, body
 * </pre>
 */
@Slf4j
public final class MailboxFileUtil {

    public static final int RECORD_MAGIC = 0x4D4D5231; // "MMR1"
    private static final int HEADER_SIZE = 8;

    private MailboxFileUtil() {}

    /**
     * Generate a unique message id (used for UIDL)
     */
    public static String generateMessageId() {
        return UUID.randomUUID().toString().replace("-", "");
    }

    /**
     * Encode one message as a complete record (header + payload)
     */
    public static byte[] encodeRecord(StoredMessage message) throws IOException {
        ByteArrayOutputStream payloadBytes = new ByteArrayOutputStream();
        try (DataOutputStream out = new DataOutputStream(payloadBytes)) {
            out.writeUTF(message.getId());
            out.writeLong(message.getReceivedAt().toEpochMilli());
            out.writeUTF(message.getSender() == null ? "" : message.getSender());
            out.writeInt(message.getRecipients().size());
            for (String rcpt : message.getRecipients()) {
                out.writeUTF(rcpt);
            }
            byte[] body = message.getBody();
            out.writeInt(body.length);
            out.write(body);
        }
        byte[] payload = payloadBytes.toByteArray();
        return ByteBuffer.allocate(HEADER_SIZE + payload.length)
                .putInt(RECORD_MAGIC)
                .putInt(payload.length)
                .put(payload)
                .array();
    }

    static StoredMessage decodePayload(byte[] payload) throws IOException {
        try (DataInputStream in = new DataInputStream(new ByteArrayInputStream(payload))) {
            StoredMessage.StoredMessageBuilder builder = StoredMessage.builder()
                    .id(in.readUTF())
                    .receivedAt(Instant.ofEpochMilli(in.readLong()))
                    .sender(in.readUTF());
            int rcptCount = in.readInt();
            if (rcptCount < 0) {
                throw new IOException("Bad recipient count " + rcptCount);
            }
            for (int i = 0; i < rcptCount; i++) {
                builder.recipient(in.readUTF());
            }
            int bodyLength = in.readInt();
            if (bodyLength < 0 || bodyLength > in.available()) {
                throw new IOException("Bad body length " + bodyLength + ", " + in.available() + " bytes left");
            }
            byte[] body = new byte[bodyLength];
            in.readFully(body);
            return builder.body(body).build();
        }
    }

    /**
     * Read all complete records of a mailbox file.
     * A missing file is an empty mailbox; a torn trailing record is skipped.
     */
    public static List<StoredMessage> readMailbox(Path file) throws IOException {
        List<StoredMessage> messages = new ArrayList<>();
        if (!Files.exists(file)) {
            return messages;
        }
        ByteBuffer buffer = ByteBuffer.wrap(Files.readAllBytes(file));
        while (buffer.remaining() > 0) {
            int offset = buffer.position();
            if (buffer.remaining() < HEADER_SIZE) {
                log.warn("Mailbox {}: truncated record header at offset {} ignored", file, offset);
                break;
            }
            int magic = buffer.getInt();
            int length = buffer.getInt();
            if (magic != RECORD_MAGIC) {
                throw new IOException("Mailbox " + file + " corrupt: bad record magic at offset " + offset);
            }
            if (length < 0 || length > buffer.remaining()) {
                log.warn("Mailbox {}: truncated record at offset {} ignored", file, offset);
                break;
            }
            byte[] payload = new byte[length];
            buffer.get(payload);
            messages.add(decodePayload(payload));
        }
        return messages;
    }

    /**
     * Append one record with a single write and force it to disk.
     * A torn trailing record is cut off first so the new record starts on a
     * record boundary. Caller must hold the mailbox write lock.
     */
    public static void appendRecord(Path file, StoredMessage message) throws IOException {
        byte[] record = encodeRecord(message);
        Files.createDirectories(file.toAbsolutePath().getParent());
        try (FileChannel channel = FileChannel.open(file,
                StandardOpenOption.CREATE, StandardOpenOption.READ, StandardOpenOption.WRITE)) {
            long end = completeLength(channel, file);
            if (end < channel.size()) {
                log.warn("Mailbox {}: dropping {} bytes of torn record at offset {}",
                        file, channel.size() - end, end);
                channel.truncate(end);
            }
            ByteBuffer buffer = ByteBuffer.wrap(record);
            long position = end;
            while (buffer.hasRemaining()) {
                position += channel.write(buffer, position);
            }
            channel.force(true);
        }
        log.debug("Record appended: {} ({} bytes)", file, record.length);
    }

    /**
     * Offset just past the last complete record.
     * Walks the record headers; a short header or a length running past the
     * end of the file marks a torn tail.
     */
    static long completeLength(FileChannel channel, Path file) throws IOException {
        long size = channel.size();
        long position = 0;
        ByteBuffer header = ByteBuffer.allocate(HEADER_SIZE);
        while (size - position >= HEADER_SIZE) {
            header.clear();
            while (header.hasRemaining()) {
                if (channel.read(header, position + header.position()) < 0) {
                    return position;
                }
            }
            header.flip();
            int magic = header.getInt();
            int length = header.getInt();
            if (magic != RECORD_MAGIC) {
                throw new IOException("Mailbox " + file + " corrupt: bad record magic at offset " + position);
            }
            if (length < 0 || length > size - position - HEADER_SIZE) {
                return position;
            }
            position += HEADER_SIZE + length;
        }
        return position;
    }

    /**
     * Replace the mailbox file with the given messages.
     * Writes a temp file next to it and moves it into place atomically.
     */
    public static void rewriteMailbox(Path file, List<StoredMessage> messages) throws IOException {
        Path dir = file.toAbsolutePath().getParent();
        Files.createDirectories(dir);
        Path temp = Files.createTempFile(dir, file.getFileName().toString(), ".tmp");
        try {
            try (FileChannel channel = FileChannel.open(temp,
                    StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)) {
                for (StoredMessage message : messages) {
                    ByteBuffer buffer = ByteBuffer.wrap(encodeRecord(message));
                    while (buffer.hasRemaining()) {
                        channel.write(buffer);
                    }
                }
                channel.force(true);
            }
            try {
                Files.move(temp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                log.warn("Atomic move not supported for {}, falling back to replace", file);
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
        log.debug("Mailbox rewritten: {} ({} messages)", file, messages.size());
    }
}
