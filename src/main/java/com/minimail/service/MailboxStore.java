package com.minimail.service;

import com.minimail.config.ServerProperties;
import com.minimail.domain.StoredMessage;
import com.minimail.util.MailboxFileUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Mailbox store
 * - One append-only record file per user
 * - Record I/O guarded by a per-mailbox read/write lock
 * - Retrieval transactions guarded by a per-mailbox exclusive lock
 * - Deletions applied by rewriting the file and swapping it in atomically
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MailboxStore {

    private final UserDirectory userDirectory;
    private final ServerProperties properties;

    private final Map<String, ReadWriteLock> ioLocks = new ConcurrentHashMap<>();
    private final Map<String, Semaphore> maildropLocks = new ConcurrentHashMap<>();

    /**
     * Deliver a message to a user's mailbox
     */
    public void append(String username, StoredMessage message) throws NoSuchUserException, IOException {
        requireUser(username);
        ReadWriteLock lock = ioLock(username);
        lock.writeLock().lock();
        try {
            MailboxFileUtil.appendRecord(mailboxPath(username), message);
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Message {} appended to mailbox of {} ({} octets)", message.getId(), username, message.getSize());
    }

    /**
     * Build a message with a fresh id and the current time, then append it
     */
    public StoredMessage append(String username, String sender, List<String> recipients, byte[] body)
            throws NoSuchUserException, IOException {
        StoredMessage message = StoredMessage.builder()
                .id(MailboxFileUtil.generateMessageId())
                .sender(sender)
                .recipients(recipients)
                .body(body.clone())
                .receivedAt(Instant.now())
                .build();
        append(username, message);
        return message;
    }

    /**
     * Take the exclusive retrieval lock and load the mailbox snapshot
     */
    public MailboxHandle acquire(String username)
            throws NoSuchUserException, MailboxLockedException, IOException {
        requireUser(username);
        Semaphore maildropLock = maildropLocks.computeIfAbsent(username, k -> new Semaphore(1));
        if (!tryLock(maildropLock)) {
            log.warn("Mailbox of {} already locked", username);
            throw new MailboxLockedException(username);
        }
        try {
            MailboxHandle handle = new MailboxHandle(username, read(username));
            log.info("Mailbox of {} locked ({} messages)", username, handle.snapshotSize());
            return handle;
        } catch (IOException | RuntimeException e) {
            maildropLock.release();
            throw e;
        }
    }

    /**
     * Apply the handle's deletion marks and release the lock.
     * Messages appended after the snapshot are kept.
     */
    public void commit(MailboxHandle handle) throws IOException {
        if (!handle.isOpen()) {
            throw new IllegalStateException("Mailbox handle for " + handle.getUsername() + " already released");
        }
        String username = handle.getUsername();
        try {
            Set<Integer> marks = new TreeSet<>(handle.getDeletionMarks());
            if (marks.isEmpty()) {
                return;
            }
            ReadWriteLock lock = ioLock(username);
            lock.writeLock().lock();
            try {
                Path file = mailboxPath(username);
                List<StoredMessage> current = MailboxFileUtil.readMailbox(file);
                List<StoredMessage> kept = new ArrayList<>(current.size());
                for (int i = 1; i <= current.size(); i++) {
                    if (i <= handle.snapshotSize() && marks.contains(i)) {
                        continue;
                    }
                    kept.add(current.get(i - 1));
                }
                MailboxFileUtil.rewriteMailbox(file, kept);
                log.info("Mailbox of {} committed: {} deleted, {} remaining",
                        username, current.size() - kept.size(), kept.size());
            } finally {
                lock.writeLock().unlock();
            }
        } finally {
            release(handle);
        }
    }

    /**
     * Release the lock without applying deletions. Safe to call twice.
     */
    public void release(MailboxHandle handle) {
        if (!handle.isOpen()) {
            return;
        }
        handle.close();
        Semaphore maildropLock = maildropLocks.get(handle.getUsername());
        if (maildropLock != null) {
            maildropLock.release();
        }
        log.info("Mailbox of {} unlocked", handle.getUsername());
    }

    /**
     * Read the current messages of a mailbox without locking it for retrieval
     */
    public List<StoredMessage> read(String username) throws NoSuchUserException, IOException {
        requireUser(username);
        ReadWriteLock lock = ioLock(username);
        lock.readLock().lock();
        try {
            return MailboxFileUtil.readMailbox(mailboxPath(username));
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean isLocked(String username) {
        Semaphore maildropLock = maildropLocks.get(username);
        return maildropLock != null && maildropLock.availablePermits() == 0;
    }

    public List<String> lockedMailboxes() {
        return maildropLocks.entrySet().stream()
                .filter(e -> e.getValue().availablePermits() == 0)
                .map(Map.Entry::getKey)
                .sorted()
                .toList();
    }

    Path mailboxPath(String username) {
        return properties.getStorage().getMailboxDirPath().resolve(username + ".mbox");
    }

    private void requireUser(String username) throws NoSuchUserException {
        if (!userDirectory.exists(username)) {
            throw new NoSuchUserException(username);
        }
    }

    private ReadWriteLock ioLock(String username) {
        return ioLocks.computeIfAbsent(username, k -> new ReentrantReadWriteLock());
    }

    private boolean tryLock(Semaphore maildropLock) {
        long waitMs = properties.getStorage().getLockWaitMs();
        if (waitMs <= 0) {
            return maildropLock.tryAcquire();
        }
        try {
            return maildropLock.tryAcquire(waitMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
