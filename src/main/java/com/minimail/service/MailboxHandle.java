package com.minimail.service;

import com.minimail.domain.MessageInfo;
import com.minimail.domain.StoredMessage;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Exclusive view of one mailbox for a retrieval transaction.
 * Holds the snapshot taken at acquire time (stable 1-based numbering)
 * and the deletion marks, which only reach storage through
 * {@link MailboxStore#commit(MailboxHandle)}.
 */
public class MailboxHandle {

    private final String username;
    private final List<StoredMessage> messages;
    private final Set<Integer> deletionMarks = new TreeSet<>();
    private volatile boolean open = true;

    MailboxHandle(String username, List<StoredMessage> messages) {
        this.username = username;
        this.messages = List.copyOf(messages);
    }

    public String getUsername() {
        return username;
    }

    public boolean isOpen() {
        return open;
    }

    void close() {
        open = false;
    }

    /**
     * Listing of messages not marked for deletion
     */
    public List<MessageInfo> list() {
        checkOpen();
        List<MessageInfo> result = new ArrayList<>();
        for (int i = 1; i <= messages.size(); i++) {
            if (!deletionMarks.contains(i)) {
                result.add(new MessageInfo(i, messages.get(i - 1).getSize()));
            }
        }
        return result;
    }

    public StoredMessage fetch(int index) throws NoSuchMessageException {
        checkOpen();
        checkIndex(index);
        return messages.get(index - 1);
    }

    /**
     * Mark a message for deletion (in memory only)
     */
    public void markDeleted(int index) throws NoSuchMessageException {
        checkOpen();
        checkIndex(index);
        deletionMarks.add(index);
    }

    public boolean isDeleted(int index) {
        return deletionMarks.contains(index);
    }

    public void clearMarks() {
        checkOpen();
        deletionMarks.clear();
    }

    public Set<Integer> getDeletionMarks() {
        return Collections.unmodifiableSet(deletionMarks);
    }

    /**
     * Number of messages in the snapshot, marked ones included
     */
    public int snapshotSize() {
        return messages.size();
    }

    public int messageCount() {
        return messages.size() - deletionMarks.size();
    }

    public long totalSize() {
        long total = 0;
        for (int i = 1; i <= messages.size(); i++) {
            if (!deletionMarks.contains(i)) {
                total += messages.get(i - 1).getSize();
            }
        }
        return total;
    }

    private void checkIndex(int index) throws NoSuchMessageException {
        if (index < 1 || index > messages.size()) {
            throw new NoSuchMessageException(index, "does not exist");
        }
        if (deletionMarks.contains(index)) {
            throw new NoSuchMessageException(index, "already deleted");
        }
    }

    private void checkOpen() {
        if (!open) {
            throw new IllegalStateException("Mailbox handle for " + username + " already released");
        }
    }
}
