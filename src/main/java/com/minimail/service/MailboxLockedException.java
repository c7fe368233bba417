package com.minimail.service;

/**
 * Another retrieval session holds the mailbox
 */
public class MailboxLockedException extends MailStoreException {

    public MailboxLockedException(String username) {
        super("Mailbox already locked: " + username);
    }
}
