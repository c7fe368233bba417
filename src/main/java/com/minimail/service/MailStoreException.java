package com.minimail.service;

/**
 * Base class for mailbox store rejections that a protocol handler reports
 * to its peer as a per-command error.
 */
public class MailStoreException extends Exception {

    public MailStoreException(String message) {
        super(message);
    }
}
