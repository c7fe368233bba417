package com.minimail.service;

/**
 * Message number out of range or already marked for deletion
 */
public class NoSuchMessageException extends MailStoreException {

    private final int index;

    public NoSuchMessageException(int index, String reason) {
        super("Message " + index + " " + reason);
        this.index = index;
    }

    public int getIndex() {
        return index;
    }
}
