package com.minimail.service;

/**
 * The username is not in the user registry
 */
public class NoSuchUserException extends MailStoreException {

    private final String username;

    public NoSuchUserException(String username) {
        super("No such user: " + username);
        this.username = username;
    }

    public String getUsername() {
        return username;
    }
}
