package com.minimail.pop3;

/**
 * Commands understood by the retrieval server
 */
public enum Pop3Verb {
    USER,
    PASS,
    APOP,
    STAT,
    LIST,
    RETR,
    DELE,
    RSET,
    NOOP,
    TOP,
    UIDL,
    CAPA,
    QUIT,
    UNKNOWN;

    /**
     * Commands allowed only once the maildrop is locked
     */
    public boolean requiresTransaction() {
        return switch (this) {
            case STAT, LIST, RETR, DELE, RSET, NOOP, TOP, UIDL -> true;
            default -> false;
        };
    }
}
