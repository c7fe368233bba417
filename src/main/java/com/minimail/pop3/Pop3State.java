package com.minimail.pop3;

/**
 * POP3 session state machine (RFC 1939 section 3)
 */
public enum Pop3State {
    /** Waiting for USER/PASS */
    AUTHORIZATION,
    /** Maildrop locked - message commands allowed, deletions staged */
    TRANSACTION,
    /** QUIT received in TRANSACTION - staged deletions being committed */
    UPDATE,
    /** Session finished */
    CLOSED
}
