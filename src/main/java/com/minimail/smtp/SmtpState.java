package com.minimail.smtp;

/**
 * SMTP session state machine
 */
public enum SmtpState {
    /** Immediately after connect - waiting for HELO/EHLO */
    CONNECTED,
    /** HELO/EHLO completed - MAIL FROM allowed */
    GREETED,
    /** MAIL FROM completed - RCPT TO allowed */
    MAIL_FROM,
    /** At least one recipient accepted - DATA allowed */
    RCPT_TO,
    /** Receiving DATA lines until the lone "." */
    DATA,
    /** QUIT received - terminal */
    QUIT
}
