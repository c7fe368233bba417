package com.minimail.smtp;

/**
 * Commands understood by the submission server
 */
public enum SmtpVerb {
    HELO("HELO hostname"),
    EHLO("EHLO hostname"),
    MAIL("MAIL FROM:<address>"),
    RCPT("RCPT TO:<address>"),
    DATA("DATA"),
    RSET("RSET"),
    NOOP("NOOP"),
    VRFY("VRFY <address>"),
    HELP("HELP [command]"),
    QUIT("QUIT"),
    UNKNOWN(null);

    private final String syntax;

    SmtpVerb(String syntax) {
        this.syntax = syntax;
    }

    public String getSyntax() {
        return syntax;
    }
}
