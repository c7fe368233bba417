package com.minimail.pop3;

import com.minimail.service.MailboxHandle;
import lombok.Data;

/**
 * POP3 session context
 * State for a single POP3 client connection
 */
@Data
public class Pop3Session {

    private Pop3State state = Pop3State.AUTHORIZATION;
    private String remoteIp;

    // USER accepted, waiting for PASS
    private String username;
    private int authFailureCount = 0;

    // Held between PASS and QUIT; owns the deletion marks
    private MailboxHandle mailbox;

    public boolean hasOpenMailbox() {
        return mailbox != null && mailbox.isOpen();
    }
}
