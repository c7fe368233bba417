package com.minimail.smtp;

import lombok.Data;

import java.io.ByteArrayOutputStream;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * SMTP session context
 * State for a single SMTP client connection
 */
@Data
public class SmtpSession {

    private SmtpState state = SmtpState.CONNECTED;
    private String clientHostname;
    private String remoteIp;

    // Mail transaction
    private String mailFrom;
    private Set<String> recipients = new LinkedHashSet<>();
    private ByteArrayOutputStream dataBuffer = new ByteArrayOutputStream();

    // Set when the DATA content was discarded (too large or a line too long)
    private boolean dataOverflow = false;
    private boolean dataLineTooLong = false;

    public boolean isGreeted() {
        return state != SmtpState.CONNECTED && state != SmtpState.QUIT;
    }

    /**
     * Reset mail transaction (RSET, HELO/EHLO, end of DATA).
     * The greeting is kept.
     */
    public void resetTransaction() {
        this.mailFrom = null;
        this.recipients.clear();
        this.dataBuffer = new ByteArrayOutputStream();
        this.dataOverflow = false;
        this.dataLineTooLong = false;
        if (state != SmtpState.CONNECTED && state != SmtpState.QUIT) {
            state = SmtpState.GREETED;
        }
    }

    /**
     * Add recipient; false if it was already accepted
     */
    public boolean addRecipient(String recipient) {
        return this.recipients.add(recipient);
    }

    public List<String> getRecipientList() {
        return new ArrayList<>(recipients);
    }

    /**
     * Append one unstuffed DATA line, line ending included
     */
    public void appendData(byte[] line) {
        dataBuffer.write(line, 0, line.length);
    }

    public int getDataSize() {
        return dataBuffer.size();
    }

    /**
     * Return raw DATA bytes
     */
    public byte[] getDataBytes() {
        return dataBuffer.toByteArray();
    }
}
