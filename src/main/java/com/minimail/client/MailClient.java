package com.minimail.client;

import jakarta.mail.Address;
import jakarta.mail.Flags;
import jakarta.mail.Folder;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.Multipart;
import jakarta.mail.Session;
import jakarta.mail.Store;
import jakarta.mail.Transport;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeMessage;
import lombok.extern.slf4j.Slf4j;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Properties;

/**
 * Jakarta Mail client for the MiniMail servers:
 * submits over SMTP and retrieves over POP3 with USER/PASS.
 * Plain connections only.
 */
@Slf4j
public class MailClient {

    private static final int TIMEOUT_MS = 10_000;

    private final String host;
    private final int smtpPort;
    private final int pop3Port;
    private final Session session;

    public MailClient(String host, int smtpPort, int pop3Port) {
        this.host = host;
        this.smtpPort = smtpPort;
        this.pop3Port = pop3Port;

        Properties props = new Properties();
        props.setProperty("mail.mime.charset", "UTF-8");
        props.setProperty("mail.smtp.host", host);
        props.setProperty("mail.smtp.port", String.valueOf(smtpPort));
        props.setProperty("mail.smtp.auth", "false");
        props.setProperty("mail.smtp.connectiontimeout", String.valueOf(TIMEOUT_MS));
        props.setProperty("mail.smtp.timeout", String.valueOf(TIMEOUT_MS));
        props.setProperty("mail.pop3.host", host);
        props.setProperty("mail.pop3.port", String.valueOf(pop3Port));
        props.setProperty("mail.pop3.connectiontimeout", String.valueOf(TIMEOUT_MS));
        props.setProperty("mail.pop3.timeout", String.valueOf(TIMEOUT_MS));
        this.session = Session.getInstance(props);
    }

    /**
     * Submit a plain text message
     *
     * @return the Message-ID header of the sent message
     */
    public String send(String from, List<String> to, String subject, String text) throws MessagingException {
        MimeMessage message = new MimeMessage(session);
        message.setFrom(new InternetAddress(from));
        for (String recipient : to) {
            message.addRecipient(Message.RecipientType.TO, new InternetAddress(recipient));
        }
        message.setSubject(subject, "UTF-8");
        message.setSentDate(new Date());
        message.setText(text, "UTF-8");
        message.saveChanges();

        Transport.send(message);
        log.info("Sent '{}' from {} to {} via {}:{}", subject, from, to, host, smtpPort);
        return message.getMessageID();
    }

    /**
     * Fetch every message of a maildrop
     *
     * @param delete mark all fetched messages deleted and commit on close
     */
    public List<RetrievedMessage> fetchAll(String username, String password, boolean delete)
            throws MessagingException, IOException {
        List<RetrievedMessage> result = new ArrayList<>();
        Store store = session.getStore("pop3");
        store.connect(host, pop3Port, username, password);
        try {
            Folder inbox = store.getFolder("INBOX");
            inbox.open(delete ? Folder.READ_WRITE : Folder.READ_ONLY);
            try {
                for (Message message : inbox.getMessages()) {
                    result.add(toRetrieved(message));
                    if (delete) {
                        message.setFlag(Flags.Flag.DELETED, true);
                    }
                }
            } finally {
                inbox.close(delete);
            }
        } finally {
            store.close();
        }
        log.info("Fetched {} messages for {} via {}:{}{}", result.size(), username, host, pop3Port,
                delete ? " (deleted)" : "");
        return result;
    }

    /**
     * Number of messages in a maildrop
     */
    public int count(String username, String password) throws MessagingException {
        Store store = session.getStore("pop3");
        store.connect(host, pop3Port, username, password);
        try {
            Folder inbox = store.getFolder("INBOX");
            inbox.open(Folder.READ_ONLY);
            try {
                return inbox.getMessageCount();
            } finally {
                inbox.close(false);
            }
        } finally {
            store.close();
        }
    }

    private static RetrievedMessage toRetrieved(Message message) throws MessagingException, IOException {
        ByteArrayOutputStream raw = new ByteArrayOutputStream();
        message.writeTo(raw);

        Address[] from = message.getFrom();
        String subject = message.getSubject();
        return new RetrievedMessage(
                message.getMessageNumber(),
                from != null && from.length > 0 ? from[0].toString() : "unknown@unknown",
                subject != null ? subject : "(No Subject)",
                extractText(message.getContent()),
                raw.toByteArray());
    }

    private static String extractText(Object content) throws MessagingException, IOException {
        if (content instanceof String text) {
            return text;
        }
        if (content instanceof Multipart multipart && multipart.getCount() > 0) {
            return extractText(multipart.getBodyPart(0).getContent());
        }
        return "";
    }
}
