package com.minimail.client;

import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.UUID;

/**
 * Round-trip check against running servers: submit one message over SMTP,
 * then fetch it back over POP3 and delete it.
 *
 * Usage: MailClientHarness host smtpPort pop3Port user password [domain]
 */
@Slf4j
public class MailClientHarness {

    private final MailClient client;
    private final String domain;

    public MailClientHarness(MailClient client, String domain) {
        this.client = client;
        this.domain = domain;
    }

    /**
     * @return true when the message came back with the same subject and text
     */
    public boolean roundTrip(String username, String password) throws Exception {
        String address = username + "@" + domain;
        String token = UUID.randomUUID().toString();
        String subject = "MiniMail round trip " + token;
        String text = "Round trip check " + token + "\r\n";

        client.send(address, List.of(address), subject, text);

        List<RetrievedMessage> messages = client.fetchAll(username, password, true);
        for (RetrievedMessage message : messages) {
            if (subject.equals(message.getSubject())) {
                boolean textMatches = message.getText().trim().equals(text.trim());
                log.info("Round trip for {}: message #{} found, text {}", username, message.getNumber(),
                        textMatches ? "matches" : "differs");
                return textMatches;
            }
        }
        log.warn("Round trip for {}: message not found among {} fetched", username, messages.size());
        return false;
    }

    public static void main(String[] args) throws Exception {
        if (args.length < 5) {
            System.err.println("Usage: MailClientHarness host smtpPort pop3Port user password [domain]");
            System.exit(2);
        }
        String host = args[0];
        MailClient client = new MailClient(host, Integer.parseInt(args[1]), Integer.parseInt(args[2]));
        String domain = args.length > 5 ? args[5] : "localhost";

        boolean ok = new MailClientHarness(client, domain).roundTrip(args[3], args[4]);
        log.info("Round trip {}", ok ? "PASSED" : "FAILED");
        System.exit(ok ? 0 : 1);
    }
}
