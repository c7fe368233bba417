package com.minimail.domain;

import com.minimail.protocol.DotStuffing;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Message as held in a mailbox.
 * The body is the exact DATA content (dot-unstuffed, terminator removed).
 */
@Value
@Builder
public class StoredMessage {

    String id;
    String sender;
    @Singular
    List<String> recipients;
    byte[] body;
    Instant receivedAt;

    public byte[] getBody() {
        return body.clone();
    }

    /**
     * Size in octets as reported by LIST/STAT/RETR: the body with CRLF line
     * endings, as sent on the wire. Stored bytes are left as received.
     */
    public int getSize() {
        return DotStuffing.canonicalLength(body);
    }
}
