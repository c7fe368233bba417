package com.minimail.client;

import lombok.Value;

/**
 * A message fetched over POP3, with the raw bytes as the server sent them
 * (dot-unstuffed by the client library)
 */
@Value
public class RetrievedMessage {
    int number;
    String from;
    String subject;
    String text;
    byte[] raw;

    public byte[] getRaw() {
        return raw.clone();
    }
}
