package com.minimail.domain;

import lombok.Value;

/**
 * Scan listing entry: 1-based message number and size in octets
 */
@Value
public class MessageInfo {
    int index;
    int size;
}
