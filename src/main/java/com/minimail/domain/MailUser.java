package com.minimail.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Registered user, one line of the user registry
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MailUser {

    private String username;
    private String password;  // plain text or {SHA256}hex
}
