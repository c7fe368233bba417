package com.minimail;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * MiniMail
 *
 * Minimal local mail server (SMTP submission + POP3 retrieval)
 * - Netty-based protocol servers
 * - Flat-file mailbox store with atomic commit
 * - Reactor startup of the listeners
 * - Prometheus metrics monitoring
 */
@SpringBootApplication
@EnableConfigurationProperties
public class MiniMailApplication {

    public static void main(String[] args) {
        SpringApplication.run(MiniMailApplication.class, args);
    }
}
