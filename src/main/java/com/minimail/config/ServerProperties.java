package com.minimail.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * MiniMail server configuration properties
 */
@Data
@Component
@ConfigurationProperties(prefix = "minimail")
public class ServerProperties {

    private String domain = "localhost";
    private String hostname = "mail.localhost";

    private Smtp smtp = new Smtp();
    private Pop3 pop3 = new Pop3();
    private Storage storage = new Storage();
    private Workers workers = new Workers();

    @Data
    public static class Smtp {
        private String bindAddress = "0.0.0.0";
        private int port = 2525;
        private long timeout = 300000L;
        private long maxMessageSize = 10485760L; // 10MB
        private int maxRecipients = 100;
        private int maxLineLength = 8192;
        private String banner = "MiniMail SMTP Service Ready";
    }

    @Data
    public static class Pop3 {
        private String bindAddress = "0.0.0.0";
        private int port = 1110;
        private long timeout = 600000L;
        private int maxLineLength = 1024;
        private int maxAuthFailures = 3;
        private String banner = "MiniMail POP3 server ready";
    }

    @Data
    public static class Storage {
        private String root = "data";
        private String usersFile = "users.txt";
        private String mailboxDir = "mailboxes";

        /**
         * How long acquire() waits for a held mailbox; 0 fails fast
         */
        private long lockWaitMs = 0L;

        public Path getUsersFilePath() {
            return Paths.get(root).resolve(usersFile);
        }

        public Path getMailboxDirPath() {
            return Paths.get(root).resolve(mailboxDir);
        }
    }

    @Data
    public static class Workers {
        /** Threads running protocol handlers (blocking mailbox I/O) */
        private int sessionThreads = 16;
    }
}
