package com.minimail.pop3;

import com.minimail.config.ServerProperties;
import com.minimail.domain.MessageInfo;
import com.minimail.domain.StoredMessage;
import com.minimail.protocol.CommandParser;
import com.minimail.protocol.DotStuffing;
import com.minimail.protocol.ParsedCommand;
import com.minimail.service.MailboxHandle;
import com.minimail.service.MailboxLockedException;
import com.minimail.service.MailboxStore;
import com.minimail.service.NoSuchMessageException;
import com.minimail.service.NoSuchUserException;
import com.minimail.service.UserDirectory;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.TooLongFrameException;
import io.netty.handler.timeout.IdleStateEvent;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Netty-based POP3 command handler
 * RFC 1939 subset with CAPA (RFC 2449), TOP and UIDL.
 *
 * Supported commands:
 * - AUTHORIZATION: USER, PASS, APOP (rejected), CAPA, QUIT
 * - TRANSACTION: STAT, LIST, RETR, DELE, RSET, NOOP, TOP, UIDL, CAPA, QUIT
 *
 * Deletions are staged on the {@link MailboxHandle} and committed only on
 * QUIT; any other end of the connection releases the mailbox untouched.
 */
@Slf4j
public class Pop3CommandHandler extends SimpleChannelInboundHandler<ByteBuf> {

    private static final CommandParser<Pop3Verb> PARSER = new CommandParser<>(Pop3Verb.class, Pop3Verb.UNKNOWN);

    private final Pop3Session session = new Pop3Session();
    private final ServerProperties properties;
    private final UserDirectory userDirectory;
    private final MailboxStore mailboxStore;
    private final Counter authFailureCounter;
    private final Counter messagesDeletedCounter;

    public Pop3CommandHandler(ServerProperties properties,
            UserDirectory userDirectory,
            MailboxStore mailboxStore,
            MeterRegistry meterRegistry) {
        this.properties = properties;
        this.userDirectory = userDirectory;
        this.mailboxStore = mailboxStore;
        this.authFailureCounter = Counter.builder("pop3.auth.failure")
                .description("Authentication failures")
                .register(meterRegistry);
        this.messagesDeletedCounter = Counter.builder("pop3.messages.deleted")
                .description("Messages removed on QUIT")
                .register(meterRegistry);
    }

    Pop3Session getSession() {
        return session;
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) {
        session.setRemoteIp(describe(ctx.channel().remoteAddress()));
        log.info("POP3 connection from: {}", session.getRemoteIp());
        ok(ctx, properties.getPop3().getBanner());
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, ByteBuf msg) {
        if (session.getState() == Pop3State.UPDATE || session.getState() == Pop3State.CLOSED) {
            return;
        }

        ParsedCommand<Pop3Verb> command = PARSER.parse(msg.toString(StandardCharsets.UTF_8));
        if (command.getVerb() == Pop3Verb.PASS) {
            log.debug("POP3 << PASS ****");
        } else {
            log.debug("POP3 << {} {}", command.getKeyword(), command.getArgument());
        }

        if (command.getKeyword().isEmpty()) {
            err(ctx, "Empty command");
            return;
        }
        if (command.getVerb().requiresTransaction() && session.getState() != Pop3State.TRANSACTION) {
            err(ctx, "Bad sequence: " + command.getVerb() + " not valid before authentication, use USER/PASS first");
            return;
        }

        switch (command.getVerb()) {
            case USER -> handleUser(ctx, command);
            case PASS -> handlePass(ctx, command);
            case APOP -> handleApop(ctx);
            case STAT -> handleStat(ctx);
            case LIST -> handleList(ctx, command);
            case RETR -> handleRetr(ctx, command);
            case DELE -> handleDele(ctx, command);
            case RSET -> handleRset(ctx);
            case NOOP -> ok(ctx, "");
            case TOP -> handleTop(ctx, command);
            case UIDL -> handleUidl(ctx, command);
            case CAPA -> handleCapa(ctx);
            case QUIT -> handleQuit(ctx);
            case UNKNOWN -> err(ctx, "Command \"" + command.getKeyword() + "\" not recognized");
        }
    }

    // ================================================================
    // AUTHORIZATION state
    // ================================================================

    private void handleUser(ChannelHandlerContext ctx, ParsedCommand<Pop3Verb> command) {
        if (session.getState() != Pop3State.AUTHORIZATION) {
            err(ctx, "Bad sequence: already authenticated");
            return;
        }
        if (session.getUsername() != null) {
            err(ctx, "Bad sequence: USER already accepted, send PASS");
            return;
        }
        if (!command.hasArgument()) {
            err(ctx, "Syntax: USER name");
            return;
        }
        String username = command.getArgument();
        if (!userDirectory.exists(username)) {
            err(ctx, "No mailbox for " + username);
            return;
        }
        session.setUsername(username);
        ok(ctx, username + " is a valid mailbox");
    }

    private void handlePass(ChannelHandlerContext ctx, ParsedCommand<Pop3Verb> command) {
        if (session.getState() != Pop3State.AUTHORIZATION) {
            err(ctx, "Bad sequence: already authenticated");
            return;
        }
        String username = session.getUsername();
        if (username == null) {
            err(ctx, "Bad sequence: send USER first");
            return;
        }
        if (!command.hasArgument()) {
            err(ctx, "Syntax: PASS password");
            return;
        }

        // A failed PASS always returns to the start of AUTHORIZATION
        session.setUsername(null);

        if (!userDirectory.verify(username, command.getArgument())) {
            handleAuthFailure(ctx, username);
            return;
        }

        try {
            MailboxHandle mailbox = mailboxStore.acquire(username);
            session.setUsername(username);
            session.setMailbox(mailbox);
            session.setState(Pop3State.TRANSACTION);
            log.info("POP3 login: {} from {}", username, session.getRemoteIp());
            ok(ctx, "Maildrop locked and ready (" + mailbox.messageCount() + " messages, "
                    + mailbox.totalSize() + " octets)");
        } catch (MailboxLockedException e) {
            err(ctx, "[IN-USE] Unable to lock maildrop, another session holds it");
        } catch (NoSuchUserException e) {
            err(ctx, "No mailbox for " + username);
        } catch (IOException e) {
            log.error("POP3 failed to open maildrop of {}", username, e);
            err(ctx, "[SYS/TEMP] Unable to open maildrop");
        }
    }

    private void handleAuthFailure(ChannelHandlerContext ctx, String username) {
        session.setAuthFailureCount(session.getAuthFailureCount() + 1);
        authFailureCounter.increment();
        log.warn("POP3 authentication failed for {} from {}", username, session.getRemoteIp());

        if (session.getAuthFailureCount() >= properties.getPop3().getMaxAuthFailures()) {
            session.setState(Pop3State.CLOSED);
            ctx.writeAndFlush("-ERR [AUTH] Too many authentication failures, disconnecting\r\n")
                    .addListener(ChannelFutureListener.CLOSE);
        } else {
            err(ctx, "[AUTH] Invalid username or password");
        }
    }

    private void handleApop(ChannelHandlerContext ctx) {
        err(ctx, "APOP not supported, use USER/PASS");
    }

    // ================================================================
    // TRANSACTION state
    // ================================================================

    private void handleStat(ChannelHandlerContext ctx) {
        MailboxHandle mailbox = session.getMailbox();
        ok(ctx, mailbox.messageCount() + " " + mailbox.totalSize());
    }

    private void handleList(ChannelHandlerContext ctx, ParsedCommand<Pop3Verb> command) {
        MailboxHandle mailbox = session.getMailbox();
        if (command.hasArgument()) {
            Integer index = parseIndex(ctx, command.getArgument());
            if (index == null) {
                return;
            }
            try {
                ok(ctx, index + " " + mailbox.fetch(index).getSize());
            } catch (NoSuchMessageException e) {
                err(ctx, e.getMessage());
            }
            return;
        }

        List<MessageInfo> listing = mailbox.list();
        StringBuilder response = new StringBuilder();
        response.append("+OK ").append(listing.size()).append(" messages (")
                .append(mailbox.totalSize()).append(" octets)\r\n");
        for (MessageInfo info : listing) {
            response.append(info.getIndex()).append(' ').append(info.getSize()).append("\r\n");
        }
        response.append(".\r\n");
        log.debug("POP3 >> LIST ({} entries)", listing.size());
        ctx.writeAndFlush(response.toString());
    }

    private void handleRetr(ChannelHandlerContext ctx, ParsedCommand<Pop3Verb> command) {
        Integer index = parseIndex(ctx, command.getArgument());
        if (index == null) {
            return;
        }
        try {
            StoredMessage message = session.getMailbox().fetch(index);
            byte[] body = message.getBody();
            respond(ctx, "+OK " + message.getSize() + " octets");
            writeBody(ctx, body, body.length);
        } catch (NoSuchMessageException e) {
            err(ctx, e.getMessage());
        }
    }

    private void handleTop(ChannelHandlerContext ctx, ParsedCommand<Pop3Verb> command) {
        String[] args = command.getArgument().split("\\s+");
        if (args.length != 2) {
            err(ctx, "Syntax: TOP msg n");
            return;
        }
        Integer index = parseIndex(ctx, args[0]);
        if (index == null) {
            return;
        }
        int lines;
        try {
            lines = Integer.parseInt(args[1]);
        } catch (NumberFormatException e) {
            lines = -1;
        }
        if (lines < 0) {
            err(ctx, "Invalid line count: " + args[1]);
            return;
        }
        try {
            byte[] body = session.getMailbox().fetch(index).getBody();
            respond(ctx, "+OK top of message follows");
            writeBody(ctx, body, topLength(body, lines));
        } catch (NoSuchMessageException e) {
            err(ctx, e.getMessage());
        }
    }

    private void handleUidl(ChannelHandlerContext ctx, ParsedCommand<Pop3Verb> command) {
        MailboxHandle mailbox = session.getMailbox();
        try {
            if (command.hasArgument()) {
                Integer index = parseIndex(ctx, command.getArgument());
                if (index != null) {
                    ok(ctx, index + " " + mailbox.fetch(index).getId());
                }
                return;
            }
            StringBuilder response = new StringBuilder("+OK unique-id listing follows\r\n");
            for (MessageInfo info : mailbox.list()) {
                response.append(info.getIndex()).append(' ')
                        .append(mailbox.fetch(info.getIndex()).getId()).append("\r\n");
            }
            response.append(".\r\n");
            ctx.writeAndFlush(response.toString());
        } catch (NoSuchMessageException e) {
            err(ctx, e.getMessage());
        }
    }

    private void handleDele(ChannelHandlerContext ctx, ParsedCommand<Pop3Verb> command) {
        Integer index = parseIndex(ctx, command.getArgument());
        if (index == null) {
            return;
        }
        try {
            session.getMailbox().markDeleted(index);
            ok(ctx, "Message " + index + " deleted");
        } catch (NoSuchMessageException e) {
            err(ctx, e.getMessage());
        }
    }

    private void handleRset(ChannelHandlerContext ctx) {
        MailboxHandle mailbox = session.getMailbox();
        mailbox.clearMarks();
        ok(ctx, "Maildrop has " + mailbox.messageCount() + " messages (" + mailbox.totalSize() + " octets)");
    }

    // ================================================================
    // Any state
    // ================================================================

    private void handleCapa(ChannelHandlerContext ctx) {
        ctx.writeAndFlush("+OK Capability list follows\r\n"
                + "USER\r\n"
                + "TOP\r\n"
                + "UIDL\r\n"
                + "RESP-CODES\r\n"
                + "IMPLEMENTATION MiniMail\r\n"
                + ".\r\n");
    }

    private void handleQuit(ChannelHandlerContext ctx) {
        if (session.getState() != Pop3State.TRANSACTION) {
            session.setState(Pop3State.CLOSED);
            ctx.writeAndFlush("+OK " + properties.getHostname() + " POP3 server signing off\r\n")
                    .addListener(ChannelFutureListener.CLOSE);
            return;
        }

        session.setState(Pop3State.UPDATE);
        MailboxHandle mailbox = session.getMailbox();
        int deleted = mailbox.getDeletionMarks().size();
        int remaining = mailbox.messageCount();
        String reply;
        try {
            mailboxStore.commit(mailbox);
            messagesDeletedCounter.increment(deleted);
            reply = "+OK " + properties.getHostname() + " POP3 server signing off (" + remaining
                    + " messages left)";
        } catch (IOException e) {
            log.error("POP3 commit failed for {}", mailbox.getUsername(), e);
            reply = "-ERR [SYS/TEMP] Some deleted messages not removed";
        } finally {
            mailboxStore.release(mailbox);
            session.setMailbox(null);
            session.setState(Pop3State.CLOSED);
        }
        log.debug("POP3 >> {}", reply);
        ctx.writeAndFlush(reply + "\r\n").addListener(ChannelFutureListener.CLOSE);
    }

    // ================================================================
    // Utilities
    // ================================================================

    private Integer parseIndex(ChannelHandlerContext ctx, String argument) {
        if (argument == null || argument.isEmpty()) {
            err(ctx, "Message number required");
            return null;
        }
        try {
            return Integer.parseInt(argument.trim());
        } catch (NumberFormatException e) {
            err(ctx, "Invalid message number: " + argument);
            return null;
        }
    }

    private void writeBody(ChannelHandlerContext ctx, byte[] body, int length) {
        ByteBuf out = ctx.alloc().buffer(length + 64);
        DotStuffing.writeStuffed(body, 0, length, out);
        ctx.writeAndFlush(out);
    }

    /**
     * Length of the header block, the blank line and the first {@code lines}
     * lines of the body
     */
    static int topLength(byte[] message, int lines) {
        int pos = 0;
        boolean inHeaders = true;
        int bodyLines = 0;
        while (pos < message.length) {
            int lineStart = pos;
            while (pos < message.length && message[pos] != '\n') {
                pos++;
            }
            if (pos < message.length) {
                pos++;
            }
            if (inHeaders) {
                int contentEnd = pos;
                while (contentEnd > lineStart
                        && (message[contentEnd - 1] == '\n' || message[contentEnd - 1] == '\r')) {
                    contentEnd--;
                }
                if (contentEnd == lineStart) {
                    inHeaders = false;
                    if (lines == 0) {
                        return pos;
                    }
                }
            } else if (++bodyLines >= lines) {
                return pos;
            }
        }
        return message.length;
    }

    private void ok(ChannelHandlerContext ctx, String text) {
        respond(ctx, text.isEmpty() ? "+OK" : "+OK " + text);
    }

    private void err(ChannelHandlerContext ctx, String text) {
        respond(ctx, "-ERR " + text);
    }

    private void respond(ChannelHandlerContext ctx, String response) {
        log.debug("POP3 >> {}", response);
        ctx.writeAndFlush(response + "\r\n");
    }

    static String describe(SocketAddress address) {
        if (address instanceof InetSocketAddress inet && inet.getAddress() != null) {
            return inet.getAddress().getHostAddress();
        }
        return String.valueOf(address);
    }

    @Override
    public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
        if (evt instanceof IdleStateEvent) {
            log.warn("POP3 idle timeout for {} in state {}, closing", session.getRemoteIp(), session.getState());
            ctx.writeAndFlush("-ERR Idle timeout, closing connection\r\n")
                    .addListener(ChannelFutureListener.CLOSE);
        } else {
            super.userEventTriggered(ctx, evt);
        }
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        if (cause instanceof TooLongFrameException) {
            err(ctx, "Line too long");
            return;
        }
        String ip = session.getRemoteIp() != null ? session.getRemoteIp() : describe(ctx.channel().remoteAddress());
        String msg = cause.getMessage();
        if ("Connection reset".equals(msg) || cause instanceof IOException) {
            log.debug("POP3 connection reset from {}: {}", ip, msg);
        } else {
            log.error("POP3 error from {}: {}", ip, msg, cause);
        }
        ctx.close();
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) {
        if (session.hasOpenMailbox()) {
            MailboxHandle mailbox = session.getMailbox();
            log.info("POP3 connection from {} closed before QUIT, releasing mailbox of {} without deleting",
                    session.getRemoteIp(), mailbox.getUsername());
            mailboxStore.release(mailbox);
        }
        session.setMailbox(null);
        session.setState(Pop3State.CLOSED);
        log.info("POP3 connection closed: {}", session.getRemoteIp());
    }
}
