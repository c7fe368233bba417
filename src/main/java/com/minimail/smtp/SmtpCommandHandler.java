package com.minimail.smtp;

import com.minimail.config.ServerProperties;
import com.minimail.protocol.CommandParser;
import com.minimail.protocol.DotStuffing;
import com.minimail.protocol.ParsedCommand;
import com.minimail.service.MailboxStore;
import com.minimail.service.NoSuchUserException;
import com.minimail.service.UserDirectory;
import com.minimail.util.AddressUtil;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.TooLongFrameException;
import io.netty.handler.timeout.IdleStateEvent;
import lombok.extern.slf4j.Slf4j;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Netty-based SMTP command handler
 * One instance per connection; drives the submission state machine and
 * delivers completed messages to the local mailboxes.
 */
@Slf4j
public class SmtpCommandHandler extends SimpleChannelInboundHandler<ByteBuf> {

    private static final CommandParser<SmtpVerb> PARSER = new CommandParser<>(SmtpVerb.class, SmtpVerb.UNKNOWN);

    private final SmtpSession session = new SmtpSession();
    private final ServerProperties properties;
    private final UserDirectory userDirectory;
    private final MailboxStore mailboxStore;
    private final Counter mailReceivedCounter;
    private final Counter rcptRejectedCounter;

    public SmtpCommandHandler(ServerProperties properties,
            UserDirectory userDirectory,
            MailboxStore mailboxStore,
            MeterRegistry meterRegistry) {
        this.properties = properties;
        this.userDirectory = userDirectory;
        this.mailboxStore = mailboxStore;
        this.mailReceivedCounter = Counter.builder("smtp.mail.received")
                .description("Number of mails received")
                .register(meterRegistry);
        this.rcptRejectedCounter = Counter.builder("smtp.rcpt.rejected")
                .description("Recipients rejected")
                .register(meterRegistry);
    }

    SmtpSession getSession() {
        return session;
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) {
        session.setRemoteIp(describe(ctx.channel().remoteAddress()));
        log.info("SMTP connection from: {}", session.getRemoteIp());
        respond(ctx, "220 " + properties.getHostname() + " " + properties.getSmtp().getBanner());
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, ByteBuf msg) {
        byte[] line = ByteBufUtil.getBytes(msg);

        // DATA state: preserve original line bytes (no trimming, no decoding)
        if (session.getState() == SmtpState.DATA) {
            handleDataLine(ctx, line);
            return;
        }
        if (session.getState() == SmtpState.QUIT) {
            return;
        }

        ParsedCommand<SmtpVerb> command = PARSER.parse(new String(line, StandardCharsets.UTF_8));
        log.debug("SMTP << {} {}", command.getKeyword(), command.getArgument());

        if (command.getKeyword().isEmpty()) {
            respond(ctx, "500 5.5.2 Error: bad syntax");
            return;
        }

        switch (command.getVerb()) {
            case HELO, EHLO -> handleHelo(ctx, command);
            case MAIL -> handleMailFrom(ctx, command);
            case RCPT -> handleRcptTo(ctx, command);
            case DATA -> handleData(ctx, command);
            case RSET -> handleRset(ctx, command);
            case NOOP -> respond(ctx, "250 2.0.0 OK");
            case VRFY -> handleVrfy(ctx, command);
            case HELP -> handleHelp(ctx, command);
            case QUIT -> handleQuit(ctx);
            case UNKNOWN -> respond(ctx, "500 5.5.2 Error: command \"" + command.getKeyword() + "\" not recognized");
        }
    }

    // ======== HELO / EHLO ========
    private void handleHelo(ChannelHandlerContext ctx, ParsedCommand<SmtpVerb> command) {
        if (!command.hasArgument()) {
            respond(ctx, "501 5.5.4 Syntax: " + command.getVerb().getSyntax());
            return;
        }
        session.setClientHostname(command.getArgument());
        session.setState(SmtpState.GREETED);
        session.resetTransaction();

        if (command.getVerb() == SmtpVerb.EHLO) {
            StringBuilder response = new StringBuilder();
            response.append("250-").append(properties.getHostname()).append(" Hello ")
                    .append(session.getClientHostname()).append("\r\n");
            response.append("250-SIZE ").append(properties.getSmtp().getMaxMessageSize()).append("\r\n");
            response.append("250-8BITMIME\r\n");
            response.append("250-ENHANCEDSTATUSCODES\r\n");
            response.append("250 HELP");
            log.debug("SMTP >> EHLO response: {}", response.toString().replace("\r\n", " | "));
            ctx.writeAndFlush(response + "\r\n");
        } else {
            respond(ctx, "250 " + properties.getHostname() + " Hello " + session.getClientHostname());
        }
    }

    // ======== MAIL FROM ========
    private void handleMailFrom(ChannelHandlerContext ctx, ParsedCommand<SmtpVerb> command) {
        if (!session.isGreeted()) {
            respond(ctx, "503 5.5.1 Error: send HELO first");
            return;
        }
        if (session.getState() != SmtpState.GREETED) {
            respond(ctx, "503 5.5.1 Error: nested MAIL command");
            return;
        }

        String from = AddressUtil.extractPath(command.getArgument(), "FROM:");
        if (from == null) {
            respond(ctx, "501 5.5.4 Syntax: " + SmtpVerb.MAIL.getSyntax());
            return;
        }

        session.setMailFrom(from);
        session.setState(SmtpState.MAIL_FROM);
        respond(ctx, "250 2.1.0 Sender <" + from + "> OK");
    }

    // ======== RCPT TO ========
    private void handleRcptTo(ChannelHandlerContext ctx, ParsedCommand<SmtpVerb> command) {
        if (!session.isGreeted()) {
            respond(ctx, "503 5.5.1 Error: send HELO first");
            return;
        }
        if (session.getState() != SmtpState.MAIL_FROM && session.getState() != SmtpState.RCPT_TO) {
            respond(ctx, "503 5.5.1 Error: need MAIL command");
            return;
        }

        String to = AddressUtil.extractPath(command.getArgument(), "TO:");
        if (to == null || to.isEmpty()) {
            respond(ctx, "501 5.5.4 Syntax: " + SmtpVerb.RCPT.getSyntax());
            return;
        }

        if (session.getRecipients().size() >= properties.getSmtp().getMaxRecipients()) {
            respond(ctx, "452 4.5.3 Too many recipients");
            return;
        }

        if (!isLocalDomain(to)) {
            rcptRejectedCounter.increment();
            log.info("SMTP RCPT rejected (not local): {} from {}", to, session.getRemoteIp());
            respond(ctx, "550 5.7.1 Relaying denied: <" + to + ">");
            return;
        }

        String username = AddressUtil.extractLocalPart(to);
        if (!userDirectory.exists(username)) {
            rcptRejectedCounter.increment();
            log.info("SMTP RCPT rejected (unknown user): {} from {}", to, session.getRemoteIp());
            respond(ctx, "550 5.1.1 Unknown user: <" + to + ">");
            return;
        }

        session.addRecipient(username);
        session.setState(SmtpState.RCPT_TO);
        respond(ctx, "250 2.1.5 Recipient <" + to + "> OK");
    }

    // ======== DATA ========
    private void handleData(ChannelHandlerContext ctx, ParsedCommand<SmtpVerb> command) {
        if (!session.isGreeted()) {
            respond(ctx, "503 5.5.1 Error: send HELO first");
            return;
        }
        if (session.getState() == SmtpState.GREETED) {
            respond(ctx, "503 5.5.1 Error: need MAIL command");
            return;
        }
        if (session.getState() != SmtpState.RCPT_TO) {
            respond(ctx, "503 5.5.1 Error: need RCPT command");
            return;
        }
        if (command.hasArgument()) {
            respond(ctx, "501 5.5.4 Syntax: " + SmtpVerb.DATA.getSyntax());
            return;
        }
        session.setState(SmtpState.DATA);
        respond(ctx, "354 End data with <CR><LF>.<CR><LF>");
    }

    private void handleDataLine(ChannelHandlerContext ctx, byte[] line) {
        if (DotStuffing.isTerminator(line)) {
            processReceivedMail(ctx);
            return;
        }
        if (session.isDataOverflow()) {
            return;
        }

        byte[] data = DotStuffing.unstuff(line);
        if ((long) session.getDataSize() + data.length > properties.getSmtp().getMaxMessageSize()) {
            log.warn("SMTP DATA from {} exceeds {} bytes, discarding",
                    session.getRemoteIp(), properties.getSmtp().getMaxMessageSize());
            session.setDataOverflow(true);
            session.setDataBuffer(new ByteArrayOutputStream());
            return;
        }
        session.appendData(data);
    }

    private void processReceivedMail(ChannelHandlerContext ctx) {
        if (session.isDataOverflow()) {
            respond(ctx, "552 5.3.4 Message size exceeds fixed maximum message size");
            session.resetTransaction();
            return;
        }
        if (session.isDataLineTooLong()) {
            respond(ctx, "554 5.6.0 Message rejected: line too long");
            session.resetTransaction();
            return;
        }

        byte[] body = session.getDataBytes();
        String sender = session.getMailFrom();
        List<String> recipients = session.getRecipientList();
        int failed = 0;

        for (String rcpt : recipients) {
            try {
                mailboxStore.append(rcpt, sender, recipients, body);
            } catch (NoSuchUserException | IOException e) {
                failed++;
                log.error("Failed to deliver message from {} to {}", sender, rcpt, e);
            }
        }

        if (failed == 0) {
            mailReceivedCounter.increment();
            log.info("Mail delivered: from={}, to={}, size={}", sender, recipients, body.length);
            respond(ctx, "250 2.0.0 OK message accepted for delivery");
        } else {
            respond(ctx, "451 4.3.0 Delivery failed for " + failed + " of " + recipients.size() + " recipients");
        }
        session.resetTransaction();
    }

    // ======== RSET ========
    private void handleRset(ChannelHandlerContext ctx, ParsedCommand<SmtpVerb> command) {
        if (command.hasArgument()) {
            respond(ctx, "501 5.5.4 Syntax: " + SmtpVerb.RSET.getSyntax());
            return;
        }
        session.resetTransaction();
        respond(ctx, "250 2.0.0 OK");
    }

    // ======== VRFY ========
    private void handleVrfy(ChannelHandlerContext ctx, ParsedCommand<SmtpVerb> command) {
        if (!command.hasArgument()) {
            respond(ctx, "501 5.5.4 Syntax: " + SmtpVerb.VRFY.getSyntax());
            return;
        }
        String address = AddressUtil.stripAngleBrackets(command.getArgument());
        String username = AddressUtil.extractLocalPart(address);
        if (isLocalDomain(address) && userDirectory.exists(username)) {
            respond(ctx, "250 2.1.5 <" + username + "@" + properties.getDomain() + ">");
        } else {
            respond(ctx, "550 5.1.1 Unknown user: " + address);
        }
    }

    // ======== HELP ========
    private void handleHelp(ChannelHandlerContext ctx, ParsedCommand<SmtpVerb> command) {
        if (!command.hasArgument()) {
            respond(ctx, "214 2.0.0 Supported commands: HELO EHLO MAIL RCPT DATA RSET NOOP VRFY HELP QUIT");
            return;
        }
        SmtpVerb topic = PARSER.parse(command.getArgument()).getVerb();
        if (topic == SmtpVerb.UNKNOWN) {
            respond(ctx, "504 5.5.1 HELP topic unknown: " + command.getArgument());
        } else {
            respond(ctx, "214 2.0.0 Syntax: " + topic.getSyntax());
        }
    }

    // ======== QUIT ========
    private void handleQuit(ChannelHandlerContext ctx) {
        session.setState(SmtpState.QUIT);
        log.debug("SMTP >> 221 closing connection");
        ctx.writeAndFlush("221 2.0.0 " + properties.getHostname() + " closing connection\r\n")
                .addListener(ChannelFutureListener.CLOSE);
    }

    // ======== Utilities ========
    private void respond(ChannelHandlerContext ctx, String response) {
        log.debug("SMTP >> {}", response);
        ctx.writeAndFlush(response + "\r\n");
    }

    private boolean isLocalDomain(String address) {
        String domain = AddressUtil.extractDomain(address);
        return domain == null || domain.equalsIgnoreCase(properties.getDomain());
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
            log.warn("SMTP idle timeout for {} in state {}, closing", session.getRemoteIp(), session.getState());
            ctx.writeAndFlush("421 4.4.2 " + properties.getHostname() + " Idle timeout, closing connection\r\n")
                    .addListener(ChannelFutureListener.CLOSE);
        } else {
            super.userEventTriggered(ctx, evt);
        }
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        if (cause instanceof TooLongFrameException) {
            if (session.getState() == SmtpState.DATA) {
                log.warn("SMTP DATA line too long from {}", session.getRemoteIp());
                session.setDataLineTooLong(true);
            } else {
                respond(ctx, "500 5.5.2 Error: line too long");
            }
            return;
        }
        String ip = session.getRemoteIp() != null ? session.getRemoteIp() : describe(ctx.channel().remoteAddress());
        String msg = cause.getMessage();
        if ("Connection reset".equals(msg) || cause instanceof IOException) {
            log.debug("SMTP connection reset from {}: {}", ip, msg);
        } else {
            log.error("SMTP error from {}: {}", ip, msg, cause);
        }
        ctx.close();
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) {
        if (session.getState() == SmtpState.DATA) {
            log.warn("SMTP connection from {} closed during DATA, message discarded", session.getRemoteIp());
        }
        log.info("SMTP connection closed: {}", session.getRemoteIp());
    }
}
