package com.minimail.smtp;

import com.minimail.config.ServerProperties;
import com.minimail.service.MailboxStore;
import com.minimail.service.UserDirectory;
import io.micrometer.core.instrument.MeterRegistry;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.socket.SocketChannel;
import io.netty.handler.codec.LineBasedFrameDecoder;
import io.netty.handler.codec.string.StringEncoder;
import io.netty.handler.timeout.IdleStateHandler;
import io.netty.util.concurrent.EventExecutorGroup;
import lombok.RequiredArgsConstructor;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.TimeUnit;

/**
 * SMTP Netty channel initializer
 *
 * Lines are framed with their CRLF kept so DATA content is stored byte for
 * byte. The command handler runs on the session executor group: mailbox
 * appends block on file I/O and must stay off the I/O event loop.
 */
@RequiredArgsConstructor
public class SmtpServerInitializer extends ChannelInitializer<SocketChannel> {

    private final ServerProperties properties;
    private final UserDirectory userDirectory;
    private final MailboxStore mailboxStore;
    private final MeterRegistry meterRegistry;
    private final EventExecutorGroup sessionExecutor;

    @Override
    protected void initChannel(SocketChannel ch) {
        ChannelPipeline pipeline = ch.pipeline();

        // Idle-read timeout
        pipeline.addLast("idleState", new IdleStateHandler(
                properties.getSmtp().getTimeout(), 0, 0, TimeUnit.MILLISECONDS));

        // Line-based frame decoder (SMTP is line-oriented), delimiter kept
        pipeline.addLast("framer", new LineBasedFrameDecoder(
                properties.getSmtp().getMaxLineLength(), false, false));
        pipeline.addLast("encoder", new StringEncoder(StandardCharsets.UTF_8));

        // SMTP command handler
        pipeline.addLast(sessionExecutor, "handler", new SmtpCommandHandler(
                properties, userDirectory, mailboxStore, meterRegistry));
    }
}
