package com.minimail.pop3;

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
 * POP3 Netty channel initializer
 *
 * Replies go out as strings, message bodies as ready-stuffed ByteBufs.
 */
@RequiredArgsConstructor
public class Pop3ServerInitializer extends ChannelInitializer<SocketChannel> {

    private final ServerProperties properties;
    private final UserDirectory userDirectory;
    private final MailboxStore mailboxStore;
    private final MeterRegistry meterRegistry;
    private final EventExecutorGroup sessionExecutor;

    @Override
    protected void initChannel(SocketChannel ch) {
        ChannelPipeline pipeline = ch.pipeline();

        pipeline.addLast("idleState", new IdleStateHandler(
                properties.getPop3().getTimeout(), 0, 0, TimeUnit.MILLISECONDS));

        pipeline.addLast("framer", new LineBasedFrameDecoder(
                properties.getPop3().getMaxLineLength(), false, false));
        pipeline.addLast("encoder", new StringEncoder(StandardCharsets.UTF_8));

        // POP3 command handler; mailbox loads and commits block on file I/O
        pipeline.addLast(sessionExecutor, "handler", new Pop3CommandHandler(
                properties, userDirectory, mailboxStore, meterRegistry));
    }
}
