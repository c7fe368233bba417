package com.minimail.smtp;

import com.minimail.config.ServerProperties;
import com.minimail.service.MailboxStore;
import com.minimail.service.UserDirectory;
import io.micrometer.core.instrument.MeterRegistry;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.logging.LogLevel;
import io.netty.handler.logging.LoggingHandler;
import io.netty.util.concurrent.DefaultEventExecutorGroup;
import io.netty.util.concurrent.EventExecutorGroup;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.net.InetSocketAddress;

/**
 * Netty-based SMTP submission server
 * - RFC 5321 subset: HELO/EHLO, MAIL, RCPT, DATA, RSET, NOOP, VRFY, HELP, QUIT
 * - Local delivery only
 */
@Slf4j
@Component
public class SmtpServer {

    private final ServerProperties properties;
    private final UserDirectory userDirectory;
    private final MailboxStore mailboxStore;
    private final MeterRegistry meterRegistry;

    public SmtpServer(ServerProperties properties,
            UserDirectory userDirectory,
            MailboxStore mailboxStore,
            MeterRegistry meterRegistry) {
        this.properties = properties;
        this.userDirectory = userDirectory;
        this.mailboxStore = mailboxStore;
        this.meterRegistry = meterRegistry;
    }

    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private EventExecutorGroup sessionExecutor;
    private Channel serverChannel;

    @PostConstruct
    public void start() {
        Mono.fromRunnable(this::bind)
                .subscribeOn(Schedulers.boundedElastic())
                .subscribe();
    }

    /**
     * Bind the listening socket; blocks until bound
     */
    public void bind() {
        bossGroup = new NioEventLoopGroup(1);
        workerGroup = new NioEventLoopGroup();
        sessionExecutor = new DefaultEventExecutorGroup(properties.getWorkers().getSessionThreads());

        try {
            ServerBootstrap bootstrap = new ServerBootstrap();
            bootstrap.group(bossGroup, workerGroup)
                    .channel(NioServerSocketChannel.class)
                    .handler(new LoggingHandler(LogLevel.DEBUG))
                    .childHandler(new SmtpServerInitializer(
                            properties, userDirectory, mailboxStore, meterRegistry, sessionExecutor))
                    .option(ChannelOption.SO_BACKLOG, 128)
                    .childOption(ChannelOption.SO_KEEPALIVE, true)
                    .childOption(ChannelOption.TCP_NODELAY, true);

            serverChannel = bootstrap.bind(properties.getSmtp().getBindAddress(), properties.getSmtp().getPort())
                    .sync().channel();
            log.info("=== SMTP Server started on {}:{} ===", properties.getSmtp().getBindAddress(), getPort());

            serverChannel.closeFuture().addListener(future -> {
                log.info("SMTP Server channel closed");
            });
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("SMTP Server start interrupted", e);
        }
    }

    /**
     * Actual listening port (differs from the configured one when that is 0)
     */
    public int getPort() {
        if (serverChannel == null) {
            return -1;
        }
        return ((InetSocketAddress) serverChannel.localAddress()).getPort();
    }

    public boolean isRunning() {
        return serverChannel != null && serverChannel.isActive();
    }

    @PreDestroy
    public void stop() {
        log.info("Shutting down SMTP Server...");
        if (serverChannel != null) {
            serverChannel.close().syncUninterruptibly();
        }
        if (bossGroup != null) {
            bossGroup.shutdownGracefully();
        }
        if (workerGroup != null) {
            workerGroup.shutdownGracefully();
        }
        if (sessionExecutor != null) {
            sessionExecutor.shutdownGracefully();
        }
    }
}
