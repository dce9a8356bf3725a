package com.iksanov.respcache.server.net;

import com.iksanov.respcache.server.command.CommandProcessor;
import com.iksanov.respcache.server.config.ReplicationInfo;
import com.iksanov.respcache.server.config.ServerParameters;
import com.iksanov.respcache.server.core.InMemoryCacheStore;
import com.iksanov.respcache.server.metrics.NetMetrics;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.embedded.EmbeddedChannel;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Runs the full client pipeline built by {@link NetServerInitializer}, in its real handler order,
 * on an {@link EmbeddedChannel}.
 */
class NetServerInitializerTest {

    private NetMetrics metrics;
    private ClientConnectionTracker tracker;
    private EmbeddedChannel channel;

    @BeforeEach
    void setUp() {
        metrics = new NetMetrics();
        tracker = new ClientConnectionTracker(metrics);
        CommandProcessor processor = new CommandProcessor(new InMemoryCacheStore(),
                ServerParameters.of("/tmp/cache", "dump.rdb", 6379), ReplicationInfo.master());
        NetServerInitializer initializer = new NetServerInitializer(processor, 1024 * 1024, 10_000L, tracker, metrics);
        channel = new EmbeddedChannel(new ChannelInitializer<EmbeddedChannel>() {
            @Override
            protected void initChannel(EmbeddedChannel ch) {
                initializer.configure(ch.pipeline());
            }
        });
    }

    @AfterEach
    void tearDown() {
        channel.finishAndReleaseAll();
    }

    @Test
    @DisplayName("Connection open and close are tracked by the first handler")
    void tracksConnection() {
        assertThat(tracker.openClients()).isEqualTo(1);
        assertThat(metrics.openConnections()).isEqualTo(1);

        channel.close();

        assertThat(tracker.openClients()).isZero();
        assertThat(metrics.openConnections()).isZero();
    }

    @Test
    @DisplayName("Commands pass through every handler and are answered")
    void answersThroughFullPipeline() {
        send("*3\r\n$3\r\nSET\r\n$1\r\nk\r\n$1\r\nv\r\n*2\r\n$3\r\nGET\r\n$1\r\nk\r\n");
        assertThat(drain()).isEqualTo("+OK\r\n$1\r\nv\r\n");
    }

    @Test
    @DisplayName("An I/O failure fired from the socket reaches the connection handler")
    void ioFailureReachesConnectionHandler() {
        channel.pipeline().fireExceptionCaught(new IOException("Connection reset by peer"));

        assertThat(channel.isOpen()).isFalse();
        assertThat(drain()).isEmpty();
        assertThat(metrics.channelFailures()).isEqualTo(1.0);
        assertThat(tracker.openClients()).isZero();
        channel.checkException();
    }

    @Test
    @DisplayName("A malformed frame is answered with a protocol error before the channel closes")
    void malformedFrameThroughFullPipeline() {
        send("$4\r\nPING\r\n");

        assertThat(drain()).isEqualTo("-ERR Protocol error: expected '*', got '$'\r\n");
        assertThat(channel.isOpen()).isFalse();
        assertThat(metrics.protocolErrors()).isEqualTo(1.0);
        assertThat(metrics.channelFailures()).isZero();
    }

    @Test
    @DisplayName("Closing all tracked clients closes this channel")
    void closeAllClosesTrackedChannels() {
        tracker.closeAll();
        assertThat(channel.isOpen()).isFalse();
    }

    private void send(String frame) {
        channel.writeInbound(Unpooled.copiedBuffer(frame, StandardCharsets.UTF_8));
    }

    private String drain() {
        StringBuilder sb = new StringBuilder();
        ByteBuf buf;
        while ((buf = channel.readOutbound()) != null) {
            sb.append(buf.toString(StandardCharsets.UTF_8));
            buf.release();
        }
        return sb.toString();
    }
}
