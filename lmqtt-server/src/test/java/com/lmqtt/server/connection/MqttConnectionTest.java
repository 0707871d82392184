/**
 * MQTT连接测试
 *
 * @author zhenglin
 * @date 2025/08/14
 */
package com.lmqtt.server.connection;

import com.lmqtt.common.protocol.codec.MqttCodecErrorType;
import com.lmqtt.common.protocol.codec.MqttCodecException;
import com.lmqtt.common.protocol.packet.connack.MqttConnackPacket;
import com.lmqtt.common.protocol.packet.connack.MqttConnectReturnCode;
import com.lmqtt.common.protocol.packet.connect.MqttConnectPacket;
import com.lmqtt.common.protocol.packet.disconnect.MqttDisconnectPacket;
import com.lmqtt.common.protocol.packet.ping.MqttPingreqPacket;
import com.lmqtt.common.protocol.packet.ping.MqttPingrespPacket;
import com.lmqtt.common.protocol.packet.puback.MqttPubackPacket;
import com.lmqtt.common.protocol.packet.publish.MqttPublishPacket;
import com.lmqtt.server.config.MqttServerConfig;
import com.lmqtt.server.error.MqttCloseReason;
import com.lmqtt.server.error.MqttConnectionException;
import com.lmqtt.server.handler.ConnectHandler;
import com.lmqtt.server.handler.MqttHandlers;
import com.lmqtt.server.message.MqttConnect;
import com.lmqtt.server.message.MqttConnectAck;
import com.lmqtt.server.metrics.MqttMetrics;
import com.lmqtt.server.transport.RecordingTransport;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * MQTT连接测试类
 */
@DisplayName("MQTT连接测试")
class MqttConnectionTest {
    
    private static final byte[] PAYLOAD = "payload".getBytes(StandardCharsets.UTF_8);
    
    private ScheduledExecutorService scheduler;
    
    private RecordingTransport transport;
    
    private MqttMetrics metrics;
    
    private List<String> disconnects;
    
    @BeforeEach
    void setUp() {
        scheduler = Executors.newSingleThreadScheduledExecutor();
        transport = new RecordingTransport();
        metrics = new MqttMetrics(new SimpleMeterRegistry());
        disconnects = new CopyOnWriteArrayList<>();
    }
    
    @AfterEach
    void tearDown() {
        scheduler.shutdownNow();
    }
    
    private MqttConnection<String> connection(ConnectHandler<String> connectHandler, MqttServerConfig config) {
        MqttHandlers<String> handlers = MqttHandlers.of(connectHandler)
                .withDisconnect((session, error) -> disconnects.add(session + ":" + error));
        MqttConnection<String> connection = new MqttConnection<>(handlers, config, metrics, transport, scheduler);
        connection.start();
        return connection;
    }
    
    private MqttConnection<String> connection(ConnectHandler<String> connectHandler) {
        return connection(connectHandler, MqttServerConfig.defaultConfig());
    }
    
    private static ConnectHandler<String> accepting() {
        return connect -> CompletableFuture.completedFuture(connect.ack("session-" + connect.clientId(), false));
    }
    
    private static MqttCloseReason awaitClose(MqttConnection<?> connection) throws Exception {
        return connection.getCloseFuture().get(5, TimeUnit.SECONDS);
    }
    
    @Test
    @DisplayName("接受连接后发送CONNACK")
    void testAccept() {
        MqttConnection<String> connection = connection(connect ->
                CompletableFuture.completedFuture(connect.ack("s1", true)));
        
        connection.onPacket(MqttConnectPacket.create("client-1", 60, false));
        
        assertEquals(List.of(MqttConnackPacket.accepted(true)), transport.written());
        assertEquals(MqttConnection.State.ESTABLISHED, connection.getState());
        assertEquals(MqttHandshake.State.ACCEPTED, connection.getHandshakeState());
        assertEquals("s1", connection.getSession());
        assertEquals("client-1", connection.getClientId());
        assertEquals(1, metrics.getActiveConnections());
    }
    
    @Test
    @DisplayName("拒绝连接后发送CONNACK并关闭")
    void testReject() throws Exception {
        MqttConnection<String> connection = connection(connect ->
                CompletableFuture.completedFuture(connect.<String>notAuthorized()));
        
        connection.onPacket(MqttConnectPacket.create("client-1", 60, true));
        
        assertEquals(MqttCloseReason.CONNECT_REJECTED, awaitClose(connection));
        assertEquals(List.of(MqttConnackPacket.refused(MqttConnectReturnCode.CONNECTION_REFUSED_NOT_AUTHORIZED)),
                transport.written());
        assertFalse(transport.isOpen());
        assertTrue(disconnects.isEmpty());
        assertEquals(MqttHandshake.State.REJECTED, connection.getHandshakeState());
        assertEquals(1.0, metrics.getClosedCount(MqttCloseReason.CONNECT_REJECTED));
    }
    
    @Test
    @DisplayName("第一个包不是CONNECT时协议违规")
    void testFirstPacketNotConnect() throws Exception {
        MqttConnection<String> connection = connection(accepting());
        
        connection.onPacket(MqttPingreqPacket.INSTANCE);
        
        assertEquals(MqttCloseReason.PROTOCOL_VIOLATION, awaitClose(connection));
        assertTrue(transport.written().isEmpty());
        assertFalse(transport.isOpen());
    }
    
    @Test
    @DisplayName("未收到CONNECT时握手超时")
    void testHandshakeTimeout() throws Exception {
        MqttConnection<String> connection = connection(accepting(),
                MqttServerConfig.builder().handshakeTimeoutMillis(50).build());
        
        assertEquals(MqttCloseReason.HANDSHAKE_TIMEOUT, awaitClose(connection));
        assertTrue(MqttCloseReason.HANDSHAKE_TIMEOUT.isError());
        assertTrue(transport.written().isEmpty());
    }
    
    @Test
    @DisplayName("连接处理器未完成时握手超时")
    void testHandshakeTimeoutWhileConnecting() throws Exception {
        CompletableFuture<MqttConnectAck<String>> pending = new CompletableFuture<>();
        MqttConnection<String> connection = connection(connect -> pending,
                MqttServerConfig.builder().handshakeTimeoutMillis(50).build());
        
        connection.onPacket(MqttConnectPacket.create("slow", 60, true));
        
        assertEquals(MqttCloseReason.HANDSHAKE_TIMEOUT, awaitClose(connection));
        assertTrue(pending.isCancelled());
        assertTrue(transport.written().isEmpty());
    }
    
    @Test
    @DisplayName("连接处理器失败")
    void testConnectHandlerFailure() throws Exception {
        MqttConnection<String> connection = connection(connect ->
                CompletableFuture.failedFuture(new IllegalStateException("auth backend down")));
        
        connection.onPacket(MqttConnectPacket.create("client-1", 60, true));
        
        assertEquals(MqttCloseReason.HANDLER_ERROR, awaitClose(connection));
        assertTrue(transport.written().isEmpty());
    }
    
    @Test
    @DisplayName("握手期间到达的包在接受后按顺序处理")
    void testPacketsBufferedWhileConnecting() {
        CompletableFuture<MqttConnectAck<String>> pending = new CompletableFuture<>();
        AtomicReference<MqttConnect> captured = new AtomicReference<>();
        MqttConnection<String> connection = connection(connect -> {
            captured.set(connect);
            return pending;
        });
        
        connection.onPacket(MqttConnectPacket.create("client-1", 60, true));
        connection.onPacket(MqttPingreqPacket.INSTANCE);
        connection.onPacket(MqttPublishPacket.atLeastOnce("t", 4, PAYLOAD));
        assertTrue(transport.written().isEmpty());
        assertEquals(MqttHandshake.State.CONNECTING, connection.getHandshakeState());
        assertTrue(transport.isReadingPaused());
        
        pending.complete(captured.get().ack("s1", false));
        assertFalse(transport.isReadingPaused());
        
        assertEquals(List.of(MqttConnackPacket.accepted(false), MqttPingrespPacket.INSTANCE, new MqttPubackPacket(4)),
                transport.written());
    }
    
    @Test
    @DisplayName("保持连接超时")
    void testKeepAliveTimeout() throws Exception {
        MqttConnection<String> connection = connection(connect -> CompletableFuture.completedFuture(
                        connect.ack("s1", false).idleTimeout(Duration.ofMillis(100))),
                MqttServerConfig.builder().keepAliveCheckIntervalMillis(10).build());
        
        connection.onPacket(MqttConnectPacket.create("client-1", 60, true));
        
        assertEquals(MqttCloseReason.KEEP_ALIVE_TIMEOUT, awaitClose(connection));
        assertEquals(List.of("s1:true"), disconnects);
        assertEquals(1.0, metrics.getClosedCount(MqttCloseReason.KEEP_ALIVE_TIMEOUT));
    }
    
    @Test
    @DisplayName("保持连接时间为0时不检查")
    void testKeepAliveDisabled() throws Exception {
        MqttConnection<String> connection = connection(accepting(),
                MqttServerConfig.builder().keepAliveCheckIntervalMillis(10).build());
        
        connection.onPacket(MqttConnectPacket.create("client-1", 0, true));
        Thread.sleep(100);
        
        assertTrue(connection.isOpen());
    }
    
    @Test
    @DisplayName("关闭时未确认的发布以关闭原因失败")
    void testPendingPublishesFailOnClose() {
        MqttConnection<String> connection = connection(accepting());
        connection.onPacket(MqttConnectPacket.create("client-1", 60, true));
        
        CompletableFuture<Void> completion = connection.getSink().publishAtLeastOnce("out", PAYLOAD, false);
        connection.onTransportClosed();
        
        ExecutionException e = assertThrows(ExecutionException.class, completion::get);
        assertEquals(MqttCloseReason.TRANSPORT_CLOSED, ((MqttConnectionException) e.getCause()).getReason());
        assertEquals(List.of("session-client-1:false"), disconnects);
        assertEquals(0, metrics.getActiveConnections());
    }
    
    @Test
    @DisplayName("DISCONNECT正常关闭")
    void testPeerDisconnect() throws Exception {
        MqttConnection<String> connection = connection(accepting());
        connection.onPacket(MqttConnectPacket.create("client-1", 60, true));
        connection.onPacket(MqttDisconnectPacket.INSTANCE);
        
        assertEquals(MqttCloseReason.PEER_DISCONNECT, awaitClose(connection));
        assertEquals(List.of("session-client-1:false"), disconnects);
        assertFalse(transport.isOpen());
    }
    
    @Test
    @DisplayName("解码失败")
    void testDecodeError() throws Exception {
        MqttConnection<String> connection = connection(accepting());
        connection.onPacket(MqttConnectPacket.create("client-1", 60, true));
        connection.onDecodeError(new MqttCodecException(MqttCodecErrorType.MALFORMED_PACKET, "bad"));
        
        assertEquals(MqttCloseReason.DECODE_ERROR, awaitClose(connection));
        assertEquals(List.of("session-client-1:true"), disconnects);
    }
    
    @Test
    @DisplayName("写失败以IO_ERROR关闭")
    void testWriteFailure() throws Exception {
        transport.setFailWrites(true);
        MqttConnection<String> connection = connection(accepting());
        
        connection.onPacket(MqttConnectPacket.create("client-1", 60, true));
        
        assertEquals(MqttCloseReason.IO_ERROR, awaitClose(connection));
    }
    
    @Test
    @DisplayName("多次关闭只生效一次")
    void testCloseOnce() throws Exception {
        MqttConnection<String> connection = connection(accepting());
        connection.onPacket(MqttConnectPacket.create("client-1", 60, true));
        
        connection.close();
        connection.onTransportClosed();
        connection.onIoError(new RuntimeException("late"));
        
        assertEquals(MqttCloseReason.APPLICATION_CLOSE, awaitClose(connection));
        assertEquals(MqttCloseReason.APPLICATION_CLOSE, connection.getCloseReason());
        assertEquals(1, transport.getCloseCount());
        assertEquals(1, disconnects.size());
        assertEquals(MqttConnection.State.CLOSED, connection.getState());
        
        transport.clear();
        connection.onPacket(MqttPingreqPacket.INSTANCE);
        assertTrue(transport.written().isEmpty());
    }
    
    @Test
    @DisplayName("连接处理器覆盖在途上限")
    void testInflightOverride() {
        List<CompletableFuture<Void>> pending = new CopyOnWriteArrayList<>();
        MqttHandlers<String> handlers = MqttHandlers.<String>of(connect ->
                        CompletableFuture.completedFuture(connect.ack("s", false).inflight(1)))
                .withPublish(publish -> {
                    CompletableFuture<Void> future = new CompletableFuture<>();
                    pending.add(future);
                    return future;
                });
        MqttConnection<String> connection = new MqttConnection<>(handlers, MqttServerConfig.defaultConfig(),
                metrics, transport, scheduler);
        connection.start();
        
        connection.onPacket(MqttConnectPacket.create("client-1", 60, true));
        connection.onPacket(MqttPublishPacket.atLeastOnce("t", 1, PAYLOAD));
        connection.onPacket(MqttPublishPacket.atLeastOnce("t", 2, PAYLOAD));
        assertEquals(1, pending.size());
        
        pending.get(0).complete(null);
        assertEquals(2, pending.size());
    }
}
