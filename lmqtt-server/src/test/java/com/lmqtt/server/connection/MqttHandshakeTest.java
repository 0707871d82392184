/**
 * MQTT握手测试
 *
 * @author zhenglin
 * @date 2025/08/14
 */
package com.lmqtt.server.connection;

import com.lmqtt.common.protocol.packet.connect.MqttConnectPacket;
import com.lmqtt.common.protocol.packet.ping.MqttPingreqPacket;
import com.lmqtt.server.error.MqttCloseReason;
import com.lmqtt.server.error.MqttConnectionException;
import com.lmqtt.server.handler.ConnectHandler;
import com.lmqtt.server.message.MqttConnectAck;
import com.lmqtt.server.session.MqttSink;
import com.lmqtt.server.transport.RecordingTransport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@DisplayName("MQTT握手测试")
class MqttHandshakeTest {
    
    private MqttSink sink;
    
    @BeforeEach
    void setUp() {
        sink = new MqttSink(new RecordingTransport(), e -> { });
    }
    
    private static MqttConnectionException failure(MqttHandshake<?> handshake) {
        ExecutionException e = assertThrows(ExecutionException.class, () -> handshake.result().get());
        return assertInstanceOf(MqttConnectionException.class, e.getCause());
    }
    
    @Test
    @DisplayName("接受CONNECT")
    void testAccepted() {
        ConnectHandler<String> handler = connect -> {
            assertSame(sink, connect.sink());
            assertEquals("c1", connect.clientId());
            return CompletableFuture.completedFuture(connect.ack("state", true));
        };
        MqttHandshake<String> handshake = new MqttHandshake<>(handler, sink, 0);
        
        handshake.onPacket(MqttConnectPacket.create("c1", 30, false));
        
        MqttHandshakeResult<String> result = handshake.result().join();
        assertEquals(MqttHandshake.State.ACCEPTED, handshake.getState());
        assertEquals("state", result.ack().getSession());
        assertTrue(result.ack().isSessionPresent());
        assertEquals(30, result.connect().keepAlive());
    }
    
    @Test
    @DisplayName("拒绝CONNECT")
    void testRejected() {
        MqttHandshake<String> handshake = new MqttHandshake<>(
                connect -> CompletableFuture.completedFuture(connect.<String>badUsernameOrPassword()), sink, 0);
        
        handshake.onPacket(MqttConnectPacket.create("c1", 30, true, "user", "wrong"));
        
        assertEquals(MqttHandshake.State.REJECTED, handshake.getState());
        assertFalse(handshake.result().join().ack().isAccepted());
    }
    
    @Test
    @DisplayName("第一个包不是CONNECT")
    void testUnexpectedPacket() {
        MqttHandshake<String> handshake = new MqttHandshake<>(
                connect -> CompletableFuture.completedFuture(connect.ack("s", false)), sink, 0);
        
        handshake.onPacket(MqttPingreqPacket.INSTANCE);
        
        assertEquals(MqttCloseReason.PROTOCOL_VIOLATION, failure(handshake).getReason());
        assertEquals(MqttHandshake.State.FAILED, handshake.getState());
    }
    
    @Test
    @DisplayName("连接处理器同步抛出异常")
    void testHandlerThrows() {
        MqttHandshake<String> handshake = new MqttHandshake<>(connect -> {
            throw new IllegalStateException("boom");
        }, sink, 0);
        
        handshake.onPacket(MqttConnectPacket.create("c1", 30, true));
        
        MqttConnectionException e = failure(handshake);
        assertEquals(MqttCloseReason.HANDLER_ERROR, e.getReason());
        assertInstanceOf(IllegalStateException.class, e.getCause());
    }
    
    @Test
    @DisplayName("连接处理器返回null")
    void testHandlerReturnsNull() {
        MqttHandshake<String> handshake = new MqttHandshake<>(connect -> null, sink, 0);
        
        handshake.onPacket(MqttConnectPacket.create("c1", 30, true));
        
        assertEquals(MqttCloseReason.HANDLER_ERROR, failure(handshake).getReason());
    }
    
    @Test
    @DisplayName("完成后取消超时任务")
    @SuppressWarnings({"unchecked", "rawtypes"})
    void testTimeoutCancelledOnCompletion() {
        ScheduledExecutorService scheduler = mock(ScheduledExecutorService.class);
        ScheduledFuture timeoutTask = mock(ScheduledFuture.class);
        when(scheduler.schedule(any(Runnable.class), eq(1000L), eq(TimeUnit.MILLISECONDS))).thenReturn(timeoutTask);
        
        MqttHandshake<String> handshake = new MqttHandshake<>(
                connect -> CompletableFuture.completedFuture(connect.ack("s", false)), sink, 1000);
        handshake.start(scheduler);
        handshake.onPacket(MqttConnectPacket.create("c1", 30, true));
        
        verify(scheduler).schedule(any(Runnable.class), eq(1000L), eq(TimeUnit.MILLISECONDS));
        verify(timeoutTask).cancel(false);
    }
    
    @Test
    @DisplayName("超时为0时不计时")
    void testNoTimeoutWhenDisabled() {
        ScheduledExecutorService scheduler = mock(ScheduledExecutorService.class);
        MqttHandshake<String> handshake = new MqttHandshake<>(
                connect -> new CompletableFuture<MqttConnectAck<String>>(), sink, 0);
        
        handshake.start(scheduler);
        
        verifyNoInteractions(scheduler);
    }
    
    @Test
    @DisplayName("取消握手")
    void testCancel() {
        CompletableFuture<MqttConnectAck<String>> pending = new CompletableFuture<>();
        MqttHandshake<String> handshake = new MqttHandshake<>(connect -> pending, sink, 0);
        handshake.onPacket(MqttConnectPacket.create("c1", 30, true));
        
        handshake.cancel();
        
        assertTrue(pending.isCancelled());
        assertTrue(handshake.result().isCancelled());
        assertEquals(MqttHandshake.State.FAILED, handshake.getState());
    }
    
    @Test
    @DisplayName("超时后到达的CONNECT被丢弃")
    @SuppressWarnings({"unchecked", "rawtypes"})
    void testPacketAfterTimeoutIgnored() {
        ScheduledExecutorService scheduler = mock(ScheduledExecutorService.class);
        ArgumentCaptor<Runnable> timeout = ArgumentCaptor.forClass(Runnable.class);
        when(scheduler.schedule(timeout.capture(), eq(500L), eq(TimeUnit.MILLISECONDS)))
                .thenReturn(mock(ScheduledFuture.class));
        AtomicInteger invocations = new AtomicInteger();
        MqttHandshake<String> handshake = new MqttHandshake<>(connect -> {
            invocations.incrementAndGet();
            return CompletableFuture.completedFuture(connect.ack("s", false));
        }, sink, 500);
        handshake.start(scheduler);
        
        timeout.getValue().run();
        assertDoesNotThrow(() -> handshake.onPacket(MqttConnectPacket.create("late", 30, true)));
        
        assertEquals(0, invocations.get());
        assertEquals(MqttHandshake.State.FAILED, handshake.getState());
        assertEquals(MqttCloseReason.HANDSHAKE_TIMEOUT, failure(handshake).getReason());
    }
}
