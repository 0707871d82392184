/**
 * MQTT服务组装测试
 *
 * @author zhenglin
 * @date 2025/08/15
 */
package com.lmqtt.server;

import com.lmqtt.common.protocol.packet.connack.MqttConnackPacket;
import com.lmqtt.common.protocol.packet.connect.MqttConnectPacket;
import com.lmqtt.server.config.MqttServerConfig;
import com.lmqtt.server.connection.MqttConnection;
import com.lmqtt.server.handler.PublishHandler;
import com.lmqtt.server.transport.RecordingTransport;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

@DisplayName("MQTT服务组装测试")
class MqttServerTest {
    
    @Test
    @DisplayName("为每个传输创建独立连接并共享度量")
    void testNewConnection() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        MqttServer<String> server = MqttServer.<String>create(connect ->
                        CompletableFuture.completedFuture(connect.ack("s", false)))
                .config(MqttServerConfig.builder().meterRegistry(registry).build());
        ScheduledExecutorService scheduler = mock(ScheduledExecutorService.class);
        
        RecordingTransport first = new RecordingTransport();
        RecordingTransport second = new RecordingTransport();
        MqttConnection<String> a = server.newConnection(first, scheduler);
        MqttConnection<String> b = server.newConnection(second, scheduler);
        a.start();
        b.start();
        a.onPacket(MqttConnectPacket.create("a", 0, true));
        
        assertNotSame(a, b);
        assertEquals(List.of(MqttConnackPacket.accepted(false)), first.written());
        assertTrue(second.written().isEmpty());
        assertEquals(2, server.getMetrics().getActiveConnections());
        assertEquals(1.0, registry.get("mqtt.connections.accepted").counter().count());
    }
    
    @Test
    @DisplayName("设置处理器")
    void testHandlers() {
        PublishHandler<String> publish = p -> CompletableFuture.completedFuture(null);
        MqttServer<String> server = MqttServer.<String>create(connect -> null).publish(publish);
        
        assertSame(publish, server.getHandlers().publish());
        assertNotNull(server.getHandlers().subscribe());
        assertNotNull(server.channelInitializer());
    }
    
    @Test
    @DisplayName("非法配置")
    void testInvalidConfig() {
        MqttServer<String> server = MqttServer.create(connect -> null);
        
        assertThrows(IllegalArgumentException.class,
                () -> server.config(MqttServerConfig.builder().inflight(0).build()));
    }
}
