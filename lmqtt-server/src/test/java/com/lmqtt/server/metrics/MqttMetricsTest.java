/**
 * MQTT连接度量测试
 *
 * @author zhenglin
 * @date 2025/08/14
 */
package com.lmqtt.server.metrics;

import com.lmqtt.server.error.MqttCloseReason;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MQTT连接度量测试")
class MqttMetricsTest {
    
    @Test
    @DisplayName("按关闭原因计数")
    void testClosedByReason() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        MqttMetrics metrics = new MqttMetrics(registry);
        
        metrics.connectionOpened();
        metrics.connectionOpened();
        metrics.connectionAccepted();
        metrics.connectionRejected();
        metrics.connectionClosed(MqttCloseReason.KEEP_ALIVE_TIMEOUT);
        
        assertEquals(1, metrics.getActiveConnections());
        assertEquals(1.0, metrics.getClosedCount(MqttCloseReason.KEEP_ALIVE_TIMEOUT));
        assertEquals(0.0, metrics.getClosedCount(MqttCloseReason.PEER_DISCONNECT));
        assertEquals(1.0, registry.get("mqtt.connections.accepted").counter().count());
        assertEquals(1.0, registry.get("mqtt.connections.rejected").counter().count());
        assertEquals(1.0, registry.get("mqtt.connections.active").gauge().value());
        assertEquals(1.0, registry.get("mqtt.connections.closed")
                .tag("reason", "KEEP_ALIVE_TIMEOUT")
                .tag("category", "TIMEOUT")
                .counter().count());
    }
    
    @Test
    @DisplayName("共享注册表的实例合并活跃连接数")
    void testSharedRegistry() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        MqttMetrics first = new MqttMetrics(registry);
        MqttMetrics second = new MqttMetrics(registry);
        
        first.connectionOpened();
        second.connectionOpened();
        second.connectionOpened();
        second.connectionClosed(MqttCloseReason.PEER_DISCONNECT);
        
        assertEquals(2.0, registry.get("mqtt.connections.active").gauge().value());
        assertEquals(2, first.getActiveConnections());
        assertEquals(1.0, first.getClosedCount(MqttCloseReason.PEER_DISCONNECT));
    }
}
