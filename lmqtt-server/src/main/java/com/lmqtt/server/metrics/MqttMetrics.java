/**
 * MQTT连接指标
 *
 * @author zhenglin
 * @date 2025/08/06
 */
package com.lmqtt.server.metrics;

import com.lmqtt.server.error.MqttCloseReason;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.WeakHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 连接生命周期指标
 * 
 * 关闭计数按原因打标签，超时关闭与协议错误可以分别统计。
 * 同一个MeterRegistry上的多个实例共享活跃连接计数，注册表只保留第一次注册的Gauge
 */
public class MqttMetrics {
    
    private static final Map<MeterRegistry, AtomicLong> ACTIVE_BY_REGISTRY =
            Collections.synchronizedMap(new WeakHashMap<>());
    
    private final MeterRegistry meterRegistry;
    
    private final AtomicLong activeConnections;
    
    private final Counter acceptedConnections;
    
    private final Counter rejectedConnections;
    
    private final Map<MqttCloseReason, Counter> closedConnections = new EnumMap<>(MqttCloseReason.class);
    
    public MqttMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.activeConnections = ACTIVE_BY_REGISTRY.computeIfAbsent(meterRegistry, registry -> {
            AtomicLong active = new AtomicLong(0);
            Gauge.builder("mqtt.connections.active", active, AtomicLong::get)
                    .description("Number of open MQTT connections")
                    .strongReference(true)
                    .register(registry);
            return active;
        });
        this.acceptedConnections = Counter.builder("mqtt.connections.accepted")
                .description("Number of accepted MQTT handshakes")
                .register(meterRegistry);
        this.rejectedConnections = Counter.builder("mqtt.connections.rejected")
                .description("Number of rejected MQTT handshakes")
                .register(meterRegistry);
        
        for (MqttCloseReason reason : MqttCloseReason.values()) {
            closedConnections.put(reason, Counter.builder("mqtt.connections.closed")
                    .description("Number of closed MQTT connections")
                    .tag("reason", reason.name())
                    .tag("category", reason.getCategory().name())
                    .register(meterRegistry));
        }
    }
    
    public void connectionOpened() {
        activeConnections.incrementAndGet();
    }
    
    public void connectionAccepted() {
        acceptedConnections.increment();
    }
    
    public void connectionRejected() {
        rejectedConnections.increment();
    }
    
    /**
     * 记录连接关闭
     *
     * @param reason 关闭原因
     */
    public void connectionClosed(MqttCloseReason reason) {
        activeConnections.decrementAndGet();
        closedConnections.get(reason).increment();
    }
    
    /**
     * 获取注册表上的活跃连接数
     *
     * @return 活跃连接数
     */
    public long getActiveConnections() {
        return activeConnections.get();
    }
    
    /**
     * 获取指定原因的关闭次数
     *
     * @param reason 关闭原因
     * @return 关闭次数
     */
    public double getClosedCount(MqttCloseReason reason) {
        return closedConnections.get(reason).count();
    }
    
    public MeterRegistry getMeterRegistry() {
        return meterRegistry;
    }
}
