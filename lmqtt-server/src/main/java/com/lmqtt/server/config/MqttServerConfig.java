/**
 * MQTT服务器配置类
 *
 * @author zhenglin
 * @date 2025/08/06
 */
package com.lmqtt.server.config;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * MQTT协议引擎配置
 * 
 * 每个连接使用的默认值，连接处理器可以通过CONNACK视图按连接覆盖保持连接和在途上限
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MqttServerConfig {
    
    /**
     * 默认在途发布处理数上限
     */
    public static final int DEFAULT_INFLIGHT = 15;
    
    /**
     * 默认保持连接检查间隔（毫秒）
     */
    public static final long DEFAULT_KEEP_ALIVE_CHECK_INTERVAL_MILLIS = 1000L;
    
    /**
     * 入站帧最大字节数（剩余长度），0表示不限制
     */
    @Builder.Default
    private int maxFrameSize = 0;
    
    /**
     * 同时执行的发布处理器调用上限，超出的PUBLISH排队等待
     */
    @Builder.Default
    private int inflight = DEFAULT_INFLIGHT;
    
    /**
     * 握手超时（毫秒），0表示不限制
     */
    @Builder.Default
    private long handshakeTimeoutMillis = 0L;
    
    /**
     * 保持连接计时器的检查间隔（毫秒）
     */
    @Builder.Default
    private long keepAliveCheckIntervalMillis = DEFAULT_KEEP_ALIVE_CHECK_INTERVAL_MILLIS;
    
    /**
     * 度量注册表
     */
    @Builder.Default
    private MeterRegistry meterRegistry = new SimpleMeterRegistry();
    
    /**
     * 创建默认配置
     *
     * @return 默认配置
     */
    public static MqttServerConfig defaultConfig() {
        return MqttServerConfig.builder().build();
    }
    
    /**
     * 校验配置
     *
     * @throws IllegalArgumentException 如果配置非法
     */
    public void validate() {
        if (maxFrameSize < 0) {
            throw new IllegalArgumentException("maxFrameSize cannot be negative: " + maxFrameSize);
        }
        if (inflight < 1) {
            throw new IllegalArgumentException("inflight must be positive: " + inflight);
        }
        if (handshakeTimeoutMillis < 0) {
            throw new IllegalArgumentException("handshakeTimeoutMillis cannot be negative: " + handshakeTimeoutMillis);
        }
        if (keepAliveCheckIntervalMillis <= 0) {
            throw new IllegalArgumentException("keepAliveCheckIntervalMillis must be positive: " + keepAliveCheckIntervalMillis);
        }
        if (meterRegistry == null) {
            throw new IllegalArgumentException("meterRegistry cannot be null");
        }
    }
}
