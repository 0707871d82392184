/**
 * MQTT保持连接监视器
 *
 * @author zhenglin
 * @date 2025/08/08
 */
package com.lmqtt.server.connection;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

/**
 * 周期性检查距离上一次收到入站帧的时间，超过保持连接时间后触发一次超时回调
 */
@Slf4j
public class MqttKeepAliveMonitor {
    
    private final long timeoutMillis;
    
    private final LongSupplier clock;
    
    private final Runnable onTimeout;
    
    private volatile long lastActivity;
    
    private volatile boolean expired;
    
    private ScheduledFuture<?> task;
    
    /**
     * 创建监视器
     *
     * @param timeoutMillis 保持连接时间（毫秒），必须大于0
     * @param clock 毫秒时钟
     * @param onTimeout 超时回调
     */
    public MqttKeepAliveMonitor(long timeoutMillis, LongSupplier clock, Runnable onTimeout) {
        if (timeoutMillis <= 0) {
            throw new IllegalArgumentException("Keep alive timeout must be positive: " + timeoutMillis);
        }
        this.timeoutMillis = timeoutMillis;
        this.clock = clock;
        this.onTimeout = onTimeout;
        this.lastActivity = clock.getAsLong();
    }
    
    /**
     * 按固定间隔开始检查
     *
     * @param scheduler 调度器
     * @param intervalMillis 检查间隔（毫秒）
     */
    public synchronized void start(ScheduledExecutorService scheduler, long intervalMillis) {
        if (task == null) {
            task = scheduler.scheduleAtFixedRate(this::check, intervalMillis, intervalMillis, TimeUnit.MILLISECONDS);
        }
    }
    
    /**
     * 停止检查
     */
    public synchronized void stop() {
        if (task != null) {
            task.cancel(false);
            task = null;
        }
    }
    
    /**
     * 记录收到一个入站帧
     */
    public void touch() {
        lastActivity = clock.getAsLong();
    }
    
    /**
     * 检查是否超时，超时回调只触发一次
     *
     * @return 如果已超时返回true
     */
    public boolean check() {
        if (expired) {
            return true;
        }
        long idle = clock.getAsLong() - lastActivity;
        if (idle <= timeoutMillis) {
            return false;
        }
        
        expired = true;
        log.debug("保持连接超时: 空闲{}ms, 上限{}ms", idle, timeoutMillis);
        stop();
        onTimeout.run();
        return true;
    }
    
    public long getTimeoutMillis() {
        return timeoutMillis;
    }
}
