/**
 * MQTT服务
 *
 * @author zhenglin
 * @date 2025/08/09
 */
package com.lmqtt.server;

import com.lmqtt.server.config.MqttServerConfig;
import com.lmqtt.server.connection.MqttConnection;
import com.lmqtt.server.handler.ConnectHandler;
import com.lmqtt.server.handler.DisconnectHandler;
import com.lmqtt.server.handler.MqttHandlers;
import com.lmqtt.server.handler.PublishHandler;
import com.lmqtt.server.handler.SubscribeHandler;
import com.lmqtt.server.handler.UnsubscribeHandler;
import com.lmqtt.server.metrics.MqttMetrics;
import com.lmqtt.server.netty.initializer.MqttChannelInitializer;
import com.lmqtt.server.transport.MqttTransport;

import java.util.concurrent.ScheduledExecutorService;

/**
 * MQTT协议引擎的组装入口
 * 
 * 配置处理器和参数后，为每个传输连接创建独立的MqttConnection，
 * 或者直接生成Netty的ChannelInitializer
 * 
 * <pre>
 * MqttServer&lt;Session&gt; server = MqttServer.create(connect -&gt; ...)
 *         .publish(router)
 *         .config(MqttServerConfig.builder().inflight(32).build());
 * </pre>
 *
 * @param <S> 会话状态类型
 */
public class MqttServer<S> {
    
    private MqttHandlers<S> handlers;
    
    private MqttServerConfig config = MqttServerConfig.defaultConfig();
    
    private MqttMetrics metrics;
    
    private MqttServer(ConnectHandler<S> connectHandler) {
        this.handlers = MqttHandlers.of(connectHandler);
    }
    
    /**
     * 以连接处理器创建服务
     *
     * @param connectHandler 连接处理器
     * @param <S> 会话状态类型
     * @return 服务
     */
    public static <S> MqttServer<S> create(ConnectHandler<S> connectHandler) {
        return new MqttServer<>(connectHandler);
    }
    
    public MqttServer<S> publish(PublishHandler<S> handler) {
        handlers = handlers.withPublish(handler);
        return this;
    }
    
    public MqttServer<S> subscribe(SubscribeHandler<S> handler) {
        handlers = handlers.withSubscribe(handler);
        return this;
    }
    
    public MqttServer<S> unsubscribe(UnsubscribeHandler<S> handler) {
        handlers = handlers.withUnsubscribe(handler);
        return this;
    }
    
    public MqttServer<S> disconnect(DisconnectHandler<S> handler) {
        handlers = handlers.withDisconnect(handler);
        return this;
    }
    
    /**
     * 设置配置，度量注册表随配置一起替换
     *
     * @param config 配置
     * @return this
     */
    public MqttServer<S> config(MqttServerConfig config) {
        config.validate();
        this.config = config;
        this.metrics = null;
        return this;
    }
    
    /**
     * 为一个传输连接创建协议引擎，调用方负责start()并推送入站数据包
     *
     * @param transport 传输层
     * @param scheduler 调度器
     * @return 连接
     */
    public MqttConnection<S> newConnection(MqttTransport transport, ScheduledExecutorService scheduler) {
        return new MqttConnection<>(handlers, config, getMetrics(), transport, scheduler);
    }
    
    /**
     * 创建Netty管道初始化器
     *
     * @return 初始化器
     */
    public MqttChannelInitializer channelInitializer() {
        return new MqttChannelInitializer(this);
    }
    
    public MqttHandlers<S> getHandlers() {
        return handlers;
    }
    
    public MqttServerConfig getConfig() {
        return config;
    }
    
    public synchronized MqttMetrics getMetrics() {
        if (metrics == null) {
            metrics = new MqttMetrics(config.getMeterRegistry());
        }
        return metrics;
    }
}
