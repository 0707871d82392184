/**
 * MQTT处理器集合
 *
 * @author zhenglin
 * @date 2025/08/08
 */
package com.lmqtt.server.handler;

/**
 * 一个连接使用的全部处理器
 *
 * @param connect 连接处理器
 * @param publish 发布处理器
 * @param subscribe 订阅处理器
 * @param unsubscribe 取消订阅处理器
 * @param disconnect 断开连接回调
 * @param <S> 会话状态类型
 */
public record MqttHandlers<S>(
        ConnectHandler<S> connect,
        PublishHandler<S> publish,
        SubscribeHandler<S> subscribe,
        UnsubscribeHandler<S> unsubscribe,
        DisconnectHandler<S> disconnect) {
    
    /**
     * 构造函数验证
     */
    public MqttHandlers {
        if (connect == null) {
            throw new IllegalArgumentException("Connect handler is required");
        }
        if (publish == null || subscribe == null || unsubscribe == null || disconnect == null) {
            throw new IllegalArgumentException("Handlers cannot be null, use DefaultHandlers instead");
        }
    }
    
    /**
     * 只设置连接处理器，其余使用默认实现
     *
     * @param connect 连接处理器
     * @param <S> 会话状态类型
     * @return 处理器集合
     */
    public static <S> MqttHandlers<S> of(ConnectHandler<S> connect) {
        return new MqttHandlers<>(connect,
                DefaultHandlers.publish(),
                DefaultHandlers.subscribe(),
                DefaultHandlers.unsubscribe(),
                DefaultHandlers.disconnect());
    }
    
    public MqttHandlers<S> withPublish(PublishHandler<S> handler) {
        return new MqttHandlers<>(connect, handler, subscribe, unsubscribe, disconnect);
    }
    
    public MqttHandlers<S> withSubscribe(SubscribeHandler<S> handler) {
        return new MqttHandlers<>(connect, publish, handler, unsubscribe, disconnect);
    }
    
    public MqttHandlers<S> withUnsubscribe(UnsubscribeHandler<S> handler) {
        return new MqttHandlers<>(connect, publish, subscribe, handler, disconnect);
    }
    
    public MqttHandlers<S> withDisconnect(DisconnectHandler<S> handler) {
        return new MqttHandlers<>(connect, publish, subscribe, unsubscribe, handler);
    }
}
