/**
 * MQTT发布处理器
 *
 * @author zhenglin
 * @date 2025/08/08
 */
package com.lmqtt.server.handler;

import com.lmqtt.server.message.MqttPublish;

import java.util.concurrent.CompletableFuture;

/**
 * 处理入站PUBLISH，返回的future完成后才会回复PUBACK
 *
 * @param <S> 会话状态类型
 */
@FunctionalInterface
public interface PublishHandler<S> {
    
    CompletableFuture<Void> handle(MqttPublish<S> publish);
}
