/**
 * MQTT取消订阅处理器
 *
 * @author zhenglin
 * @date 2025/08/08
 */
package com.lmqtt.server.handler;

import com.lmqtt.server.message.MqttUnsubscribe;

import java.util.concurrent.CompletableFuture;

/**
 * 处理UNSUBSCRIBE，完成后总是回复UNSUBACK
 *
 * @param <S> 会话状态类型
 */
@FunctionalInterface
public interface UnsubscribeHandler<S> {
    
    CompletableFuture<Void> handle(MqttUnsubscribe<S> unsubscribe);
}
