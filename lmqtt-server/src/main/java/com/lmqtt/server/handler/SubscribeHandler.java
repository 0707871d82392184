/**
 * MQTT订阅处理器
 *
 * @author zhenglin
 * @date 2025/08/08
 */
package com.lmqtt.server.handler;

import com.lmqtt.server.message.MqttSubscribe;

import java.util.concurrent.CompletableFuture;

/**
 * 处理SUBSCRIBE
 * 
 * 处理器对每个订阅项调用subscribe(qos)或fail()，未处理的订阅项视为失败
 *
 * @param <S> 会话状态类型
 */
@FunctionalInterface
public interface SubscribeHandler<S> {
    
    CompletableFuture<Void> handle(MqttSubscribe<S> subscribe);
}
