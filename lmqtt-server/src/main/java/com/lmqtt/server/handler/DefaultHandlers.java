/**
 * 默认处理器
 *
 * @author zhenglin
 * @date 2025/08/08
 */
package com.lmqtt.server.handler;

import com.lmqtt.server.message.MqttSubscription;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.CompletableFuture;

/**
 * 应用未设置处理器时使用的默认实现
 * 
 * - 发布：记录警告并确认
 * - 订阅：拒绝所有订阅项
 * - 取消订阅：直接确认
 */
@Slf4j
public final class DefaultHandlers {
    
    private DefaultHandlers() {
    }
    
    public static <S> PublishHandler<S> publish() {
        return publish -> {
            log.warn("未设置发布处理器，忽略消息: topic={}", publish.publishTopic());
            return CompletableFuture.completedFuture(null);
        };
    }
    
    public static <S> SubscribeHandler<S> subscribe() {
        return subscribe -> {
            log.warn("未设置订阅处理器，拒绝{}个订阅", subscribe.size());
            subscribe.subscriptions().forEach(MqttSubscription::fail);
            return CompletableFuture.completedFuture(null);
        };
    }
    
    public static <S> UnsubscribeHandler<S> unsubscribe() {
        return unsubscribe -> {
            log.debug("未设置取消订阅处理器，直接确认: {}", unsubscribe.topicFilters());
            return CompletableFuture.completedFuture(null);
        };
    }
    
    public static <S> DisconnectHandler<S> disconnect() {
        return (session, error) -> {
        };
    }
}
