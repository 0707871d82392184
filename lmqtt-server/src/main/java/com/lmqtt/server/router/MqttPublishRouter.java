/**
 * MQTT发布路由器
 *
 * @author zhenglin
 * @date 2025/08/09
 */
package com.lmqtt.server.router;

import com.lmqtt.common.protocol.topic.MqttTopic;
import com.lmqtt.server.handler.PublishHandler;
import com.lmqtt.server.message.MqttPublish;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 按主题过滤器路由PUBLISH的发布处理器
 * 
 * 按注册顺序匹配主题路径（'?'之前的部分），第一个匹配的处理器生效，
 * 都不匹配时交给默认处理器
 *
 * @param <S> 会话状态类型
 */
@Slf4j
public class MqttPublishRouter<S> implements PublishHandler<S> {
    
    private record Route<S>(MqttTopic filter, PublishHandler<S> handler) {
    }
    
    private final List<Route<S>> routes = new CopyOnWriteArrayList<>();
    
    private volatile PublishHandler<S> defaultHandler = publish -> {
        log.warn("未知主题，忽略消息: {}", publish.publishTopic());
        return CompletableFuture.completedFuture(null);
    };
    
    /**
     * 注册主题过滤器的处理器
     *
     * @param filter 主题过滤器
     * @param handler 处理器
     * @return this
     * @throws com.lmqtt.common.protocol.topic.MqttTopicException 如果过滤器非法
     */
    public MqttPublishRouter<S> resource(String filter, PublishHandler<S> handler) {
        if (handler == null) {
            throw new IllegalArgumentException("Handler cannot be null");
        }
        routes.add(new Route<>(MqttTopic.parse(filter), handler));
        log.debug("注册发布路由: {}", filter);
        return this;
    }
    
    /**
     * 设置没有路由匹配时的处理器
     *
     * @param handler 处理器
     * @return this
     */
    public MqttPublishRouter<S> defaultResource(PublishHandler<S> handler) {
        if (handler == null) {
            throw new IllegalArgumentException("Handler cannot be null");
        }
        this.defaultHandler = handler;
        return this;
    }
    
    @Override
    public CompletableFuture<Void> handle(MqttPublish<S> publish) {
        String topic = publish.topic();
        for (Route<S> route : routes) {
            if (route.filter().matches(topic)) {
                return route.handler().handle(publish);
            }
        }
        return defaultHandler.handle(publish);
    }
    
    public int size() {
        return routes.size();
    }
}
