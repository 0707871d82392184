/**
 * MQTT连接处理器
 *
 * @author zhenglin
 * @date 2025/08/08
 */
package com.lmqtt.server.handler;

import com.lmqtt.server.message.MqttConnect;
import com.lmqtt.server.message.MqttConnectAck;

import java.util.concurrent.CompletableFuture;

/**
 * 处理CONNECT，决定接受（并创建会话状态）或拒绝连接
 *
 * @param <S> 会话状态类型
 */
@FunctionalInterface
public interface ConnectHandler<S> {
    
    /**
     * 处理连接请求
     *
     * @param connect CONNECT视图
     * @return 由connect.ack(...)或拒绝方法构造的结果
     */
    CompletableFuture<MqttConnectAck<S>> handle(MqttConnect connect);
}
