/**
 * MQTT断开连接回调
 *
 * @author zhenglin
 * @date 2025/08/08
 */
package com.lmqtt.server.handler;

/**
 * 已建立的连接关闭时调用一次
 *
 * @param <S> 会话状态类型
 */
@FunctionalInterface
public interface DisconnectHandler<S> {
    
    /**
     * 连接关闭
     *
     * @param session 会话状态
     * @param error 是否因错误关闭
     */
    void onDisconnect(S session, boolean error);
}
