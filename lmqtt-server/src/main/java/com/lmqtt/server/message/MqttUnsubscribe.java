/**
 * UNSUBSCRIBE消息视图
 *
 * @author zhenglin
 * @date 2025/08/08
 */
package com.lmqtt.server.message;

import com.lmqtt.common.protocol.packet.unsubscribe.MqttUnsubscribePacket;

import java.util.List;

/**
 * 传给取消订阅处理器的UNSUBSCRIBE视图
 *
 * @param <S> 会话状态类型
 */
public class MqttUnsubscribe<S> {
    
    private final MqttUnsubscribePacket packet;
    
    private final S session;
    
    public MqttUnsubscribe(MqttUnsubscribePacket packet, S session) {
        this.packet = packet;
        this.session = session;
    }
    
    public int packetId() {
        return packet.packetId();
    }
    
    public List<String> topicFilters() {
        return packet.topicFilters();
    }
    
    public S session() {
        return session;
    }
}
