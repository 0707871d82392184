/**
 * MQTT订阅包
 *
 * @author zhenglin
 * @date 2025/08/06
 */
package com.lmqtt.common.protocol.packet.subscribe;

import com.lmqtt.common.protocol.MqttQos;
import com.lmqtt.common.protocol.packet.MqttPacket;
import com.lmqtt.common.protocol.packet.MqttPacketType;
import com.lmqtt.common.protocol.packet.MqttPacketWithId;

import java.util.List;

/**
 * MQTT SUBSCRIBE包定义
 * 
 * 固定头部标志位必须为0010，负载由重复的(主题过滤器, QoS)条目组成
 *
 * @param packetId 包标识符
 * @param subscriptions 订阅列表，保持请求顺序
 */
public record MqttSubscribePacket(int packetId, List<MqttTopicSubscription> subscriptions)
        implements MqttPacket, MqttPacketWithId {
    
    /**
     * 构造函数验证
     */
    public MqttSubscribePacket {
        MqttPacketWithId.validatePacketId(packetId);
        if (subscriptions == null) {
            throw new IllegalArgumentException("Subscriptions cannot be null");
        }
        subscriptions = List.copyOf(subscriptions);
    }
    
    @Override
    public MqttPacketType getPacketType() {
        return MqttPacketType.SUBSCRIBE;
    }
    
    @Override
    public int getPacketFlags() {
        return 0x02;
    }
    
    @Override
    public int getPacketId() {
        return packetId;
    }
    
    /**
     * 创建单主题订阅包
     *
     * @param packetId 包标识符
     * @param topicFilter 主题过滤器
     * @param qos 请求的QoS
     * @return SUBSCRIBE包
     */
    public static MqttSubscribePacket create(int packetId, String topicFilter, MqttQos qos) {
        return new MqttSubscribePacket(packetId, List.of(new MqttTopicSubscription(topicFilter, qos)));
    }
}
