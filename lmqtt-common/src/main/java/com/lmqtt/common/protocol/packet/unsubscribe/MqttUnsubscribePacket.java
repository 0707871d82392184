/**
 * MQTT取消订阅包
 *
 * @author zhenglin
 * @date 2025/08/06
 */
package com.lmqtt.common.protocol.packet.unsubscribe;

import com.lmqtt.common.protocol.packet.MqttPacket;
import com.lmqtt.common.protocol.packet.MqttPacketType;
import com.lmqtt.common.protocol.packet.MqttPacketWithId;

import java.util.List;

/**
 * MQTT UNSUBSCRIBE包定义
 *
 * @param packetId 包标识符
 * @param topicFilters 要取消的主题过滤器
 */
public record MqttUnsubscribePacket(int packetId, List<String> topicFilters)
        implements MqttPacket, MqttPacketWithId {
    
    /**
     * 构造函数验证
     */
    public MqttUnsubscribePacket {
        MqttPacketWithId.validatePacketId(packetId);
        if (topicFilters == null) {
            throw new IllegalArgumentException("Topic filters cannot be null");
        }
        topicFilters = List.copyOf(topicFilters);
    }
    
    @Override
    public MqttPacketType getPacketType() {
        return MqttPacketType.UNSUBSCRIBE;
    }
    
    @Override
    public int getPacketFlags() {
        return 0x02;
    }
    
    @Override
    public int getPacketId() {
        return packetId;
    }
}
