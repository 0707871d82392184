/**
 * MQTT发布收到包
 *
 * @author zhenglin
 * @date 2025/08/06
 */
package com.lmqtt.common.protocol.packet.pubrec;

import com.lmqtt.common.protocol.packet.MqttPacket;
import com.lmqtt.common.protocol.packet.MqttPacketType;
import com.lmqtt.common.protocol.packet.MqttPacketWithId;

/**
 * MQTT PUBREC包定义（QoS 2第一步确认）
 *
 * @param packetId 包标识符
 */
public record MqttPubrecPacket(int packetId) implements MqttPacket, MqttPacketWithId {
    
    /**
     * 构造函数验证
     */
    public MqttPubrecPacket {
        MqttPacketWithId.validatePacketId(packetId);
    }
    
    @Override
    public MqttPacketType getPacketType() {
        return MqttPacketType.PUBREC;
    }
    
    @Override
    public int getPacketId() {
        return packetId;
    }
}
