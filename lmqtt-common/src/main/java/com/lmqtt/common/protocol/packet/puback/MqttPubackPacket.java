/**
 * MQTT发布确认包
 *
 * @author zhenglin
 * @date 2025/08/06
 */
package com.lmqtt.common.protocol.packet.puback;

import com.lmqtt.common.protocol.packet.MqttPacket;
import com.lmqtt.common.protocol.packet.MqttPacketType;
import com.lmqtt.common.protocol.packet.MqttPacketWithId;

/**
 * MQTT PUBACK包定义
 * 
 * QoS 1发布确认包，包标识符与被确认的PUBLISH一致
 *
 * @param packetId 包标识符
 */
public record MqttPubackPacket(int packetId) implements MqttPacket, MqttPacketWithId {
    
    /**
     * 构造函数验证
     */
    public MqttPubackPacket {
        MqttPacketWithId.validatePacketId(packetId);
    }
    
    @Override
    public MqttPacketType getPacketType() {
        return MqttPacketType.PUBACK;
    }
    
    @Override
    public int getPacketId() {
        return packetId;
    }
}
