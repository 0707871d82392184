/**
 * MQTT发布完成包
 *
 * @author zhenglin
 * @date 2025/08/06
 */
package com.lmqtt.common.protocol.packet.pubcomp;

import com.lmqtt.common.protocol.packet.MqttPacket;
import com.lmqtt.common.protocol.packet.MqttPacketType;
import com.lmqtt.common.protocol.packet.MqttPacketWithId;

/**
 * MQTT PUBCOMP包定义
 *
 * @param packetId 包标识符
 */
public record MqttPubcompPacket(int packetId) implements MqttPacket, MqttPacketWithId {
    
    /**
     * 构造函数验证
     */
    public MqttPubcompPacket {
        MqttPacketWithId.validatePacketId(packetId);
    }
    
    @Override
    public MqttPacketType getPacketType() {
        return MqttPacketType.PUBCOMP;
    }
    
    @Override
    public int getPacketId() {
        return packetId;
    }
}
