/**
 * MQTT发布释放包
 *
 * @author zhenglin
 * @date 2025/08/06
 */
package com.lmqtt.common.protocol.packet.pubrel;

import com.lmqtt.common.protocol.packet.MqttPacket;
import com.lmqtt.common.protocol.packet.MqttPacketType;
import com.lmqtt.common.protocol.packet.MqttPacketWithId;

/**
 * MQTT PUBREL包定义
 * 
 * 固定头部标志位必须为0010
 *
 * @param packetId 包标识符
 */
public record MqttPubrelPacket(int packetId) implements MqttPacket, MqttPacketWithId {
    
    /**
     * 构造函数验证
     */
    public MqttPubrelPacket {
        MqttPacketWithId.validatePacketId(packetId);
    }
    
    @Override
    public MqttPacketType getPacketType() {
        return MqttPacketType.PUBREL;
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
