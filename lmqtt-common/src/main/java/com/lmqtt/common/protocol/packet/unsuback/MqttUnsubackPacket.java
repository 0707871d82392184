/**
 * MQTT取消订阅确认包
 *
 * @author zhenglin
 * @date 2025/08/06
 */
package com.lmqtt.common.protocol.packet.unsuback;

import com.lmqtt.common.protocol.packet.MqttPacket;
import com.lmqtt.common.protocol.packet.MqttPacketType;
import com.lmqtt.common.protocol.packet.MqttPacketWithId;

/**
 * MQTT UNSUBACK包定义
 * 
 * 无论取消订阅的结果如何都会回复
 *
 * @param packetId 包标识符
 */
public record MqttUnsubackPacket(int packetId) implements MqttPacket, MqttPacketWithId {
    
    /**
     * 构造函数验证
     */
    public MqttUnsubackPacket {
        MqttPacketWithId.validatePacketId(packetId);
    }
    
    @Override
    public MqttPacketType getPacketType() {
        return MqttPacketType.UNSUBACK;
    }
    
    @Override
    public int getPacketId() {
        return packetId;
    }
}
