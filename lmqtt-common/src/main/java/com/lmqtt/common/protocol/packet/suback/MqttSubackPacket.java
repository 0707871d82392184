/**
 * MQTT订阅确认包
 *
 * @author zhenglin
 * @date 2025/08/06
 */
package com.lmqtt.common.protocol.packet.suback;

import com.lmqtt.common.protocol.packet.MqttPacket;
import com.lmqtt.common.protocol.packet.MqttPacketType;
import com.lmqtt.common.protocol.packet.MqttPacketWithId;

import java.util.List;

/**
 * MQTT SUBACK包定义
 * 
 * 返回码顺序与SUBSCRIBE请求中的订阅顺序一致
 *
 * @param packetId 包标识符
 * @param returnCodes 返回码列表
 */
public record MqttSubackPacket(int packetId, List<MqttSubackReturnCode> returnCodes)
        implements MqttPacket, MqttPacketWithId {
    
    /**
     * 构造函数验证
     */
    public MqttSubackPacket {
        MqttPacketWithId.validatePacketId(packetId);
        if (returnCodes == null) {
            throw new IllegalArgumentException("Return codes cannot be null");
        }
        returnCodes = List.copyOf(returnCodes);
    }
    
    @Override
    public MqttPacketType getPacketType() {
        return MqttPacketType.SUBACK;
    }
    
    @Override
    public int getPacketId() {
        return packetId;
    }
}
