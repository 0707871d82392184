/**
 * MQTT断开连接包
 *
 * @author zhenglin
 * @date 2025/08/06
 */
package com.lmqtt.common.protocol.packet.disconnect;

import com.lmqtt.common.protocol.packet.MqttPacket;
import com.lmqtt.common.protocol.packet.MqttPacketType;

/**
 * MQTT DISCONNECT包定义
 * 
 * 客户端发送的最后一个包，表示正常断开
 */
public record MqttDisconnectPacket() implements MqttPacket {
    
    public static final MqttDisconnectPacket INSTANCE = new MqttDisconnectPacket();
    
    @Override
    public MqttPacketType getPacketType() {
        return MqttPacketType.DISCONNECT;
    }
}
