/**
 * MQTT PING响应包
 *
 * @author zhenglin
 * @date 2025/08/06
 */
package com.lmqtt.common.protocol.packet.ping;

import com.lmqtt.common.protocol.packet.MqttPacket;
import com.lmqtt.common.protocol.packet.MqttPacketType;

/**
 * MQTT PINGRESP包定义
 */
public record MqttPingrespPacket() implements MqttPacket {
    
    public static final MqttPingrespPacket INSTANCE = new MqttPingrespPacket();
    
    @Override
    public MqttPacketType getPacketType() {
        return MqttPacketType.PINGRESP;
    }
}
