/**
 * MQTT PING请求包
 *
 * @author zhenglin
 * @date 2025/08/06
 */
package com.lmqtt.common.protocol.packet.ping;

import com.lmqtt.common.protocol.packet.MqttPacket;
import com.lmqtt.common.protocol.packet.MqttPacketType;

/**
 * MQTT PINGREQ包定义，没有可变头部和负载
 */
public record MqttPingreqPacket() implements MqttPacket {
    
    public static final MqttPingreqPacket INSTANCE = new MqttPingreqPacket();
    
    @Override
    public MqttPacketType getPacketType() {
        return MqttPacketType.PINGREQ;
    }
}
