/**
 * MQTT连接确认包
 *
 * @author zhenglin
 * @date 2025/08/06
 */
package com.lmqtt.common.protocol.packet.connack;

import com.lmqtt.common.protocol.packet.MqttPacket;
import com.lmqtt.common.protocol.packet.MqttPacketType;

/**
 * MQTT CONNACK包定义
 * 
 * 确认标志字节只有bit 0（会话存在）有意义，其余位为保留位
 *
 * @param sessionPresent 会话存在标志
 * @param returnCode 连接返回码
 */
public record MqttConnackPacket(boolean sessionPresent, MqttConnectReturnCode returnCode) implements MqttPacket {
    
    /**
     * 会话存在标志位
     */
    public static final int SESSION_PRESENT = 0x01;
    
    /**
     * 构造函数验证
     */
    public MqttConnackPacket {
        if (returnCode == null) {
            throw new IllegalArgumentException("Return code cannot be null");
        }
    }
    
    @Override
    public MqttPacketType getPacketType() {
        return MqttPacketType.CONNACK;
    }
    
    /**
     * 创建接受连接的CONNACK包
     *
     * @param sessionPresent 会话存在标志
     * @return CONNACK包
     */
    public static MqttConnackPacket accepted(boolean sessionPresent) {
        return new MqttConnackPacket(sessionPresent, MqttConnectReturnCode.CONNECTION_ACCEPTED);
    }
    
    /**
     * 创建拒绝连接的CONNACK包
     *
     * @param returnCode 拒绝原因
     * @return CONNACK包
     */
    public static MqttConnackPacket refused(MqttConnectReturnCode returnCode) {
        return new MqttConnackPacket(false, returnCode);
    }
}
