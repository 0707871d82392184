/**
 * MQTT连接标志
 *
 * @author zhenglin
 * @date 2025/08/06
 */
package com.lmqtt.common.protocol.packet.connect;

import com.lmqtt.common.protocol.MqttQos;

/**
 * MQTT CONNECT包连接标志定义
 * 
 * 连接标志字节的各个位定义：
 * - bit 7: Username Flag
 * - bit 6: Password Flag  
 * - bit 5: Will Retain
 * - bit 4-3: Will QoS
 * - bit 2: Will Flag
 * - bit 1: Clean Session
 * - bit 0: Reserved (必须为0)
 */
public record MqttConnectFlags(
        boolean cleanSession,
        boolean willFlag,
        MqttQos willQos,
        boolean willRetain,
        boolean usernameFlag,
        boolean passwordFlag) {
    
    public static final int USERNAME = 0x80;
    public static final int PASSWORD = 0x40;
    public static final int WILL_RETAIN = 0x20;
    public static final int WILL_QOS = 0x18;
    public static final int WILL_QOS_SHIFT = 3;
    public static final int WILL = 0x04;
    public static final int CLEAN_SESSION = 0x02;
    public static final int RESERVED = 0x01;
    
    /**
     * 构造函数验证
     */
    public MqttConnectFlags {
        if (willQos == null) {
            throw new IllegalArgumentException("Will QoS cannot be null");
        }
    }
    
    /**
     * 从字节值创建连接标志
     * 
     * 保留位和Will QoS取值由解码器在调用前校验
     *
     * @param flags 标志字节
     * @return MQTT连接标志
     * @throws IllegalArgumentException 如果Will QoS为3
     */
    public static MqttConnectFlags fromByte(int flags) {
        boolean cleanSession = (flags & CLEAN_SESSION) != 0;
        boolean willFlag = (flags & WILL) != 0;
        MqttQos willQos = MqttQos.fromValue((flags & WILL_QOS) >> WILL_QOS_SHIFT);
        boolean willRetain = (flags & WILL_RETAIN) != 0;
        boolean passwordFlag = (flags & PASSWORD) != 0;
        boolean usernameFlag = (flags & USERNAME) != 0;
        
        return new MqttConnectFlags(cleanSession, willFlag, willQos, willRetain, usernameFlag, passwordFlag);
    }
    
    /**
     * 根据CONNECT包内容创建连接标志
     *
     * @param packet CONNECT包
     * @return 连接标志
     */
    public static MqttConnectFlags of(MqttConnectPacket packet) {
        MqttLastWill will = packet.lastWill();
        return new MqttConnectFlags(
                packet.cleanSession(),
                will != null,
                will != null ? will.qos() : MqttQos.AT_MOST_ONCE,
                will != null && will.retain(),
                packet.username() != null,
                packet.password() != null);
    }
    
    /**
     * 转换为字节值
     *
     * @return 标志字节
     */
    public byte toByte() {
        int flags = 0;
        if (cleanSession) {
            flags |= CLEAN_SESSION;
        }
        if (willFlag) {
            flags |= WILL;
            flags |= willQos.getValue() << WILL_QOS_SHIFT;
            if (willRetain) {
                flags |= WILL_RETAIN;
            }
        }
        if (passwordFlag) {
            flags |= PASSWORD;
        }
        if (usernameFlag) {
            flags |= USERNAME;
        }
        return (byte) flags;
    }
}
