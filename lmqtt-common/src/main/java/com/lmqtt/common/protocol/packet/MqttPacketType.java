/**
 * MQTT数据包类型枚举
 *
 * @author zhenglin
 * @date 2025/08/06
 */
package com.lmqtt.common.protocol.packet;

/**
 * 固定报头高4位的控制包类型，值0和15保留
 */
public enum MqttPacketType {
    CONNECT(1),
    CONNACK(2),
    PUBLISH(3),
    PUBACK(4),
    // QoS 2流程，只做编解码
    PUBREC(5),
    PUBREL(6),
    PUBCOMP(7),
    SUBSCRIBE(8),
    SUBACK(9),
    UNSUBSCRIBE(10),
    UNSUBACK(11),
    PINGREQ(12),
    PINGRESP(13),
    DISCONNECT(14);
    
    private static final MqttPacketType[] BY_VALUE = new MqttPacketType[16];
    
    static {
        for (MqttPacketType type : values()) {
            BY_VALUE[type.value] = type;
        }
    }
    
    private final int value;
    
    MqttPacketType(int value) {
        this.value = value;
    }
    
    public int getValue() {
        return value;
    }
    
    /**
     * 根据固定报头中的类型值查找包类型
     *
     * @param value 包类型值（4位）
     * @return 包类型，保留值或越界返回null
     */
    public static MqttPacketType fromValue(int value) {
        return value >= 0 && value < BY_VALUE.length ? BY_VALUE[value] : null;
    }
}
