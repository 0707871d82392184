/**
 * MQTT发布包
 *
 * @author zhenglin
 * @date 2025/08/06
 */
package com.lmqtt.common.protocol.packet.publish;

import com.lmqtt.common.protocol.MqttQos;
import com.lmqtt.common.protocol.packet.MqttPacket;
import com.lmqtt.common.protocol.packet.MqttPacketType;
import com.lmqtt.common.protocol.packet.MqttPacketWithId;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * MQTT PUBLISH包定义
 * 
 * 包标识符仅在QoS大于0时出现（0表示不存在），负载没有长度前缀，占用帧的剩余全部字节
 *
 * @param dup 重复投递标志
 * @param retain 保留标志
 * @param qos QoS等级
 * @param topic 主题名，不能包含通配符
 * @param packetId 包标识符，QoS 0时为0
 * @param payload 消息负载
 */
public record MqttPublishPacket(
        boolean dup,
        boolean retain,
        MqttQos qos,
        String topic,
        int packetId,
        byte[] payload) implements MqttPacket, MqttPacketWithId {
    
    public static final int DUP = 0x08;
    public static final int QOS = 0x06;
    public static final int QOS_SHIFT = 1;
    public static final int RETAIN = 0x01;
    
    /**
     * 构造函数验证
     * 
     * QoS大于0但没有包标识符的包可以构造，编码时报告PACKET_ID_REQUIRED
     */
    public MqttPublishPacket {
        if (qos == null) {
            throw new IllegalArgumentException("QoS cannot be null");
        }
        if (topic == null) {
            throw new IllegalArgumentException("Topic cannot be null");
        }
        if (containsWildcard(topic)) {
            throw new IllegalArgumentException("Publish topic cannot contain wildcards: " + topic);
        }
        if (payload == null) {
            throw new IllegalArgumentException("Payload cannot be null");
        }
        if (qos == MqttQos.AT_MOST_ONCE && packetId != 0) {
            throw new IllegalArgumentException("QoS 0 publish cannot carry a packet ID");
        }
        if (packetId != 0) {
            MqttPacketWithId.validatePacketId(packetId);
        }
    }
    
    @Override
    public MqttPacketType getPacketType() {
        return MqttPacketType.PUBLISH;
    }
    
    @Override
    public int getPacketFlags() {
        int flags = qos.getValue() << QOS_SHIFT;
        if (dup) {
            flags |= DUP;
        }
        if (retain) {
            flags |= RETAIN;
        }
        return flags;
    }
    
    @Override
    public int getPacketId() {
        return packetId;
    }
    
    /**
     * 是否携带包标识符
     *
     * @return 如果携带返回true
     */
    public boolean hasPacketId() {
        return packetId != 0;
    }
    
    /**
     * 检查主题名是否包含通配符
     *
     * @param topic 主题名
     * @return 如果包含'+'或'#'返回true
     */
    public static boolean containsWildcard(String topic) {
        return topic.indexOf('+') >= 0 || topic.indexOf('#') >= 0;
    }
    
    /**
     * 创建QoS 0的PUBLISH包
     *
     * @param topic 主题名
     * @param payload 负载
     * @return PUBLISH包
     */
    public static MqttPublishPacket atMostOnce(String topic, byte[] payload) {
        return new MqttPublishPacket(false, false, MqttQos.AT_MOST_ONCE, topic, 0, payload);
    }
    
    /**
     * 创建QoS 1的PUBLISH包
     *
     * @param topic 主题名
     * @param packetId 包标识符
     * @param payload 负载
     * @return PUBLISH包
     */
    public static MqttPublishPacket atLeastOnce(String topic, int packetId, byte[] payload) {
        return new MqttPublishPacket(false, false, MqttQos.AT_LEAST_ONCE, topic, packetId, payload);
    }
    
    /**
     * 以UTF-8文本形式获取负载
     *
     * @return 负载文本
     */
    public String getPayloadAsString() {
        return new String(payload, StandardCharsets.UTF_8);
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof MqttPublishPacket other)) {
            return false;
        }
        return dup == other.dup
                && retain == other.retain
                && qos == other.qos
                && packetId == other.packetId
                && topic.equals(other.topic)
                && Arrays.equals(payload, other.payload);
    }
    
    @Override
    public int hashCode() {
        return 31 * Objects.hash(dup, retain, qos, topic, packetId) + Arrays.hashCode(payload);
    }
    
    @Override
    public String toString() {
        return String.format("MqttPublishPacket{topic='%s', qos=%d, packetId=%d, dup=%s, retain=%s, payloadLength=%d}",
                topic, qos.getValue(), packetId, dup, retain, payload.length);
    }
}
