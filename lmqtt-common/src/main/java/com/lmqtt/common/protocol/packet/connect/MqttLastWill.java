/**
 * MQTT遗嘱消息
 *
 * @author zhenglin
 * @date 2025/08/06
 */
package com.lmqtt.common.protocol.packet.connect;

import com.lmqtt.common.protocol.MqttQos;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * CONNECT包中的遗嘱消息，主题和消息总是同时出现
 *
 * @param qos 遗嘱消息发布时使用的QoS
 * @param retain 遗嘱消息是否保留
 * @param topic 遗嘱主题
 * @param message 遗嘱消息内容
 */
public record MqttLastWill(MqttQos qos, boolean retain, String topic, byte[] message) {
    
    /**
     * 构造函数验证
     */
    public MqttLastWill {
        if (qos == null) {
            throw new IllegalArgumentException("Will QoS cannot be null");
        }
        if (topic == null) {
            throw new IllegalArgumentException("Will topic cannot be null");
        }
        if (message == null) {
            throw new IllegalArgumentException("Will message cannot be null");
        }
    }
    
    /**
     * 创建遗嘱消息
     *
     * @param qos QoS等级
     * @param retain 保留标志
     * @param topic 遗嘱主题
     * @param message UTF-8文本消息
     * @return 遗嘱消息
     */
    public static MqttLastWill of(MqttQos qos, boolean retain, String topic, String message) {
        return new MqttLastWill(qos, retain, topic, message.getBytes(StandardCharsets.UTF_8));
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof MqttLastWill other)) {
            return false;
        }
        return retain == other.retain
                && qos == other.qos
                && topic.equals(other.topic)
                && Arrays.equals(message, other.message);
    }
    
    @Override
    public int hashCode() {
        return 31 * Objects.hash(qos, retain, topic) + Arrays.hashCode(message);
    }
    
    @Override
    public String toString() {
        return String.format("MqttLastWill{qos=%s, retain=%s, topic='%s', messageLength=%d}",
                qos.getValue(), retain, topic, message.length);
    }
}
