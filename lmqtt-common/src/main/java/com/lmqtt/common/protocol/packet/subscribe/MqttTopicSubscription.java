/**
 * MQTT主题订阅项
 *
 * @author zhenglin
 * @date 2025/08/06
 */
package com.lmqtt.common.protocol.packet.subscribe;

import com.lmqtt.common.protocol.MqttQos;

/**
 * SUBSCRIBE包中的单个订阅请求
 *
 * @param topicFilter 主题过滤器
 * @param qos 请求的最大QoS
 */
public record MqttTopicSubscription(String topicFilter, MqttQos qos) {
    
    /**
     * 构造函数验证
     */
    public MqttTopicSubscription {
        if (topicFilter == null) {
            throw new IllegalArgumentException("Topic filter cannot be null");
        }
        if (qos == null) {
            throw new IllegalArgumentException("QoS cannot be null");
        }
    }
}
