/**
 * MQTT QoS级别定义
 *
 * @author zhenglin
 * @date 2025/08/06
 */
package com.lmqtt.common.protocol;

/**
 * MQTT服务质量级别，对应PUBLISH固定报头中的两位QoS字段
 */
public enum MqttQos {
    /**
     * 至多一次，不携带包标识符
     */
    AT_MOST_ONCE(0),
    
    /**
     * 至少一次，接收方回复PUBACK
     */
    AT_LEAST_ONCE(1),
    
    /**
     * 恰好一次，仅解析标志位，不维护重传和去重状态
     */
    EXACTLY_ONCE(2);
    
    private final int value;
    
    MqttQos(int value) {
        this.value = value;
    }
    
    public int getValue() {
        return value;
    }
    
    /**
     * 根据线上的值获取QoS级别
     *
     * @param value QoS字段值
     * @return QoS级别
     * @throws IllegalArgumentException 值为保留值3或越界
     */
    public static MqttQos fromValue(int value) {
        if (!isValid(value)) {
            throw new IllegalArgumentException("Invalid QoS level: " + value);
        }
        return values()[value];
    }
    
    public static boolean isValid(int value) {
        return value >= 0 && value <= 2;
    }
    
    /**
     * QoS 1和QoS 2的PUBLISH携带包标识符并需要确认
     *
     * @return 如果需要确认返回true
     */
    public boolean requiresAcknowledgment() {
        return this != AT_MOST_ONCE;
    }
}
