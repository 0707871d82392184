/**
 * MQTT订阅确认返回码
 *
 * @author zhenglin
 * @date 2025/08/06
 */
package com.lmqtt.common.protocol.packet.suback;

import com.lmqtt.common.protocol.MqttQos;

/**
 * SUBACK返回码：授予的最大QoS或失败
 */
public enum MqttSubackReturnCode {
    /**
     * 成功 - 最大QoS 0
     */
    MAXIMUM_QOS_0(0x00),
    
    /**
     * 成功 - 最大QoS 1
     */
    MAXIMUM_QOS_1(0x01),
    
    /**
     * 成功 - 最大QoS 2
     */
    MAXIMUM_QOS_2(0x02),
    
    /**
     * 失败
     */
    FAILURE(0x80);
    
    private final int value;
    
    MqttSubackReturnCode(int value) {
        this.value = value;
    }
    
    public int getValue() {
        return value;
    }
    
    /**
     * 根据授予的QoS获取返回码
     *
     * @param qos 授予的QoS
     * @return 返回码
     */
    public static MqttSubackReturnCode granted(MqttQos qos) {
        return switch (qos) {
            case AT_MOST_ONCE -> MAXIMUM_QOS_0;
            case AT_LEAST_ONCE -> MAXIMUM_QOS_1;
            case EXACTLY_ONCE -> MAXIMUM_QOS_2;
        };
    }
    
    /**
     * 根据值获取返回码
     *
     * @param value 返回码值
     * @return 返回码，未知值返回null
     */
    public static MqttSubackReturnCode fromValue(int value) {
        for (MqttSubackReturnCode code : values()) {
            if (code.value == value) {
                return code;
            }
        }
        return null;
    }
}
