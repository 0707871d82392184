/**
 * 订阅项
 *
 * @author zhenglin
 * @date 2025/08/08
 */
package com.lmqtt.server.message;

import com.lmqtt.common.protocol.MqttQos;
import com.lmqtt.common.protocol.packet.suback.MqttSubackReturnCode;

/**
 * SUBSCRIBE中的单个订阅项，按下标指向SUBACK返回码槽位
 */
public final class MqttSubscription {
    
    private final String topicFilter;
    
    private final MqttQos qos;
    
    private final MqttSubackReturnCode[] returnCodes;
    
    private final int index;
    
    MqttSubscription(String topicFilter, MqttQos qos, MqttSubackReturnCode[] returnCodes, int index) {
        this.topicFilter = topicFilter;
        this.qos = qos;
        this.returnCodes = returnCodes;
        this.index = index;
    }
    
    public String topicFilter() {
        return topicFilter;
    }
    
    /**
     * 客户端请求的QoS
     */
    public MqttQos qos() {
        return qos;
    }
    
    /**
     * 拒绝该订阅
     */
    public void fail() {
        returnCodes[index] = MqttSubackReturnCode.FAILURE;
    }
    
    /**
     * 接受该订阅
     *
     * @param grantedQos 授予的QoS
     */
    public void subscribe(MqttQos grantedQos) {
        returnCodes[index] = MqttSubackReturnCode.granted(grantedQos);
    }
    
    /**
     * 当前结果
     *
     * @return 返回码，默认FAILURE
     */
    public MqttSubackReturnCode returnCode() {
        return returnCodes[index];
    }
    
    @Override
    public String toString() {
        return String.format("MqttSubscription{topicFilter='%s', qos=%d, result=%s}",
                topicFilter, qos.getValue(), returnCode());
    }
}
