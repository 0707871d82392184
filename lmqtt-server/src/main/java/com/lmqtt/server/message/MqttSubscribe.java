/**
 * SUBSCRIBE消息视图
 *
 * @author zhenglin
 * @date 2025/08/08
 */
package com.lmqtt.server.message;

import com.lmqtt.common.protocol.packet.suback.MqttSubackPacket;
import com.lmqtt.common.protocol.packet.suback.MqttSubackReturnCode;
import com.lmqtt.common.protocol.packet.subscribe.MqttSubscribePacket;
import com.lmqtt.common.protocol.packet.subscribe.MqttTopicSubscription;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * 传给订阅处理器的SUBSCRIBE视图
 * 
 * 每个订阅项对应一个返回码槽位，初始均为FAILURE，
 * 处理器完成后按请求顺序组装成SUBACK
 *
 * @param <S> 会话状态类型
 */
public class MqttSubscribe<S> {
    
    private final MqttSubscribePacket packet;
    
    private final S session;
    
    private final MqttSubackReturnCode[] returnCodes;
    
    private final List<MqttSubscription> subscriptions;
    
    public MqttSubscribe(MqttSubscribePacket packet, S session) {
        this.packet = packet;
        this.session = session;
        this.returnCodes = new MqttSubackReturnCode[packet.subscriptions().size()];
        Arrays.fill(returnCodes, MqttSubackReturnCode.FAILURE);
        
        List<MqttSubscription> list = new ArrayList<>(returnCodes.length);
        for (int i = 0; i < returnCodes.length; i++) {
            MqttTopicSubscription request = packet.subscriptions().get(i);
            list.add(new MqttSubscription(request.topicFilter(), request.qos(), returnCodes, i));
        }
        this.subscriptions = Collections.unmodifiableList(list);
    }
    
    public int packetId() {
        return packet.packetId();
    }
    
    public S session() {
        return session;
    }
    
    /**
     * 订阅项列表，保持请求顺序
     */
    public List<MqttSubscription> subscriptions() {
        return subscriptions;
    }
    
    public MqttSubscription get(int index) {
        return subscriptions.get(index);
    }
    
    public int size() {
        return subscriptions.size();
    }
    
    /**
     * 当前各订阅项的返回码
     *
     * @return 返回码列表
     */
    public List<MqttSubackReturnCode> returnCodes() {
        return List.of(returnCodes);
    }
    
    /**
     * 组装SUBACK
     *
     * @return SUBACK包
     */
    public MqttSubackPacket toAck() {
        return new MqttSubackPacket(packet.packetId(), returnCodes());
    }
}
