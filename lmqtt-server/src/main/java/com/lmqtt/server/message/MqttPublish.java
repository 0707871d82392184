/**
 * PUBLISH消息视图
 *
 * @author zhenglin
 * @date 2025/08/08
 */
package com.lmqtt.server.message;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lmqtt.common.protocol.MqttQos;
import com.lmqtt.common.protocol.packet.publish.MqttPublishPacket;
import com.lmqtt.server.error.MqttPayloadException;
import com.lmqtt.server.session.MqttSink;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * 传给发布处理器的PUBLISH视图
 * 
 * 主题中第一个'?'之前的部分为路径，之后的部分为查询串
 *
 * @param <S> 会话状态类型
 */
public class MqttPublish<S> {
    
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    
    private final MqttPublishPacket packet;
    
    private final S session;
    
    private final MqttSink sink;
    
    private final String topic;
    
    private final String query;
    
    public MqttPublish(MqttPublishPacket packet, S session, MqttSink sink) {
        this.packet = packet;
        this.session = session;
        this.sink = sink;
        
        String publishTopic = packet.topic();
        int queryIndex = publishTopic.indexOf('?');
        if (queryIndex >= 0) {
            this.topic = publishTopic.substring(0, queryIndex);
            this.query = publishTopic.substring(queryIndex + 1);
        } else {
            this.topic = publishTopic;
            this.query = "";
        }
    }
    
    public MqttPublishPacket packet() {
        return packet;
    }
    
    public boolean dup() {
        return packet.dup();
    }
    
    public boolean retain() {
        return packet.retain();
    }
    
    public MqttQos qos() {
        return packet.qos();
    }
    
    /**
     * 包标识符
     *
     * @return 包标识符，QoS 0时为0
     */
    public int id() {
        return packet.packetId();
    }
    
    /**
     * PUBLISH包中的原始主题
     */
    public String publishTopic() {
        return packet.topic();
    }
    
    /**
     * 主题路径（'?'之前的部分）
     */
    public String topic() {
        return topic;
    }
    
    /**
     * 查询串（'?'之后的部分），没有时为空字符串
     */
    public String query() {
        return query;
    }
    
    public byte[] payload() {
        return packet.payload();
    }
    
    public String payloadAsString() {
        return new String(packet.payload(), StandardCharsets.UTF_8);
    }
    
    public S session() {
        return session;
    }
    
    public MqttSink sink() {
        return sink;
    }
    
    /**
     * 将负载按JSON反序列化
     *
     * @param type 目标类型
     * @param <T> 目标类型
     * @return 反序列化结果
     * @throws MqttPayloadException 如果负载不是合法的JSON
     */
    public <T> T json(Class<T> type) {
        try {
            return OBJECT_MAPPER.readValue(packet.payload(), type);
        } catch (IOException e) {
            throw new MqttPayloadException("Failed to deserialize payload of " + packet.topic()
                    + " to " + type.getSimpleName(), e);
        }
    }
    
    @Override
    public String toString() {
        return "MqttPublish{" + packet + "}";
    }
}
