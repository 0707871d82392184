/**
 * PUBLISH消息视图测试
 *
 * @author zhenglin
 * @date 2025/08/14
 */
package com.lmqtt.server.message;

import com.lmqtt.common.protocol.MqttQos;
import com.lmqtt.common.protocol.packet.publish.MqttPublishPacket;
import com.lmqtt.server.error.MqttPayloadException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PUBLISH消息视图测试")
class MqttPublishTest {
    
    public static class Reading {
        public String sensor;
        public double value;
    }
    
    private static MqttPublish<String> publish(String topic, String payload) {
        MqttPublishPacket packet = new MqttPublishPacket(true, true, MqttQos.AT_LEAST_ONCE, topic, 12,
                payload.getBytes(StandardCharsets.UTF_8));
        return new MqttPublish<>(packet, "session", null);
    }
    
    @Test
    @DisplayName("拆分主题路径和查询串")
    void testTopicAndQuery() {
        MqttPublish<String> publish = publish("devices/42/telemetry?format=json&v=2", "{}");
        
        assertEquals("devices/42/telemetry", publish.topic());
        assertEquals("format=json&v=2", publish.query());
        assertEquals("devices/42/telemetry?format=json&v=2", publish.publishTopic());
    }
    
    @Test
    @DisplayName("没有查询串")
    void testNoQuery() {
        MqttPublish<String> publish = publish("devices/42", "x");
        
        assertEquals("devices/42", publish.topic());
        assertEquals("", publish.query());
    }
    
    @Test
    @DisplayName("只按第一个问号拆分")
    void testFirstQuestionMark() {
        MqttPublish<String> publish = publish("a?b?c", "x");
        
        assertEquals("a", publish.topic());
        assertEquals("b?c", publish.query());
    }
    
    @Test
    @DisplayName("包字段")
    void testPacketFields() {
        MqttPublish<String> publish = publish("a", "hello");
        
        assertTrue(publish.dup());
        assertTrue(publish.retain());
        assertEquals(MqttQos.AT_LEAST_ONCE, publish.qos());
        assertEquals(12, publish.id());
        assertEquals("hello", publish.payloadAsString());
        assertEquals("session", publish.session());
    }
    
    @Test
    @DisplayName("JSON负载反序列化，忽略未知字段")
    void testJson() {
        MqttPublish<String> publish = publish("a", "{\"sensor\":\"t1\",\"value\":21.5,\"unit\":\"C\"}");
        
        Reading reading = publish.json(Reading.class);
        
        assertEquals("t1", reading.sensor);
        assertEquals(21.5, reading.value);
    }
    
    @Test
    @DisplayName("非法JSON负载")
    void testInvalidJson() {
        MqttPublish<String> publish = publish("a", "not json");
        
        assertThrows(MqttPayloadException.class, () -> publish.json(Reading.class));
    }
}
