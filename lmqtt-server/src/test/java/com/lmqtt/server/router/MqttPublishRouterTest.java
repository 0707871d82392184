/**
 * MQTT发布路由器测试
 *
 * @author zhenglin
 * @date 2025/08/14
 */
package com.lmqtt.server.router;

import com.lmqtt.common.protocol.packet.publish.MqttPublishPacket;
import com.lmqtt.common.protocol.topic.MqttTopicException;
import com.lmqtt.server.message.MqttPublish;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MQTT发布路由器测试")
class MqttPublishRouterTest {
    
    private List<String> calls;
    
    private MqttPublishRouter<String> router;
    
    @BeforeEach
    void setUp() {
        calls = new ArrayList<>();
        router = new MqttPublishRouter<String>()
                .resource("devices/+/telemetry", publish -> handled("telemetry", publish))
                .resource("devices/#", publish -> handled("devices", publish))
                .resource("$SYS/#", publish -> handled("sys", publish));
    }
    
    private CompletableFuture<Void> handled(String name, MqttPublish<String> publish) {
        calls.add(name + ":" + publish.topic());
        return CompletableFuture.completedFuture(null);
    }
    
    private void route(String topic) {
        router.handle(new MqttPublish<>(MqttPublishPacket.atMostOnce(topic, new byte[0]), "s", null)).join();
    }
    
    @Test
    @DisplayName("按注册顺序第一个匹配生效")
    void testFirstMatchWins() {
        route("devices/1/telemetry");
        route("devices/1/status");
        
        assertEquals(List.of("telemetry:devices/1/telemetry", "devices:devices/1/status"), calls);
    }
    
    @Test
    @DisplayName("按主题路径匹配，忽略查询串")
    void testMatchesTopicPath() {
        route("devices/7/telemetry?format=cbor");
        
        assertEquals(List.of("telemetry:devices/7/telemetry"), calls);
    }
    
    @Test
    @DisplayName("元数据主题只匹配显式过滤器")
    void testMetadataTopic() {
        route("$SYS/broker/uptime");
        
        assertEquals(List.of("sys:$SYS/broker/uptime"), calls);
    }
    
    @Test
    @DisplayName("没有匹配时交给默认处理器")
    void testDefaultResource() {
        router.defaultResource(publish -> handled("default", publish));
        
        route("other/topic");
        
        assertEquals(List.of("default:other/topic"), calls);
    }
    
    @Test
    @DisplayName("未设置默认处理器时直接确认")
    void testBuiltInDefault() {
        assertDoesNotThrow(() -> route("other/topic"));
        assertTrue(calls.isEmpty());
    }
    
    @Test
    @DisplayName("非法过滤器在注册时拒绝")
    void testInvalidFilter() {
        assertThrows(MqttTopicException.class, () -> router.resource("a/#/b", publish -> null));
        assertThrows(MqttTopicException.class, () -> router.resource("a/$meta", publish -> null));
        assertEquals(3, router.size());
    }
}
