/**
 * MQTT服务端通道处理器测试
 *
 * @author zhenglin
 * @date 2025/08/15
 */
package com.lmqtt.server.netty.handler;

import com.lmqtt.common.protocol.MqttQos;
import com.lmqtt.common.protocol.codec.MqttFrameDecoder;
import com.lmqtt.common.protocol.codec.MqttPacketEncoder;
import com.lmqtt.common.protocol.packet.MqttPacket;
import com.lmqtt.common.protocol.packet.connack.MqttConnackPacket;
import com.lmqtt.common.protocol.packet.connect.MqttConnectPacket;
import com.lmqtt.common.protocol.packet.puback.MqttPubackPacket;
import com.lmqtt.common.protocol.packet.publish.MqttPublishPacket;
import com.lmqtt.common.protocol.packet.suback.MqttSubackPacket;
import com.lmqtt.common.protocol.packet.suback.MqttSubackReturnCode;
import com.lmqtt.common.protocol.packet.subscribe.MqttSubscribePacket;
import com.lmqtt.server.MqttServer;
import com.lmqtt.server.config.MqttServerConfig;
import com.lmqtt.server.connection.MqttConnection;
import com.lmqtt.server.error.MqttCloseReason;
import com.lmqtt.server.router.MqttPublishRouter;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.embedded.EmbeddedChannel;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 通过EmbeddedChannel验证完整的服务端管道
 */
@DisplayName("MQTT服务端通道处理器测试")
class MqttServerHandlerTest {
    
    private List<String> published;
    
    private List<String> disconnects;
    
    private EmbeddedChannel channel;
    
    private MqttServerHandler handler;
    
    @BeforeEach
    void setUp() {
        published = new CopyOnWriteArrayList<>();
        disconnects = new CopyOnWriteArrayList<>();
        
        MqttPublishRouter<String> router = new MqttPublishRouter<String>()
                .resource("sensors/#", publish -> {
                    published.add(publish.session() + "|" + publish.topic() + "|" + publish.payloadAsString());
                    return CompletableFuture.completedFuture(null);
                });
        MqttServer<String> server = MqttServer.<String>create(connect -> "secret".equals(connect.username())
                        ? CompletableFuture.completedFuture(connect.ack(connect.clientId(), false))
                        : CompletableFuture.completedFuture(connect.<String>badUsernameOrPassword()))
                .publish(router)
                .subscribe(subscribe -> {
                    subscribe.subscriptions().forEach(s -> s.subscribe(MqttQos.AT_MOST_ONCE));
                    return CompletableFuture.completedFuture(null);
                })
                .disconnect((session, error) -> disconnects.add(session + ":" + error))
                .config(MqttServerConfig.builder().maxFrameSize(256).build());
        
        channel = new EmbeddedChannel(server.channelInitializer());
        // 通道关闭后管道中的处理器会被移除，提前保存
        handler = channel.pipeline().get(MqttServerHandler.class);
        assertNotNull(handler.getConnection());
    }
    
    @AfterEach
    void tearDown() {
        channel.finishAndReleaseAll();
    }
    
    private void send(MqttPacket packet) {
        ByteBuf buf = Unpooled.buffer();
        MqttPacketEncoder.encode(packet, buf);
        channel.writeInbound(buf);
    }
    
    private MqttPacket receive() {
        ByteBuf buf = channel.readOutbound();
        assertNotNull(buf, "expected an outbound packet");
        try {
            return new MqttFrameDecoder().decode(buf);
        } finally {
            buf.release();
        }
    }
    
    private MqttConnection<?> connection() {
        return handler.getConnection();
    }
    
    @Test
    @DisplayName("完整的连接、发布、订阅流程")
    void testSessionFlow() {
        send(MqttConnectPacket.create("dev-1", 60, true, "user", "secret"));
        assertEquals(MqttConnackPacket.accepted(false), receive());
        
        send(MqttPublishPacket.atLeastOnce("sensors/temp?unit=c", 17, "21.5".getBytes(StandardCharsets.UTF_8)));
        assertEquals(new MqttPubackPacket(17), receive());
        assertEquals(List.of("dev-1|sensors/temp|21.5"), published);
        
        send(MqttSubscribePacket.create(5, "commands/#", MqttQos.AT_LEAST_ONCE));
        MqttSubackPacket suback = (MqttSubackPacket) receive();
        assertEquals(5, suback.packetId());
        assertEquals(List.of(MqttSubackReturnCode.MAXIMUM_QOS_0), suback.returnCodes());
        
        channel.close();
        assertEquals(MqttCloseReason.TRANSPORT_CLOSED, connection().getCloseReason());
        assertEquals(List.of("dev-1:false"), disconnects);
    }
    
    @Test
    @DisplayName("应用通过发布通道下发消息")
    void testOutboundPublish() {
        send(MqttConnectPacket.create("dev-2", 60, true, "user", "secret"));
        receive();
        
        CompletableFuture<Void> delivered = connection().getSink()
                .publishAtLeastOnce("commands/reboot", new byte[]{1}, false);
        MqttPublishPacket outbound = (MqttPublishPacket) receive();
        assertEquals("commands/reboot", outbound.topic());
        assertEquals(1, outbound.packetId());
        assertFalse(delivered.isDone());
        
        send(new MqttPubackPacket(1));
        assertTrue(delivered.isDone());
        assertFalse(delivered.isCompletedExceptionally());
    }
    
    @Test
    @DisplayName("认证失败时回复拒绝并关闭通道")
    void testRejected() {
        send(MqttConnectPacket.create("dev-3", 60, true, "user", "wrong"));
        
        MqttConnackPacket connack = (MqttConnackPacket) receive();
        assertFalse(connack.returnCode().isSuccess());
        assertFalse(channel.isActive());
        assertEquals(MqttCloseReason.CONNECT_REJECTED, connection().getCloseReason());
        assertTrue(disconnects.isEmpty());
    }
    
    @Test
    @DisplayName("非法数据以DECODE_ERROR关闭")
    void testMalformedInput() {
        channel.writeInbound(Unpooled.wrappedBuffer(new byte[]{0x10, 0x02, 0x00, 0x03}));
        
        assertFalse(channel.isActive());
        assertEquals(MqttCloseReason.DECODE_ERROR, connection().getCloseReason());
    }
    
    @Test
    @DisplayName("超过最大帧长度以DECODE_ERROR关闭")
    void testFrameTooLarge() {
        send(MqttConnectPacket.create("dev-4", 60, true, "user", "secret"));
        receive();
        
        send(MqttPublishPacket.atMostOnce("sensors/big", new byte[512]));
        
        assertFalse(channel.isActive());
        assertEquals(MqttCloseReason.DECODE_ERROR, connection().getCloseReason());
        assertEquals(List.of("dev-4:true"), disconnects);
        assertTrue(published.isEmpty());
    }
    
    @Test
    @DisplayName("在途发布达到上限时暂停读取通道")
    void testBackpressurePausesAutoRead() {
        List<CompletableFuture<Void>> pending = new CopyOnWriteArrayList<>();
        MqttServer<String> server = MqttServer.<String>create(connect ->
                        CompletableFuture.completedFuture(connect.ack(connect.clientId(), false)))
                .publish(publish -> {
                    CompletableFuture<Void> future = new CompletableFuture<>();
                    pending.add(future);
                    return future;
                })
                .config(MqttServerConfig.builder().inflight(1).build());
        EmbeddedChannel slow = new EmbeddedChannel(server.channelInitializer());
        try {
            ByteBuf connect = Unpooled.buffer();
            MqttPacketEncoder.encode(MqttConnectPacket.create("flood", 60, true), connect);
            slow.writeInbound(connect);
            assertTrue(slow.config().isAutoRead());
            
            ByteBuf flood = Unpooled.buffer();
            for (int i = 1; i <= 200; i++) {
                MqttPacketEncoder.encode(MqttPublishPacket.atLeastOnce("t", i, new byte[]{1}), flood);
            }
            slow.writeInbound(flood);
            
            assertEquals(1, pending.size());
            assertFalse(slow.config().isAutoRead());
            assertTrue(slow.isActive());
            
            for (int i = 0; i < pending.size(); i++) {
                pending.get(i).complete(null);
            }
            assertEquals(200, pending.size());
            assertTrue(slow.config().isAutoRead());
        } finally {
            slow.finishAndReleaseAll();
        }
    }
}
