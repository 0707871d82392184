/**
 * MQTT服务端通道处理器
 *
 * @author zhenglin
 * @date 2025/08/09
 */
package com.lmqtt.server.netty.handler;

import com.lmqtt.common.protocol.codec.MqttCodecException;
import com.lmqtt.common.protocol.packet.MqttPacket;
import com.lmqtt.server.MqttServer;
import com.lmqtt.server.connection.MqttConnection;
import com.lmqtt.server.transport.NettyMqttTransport;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.handler.codec.DecoderException;
import io.netty.util.ReferenceCountUtil;
import lombok.extern.slf4j.Slf4j;

/**
 * 把一个Netty通道绑定到一个MqttConnection
 * 
 * 通道激活时创建连接并开始握手，解码后的数据包按顺序推送给连接，
 * 使用通道的事件循环作为握手超时和保持连接的调度器。每个通道一个实例
 */
@Slf4j
public class MqttServerHandler extends ChannelInboundHandlerAdapter {
    
    private final MqttServer<?> server;
    
    private MqttConnection<?> connection;
    
    public MqttServerHandler(MqttServer<?> server) {
        this.server = server;
    }
    
    @Override
    public void channelActive(ChannelHandlerContext ctx) throws Exception {
        connection = server.newConnection(new NettyMqttTransport(ctx.channel()), ctx.executor());
        connection.start();
        log.debug("MQTT通道激活: {}", ctx.channel().remoteAddress());
        super.channelActive(ctx);
    }
    
    @Override
    public void channelRead(ChannelHandlerContext ctx, Object msg) throws Exception {
        if (!(msg instanceof MqttPacket packet)) {
            log.warn("收到非MQTT消息: {}", msg.getClass().getSimpleName());
            ReferenceCountUtil.release(msg);
            return;
        }
        if (connection == null) {
            log.warn("连接未初始化，丢弃数据包: {}", packet.getPacketType());
            return;
        }
        connection.onPacket(packet);
    }
    
    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        if (connection != null) {
            connection.onTransportClosed();
        }
        log.debug("MQTT通道关闭: {}", ctx.channel().remoteAddress());
        super.channelInactive(ctx);
    }
    
    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        if (connection == null) {
            log.error("MQTT通道异常: {}", ctx.channel().remoteAddress(), cause);
            ctx.close();
            return;
        }
        if (cause instanceof DecoderException && cause.getCause() instanceof MqttCodecException codecException) {
            log.debug("MQTT解码失败: {}, {}", codecException.getErrorType(), codecException.getMessage());
            connection.onDecodeError(codecException);
        } else if (cause instanceof DecoderException) {
            connection.onDecodeError(cause.getCause() != null ? cause.getCause() : cause);
        } else {
            connection.onIoError(cause);
        }
    }
    
    /**
     * 获取通道对应的连接
     *
     * @return 连接，通道未激活时为null
     */
    public MqttConnection<?> getConnection() {
        return connection;
    }
}
