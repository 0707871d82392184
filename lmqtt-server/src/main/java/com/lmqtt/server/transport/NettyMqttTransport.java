/**
 * 基于Netty Channel的MQTT传输
 *
 * @author zhenglin
 * @date 2025/08/08
 */
package com.lmqtt.server.transport;

import com.lmqtt.common.protocol.packet.MqttPacket;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;

import java.nio.channels.ClosedChannelException;
import java.util.concurrent.CompletableFuture;

/**
 * 将MqttTransport适配到Netty Channel，编码由管道中的MqttChannelCodec完成
 */
public class NettyMqttTransport implements MqttTransport {
    
    private final Channel channel;
    
    public NettyMqttTransport(Channel channel) {
        this.channel = channel;
    }
    
    @Override
    public CompletableFuture<Void> write(MqttPacket packet) {
        if (!channel.isActive()) {
            return CompletableFuture.failedFuture(new ClosedChannelException());
        }
        
        CompletableFuture<Void> result = new CompletableFuture<>();
        channel.writeAndFlush(packet).addListener((ChannelFuture future) -> {
            if (future.isSuccess()) {
                result.complete(null);
            } else {
                result.completeExceptionally(future.cause());
            }
        });
        return result;
    }
    
    @Override
    public void pauseReading() {
        channel.config().setAutoRead(false);
    }
    
    @Override
    public void resumeReading() {
        channel.config().setAutoRead(true);
    }
    
    @Override
    public void close() {
        channel.close();
    }
    
    @Override
    public boolean isOpen() {
        return channel.isActive();
    }
    
    /**
     * 获取底层Channel
     *
     * @return Netty Channel
     */
    public Channel getChannel() {
        return channel;
    }
    
    @Override
    public String toString() {
        return "NettyMqttTransport{" + channel.remoteAddress() + "}";
    }
}
