/**
 * MQTT通道初始化器
 *
 * @author zhenglin
 * @date 2025/08/09
 */
package com.lmqtt.server.netty.initializer;

import com.lmqtt.common.protocol.codec.MqttChannelCodec;
import com.lmqtt.server.MqttServer;
import com.lmqtt.server.netty.handler.MqttServerHandler;
import io.netty.channel.Channel;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelPipeline;
import lombok.extern.slf4j.Slf4j;

/**
 * MQTT Channel Pipeline初始化器
 * 
 * 编解码器负责分帧，服务端处理器为每个通道创建独立的协议引擎
 */
@Slf4j
public class MqttChannelInitializer extends ChannelInitializer<Channel> {
    
    private final MqttServer<?> server;
    
    public MqttChannelInitializer(MqttServer<?> server) {
        this.server = server;
    }
    
    @Override
    protected void initChannel(Channel ch) {
        ChannelPipeline pipeline = ch.pipeline();
        
        // 1. MQTT编解码器，超过最大帧长度时解码失败
        pipeline.addLast("mqtt-codec", new MqttChannelCodec(server.getConfig().getMaxFrameSize()));
        
        // 2. MQTT协议引擎
        pipeline.addLast("mqtt", new MqttServerHandler(server));
        
        log.debug("初始化MQTT通道Pipeline: {}", ch.remoteAddress());
    }
    
    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.error("MQTT通道初始化失败: {}", ctx.channel().remoteAddress(), cause);
        ctx.close();
    }
}
