/**
 * MQTT编解码器适配器
 *
 * @author zhenglin
 * @date 2025/08/13
 */
package com.lmqtt.common.protocol.codec;

import com.lmqtt.common.protocol.packet.MqttPacket;
import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.ByteToMessageCodec;
import io.netty.handler.codec.DecoderException;
import io.netty.handler.codec.EncoderException;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * MQTT通道编解码器
 * 
 * 将帧解码状态机和包编码器包装为Netty的ChannelHandler。
 * 编解码错误以DecoderException/EncoderException抛出，原因为MqttCodecException。
 * 解码失败后连接即将关闭，之后到达的字节直接丢弃
 */
@Slf4j
public class MqttChannelCodec extends ByteToMessageCodec<MqttPacket> {
    
    private final MqttFrameDecoder frameDecoder;
    
    private boolean decodeFailed;
    
    /**
     * 创建不限制帧大小的编解码器
     */
    public MqttChannelCodec() {
        this(0);
    }
    
    /**
     * 创建编解码器
     *
     * @param maxFrameSize 最大帧大小（字节），0表示不限制
     */
    public MqttChannelCodec(int maxFrameSize) {
        this.frameDecoder = new MqttFrameDecoder(maxFrameSize);
    }
    
    /**
     * 解码入站字节流为MQTT数据包
     */
    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) throws Exception {
        if (decodeFailed) {
            in.skipBytes(in.readableBytes());
            return;
        }
        
        try {
            MqttPacket packet = frameDecoder.decode(in);
            if (packet != null) {
                out.add(packet);
                log.debug("解码MQTT数据包成功: {} from {}", packet.getPacketType(), ctx.channel().remoteAddress());
            }
        } catch (MqttCodecException e) {
            decodeFailed = true;
            in.skipBytes(in.readableBytes());
            log.warn("MQTT解码失败: {} from {}", e.getMessage(), ctx.channel().remoteAddress());
            throw new DecoderException(e);
        }
    }
    
    /**
     * 编码出站MQTT数据包为字节流
     */
    @Override
    protected void encode(ChannelHandlerContext ctx, MqttPacket packet, ByteBuf out) throws Exception {
        try {
            int writerIndexBefore = out.writerIndex();
            MqttPacketEncoder.encode(packet, out);
            log.debug("编码MQTT数据包成功: {} ({} 字节) to {}",
                    packet.getPacketType(), out.writerIndex() - writerIndexBefore, ctx.channel().remoteAddress());
        } catch (MqttCodecException e) {
            log.error("MQTT编码失败: {}", packet, e);
            throw new EncoderException(e);
        }
    }
    
    /**
     * 获取帧解码器
     *
     * @return 帧解码器
     */
    public MqttFrameDecoder getFrameDecoder() {
        return frameDecoder;
    }
}
