/**
 * MQTT帧解码状态机
 *
 * @author zhenglin
 * @date 2025/08/06
 */
package com.lmqtt.common.protocol.codec;

import com.lmqtt.common.protocol.packet.MqttFixedHeader;
import com.lmqtt.common.protocol.packet.MqttPacket;
import io.netty.buffer.ByteBuf;

/**
 * 增量帧解码器
 * 
 * 两个状态：
 * - AWAIT_HEADER：需要至少2个字节才能读取类型和探测剩余长度
 * - AWAIT_BODY：固定头部已消费，等待剩余长度个字节
 * 
 * 已消费的固定头部不会被重复解析，因此可以处理任意切分的字节流。
 * 每个连接持有一个实例，非线程安全
 */
public class MqttFrameDecoder {
    
    /**
     * 解码器状态
     */
    public enum State {
        AWAIT_HEADER,
        AWAIT_BODY
    }
    
    /**
     * 最大帧大小（剩余长度），0表示不限制
     */
    private final int maxFrameSize;
    
    private State state = State.AWAIT_HEADER;
    
    /**
     * AWAIT_BODY状态下已解析的固定头部
     */
    private MqttFixedHeader pendingHeader;
    
    /**
     * 创建不限制帧大小的解码器
     */
    public MqttFrameDecoder() {
        this(0);
    }
    
    /**
     * 创建帧解码器
     *
     * @param maxFrameSize 最大帧大小（字节），0表示不限制
     */
    public MqttFrameDecoder(int maxFrameSize) {
        if (maxFrameSize < 0) {
            throw new IllegalArgumentException("Max frame size cannot be negative: " + maxFrameSize);
        }
        this.maxFrameSize = maxFrameSize;
    }
    
    /**
     * 尝试从缓冲区解码一个数据包
     * 
     * 只消费已确定的字节：固定头部在完整可解析时消费，包体在全部到达时消费
     *
     * @param in 输入缓冲区
     * @return 解码的数据包，数据不足时返回null
     * @throws MqttCodecException 如果帧非法或超过最大帧大小
     */
    public MqttPacket decode(ByteBuf in) {
        if (state == State.AWAIT_HEADER) {
            if (in.readableBytes() < 2) {
                return null;
            }
            
            int firstByte = in.getUnsignedByte(in.readerIndex());
            MqttVariableLength length = MqttCodecUtil.decodeVariableLength(in, in.readerIndex() + 1);
            if (length == null) {
                return null;
            }
            if (maxFrameSize != 0 && length.value() > maxFrameSize) {
                throw new MqttCodecException(MqttCodecErrorType.MAX_SIZE_EXCEEDED,
                        String.format("frame of %d bytes exceeds limit of %d", length.value(), maxFrameSize));
            }
            
            in.skipBytes(1 + length.bytesConsumed());
            pendingHeader = MqttFixedHeader.fromFirstByte(firstByte, length.value());
            state = State.AWAIT_BODY;
        }
        
        MqttFixedHeader header = pendingHeader;
        if (in.readableBytes() < header.remainingLength()) {
            return null;
        }
        
        ByteBuf body = in.readSlice(header.remainingLength());
        pendingHeader = null;
        state = State.AWAIT_HEADER;
        return MqttPacketDecoder.readPacket(body, header);
    }
    
    /**
     * 获取当前状态
     *
     * @return 解码器状态
     */
    public State getState() {
        return state;
    }
    
    /**
     * 获取最大帧大小
     *
     * @return 最大帧大小，0表示不限制
     */
    public int getMaxFrameSize() {
        return maxFrameSize;
    }
}
