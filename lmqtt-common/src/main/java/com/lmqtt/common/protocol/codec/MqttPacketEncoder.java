/**
 * MQTT数据包编码器
 *
 * @author zhenglin
 * @date 2025/08/06
 */
package com.lmqtt.common.protocol.codec;

import com.lmqtt.common.protocol.packet.MqttPacket;
import com.lmqtt.common.protocol.packet.MqttPacketWithId;
import com.lmqtt.common.protocol.packet.connack.MqttConnackPacket;
import com.lmqtt.common.protocol.packet.connect.MqttConnectPacket;
import com.lmqtt.common.protocol.packet.connect.MqttLastWill;
import com.lmqtt.common.protocol.packet.publish.MqttPublishPacket;
import com.lmqtt.common.protocol.packet.suback.MqttSubackPacket;
import com.lmqtt.common.protocol.packet.suback.MqttSubackReturnCode;
import com.lmqtt.common.protocol.packet.subscribe.MqttSubscribePacket;
import com.lmqtt.common.protocol.packet.subscribe.MqttTopicSubscription;
import com.lmqtt.common.protocol.packet.unsubscribe.MqttUnsubscribePacket;
import io.netty.buffer.ByteBuf;

/**
 * MQTT 3.1.1数据包编码器
 * 
 * 先计算剩余长度，再依次写出固定头部和类型相关的包体。
 * getEncodedSize的结果必须与writePacket实际写出的包体字节数完全一致
 */
public final class MqttPacketEncoder {
    
    private MqttPacketEncoder() {
    }
    
    /**
     * 编码完整的数据包
     * 
     * 编码失败时输出缓冲区的写指针会被恢复，不会留下半个包
     *
     * @param packet MQTT数据包
     * @param out 输出缓冲区
     * @throws MqttCodecException 如果数据包无法编码
     */
    public static void encode(MqttPacket packet, ByteBuf out) {
        validate(packet);
        int remainingLength = getEncodedSize(packet);
        if (remainingLength > MqttCodecUtil.MAX_REMAINING_LENGTH) {
            throw new MqttCodecException(MqttCodecErrorType.MAX_SIZE_EXCEEDED,
                    packet.getPacketType() + " body of " + remainingLength + " bytes");
        }
        
        int writerIndex = out.writerIndex();
        try {
            writePacket(packet, remainingLength, out);
        } catch (RuntimeException e) {
            out.writerIndex(writerIndex);
            throw e;
        }
    }
    
    /**
     * 写出固定头部和包体
     *
     * @param packet MQTT数据包
     * @param remainingLength 由getEncodedSize计算出的剩余长度
     * @param out 输出缓冲区
     */
    public static void writePacket(MqttPacket packet, int remainingLength, ByteBuf out) {
        out.writeByte((packet.getPacketType().getValue() << 4) | packet.getPacketFlags());
        MqttCodecUtil.encodeRemainingLength(out, remainingLength);
        
        if (packet instanceof MqttConnectPacket connect) {
            writeConnect(connect, out);
        } else if (packet instanceof MqttConnackPacket connack) {
            out.writeByte(connack.sessionPresent() ? MqttConnackPacket.SESSION_PRESENT : 0);
            out.writeByte(connack.returnCode().getValue());
        } else if (packet instanceof MqttPublishPacket publish) {
            MqttCodecUtil.encodeString(out, publish.topic());
            if (publish.qos().requiresAcknowledgment()) {
                MqttCodecUtil.encodePacketId(out, publish.packetId());
            }
            out.writeBytes(publish.payload());
        } else if (packet instanceof MqttSubscribePacket subscribe) {
            MqttCodecUtil.encodePacketId(out, subscribe.packetId());
            for (MqttTopicSubscription subscription : subscribe.subscriptions()) {
                MqttCodecUtil.encodeString(out, subscription.topicFilter());
                out.writeByte(subscription.qos().getValue());
            }
        } else if (packet instanceof MqttSubackPacket suback) {
            MqttCodecUtil.encodePacketId(out, suback.packetId());
            for (MqttSubackReturnCode returnCode : suback.returnCodes()) {
                out.writeByte(returnCode.getValue());
            }
        } else if (packet instanceof MqttUnsubscribePacket unsubscribe) {
            MqttCodecUtil.encodePacketId(out, unsubscribe.packetId());
            for (String topicFilter : unsubscribe.topicFilters()) {
                MqttCodecUtil.encodeString(out, topicFilter);
            }
        } else if (packet instanceof MqttPacketWithId withId) {
            // PUBACK / PUBREC / PUBREL / PUBCOMP / UNSUBACK
            MqttCodecUtil.encodePacketId(out, withId.getPacketId());
        }
        // PINGREQ / PINGRESP / DISCONNECT 没有包体
    }
    
    private static void writeConnect(MqttConnectPacket connect, ByteBuf out) {
        MqttCodecUtil.encodeString(out, MqttConnectPacket.PROTOCOL_NAME);
        out.writeByte(MqttConnectPacket.PROTOCOL_LEVEL);
        out.writeByte(connect.getConnectFlags().toByte());
        out.writeShort(connect.keepAlive());
        MqttCodecUtil.encodeString(out, connect.clientId());
        
        MqttLastWill will = connect.lastWill();
        if (will != null) {
            MqttCodecUtil.encodeString(out, will.topic());
            MqttCodecUtil.encodeBinaryData(out, will.message());
        }
        if (connect.username() != null) {
            MqttCodecUtil.encodeString(out, connect.username());
        }
        if (connect.password() != null) {
            MqttCodecUtil.encodeBinaryData(out, connect.password());
        }
    }
    
    /**
     * 计算包体（剩余长度）的字节数
     *
     * @param packet MQTT数据包
     * @return 剩余长度
     */
    public static int getEncodedSize(MqttPacket packet) {
        if (packet instanceof MqttConnectPacket connect) {
            // 协议名(6) + 协议级别(1) + 连接标志(1) + 保持连接(2)
            int size = 10 + MqttCodecUtil.getStringEncodedLength(connect.clientId());
            MqttLastWill will = connect.lastWill();
            if (will != null) {
                size += MqttCodecUtil.getStringEncodedLength(will.topic());
                size += MqttCodecUtil.getBinaryEncodedLength(will.message());
            }
            if (connect.username() != null) {
                size += MqttCodecUtil.getStringEncodedLength(connect.username());
            }
            if (connect.password() != null) {
                size += MqttCodecUtil.getBinaryEncodedLength(connect.password());
            }
            return size;
        } else if (packet instanceof MqttPublishPacket publish) {
            int size = MqttCodecUtil.getStringEncodedLength(publish.topic()) + publish.payload().length;
            return publish.qos().requiresAcknowledgment() ? size + 2 : size;
        } else if (packet instanceof MqttSubscribePacket subscribe) {
            int size = 2;
            for (MqttTopicSubscription subscription : subscribe.subscriptions()) {
                size += MqttCodecUtil.getStringEncodedLength(subscription.topicFilter()) + 1;
            }
            return size;
        } else if (packet instanceof MqttSubackPacket suback) {
            return 2 + suback.returnCodes().size();
        } else if (packet instanceof MqttUnsubscribePacket unsubscribe) {
            int size = 2;
            for (String topicFilter : unsubscribe.topicFilters()) {
                size += MqttCodecUtil.getStringEncodedLength(topicFilter);
            }
            return size;
        } else if (packet instanceof MqttConnackPacket || packet instanceof MqttPacketWithId) {
            return 2;
        }
        return 0;
    }
    
    /**
     * 编码前校验，保证不会写出半个包
     */
    private static void validate(MqttPacket packet) {
        if (packet == null) {
            throw new MqttCodecException(MqttCodecErrorType.MALFORMED_PACKET, "packet cannot be null");
        }
        if (packet instanceof MqttPublishPacket publish
                && publish.qos().requiresAcknowledgment() && !publish.hasPacketId()) {
            throw new MqttCodecException(MqttCodecErrorType.PACKET_ID_REQUIRED,
                    "QoS " + publish.qos().getValue() + " publish to " + publish.topic());
        }
    }
}
