/**
 * MQTT数据包解码器
 *
 * @author zhenglin
 * @date 2025/08/06
 */
package com.lmqtt.common.protocol.codec;

import com.lmqtt.common.protocol.MqttQos;
import com.lmqtt.common.protocol.packet.MqttFixedHeader;
import com.lmqtt.common.protocol.packet.MqttPacket;
import com.lmqtt.common.protocol.packet.MqttPacketType;
import com.lmqtt.common.protocol.packet.connack.MqttConnackPacket;
import com.lmqtt.common.protocol.packet.connack.MqttConnectReturnCode;
import com.lmqtt.common.protocol.packet.connect.MqttConnectFlags;
import com.lmqtt.common.protocol.packet.connect.MqttConnectPacket;
import com.lmqtt.common.protocol.packet.connect.MqttLastWill;
import com.lmqtt.common.protocol.packet.disconnect.MqttDisconnectPacket;
import com.lmqtt.common.protocol.packet.ping.MqttPingreqPacket;
import com.lmqtt.common.protocol.packet.ping.MqttPingrespPacket;
import com.lmqtt.common.protocol.packet.puback.MqttPubackPacket;
import com.lmqtt.common.protocol.packet.pubcomp.MqttPubcompPacket;
import com.lmqtt.common.protocol.packet.publish.MqttPublishPacket;
import com.lmqtt.common.protocol.packet.pubrec.MqttPubrecPacket;
import com.lmqtt.common.protocol.packet.pubrel.MqttPubrelPacket;
import com.lmqtt.common.protocol.packet.suback.MqttSubackPacket;
import com.lmqtt.common.protocol.packet.suback.MqttSubackReturnCode;
import com.lmqtt.common.protocol.packet.subscribe.MqttSubscribePacket;
import com.lmqtt.common.protocol.packet.subscribe.MqttTopicSubscription;
import com.lmqtt.common.protocol.packet.unsuback.MqttUnsubackPacket;
import com.lmqtt.common.protocol.packet.unsubscribe.MqttUnsubscribePacket;
import io.netty.buffer.ByteBuf;

import java.util.ArrayList;
import java.util.List;

/**
 * MQTT 3.1.1包体解码器
 * 
 * 无状态，输入为恰好包含剩余长度字节的包体和已解析的固定头部。
 * 非PUBLISH包的固定头部标志位和包体末尾多余的字节不做校验
 */
public final class MqttPacketDecoder {
    
    /**
     * CONNECT可变头部的最小长度：协议名(6) + 协议级别(1) + 连接标志(1) + 保持连接(2)
     */
    private static final int CONNECT_VARIABLE_HEADER_LENGTH = 10;
    
    private MqttPacketDecoder() {
    }
    
    /**
     * 解码包体
     *
     * @param body 包体数据，读指针位于可变头部开始处
     * @param fixedHeader 固定头部
     * @return 解码的数据包
     * @throws MqttCodecException 如果包内容非法
     */
    public static MqttPacket readPacket(ByteBuf body, MqttFixedHeader fixedHeader) {
        MqttPacketType packetType = fixedHeader.getType();
        if (packetType == null) {
            throw new MqttCodecException(MqttCodecErrorType.UNSUPPORTED_PACKET_TYPE,
                    "packet type " + fixedHeader.packetType());
        }
        
        return switch (packetType) {
            case CONNECT -> decodeConnect(body);
            case CONNACK -> decodeConnack(body);
            case PUBLISH -> decodePublish(body, fixedHeader);
            case PUBACK -> new MqttPubackPacket(MqttCodecUtil.decodePacketId(body));
            case PUBREC -> new MqttPubrecPacket(MqttCodecUtil.decodePacketId(body));
            case PUBREL -> new MqttPubrelPacket(MqttCodecUtil.decodePacketId(body));
            case PUBCOMP -> new MqttPubcompPacket(MqttCodecUtil.decodePacketId(body));
            case SUBSCRIBE -> decodeSubscribe(body);
            case SUBACK -> decodeSuback(body);
            case UNSUBSCRIBE -> decodeUnsubscribe(body);
            case UNSUBACK -> new MqttUnsubackPacket(MqttCodecUtil.decodePacketId(body));
            case PINGREQ -> MqttPingreqPacket.INSTANCE;
            case PINGRESP -> MqttPingrespPacket.INSTANCE;
            case DISCONNECT -> MqttDisconnectPacket.INSTANCE;
        };
    }
    
    /**
     * 解码CONNECT包
     */
    private static MqttConnectPacket decodeConnect(ByteBuf buffer) {
        MqttCodecUtil.ensureReadable(buffer, CONNECT_VARIABLE_HEADER_LENGTH, "connect variable header");
        
        int nameLength = buffer.readUnsignedShort();
        if (nameLength != MqttConnectPacket.PROTOCOL_NAME.length()) {
            throw new MqttCodecException(MqttCodecErrorType.INVALID_PROTOCOL, "protocol name length " + nameLength);
        }
        String protocolName = buffer.readCharSequence(nameLength, MqttCodecUtil.UTF8_CHARSET).toString();
        if (!MqttConnectPacket.PROTOCOL_NAME.equals(protocolName)) {
            throw new MqttCodecException(MqttCodecErrorType.INVALID_PROTOCOL, "protocol name " + protocolName);
        }
        
        int protocolLevel = buffer.readUnsignedByte();
        if (protocolLevel != MqttConnectPacket.PROTOCOL_LEVEL) {
            throw new MqttCodecException(MqttCodecErrorType.UNSUPPORTED_PROTOCOL_LEVEL, "level " + protocolLevel);
        }
        
        int flagsByte = buffer.readUnsignedByte();
        if ((flagsByte & MqttConnectFlags.RESERVED) != 0) {
            throw new MqttCodecException(MqttCodecErrorType.CONNECT_RESERVED_FLAG_SET,
                    String.format("flags 0x%02X", flagsByte));
        }
        int willQos = (flagsByte & MqttConnectFlags.WILL_QOS) >> MqttConnectFlags.WILL_QOS_SHIFT;
        if (!MqttQos.isValid(willQos)) {
            throw new MqttCodecException(MqttCodecErrorType.MALFORMED_PACKET, "will QoS " + willQos);
        }
        MqttConnectFlags flags = MqttConnectFlags.fromByte(flagsByte);
        
        int keepAlive = buffer.readUnsignedShort();
        String clientId = MqttCodecUtil.decodeString(buffer);
        if (clientId.isEmpty() && !flags.cleanSession()) {
            throw new MqttCodecException(MqttCodecErrorType.INVALID_CLIENT_ID,
                    "empty client identifier requires clean session");
        }
        
        MqttLastWill lastWill = null;
        if (flags.willFlag()) {
            String willTopic = MqttCodecUtil.decodeString(buffer);
            byte[] willMessage = MqttCodecUtil.decodeBinaryData(buffer);
            lastWill = new MqttLastWill(flags.willQos(), flags.willRetain(), willTopic, willMessage);
        }
        
        String username = flags.usernameFlag() ? MqttCodecUtil.decodeString(buffer) : null;
        byte[] password = flags.passwordFlag() ? MqttCodecUtil.decodeBinaryData(buffer) : null;
        
        return new MqttConnectPacket(flags.cleanSession(), keepAlive, clientId, lastWill, username, password);
    }
    
    /**
     * 解码CONNACK包
     */
    private static MqttConnackPacket decodeConnack(ByteBuf buffer) {
        MqttCodecUtil.ensureReadable(buffer, 2, "connack");
        
        int ackFlags = buffer.readUnsignedByte();
        if ((ackFlags & ~MqttConnackPacket.SESSION_PRESENT) != 0) {
            throw new MqttCodecException(MqttCodecErrorType.CONNACK_RESERVED_FLAG_SET,
                    String.format("flags 0x%02X", ackFlags));
        }
        
        int code = buffer.readUnsignedByte();
        MqttConnectReturnCode returnCode = MqttConnectReturnCode.fromValue(code);
        if (returnCode == null) {
            throw new MqttCodecException(MqttCodecErrorType.MALFORMED_PACKET, "connect return code " + code);
        }
        
        return new MqttConnackPacket((ackFlags & MqttConnackPacket.SESSION_PRESENT) != 0, returnCode);
    }
    
    /**
     * 解码PUBLISH包，负载为包体剩余的全部字节
     */
    private static MqttPublishPacket decodePublish(ByteBuf buffer, MqttFixedHeader fixedHeader) {
        int flags = fixedHeader.packetFlags();
        int qosValue = (flags & MqttPublishPacket.QOS) >> MqttPublishPacket.QOS_SHIFT;
        if (!MqttQos.isValid(qosValue)) {
            throw new MqttCodecException(MqttCodecErrorType.MALFORMED_PACKET, "publish QoS " + qosValue);
        }
        MqttQos qos = MqttQos.fromValue(qosValue);
        
        String topic = MqttCodecUtil.decodeString(buffer);
        if (MqttPublishPacket.containsWildcard(topic)) {
            throw new MqttCodecException(MqttCodecErrorType.MALFORMED_PACKET, "wildcard in publish topic " + topic);
        }
        
        int packetId = qos.requiresAcknowledgment() ? MqttCodecUtil.decodePacketId(buffer) : 0;
        
        byte[] payload = new byte[buffer.readableBytes()];
        buffer.readBytes(payload);
        
        return new MqttPublishPacket(
                (flags & MqttPublishPacket.DUP) != 0,
                (flags & MqttPublishPacket.RETAIN) != 0,
                qos, topic, packetId, payload);
    }
    
    /**
     * 解码SUBSCRIBE包
     */
    private static MqttSubscribePacket decodeSubscribe(ByteBuf buffer) {
        int packetId = MqttCodecUtil.decodePacketId(buffer);
        
        List<MqttTopicSubscription> subscriptions = new ArrayList<>();
        while (buffer.isReadable()) {
            String topicFilter = MqttCodecUtil.decodeString(buffer);
            MqttCodecUtil.ensureReadable(buffer, 1, "requested QoS");
            int qosValue = buffer.readUnsignedByte() & 0x03;
            if (!MqttQos.isValid(qosValue)) {
                throw new MqttCodecException(MqttCodecErrorType.MALFORMED_PACKET,
                        "requested QoS " + qosValue + " for " + topicFilter);
            }
            subscriptions.add(new MqttTopicSubscription(topicFilter, MqttQos.fromValue(qosValue)));
        }
        
        return new MqttSubscribePacket(packetId, subscriptions);
    }
    
    /**
     * 解码SUBACK包
     */
    private static MqttSubackPacket decodeSuback(ByteBuf buffer) {
        int packetId = MqttCodecUtil.decodePacketId(buffer);
        
        List<MqttSubackReturnCode> returnCodes = new ArrayList<>(buffer.readableBytes());
        while (buffer.isReadable()) {
            int code = buffer.readUnsignedByte();
            MqttSubackReturnCode returnCode = MqttSubackReturnCode.fromValue(code);
            if (returnCode == null) {
                throw new MqttCodecException(MqttCodecErrorType.MALFORMED_PACKET,
                        String.format("subscribe return code 0x%02X", code));
            }
            returnCodes.add(returnCode);
        }
        
        return new MqttSubackPacket(packetId, returnCodes);
    }
    
    /**
     * 解码UNSUBSCRIBE包
     */
    private static MqttUnsubscribePacket decodeUnsubscribe(ByteBuf buffer) {
        int packetId = MqttCodecUtil.decodePacketId(buffer);
        
        List<String> topicFilters = new ArrayList<>();
        while (buffer.isReadable()) {
            topicFilters.add(MqttCodecUtil.decodeString(buffer));
        }
        
        return new MqttUnsubscribePacket(packetId, topicFilters);
    }
}
