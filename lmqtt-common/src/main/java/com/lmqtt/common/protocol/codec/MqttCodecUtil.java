/**
 * MQTT编解码工具类
 *
 * @author zhenglin
 * @date 2025/08/06
 */
package com.lmqtt.common.protocol.codec;

import com.lmqtt.common.protocol.packet.MqttPacketWithId;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;

import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * MQTT协议编解码工具类
 * 
 * 提供变长整数、长度前缀字符串、二进制数据和包标识符的编解码
 */
public final class MqttCodecUtil {
    
    /**
     * 最大剩余长度值（2^28 - 1）
     */
    public static final int MAX_REMAINING_LENGTH = 268435455;
    
    /**
     * 剩余长度最多占用的字节数
     */
    public static final int MAX_REMAINING_LENGTH_BYTES = 4;
    
    /**
     * 长度前缀字段允许的最大字节数
     */
    public static final int MAX_STRING_LENGTH = 65535;
    
    /**
     * UTF-8字符集
     */
    public static final Charset UTF8_CHARSET = StandardCharsets.UTF_8;
    
    private MqttCodecUtil() {
        // 工具类，防止实例化
    }
    
    /**
     * 从指定位置解码剩余长度，不移动读指针
     * 
     * 每个字节低7位为数据，按低位组在前的顺序累加，最高位表示后面还有字节
     *
     * @param buffer 字节缓冲区
     * @param index 剩余长度第一个字节的绝对位置
     * @return 解码结果，如果数据不足返回null
     * @throws MqttCodecException 如果第4个字节仍然设置了继续位
     */
    public static MqttVariableLength decodeVariableLength(ByteBuf buffer, int index) {
        int value = 0;
        int shift = 0;
        
        for (int i = 0; i < MAX_REMAINING_LENGTH_BYTES; i++) {
            if (index + i >= buffer.writerIndex()) {
                return null; // 数据不足
            }
            int digit = buffer.getUnsignedByte(index + i);
            value |= (digit & 0x7F) << shift;
            if ((digit & 0x80) == 0) {
                return new MqttVariableLength(value, i + 1);
            }
            shift += 7;
        }
        
        throw new MqttCodecException(MqttCodecErrorType.INVALID_LENGTH,
                "continuation bit set on the 4th remaining length byte");
    }
    
    /**
     * 从读指针位置解码剩余长度并消费相应字节
     *
     * @param buffer 字节缓冲区
     * @return 剩余长度，如果数据不足返回-1
     */
    public static int decodeRemainingLength(ByteBuf buffer) {
        MqttVariableLength length = decodeVariableLength(buffer, buffer.readerIndex());
        if (length == null) {
            return -1;
        }
        buffer.skipBytes(length.bytesConsumed());
        return length.value();
    }
    
    /**
     * 编码剩余长度
     *
     * @param buffer 字节缓冲区
     * @param remainingLength 剩余长度
     */
    public static void encodeRemainingLength(ByteBuf buffer, int remainingLength) {
        validateRemainingLength(remainingLength);
        
        do {
            int digit = remainingLength % 128;
            remainingLength /= 128;
            if (remainingLength > 0) {
                digit |= 0x80;
            }
            buffer.writeByte(digit);
        } while (remainingLength > 0);
    }
    
    /**
     * 计算剩余长度编码后的字节数
     *
     * @param remainingLength 剩余长度
     * @return 编码字节数
     */
    public static int getRemainingLengthEncodedSize(int remainingLength) {
        validateRemainingLength(remainingLength);
        
        if (remainingLength < 128) {
            return 1;
        } else if (remainingLength < 16384) {
            return 2;
        } else if (remainingLength < 2097152) {
            return 3;
        } else {
            return 4;
        }
    }
    
    private static void validateRemainingLength(int remainingLength) {
        if (remainingLength < 0 || remainingLength > MAX_REMAINING_LENGTH) {
            throw new MqttCodecException(MqttCodecErrorType.INVALID_LENGTH,
                    "remaining length out of range: " + remainingLength);
        }
    }
    
    /**
     * 检查缓冲区可读字节数
     *
     * @param buffer 字节缓冲区
     * @param length 需要的字节数
     * @param field 字段名，用于错误信息
     */
    public static void ensureReadable(ByteBuf buffer, int length, String field) {
        if (buffer.readableBytes() < length) {
            throw new MqttCodecException(MqttCodecErrorType.INVALID_LENGTH,
                    String.format("%s requires %d bytes, only %d available", field, length, buffer.readableBytes()));
        }
    }
    
    /**
     * 解码长度前缀的UTF-8字符串
     *
     * @param buffer 字节缓冲区
     * @return 解码的字符串
     */
    public static String decodeString(ByteBuf buffer) {
        ensureReadable(buffer, 2, "string length");
        int length = buffer.readUnsignedShort();
        ensureReadable(buffer, length, "string");
        
        try {
            String value = UTF8_CHARSET.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(buffer.nioBuffer(buffer.readerIndex(), length))
                    .toString();
            buffer.skipBytes(length);
            return value;
        } catch (CharacterCodingException e) {
            throw new MqttCodecException(MqttCodecErrorType.UTF8_ERROR, "malformed string of " + length + " bytes", e);
        }
    }
    
    /**
     * 编码长度前缀的UTF-8字符串
     *
     * @param buffer 字节缓冲区
     * @param str 要编码的字符串
     */
    public static void encodeString(ByteBuf buffer, String str) {
        encodeBinaryData(buffer, str.getBytes(UTF8_CHARSET));
    }
    
    /**
     * 解码长度前缀的二进制数据
     *
     * @param buffer 字节缓冲区
     * @return 二进制数据
     */
    public static byte[] decodeBinaryData(ByteBuf buffer) {
        ensureReadable(buffer, 2, "binary length");
        int length = buffer.readUnsignedShort();
        ensureReadable(buffer, length, "binary data");
        
        byte[] data = new byte[length];
        buffer.readBytes(data);
        return data;
    }
    
    /**
     * 编码长度前缀的二进制数据
     *
     * @param buffer 字节缓冲区
     * @param data 二进制数据
     */
    public static void encodeBinaryData(ByteBuf buffer, byte[] data) {
        if (data.length > MAX_STRING_LENGTH) {
            throw new MqttCodecException(MqttCodecErrorType.INVALID_LENGTH,
                    "length-prefixed field too long: " + data.length);
        }
        buffer.writeShort(data.length);
        buffer.writeBytes(data);
    }
    
    /**
     * 解码包标识符
     *
     * @param buffer 字节缓冲区
     * @return 包标识符
     * @throws MqttCodecException 如果数据不足或包标识符为0
     */
    public static int decodePacketId(ByteBuf buffer) {
        ensureReadable(buffer, 2, "packet identifier");
        int packetId = buffer.readUnsignedShort();
        if (packetId < MqttPacketWithId.MIN_PACKET_ID) {
            throw new MqttCodecException(MqttCodecErrorType.MALFORMED_PACKET, "packet identifier must not be 0");
        }
        return packetId;
    }
    
    /**
     * 编码包标识符
     *
     * @param buffer 字节缓冲区
     * @param packetId 包标识符
     */
    public static void encodePacketId(ByteBuf buffer, int packetId) {
        if (packetId < MqttPacketWithId.MIN_PACKET_ID || packetId > MqttPacketWithId.MAX_PACKET_ID) {
            throw new MqttCodecException(MqttCodecErrorType.MALFORMED_PACKET, "invalid packet identifier: " + packetId);
        }
        buffer.writeShort(packetId);
    }
    
    /**
     * 计算字符串编码后的长度（包括2字节长度前缀）
     *
     * @param str 字符串
     * @return 编码后长度
     */
    public static int getStringEncodedLength(String str) {
        return 2 + ByteBufUtil.utf8Bytes(str);
    }
    
    /**
     * 计算二进制数据编码后的长度（包括2字节长度前缀）
     *
     * @param data 二进制数据
     * @return 编码后长度
     */
    public static int getBinaryEncodedLength(byte[] data) {
        return 2 + data.length;
    }
}
