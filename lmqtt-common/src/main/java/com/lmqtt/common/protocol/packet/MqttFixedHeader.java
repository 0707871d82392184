/**
 * MQTT固定头部
 *
 * @author zhenglin
 * @date 2025/08/06
 */
package com.lmqtt.common.protocol.packet;

import com.lmqtt.common.protocol.codec.MqttCodecUtil;

/**
 * MQTT固定头部定义
 * 
 * 固定头部存在于每个MQTT控制包中，包含：
 * - 控制包类型和标志位（1字节，高4位为类型，低4位为标志）
 * - 剩余长度（1-4字节）
 *
 * @param packetType 包类型值（4位，0-15，未知类型在读取包体时报告）
 * @param packetFlags 类型相关的标志位（4位）
 * @param remainingLength 剩余长度
 */
public record MqttFixedHeader(int packetType, int packetFlags, int remainingLength) {
    
    /**
     * 构造函数验证
     */
    public MqttFixedHeader {
        if (packetType < 0 || packetType > 0x0F) {
            throw new IllegalArgumentException("Packet type out of range: " + packetType);
        }
        if (packetFlags < 0 || packetFlags > 0x0F) {
            throw new IllegalArgumentException("Packet flags out of range: " + packetFlags);
        }
        if (remainingLength < 0 || remainingLength > MqttCodecUtil.MAX_REMAINING_LENGTH) {
            throw new IllegalArgumentException("Remaining length out of range: " + remainingLength);
        }
    }
    
    /**
     * 根据固定头部第一个字节创建
     *
     * @param firstByte 第一个字节
     * @param remainingLength 剩余长度
     * @return 固定头部
     */
    public static MqttFixedHeader fromFirstByte(int firstByte, int remainingLength) {
        return new MqttFixedHeader((firstByte & 0xF0) >> 4, firstByte & 0x0F, remainingLength);
    }
    
    /**
     * 获取第一个字节（包含包类型和标志位）
     *
     * @return 固定头部第一个字节
     */
    public byte getFirstByte() {
        return (byte) ((packetType << 4) | packetFlags);
    }
    
    /**
     * 获取包类型枚举
     *
     * @return 包类型，保留值返回null
     */
    public MqttPacketType getType() {
        return MqttPacketType.fromValue(packetType);
    }
}
