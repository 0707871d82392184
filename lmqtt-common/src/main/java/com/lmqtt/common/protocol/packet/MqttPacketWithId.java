/**
 * 带包标识符的MQTT数据包接口
 *
 * @author zhenglin
 * @date 2025/08/06
 */
package com.lmqtt.common.protocol.packet;

/**
 * 包含包标识符的MQTT控制包
 */
public interface MqttPacketWithId {
    
    /**
     * 最小包标识符，0为保留值
     */
    int MIN_PACKET_ID = 1;
    
    /**
     * 最大包标识符
     */
    int MAX_PACKET_ID = 65535;
    
    /**
     * 获取包标识符
     *
     * @return 包标识符
     */
    int getPacketId();
    
    /**
     * 验证包标识符
     *
     * @param packetId 包标识符
     * @throws IllegalArgumentException 如果包标识符无效
     */
    static void validatePacketId(int packetId) {
        if (packetId < MIN_PACKET_ID || packetId > MAX_PACKET_ID) {
            throw new IllegalArgumentException("Invalid packet ID: " + packetId + ", must be 1-65535");
        }
    }
}
