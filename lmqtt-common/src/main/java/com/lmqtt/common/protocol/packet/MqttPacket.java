/**
 * MQTT数据包基础接口
 *
 * @author zhenglin
 * @date 2025/08/06
 */
package com.lmqtt.common.protocol.packet;

/**
 * MQTT控制包基础接口
 * 
 * 每种控制包类型对应一个不可变的record实现，只携带该类型有意义的字段
 */
public interface MqttPacket {
    
    /**
     * 获取包类型
     *
     * @return MQTT包类型
     */
    MqttPacketType getPacketType();
    
    /**
     * 获取固定头部的标志位
     *
     * @return 低4位标志
     */
    default int getPacketFlags() {
        return 0;
    }
    
    /**
     * 获取包标识符（如果存在）
     *
     * @return 包标识符，如果不存在返回0
     */
    default int getPacketId() {
        if (this instanceof MqttPacketWithId packetWithId) {
            return packetWithId.getPacketId();
        }
        return 0;
    }
}
