/**
 * MQTT编解码错误类型
 *
 * @author zhenglin
 * @date 2025/08/06
 */
package com.lmqtt.common.protocol.codec;

/**
 * 编解码错误分类，每种错误都是独立报告的，不会被静默转换
 */
public enum MqttCodecErrorType {
    /**
     * 协议名不是"MQTT"
     */
    INVALID_PROTOCOL("Invalid protocol name"),
    
    /**
     * 不支持的协议级别
     */
    UNSUPPORTED_PROTOCOL_LEVEL("Unsupported protocol level"),
    
    /**
     * CONNECT标志字节的保留位被设置
     */
    CONNECT_RESERVED_FLAG_SET("Connect reserved flag set"),
    
    /**
     * CONNACK确认标志字节的保留位被设置
     */
    CONNACK_RESERVED_FLAG_SET("ConnAck reserved flag set"),
    
    /**
     * 空客户端标识符但未设置清除会话
     */
    INVALID_CLIENT_ID("Invalid client identifier"),
    
    /**
     * 数据比长度字段承诺的短，或长度字段本身非法
     */
    INVALID_LENGTH("Invalid length"),
    
    /**
     * 字段取值非法（QoS为3、包标识符为0、未知返回码等）
     */
    MALFORMED_PACKET("Malformed packet"),
    
    /**
     * 未知的包类型（0或15）
     */
    UNSUPPORTED_PACKET_TYPE("Unsupported packet type"),
    
    /**
     * 帧大小超过配置的上限
     */
    MAX_SIZE_EXCEEDED("Max frame size exceeded"),
    
    /**
     * 字符串不是合法的UTF-8
     */
    UTF8_ERROR("Invalid UTF-8 string"),
    
    /**
     * QoS大于0的PUBLISH缺少包标识符
     */
    PACKET_ID_REQUIRED("Packet identifier required");
    
    private final String description;
    
    MqttCodecErrorType(String description) {
        this.description = description;
    }
    
    public String getDescription() {
        return description;
    }
}
