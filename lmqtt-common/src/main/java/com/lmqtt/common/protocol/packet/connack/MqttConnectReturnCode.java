/**
 * MQTT连接返回码
 *
 * @author zhenglin
 * @date 2025/08/06
 */
package com.lmqtt.common.protocol.packet.connack;

/**
 * MQTT 3.1.1 CONNACK包连接返回码定义
 */
public enum MqttConnectReturnCode {
    /**
     * 连接已接受
     */
    CONNECTION_ACCEPTED(0x00, "Connection accepted"),
    
    /**
     * 连接已拒绝，不支持的协议版本
     */
    CONNECTION_REFUSED_UNACCEPTABLE_PROTOCOL_VERSION(0x01, "Connection refused: unacceptable protocol version"),
    
    /**
     * 连接已拒绝，不合格的客户端标识符
     */
    CONNECTION_REFUSED_IDENTIFIER_REJECTED(0x02, "Connection refused: identifier rejected"),
    
    /**
     * 连接已拒绝，服务端不可用
     */
    CONNECTION_REFUSED_SERVER_UNAVAILABLE(0x03, "Connection refused: server unavailable"),
    
    /**
     * 连接已拒绝，无效的用户名或密码
     */
    CONNECTION_REFUSED_BAD_USER_NAME_OR_PASSWORD(0x04, "Connection refused: bad username or password"),
    
    /**
     * 连接已拒绝，未授权
     */
    CONNECTION_REFUSED_NOT_AUTHORIZED(0x05, "Connection refused: not authorized");
    
    /**
     * 返回码值
     */
    private final int value;
    
    /**
     * 返回码描述
     */
    private final String description;
    
    MqttConnectReturnCode(int value, String description) {
        this.value = value;
        this.description = description;
    }
    
    /**
     * 获取返回码值
     *
     * @return 返回码值
     */
    public int getValue() {
        return value;
    }
    
    /**
     * 获取返回码描述
     *
     * @return 返回码描述
     */
    public String getDescription() {
        return description;
    }
    
    /**
     * 检查是否为成功返回码
     *
     * @return 如果是成功返回码返回true
     */
    public boolean isSuccess() {
        return this == CONNECTION_ACCEPTED;
    }
    
    /**
     * 根据值获取返回码
     *
     * @param value 返回码值
     * @return 返回码，未知值返回null
     */
    public static MqttConnectReturnCode fromValue(int value) {
        for (MqttConnectReturnCode code : values()) {
            if (code.value == value) {
                return code;
            }
        }
        return null;
    }
}
