/**
 * MQTT连接包
 *
 * @author zhenglin
 * @date 2025/08/06
 */
package com.lmqtt.common.protocol.packet.connect;

import com.lmqtt.common.protocol.packet.MqttPacket;
import com.lmqtt.common.protocol.packet.MqttPacketType;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * MQTT CONNECT包定义
 * 
 * 客户端连接到服务器时发送的第一个包，协议名固定为"MQTT"，协议级别为4（3.1.1）
 *
 * @param cleanSession 清除会话标志
 * @param keepAlive 保持连接时间（秒，0-65535）
 * @param clientId 客户端标识符，仅当cleanSession为true时允许为空
 * @param lastWill 遗嘱消息，可为null
 * @param username 用户名，可为null
 * @param password 密码，可为null
 */
public record MqttConnectPacket(
        boolean cleanSession,
        int keepAlive,
        String clientId,
        MqttLastWill lastWill,
        String username,
        byte[] password) implements MqttPacket {
    
    /**
     * 协议名
     */
    public static final String PROTOCOL_NAME = "MQTT";
    
    /**
     * 协议级别（MQTT 3.1.1）
     */
    public static final int PROTOCOL_LEVEL = 4;
    
    /**
     * 构造函数验证
     */
    public MqttConnectPacket {
        if (keepAlive < 0 || keepAlive > 65535) {
            throw new IllegalArgumentException("Keep alive must be 0-65535: " + keepAlive);
        }
        if (clientId == null) {
            throw new IllegalArgumentException("Client ID cannot be null");
        }
        if (clientId.isEmpty() && !cleanSession) {
            throw new IllegalArgumentException("Empty client ID requires clean session");
        }
    }
    
    @Override
    public MqttPacketType getPacketType() {
        return MqttPacketType.CONNECT;
    }
    
    /**
     * 创建不带遗嘱和认证信息的CONNECT包
     *
     * @param clientId 客户端标识符
     * @param keepAlive 保持连接时间（秒）
     * @param cleanSession 清除会话标志
     * @return CONNECT包
     */
    public static MqttConnectPacket create(String clientId, int keepAlive, boolean cleanSession) {
        return new MqttConnectPacket(cleanSession, keepAlive, clientId, null, null, null);
    }
    
    /**
     * 创建带用户名密码的CONNECT包
     *
     * @param clientId 客户端标识符
     * @param keepAlive 保持连接时间（秒）
     * @param cleanSession 清除会话标志
     * @param username 用户名
     * @param password 密码
     * @return CONNECT包
     */
    public static MqttConnectPacket create(String clientId, int keepAlive, boolean cleanSession,
                                           String username, String password) {
        return new MqttConnectPacket(cleanSession, keepAlive, clientId, null, username,
                password != null ? password.getBytes(StandardCharsets.UTF_8) : null);
    }
    
    /**
     * 获取连接标志
     *
     * @return 连接标志
     */
    public MqttConnectFlags getConnectFlags() {
        return MqttConnectFlags.of(this);
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof MqttConnectPacket other)) {
            return false;
        }
        return cleanSession == other.cleanSession
                && keepAlive == other.keepAlive
                && clientId.equals(other.clientId)
                && Objects.equals(lastWill, other.lastWill)
                && Objects.equals(username, other.username)
                && Arrays.equals(password, other.password);
    }
    
    @Override
    public int hashCode() {
        return 31 * Objects.hash(cleanSession, keepAlive, clientId, lastWill, username) + Arrays.hashCode(password);
    }
    
    @Override
    public String toString() {
        return String.format("MqttConnectPacket{clientId='%s', keepAlive=%d, cleanSession=%s, hasWill=%s, hasUsername=%s, hasPassword=%s}",
                clientId, keepAlive, cleanSession, lastWill != null, username != null, password != null);
    }
}
