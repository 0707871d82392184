/**
 * CONNECT消息视图
 *
 * @author zhenglin
 * @date 2025/08/08
 */
package com.lmqtt.server.message;

import com.lmqtt.common.protocol.packet.connack.MqttConnectReturnCode;
import com.lmqtt.common.protocol.packet.connect.MqttConnectPacket;
import com.lmqtt.common.protocol.packet.connect.MqttLastWill;
import com.lmqtt.server.session.MqttSink;

import java.time.Duration;

/**
 * 传给连接处理器的CONNECT视图，同时用于构造接受或拒绝结果
 */
public class MqttConnect {
    
    private final MqttConnectPacket packet;
    
    private final MqttSink sink;
    
    public MqttConnect(MqttConnectPacket packet, MqttSink sink) {
        this.packet = packet;
        this.sink = sink;
    }
    
    public MqttConnectPacket packet() {
        return packet;
    }
    
    public String clientId() {
        return packet.clientId();
    }
    
    public boolean cleanSession() {
        return packet.cleanSession();
    }
    
    /**
     * 客户端请求的保持连接时间
     *
     * @return 保持连接时间，0表示不检查
     */
    public Duration keepAlive() {
        return Duration.ofSeconds(packet.keepAlive());
    }
    
    public MqttLastWill lastWill() {
        return packet.lastWill();
    }
    
    public String username() {
        return packet.username();
    }
    
    public byte[] password() {
        return packet.password();
    }
    
    /**
     * 获取连接的发布通道，可保存在会话状态中用于主动发布
     *
     * @return 发布通道
     */
    public MqttSink sink() {
        return sink;
    }
    
    /**
     * 接受连接
     *
     * @param session 会话状态
     * @param sessionPresent 会话存在标志
     * @param <S> 会话状态类型
     * @return 接受结果
     */
    public <S> MqttConnectAck<S> ack(S session, boolean sessionPresent) {
        return MqttConnectAck.accepted(session, sessionPresent);
    }
    
    /**
     * 拒绝连接：客户端标识符不合格
     */
    public <S> MqttConnectAck<S> identifierRejected() {
        return MqttConnectAck.rejected(MqttConnectReturnCode.CONNECTION_REFUSED_IDENTIFIER_REJECTED);
    }
    
    /**
     * 拒绝连接：用户名或密码错误
     */
    public <S> MqttConnectAck<S> badUsernameOrPassword() {
        return MqttConnectAck.rejected(MqttConnectReturnCode.CONNECTION_REFUSED_BAD_USER_NAME_OR_PASSWORD);
    }
    
    /**
     * 拒绝连接：未授权
     */
    public <S> MqttConnectAck<S> notAuthorized() {
        return MqttConnectAck.rejected(MqttConnectReturnCode.CONNECTION_REFUSED_NOT_AUTHORIZED);
    }
    
    /**
     * 拒绝连接：服务不可用
     */
    public <S> MqttConnectAck<S> serverUnavailable() {
        return MqttConnectAck.rejected(MqttConnectReturnCode.CONNECTION_REFUSED_SERVER_UNAVAILABLE);
    }
    
    @Override
    public String toString() {
        return "MqttConnect{" + packet + "}";
    }
}
