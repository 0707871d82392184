/**
 * 连接处理结果
 *
 * @author zhenglin
 * @date 2025/08/08
 */
package com.lmqtt.server.message;

import com.lmqtt.common.protocol.packet.connack.MqttConnackPacket;
import com.lmqtt.common.protocol.packet.connack.MqttConnectReturnCode;

import java.time.Duration;

/**
 * 连接处理器的结果：接受（携带会话状态）或拒绝（携带返回码）
 * 
 * 接受时可以覆盖本连接的保持连接时间和在途发布上限
 *
 * @param <S> 会话状态类型
 */
public final class MqttConnectAck<S> {
    
    private final S session;
    
    private final boolean sessionPresent;
    
    private final MqttConnectReturnCode returnCode;
    
    private Duration idleTimeout;
    
    private int inflight;
    
    private MqttConnectAck(S session, boolean sessionPresent, MqttConnectReturnCode returnCode) {
        this.session = session;
        this.sessionPresent = sessionPresent;
        this.returnCode = returnCode;
    }
    
    static <S> MqttConnectAck<S> accepted(S session, boolean sessionPresent) {
        return new MqttConnectAck<>(session, sessionPresent, MqttConnectReturnCode.CONNECTION_ACCEPTED);
    }
    
    static <S> MqttConnectAck<S> rejected(MqttConnectReturnCode returnCode) {
        if (returnCode.isSuccess()) {
            throw new IllegalArgumentException("Rejection requires a failure return code");
        }
        return new MqttConnectAck<>(null, false, returnCode);
    }
    
    /**
     * 覆盖保持连接时间，Duration.ZERO表示不检查
     *
     * @param timeout 保持连接时间
     * @return this
     */
    public MqttConnectAck<S> idleTimeout(Duration timeout) {
        if (timeout == null || timeout.isNegative()) {
            throw new IllegalArgumentException("Idle timeout must be non-negative");
        }
        this.idleTimeout = timeout;
        return this;
    }
    
    /**
     * 覆盖在途发布上限
     *
     * @param inflight 上限
     * @return this
     */
    public MqttConnectAck<S> inflight(int inflight) {
        if (inflight < 1) {
            throw new IllegalArgumentException("Inflight must be positive: " + inflight);
        }
        this.inflight = inflight;
        return this;
    }
    
    public boolean isAccepted() {
        return returnCode.isSuccess();
    }
    
    public S getSession() {
        return session;
    }
    
    public boolean isSessionPresent() {
        return sessionPresent;
    }
    
    public MqttConnectReturnCode getReturnCode() {
        return returnCode;
    }
    
    /**
     * 获取覆盖的保持连接时间
     *
     * @return 保持连接时间，未覆盖返回null
     */
    public Duration getIdleTimeout() {
        return idleTimeout;
    }
    
    /**
     * 获取覆盖的在途发布上限
     *
     * @return 上限，未覆盖返回0
     */
    public int getInflight() {
        return inflight;
    }
    
    /**
     * 转换为CONNACK包
     *
     * @return CONNACK包
     */
    public MqttConnackPacket toPacket() {
        return new MqttConnackPacket(sessionPresent, returnCode);
    }
}
