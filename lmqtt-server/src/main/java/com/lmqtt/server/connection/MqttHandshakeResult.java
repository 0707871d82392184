/**
 * 握手结果
 *
 * @author zhenglin
 * @date 2025/08/08
 */
package com.lmqtt.server.connection;

import com.lmqtt.common.protocol.packet.connect.MqttConnectPacket;
import com.lmqtt.server.message.MqttConnectAck;

/**
 * 连接处理器完成后的握手结果
 *
 * @param connect 收到的CONNECT包
 * @param ack 连接处理器的结果
 * @param <S> 会话状态类型
 */
public record MqttHandshakeResult<S>(MqttConnectPacket connect, MqttConnectAck<S> ack) {
}
