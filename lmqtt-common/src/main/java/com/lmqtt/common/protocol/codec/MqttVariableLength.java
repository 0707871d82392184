/**
 * 变长整数解码结果
 *
 * @author zhenglin
 * @date 2025/08/06
 */
package com.lmqtt.common.protocol.codec;

/**
 * 剩余长度解码结果
 *
 * @param value 解码出的长度值
 * @param bytesConsumed 编码占用的字节数（1-4）
 */
public record MqttVariableLength(int value, int bytesConsumed) {
}
