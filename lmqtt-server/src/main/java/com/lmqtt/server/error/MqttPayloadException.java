/**
 * MQTT负载解析异常
 *
 * @author zhenglin
 * @date 2025/08/08
 */
package com.lmqtt.server.error;

/**
 * PUBLISH负载无法按JSON反序列化时抛出
 */
public class MqttPayloadException extends RuntimeException {
    
    private static final long serialVersionUID = 1L;
    
    public MqttPayloadException(String message, Throwable cause) {
        super(message, cause);
    }
}
