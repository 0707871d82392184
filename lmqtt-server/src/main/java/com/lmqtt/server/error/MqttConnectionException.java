/**
 * MQTT连接异常
 *
 * @author zhenglin
 * @date 2025/08/08
 */
package com.lmqtt.server.error;

/**
 * 连接关闭异常
 * 
 * 连接关闭时，所有未完成的发布确认都以此异常失败，异常携带关闭原因
 */
public class MqttConnectionException extends RuntimeException {
    
    private static final long serialVersionUID = 1L;
    
    private final MqttCloseReason reason;
    
    public MqttConnectionException(MqttCloseReason reason, String message) {
        super(reason.getDescription() + ": " + message);
        this.reason = reason;
    }
    
    public MqttConnectionException(MqttCloseReason reason, String message, Throwable cause) {
        super(reason.getDescription() + ": " + message, cause);
        this.reason = reason;
    }
    
    /**
     * 获取关闭原因
     *
     * @return 关闭原因
     */
    public MqttCloseReason getReason() {
        return reason;
    }
}
