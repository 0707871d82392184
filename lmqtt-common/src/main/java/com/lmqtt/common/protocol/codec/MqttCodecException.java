/**
 * MQTT编解码异常
 *
 * @author zhenglin
 * @date 2025/08/06
 */
package com.lmqtt.common.protocol.codec;

/**
 * MQTT协议编解码异常
 * 
 * 在MQTT数据包编码或解码过程中发生错误时抛出，携带具体的错误类型
 */
public class MqttCodecException extends RuntimeException {
    
    /**
     * 序列化版本号
     */
    private static final long serialVersionUID = 1L;
    
    /**
     * 错误类型
     */
    private final MqttCodecErrorType errorType;
    
    /**
     * 创建编解码异常
     *
     * @param errorType 错误类型
     * @param message 异常消息
     */
    public MqttCodecException(MqttCodecErrorType errorType, String message) {
        super(errorType.getDescription() + ": " + message);
        this.errorType = errorType;
    }
    
    /**
     * 创建编解码异常
     *
     * @param errorType 错误类型
     * @param message 异常消息
     * @param cause 原因异常
     */
    public MqttCodecException(MqttCodecErrorType errorType, String message, Throwable cause) {
        super(errorType.getDescription() + ": " + message, cause);
        this.errorType = errorType;
    }
    
    /**
     * 获取错误类型
     *
     * @return 错误类型
     */
    public MqttCodecErrorType getErrorType() {
        return errorType;
    }
}
