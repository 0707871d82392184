/**
 * MQTT主题解析异常
 *
 * @author zhenglin
 * @date 2025/08/07
 */
package com.lmqtt.common.protocol.topic;

/**
 * 主题或主题过滤器格式非法时抛出
 */
public class MqttTopicException extends RuntimeException {
    
    private static final long serialVersionUID = 1L;
    
    /**
     * 错误类型
     */
    public enum ErrorType {
        /**
         * 层级组合非法：'#'不在最后一层，或'$'层级不在第一层
         */
        INVALID_TOPIC,
        
        /**
         * 单个层级非法：通配符与其他字符混用
         */
        INVALID_LEVEL
    }
    
    private final ErrorType errorType;
    
    public MqttTopicException(ErrorType errorType, String message) {
        super(message);
        this.errorType = errorType;
    }
    
    public ErrorType getErrorType() {
        return errorType;
    }
}
