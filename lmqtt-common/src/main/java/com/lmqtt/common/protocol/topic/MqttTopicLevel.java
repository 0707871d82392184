/**
 * MQTT主题层级
 *
 * @author zhenglin
 * @date 2025/08/07
 */
package com.lmqtt.common.protocol.topic;

/**
 * 主题中以'/'分隔的单个层级
 *
 * @param type 层级类型
 * @param value 层级原始文本
 */
public record MqttTopicLevel(Type type, String value) {
    
    /**
     * 层级类型
     */
    public enum Type {
        /**
         * 普通层级，不以'$'开头且不含通配符
         */
        NORMAL,
        
        /**
         * 元数据层级，以'$'开头，如$SYS
         */
        METADATA,
        
        /**
         * 空层级，由相邻或首尾的'/'产生
         */
        BLANK,
        
        /**
         * 单层通配符'+'
         */
        SINGLE_WILDCARD,
        
        /**
         * 多层通配符'#'
         */
        MULTI_WILDCARD
    }
    
    public static final MqttTopicLevel BLANK = new MqttTopicLevel(Type.BLANK, "");
    public static final MqttTopicLevel SINGLE_WILDCARD = new MqttTopicLevel(Type.SINGLE_WILDCARD, "+");
    public static final MqttTopicLevel MULTI_WILDCARD = new MqttTopicLevel(Type.MULTI_WILDCARD, "#");
    
    /**
     * 解析单个层级
     *
     * @param level 层级文本
     * @return 主题层级
     * @throws MqttTopicException 如果通配符与其他字符混用
     */
    public static MqttTopicLevel parse(String level) {
        switch (level) {
            case "+":
                return SINGLE_WILDCARD;
            case "#":
                return MULTI_WILDCARD;
            case "":
                return BLANK;
            default:
                break;
        }
        
        if (level.indexOf('+') >= 0 || level.indexOf('#') >= 0) {
            throw new MqttTopicException(MqttTopicException.ErrorType.INVALID_LEVEL, "Invalid topic level: " + level);
        }
        return new MqttTopicLevel(isMetadata(level) ? Type.METADATA : Type.NORMAL, level);
    }
    
    /**
     * 判断主题层级文本是否为元数据层级
     *
     * @param level 层级文本
     * @return 如果以'$'开头返回true
     */
    public static boolean isMetadata(String level) {
        return level.startsWith("$");
    }
    
    /**
     * 是否为通配符层级
     *
     * @return 如果是'+'或'#'返回true
     */
    public boolean isWildcard() {
        return type == Type.SINGLE_WILDCARD || type == Type.MULTI_WILDCARD;
    }
    
    /**
     * 作为过滤器层级匹配一个主题层级
     * 
     * 通配符不匹配元数据层级，元数据层级只被内容相同的元数据过滤层级匹配
     *
     * @param topicLevel 主题层级文本
     * @return 如果匹配返回true
     */
    public boolean matches(String topicLevel) {
        return switch (type) {
            case NORMAL -> !isMetadata(topicLevel) && value.equals(topicLevel);
            case METADATA -> value.equals(topicLevel);
            case BLANK -> topicLevel.isEmpty();
            case SINGLE_WILDCARD, MULTI_WILDCARD -> !isMetadata(topicLevel);
        };
    }
    
    @Override
    public String toString() {
        return value;
    }
}
