/**
 * MQTT主题模型
 *
 * @author zhenglin
 * @date 2025/08/07
 */
package com.lmqtt.common.protocol.topic;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 由层级组成的主题或主题过滤器
 * 
 * 解析时校验：'#'只能是最后一层，'$'开头的层级只能是第一层。
 * 匹配规则：
 * - '+'匹配恰好一个非元数据层级（包括空层级）
 * - '#'匹配剩余的零个或多个层级
 * - 普通和元数据层级要求内容完全相同
 * - '$'开头的主题不会被首层通配符匹配
 */
public final class MqttTopic {
    
    /**
     * 层级分隔符
     */
    public static final String LEVEL_SEPARATOR = "/";
    
    private final List<MqttTopicLevel> levels;
    
    private MqttTopic(List<MqttTopicLevel> levels) {
        this.levels = Collections.unmodifiableList(levels);
    }
    
    /**
     * 解析主题或主题过滤器
     *
     * @param topic 主题字符串
     * @return 主题
     * @throws MqttTopicException 如果主题格式非法
     */
    public static MqttTopic parse(String topic) {
        if (topic == null) {
            throw new MqttTopicException(MqttTopicException.ErrorType.INVALID_TOPIC, "Topic cannot be null");
        }
        
        String[] parts = topic.split(LEVEL_SEPARATOR, -1);
        List<MqttTopicLevel> levels = new ArrayList<>(parts.length);
        for (String part : parts) {
            levels.add(MqttTopicLevel.parse(part));
        }
        
        MqttTopic parsed = new MqttTopic(levels);
        if (!parsed.isValid()) {
            throw new MqttTopicException(MqttTopicException.ErrorType.INVALID_TOPIC, "Invalid topic: " + topic);
        }
        return parsed;
    }
    
    /**
     * 检查主题字符串是否合法
     *
     * @param topic 主题字符串
     * @return 如果合法返回true
     */
    public static boolean isValid(String topic) {
        try {
            parse(topic);
            return true;
        } catch (MqttTopicException e) {
            return false;
        }
    }
    
    /**
     * 检查层级组合是否合法
     *
     * @return 如果'#'只在最后一层且'$'层级只在第一层返回true
     */
    public boolean isValid() {
        for (int i = 0; i < levels.size(); i++) {
            MqttTopicLevel.Type type = levels.get(i).type();
            if (type == MqttTopicLevel.Type.MULTI_WILDCARD && i != levels.size() - 1) {
                return false;
            }
            if (type == MqttTopicLevel.Type.METADATA && i != 0) {
                return false;
            }
        }
        return true;
    }
    
    /**
     * 匹配主题名
     *
     * @param topic 发布的主题名
     * @return 如果该过滤器匹配主题返回true
     */
    public boolean matches(String topic) {
        return matchLevels(topic.split(LEVEL_SEPARATOR, -1));
    }
    
    /**
     * 匹配已解析的主题
     *
     * @param topic 发布的主题
     * @return 如果该过滤器匹配主题返回true
     */
    public boolean matches(MqttTopic topic) {
        return matchLevels(topic.levels.stream().map(MqttTopicLevel::value).toArray(String[]::new));
    }
    
    private boolean matchLevels(String[] topicLevels) {
        int index = 0;
        for (MqttTopicLevel filterLevel : levels) {
            if (filterLevel.type() == MqttTopicLevel.Type.MULTI_WILDCARD) {
                // '#'匹配剩余全部层级，但不匹配以元数据层级开头的剩余部分
                return index >= topicLevels.length || filterLevel.matches(topicLevels[index]);
            }
            if (index >= topicLevels.length || !filterLevel.matches(topicLevels[index])) {
                return false;
            }
            index++;
        }
        return index == topicLevels.length;
    }
    
    /**
     * 是否包含通配符层级
     *
     * @return 如果包含'+'或'#'返回true
     */
    public boolean hasWildcards() {
        return levels.stream().anyMatch(MqttTopicLevel::isWildcard);
    }
    
    /**
     * 获取层级列表
     *
     * @return 不可修改的层级列表
     */
    public List<MqttTopicLevel> getLevels() {
        return levels;
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof MqttTopic other && levels.equals(other.levels);
    }
    
    @Override
    public int hashCode() {
        return levels.hashCode();
    }
    
    @Override
    public String toString() {
        return levels.stream().map(MqttTopicLevel::value).collect(Collectors.joining(LEVEL_SEPARATOR));
    }
}
