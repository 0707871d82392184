/**
 * MQTT连接关闭原因
 *
 * @author zhenglin
 * @date 2025/08/08
 */
package com.lmqtt.server.error;

/**
 * 连接关闭原因
 * 
 * 每次连接关闭都只对应一个原因。前四种为正常关闭，其余为错误关闭，
 * 错误关闭按类别区分，便于应用分别记录日志和指标
 */
public enum MqttCloseReason {
    /**
     * 对端发送DISCONNECT
     */
    PEER_DISCONNECT(Category.ORDERLY, "Peer sent DISCONNECT"),
    
    /**
     * 传输层被对端关闭
     */
    TRANSPORT_CLOSED(Category.ORDERLY, "Transport closed"),
    
    /**
     * 应用主动关闭
     */
    APPLICATION_CLOSE(Category.ORDERLY, "Closed by application"),
    
    /**
     * 连接处理器拒绝了连接，CONNACK已发送
     */
    CONNECT_REJECTED(Category.ORDERLY, "Connection rejected"),
    
    /**
     * 入站数据无法解码
     */
    DECODE_ERROR(Category.DECODE, "Decode error"),
    
    /**
     * 协议顺序违规，如PUBACK包标识符不匹配或握手阶段收到非CONNECT包
     */
    PROTOCOL_VIOLATION(Category.PROTOCOL, "Protocol violation"),
    
    /**
     * 握手超时
     */
    HANDSHAKE_TIMEOUT(Category.TIMEOUT, "Handshake timeout"),
    
    /**
     * 保持连接超时
     */
    KEEP_ALIVE_TIMEOUT(Category.TIMEOUT, "Keep alive timeout"),
    
    /**
     * 应用处理器失败
     */
    HANDLER_ERROR(Category.HANDLER, "Handler error"),
    
    /**
     * 传输层读写失败
     */
    IO_ERROR(Category.IO, "I/O error");
    
    /**
     * 关闭原因类别
     */
    public enum Category {
        ORDERLY,
        DECODE,
        PROTOCOL,
        TIMEOUT,
        HANDLER,
        IO
    }
    
    private final Category category;
    
    private final String description;
    
    MqttCloseReason(Category category, String description) {
        this.category = category;
        this.description = description;
    }
    
    public Category getCategory() {
        return category;
    }
    
    public String getDescription() {
        return description;
    }
    
    /**
     * 是否为错误关闭
     *
     * @return 非正常关闭返回true
     */
    public boolean isError() {
        return category != Category.ORDERLY;
    }
}
