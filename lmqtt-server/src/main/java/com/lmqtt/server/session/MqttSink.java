/**
 * MQTT会话发布通道
 *
 * @author zhenglin
 * @date 2025/08/08
 */
package com.lmqtt.server.session;

import com.lmqtt.common.protocol.MqttQos;
import com.lmqtt.common.protocol.packet.MqttPacketWithId;
import com.lmqtt.common.protocol.packet.publish.MqttPublishPacket;
import com.lmqtt.server.error.MqttCloseReason;
import com.lmqtt.server.error.MqttConnectionException;
import com.lmqtt.server.transport.MqttTransport;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * 每个连接一个的出站发布通道
 * 
 * 维护等待PUBACK的QoS 1发布队列，严格按发出顺序确认：
 * 收到的PUBACK必须对应队首的包标识符，否则会话失效并关闭连接。
 * 包标识符按连接递增分配，回绕时跳过0
 */
@Slf4j
public class MqttSink {
    
    /**
     * 等待确认的发布
     */
    private record PendingPublish(int packetId, CompletableFuture<Void> completion) {
    }
    
    private final MqttTransport transport;
    
    /**
     * 会话失效时调用，关闭所属连接
     */
    private final Consumer<MqttConnectionException> closeHandler;
    
    private final Object lock = new Object();
    
    private final Deque<PendingPublish> pending = new ArrayDeque<>();
    
    private int lastPacketId;
    
    private MqttConnectionException closeCause;
    
    /**
     * 创建发布通道
     *
     * @param transport 传输层
     * @param closeHandler 需要关闭连接时的回调
     */
    public MqttSink(MqttTransport transport, Consumer<MqttConnectionException> closeHandler) {
        this.transport = transport;
        this.closeHandler = closeHandler;
    }
    
    /**
     * 以QoS 0发布消息，不等待确认
     *
     * @param topic 主题
     * @param payload 负载
     * @param dup 重复标志
     */
    public void publishAtMostOnce(String topic, byte[] payload, boolean dup) {
        synchronized (lock) {
            if (closeCause != null) {
                log.debug("会话已关闭，丢弃QoS 0消息: topic={}", topic);
                return;
            }
            transport.write(new MqttPublishPacket(dup, false, MqttQos.AT_MOST_ONCE, topic, 0, payload));
        }
    }
    
    /**
     * 以QoS 1发布消息
     *
     * @param topic 主题
     * @param payload 负载
     * @param dup 重复标志
     * @return 收到对应PUBACK时完成，连接关闭时以MqttConnectionException失败
     */
    public CompletableFuture<Void> publishAtLeastOnce(String topic, byte[] payload, boolean dup) {
        CompletableFuture<Void> completion = new CompletableFuture<>();
        synchronized (lock) {
            if (closeCause != null) {
                completion.completeExceptionally(closeCause);
                return completion;
            }
            int packetId = nextPacketId();
            MqttPublishPacket packet = new MqttPublishPacket(dup, false, MqttQos.AT_LEAST_ONCE, topic, packetId, payload);
            pending.addLast(new PendingPublish(packetId, completion));
            transport.write(packet);
            log.debug("发送QoS 1消息: topic={}, packetId={}, 待确认数={}", topic, packetId, pending.size());
        }
        return completion;
    }
    
    /**
     * 处理收到的PUBACK
     *
     * @param packetId 确认的包标识符
     */
    public void completePublishAtLeastOnce(int packetId) {
        PendingPublish head;
        synchronized (lock) {
            if (closeCause != null) {
                return;
            }
            head = pending.pollFirst();
        }
        
        if (head == null) {
            closeHandler.accept(new MqttConnectionException(MqttCloseReason.PROTOCOL_VIOLATION,
                    "unexpected PUBACK " + packetId + " with no pending publish"));
            return;
        }
        if (head.packetId() != packetId) {
            MqttConnectionException e = new MqttConnectionException(MqttCloseReason.PROTOCOL_VIOLATION,
                    "PUBACK " + packetId + " does not match pending publish " + head.packetId());
            head.completion().completeExceptionally(e);
            closeHandler.accept(e);
            return;
        }
        head.completion().complete(null);
    }
    
    /**
     * 应用主动关闭连接
     */
    public void close() {
        closeHandler.accept(new MqttConnectionException(MqttCloseReason.APPLICATION_CLOSE, "sink closed"));
    }
    
    /**
     * 释放会话状态，所有未确认的发布以关闭原因失败
     *
     * @param cause 关闭原因
     */
    public void closeSession(MqttConnectionException cause) {
        List<PendingPublish> failed;
        synchronized (lock) {
            if (closeCause != null) {
                return;
            }
            closeCause = cause;
            failed = new ArrayList<>(pending);
            pending.clear();
        }
        
        if (!failed.isEmpty()) {
            log.debug("会话关闭，{}个未确认的发布失败: {}", failed.size(), cause.getReason());
        }
        for (PendingPublish publish : failed) {
            publish.completion().completeExceptionally(cause);
        }
    }
    
    /**
     * 会话是否仍然有效
     *
     * @return 如果未关闭返回true
     */
    public boolean isOpen() {
        synchronized (lock) {
            return closeCause == null;
        }
    }
    
    /**
     * 获取等待确认的发布数
     *
     * @return 待确认数
     */
    public int getPendingCount() {
        synchronized (lock) {
            return pending.size();
        }
    }
    
    /**
     * 分配下一个包标识符，回绕时跳过0
     */
    private int nextPacketId() {
        lastPacketId = (lastPacketId + 1) & MqttPacketWithId.MAX_PACKET_ID;
        if (lastPacketId == 0) {
            lastPacketId = MqttPacketWithId.MIN_PACKET_ID;
        }
        return lastPacketId;
    }
    
    /**
     * 设置上一次分配的包标识符，仅用于测试回绕
     */
    void setLastPacketId(int lastPacketId) {
        synchronized (lock) {
            this.lastPacketId = lastPacketId;
        }
    }
}
