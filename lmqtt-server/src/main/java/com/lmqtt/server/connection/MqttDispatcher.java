/**
 * MQTT数据包分发器
 *
 * @author zhenglin
 * @date 2025/08/08
 */
package com.lmqtt.server.connection;

import com.lmqtt.common.protocol.packet.MqttPacket;
import com.lmqtt.common.protocol.packet.connect.MqttConnectPacket;
import com.lmqtt.common.protocol.packet.disconnect.MqttDisconnectPacket;
import com.lmqtt.common.protocol.packet.ping.MqttPingreqPacket;
import com.lmqtt.common.protocol.packet.ping.MqttPingrespPacket;
import com.lmqtt.common.protocol.packet.puback.MqttPubackPacket;
import com.lmqtt.common.protocol.packet.publish.MqttPublishPacket;
import com.lmqtt.common.protocol.packet.subscribe.MqttSubscribePacket;
import com.lmqtt.common.protocol.packet.unsuback.MqttUnsubackPacket;
import com.lmqtt.common.protocol.packet.unsubscribe.MqttUnsubscribePacket;
import com.lmqtt.server.error.MqttCloseReason;
import com.lmqtt.server.error.MqttConnectionException;
import com.lmqtt.server.handler.MqttHandlers;
import com.lmqtt.server.message.MqttPublish;
import com.lmqtt.server.message.MqttSubscribe;
import com.lmqtt.server.message.MqttUnsubscribe;
import com.lmqtt.server.session.MqttSink;
import com.lmqtt.server.transport.MqttTransport;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * 握手完成后的数据包分发器
 * 
 * PUBLISH按到达顺序占用一个响应槽位，处理器可以乱序完成，
 * 但PUBACK只从队首连续已完成的槽位依次发出，保证确认顺序与发布顺序一致。
 * 未发出确认的槽位数达到在途上限时，新的PUBLISH进入积压队列，
 * 等前面的确认发出后再交给处理器。积压队列非空期间暂停读取传输，
 * 积压只包含暂停生效前已经读入的包
 *
 * @param <S> 会话状态类型
 */
@Slf4j
public class MqttDispatcher<S> {
    
    /**
     * 一个已交给处理器的PUBLISH
     */
    private static final class PublishSlot {
        
        private final MqttPublishPacket packet;
        
        private CompletableFuture<Void> future;
        
        private boolean done;
        
        private PublishSlot(MqttPublishPacket packet) {
            this.packet = packet;
        }
    }
    
    private final MqttHandlers<S> handlers;
    
    private final S session;
    
    private final MqttSink sink;
    
    private final MqttTransport transport;
    
    private final int inflight;
    
    private final Consumer<MqttConnectionException> closeHandler;
    
    private final Deque<PublishSlot> responseQueue = new ArrayDeque<>();
    
    private final Deque<MqttPublishPacket> backlog = new ArrayDeque<>();
    
    private final List<CompletableFuture<Void>> pendingRequests = new ArrayList<>();
    
    private boolean closed;
    
    private boolean readingPaused;
    
    /**
     * 创建分发器
     *
     * @param handlers 处理器集合
     * @param session 连接处理器返回的会话状态
     * @param sink 会话发布通道
     * @param transport 传输层
     * @param inflight 在途上限
     * @param closeHandler 需要关闭连接时的回调
     */
    public MqttDispatcher(MqttHandlers<S> handlers, S session, MqttSink sink, MqttTransport transport,
                          int inflight, Consumer<MqttConnectionException> closeHandler) {
        if (inflight < 1) {
            throw new IllegalArgumentException("Inflight must be positive: " + inflight);
        }
        this.handlers = handlers;
        this.session = session;
        this.sink = sink;
        this.transport = transport;
        this.inflight = inflight;
        this.closeHandler = closeHandler;
    }
    
    /**
     * 分发一个入站数据包
     *
     * @param packet 数据包
     */
    public void dispatch(MqttPacket packet) {
        if (isClosed()) {
            log.debug("分发器已关闭，丢弃数据包: {}", packet.getPacketType());
            return;
        }
        
        if (packet instanceof MqttPublishPacket publish) {
            onPublish(publish);
        } else if (packet instanceof MqttPubackPacket puback) {
            sink.completePublishAtLeastOnce(puback.packetId());
        } else if (packet instanceof MqttPingreqPacket) {
            transport.write(MqttPingrespPacket.INSTANCE);
        } else if (packet instanceof MqttSubscribePacket subscribe) {
            onSubscribe(subscribe);
        } else if (packet instanceof MqttUnsubscribePacket unsubscribe) {
            onUnsubscribe(unsubscribe);
        } else if (packet instanceof MqttDisconnectPacket) {
            closeHandler.accept(new MqttConnectionException(MqttCloseReason.PEER_DISCONNECT, "DISCONNECT received"));
        } else if (packet instanceof MqttConnectPacket) {
            closeHandler.accept(new MqttConnectionException(MqttCloseReason.PROTOCOL_VIOLATION,
                    "second CONNECT on an established connection"));
        } else {
            // QoS 2流程和服务端发出的包类型不处理
            log.debug("忽略数据包: {}", packet.getPacketType());
        }
    }
    
    private void onPublish(MqttPublishPacket packet) {
        PublishSlot slot;
        synchronized (this) {
            if (closed) {
                return;
            }
            if (responseQueue.size() >= inflight) {
                backlog.addLast(packet);
                if (!readingPaused) {
                    readingPaused = true;
                    transport.pauseReading();
                }
                log.debug("在途发布已达上限{}，排队等待: topic={}, 积压数={}", inflight, packet.topic(), backlog.size());
                return;
            }
            slot = admit(packet);
        }
        invoke(slot);
    }
    
    /**
     * 必须在持有锁时调用
     */
    private PublishSlot admit(MqttPublishPacket packet) {
        PublishSlot slot = new PublishSlot(packet);
        responseQueue.addLast(slot);
        return slot;
    }
    
    private void invoke(PublishSlot slot) {
        CompletableFuture<Void> future = call(() -> handlers.publish().handle(new MqttPublish<>(slot.packet, session, sink)));
        synchronized (this) {
            if (closed) {
                future.cancel(false);
                return;
            }
            slot.future = future;
        }
        future.whenComplete((result, error) -> onPublishComplete(slot, error));
    }
    
    private void onPublishComplete(PublishSlot slot, Throwable error) {
        if (error != null) {
            handlerFailed("publish", error);
            return;
        }
        
        List<PublishSlot> admitted = new ArrayList<>();
        synchronized (this) {
            if (closed) {
                return;
            }
            slot.done = true;
            while (!responseQueue.isEmpty() && responseQueue.peekFirst().done) {
                PublishSlot head = responseQueue.pollFirst();
                if (head.packet.hasPacketId()) {
                    transport.write(new MqttPubackPacket(head.packet.packetId()));
                }
            }
            while (responseQueue.size() < inflight && !backlog.isEmpty()) {
                admitted.add(admit(backlog.pollFirst()));
            }
            if (readingPaused && backlog.isEmpty()) {
                readingPaused = false;
                transport.resumeReading();
            }
        }
        admitted.forEach(this::invoke);
    }
    
    private void onSubscribe(MqttSubscribePacket packet) {
        MqttSubscribe<S> subscribe = new MqttSubscribe<>(packet, session);
        CompletableFuture<Void> future = call(() -> handlers.subscribe().handle(subscribe));
        if (!track(future)) {
            return;
        }
        future.whenComplete((result, error) -> {
            untrack(future);
            if (error != null) {
                handlerFailed("subscribe", error);
            } else {
                writeIfOpen(subscribe.toAck());
            }
        });
    }
    
    private void onUnsubscribe(MqttUnsubscribePacket packet) {
        MqttUnsubscribe<S> unsubscribe = new MqttUnsubscribe<>(packet, session);
        CompletableFuture<Void> future = call(() -> handlers.unsubscribe().handle(unsubscribe));
        if (!track(future)) {
            return;
        }
        future.whenComplete((result, error) -> {
            untrack(future);
            if (error != null) {
                handlerFailed("unsubscribe", error);
            } else {
                writeIfOpen(new MqttUnsubackPacket(packet.packetId()));
            }
        });
    }
    
    private synchronized boolean track(CompletableFuture<Void> future) {
        if (closed) {
            future.cancel(false);
            return false;
        }
        pendingRequests.add(future);
        return true;
    }
    
    private synchronized void untrack(CompletableFuture<Void> future) {
        pendingRequests.remove(future);
    }
    
    private synchronized void writeIfOpen(MqttPacket packet) {
        if (!closed) {
            transport.write(packet);
        }
    }
    
    private void handlerFailed(String kind, Throwable error) {
        if (isClosed()) {
            return;
        }
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        log.warn("{}处理器失败: {}", kind, cause.getMessage());
        closeHandler.accept(new MqttConnectionException(MqttCloseReason.HANDLER_ERROR, kind + " handler failed", cause));
    }
    
    /**
     * 调用处理器，同步抛出的异常和null结果都转换为失败的future
     */
    private static CompletableFuture<Void> call(Supplier<CompletableFuture<Void>> invocation) {
        CompletableFuture<Void> future;
        try {
            future = invocation.get();
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
        if (future == null) {
            return CompletableFuture.failedFuture(new NullPointerException("Handler returned null"));
        }
        return future;
    }
    
    /**
     * 关闭分发器，丢弃积压的PUBLISH并取消未完成的处理器调用
     */
    public void close() {
        List<CompletableFuture<Void>> cancelled = new ArrayList<>();
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
            if (!backlog.isEmpty()) {
                log.debug("分发器关闭，丢弃{}个积压的PUBLISH", backlog.size());
            }
            backlog.clear();
            for (PublishSlot slot : responseQueue) {
                if (slot.future != null) {
                    cancelled.add(slot.future);
                }
            }
            responseQueue.clear();
            cancelled.addAll(pendingRequests);
            pendingRequests.clear();
        }
        cancelled.forEach(future -> future.cancel(false));
    }
    
    public synchronized boolean isClosed() {
        return closed;
    }
    
    /**
     * 获取已交给处理器但尚未发出确认的PUBLISH数
     *
     * @return 在途数
     */
    public synchronized int getInflightCount() {
        return responseQueue.size();
    }
    
    /**
     * 是否因积压暂停了读取
     *
     * @return 如果已暂停返回true
     */
    public synchronized boolean isReadingPaused() {
        return readingPaused;
    }
    
    /**
     * 获取等待进入处理器的PUBLISH数
     *
     * @return 积压数
     */
    public synchronized int getBacklogCount() {
        return backlog.size();
    }
}
