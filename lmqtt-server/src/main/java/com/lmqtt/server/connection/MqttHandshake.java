/**
 * MQTT连接握手
 *
 * @author zhenglin
 * @date 2025/08/08
 */
package com.lmqtt.server.connection;

import com.lmqtt.common.protocol.packet.MqttPacket;
import com.lmqtt.common.protocol.packet.connect.MqttConnectPacket;
import com.lmqtt.server.error.MqttCloseReason;
import com.lmqtt.server.error.MqttConnectionException;
import com.lmqtt.server.handler.ConnectHandler;
import com.lmqtt.server.message.MqttConnect;
import com.lmqtt.server.message.MqttConnectAck;
import com.lmqtt.server.session.MqttSink;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * 有时限的握手状态机
 * 
 * AWAIT_CONNECT --CONNECT--> CONNECTING --处理器完成--> ACCEPTED / REJECTED
 * 
 * 第一个包不是CONNECT时以PROTOCOL_VIOLATION失败，
 * 超时（未收到CONNECT或处理器未完成）时以HANDSHAKE_TIMEOUT失败
 *
 * @param <S> 会话状态类型
 */
@Slf4j
public class MqttHandshake<S> {
    
    /**
     * 握手状态
     */
    public enum State {
        AWAIT_CONNECT,
        CONNECTING,
        ACCEPTED,
        REJECTED,
        FAILED
    }
    
    private final ConnectHandler<S> connectHandler;
    
    private final MqttSink sink;
    
    private final long timeoutMillis;
    
    private final CompletableFuture<MqttHandshakeResult<S>> result = new CompletableFuture<>();
    
    private State state = State.AWAIT_CONNECT;
    
    private ScheduledFuture<?> timeoutTask;
    
    private CompletableFuture<MqttConnectAck<S>> handlerFuture;
    
    /**
     * 创建握手状态机
     *
     * @param connectHandler 连接处理器
     * @param sink 连接的发布通道，通过CONNECT视图交给处理器
     * @param timeoutMillis 超时（毫秒），0表示不限制
     */
    public MqttHandshake(ConnectHandler<S> connectHandler, MqttSink sink, long timeoutMillis) {
        this.connectHandler = connectHandler;
        this.sink = sink;
        this.timeoutMillis = timeoutMillis;
    }
    
    /**
     * 启动超时计时
     *
     * @param scheduler 调度器
     */
    public synchronized void start(ScheduledExecutorService scheduler) {
        if (timeoutMillis > 0 && state == State.AWAIT_CONNECT && timeoutTask == null) {
            timeoutTask = scheduler.schedule(this::onTimeout, timeoutMillis, TimeUnit.MILLISECONDS);
        }
    }
    
    /**
     * 处理握手阶段收到的第一个包
     *
     * @param packet 数据包
     */
    public void onPacket(MqttPacket packet) {
        MqttConnectPacket connect;
        MqttConnectionException failure = null;
        synchronized (this) {
            if (state == State.FAILED) {
                // 超时或取消与入站包并发时，结果已经异常完成
                log.debug("握手已失败，丢弃数据包: {}", packet.getPacketType());
                return;
            }
            if (state != State.AWAIT_CONNECT) {
                throw new IllegalStateException("Handshake already received a packet, state=" + state);
            }
            if (packet instanceof MqttConnectPacket connectPacket) {
                connect = connectPacket;
                state = State.CONNECTING;
            } else {
                connect = null;
                failure = fail(new MqttConnectionException(MqttCloseReason.PROTOCOL_VIOLATION,
                        "expected CONNECT, received " + packet.getPacketType()));
            }
        }
        if (failure != null) {
            result.completeExceptionally(failure);
            return;
        }
        
        log.debug("收到CONNECT: {}", connect);
        CompletableFuture<MqttConnectAck<S>> future;
        try {
            future = connectHandler.handle(new MqttConnect(connect, sink));
        } catch (RuntimeException e) {
            future = CompletableFuture.failedFuture(e);
        }
        if (future == null) {
            future = CompletableFuture.failedFuture(new NullPointerException("Connect handler returned null"));
        }
        
        synchronized (this) {
            handlerFuture = future;
        }
        future.whenComplete((ack, error) -> onHandlerComplete(connect, ack, error));
    }
    
    private void onHandlerComplete(MqttConnectPacket connect, MqttConnectAck<S> ack, Throwable error) {
        MqttConnectionException failure = null;
        synchronized (this) {
            if (state != State.CONNECTING) {
                return;
            }
            if (error != null) {
                failure = fail(new MqttConnectionException(MqttCloseReason.HANDLER_ERROR,
                        "connect handler failed", unwrap(error)));
            } else if (ack == null) {
                failure = fail(new MqttConnectionException(MqttCloseReason.HANDLER_ERROR,
                        "connect handler returned no result"));
            } else {
                state = ack.isAccepted() ? State.ACCEPTED : State.REJECTED;
                cancelTimeout();
            }
        }
        if (failure != null) {
            result.completeExceptionally(failure);
        } else {
            result.complete(new MqttHandshakeResult<>(connect, ack));
        }
    }
    
    private void onTimeout() {
        MqttConnectionException failure;
        synchronized (this) {
            if (state != State.AWAIT_CONNECT && state != State.CONNECTING) {
                return;
            }
            log.debug("握手超时: {}ms, state={}", timeoutMillis, state);
            failure = fail(new MqttConnectionException(MqttCloseReason.HANDSHAKE_TIMEOUT,
                    "no CONNECT accepted within " + timeoutMillis + "ms"));
        }
        result.completeExceptionally(failure);
    }
    
    /**
     * 取消握手，连接关闭时调用
     */
    public void cancel() {
        synchronized (this) {
            if (state != State.AWAIT_CONNECT && state != State.CONNECTING) {
                return;
            }
            state = State.FAILED;
            cancelTimeout();
            if (handlerFuture != null) {
                handlerFuture.cancel(false);
            }
        }
        result.cancel(false);
    }
    
    /**
     * 必须在持有锁时调用，结果在锁外完成
     */
    private MqttConnectionException fail(MqttConnectionException e) {
        state = State.FAILED;
        cancelTimeout();
        if (handlerFuture != null) {
            handlerFuture.cancel(false);
        }
        return e;
    }
    
    private void cancelTimeout() {
        if (timeoutTask != null) {
            timeoutTask.cancel(false);
            timeoutTask = null;
        }
    }
    
    private static Throwable unwrap(Throwable error) {
        if (error instanceof CompletionException && error.getCause() != null) {
            return error.getCause();
        }
        return error;
    }
    
    /**
     * 握手结果，接受或拒绝时正常完成，失败时以MqttConnectionException异常完成
     *
     * @return 握手结果
     */
    public CompletableFuture<MqttHandshakeResult<S>> result() {
        return result;
    }
    
    public synchronized State getState() {
        return state;
    }
}
