/**
 * MQTT连接
 *
 * @author zhenglin
 * @date 2025/08/08
 */
package com.lmqtt.server.connection;

import com.lmqtt.common.protocol.packet.MqttPacket;
import com.lmqtt.common.protocol.packet.connect.MqttConnectPacket;
import com.lmqtt.server.config.MqttServerConfig;
import com.lmqtt.server.error.MqttCloseReason;
import com.lmqtt.server.error.MqttConnectionException;
import com.lmqtt.server.handler.MqttHandlers;
import com.lmqtt.server.message.MqttConnectAck;
import com.lmqtt.server.metrics.MqttMetrics;
import com.lmqtt.server.session.MqttSink;
import com.lmqtt.server.transport.MqttTransport;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.LongSupplier;

/**
 * 单个MQTT连接的协议引擎
 * 
 * 组合握手、保持连接、会话发布通道和分发器：
 * 握手阶段收到的第一个包交给握手状态机，连接处理器未完成前到达的包先缓存并暂停读取，
 * 接受后发送CONNACK、按顺序重放缓存的包再恢复读取。
 * 任何原因的关闭都只执行一次：释放会话、失败所有未确认的发布、关闭传输，
 * 已建立的连接再调用一次断开连接回调
 *
 * @param <S> 会话状态类型
 */
@Slf4j
public class MqttConnection<S> {
    
    /**
     * 连接状态
     */
    public enum State {
        HANDSHAKING,
        ESTABLISHED,
        CLOSED
    }
    
    private final MqttHandlers<S> handlers;
    
    private final MqttServerConfig config;
    
    private final MqttMetrics metrics;
    
    private final MqttTransport delegate;
    
    private final MqttTransport transport;
    
    private final ScheduledExecutorService scheduler;
    
    private final LongSupplier clock;
    
    private final MqttSink sink;
    
    private final MqttHandshake<S> handshake;
    
    private final Object lock = new Object();
    
    /**
     * 连接处理器执行期间到达的包
     */
    private final List<MqttPacket> pendingPackets = new ArrayList<>();
    
    private final AtomicReference<MqttConnectionException> closeCause = new AtomicReference<>();
    
    private final AtomicBoolean disconnectNotified = new AtomicBoolean(false);
    
    private final AtomicBoolean started = new AtomicBoolean(false);
    
    private final CompletableFuture<MqttCloseReason> closeFuture = new CompletableFuture<>();
    
    private volatile MqttDispatcher<S> dispatcher;
    
    private volatile MqttKeepAliveMonitor keepAlive;
    
    private volatile S session;
    
    private volatile String clientId;
    
    private volatile boolean established;
    
    public MqttConnection(MqttHandlers<S> handlers, MqttServerConfig config, MqttMetrics metrics,
                          MqttTransport transport, ScheduledExecutorService scheduler) {
        this(handlers, config, metrics, transport, scheduler, System::currentTimeMillis);
    }
    
    /**
     * 创建连接
     *
     * @param handlers 处理器集合
     * @param config 配置
     * @param metrics 度量
     * @param transport 传输层
     * @param scheduler 握手超时和保持连接使用的调度器
     * @param clock 毫秒时钟
     */
    public MqttConnection(MqttHandlers<S> handlers, MqttServerConfig config, MqttMetrics metrics,
                          MqttTransport transport, ScheduledExecutorService scheduler, LongSupplier clock) {
        this.handlers = handlers;
        this.config = config;
        this.metrics = metrics;
        this.delegate = transport;
        this.transport = new ConnectionTransport();
        this.scheduler = scheduler;
        this.clock = clock;
        this.sink = new MqttSink(this.transport, this::fail);
        this.handshake = new MqttHandshake<>(handlers.connect(), sink, config.getHandshakeTimeoutMillis());
    }
    
    /**
     * 开始握手计时
     */
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        metrics.connectionOpened();
        handshake.result().whenComplete(this::onHandshakeComplete);
        handshake.start(scheduler);
    }
    
    /**
     * 处理一个解码完成的入站数据包，必须按到达顺序调用
     *
     * @param packet 数据包
     */
    public void onPacket(MqttPacket packet) {
        if (closeCause.get() != null) {
            log.debug("连接已关闭，丢弃数据包: {}", packet.getPacketType());
            return;
        }
        MqttKeepAliveMonitor monitor = keepAlive;
        if (monitor != null) {
            monitor.touch();
        }
        
        MqttDispatcher<S> current;
        synchronized (lock) {
            current = dispatcher;
            if (current == null) {
                if (handshake.getState() == MqttHandshake.State.AWAIT_CONNECT) {
                    handshake.onPacket(packet);
                } else {
                    if (pendingPackets.isEmpty()) {
                        // 连接处理器完成前停止读取，缓存只保留已到达的包
                        transport.pauseReading();
                    }
                    pendingPackets.add(packet);
                }
                return;
            }
        }
        current.dispatch(packet);
    }
    
    private void onHandshakeComplete(MqttHandshakeResult<S> result, Throwable error) {
        if (error != null) {
            Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
            if (cause instanceof MqttConnectionException e) {
                fail(e);
            } else if (!(cause instanceof CancellationException)) {
                fail(new MqttConnectionException(MqttCloseReason.HANDLER_ERROR, "handshake failed", cause));
            }
            return;
        }
        
        if (result.ack().isAccepted()) {
            accept(result.connect(), result.ack());
        } else {
            reject(result.connect(), result.ack());
        }
    }
    
    private void accept(MqttConnectPacket connect, MqttConnectAck<S> ack) {
        synchronized (lock) {
            if (closeCause.get() != null) {
                return;
            }
            session = ack.getSession();
            clientId = connect.clientId();
            transport.write(ack.toPacket());
            if (closeCause.get() != null) {
                return;
            }
            
            long keepAliveMillis = ack.getIdleTimeout() != null
                    ? ack.getIdleTimeout().toMillis()
                    : connect.keepAlive() * 1000L;
            if (keepAliveMillis > 0) {
                MqttKeepAliveMonitor monitor = new MqttKeepAliveMonitor(keepAliveMillis, clock,
                        () -> fail(new MqttConnectionException(MqttCloseReason.KEEP_ALIVE_TIMEOUT,
                                "no packet received within " + keepAliveMillis + "ms")));
                keepAlive = monitor;
                monitor.start(scheduler, Math.min(config.getKeepAliveCheckIntervalMillis(), keepAliveMillis));
            }
            
            int inflight = ack.getInflight() > 0 ? ack.getInflight() : config.getInflight();
            MqttDispatcher<S> created = new MqttDispatcher<>(handlers, session, sink, transport, inflight, this::fail);
            dispatcher = created;
            established = true;
            metrics.connectionAccepted();
            log.info("MQTT连接已建立: clientId={}, sessionPresent={}, keepAlive={}ms, inflight={}",
                    clientId, ack.isSessionPresent(), keepAliveMillis, inflight);
            
            if (!pendingPackets.isEmpty()) {
                log.debug("重放握手期间缓存的{}个数据包", pendingPackets.size());
                List<MqttPacket> replay = new ArrayList<>(pendingPackets);
                pendingPackets.clear();
                for (MqttPacket packet : replay) {
                    created.dispatch(packet);
                }
                if (created.getBacklogCount() == 0) {
                    transport.resumeReading();
                }
            }
        }
        
        // 与并发关闭竞争时由这里补做清理
        MqttConnectionException cause = closeCause.get();
        if (cause != null) {
            releaseResources();
            notifyDisconnect(cause.getReason());
        }
    }
    
    private void reject(MqttConnectPacket connect, MqttConnectAck<S> ack) {
        metrics.connectionRejected();
        log.warn("拒绝MQTT连接: clientId={}, returnCode={}", connect.clientId(), ack.getReturnCode());
        transport.write(ack.toPacket()).whenComplete((result, error) ->
                fail(new MqttConnectionException(MqttCloseReason.CONNECT_REJECTED, ack.getReturnCode().name())));
    }
    
    /**
     * 入站数据解码失败
     *
     * @param cause 解码异常
     */
    public void onDecodeError(Throwable cause) {
        fail(new MqttConnectionException(MqttCloseReason.DECODE_ERROR, String.valueOf(cause.getMessage()), cause));
    }
    
    /**
     * 传输层读写失败
     *
     * @param cause 异常
     */
    public void onIoError(Throwable cause) {
        fail(new MqttConnectionException(MqttCloseReason.IO_ERROR, String.valueOf(cause.getMessage()), cause));
    }
    
    /**
     * 传输层被对端关闭
     */
    public void onTransportClosed() {
        fail(new MqttConnectionException(MqttCloseReason.TRANSPORT_CLOSED, "transport closed"));
    }
    
    /**
     * 应用主动关闭连接
     */
    public void close() {
        fail(new MqttConnectionException(MqttCloseReason.APPLICATION_CLOSE, "closed by application"));
    }
    
    /**
     * 以给定原因关闭连接，只有第一次调用生效
     *
     * @param cause 关闭原因
     */
    public void fail(MqttConnectionException cause) {
        if (!closeCause.compareAndSet(null, cause)) {
            return;
        }
        MqttCloseReason reason = cause.getReason();
        if (reason.isError()) {
            log.warn("MQTT连接异常关闭: clientId={}, reason={}, message={}", clientId, reason, cause.getMessage());
        } else {
            log.info("MQTT连接关闭: clientId={}, reason={}", clientId, reason);
        }
        
        handshake.cancel();
        releaseResources();
        sink.closeSession(cause);
        delegate.close();
        if (started.get()) {
            metrics.connectionClosed(reason);
        }
        if (established) {
            notifyDisconnect(reason);
        }
        closeFuture.complete(reason);
    }
    
    private void releaseResources() {
        MqttKeepAliveMonitor monitor = keepAlive;
        if (monitor != null) {
            monitor.stop();
        }
        MqttDispatcher<S> current = dispatcher;
        if (current != null) {
            current.close();
        }
    }
    
    private void notifyDisconnect(MqttCloseReason reason) {
        if (!disconnectNotified.compareAndSet(false, true)) {
            return;
        }
        try {
            handlers.disconnect().onDisconnect(session, reason.isError());
        } catch (RuntimeException e) {
            log.error("断开连接回调失败: clientId={}", clientId, e);
        }
    }
    
    public State getState() {
        if (closeCause.get() != null) {
            return State.CLOSED;
        }
        return established ? State.ESTABLISHED : State.HANDSHAKING;
    }
    
    public boolean isOpen() {
        return closeCause.get() == null;
    }
    
    /**
     * 获取关闭原因
     *
     * @return 关闭原因，未关闭返回null
     */
    public MqttCloseReason getCloseReason() {
        MqttConnectionException cause = closeCause.get();
        return cause == null ? null : cause.getReason();
    }
    
    /**
     * 连接关闭时以关闭原因完成
     *
     * @return 关闭future
     */
    public CompletableFuture<MqttCloseReason> getCloseFuture() {
        return closeFuture;
    }
    
    public MqttSink getSink() {
        return sink;
    }
    
    public S getSession() {
        return session;
    }
    
    public String getClientId() {
        return clientId;
    }
    
    public MqttHandshake.State getHandshakeState() {
        return handshake.getState();
    }
    
    /**
     * 写失败时以IO_ERROR关闭连接的传输包装
     */
    private final class ConnectionTransport implements MqttTransport {
        
        @Override
        public CompletableFuture<Void> write(MqttPacket packet) {
            CompletableFuture<Void> future = delegate.write(packet);
            future.whenComplete((result, error) -> {
                if (error != null) {
                    onIoError(error);
                }
            });
            return future;
        }
        
        @Override
        public void pauseReading() {
            delegate.pauseReading();
        }
        
        @Override
        public void resumeReading() {
            delegate.resumeReading();
        }
        
        @Override
        public void close() {
            delegate.close();
        }
        
        @Override
        public boolean isOpen() {
            return delegate.isOpen();
        }
    }
}
