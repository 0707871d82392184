/**
 * Netty MQTT服务器
 *
 * @author zhenglin
 * @date 2025/08/09
 */
package com.lmqtt.server.netty;

import com.lmqtt.server.MqttServer;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.util.concurrent.DefaultThreadFactory;
import lombok.extern.slf4j.Slf4j;

import java.net.InetSocketAddress;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 接受TCP连接的Netty服务器，每个连接交给MqttServer创建的协议引擎
 */
@Slf4j
public class NettyMqttServer {
    
    private final MqttServer<?> server;
    
    private final int ioThreads;
    
    private EventLoopGroup bossGroup;
    
    private EventLoopGroup workerGroup;
    
    private Channel serverChannel;
    
    private final AtomicBoolean running = new AtomicBoolean(false);
    
    public NettyMqttServer(MqttServer<?> server) {
        this(server, 0);
    }
    
    /**
     * 创建服务器
     *
     * @param server 协议引擎
     * @param ioThreads IO线程数，0表示使用Netty默认值
     */
    public NettyMqttServer(MqttServer<?> server, int ioThreads) {
        this.server = server;
        this.ioThreads = ioThreads;
    }
    
    /**
     * 绑定端口并开始接受连接
     *
     * @param port 端口，0表示随机端口
     * @throws InterruptedException 如果绑定时被中断
     */
    public void start(int port) throws InterruptedException {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        
        log.info("正在启动MQTT服务器...");
        bossGroup = new NioEventLoopGroup(1, new DefaultThreadFactory("mqtt-boss"));
        workerGroup = new NioEventLoopGroup(ioThreads, new DefaultThreadFactory("mqtt-worker"));
        
        try {
            ServerBootstrap bootstrap = new ServerBootstrap()
                    .group(bossGroup, workerGroup)
                    .channel(NioServerSocketChannel.class)
                    .childHandler(server.channelInitializer())
                    .option(ChannelOption.SO_REUSEADDR, true)
                    .childOption(ChannelOption.TCP_NODELAY, true)
                    .childOption(ChannelOption.SO_KEEPALIVE, true);
            
            ChannelFuture future = bootstrap.bind(port).sync();
            serverChannel = future.channel();
            log.info("MQTT服务器已绑定到端口: {}", getPort());
        } catch (InterruptedException | RuntimeException e) {
            log.error("启动MQTT服务器失败", e);
            shutdownGroups();
            running.set(false);
            throw e;
        }
    }
    
    /**
     * 停止接受连接并优雅关闭线程池
     */
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        
        log.info("正在关闭MQTT服务器...");
        if (serverChannel != null) {
            serverChannel.close().syncUninterruptibly();
            serverChannel = null;
        }
        shutdownGroups();
        log.info("MQTT服务器已关闭");
    }
    
    private void shutdownGroups() {
        if (bossGroup != null) {
            bossGroup.shutdownGracefully().syncUninterruptibly();
            bossGroup = null;
        }
        if (workerGroup != null) {
            workerGroup.shutdownGracefully().syncUninterruptibly();
            workerGroup = null;
        }
    }
    
    /**
     * 获取实际绑定的端口
     *
     * @return 端口，未启动返回-1
     */
    public int getPort() {
        Channel channel = serverChannel;
        if (channel == null || !(channel.localAddress() instanceof InetSocketAddress address)) {
            return -1;
        }
        return address.getPort();
    }
    
    public boolean isRunning() {
        return running.get();
    }
}
