/**
 * 记录写出数据包的测试传输
 *
 * @author zhenglin
 * @date 2025/08/14
 */
package com.lmqtt.server.transport;

import com.lmqtt.common.protocol.packet.MqttPacket;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

/**
 * 按写出顺序记录数据包，可以设置写失败
 */
public class RecordingTransport implements MqttTransport {
    
    private final List<MqttPacket> written = new ArrayList<>();
    
    private volatile boolean open = true;
    
    private volatile boolean failWrites;
    
    private volatile int closeCount;
    
    private volatile boolean readingPaused;
    
    private volatile int pauseCount;
    
    @Override
    public synchronized CompletableFuture<Void> write(MqttPacket packet) {
        if (failWrites) {
            return CompletableFuture.failedFuture(new IOException("broken pipe"));
        }
        written.add(packet);
        return CompletableFuture.completedFuture(null);
    }
    
    @Override
    public synchronized void pauseReading() {
        readingPaused = true;
        pauseCount++;
    }
    
    @Override
    public synchronized void resumeReading() {
        readingPaused = false;
    }
    
    @Override
    public synchronized void close() {
        open = false;
        closeCount++;
    }
    
    @Override
    public boolean isOpen() {
        return open;
    }
    
    public synchronized List<MqttPacket> written() {
        return new ArrayList<>(written);
    }
    
    public synchronized <T extends MqttPacket> List<T> written(Class<T> type) {
        return written.stream().filter(type::isInstance).map(type::cast).collect(Collectors.toList());
    }
    
    public synchronized MqttPacket last() {
        return written.isEmpty() ? null : written.get(written.size() - 1);
    }
    
    public synchronized void clear() {
        written.clear();
    }
    
    public void setFailWrites(boolean failWrites) {
        this.failWrites = failWrites;
    }
    
    public int getCloseCount() {
        return closeCount;
    }
    
    public boolean isReadingPaused() {
        return readingPaused;
    }
    
    public int getPauseCount() {
        return pauseCount;
    }
}
