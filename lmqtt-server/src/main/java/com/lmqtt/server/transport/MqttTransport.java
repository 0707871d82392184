/**
 * MQTT传输层接口
 *
 * @author zhenglin
 * @date 2025/08/08
 */
package com.lmqtt.server.transport;

import com.lmqtt.common.protocol.packet.MqttPacket;

import java.util.concurrent.CompletableFuture;

/**
 * 协议引擎依赖的双工传输抽象
 * 
 * 入站数据包由传输实现推送给MqttConnection，引擎只通过本接口写出和关闭
 */
public interface MqttTransport {
    
    /**
     * 写出一个完整的数据包
     *
     * @param packet 数据包
     * @return 写出完成时完成，失败时异常完成
     */
    CompletableFuture<Void> write(MqttPacket packet);
    
    /**
     * 暂停读取入站数据，积压达到上限时调用，重复调用无副作用
     */
    void pauseReading();
    
    /**
     * 恢复读取入站数据
     */
    void resumeReading();
    
    /**
     * 关闭传输
     */
    void close();
    
    /**
     * 传输是否仍然可用
     *
     * @return 如果可用返回true
     */
    boolean isOpen();
}
