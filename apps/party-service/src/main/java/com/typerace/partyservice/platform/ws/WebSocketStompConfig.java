package com.typerace.partyservice.platform.ws;

import com.typerace.partyservice.config.TypingProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.messaging.simp.config.MessageBrokerRegistry;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.web.socket.config.annotation.EnableWebSocketMessageBroker;
import org.springframework.web.socket.config.annotation.StompEndpointRegistry;
import org.springframework.web.socket.config.annotation.WebSocketMessageBrokerConfigurer;

/**
 * WebSocket + STOMP 配置类
 * ----------------------------------------
 * 本类启用 Spring 的内存消息代理（Simple Broker），
 * 允许客户端通过 /ws 端点连接 WebSocket，
 * 并使用 /app 前缀发送消息、/topic 前缀订阅房间广播、/user/queue 接收单播。
 *
 * 用途：
 *   - /app/... : 客户端发送（如 /app/join-room、/app/message）
 *   - /topic/room.{roomId} : 房间广播（game-update）
 *   - /user/queue/res_conn、/user/queue/join-room-success : 单播应答
 */
@Configuration
@EnableWebSocketMessageBroker
public class WebSocketStompConfig implements WebSocketMessageBrokerConfigurer {

    private final TypingProperties properties;

    public WebSocketStompConfig(TypingProperties properties) {
        this.properties = properties;
    }

    /**
     * 配置 TaskScheduler 用于 WebSocket 心跳。
     * 当使用 setHeartbeatValue() 时，必须提供 TaskScheduler。
     * 注意：使用不同的 bean 名称避免与 Spring 自动配置冲突。
     */
    @Bean(name = "wsHeartbeatTaskScheduler")
    public TaskScheduler wsHeartbeatTaskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("ws-heartbeat-");
        scheduler.setDaemon(true);
        scheduler.initialize();
        return scheduler;
    }

    /**
     * 注册 WebSocket STOMP 端点
     * ----------------------------------------
     * 前端连接地址：
     *   ws://localhost:8080/ws
     *   或 SockJS 备用: http://localhost:8080/ws
     */
    @Override
    public void registerStompEndpoints(StompEndpointRegistry registry) {
        String[] origins = properties.getWs().getAllowedOriginPatterns().toArray(new String[0]);
        registry.addEndpoint("/ws")
                .setAllowedOriginPatterns(origins);
        registry.addEndpoint("/ws")
                .setAllowedOriginPatterns(origins)
                .withSockJS(); //启用 SockJS 兼容层，让旧浏览器也能用
    }

    /**
     * 配置消息代理（Broker）消息路由规则
     * ----------------------------------------
     *   - enableSimpleBroker(): 内存消息代理，用于广播订阅
     *   - setApplicationDestinationPrefixes(): 客户端发消息的前缀
     *   - setUserDestinationPrefix(): 单播前缀（按 sessionId 路由，匿名连接同样可用）
     *   - setHeartbeatValue(): 心跳间隔 [客户端发送间隔, 服务端发送间隔]（毫秒）
     */
    @Override
    public void configureMessageBroker(MessageBrokerRegistry registry) {
        registry.enableSimpleBroker("/topic", "/queue")
                .setHeartbeatValue(new long[]{5000, 5000})
                .setTaskScheduler(wsHeartbeatTaskScheduler());
        registry.setApplicationDestinationPrefixes("/app");
        registry.setUserDestinationPrefix("/user");
    }
}
