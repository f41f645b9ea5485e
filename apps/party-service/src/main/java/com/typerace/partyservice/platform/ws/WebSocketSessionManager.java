package com.typerace.partyservice.platform.ws;

import com.typerace.partyservice.games.typing.domain.constants.PartyEvents;
import com.typerace.partyservice.games.typing.service.PartyService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.messaging.simp.stomp.StompHeaderAccessor;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.messaging.SessionConnectEvent;
import org.springframework.web.socket.messaging.SessionDisconnectEvent;
import org.springframework.web.socket.messaging.SessionSubscribeEvent;

/**
 * 监听 STOMP 连接/订阅/断开事件，驱动连接注册表与房间离开。
 *
 * 连接的身份即 STOMP sessionId（不做认证）。
 */
@Slf4j
@Component
public class WebSocketSessionManager {

    /** 客户端订阅该地址后下发 res_conn（订阅前发送的单播会丢失） */
    static final String RES_CONN_SUBSCRIPTION = "/user" + PartyEvents.userQueue(PartyEvents.RES_CONN);

    private final PartyService partyService;

    public WebSocketSessionManager(PartyService partyService) {
        this.partyService = partyService;
    }

    /**
     * 连接建立后登记默认玩家。
     */
    @EventListener
    public void handleSessionConnect(SessionConnectEvent event) {
        String sessionId = StompHeaderAccessor.wrap(event.getMessage()).getSessionId();
        if (sessionId == null) {
            log.warn("SessionConnectEvent 缺少 sessionId");
            return;
        }
        partyService.connect(sessionId);
        log.info("WebSocket 连接 {} 注册完成", sessionId);
    }

    /**
     * 订阅 res_conn 队列时下发初始状态。
     */
    @EventListener
    public void handleSessionSubscribe(SessionSubscribeEvent event) {
        StompHeaderAccessor accessor = StompHeaderAccessor.wrap(event.getMessage());
        if (RES_CONN_SUBSCRIPTION.equals(accessor.getDestination()) && accessor.getSessionId() != null) {
            partyService.acknowledge(accessor.getSessionId());
        }
    }

    /**
     * 连接断开时离开房间并注销登记。
     *
     * 基于底层连接关闭检测，正常关闭、强制关闭浏览器、网络中断都会触发，
     * 同一个 sessionId 可能收到多次，重复处理是无害的。
     */
    @EventListener
    public void handleSessionDisconnect(SessionDisconnectEvent event) {
        String sessionId = event.getSessionId();
        if (sessionId == null) {
            log.warn("【WebSocket断开检测】收到 SessionDisconnectEvent 但缺少 sessionId");
            return;
        }
        try {
            partyService.disconnect(sessionId);
            log.info("【WebSocket断开检测】连接已清理: sessionId={}, status={}", sessionId, event.getCloseStatus());
        } catch (Exception e) {
            log.warn("【WebSocket断开检测】清理连接失败: sessionId={}", sessionId, e);
        }
    }
}
