package com.typerace.partyservice.games.typing.interfaces.ws;

import com.fasterxml.jackson.databind.JsonNode;
import com.typerace.partyservice.games.typing.domain.constants.PartyEvents;
import com.typerace.partyservice.games.typing.service.PartyService;
import com.typerace.partyservice.platform.transport.InboundMessage;
import com.typerace.partyservice.platform.transport.InboundMessageParser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.messaging.handler.annotation.MessageExceptionHandler;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.stereotype.Controller;

import java.util.Optional;

/**
 * 打字房间 WebSocket 控制器
 * ----------------------------------------
 * 负责接收前端通过 STOMP 发送的指令，解析后交给 PartyService；
 * 应答与房间广播统一由服务层经 PartyBroadcaster 下发。
 *
 *   /app/join-room  { name, room }
 *   /app/leave-room {}
 *   /app/message    { event, message: { room, ... } }
 *
 * 无法解析的载荷、未知事件、未知房间一律丢弃，不回错误、不断开连接。
 */
@Slf4j
@Controller
@RequiredArgsConstructor
public class PartyWsController {

    /** 房间会话管理 */
    private final PartyService partyService;
    /** 入站载荷解析 */
    private final InboundMessageParser parser;

    /**
     * 加入房间（不存在则创建）。
     */
    @MessageMapping("/join-room")
    public void joinRoom(@Payload JsonNode payload, SimpMessageHeaderAccessor sha) {
        final String connectionId = sha.getSessionId();
        Optional<JsonNode> body = parser.unwrap(payload);
        if (body.isEmpty()) {
            log.debug("join-room 载荷无法解析，已丢弃: connectionId={}", connectionId);
            return;
        }
        String room = InboundMessageParser.text(body.get(), "room");
        if (StringUtils.isBlank(room)) {
            log.debug("join-room 缺少 room，已丢弃: connectionId={}", connectionId);
            return;
        }
        partyService.joinRoom(room.trim(), connectionId, InboundMessageParser.text(body.get(), "name"));
    }

    /**
     * 主动离开当前房间（断线时由 WebSocketSessionManager 自动处理）。
     */
    @MessageMapping("/leave-room")
    public void leaveRoom(SimpMessageHeaderAccessor sha) {
        partyService.leaveRoom(sha.getSessionId());
    }

    /**
     * 通用消息信封，按 event 分发。
     */
    @MessageMapping("/message")
    public void onMessage(@Payload JsonNode payload, SimpMessageHeaderAccessor sha) {
        final String connectionId = sha.getSessionId();
        Optional<InboundMessage> parsed = parser.parseEnvelope(payload);
        if (parsed.isEmpty()) {
            log.debug("消息信封无法解析，已丢弃: connectionId={}", connectionId);
            return;
        }
        InboundMessage msg = parsed.get();
        switch (msg.event()) {
            case PartyEvents.UPDATE_USER_PROGRESS -> InboundMessageParser.integer(msg.message(), "progress")
                    .ifPresentOrElse(
                            progress -> partyService.updateProgress(msg.room(), connectionId, progress),
                            () -> log.debug("progress 非法，已丢弃: connectionId={}", connectionId));
            case PartyEvents.UPDATE_USER_STATE -> InboundMessageParser.bool(msg.message(), "is_ready")
                    .ifPresentOrElse(
                            ready -> partyService.updateReadiness(msg.room(), connectionId, ready),
                            () -> log.debug("is_ready 非法，已丢弃: connectionId={}", connectionId));
            case PartyEvents.START_GAME -> partyService.startGame(msg.room(), connectionId);
            default -> log.debug("未知事件，已丢弃: event={}, connectionId={}", msg.event(), connectionId);
        }
    }

    /**
     * 载荷转换失败（非 JSON 等）或处理异常：记录后丢弃，连接保持。
     */
    @MessageExceptionHandler(Exception.class)
    public void onInboundFailure(Exception e, SimpMessageHeaderAccessor sha) {
        log.warn("入站消息处理失败，已丢弃: connectionId={}, error={}", sha.getSessionId(), e.getMessage());
    }
}
