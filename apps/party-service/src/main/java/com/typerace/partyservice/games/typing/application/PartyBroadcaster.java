package com.typerace.partyservice.games.typing.application;

import com.typerace.partyservice.games.typing.domain.constants.PartyEvents;
import com.typerace.partyservice.games.typing.domain.model.PartySnapshot;
import com.typerace.partyservice.games.typing.interfaces.ws.dto.PartyMessages.BroadcastEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.messaging.simp.SimpMessageType;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

/**
 * 房间镜像广播层。
 *
 * <ul>
 *   <li>publish：把房间快照以 game-update 推送到 /topic/room.{roomId}；</li>
 *   <li>sendToConnection：按 STOMP sessionId 单播到 /user/queue/{event}（匿名连接也可用）。</li>
 * </ul>
 * 发送即忘：失败只记日志，不影响已经完成的状态变更。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PartyBroadcaster {

    private final SimpMessagingTemplate messaging;

    public void publish(PartySnapshot snapshot) {
        BroadcastEvent evt = new BroadcastEvent(snapshot.name(), PartyEvents.GAME_UPDATE, snapshot);
        try {
            messaging.convertAndSend(PartyEvents.roomTopic(snapshot.name()), evt);
            log.debug("广播房间快照: roomId={}, state={}, players={}",
                    snapshot.name(), snapshot.state().wireName(), snapshot.players().size());
        } catch (Exception e) {
            log.warn("广播房间快照失败: roomId={}", snapshot.name(), e);
        }
    }

    public void sendToConnection(String connectionId, String event, Object payload) {
        try {
            SimpMessageHeaderAccessor headerAccessor = SimpMessageHeaderAccessor.create(SimpMessageType.MESSAGE);
            headerAccessor.setSessionId(connectionId);
            headerAccessor.setLeaveMutable(true);
            messaging.convertAndSendToUser(connectionId, PartyEvents.userQueue(event), payload,
                    headerAccessor.getMessageHeaders());
        } catch (Exception e) {
            log.warn("单播失败: connectionId={}, event={}", connectionId, event, e);
        }
    }
}
