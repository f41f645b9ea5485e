package com.typerace.partyservice.games.typing.interfaces.ws.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.typerace.partyservice.games.typing.domain.enums.PartyState;
import com.typerace.partyservice.games.typing.domain.model.PlayerView;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * WebSocket 消息对象定义（DTO）
 * ----------------------------------------
 * 后端 -> 前端的出站结构。入站信封是松散 JSON，由 InboundMessageParser 宽松解析，
 * 因此这里不定义入站命令类。
 *
 * 这些消息会被 STOMP 封装后，通过 /topic/... 和 /user/queue/... 下发。
 */
public class PartyMessages {

    /**
     * 广播事件（服务端 → 房间内所有订阅者）
     * ---------------------------------------------
     * 字段：
     *   - roomId ：所属房间；
     *   - type   ：事件类型（目前只有 "game-update"）；
     *   - payload：房间全貌快照。
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class BroadcastEvent {
        private String roomId;
        private String type;
        private Object payload;
    }

    /**
     * 连接建立应答（服务端 → 当前连接）
     * ---------------------------------------------
     * 字段：
     *   - partyState：固定为 lobby（尚未加入任何房间）；
     *   - player    ：默认玩家记录。
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ConnectionAck {
        @JsonProperty("party_state")
        private PartyState partyState;
        private PlayerView player;
    }
}
