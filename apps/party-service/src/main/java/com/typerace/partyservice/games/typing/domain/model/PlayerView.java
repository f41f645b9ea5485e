package com.typerace.partyservice.games.typing.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 玩家对外视图（只读，用于广播与单播应答）。
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PlayerView(
        @JsonProperty("conn_id") String connectionId,
        String name,
        int score,
        Integer progress,
        Integer place,
        @JsonProperty("is_ready") boolean ready,
        String room) {

    public static PlayerView of(Player p) {
        return new PlayerView(p.getConnectionId(), p.getName(), p.getScore(),
                p.getProgress(), p.getPlace(), p.isReady(), p.getRoom());
    }
}
