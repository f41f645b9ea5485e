package com.typerace.partyservice.games.typing.interfaces.http.dto;

import com.typerace.partyservice.games.typing.domain.model.PartySnapshot;

/**
 * 大厅房间列表的单行摘要信息。
 * 这是 HTTP 层专用 DTO，从 PartySnapshot 映射而来。
 */
public record PartySummary(String roomId, String state, int playerCount, long roundSeq) {

    public static PartySummary from(PartySnapshot snap) {
        return new PartySummary(snap.name(), snap.state().wireName(), snap.players().size(), snap.roundSeq());
    }
}
