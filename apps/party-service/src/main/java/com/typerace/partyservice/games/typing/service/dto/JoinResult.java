package com.typerace.partyservice.games.typing.service.dto;

import com.typerace.partyservice.games.typing.domain.model.PartySnapshot;
import com.typerace.partyservice.games.typing.domain.model.PlayerView;

/**
 * 加入房间的结果：调用方自己的玩家记录 + 加入后的房间快照。
 */
public record JoinResult(PlayerView player, PartySnapshot party) {
}
