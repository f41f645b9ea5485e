package com.typerace.partyservice.games.typing.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.typerace.partyservice.games.typing.domain.enums.PartyState;

import java.util.List;

/**
 * 房间全貌快照（不可变）。
 *
 * <p>在房间锁内由 {@link Party} 拷贝生成，锁外序列化/广播不会看到中间态。</p>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PartySnapshot(
        String name,
        List<PlayerView> players,
        PartyState state,
        String targetString,
        @JsonProperty("timer") Long timerDurationMs,
        long roundSeq,
        Long deadlineEpochMs,
        boolean finished) {

    public static PartySnapshot of(Party party) {
        List<PlayerView> players = party.getPlayers().stream().map(PlayerView::of).toList();
        return new PartySnapshot(party.getName(), players, party.getState(), party.getTargetString(),
                party.getTimerDurationMs(), party.getRoundSeq(), party.getDeadlineEpochMs(), party.isFinished());
    }

    public PlayerView player(String connectionId) {
        return players.stream().filter(p -> p.connectionId().equals(connectionId)).findFirst().orElse(null);
    }
}
