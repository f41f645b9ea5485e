package com.typerace.partyservice.games.typing.domain.model;

import com.typerace.partyservice.games.typing.domain.enums.PartyState;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 房间聚合（roomId 同时作为展示名）
 *
 * <p>非线程安全：所有读写都必须在会话管理器的房间锁内完成。</p>
 */
@Data
public class Party {

    // ---- 基本信息 ----
    private final String name;
    private final long createdAt;

    // ---- 成员（加入顺序即列表顺序）----
    private final List<Player> players = new ArrayList<>();

    // ---- 阶段与回合 ----
    private PartyState state = PartyState.LOBBY;
    private String targetString;
    /** 名义回合时长，仅用于展示 */
    private Long timerDurationMs;
    /** 回合序号（全服务递增，由状态机发号），作为计时版本号，防止旧回合或旧房间的到期回调误结算 */
    private long roundSeq;
    /** 本回合截止时间（仅 running 期间有值） */
    private Long deadlineEpochMs;
    /** 预留字段 */
    private boolean finished;
    /** 本回合已发出的名次数（离开的玩家也计入） */
    private int placesAssigned;

    public Party(String name, long createdAt) {
        this.name = name;
        this.createdAt = createdAt;
    }

    public Optional<Player> findPlayer(String connectionId) {
        return players.stream().filter(p -> p.getConnectionId().equals(connectionId)).findFirst();
    }

    public boolean removePlayer(String connectionId) {
        return players.removeIf(p -> p.getConnectionId().equals(connectionId));
    }

    public boolean isEmpty() {
        return players.isEmpty();
    }

    /** 发出本回合的下一个名次（1 起） */
    public int nextPlace() {
        return ++placesAssigned;
    }

    /** 空房间视为未全员准备 */
    public boolean allReady() {
        return !players.isEmpty() && players.stream().allMatch(Player::isReady);
    }
}
