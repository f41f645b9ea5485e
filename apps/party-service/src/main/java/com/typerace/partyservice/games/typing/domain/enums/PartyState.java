package com.typerace.partyservice.games.typing.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 房间阶段（线上协议使用小写取值）
 */
public enum PartyState {

    LOBBY("lobby"),         // 等待全员准备
    READY("ready"),         // 全员已准备，挑战文本已生成，等待开局指令
    PREPARING("preparing"), // 预留，当前不会进入
    STARTING("starting"),   // 开局中（瞬时，进入后立刻转 running）
    RUNNING("running"),     // 回合进行中（接受进度上报）
    FINISHED("finished");   // 回合已结束（名次已结算）

    private final String wireName;

    PartyState(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /** 准备状态是否参与阶段判定（回合进行中只记录、不切换阶段） */
    public boolean acceptsReadinessTransition() {
        return this == LOBBY || this == READY || this == FINISHED;
    }
}
