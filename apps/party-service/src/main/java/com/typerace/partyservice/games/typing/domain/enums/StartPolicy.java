package com.typerace.partyservice.games.typing.domain.enums;

/**
 * 开局指令放行策略
 */
public enum StartPolicy {

    /** 任意成员在任意阶段都可强制开局（房主越权开局） */
    PERMISSIVE,

    /** 仅当房间处于 ready（全员准备）时才允许开局 */
    REQUIRE_READY;

    public boolean allows(PartyState current) {
        return this == PERMISSIVE || current == PartyState.READY;
    }
}
