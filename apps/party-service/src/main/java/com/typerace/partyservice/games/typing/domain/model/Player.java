package com.typerace.partyservice.games.typing.domain.model;

import com.typerace.partyservice.platform.ws.ConnectionInfo;
import lombok.Data;

/**
 * 房间内的玩家记录（房间作用域，加入房间后即为唯一权威数据）
 */
@Data
public class Player {

    // ---- 身份 ----
    private final String connectionId;
    private final String room;
    private String name = ConnectionInfo.DEFAULT_NAME;

    // ---- 回合数据 ----
    /** 预留字段，当前不参与计算 */
    private int score;
    /** 完成百分比 0~100 */
    private int progress;
    /** 名次（1 起），未结算时为 null */
    private Integer place;
    private boolean ready;

    public Player(String connectionId, String room) {
        this.connectionId = connectionId;
        this.room = room;
    }

    public boolean hasPlace() {
        return place != null;
    }
}
