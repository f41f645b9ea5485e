package com.typerace.partyservice.platform.ws;

import lombok.Data;

/**
 * 长连接登记信息：只保存身份与所在房间（反向索引），
 * 不保存任何回合数据（进度/名次/准备状态以房间内的玩家记录为准）。
 */
@Data
public class ConnectionInfo {

    /** 未设置展示名时使用的默认名 */
    public static final String DEFAULT_NAME = "Anonymous";

    /**
     * STOMP sessionId，连接存续期内稳定、不复用。
     */
    private final String connectionId;

    /**
     * 连接建立时间（毫秒时间戳）。
     */
    private final long connectedAt;

    /**
     * 展示名，加入房间前为默认值。
     */
    private volatile String name = DEFAULT_NAME;

    /**
     * 当前所在房间，未加入或已离开时为 null。
     */
    private volatile String room;
}
