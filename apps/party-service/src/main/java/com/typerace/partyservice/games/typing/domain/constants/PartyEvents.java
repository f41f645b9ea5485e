package com.typerace.partyservice.games.typing.domain.constants;

/**
 * 打字房间线上协议常量（入站事件名 / 出站事件名 / 目的地）
 * 统一管理，避免在控制器与广播层硬编码。
 */
public final class PartyEvents {

    private PartyEvents() {
        // 工具类，禁止实例化
    }

    // ========== 入站（/app/message 信封内的 event）==========

    /** 上报进度 { progress } */
    public static final String UPDATE_USER_PROGRESS = "update_user_progress";

    /** 切换准备 { is_ready } */
    public static final String UPDATE_USER_STATE = "update_user_state";

    /** 开局 {} */
    public static final String START_GAME = "start-game";

    // ========== 出站 ==========

    /** 连接建立后的初始状态（单播） */
    public static final String RES_CONN = "res_conn";

    /** 加入房间成功（单播，玩家记录） */
    public static final String JOIN_ROOM_SUCCESS = "join-room-success";

    /** 房间全貌（房间广播） */
    public static final String GAME_UPDATE = "game-update";

    // ========== 目的地 ==========

    /** 房间主题前缀：/topic/room.{roomId} */
    public static final String ROOM_TOPIC_PREFIX = "/topic/room.";

    /** 单播队列前缀：/user/queue/{event} */
    public static final String USER_QUEUE_PREFIX = "/queue/";

    public static String roomTopic(String roomId) {
        return ROOM_TOPIC_PREFIX + roomId;
    }

    public static String userQueue(String event) {
        return USER_QUEUE_PREFIX + event;
    }
}
