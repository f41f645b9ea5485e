package com.typerace.partyservice.games.typing.service;

import com.typerace.partyservice.games.typing.domain.model.PartySnapshot;
import com.typerace.partyservice.games.typing.domain.model.PlayerView;
import com.typerace.partyservice.games.typing.service.dto.JoinResult;
import com.typerace.partyservice.platform.ws.ConnectionInfo;

import java.util.List;
import java.util.Optional;

/**
 * 打字房间会话管理（房间注册表 + 生命周期入口）。
 *
 * 所有入站事件与计时到期都经由本接口进入，实现负责：加锁 → 查找 → 变更 → 状态机判定 → 广播。
 * 引用不存在的房间/连接一律静默忽略（断线竞态是常态），不会抛出异常。
 */
public interface PartyService {

    /** 连接建立：登记默认玩家记录 */
    ConnectionInfo connect(String connectionId);

    /** 向连接单播 res_conn（客户端订阅 /user/queue/res_conn 后触发）；未登记的连接忽略 */
    boolean acknowledge(String connectionId);

    /** 连接断开：离开房间并注销登记 */
    void disconnect(String connectionId);

    /** 加入（必要时创建）房间；重复加入同一房间不会产生重复成员 */
    Optional<JoinResult> joinRoom(String roomId, String connectionId, String displayName);

    /** 离开当前房间；房间空了则解散并停止计时 */
    void leaveRoom(String connectionId);

    /** 上报进度（仅 running 阶段接受，取值 0~100） */
    boolean updateProgress(String roomId, String connectionId, int progress);

    /** 更新准备状态 */
    boolean updateReadiness(String roomId, String connectionId, boolean ready);

    /** 开局指令（任一成员均可发起，受开局策略约束） */
    boolean startGame(String roomId, String connectionId);

    /** 回合计时到期回调 */
    boolean onRoundTimeout(String roomId, long roundSeq);

    Optional<PlayerView> findInRoom(String roomId, String connectionId);

    Optional<PartySnapshot> snapshot(String roomId);

    /** 当前全部房间快照（按创建时间倒序） */
    List<PartySnapshot> listParties();
}
