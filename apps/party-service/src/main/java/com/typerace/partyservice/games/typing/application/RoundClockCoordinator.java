package com.typerace.partyservice.games.typing.application;

import com.typerace.partyservice.clock.scheduler.RoomTimerScheduler;
import com.typerace.partyservice.games.typing.service.PartyService;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

/**
 * RoundClockCoordinator
 * -------------------------------------------------
 * 回合计时协调器（应用编排层）：把通用房间计时器与打字房间的回合规则对接。
 *
 * 职责与边界：
 * 1) 开局时登记一次性回合计时，key = typing:{roomId}，version = 回合序号；
 *    同一房间再次开局会原子替换旧计时，旧计时不会再回调；
 * 2) 房间解散时停止计时；
 * 3) 到期回调时交给 PartyService 做权威结算（由服务端再次校验房间是否仍存在、回合序号是否匹配）。
 *
 * 本类不管理线程池，也不修改房间状态。
 */
@Component
@RequiredArgsConstructor
public class RoundClockCoordinator {

    private static final Logger log = LoggerFactory.getLogger(RoundClockCoordinator.class);

    private static final String KEY_PREFIX = "typing:";

    // 通用房间计时器（不懂业务）
    private final RoomTimerScheduler scheduler;
    // 延迟获取，避免与 PartyService 循环依赖
    private final ObjectProvider<PartyService> partyServiceProvider;

    /**
     * 启动（或替换）房间的回合计时。
     * @return 本回合截止时间（毫秒时间戳）
     */
    public long startRound(String roomId, long roundSeq, long durationMs) {
        long deadline = System.currentTimeMillis() + durationMs;
        scheduler.schedule(key(roomId), durationMs, String.valueOf(roundSeq), this::handleTimeout);
        log.info("回合计时启动: roomId={}, roundSeq={}, durationMs={}", roomId, roundSeq, durationMs);
        return deadline;
    }

    // 对外暴露停止
    public void stop(String roomId) { scheduler.cancel(key(roomId)); }

    public boolean isRunning(String roomId) { return scheduler.isScheduled(key(roomId)); }

    /**
     * 处理回合到期：解析出 roomId 与回合序号，交给服务层结算。
     */
    private void handleTimeout(String key, String version) {
        String roomId = extractRoomId(key);
        long roundSeq;
        try {
            roundSeq = Long.parseLong(version);
        } catch (NumberFormatException e) {
            log.warn("回合计时版本无法识别，忽略本次到期: key={}, version={}", key, version);
            return;
        }
        log.info("回合到期: roomId={}, roundSeq={}", roomId, roundSeq);
        partyServiceProvider.getObject().onRoundTimeout(roomId, roundSeq);
    }

    // key 生成：通用前缀 + roomId
    private String key(String roomId) { return KEY_PREFIX + roomId; }
    // 反向解析 roomId
    private String extractRoomId(String key) {
        return key.startsWith(KEY_PREFIX) ? key.substring(KEY_PREFIX.length()) : key;
    }
}
