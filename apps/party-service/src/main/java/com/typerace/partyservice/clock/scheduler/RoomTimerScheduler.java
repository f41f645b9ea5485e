package com.typerace.partyservice.clock.scheduler;

/**
 * RoomTimerScheduler
 * ---------------------------------------
 * 通用的“按房间一次性定时”接口，完全独立于具体业务（打字竞速、倒数开局等）。
 *
 * 约定：
 *  - 每个 key 同一时刻至多存在一个待执行任务；
 *  - schedule 对同一 key 是“先取消旧任务、再登记新任务”的原子替换；
 *  - 被替换或取消的任务即使已经开始执行，也不会回调 TimeoutHandler。
 */
public interface RoomTimerScheduler {

    /**
     * TimeoutHandler
     * ---------------------------------------
     * 到期时回调一次，由上层做权威业务处理。
     */
    interface TimeoutHandler {
        /**
         * 定时到期时触发。
         * @param key     业务键（如 "typing:{roomId}"）
         * @param version 登记时携带的版本（上层用于幂等/跨回合保护）
         */
        void onTimeout(String key, String version);
    }

    /**
     * 登记（或替换）指定 key 的一次性任务。
     * @param key       业务键
     * @param delayMs   延迟毫秒数，小于 0 时按 0 处理
     * @param version   版本标识
     * @param onTimeout 到期回调
     */
    void schedule(String key, long delayMs, String version, TimeoutHandler onTimeout);

    /**
     * 取消指定 key 的任务；key 不存在时什么也不做。
     * @param key 业务键
     */
    void cancel(String key);

    /**
     * 指定 key 是否存在尚未触发的任务。
     */
    boolean isScheduled(String key);

    /**
     * 当前待执行任务数。
     */
    int activeCount();
}
