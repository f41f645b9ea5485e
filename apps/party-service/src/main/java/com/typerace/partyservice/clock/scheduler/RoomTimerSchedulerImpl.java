package com.typerace.partyservice.clock.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * RoomTimerSchedulerImpl
 * ---------------------------------------
 * 通用房间计时器的默认实现（纯内存）。
 *
 * 职责：
 *  - 使用 ScheduledExecutorService 调度一次性任务；
 *  - key -> 任务句柄 的登记表，保证同一 key 至多一个任务；
 *  - 到期时以“登记表中仍是自己”为前提才回调，过期句柄直接丢弃。
 *
 * 不做的事：
 *  - 不做任何业务逻辑（如结算、广播）。
 */
public class RoomTimerSchedulerImpl implements RoomTimerScheduler {

    private static final Logger log = LoggerFactory.getLogger(RoomTimerSchedulerImpl.class);

    // 调度器
    private final ScheduledExecutorService scheduler;

    // key -> 当前登记的任务
    private final ConcurrentMap<String, TimerEntry> activeTasks = new ConcurrentHashMap<>();

    /**
     * 构造函数：注入调度线程池。
     * @param scheduler 执行到期任务的线程池
     */
    public RoomTimerSchedulerImpl(ScheduledExecutorService scheduler) {
        this.scheduler = scheduler;
    }

    @Override
    public void schedule(String key, long delayMs, String version, TimeoutHandler onTimeout) {
        long delay = Math.max(0L, delayMs);
        TimerEntry entry = new TimerEntry(version);
        // compute 持有桶锁：取消旧任务与登记新任务对同一 key 原子可见
        activeTasks.compute(key, (k, old) -> {
            if (old != null) {
                old.cancel();
                log.debug("Room timer replaced: key={}, oldVersion={}, newVersion={}", k, old.version, version);
            }
            try {
                entry.future = scheduler.schedule(() -> fire(k, entry, onTimeout), delay, TimeUnit.MILLISECONDS);
            } catch (RejectedExecutionException e) {
                log.error("Room timer rejected: key={}, version={}", k, version, e);
                return null;
            }
            return entry;
        });
    }

    @Override
    public void cancel(String key) {
        TimerEntry entry = activeTasks.remove(key);
        // 取消调度，但不打断正在运行
        if (entry != null) {
            entry.cancel();
            log.debug("Room timer cancelled: key={}, version={}", key, entry.version);
        }
    }

    @Override
    public boolean isScheduled(String key) {
        return activeTasks.containsKey(key);
    }

    @Override
    public int activeCount() {
        return activeTasks.size();
    }

    /**
     * 到期执行：只有登记表里仍是本任务才回调（被替换/取消的任务静默退出）。
     */
    private void fire(String key, TimerEntry entry, TimeoutHandler onTimeout) {
        if (!activeTasks.remove(key, entry)) {
            return;
        }
        if (onTimeout == null) return;
        try {
            onTimeout.onTimeout(key, entry.version);
        } catch (Throwable t) {
            log.error("Room timer callback failed: key={}, version={}", key, entry.version, t);
        }
    }

    /**
     * 登记表中的任务句柄
     */
    private static final class TimerEntry {
        // 登记时的版本
        private final String version;
        // 调度句柄（在 compute 内赋值）
        private volatile ScheduledFuture<?> future;

        private TimerEntry(String version) {
            this.version = version;
        }

        private void cancel() {
            ScheduledFuture<?> f = future;
            if (f != null) f.cancel(false);
        }
    }
}
