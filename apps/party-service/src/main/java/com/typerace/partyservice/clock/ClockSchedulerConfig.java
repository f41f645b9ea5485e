package com.typerace.partyservice.clock;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 定时线程池配置类，用于统一创建全局的 ScheduledThreadPoolExecutor。
 *
 * 功能说明：
 * 1. 从配置文件读取核心线程数（scheduler.clock.corePoolSize）；
 * 2. 自定义线程工厂，线程命名为 round-clock-N，便于调试；
 * 3. 设置为守护线程，JVM 退出时自动结束；
 * 4. 启用 setRemoveOnCancelPolicy(true)，回合计时被替换/取消后立即出队。
 *
 * 主要用于房间回合到期等一次性定时任务。
 */
@Configuration
public class ClockSchedulerConfig {

    @Value("${scheduler.clock.corePoolSize:2}")
    private int corePoolSize;

    @Bean(name = "roundClockScheduler", destroyMethod = "shutdownNow")
    public ScheduledThreadPoolExecutor roundClockScheduler() {
        ThreadFactory tf = new ThreadFactory() {
            private final AtomicInteger seq = new AtomicInteger(1);
            @Override
            public Thread newThread(Runnable r) {
                Thread t = new Thread(r, "round-clock-" + seq.getAndIncrement());
                // 非业务线程，允许JVM优雅退出时不用等它
                t.setDaemon(true);
                return t;
            }
        };
        ScheduledThreadPoolExecutor executor =
                new ScheduledThreadPoolExecutor(corePoolSize, tf, new ThreadPoolExecutor.AbortPolicy());
        //定时任务cancel后，调度队列里干净地移除
        executor.setRemoveOnCancelPolicy(true);
        return executor;
    }
}
