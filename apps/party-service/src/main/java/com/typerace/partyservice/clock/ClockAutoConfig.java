package com.typerace.partyservice.clock;

import com.typerace.partyservice.clock.scheduler.RoomTimerScheduler;
import com.typerace.partyservice.clock.scheduler.RoomTimerSchedulerImpl;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ScheduledThreadPoolExecutor;

/**
 * ClockAutoConfig
 * ---------------------------------------
 * 房间计时相关 Bean 的装配：把调度线程池注入到通用房间计时器中。
 *
 * 说明：
 *  - 线程池由 {@link ClockSchedulerConfig} 提供。
 *  - 这里不关心任何业务细节，只负责把基础设施拼起来。
 */
@Configuration
public class ClockAutoConfig {

    /**
     * 注册通用房间计时器。
     * @param roundClockScheduler 调度线程池（守护线程）
     * @return RoomTimerScheduler 实例
     */
    @Bean
    public RoomTimerScheduler roomTimerScheduler(@Qualifier("roundClockScheduler") ScheduledThreadPoolExecutor roundClockScheduler) {
        return new RoomTimerSchedulerImpl(roundClockScheduler); // 纯引擎，无业务逻辑
    }
}
