package com.careerhub.matchservice.clock;

import com.careerhub.matchservice.clock.scheduler.CountdownScheduler;
import com.careerhub.matchservice.clock.scheduler.CountdownSchedulerImpl;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ScheduledThreadPoolExecutor;

/**
 * 倒计时 Bean 装配：把调度线程池与时钟注入通用倒计时引擎，不涉及任何业务。
 */
@Configuration
public class ClockAutoConfig {

    @Bean
    public CountdownScheduler countdownScheduler(@Qualifier("turnClockScheduler") ScheduledThreadPoolExecutor turnClockScheduler,
                                                 Clock clock) {
        return new CountdownSchedulerImpl(turnClockScheduler, clock);
    }
}
