package com.wangbin.hvac.common.config;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.wangbin.hvac.core.config.HvacProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.*;

@Configuration
public class ThreadPoolConfig {

    private ThreadFactory buildNamedThreadFactory(String prefix, boolean daemon) {
        return new ThreadFactoryBuilder()
                .setNameFormat(prefix + "-%d")
                .setDaemon(daemon)
                .setPriority(Thread.NORM_PRIORITY)
                .build();
    }

    /**
     * 处理器调度线程池（只负责触发周期与超时检查）
     */
    @Bean(name = "processorScheduler", destroyMethod = "shutdown")
    public ScheduledExecutorService processorScheduler(HvacProperties properties) {
        ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(
                Math.max(1, properties.getProcessor().getSchedulerThreads()),
                buildNamedThreadFactory("processor-scheduler", true)
        );
        executor.setRemoveOnCancelPolicy(true);
        return executor;
    }

    /**
     * 设备控制周期执行线程池（IO密集型：读遥测、写结果）
     */
    @Bean(name = "equipmentWorkerExecutor", destroyMethod = "shutdown")
    public ThreadPoolExecutor equipmentWorkerExecutor(HvacProperties properties) {
        HvacProperties.ProcessorConfig config = properties.getProcessor();
        int threads = Math.max(1, config.getWorkerThreads());
        return new ThreadPoolExecutor(
                threads,
                threads,
                60L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(Math.max(1, config.getWorkerQueueCapacity())),
                buildNamedThreadFactory("equipment-worker", true),
                new ThreadPoolExecutor.AbortPolicy()
        );
    }
}
