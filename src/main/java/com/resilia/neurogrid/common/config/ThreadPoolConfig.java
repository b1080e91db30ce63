package com.resilia.neurogrid.common.config;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

@Configuration
public class ThreadPoolConfig {

    private final int cpuCores = Runtime.getRuntime().availableProcessors();

    private ThreadFactory buildNamedThreadFactory(String prefix, boolean daemon, int priority) {
        return new ThreadFactoryBuilder()
                .setNameFormat(prefix + "-%d")
                .setDaemon(daemon)
                .setPriority(priority)
                .build();
    }

    /**
     * 控制周期调度线程（单线程，独占实时状态）
     */
    @Bean(name = "controlCycleScheduler", destroyMethod = "shutdown")
    public ScheduledExecutorService controlCycleScheduler() {
        ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(
                1,
                buildNamedThreadFactory("control-cycle", true, Thread.MAX_PRIORITY)
        );
        executor.setRemoveOnCancelPolicy(true);
        return executor;
    }

    /**
     * gossip / 联邦学习的慢节奏调度线程
     */
    @Bean(name = "backgroundScheduler", destroyMethod = "shutdown")
    public ScheduledExecutorService backgroundScheduler() {
        ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(
                2,
                buildNamedThreadFactory("background-scheduler", true, Thread.NORM_PRIORITY)
        );
        executor.setRemoveOnCancelPolicy(true);
        return executor;
    }

    /**
     * 邻居交换线程池（IO密集型）
     */
    @Bean(name = "gossipExchangeExecutor", destroyMethod = "shutdown")
    public ThreadPoolExecutor gossipExchangeExecutor() {
        return new ThreadPoolExecutor(
                2,
                Math.max(4, cpuCores * 2),
                30L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(256),
                buildNamedThreadFactory("gossip-exchange", true, Thread.NORM_PRIORITY),
                new ThreadPoolExecutor.DiscardOldestPolicy()
        );
    }

    /**
     * 联邦学习线程池（CPU密集型，低优先级）
     */
    @Bean(name = "learningExecutor", destroyMethod = "shutdown")
    public ThreadPoolExecutor learningExecutor() {
        return new ThreadPoolExecutor(
                1,
                1,
                60L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(4),
                buildNamedThreadFactory("federated-learning", true, Thread.MIN_PRIORITY),
                new ThreadPoolExecutor.DiscardPolicy()
        );
    }
}
