package common.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 线程模型
 * agentExecutor：车辆代理共享线程池，每辆车的邮箱串行消费
 * dispatchExecutor：调度决策唯一线程，协调器、波次控制器只在该线程上被访问
 */
@Configuration
public class ExecutorConfig {

    public static final String AGENT_EXECUTOR = "agentExecutor";
    public static final String DISPATCH_EXECUTOR = "dispatchExecutor";

    @Bean(name = AGENT_EXECUTOR, destroyMethod = "shutdown")
    public ExecutorService agentExecutor(DispatchConfig dispatchConfig) {
        return Executors.newFixedThreadPool(dispatchConfig.getAgentThreads(), namedFactory("vehicle-agent-"));
    }

    @Bean(name = DISPATCH_EXECUTOR, destroyMethod = "shutdown")
    public ExecutorService dispatchExecutor() {
        return Executors.newSingleThreadExecutor(namedFactory("ride-hail-dispatch-"));
    }

    private static ThreadFactory namedFactory(String prefix) {
        AtomicInteger counter = new AtomicInteger(1);
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        };
    }
}
