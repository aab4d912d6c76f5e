package common.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * 调度协调器配置
 * 所有波次间隔、搜索半径等常量统一从这里集中管理，对核心逻辑只读。
 *
 * 缺省值可以通过 Spring 配置文件覆盖：
 *
 * sim.dispatch.reposition-timeout-sec
 * sim.dispatch.request-buffer-timeout-sec
 * sim.dispatch.search-radius
 * sim.dispatch.interrupt-reply-timeout-sec
 */
@Configuration
@ConfigurationProperties(prefix = "sim.dispatch")
@Data
public class DispatchConfig {

    /**
     * 再平衡波次间隔 (秒)
     */
    private long repositionTimeoutSec = 300;

    /**
     * 缓冲订单批量分配波次间隔 (秒)
     */
    private long requestBufferTimeoutSec = 60;

    /**
     * 分配时搜索空闲车辆的半径 (米)
     */
    private double searchRadius = 5000.0;

    /**
     * 直线估算行驶耗时所用车速 (米/秒)
     */
    private double vehicleSpeed = 10.0;

    /**
     * 中断回复的最长等待 (仿真秒)，超时后放弃该尝试并恢复车辆；0 表示无限等待
     */
    private long interruptReplyTimeoutSec = 600;

    /**
     * 单一 tick 下允许投递的最大触发器数量（防止死循环）
     */
    private int maxTriggersPerTick = 10_000;

    /**
     * 订单因车辆离线而修改失败后，重新进入缓冲队列的最大次数
     */
    private int maxReservationRetries = 2;

    /**
     * 车辆代理线程数
     */
    private int agentThreads = 4;
}
