package common.consts;

/**
 * 非车辆类触发器接收方ID
 */
public class AgentIds {
    // 网约车调度管理器，接收两类波次定时触发器
    public static final String RIDE_HAIL_MANAGER = "rideHailManager";
}
