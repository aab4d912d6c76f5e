package engine.agent;

/**
 * 车辆代理能力：身份 + 异步投递
 * 协调器只依赖该接口，不关心代理背后的并发实现
 */
public interface VehicleAgentRef {

    String getVehicleId();

    /**
     * 投递指令后立即返回，不等待处理结果
     */
    void tell(VehicleCommand command);
}
