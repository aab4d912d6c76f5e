package controller;

import common.Result;
import model.dto.request.FleetLoadReq;
import model.dto.request.VehicleStateReq;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import service.SimulationService;

/**
 * 仿真场景管理接口：重置、装载与车辆状态设置
 */
@RestController
@RequestMapping("/sim/admin")
public class SimAdminController {

    private final SimulationService simulationService;

    public SimAdminController(SimulationService simulationService) {
        this.simulationService = simulationService;
    }

    /**
     * 清空当前场景，所有被中断的车辆先被恢复
     */
    @PostMapping("/reset")
    public Result reset() {
        simulationService.reset();
        return Result.success("重置成功", null);
    }

    /**
     * 从请求装载新车队 (会先清空当前场景)
     */
    @PostMapping("/load")
    public Result load(@RequestBody FleetLoadReq req) {
        int count = simulationService.loadFleet(req);
        return Result.success("车队装载成功", count);
    }

    // 车辆上线/下线
    @PostMapping("/vehicle/state")
    public Result setVehicleState(@RequestBody VehicleStateReq req) {
        simulationService.setVehicleState(req);
        return Result.success();
    }
}
