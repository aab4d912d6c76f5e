package controller;

import common.Result;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import service.SimulationService;
import service.algorithm.impl.TriggerLog;

/**
 * 仿真状态查询接口
 */
@RestController
@RequestMapping("/sim/state")
public class SimStateController {

    private final SimulationService simulationService;
    private final TriggerLog triggerLog;

    public SimStateController(SimulationService simulationService, TriggerLog triggerLog) {
        this.simulationService = simulationService;
        this.triggerLog = triggerLog;
    }

    /**
     * 当前时钟、车辆、进行中的修改尝试与波次
     */
    @GetMapping
    public Result getSnapshot() {
        return Result.success("查询成功", simulationService.snapshot());
    }

    /**
     * 最近投递的触发器
     */
    @GetMapping("/triggers")
    public Result listTriggers(@RequestParam(name = "since", defaultValue = "0") long sinceTick) {
        return Result.success("查询成功", triggerLog.listSince(sinceTick));
    }
}
