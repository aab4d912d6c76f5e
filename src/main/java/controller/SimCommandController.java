package controller;

import common.Result;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import service.SimulationService;

/**
 * 仿真时钟控制
 */
@RestController
@RequestMapping("/sim")
public class SimCommandController {

    private final SimulationService simulationService;

    public SimCommandController(SimulationService simulationService) {
        this.simulationService = simulationService;
    }

    @PostMapping("/start")
    public Result start() {
        boolean started = simulationService.start();
        return started ? Result.success("仿真已启动", null) : Result.error(400, "仿真已在运行");
    }

    // 推进 ticks 秒，返回推进后的时钟
    @PostMapping("/step")
    public Result step(@RequestParam long ticks) {
        return Result.success(simulationService.step(ticks));
    }
}
