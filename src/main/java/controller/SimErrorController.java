package controller;

import common.Result;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import service.algorithm.impl.DispatchErrorLog;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 调度错误日志查询接口
 * 协议异常 (过期回复、车辆离线放弃等) 不中断仿真，只能在这里查到
 */
@RestController
@RequestMapping("/sim/errors")
public class SimErrorController {

    private final DispatchErrorLog errorLog;

    public SimErrorController(DispatchErrorLog errorLog) {
        this.errorLog = errorLog;
    }

    /**
     * 查询指定时刻之后的错误日志
     */
    @GetMapping
    public Result listErrors(@RequestParam(name = "since", defaultValue = "0") long sinceTick) {
        List<DispatchErrorLog.ErrorLogEntry> entries = errorLog.listSince(sinceTick);
        return Result.success("查询成功", entries);
    }

    /**
     * 查询所有错误日志
     */
    @GetMapping("/all")
    public Result listAllErrors() {
        return Result.success("查询成功", errorLog.listAll());
    }

    /**
     * 按错误类型统计
     */
    @GetMapping("/summary")
    public Result summary() {
        Map<DispatchErrorLog.ErrorType, Long> counts = new EnumMap<>(DispatchErrorLog.ErrorType.class);
        for (DispatchErrorLog.ErrorType type : DispatchErrorLog.ErrorType.values()) {
            counts.put(type, errorLog.count(type));
        }
        return Result.success("查询成功", counts);
    }
}
