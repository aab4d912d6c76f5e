package common.exception;

import common.Result;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * 全局异常处理器
 * 调用方错误返回 400，其余记录日志后返回 500
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    /**
     * 处理业务异常
     */
    @ExceptionHandler(BusinessException.class)
    public Result handleBusinessException(BusinessException e) {
        log.warn("业务异常: {}", e.getMessage());
        return Result.error(400, e.getMessage());
    }

    /**
     * 处理仿真死循环异常
     */
    @ExceptionHandler(SimulationDeadLoopException.class)
    public Result handleDeadLoopException(SimulationDeadLoopException e) {
        log.error("仿真死循环异常: {}", e.getMessage());
        // 错误日志在 TriggerScheduler 中记录
        return Result.error(500, "仿真死循环: " + e.getMessage());
    }

    /**
     * 处理所有其他异常
     */
    @ExceptionHandler(Exception.class)
    public Result handleException(Exception e) {
        log.error("系统异常", e);
        return Result.error(500, "系统内部错误: " + e.getMessage());
    }
}
