package common.exception;

import common.consts.ErrorCodes;
import common.consts.WaveTypeEnum;

/**
 * 在未持有波次触发器的情况下尝试发送完成通知
 * 属于程序不变量被破坏，必须立即暴露，不能静默丢弃该波次
 */
public class TriggerNotHeldException extends IllegalStateException {
    private final WaveTypeEnum waveType;

    public TriggerNotHeldException(WaveTypeEnum waveType) {
        super(ErrorCodes.TRIGGER_NOT_HELD + ": " + waveType);
        this.waveType = waveType;
    }

    public WaveTypeEnum getWaveType() {
        return waveType;
    }
}
