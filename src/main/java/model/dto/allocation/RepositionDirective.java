package model.dto.allocation;

import lombok.Value;
import model.entity.Point;

/**
 * 再平衡指令：把空闲车辆调往目标点
 */
@Value
public class RepositionDirective {
    String vehicleId;
    Point target;
}
