package service.allocation;

import model.dto.allocation.BatchAllocation;
import model.dto.allocation.RepositionDirective;
import model.dto.allocation.VehicleAllocation;
import model.entity.Point;
import model.entity.RideHailRequest;

import java.util.List;
import java.util.Optional;

/**
 * 车辆分配算法接口
 * 只负责选车，不会创建修改尝试；选中的车辆需由调用方交给协调器去改写计划
 */
public interface VehicleAllocationManager {

    /**
     * 为单个上车点选车
     * @return 半径内最近的空闲车辆；没有则为空
     */
    Optional<VehicleAllocation> proposeAllocation(Point pickupLocation, double searchRadius);

    /**
     * 批量选车：按输入顺序逐个贪心匹配，已用车辆不再参与后续匹配
     * 不回溯，不保证全局最优
     * @return 与输入同序的分配结果
     */
    List<BatchAllocation> allocateBatch(List<RideHailRequest> requests);

    /**
     * 再平衡：为每个需求点调派一辆尚未使用的空闲车辆
     */
    List<RepositionDirective> repositionVehicles(List<Point> demandPoints, long tick);
}
