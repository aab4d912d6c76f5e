package service.allocation.impl;

import common.config.DispatchConfig;
import common.util.GisUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import model.dto.allocation.BatchAllocation;
import model.dto.allocation.RepositionDirective;
import model.dto.allocation.VehicleAllocation;
import model.entity.Point;
import model.entity.RideHailRequest;
import model.entity.RideHailVehicle;
import org.springframework.stereotype.Component;
import service.allocation.VehicleAllocationManager;
import service.fleet.FleetStateTracker;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * 最近空闲车辆分配
 * 基于车队状态跟踪器的当前快照，结果确定：距离相同按车辆ID
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class NearestIdleAllocationManager implements VehicleAllocationManager {

    // 车辆已在需求点附近时无需再平衡 (米)
    private static final double ALREADY_THERE_THRESHOLD = 1.0;

    private final FleetStateTracker fleet;
    private final DispatchConfig dispatchConfig;

    @Override
    public Optional<VehicleAllocation> proposeAllocation(Point pickupLocation, double searchRadius) {
        List<RideHailVehicle> candidates = fleet.getClosestIdleVehicles(pickupLocation, searchRadius);
        if (candidates.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(toAllocation(candidates.get(0), pickupLocation));
    }

    @Override
    public List<BatchAllocation> allocateBatch(List<RideHailRequest> requests) {
        Set<String> alreadyUsedVehicles = new HashSet<>();
        List<BatchAllocation> result = new ArrayList<>(requests.size());
        for (RideHailRequest request : requests) {
            Optional<VehicleAllocation> allocation = nearestUnused(request.getPickup(), alreadyUsedVehicles)
                    .map(v -> toAllocation(v, request.getPickup()));
            allocation.ifPresent(a -> alreadyUsedVehicles.add(a.getVehicleId()));
            result.add(new BatchAllocation(request, allocation));
        }
        log.debug("批量分配: 订单数={}, 匹配数={}", requests.size(), alreadyUsedVehicles.size());
        return result;
    }

    @Override
    public List<RepositionDirective> repositionVehicles(List<Point> demandPoints, long tick) {
        Set<String> alreadyUsedVehicles = new HashSet<>();
        List<RepositionDirective> directives = new ArrayList<>();
        for (Point demand : demandPoints) {
            Optional<RideHailVehicle> vehicle = nearestUnused(demand, alreadyUsedVehicles);
            if (vehicle.isEmpty()) {
                continue;
            }
            alreadyUsedVehicles.add(vehicle.get().getId());
            if (GisUtil.getDistance(vehicle.get().getLocation(), demand) > ALREADY_THERE_THRESHOLD) {
                directives.add(new RepositionDirective(vehicle.get().getId(), demand));
            }
        }
        log.debug("再平衡 @ {}: 需求点={}, 调派={}", tick, demandPoints.size(), directives.size());
        return directives;
    }

    private Optional<RideHailVehicle> nearestUnused(Point location, Set<String> alreadyUsedVehicles) {
        for (RideHailVehicle vehicle : fleet.getClosestIdleVehicles(location, dispatchConfig.getSearchRadius())) {
            if (!alreadyUsedVehicles.contains(vehicle.getId())) {
                return Optional.of(vehicle);
            }
        }
        return Optional.empty();
    }

    private static VehicleAllocation toAllocation(RideHailVehicle vehicle, Point pickup) {
        Point location = vehicle.getLocation();
        return new VehicleAllocation(vehicle.getId(), location, GisUtil.getDistance(location, pickup));
    }
}
