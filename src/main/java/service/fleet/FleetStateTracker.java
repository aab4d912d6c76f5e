package service.fleet;

import common.consts.ErrorCodes;
import common.consts.VehicleStateEnum;
import common.exception.BusinessException;
import common.util.GisUtil;
import engine.agent.VehicleAgentRef;
import lombok.extern.slf4j.Slf4j;
import model.entity.Point;
import model.entity.RideHailVehicle;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * 车队状态跟踪器：车辆ID -> 运营状态 + 最近位置
 * 唯一的权威来源，其他组件通过它查询与更新车辆状态
 */
@Slf4j
@Component
public class FleetStateTracker {

    private final Map<String, RideHailVehicle> vehicleMap = new ConcurrentHashMap<>();

    public void registerVehicle(RideHailVehicle vehicle) {
        RideHailVehicle existing = vehicleMap.putIfAbsent(vehicle.getId(), vehicle);
        if (existing != null) {
            throw new BusinessException(ErrorCodes.VEHICLE_ALREADY_REGISTERED + ": " + vehicle.getId());
        }
    }

    public RideHailVehicle getVehicle(String vehicleId) {
        if (vehicleId == null) return null;
        return vehicleMap.get(vehicleId);
    }

    public VehicleAgentRef getAgent(String vehicleId) {
        RideHailVehicle vehicle = getVehicle(vehicleId);
        return vehicle != null ? vehicle.getAgent() : null;
    }

    public void updateState(String vehicleId, VehicleStateEnum state, long tick) {
        RideHailVehicle vehicle = vehicleMap.get(vehicleId);
        if (vehicle == null) {
            log.warn("更新状态失败，车辆 {} 不存在", vehicleId);
            return;
        }
        synchronized (vehicle) {
            vehicle.setState(state);
            vehicle.setLastUpdateTick(tick);
        }
    }

    /**
     * 车辆自身驱动的状态变化 (空闲 / 服务中)，不覆盖外部设置的离线状态
     * @return 是否已更新
     */
    public boolean updateStateUnlessOffline(String vehicleId, VehicleStateEnum state, long tick) {
        RideHailVehicle vehicle = vehicleMap.get(vehicleId);
        if (vehicle == null) {
            log.warn("更新状态失败，车辆 {} 不存在", vehicleId);
            return false;
        }
        synchronized (vehicle) {
            if (vehicle.getState() == VehicleStateEnum.OFFLINE) {
                return false;
            }
            vehicle.setState(state);
            vehicle.setLastUpdateTick(tick);
            return true;
        }
    }

    public void updateLocation(String vehicleId, Point location, long tick) {
        RideHailVehicle vehicle = vehicleMap.get(vehicleId);
        if (vehicle == null) {
            log.warn("更新位置失败，车辆 {} 不存在", vehicleId);
            return;
        }
        synchronized (vehicle) {
            vehicle.setPosX(location.getX());
            vehicle.setPosY(location.getY());
            vehicle.setLastUpdateTick(tick);
        }
    }

    /**
     * 所有空闲车辆ID，按ID排序
     */
    public List<String> getIdleVehicleIds() {
        return idsInState(v -> v.getState() == VehicleStateEnum.IDLE);
    }

    /**
     * 空闲与服务中车辆ID，按ID排序：波次规划的中断对象
     */
    public List<String> getIdleAndInServiceVehicleIds() {
        return idsInState(v -> v.getState() != VehicleStateEnum.OFFLINE);
    }

    private List<String> idsInState(Predicate<RideHailVehicle> filter) {
        return vehicleMap.values().stream()
                .filter(filter)
                .map(RideHailVehicle::getId)
                .sorted()
                .collect(Collectors.toList());
    }

    /**
     * 半径内的空闲车辆，按距离升序，距离相同按车辆ID
     */
    public List<RideHailVehicle> getClosestIdleVehicles(Point location, double radius) {
        List<RideHailVehicle> result = new ArrayList<>();
        for (RideHailVehicle vehicle : vehicleMap.values()) {
            if (vehicle.getState() == VehicleStateEnum.IDLE
                    && GisUtil.getDistance(vehicle.getLocation(), location) <= radius) {
                result.add(vehicle);
            }
        }
        result.sort(Comparator
                .comparingDouble((RideHailVehicle v) -> GisUtil.getDistance(v.getLocation(), location))
                .thenComparing(RideHailVehicle::getId));
        return result;
    }

    public Collection<RideHailVehicle> getAllVehicles() {
        return vehicleMap.values();
    }

    public int size() {
        return vehicleMap.size();
    }

    /**
     * 场景重置
     */
    public void clearAll() {
        vehicleMap.clear();
    }
}
