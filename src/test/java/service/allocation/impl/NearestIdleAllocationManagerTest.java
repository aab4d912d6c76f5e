package service.allocation.impl;

import common.config.DispatchConfig;
import common.consts.VehicleStateEnum;
import model.dto.allocation.BatchAllocation;
import model.dto.allocation.RepositionDirective;
import model.dto.allocation.VehicleAllocation;
import model.entity.Point;
import model.entity.RideHailRequest;
import model.entity.RideHailVehicle;
import model.schedule.PassengerRef;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import service.fleet.FleetStateTracker;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("最近空闲车辆分配测试")
class NearestIdleAllocationManagerTest {

    private FleetStateTracker fleet;
    private DispatchConfig config;
    private NearestIdleAllocationManager allocationManager;

    @BeforeEach
    void setUp() {
        fleet = new FleetStateTracker();
        config = new DispatchConfig();
        config.setSearchRadius(1000);
        allocationManager = new NearestIdleAllocationManager(fleet, config);
    }

    private void addVehicle(String id, double x, double y, VehicleStateEnum state) {
        fleet.registerVehicle(new RideHailVehicle(id, state, new Point(x, y), null));
    }

    private RideHailRequest request(long id, double x, double y) {
        return new RideHailRequest(id, new PassengerRef("body-" + id, "p" + id), new Point(x, y), new Point(x + 500, y), 0);
    }

    @Test
    @DisplayName("选择半径内最近的空闲车辆")
    void proposeNearestIdle() {
        addVehicle("v1", 500, 0, VehicleStateEnum.IDLE);
        addVehicle("v2", 100, 0, VehicleStateEnum.IDLE);
        addVehicle("v3", 10, 0, VehicleStateEnum.IN_SERVICE);

        Optional<VehicleAllocation> allocation = allocationManager.proposeAllocation(new Point(0, 0), 1000);

        assertTrue(allocation.isPresent());
        assertEquals("v2", allocation.get().getVehicleId());
        assertEquals(100.0, allocation.get().getDistanceToPickup(), 1e-9);
    }

    @Test
    @DisplayName("半径内没有空闲车辆时返回空")
    void proposeNoneOutsideRadius() {
        addVehicle("v1", 5000, 0, VehicleStateEnum.IDLE);

        assertFalse(allocationManager.proposeAllocation(new Point(0, 0), 1000).isPresent());
    }

    @Test
    @DisplayName("距离相同按车辆ID选择")
    void tieBrokenById() {
        addVehicle("vB", 0, 100, VehicleStateEnum.IDLE);
        addVehicle("vA", 100, 0, VehicleStateEnum.IDLE);

        assertEquals("vA", allocationManager.proposeAllocation(new Point(0, 0), 1000).get().getVehicleId());
    }

    @Test
    @DisplayName("5 个订单 3 辆空闲车：3 个匹配不同车辆，2 个为空，保持原顺序")
    void batchFiveRequestsThreeVehicles() {
        addVehicle("v1", 0, 0, VehicleStateEnum.IDLE);
        addVehicle("v2", 200, 0, VehicleStateEnum.IDLE);
        addVehicle("v3", 400, 0, VehicleStateEnum.IDLE);

        List<RideHailRequest> requests = new ArrayList<>();
        for (long i = 1; i <= 5; i++) {
            requests.add(request(i, i * 50, 0));
        }

        List<BatchAllocation> result = allocationManager.allocateBatch(requests);

        assertEquals(5, result.size());
        Set<String> usedVehicles = new HashSet<>();
        int matched = 0;
        for (int i = 0; i < result.size(); i++) {
            assertSame(requests.get(i), result.get(i).getRequest(), "结果应保持订单原顺序");
            if (result.get(i).getAllocation().isPresent()) {
                matched++;
                assertTrue(usedVehicles.add(result.get(i).getAllocation().get().getVehicleId()), "车辆不能重复分配");
            }
        }
        assertEquals(3, matched);
        assertFalse(result.get(3).getAllocation().isPresent());
        assertFalse(result.get(4).getAllocation().isPresent());
    }

    @Test
    @DisplayName("贪心分配：先到的订单优先拿到最近车辆")
    void batchIsGreedyInInputOrder() {
        addVehicle("near", 100, 0, VehicleStateEnum.IDLE);
        addVehicle("far", 600, 0, VehicleStateEnum.IDLE);

        List<BatchAllocation> result = allocationManager.allocateBatch(
                Arrays.asList(request(1, 0, 0), request(2, 100, 0)));

        assertEquals("near", result.get(0).getAllocation().get().getVehicleId());
        assertEquals("far", result.get(1).getAllocation().get().getVehicleId());
    }

    @Test
    @DisplayName("再平衡：每个需求点调派一辆未使用的最近空闲车")
    void repositionToDemandPoints() {
        addVehicle("v1", 0, 0, VehicleStateEnum.IDLE);
        addVehicle("v2", 900, 0, VehicleStateEnum.IDLE);

        List<RepositionDirective> directives = allocationManager.repositionVehicles(
                Arrays.asList(new Point(100, 0), new Point(150, 0), new Point(5000, 5000)), 10);

        assertEquals(2, directives.size());
        assertEquals("v1", directives.get(0).getVehicleId());
        assertEquals(new Point(100, 0), directives.get(0).getTarget());
        assertEquals("v2", directives.get(1).getVehicleId());
    }

    @Test
    @DisplayName("车辆已在需求点时不生成调派")
    void repositionSkipsVehicleAlreadyThere() {
        addVehicle("v1", 100, 0, VehicleStateEnum.IDLE);

        assertTrue(allocationManager.repositionVehicles(List.of(new Point(100, 0)), 10).isEmpty());
    }
}
