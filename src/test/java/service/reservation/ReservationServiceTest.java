package service.reservation;

import common.config.DispatchConfig;
import common.consts.ReservationStatusEnum;
import common.exception.BusinessException;
import model.entity.Point;
import model.entity.RideHailRequest;
import model.schedule.PassengerRef;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("订单子系统测试")
class ReservationServiceTest {

    private DispatchConfig config;
    private ReservationService reservationService;

    @BeforeEach
    void setUp() {
        config = new DispatchConfig();
        config.setMaxReservationRetries(1);
        reservationService = new ReservationService(config);
    }

    private RideHailRequest request(long id) {
        return new RideHailRequest(id, new PassengerRef("body-" + id, "p" + id), new Point(id, 0), new Point(id, 100), 0);
    }

    @Test
    @DisplayName("缓冲订单按进入顺序取出，取出后清空")
    void drainBufferedInOrder() {
        RideHailRequest first = reservationService.submit(request(2));
        RideHailRequest second = reservationService.submit(request(1));
        reservationService.buffer(first);
        reservationService.buffer(second);

        List<RideHailRequest> drained = reservationService.drainBuffered();
        assertEquals(2, drained.size());
        assertSame(first, drained.get(0));
        assertEquals(ReservationStatusEnum.BUFFERED, drained.get(1).getStatus());
        assertTrue(reservationService.drainBuffered().isEmpty());
    }

    @Test
    @DisplayName("修改失败后重新缓冲，超过重试次数则失败")
    void failureRetriesThenFails() {
        RideHailRequest req = reservationService.submit(request(5));
        reservationService.markPending(5, "v1");

        reservationService.onReservationModificationFailed(5, "v1", 10);
        assertEquals(ReservationStatusEnum.BUFFERED, req.getStatus());
        assertEquals(1, req.getRetryCount());
        assertNull(req.getAssignedVehicleId());
        assertEquals(1, reservationService.getBufferedCount());

        reservationService.drainBuffered();
        reservationService.markPending(5, "v2");
        reservationService.onReservationModificationFailed(5, "v2", 70);
        assertEquals(ReservationStatusEnum.FAILED, req.getStatus());
        assertEquals(0, reservationService.getBufferedCount());
    }

    @Test
    @DisplayName("未匹配订单的上车点进入再平衡需求")
    void unmatchedPickupFeedsReposition() {
        reservationService.submit(request(3));
        reservationService.markUnmatched(3);

        assertEquals(List.of(new Point(3, 0)), reservationService.drainUnservedPickups());
        assertTrue(reservationService.drainUnservedPickups().isEmpty());
    }

    @Test
    @DisplayName("确认订单记录分配车辆")
    void confirmAssignsVehicle() {
        RideHailRequest req = reservationService.submit(request(4));
        reservationService.confirm(4, "v9");

        assertEquals(ReservationStatusEnum.CONFIRMED, req.getStatus());
        assertEquals("v9", req.getAssignedVehicleId());
    }

    @Test
    @DisplayName("重复订单号与缺少上车点的订单被拒绝")
    void invalidSubmissionsRejected() {
        reservationService.submit(request(1));
        assertThrows(BusinessException.class, () -> reservationService.submit(request(1)));

        RideHailRequest noPickup = request(2);
        noPickup.setPickup(null);
        assertThrows(BusinessException.class, () -> reservationService.submit(noPickup));
    }
}
