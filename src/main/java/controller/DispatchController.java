package controller;

import common.Result;
import common.consts.ErrorCodes;
import common.exception.BusinessException;
import engine.TriggerScheduler;
import model.dto.request.RideHailRequestReq;
import model.entity.RideHailRequest;
import model.schedule.PassengerRef;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import service.dispatch.RideHailDispatchService;
import service.reservation.ReservationService;

@RestController
@RequestMapping("/dispatch")
public class DispatchController {

    private final RideHailDispatchService dispatchService;
    private final ReservationService reservationService;
    private final TriggerScheduler scheduler;

    public DispatchController(RideHailDispatchService dispatchService, ReservationService reservationService,
                              TriggerScheduler scheduler) {
        this.dispatchService = dispatchService;
        this.reservationService = reservationService;
        this.scheduler = scheduler;
    }

    // 单笔订单：立即选车 POST /dispatch/reserve
    @PostMapping("/reserve")
    public Result reserve(@RequestBody RideHailRequestReq req) {
        return Result.success("订单已受理", dispatchService.reserve(toRequest(req)));
    }

    // 缓冲订单：等待下一个批量波次 POST /dispatch/buffer
    @PostMapping("/buffer")
    public Result buffer(@RequestBody RideHailRequestReq req) {
        return Result.success("订单已缓冲", dispatchService.bufferRequest(toRequest(req)));
    }

    @GetMapping("/reservations")
    public Result listReservations() {
        return Result.success("查询成功", reservationService.list());
    }

    private RideHailRequest toRequest(RideHailRequestReq req) {
        if (req.getRequestId() == null || req.getPersonId() == null) {
            throw new BusinessException(ErrorCodes.INVALID_REQUEST);
        }
        String bodyVehicleId = req.getPersonVehicleId() != null ? req.getPersonVehicleId() : "body-" + req.getPersonId();
        return new RideHailRequest(req.getRequestId(), new PassengerRef(bodyVehicleId, req.getPersonId()),
                req.getPickup(), req.getDropoff(), scheduler.getNowTick());
    }
}
