package service.reservation;

import common.config.DispatchConfig;
import common.consts.ErrorCodes;
import common.consts.ReservationStatusEnum;
import common.exception.BusinessException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import model.entity.Point;
import model.entity.RideHailRequest;
import org.springframework.stereotype.Service;
import service.dispatch.ReservationFailureListener;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 订单子系统
 *
 * 维护订单状态与缓冲队列；计划修改失败后的重试策略只在这里决定。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReservationService implements ReservationFailureListener {

    private final DispatchConfig dispatchConfig;

    private final Map<Long, RideHailRequest> requestMap = new LinkedHashMap<>();
    private final List<RideHailRequest> bufferedRequests = new ArrayList<>();
    // 未能匹配到车辆的上车点，供再平衡使用
    private final List<Point> unservedPickups = new ArrayList<>();

    /**
     * 登记订单
     */
    public synchronized RideHailRequest submit(RideHailRequest request) {
        if (request.getPickup() == null || request.getDropoff() == null) {
            throw new BusinessException(ErrorCodes.INVALID_REQUEST);
        }
        if (requestMap.containsKey(request.getRequestId())) {
            throw new BusinessException(ErrorCodes.DUPLICATE_REQUEST + ": " + request.getRequestId());
        }
        requestMap.put(request.getRequestId(), request);
        return request;
    }

    /**
     * 放入缓冲队列，等待下一个批量分配波次
     */
    public synchronized void buffer(RideHailRequest request) {
        request.setStatus(ReservationStatusEnum.BUFFERED);
        request.setAssignedVehicleId(null);
        bufferedRequests.add(request);
    }

    /**
     * 取出全部缓冲订单，按进入缓冲的顺序
     */
    public synchronized List<RideHailRequest> drainBuffered() {
        List<RideHailRequest> drained = new ArrayList<>(bufferedRequests);
        bufferedRequests.clear();
        return drained;
    }

    public synchronized int getBufferedCount() {
        return bufferedRequests.size();
    }

    public synchronized void markPending(long requestId, String vehicleId) {
        RideHailRequest request = require(requestId);
        request.setStatus(ReservationStatusEnum.PENDING);
        request.setAssignedVehicleId(vehicleId);
    }

    public synchronized void confirm(long requestId, String vehicleId) {
        RideHailRequest request = requestMap.get(requestId);
        if (request == null) {
            log.warn("确认未知订单 {}，车辆 {}", requestId, vehicleId);
            return;
        }
        request.setStatus(ReservationStatusEnum.CONFIRMED);
        request.setAssignedVehicleId(vehicleId);
        log.info("订单 {} 已由车辆 {} 确认", requestId, vehicleId);
    }

    /**
     * 半径内无空闲车辆
     */
    public synchronized void markUnmatched(long requestId) {
        RideHailRequest request = require(requestId);
        request.setStatus(ReservationStatusEnum.UNMATCHED);
        request.setAssignedVehicleId(null);
        unservedPickups.add(request.getPickup());
        log.info("订单 {} 未匹配到车辆", requestId);
    }

    @Override
    public synchronized void onReservationModificationFailed(long reservationRequestId, String vehicleId, long tick) {
        RideHailRequest request = requestMap.get(reservationRequestId);
        if (request == null) {
            log.warn("计划修改失败的订单 {} 不存在", reservationRequestId);
            return;
        }
        if (request.getRetryCount() < dispatchConfig.getMaxReservationRetries()) {
            request.setRetryCount(request.getRetryCount() + 1);
            log.info("订单 {} 因车辆 {} 离线修改失败，第 {} 次重新缓冲 @ {}",
                    reservationRequestId, vehicleId, request.getRetryCount(), tick);
            buffer(request);
        } else {
            request.setStatus(ReservationStatusEnum.FAILED);
            request.setAssignedVehicleId(null);
            log.warn("订单 {} 重试 {} 次仍失败 @ {}", reservationRequestId, request.getRetryCount(), tick);
        }
    }

    /**
     * 取出最近未被服务的上车点
     */
    public synchronized List<Point> drainUnservedPickups() {
        List<Point> drained = new ArrayList<>(unservedPickups);
        unservedPickups.clear();
        return drained;
    }

    public synchronized RideHailRequest get(long requestId) {
        return requestMap.get(requestId);
    }

    public synchronized List<RideHailRequest> list() {
        return requestMap.values().stream()
                .sorted(Comparator.comparingLong(RideHailRequest::getRequestId))
                .collect(Collectors.toList());
    }

    /**
     * 场景重置
     */
    public synchronized void clearAll() {
        requestMap.clear();
        bufferedRequests.clear();
        unservedPickups.clear();
    }

    private RideHailRequest require(long requestId) {
        RideHailRequest request = requestMap.get(requestId);
        if (request == null) {
            throw new BusinessException(ErrorCodes.REQUEST_NOT_FOUND + ": " + requestId);
        }
        return request;
    }
}
