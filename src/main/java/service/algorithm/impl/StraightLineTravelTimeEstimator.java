package service.algorithm.impl;

import common.config.DispatchConfig;
import common.util.GisUtil;
import lombok.RequiredArgsConstructor;
import model.entity.Point;
import org.springframework.stereotype.Service;
import service.algorithm.TravelTimeEstimator;

/**
 * 直线距离 / 配置车速
 */
@Service
@RequiredArgsConstructor
public class StraightLineTravelTimeEstimator implements TravelTimeEstimator {

    private final DispatchConfig dispatchConfig;

    @Override
    public long estimateTravelTimeSec(Point from, Point to) {
        return GisUtil.calculateTravelTimeSec(from, to, dispatchConfig.getVehicleSpeed());
    }
}
