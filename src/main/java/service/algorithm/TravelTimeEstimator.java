package service.algorithm;

import model.entity.Point;
import model.schedule.Leg;

/**
 * 行驶耗时估算服务接口
 * 真实路网的路径搜索不在本服务范围内，调度只依赖这里给出的耗时与路段。
 */
public interface TravelTimeEstimator {

    /**
     * 估算两点间的行驶耗时
     * @param from 起点
     * @param to 终点
     * @return 耗时 (秒)，不小于 0
     */
    long estimateTravelTimeSec(Point from, Point to);

    /**
     * 按估算耗时生成一段从 departureTick 出发的路段
     */
    default Leg planLeg(Point from, Point to, long departureTick) {
        return new Leg(departureTick, estimateTravelTimeSec(from, to), from, to);
    }
}
