package model.schedule;

import common.util.GisUtil;
import lombok.Value;
import model.entity.Point;

import java.util.Comparator;

/**
 * 车辆行驶的一段路程
 * 路径几何由外部路由引擎给出，这里只保留起止点与时间窗
 */
@Value
public class Leg implements Comparable<Leg> {

    // 排序键：先按出发时间，再按时长；起止点仅用于区分同一时间窗内的不同路段
    private static final Comparator<Leg> ORDER = Comparator
            .comparingLong(Leg::getStartTime)
            .thenComparingLong(Leg::getDuration)
            .thenComparingDouble(l -> l.getStartPoint().getX())
            .thenComparingDouble(l -> l.getStartPoint().getY())
            .thenComparingDouble(l -> l.getEndPoint().getX())
            .thenComparingDouble(l -> l.getEndPoint().getY());

    long startTime;     // 出发时刻 (仿真秒)
    long duration;      // 行驶耗时 (秒)
    Point startPoint;
    Point endPoint;

    public long getEndTime() {
        return startTime + duration;
    }

    /**
     * 线性插值得到 tick 时刻在本路段上的位置
     */
    public Point positionAt(long tick) {
        if (tick <= startTime) {
            return startPoint;
        }
        if (tick >= getEndTime()) {
            return endPoint;
        }
        double ratio = (double) (tick - startTime) / duration;
        return GisUtil.interpolate(startPoint, endPoint, ratio);
    }

    @Override
    public int compareTo(Leg other) {
        return ORDER.compare(this, other);
    }
}
