package common.util;

import model.entity.Point;

public class GisUtil {

    /**
     * 计算两点间的距离
     */
    public static double getDistance(Point p1, Point p2) {
        return Math.hypot(p1.getX() - p2.getX(), p1.getY() - p2.getY());
    }

    /**
     * 按比例在线段上取点 (相似三角形)
     * @param ratio 0 表示起点, 1 表示终点
     */
    public static Point interpolate(Point from, Point to, double ratio) {
        double newX = from.getX() + (to.getX() - from.getX()) * ratio;
        double newY = from.getY() + (to.getY() - from.getY()) * ratio;
        return new Point(newX, newY);
    }

    /**
     * 直线行驶耗时 (秒，向上取整)
     * @param speed 速度 (米/秒)
     */
    public static long calculateTravelTimeSec(Point from, Point to, double speed) {
        if (speed <= 0) {
            throw new IllegalArgumentException("speed 必须大于0");
        }
        return (long) Math.ceil(getDistance(from, to) / speed);
    }
}
