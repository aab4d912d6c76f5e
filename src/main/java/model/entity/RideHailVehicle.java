package model.entity;

import com.fasterxml.jackson.annotation.JsonIgnore;
import common.consts.VehicleStateEnum;
import engine.agent.VehicleAgentRef;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 网约车实体：车队状态跟踪器中的一条记录
 * 状态与坐标会被车辆代理线程写入、被调度线程读取
 */
@Data
@NoArgsConstructor
public class RideHailVehicle {

    //  基础信息
    private String id;
    private volatile VehicleStateEnum state = VehicleStateEnum.IDLE;

    //  最近一次上报的位置
    private volatile double posX;
    private volatile double posY;
    private volatile long lastUpdateTick;

    // 对应的车辆代理
    @JsonIgnore
    private VehicleAgentRef agent;

    public RideHailVehicle(String id, VehicleStateEnum state, Point location, VehicleAgentRef agent) {
        this.id = id;
        this.state = state;
        this.posX = location.getX();
        this.posY = location.getY();
        this.agent = agent;
    }

    @JsonIgnore
    public Point getLocation() {
        return new Point(posX, posY);
    }
}
