package model.dto.request;

import lombok.Data;
import model.entity.Point;

@Data
public class RideHailRequestReq {
    private Long requestId;          // 订单号
    private String personId;         // 乘客
    private String personVehicleId;  // 乘客自身的载具ID (空则使用 body-{personId})
    private Point pickup;            // 上车点
    private Point dropoff;           // 下车点
}
