package model.dto.request;

import lombok.Data;

@Data
public class VehicleStateReq {
    private String vehicleId;
    private String stateCode;    // 01 空闲 / 02 服务中 / 03 离线
}
