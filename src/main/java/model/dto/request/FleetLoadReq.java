package model.dto.request;

import lombok.Data;

import java.util.List;

/**
 * 车队装载请求体
 */
@Data
public class FleetLoadReq {

    private List<VehicleSpec> vehicles;

    @Data
    public static class VehicleSpec {
        private String id;
        private double posX;
        private double posY;
        private String stateCode;   // 空则为 01(空闲)
    }
}
