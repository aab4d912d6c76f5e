package model.dto.allocation;

import lombok.Value;
import model.entity.RideHailRequest;

import java.util.Optional;

/**
 * 批量分配中的一项，未匹配的订单 allocation 为空
 */
@Value
public class BatchAllocation {
    RideHailRequest request;
    Optional<VehicleAllocation> allocation;
}
