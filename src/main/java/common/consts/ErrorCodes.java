package common.consts;

/**
 * 全局错误信息与错误码常量池
 */
public class ErrorCodes {
    // 基础错误
    public static final String SYSTEM_ERROR = "系统内部错误";

    // 车辆错误
    public static final String VEHICLE_NOT_FOUND = "指定的车辆不存在";
    public static final String VEHICLE_ALREADY_REGISTERED = "车辆ID重复";

    //  参数错误
    public static final String INVALID_VEHICLE_STATE = "非法的车辆状态码，仅支持 01(空闲) 02(服务中) 03(离线)";
    public static final String INVALID_STEP = "推进步长必须大于0";
    public static final String INVALID_REQUEST = "订单缺少订单号、乘客、上车点或下车点";

    // 订单错误
    public static final String DUPLICATE_REQUEST = "订单号重复";
    public static final String REQUEST_NOT_FOUND = "指定的订单不存在";

    // 协议错误
    public static final String TRIGGER_NOT_HELD = "未持有波次触发器，无法发送完成通知";
}
