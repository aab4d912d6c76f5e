package common.exception;

/**
 * 业务异常 由调用方参数或状态错误引起
 */
public class BusinessException extends RuntimeException {

    public BusinessException(String message) {
        super(message);
    }
}
