package one.inventory.query;

import org.springframework.http.HttpStatus;

/**
 * 无法连接下游服务（语言模型或库存服务），包括超时
 */
public class UpstreamUnavailableException extends QueryException {

    public UpstreamUnavailableException(String message, Throwable cause) {
        super(HttpStatus.SERVICE_UNAVAILABLE, message, cause);
    }
}
