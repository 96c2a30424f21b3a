package one.inventory.query;

import org.springframework.http.HttpStatusCode;

/**
 * 下游服务返回了非 2xx 状态码，原样透传该状态码
 */
public class UpstreamErrorException extends QueryException {

    public UpstreamErrorException(HttpStatusCode status, String message, Throwable cause) {
        super(status, message, cause);
    }
}
