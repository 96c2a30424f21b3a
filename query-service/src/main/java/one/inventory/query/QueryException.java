package one.inventory.query;

import org.springframework.http.HttpStatusCode;

/**
 * 查询处理失败，携带返回给调用方的 HTTP 状态码
 */
public abstract class QueryException extends RuntimeException {

    private final HttpStatusCode status;

    protected QueryException(HttpStatusCode status, String message) {
        super(message);
        this.status = status;
    }

    protected QueryException(HttpStatusCode status, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
    }

    public HttpStatusCode getStatus() {
        return status;
    }
}
