package one.inventory.query;

import org.springframework.http.HttpStatus;

/**
 * 语言模型返回内容无法解析为意图
 */
public class MalformedResponseException extends QueryException {

    public MalformedResponseException(String message) {
        super(HttpStatus.INTERNAL_SERVER_ERROR, message);
    }

    public MalformedResponseException(String message, Throwable cause) {
        super(HttpStatus.INTERNAL_SERVER_ERROR, message, cause);
    }
}
