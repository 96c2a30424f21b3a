package one.inventory.query;

import org.springframework.http.HttpStatus;

/**
 * 语言模型给出了不支持的操作
 */
public class UnsupportedIntentException extends QueryException {

    public UnsupportedIntentException(String message) {
        super(HttpStatus.BAD_REQUEST, message);
    }
}
