package one.inventory.query;

import org.springframework.http.HttpStatus;

/**
 * 修改库存的意图缺少 item 或 change
 */
public class IncompleteIntentException extends QueryException {

    public IncompleteIntentException(String message) {
        super(HttpStatus.BAD_REQUEST, message);
    }
}
