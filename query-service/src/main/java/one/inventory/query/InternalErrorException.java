package one.inventory.query;

import org.springframework.http.HttpStatus;

public class InternalErrorException extends QueryException {

    public InternalErrorException(Throwable cause) {
        super(HttpStatus.INTERNAL_SERVER_ERROR,
                String.format("An unexpected error occurred: %s: %s", cause.getClass().getSimpleName(), cause.getMessage()),
                cause);
    }
}
