package one.inventory.query;

import org.springframework.http.HttpStatus;

/**
 * 缺少语言模型 API Key
 */
public class ConfigurationException extends QueryException {

    public ConfigurationException(String message) {
        super(HttpStatus.INTERNAL_SERVER_ERROR, message);
    }
}
