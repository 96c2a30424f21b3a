package one.inventory.query;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 库存服务地址配置
 */
@Data
@ConfigurationProperties(prefix = "inventory.client")
public class InventoryClientProperties {

    private String baseUrl = "http://localhost:8000";
}
