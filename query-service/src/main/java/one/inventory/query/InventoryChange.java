package one.inventory.query;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 发往库存服务的修改请求
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class InventoryChange {
    private String item;
    private Integer change;
}
