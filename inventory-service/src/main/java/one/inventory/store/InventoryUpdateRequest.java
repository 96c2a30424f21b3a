package one.inventory.store;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * POST /inventory 请求体
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class InventoryUpdateRequest {

    /**
     * 商品名称：tshirts 或 pants（忽略大小写）
     */
    @NotNull(message = "item is required")
    private String item;

    /**
     * 库存变化量，正数入库，负数出库
     */
    @NotNull(message = "change is required")
    private Integer change;
}
