package one.inventory.store;

import java.util.Locale;
import java.util.Optional;

/**
 * 库存商品（固定集合，不支持动态新增）
 */
public enum InventoryItem {
    TSHIRTS("tshirts", 20),
    PANTS("pants", 15);

    private final String itemName;
    private final int initialStock;

    InventoryItem(String itemName, int initialStock) {
        this.itemName = itemName;
        this.initialStock = initialStock;
    }

    public String getItemName() {
        return itemName;
    }

    public int getInitialStock() {
        return initialStock;
    }

    /**
     * 按名称查找商品，忽略大小写
     */
    public static Optional<InventoryItem> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.toLowerCase(Locale.ROOT);
        for (InventoryItem item : values()) {
            if (item.itemName.equals(normalized)) {
                return Optional.of(item);
            }
        }
        return Optional.empty();
    }

    /**
     * 支持的商品名称列表，用于错误提示
     */
    public static String supportedNames() {
        StringBuilder sb = new StringBuilder();
        InventoryItem[] items = values();
        for (int i = 0; i < items.length; i++) {
            if (i > 0) {
                sb.append(i == items.length - 1 ? " and " : ", ");
            }
            sb.append('\'').append(items[i].itemName).append('\'');
        }
        return sb.toString();
    }
}
