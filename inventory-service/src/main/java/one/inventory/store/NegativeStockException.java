package one.inventory.store;

/**
 * 修改后库存小于 0，库存保持不变
 */
public class NegativeStockException extends RuntimeException {

    public NegativeStockException(String item, int currentStock, int change) {
        super(String.format("Cannot reduce '%s' stock below zero. Current: %d, Attempted change: %d",
                item, currentStock, change));
    }
}
