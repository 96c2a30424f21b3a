package one.inventory.store;

/**
 * 修改后库存超出可表示范围
 */
public class InvalidChangeException extends RuntimeException {

    public InvalidChangeException(String item, int currentStock, int change) {
        super(String.format("Cannot apply change to '%s': resulting stock is out of range. Current: %d, Attempted change: %d",
                item, currentStock, change));
    }
}
