package one.inventory.store;

/**
 * 商品不在支持的集合内
 */
public class InvalidItemException extends RuntimeException {

    public InvalidItemException(String item) {
        super(String.format("Invalid item: '%s'. Only %s are supported.", item, InventoryItem.supportedNames()));
    }
}
