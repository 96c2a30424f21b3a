package one.inventory.store;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * 库存服务
 *
 * 内存存储，进程重启后恢复初始库存。
 * 所有修改在写锁内完成，保证库存不会被并发扣减成负数。
 */
@Slf4j
@Service
public class InventoryService {

    // 模拟库存数据库
    private final Map<InventoryItem, Integer> inventoryDatabase = new EnumMap<>(InventoryItem.class);

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    public InventoryService() {
        // 初始化库存
        for (InventoryItem item : InventoryItem.values()) {
            inventoryDatabase.put(item, item.getInitialStock());
        }
    }

    /**
     * 获取所有库存
     */
    public Map<String, Integer> getAllInventory() {
        lock.readLock().lock();
        try {
            return snapshot();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * 修改库存，change 为正表示入库，为负表示出库
     *
     * @return 修改后的全部库存
     * @throws InvalidItemException   商品不存在
     * @throws NegativeStockException 修改后库存小于 0
     * @throws InvalidChangeException 修改后库存超出 int 范围
     */
    public Map<String, Integer> updateInventory(String itemName, int change) {
        InventoryItem item = InventoryItem.fromName(itemName)
                .orElseThrow(() -> {
                    log.warn("⚠️ [库存] 商品不存在 - Item: {}", itemName);
                    return new InvalidItemException(itemName);
                });

        lock.writeLock().lock();
        try {
            int currentStock = inventoryDatabase.get(item);
            int newStock;
            try {
                newStock = Math.addExact(currentStock, change);
            } catch (ArithmeticException e) {
                log.warn("⚠️ [库存] 库存溢出 - Item: {}, 当前: {}, 变化: {}", item.getItemName(), currentStock, change);
                throw new InvalidChangeException(item.getItemName(), currentStock, change);
            }

            if (newStock < 0) {
                log.warn("⚠️ [库存] 库存不足 - Item: {}, 当前: {}, 变化: {}", item.getItemName(), currentStock, change);
                throw new NegativeStockException(item.getItemName(), currentStock, change);
            }

            inventoryDatabase.put(item, newStock);
            log.info("📦 [库存] 修改成功 - Item: {}, Change: {}, 当前: {}", item.getItemName(), change, newStock);
            return snapshot();
        } finally {
            lock.writeLock().unlock();
        }
    }

    private Map<String, Integer> snapshot() {
        Map<String, Integer> result = new LinkedHashMap<>();
        inventoryDatabase.forEach((item, stock) -> result.put(item.getItemName(), stock));
        return result;
    }
}
