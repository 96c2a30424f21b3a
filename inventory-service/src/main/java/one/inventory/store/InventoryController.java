package one.inventory.store;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/inventory")
@RequiredArgsConstructor
public class InventoryController {

    private final InventoryService inventoryService;

    /**
     * 查询当前库存
     */
    @GetMapping
    public Map<String, Integer> getInventory() {
        return inventoryService.getAllInventory();
    }

    /**
     * 修改库存
     *
     * 商品不存在或库存不足时返回 400，由 {@link InventoryExceptionHandler} 处理
     */
    @PostMapping
    public Map<String, Integer> updateInventory(@Valid @RequestBody InventoryUpdateRequest request) {
        log.info("📝 修改库存请求 - Item: {}, Change: {}", request.getItem(), request.getChange());
        return inventoryService.updateInventory(request.getItem(), request.getChange());
    }
}
