package one.inventory.query;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * 自然语言查询编排：解析意图，再调用库存服务
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class QueryOrchestrator {

    static final String DEFAULT_REASONING = "No specific reasoning provided by LLM.";

    private final QueryInterpreter queryInterpreter;
    private final InventoryClient inventoryClient;

    public QueryResponse process(String query) {
        log.info("📝 收到查询: '{}'", query);
        try {
            InterpretedIntent intent = queryInterpreter.interpret(query);
            return execute(intent);
        } catch (QueryException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("❌ 处理查询时发生未知错误: {}", query, e);
            throw new InternalErrorException(e);
        }
    }

    QueryResponse execute(InterpretedIntent intent) {
        if (intent == null || intent.getOperation() == null) {
            throw new MalformedResponseException(
                    "LLM response is missing the 'operation' field. Received: " + intent);
        }
        String reasoning = intent.getReasoning() != null ? intent.getReasoning() : DEFAULT_REASONING;

        return switch (intent.operationKind()) {
            case READ -> read(intent.getItem(), reasoning);
            case WRITE -> write(intent.getItem(), intent.getChange(), reasoning);
            case UNSUPPORTED -> throw new UnsupportedIntentException(String.format(
                    "LLM returned an unsupported operation: '%s'. LLM Reasoning: %s", intent.getOperation(), reasoning));
        };
    }

    private QueryResponse read(String item, String reasoning) {
        Map<String, Integer> inventory = inventoryClient.getInventory();
        if (item == null || item.isEmpty()) {
            return QueryResponse.success("Successfully retrieved inventory. Reasoning: " + reasoning, inventory);
        }
        // 未知商品按 0 处理，不报错
        int count = inventory.getOrDefault(item, 0);
        return QueryResponse.success(
                String.format("Successfully retrieved inventory for %s: %d. Reasoning: %s", item, count, reasoning),
                inventory);
    }

    private QueryResponse write(String item, Integer change, String reasoning) {
        if (item == null || change == null) {
            log.warn("⚠️ 修改意图不完整 - Item: {}, Change: {}", item, change);
            throw new IncompleteIntentException(
                    "LLM failed to extract required 'item' or 'change' for POST operation. LLM Reasoning: " + reasoning);
        }
        Map<String, Integer> updated = inventoryClient.updateInventory(item, change);
        log.info("📦 库存已修改 - Item: {}, Change: {}, 当前: {}", item, change, updated);
        return QueryResponse.success(
                String.format("Successfully updated inventory for %s by %d. Reasoning: %s", item, change, reasoning),
                updated);
    }
}
