package one.inventory.query;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * POST /process_query 响应体
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class QueryResponse {

    private String message;

    @JsonProperty("inventory_state")
    private Map<String, Integer> inventoryState;

    private String error;

    public static QueryResponse success(String message, Map<String, Integer> inventoryState) {
        return new QueryResponse(message, inventoryState, null);
    }
}
