package one.inventory.query;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * POST /process_query 请求体
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class QueryRequest {

    /**
     * 自然语言查询，例如 "I sold 3 t shirts"
     */
    @NotBlank(message = "query is required")
    private String query;
}
