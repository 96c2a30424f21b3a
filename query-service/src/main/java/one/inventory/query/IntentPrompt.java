package one.inventory.query;

import java.util.List;
import java.util.Map;

/**
 * 发给语言模型的提示词与响应 schema
 */
public final class IntentPrompt {

    private static final String QUERY_PLACEHOLDER = "{user_query}";

    private static final String TEMPLATE = """
            You are an intelligent assistant that converts natural language inventory requests into structured JSON commands for an Inventory Management System.
            The inventory system manages only two items: 'tshirts' and 'pants'.

            Your task is to determine the 'operation' (GET or POST), the 'item' (if applicable), and the 'change' amount (if applicable) based on the user's query.
            If the operation is 'GET', 'change' should be null; 'item' is set only when the user asks about one specific item.
            If the operation is 'POST', 'item' and 'change' are required.
            Always provide a 'reasoning' for your decision.

            Here are some examples:

            User Query: "I sold 3 t shirts"
            JSON Response: {"operation": "POST", "item": "tshirts", "change": -3, "reasoning": "User indicates selling, which means reducing stock. Item is 'tshirts', amount is 3."}

            User Query: "Add 5 pants"
            JSON Response: {"operation": "POST", "item": "pants", "change": 5, "reasoning": "User indicates adding stock. Item is 'pants', amount is 5."}

            User Query: "How many pants and shirts do I have?"
            JSON Response: {"operation": "GET", "item": null, "change": null, "reasoning": "User is asking for current stock levels, which is a GET operation."}

            User Query: "What's the stock of tshirts?"
            JSON Response: {"operation": "GET", "item": "tshirts", "change": null, "reasoning": "User is asking for the stock of a specific item, which is a GET operation."}

            User Query: "Increase tshirts by 10"
            JSON Response: {"operation": "POST", "item": "tshirts", "change": 10, "reasoning": "User wants to increase stock. Item is 'tshirts', amount is 10."}

            User Query: "Reduce pants by 2"
            JSON Response: {"operation": "POST", "item": "pants", "change": -2, "reasoning": "User wants to reduce stock. Item is 'pants', amount is 2."}

            User Query: "Check inventory"
            JSON Response: {"operation": "GET", "item": null, "change": null, "reasoning": "User is asking for general inventory status, which is a GET operation."}

            User Query: "{user_query}"
            JSON Response:
            """;

    /**
     * 约束语言模型输出结构
     */
    public static final Map<String, Object> RESPONSE_SCHEMA = Map.of(
            "type", "OBJECT",
            "properties", Map.of(
                    "operation", Map.of("type", "STRING", "enum", List.of("GET", "POST")),
                    "item", Map.of("type", "STRING", "enum", List.of("tshirts", "pants"), "nullable", true),
                    "change", Map.of("type", "INTEGER", "nullable", true),
                    "reasoning", Map.of("type", "STRING")
            ),
            "required", List.of("operation", "reasoning")
    );

    private IntentPrompt() {
    }

    public static String render(String query) {
        return TEMPLATE.replace(QUERY_PLACEHOLDER, query);
    }
}
