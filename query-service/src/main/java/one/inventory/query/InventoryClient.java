package one.inventory.query;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

import java.util.Map;
import java.util.function.Supplier;

/**
 * 库存服务 HTTP 客户端
 */
@Slf4j
@Component
public class InventoryClient {

    private static final ParameterizedTypeReference<Map<String, Integer>> INVENTORY_TYPE =
            new ParameterizedTypeReference<>() {
            };

    private static final String NO_DETAIL = "No specific error detail from Inventory Service.";

    private final InventoryClientProperties properties;
    private final RestClient restClient;
    private final ObjectMapper objectMapper;

    public InventoryClient(InventoryClientProperties properties,
                           @Qualifier("inventoryRestClient") RestClient restClient,
                           ObjectMapper objectMapper) {
        this.properties = properties;
        this.restClient = restClient;
        this.objectMapper = objectMapper;
    }

    /**
     * GET /inventory
     */
    public Map<String, Integer> getInventory() {
        return call(() -> restClient.get()
                .uri("/inventory")
                .retrieve()
                .body(INVENTORY_TYPE));
    }

    /**
     * POST /inventory
     */
    public Map<String, Integer> updateInventory(String item, int change) {
        return call(() -> restClient.post()
                .uri("/inventory")
                .contentType(MediaType.APPLICATION_JSON)
                .body(new InventoryChange(item, change))
                .retrieve()
                .body(INVENTORY_TYPE));
    }

    private Map<String, Integer> call(Supplier<Map<String, Integer>> request) {
        try {
            return request.get();
        } catch (ResourceAccessException e) {
            log.error("❌ 无法连接库存服务 {}: {}", properties.getBaseUrl(), e.getMessage());
            throw new UpstreamUnavailableException(String.format("Failed to connect to Inventory Service at %s: %s",
                    properties.getBaseUrl(), e.getMessage()), e);
        } catch (RestClientResponseException e) {
            int status = e.getStatusCode().value();
            log.warn("⚠️ 库存服务返回错误: {} - {}", status, e.getResponseBodyAsString());
            throw new UpstreamErrorException(e.getStatusCode(),
                    String.format("Inventory Service returned an error: %s (HTTP %d)", detailOf(e), status), e);
        }
    }

    private String detailOf(RestClientResponseException e) {
        try {
            JsonNode detail = objectMapper.readTree(e.getResponseBodyAsString()).path("detail");
            return detail.isTextual() ? detail.asText() : NO_DETAIL;
        } catch (JsonProcessingException parseError) {
            log.warn("⚠️ 库存服务错误响应不是 JSON: {}", e.getResponseBodyAsString());
            return NO_DETAIL;
        }
    }
}
