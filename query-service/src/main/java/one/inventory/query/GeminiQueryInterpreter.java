package one.inventory.query;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

import java.util.List;
import java.util.Map;

/**
 * 基于 Gemini generateContent 接口的意图解析
 */
@Slf4j
@Component
public class GeminiQueryInterpreter implements QueryInterpreter {

    private static final String GENERATE_CONTENT_PATH = "/v1beta/models/{model}:generateContent?key={key}";

    private final GeminiProperties properties;
    private final RestClient restClient;
    private final ObjectMapper objectMapper;

    public GeminiQueryInterpreter(GeminiProperties properties,
                                  @Qualifier("geminiRestClient") RestClient restClient,
                                  ObjectMapper objectMapper) {
        this.properties = properties;
        this.restClient = restClient;
        this.objectMapper = objectMapper;
    }

    @PostConstruct
    void init() {
        if (!properties.hasApiKey()) {
            log.warn("⚠️ GEMINI_API_KEY 未设置，自然语言查询将不可用。请通过环境变量 GEMINI_API_KEY 配置，"
                    + "Key 可在 https://aistudio.google.com/app/apikey 获取");
        } else {
            log.info("Gemini 意图解析已启用 - Model: {}, Timeout: {}", properties.getModel(), properties.getTimeout());
        }
    }

    @Override
    public InterpretedIntent interpret(String query) {
        if (!properties.hasApiKey()) {
            throw new ConfigurationException(
                    "Gemini API key is not configured. Please set the GEMINI_API_KEY environment variable.");
        }

        String rawResult = callGenerateContent(IntentPrompt.render(query));
        log.debug("Gemini 原始返回: {}", rawResult);

        String intentText = extractText(rawResult);
        log.debug("Gemini 意图文本: {}", intentText);

        InterpretedIntent intent = parseIntent(intentText);
        log.info("🤖 意图解析完成 - Query: {}, Intent: {}", query, intent);
        return intent;
    }

    private String callGenerateContent(String prompt) {
        Map<String, Object> payload = Map.of(
                "contents", List.of(Map.of(
                        "role", "user",
                        "parts", List.of(Map.of("text", prompt)))),
                "generationConfig", Map.of(
                        "responseMimeType", "application/json",
                        "responseSchema", IntentPrompt.RESPONSE_SCHEMA));

        try {
            return restClient.post()
                    .uri(GENERATE_CONTENT_PATH, properties.getModel(), properties.getApiKey())
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(payload)
                    .retrieve()
                    .body(String.class);
        } catch (ResourceAccessException e) {
            log.error("❌ 无法连接 Gemini API: {}", e.getMessage());
            throw new UpstreamUnavailableException("Failed to connect to Gemini API: " + e.getMessage(), e);
        } catch (RestClientResponseException e) {
            log.error("❌ Gemini API 返回错误: {} - {}", e.getStatusCode().value(), e.getResponseBodyAsString());
            throw new UpstreamErrorException(e.getStatusCode(),
                    "Gemini API returned an error: " + e.getResponseBodyAsString(), e);
        }
    }

    /**
     * 取 candidates[0].content.parts[0].text
     */
    private String extractText(String rawResult) {
        JsonNode root;
        try {
            root = objectMapper.readTree(rawResult == null ? "" : rawResult);
        } catch (JsonProcessingException e) {
            throw new MalformedResponseException("Gemini API returned a body that is not valid JSON. Raw result: " + rawResult, e);
        }

        JsonNode text = root == null ? null : root.path("candidates").path(0).path("content").path("parts").path(0).path("text");
        if (text == null || !text.isTextual()) {
            log.error("❌ Gemini 返回结构缺少 candidates 内容: {}", rawResult);
            throw new MalformedResponseException(
                    "LLM response did not contain expected content structure. Raw result: " + rawResult);
        }
        return text.asText();
    }

    /**
     * 严格校验字段类型，结构不符直接拒绝
     */
    InterpretedIntent parseIntent(String intentText) {
        JsonNode node;
        try {
            node = objectMapper.readTree(intentText);
        } catch (JsonProcessingException e) {
            log.error("❌ 意图文本不是合法 JSON: {}", intentText);
            throw new MalformedResponseException(
                    "Failed to parse JSON response from LLM. LLM returned malformed JSON. Raw text: " + intentText, e);
        }
        if (node == null || !node.isObject()) {
            throw new MalformedResponseException("LLM response is not a JSON object. Raw text: " + intentText);
        }

        InterpretedIntent intent = new InterpretedIntent();
        intent.setOperation(optionalText(node, "operation", intentText));
        intent.setItem(optionalText(node, "item", intentText));
        intent.setReasoning(optionalText(node, "reasoning", intentText));

        JsonNode change = node.get("change");
        if (change != null && !change.isNull()) {
            if (!change.isIntegralNumber() || !change.canConvertToInt()) {
                throw new MalformedResponseException("LLM returned a non-integer 'change'. Raw text: " + intentText);
            }
            intent.setChange(change.intValue());
        }
        return intent;
    }

    private String optionalText(JsonNode node, String field, String intentText) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isTextual()) {
            throw new MalformedResponseException(
                    String.format("LLM returned a non-string '%s'. Raw text: %s", field, intentText));
        }
        return value.asText();
    }
}
