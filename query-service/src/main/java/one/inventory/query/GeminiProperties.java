package one.inventory.query;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Gemini API 配置
 */
@Data
@ConfigurationProperties(prefix = "gemini")
public class GeminiProperties {

    /**
     * API Key，默认取环境变量 GEMINI_API_KEY，为空时语言模型功能不可用
     */
    private String apiKey;

    private String baseUrl = "https://generativelanguage.googleapis.com";

    private String model = "gemini-2.0-flash";

    /**
     * 连接与读取超时
     */
    private Duration timeout = Duration.ofSeconds(30);

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }
}
