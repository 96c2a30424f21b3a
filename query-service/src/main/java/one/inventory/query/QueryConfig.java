package one.inventory.query;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
public class QueryConfig {

    @Bean
    public RestClient geminiRestClient(RestClient.Builder builder, GeminiProperties properties) {
        // 超出 int 范围直接启动失败，不做截断
        int timeoutMillis = Math.toIntExact(properties.getTimeout().toMillis());
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(timeoutMillis);
        requestFactory.setReadTimeout(timeoutMillis);
        return builder
                .baseUrl(properties.getBaseUrl())
                .requestFactory(requestFactory)
                .build();
    }

    @Bean
    public RestClient inventoryRestClient(RestClient.Builder builder, InventoryClientProperties properties) {
        return builder
                .baseUrl(properties.getBaseUrl())
                .build();
    }
}
