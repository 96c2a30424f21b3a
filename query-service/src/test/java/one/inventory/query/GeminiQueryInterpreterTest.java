package one.inventory.query;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.net.SocketTimeoutException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.hamcrest.Matchers.containsString;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withException;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class GeminiQueryInterpreterTest {

    private static final String ENDPOINT =
            "https://gemini.test/v1beta/models/gemini-2.0-flash:generateContent?key=test-key";

    private MockRestServiceServer server;
    private GeminiProperties properties;
    private GeminiQueryInterpreter interpreter;

    @BeforeEach
    void setUp() {
        properties = new GeminiProperties();
        properties.setApiKey("test-key");
        properties.setBaseUrl("https://gemini.test");

        RestClient.Builder builder = RestClient.builder().baseUrl(properties.getBaseUrl());
        server = MockRestServiceServer.bindTo(builder).build();
        interpreter = new GeminiQueryInterpreter(properties, builder.build(), new ObjectMapper());
    }

    private static String candidate(String text) throws Exception {
        ObjectMapper mapper = new ObjectMapper();
        return "{\"candidates\":[{\"content\":{\"parts\":[{\"text\":" + mapper.writeValueAsString(text) + "}]}}]}";
    }

    @Test
    void sends_prompt_with_schema_and_parses_intent() throws Exception {
        server.expect(requestTo(ENDPOINT))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.contents[0].role").value("user"))
                .andExpect(jsonPath("$.contents[0].parts[0].text", containsString("User Query: \"I sold 3 t shirts\"")))
                .andExpect(jsonPath("$.generationConfig.responseMimeType").value("application/json"))
                .andExpect(jsonPath("$.generationConfig.responseSchema.required[0]").value("operation"))
                .andExpect(jsonPath("$.generationConfig.responseSchema.properties.change.type").value("INTEGER"))
                .andRespond(withSuccess(candidate(
                        "{\"operation\":\"POST\",\"item\":\"tshirts\",\"change\":-3,\"reasoning\":\"sold 3\"}"),
                        MediaType.APPLICATION_JSON));

        InterpretedIntent intent = interpreter.interpret("I sold 3 t shirts");

        assertThat(intent.getOperation()).isEqualTo("POST");
        assertThat(intent.getItem()).isEqualTo("tshirts");
        assertThat(intent.getChange()).isEqualTo(-3);
        assertThat(intent.getReasoning()).isEqualTo("sold 3");
        assertThat(intent.operationKind()).isEqualTo(IntentOperation.WRITE);
        server.verify();
    }

    @Test
    void keeps_null_fields_as_absent() throws Exception {
        server.expect(requestTo(ENDPOINT))
                .andRespond(withSuccess(candidate(
                        "{\"operation\":\"GET\",\"item\":null,\"change\":null,\"reasoning\":\"check\"}"),
                        MediaType.APPLICATION_JSON));

        InterpretedIntent intent = interpreter.interpret("Check inventory");

        assertThat(intent.getItem()).isNull();
        assertThat(intent.getChange()).isNull();
        assertThat(intent.operationKind()).isEqualTo(IntentOperation.READ);
    }

    @Test
    void does_not_validate_item_plausibility() throws Exception {
        server.expect(requestTo(ENDPOINT))
                .andRespond(withSuccess(candidate(
                        "{\"operation\":\"POST\",\"item\":\"shoes\",\"change\":1000000,\"reasoning\":\"odd\"}"),
                        MediaType.APPLICATION_JSON));

        InterpretedIntent intent = interpreter.interpret("add a million shoes");

        assertThat(intent.getItem()).isEqualTo("shoes");
        assertThat(intent.getChange()).isEqualTo(1000000);
    }

    @Test
    void fails_without_api_key_and_makes_no_call() {
        properties.setApiKey(" ");

        assertThatThrownBy(() -> interpreter.interpret("Check inventory"))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("GEMINI_API_KEY")
                .extracting(e -> ((QueryException) e).getStatus())
                .isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        server.verify();
    }

    @Test
    void maps_connection_failure_to_unavailable() {
        server.expect(requestTo(ENDPOINT))
                .andRespond(withException(new SocketTimeoutException("Read timed out")));

        assertThatThrownBy(() -> interpreter.interpret("Check inventory"))
                .isInstanceOf(UpstreamUnavailableException.class)
                .hasMessageStartingWith("Failed to connect to Gemini API")
                .extracting(e -> ((QueryException) e).getStatus())
                .isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
    }

    @Test
    void propagates_upstream_error_status() {
        server.expect(requestTo(ENDPOINT))
                .andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS)
                        .contentType(MediaType.APPLICATION_JSON)
                        .body("{\"error\":{\"message\":\"quota\"}}"));

        assertThatThrownBy(() -> interpreter.interpret("Check inventory"))
                .isInstanceOf(UpstreamErrorException.class)
                .hasMessage("Gemini API returned an error: {\"error\":{\"message\":\"quota\"}}")
                .extracting(e -> ((QueryException) e).getStatus().value())
                .isEqualTo(429);
    }

    @Test
    void rejects_response_without_candidates() {
        server.expect(requestTo(ENDPOINT))
                .andRespond(withSuccess("{\"promptFeedback\":{\"blockReason\":\"SAFETY\"}}", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> interpreter.interpret("Check inventory"))
                .isInstanceOf(MalformedResponseException.class)
                .hasMessageContaining("did not contain expected content structure");
    }

    @Test
    void rejects_text_that_is_not_json() throws Exception {
        server.expect(requestTo(ENDPOINT))
                .andRespond(withSuccess(candidate("sure, here you go"), MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> interpreter.interpret("Check inventory"))
                .isInstanceOf(MalformedResponseException.class)
                .hasMessage("Failed to parse JSON response from LLM. LLM returned malformed JSON. Raw text: sure, here you go");
    }

    @Test
    void rejects_fields_of_the_wrong_type() {
        assertThatThrownBy(() -> interpreter.parseIntent("{\"operation\":\"POST\",\"item\":\"pants\",\"change\":2.5}"))
                .isInstanceOf(MalformedResponseException.class)
                .hasMessageContaining("'change'");
        assertThatThrownBy(() -> interpreter.parseIntent("{\"operation\":[\"GET\"]}"))
                .isInstanceOf(MalformedResponseException.class)
                .hasMessageContaining("'operation'");
        assertThatThrownBy(() -> interpreter.parseIntent("[1, 2]"))
                .isInstanceOf(MalformedResponseException.class);
    }
}
