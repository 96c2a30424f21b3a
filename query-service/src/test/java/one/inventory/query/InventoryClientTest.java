package one.inventory.query;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.net.ConnectException;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withException;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class InventoryClientTest {

    private MockRestServiceServer server;
    private InventoryClient inventoryClient;

    @BeforeEach
    void setUp() {
        InventoryClientProperties properties = new InventoryClientProperties();
        properties.setBaseUrl("http://inventory.test");

        RestClient.Builder builder = RestClient.builder().baseUrl(properties.getBaseUrl());
        server = MockRestServiceServer.bindTo(builder).build();
        inventoryClient = new InventoryClient(properties, builder.build(), new ObjectMapper());
    }

    @Test
    void reads_inventory() {
        server.expect(requestTo("http://inventory.test/inventory"))
                .andExpect(method(HttpMethod.GET))
                .andRespond(withSuccess("{\"tshirts\":20,\"pants\":15}", MediaType.APPLICATION_JSON));

        assertThat(inventoryClient.getInventory()).isEqualTo(Map.of("tshirts", 20, "pants", 15));
        server.verify();
    }

    @Test
    void posts_change() {
        server.expect(requestTo("http://inventory.test/inventory"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(content().json("{\"item\":\"tshirts\",\"change\":-3}", true))
                .andRespond(withSuccess("{\"tshirts\":17,\"pants\":15}", MediaType.APPLICATION_JSON));

        assertThat(inventoryClient.updateInventory("tshirts", -3)).containsEntry("tshirts", 17);
        server.verify();
    }

    @Test
    void propagates_inventory_detail_and_status() {
        server.expect(requestTo("http://inventory.test/inventory"))
                .andRespond(withStatus(HttpStatus.BAD_REQUEST)
                        .contentType(MediaType.APPLICATION_JSON)
                        .body("{\"detail\":\"Cannot reduce 'pants' stock below zero. Current: 15, Attempted change: -100\"}"));

        assertThatThrownBy(() -> inventoryClient.updateInventory("pants", -100))
                .isInstanceOf(UpstreamErrorException.class)
                .hasMessage("Inventory Service returned an error: "
                        + "Cannot reduce 'pants' stock below zero. Current: 15, Attempted change: -100 (HTTP 400)")
                .extracting(e -> ((QueryException) e).getStatus().value())
                .isEqualTo(400);
    }

    @Test
    void falls_back_when_error_body_has_no_detail() {
        server.expect(requestTo("http://inventory.test/inventory"))
                .andRespond(withStatus(HttpStatus.BAD_GATEWAY).body("<html>bad gateway</html>"));

        assertThatThrownBy(() -> inventoryClient.getInventory())
                .isInstanceOf(UpstreamErrorException.class)
                .hasMessage("Inventory Service returned an error: "
                        + "No specific error detail from Inventory Service. (HTTP 502)");
    }

    @Test
    void maps_connection_failure_to_unavailable_with_address() {
        server.expect(requestTo("http://inventory.test/inventory"))
                .andRespond(withException(new ConnectException("Connection refused")));

        assertThatThrownBy(() -> inventoryClient.getInventory())
                .isInstanceOf(UpstreamUnavailableException.class)
                .hasMessageStartingWith("Failed to connect to Inventory Service at http://inventory.test")
                .extracting(e -> ((QueryException) e).getStatus())
                .isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
    }
}
