package com.wangbin.netboxsync.core.inventory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.wangbin.netboxsync.core.config.RestTemplateConfig;
import com.wangbin.netboxsync.core.config.SyncProperties;
import com.wangbin.netboxsync.core.inventory.model.LookupResult;
import com.wangbin.netboxsync.core.inventory.model.LookupStatus;
import com.wangbin.netboxsync.core.inventory.model.WriteResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.*;
import static org.springframework.test.web.client.response.MockRestResponseCreators.*;

class NetboxInventoryClientTest {

    private static final String BASE = "http://netbox.test";

    private MockRestServiceServer server;
    private NetboxInventoryClient client;

    @BeforeEach
    void setUp() throws Exception {
        SyncProperties props = new SyncProperties();
        props.getInventory().setBaseUrl(BASE + "/");
        props.getInventory().setToken("secret");
        props.getInventory().setIgnoreSsl(false);

        RestTemplate restTemplate = new RestTemplateConfig().inventoryRestTemplate(props);
        server = MockRestServiceServer.bindTo(restTemplate).build();
        client = new NetboxInventoryClient(restTemplate, new ObjectMapper(), props);
    }

    @Test
    void vlanLookupSendsVidSiteAndToken() {
        server.expect(requestTo(BASE + "/api/ipam/vlans/?vid=1000&site_id=1"))
                .andExpect(method(HttpMethod.GET))
                .andExpect(header("Authorization", "Token secret"))
                .andExpect(header("Accept", "application/json"))
                .andExpect(header("Content-Type", "application/json"))
                .andRespond(withSuccess("{\"count\":1,\"results\":[{\"id\":7}]}", MediaType.APPLICATION_JSON));

        LookupResult result = client.vlanExists(1000, 1);

        assertTrue(result.isFound());
        server.verify();
    }

    @Test
    void vlanLookupWithoutSiteOmitsSiteFilter() {
        server.expect(requestTo(BASE + "/api/ipam/vlans/?vid=20"))
                .andRespond(withSuccess("{\"count\":0,\"results\":[]}", MediaType.APPLICATION_JSON));

        LookupResult result = client.vlanExists(20, null);

        assertEquals(LookupStatus.NOT_FOUND, result.getStatus());
        server.verify();
    }

    @Test
    void non200LookupIsQueryFailure() {
        server.expect(requestTo(BASE + "/api/ipam/vlans/?vid=1000&site_id=1"))
                .andRespond(withStatus(HttpStatus.FORBIDDEN).body("{\"detail\":\"Invalid token\"}"));

        LookupResult result = client.vlanExists(1000, 1);

        assertEquals(LookupStatus.QUERY_FAILED, result.getStatus());
        assertEquals(403, result.getStatusCode());
        assertTrue(result.getErrorMessage().contains("Invalid token"));
    }

    @Test
    void unreadableLookupBodyIsQueryFailure() {
        server.expect(requestTo(BASE + "/api/ipam/prefixes/?prefix=10.0.0.0/24"))
                .andRespond(withSuccess("<html>proxy</html>", MediaType.TEXT_HTML));
        server.expect(requestTo(BASE + "/api/ipam/prefixes/?prefix=10.0.1.0/24"))
                .andRespond(withSuccess("{\"results\":[]}", MediaType.APPLICATION_JSON));

        assertTrue(client.prefixExists("10.0.0.0/24").isFailed());
        assertTrue(client.prefixExists("10.0.1.0/24").isFailed());
        server.verify();
    }

    @Test
    void transportFailureOnLookupIsQueryFailure() {
        server.expect(requestTo(BASE + "/api/ipam/prefixes/?prefix=10.0.0.0/24"))
                .andRespond(request -> {
                    throw new IOException("connection refused");
                });

        LookupResult result = client.prefixExists("10.0.0.0/24");

        assertTrue(result.isFailed());
        assertEquals(-1, result.getStatusCode());
    }

    @Test
    void prefixLookupQueriesByCidr() {
        server.expect(requestTo(BASE + "/api/ipam/prefixes/?prefix=45.89.69.160/29"))
                .andExpect(method(HttpMethod.GET))
                .andExpect(header("Authorization", "Token secret"))
                .andRespond(withSuccess("{\"count\":2}", MediaType.APPLICATION_JSON));

        assertTrue(client.prefixExists("45.89.69.160/29").isFound());
        server.verify();
    }

    @Test
    void createVlanPostsVidNameAndSite() {
        server.expect(requestTo(BASE + "/api/ipam/vlans/"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("Authorization", "Token secret"))
                .andExpect(content().json("{\"vid\":1000,\"name\":\"ae0.1000\",\"site\":1}", true))
                .andRespond(withStatus(HttpStatus.CREATED).body("{\"id\":42}")
                        .contentType(MediaType.APPLICATION_JSON));

        WriteResult result = client.createVlan(1000, "ae0.1000", 1);

        assertTrue(result.isSuccess());
        assertEquals(201, result.getStatusCode());
        assertEquals("{\"id\":42}", result.getResponseData());
        server.verify();
    }

    @Test
    void createVlanOnlyAcceptsCreated() {
        server.expect(requestTo(BASE + "/api/ipam/vlans/"))
                .andRespond(withSuccess("{\"id\":42}", MediaType.APPLICATION_JSON));
        server.expect(requestTo(BASE + "/api/ipam/vlans/"))
                .andRespond(withStatus(HttpStatus.BAD_REQUEST).body("{\"vid\":[\"invalid\"]}"));

        WriteResult ok200 = client.createVlan(1000, "ae0.1000", 1);
        WriteResult bad = client.createVlan(5000, "ae0.5000", 1);

        assertFalse(ok200.isSuccess());
        assertEquals(200, ok200.getStatusCode());
        assertFalse(bad.isSuccess());
        assertEquals(400, bad.getStatusCode());
        assertEquals("{\"vid\":[\"invalid\"]}", bad.getResponseData());
    }

    @Test
    void createPrefixAcceptsOkAndCreated() {
        server.expect(requestTo(BASE + "/api/ipam/prefixes/"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(content().json("{\"prefix\":\"10.0.0.0/24\",\"site\":3}", true))
                .andRespond(withSuccess("{}", MediaType.APPLICATION_JSON));
        server.expect(requestTo(BASE + "/api/ipam/prefixes/"))
                .andRespond(withStatus(HttpStatus.CREATED).body("{}"));

        assertTrue(client.createPrefix("10.0.0.0/24", 3).isSuccess());
        assertTrue(client.createPrefix("10.0.1.0/24", 3).isSuccess());
        server.verify();
    }

    @Test
    void createPrefixWithoutSiteOmitsSite() {
        server.expect(requestTo(BASE + "/api/ipam/prefixes/"))
                .andExpect(content().json("{\"prefix\":\"10.0.0.0/24\"}", true))
                .andRespond(withStatus(HttpStatus.CREATED).body("{}"));

        assertTrue(client.createPrefix("10.0.0.0/24", null).isSuccess());
        server.verify();
    }

    @Test
    void transportFailureOnCreateIsReportedWithMinusOne() {
        server.expect(requestTo(BASE + "/api/ipam/prefixes/"))
                .andRespond(request -> {
                    throw new IOException("connection reset");
                });

        WriteResult result = client.createPrefix("10.0.0.0/24", 1);

        assertFalse(result.isSuccess());
        assertEquals(-1, result.getStatusCode());
        assertNull(result.getResponseData());
        assertTrue(result.getErrorMessage().contains("connection reset"));
    }
}
