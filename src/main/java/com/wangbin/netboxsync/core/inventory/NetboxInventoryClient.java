package com.wangbin.netboxsync.core.inventory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.wangbin.netboxsync.core.config.SyncProperties;
import com.wangbin.netboxsync.core.inventory.model.LookupResult;
import com.wangbin.netboxsync.core.inventory.model.WriteResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * NetBox REST 客户端
 *
 * 所有请求携带 Token 认证头，JSON 收发；状态码由本类判断，RestTemplate 不抛状态码异常。
 */
@Slf4j
@Component
public class NetboxInventoryClient implements InventoryClient {

    private static final String VLANS_PATH = "/api/ipam/vlans/";
    private static final String PREFIXES_PATH = "/api/ipam/prefixes/";

    private static final Set<Integer> VLAN_CREATED = Set.of(HttpStatus.CREATED.value());
    private static final Set<Integer> PREFIX_CREATED = Set.of(HttpStatus.OK.value(), HttpStatus.CREATED.value());

    private static final int TRANSPORT_FAILURE = -1;

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final String baseUrl;
    private final String token;

    public NetboxInventoryClient(RestTemplate inventoryRestTemplate, ObjectMapper objectMapper,
                                 SyncProperties properties) {
        this.restTemplate = inventoryRestTemplate;
        this.objectMapper = objectMapper;
        this.baseUrl = stripTrailingSlash(properties.getInventory().getBaseUrl());
        this.token = properties.getInventory().getToken();
    }

    @Override
    public LookupResult vlanExists(int vid, Integer siteId) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromUriString(baseUrl)
                .path(VLANS_PATH)
                .queryParam("vid", vid);
        if (siteId != null) {
            builder.queryParam("site_id", siteId);
        }
        return lookup(builder.build().encode().toUri(), "VLAN " + vid);
    }

    @Override
    public WriteResult createVlan(int vid, String name, Integer siteId) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("vid", vid);
        payload.put("name", name);
        payload.put("site", siteId);
        return write(endpoint(VLANS_PATH), payload, VLAN_CREATED, "VLAN " + vid);
    }

    @Override
    public LookupResult prefixExists(String network) {
        URI uri = UriComponentsBuilder.fromUriString(baseUrl)
                .path(PREFIXES_PATH)
                .queryParam("prefix", network)
                .build()
                .encode()
                .toUri();
        return lookup(uri, "前缀 " + network);
    }

    @Override
    public WriteResult createPrefix(String network, Integer siteId) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("prefix", network);
        if (siteId != null) {
            payload.put("site", siteId);
        }
        return write(endpoint(PREFIXES_PATH), payload, PREFIX_CREATED, "前缀 " + network);
    }

    // =============== 辅助方法 ===============

    private LookupResult lookup(URI uri, String subject) {
        log.debug("查询NetBox：{} -> {}", subject, uri);
        ResponseEntity<String> response;
        try {
            response = restTemplate.exchange(uri, HttpMethod.GET, new HttpEntity<>(buildHeaders()), String.class);
        } catch (RestClientException e) {
            log.warn("查询NetBox失败：{}，{}", subject, e.getMessage());
            return LookupResult.failed(TRANSPORT_FAILURE, e.getMessage());
        }

        int status = response.getStatusCode().value();
        if (status != HttpStatus.OK.value()) {
            return LookupResult.failed(status, "HTTP错误：" + status + " - " + response.getBody());
        }
        try {
            JsonNode count = objectMapper.readTree(response.getBody() != null ? response.getBody() : "")
                    .path("count");
            if (!count.isIntegralNumber()) {
                return LookupResult.failed(status, "响应缺少count字段");
            }
            return count.asLong() > 0 ? LookupResult.found() : LookupResult.notFound();
        } catch (JsonProcessingException e) {
            return LookupResult.failed(status, "响应不是合法JSON：" + e.getOriginalMessage());
        }
    }

    private WriteResult write(URI uri, Map<String, Object> payload, Set<Integer> accepted, String subject) {
        log.debug("写入NetBox：{} -> {}", subject, uri);
        long start = System.currentTimeMillis();
        WriteResult result;
        try {
            ResponseEntity<String> response = restTemplate.exchange(
                    uri,
                    HttpMethod.POST,
                    new HttpEntity<>(payload, buildHeaders()),
                    String.class
            );
            int status = response.getStatusCode().value();
            if (accepted.contains(status)) {
                result = WriteResult.success(status, response.getBody());
            } else {
                result = WriteResult.error(status, response.getBody(), "HTTP错误：" + status);
            }
        } catch (RestClientException e) {
            log.warn("写入NetBox失败：{}，{}", subject, e.getMessage());
            result = WriteResult.error(TRANSPORT_FAILURE, null, e.getMessage());
        }
        result.setCostTime(System.currentTimeMillis() - start);
        return result;
    }

    private HttpHeaders buildHeaders() {
        HttpHeaders headers = new HttpHeaders();
        headers.set(HttpHeaders.AUTHORIZATION, "Token " + token);
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        headers.set(HttpHeaders.USER_AGENT, "NetboxSync/1.0");
        return headers;
    }

    private URI endpoint(String path) {
        return UriComponentsBuilder.fromUriString(baseUrl).path(path).build().encode().toUri();
    }

    private static String stripTrailingSlash(String url) {
        String result = url.trim();
        while (result.endsWith("/")) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }
}
