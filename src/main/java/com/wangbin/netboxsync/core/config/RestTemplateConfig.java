package com.wangbin.netboxsync.core.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.ResponseErrorHandler;
import org.springframework.web.client.RestTemplate;

import javax.net.ssl.HostnameVerifier;
import javax.net.ssl.HttpsURLConnection;
import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLSocketFactory;
import javax.net.ssl.TrustManager;
import javax.net.ssl.X509TrustManager;
import java.io.IOException;
import java.net.HttpURLConnection;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.security.cert.X509Certificate;

/**
 * NetBox 访问用 RestTemplate 配置
 */
@Slf4j
@Configuration
public class RestTemplateConfig {

    @Bean
    public RestTemplate inventoryRestTemplate(SyncProperties properties) throws GeneralSecurityException {
        SyncProperties.InventoryConfig inventory = properties.getInventory();

        SimpleClientHttpRequestFactory requestFactory;
        if (inventory.isIgnoreSsl()) {
            log.warn("已关闭NetBox的TLS证书校验(netbox-sync.inventory.ignore-ssl=true)，令牌可能被中间人截获");
            requestFactory = new TrustAllRequestFactory(trustAllSocketFactory());
        } else {
            requestFactory = new SimpleClientHttpRequestFactory();
        }
        requestFactory.setConnectTimeout(inventory.getConnectTimeout());
        requestFactory.setReadTimeout(inventory.getReadTimeout());

        RestTemplate restTemplate = new RestTemplate(requestFactory);
        // 状态码由调用方判断，不抛 HttpStatusCodeException
        restTemplate.setErrorHandler(new PassThroughErrorHandler());
        return restTemplate;
    }

    /**
     * 创建信任所有证书的 SSLSocketFactory
     */
    private static SSLSocketFactory trustAllSocketFactory() throws GeneralSecurityException {
        TrustManager[] trustAllCerts = new TrustManager[] {
                new X509TrustManager() {
                    public X509Certificate[] getAcceptedIssuers() {
                        return new X509Certificate[0];
                    }
                    public void checkClientTrusted(X509Certificate[] certs, String authType) {
                    }
                    public void checkServerTrusted(X509Certificate[] certs, String authType) {
                    }
                }
        };
        SSLContext sslContext = SSLContext.getInstance("TLS");
        sslContext.init(null, trustAllCerts, new SecureRandom());
        return sslContext.getSocketFactory();
    }

    static final class TrustAllRequestFactory extends SimpleClientHttpRequestFactory {

        private static final HostnameVerifier ANY_HOST = (hostname, session) -> true;

        private final SSLSocketFactory sslSocketFactory;

        private TrustAllRequestFactory(SSLSocketFactory sslSocketFactory) {
            this.sslSocketFactory = sslSocketFactory;
        }

        @Override
        protected void prepareConnection(HttpURLConnection connection, String httpMethod) throws IOException {
            if (connection instanceof HttpsURLConnection https) {
                https.setSSLSocketFactory(sslSocketFactory);
                https.setHostnameVerifier(ANY_HOST);
            }
            super.prepareConnection(connection, httpMethod);
        }
    }

    private static final class PassThroughErrorHandler implements ResponseErrorHandler {

        @Override
        public boolean hasError(ClientHttpResponse response) {
            return false;
        }

        @Override
        public void handleError(ClientHttpResponse response) {
        }
    }
}
