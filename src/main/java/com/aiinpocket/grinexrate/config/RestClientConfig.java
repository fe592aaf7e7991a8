package com.aiinpocket.grinexrate.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * REST 客戶端配置。
 * Grinex API 專用的 RestClient 在此建立一次，由各 Service 共用（RestClient 為執行緒安全）。
 */
@Configuration
public class RestClientConfig {

    /** Grinex API 專用 RestClient：預設 baseUrl、User-Agent，連線與讀取皆受 timeout 限制 */
    @Bean
    public RestClient grinexRestClient(GrinexApiProperties props) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(props.timeout());
        requestFactory.setReadTimeout(props.timeout());

        return RestClient.builder()
                .baseUrl(props.baseUrl())
                .requestFactory(requestFactory)
                .defaultHeader(HttpHeaders.USER_AGENT, props.userAgent())
                .build();
    }
}
