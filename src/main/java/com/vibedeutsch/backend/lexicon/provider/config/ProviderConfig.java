package com.vibedeutsch.backend.lexicon.provider.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vibedeutsch.backend.lexicon.provider.GeminiLexiconClient;
import com.vibedeutsch.backend.lexicon.provider.LexiconModelClient;
import com.vibedeutsch.backend.lexicon.provider.ProviderTelemetry;
import com.vibedeutsch.backend.lexicon.provider.StubLexiconModelClient;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.net.http.HttpClient;

@Configuration
@EnableConfigurationProperties(GeminiProperties.class)
public class ProviderConfig {

    /** 只有 gemini enabled=false 才提供 stub，避免兩個 LexiconModelClient 注入衝突 */
    @Bean
    @ConditionalOnProperty(prefix = "app.provider.gemini", name = "enabled", havingValue = "false", matchIfMissing = true)
    public LexiconModelClient stubLexiconModelClient(ObjectMapper om) {
        return new StubLexiconModelClient(om);
    }

    @Bean
    @ConditionalOnProperty(prefix = "app.provider.gemini", name = "enabled", havingValue = "true")
    public RestClient geminiRestClient(GeminiProperties props) {
        // JDK HttpClient 的 send 會回應 interrupt，模型逾時 cancel(true) 才真的放掉執行緒
        HttpClient hc = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(props.getConnectTimeout())
                .build();

        JdkClientHttpRequestFactory rf = new JdkClientHttpRequestFactory(hc);
        rf.setReadTimeout(props.getReadTimeout());

        return RestClient.builder()
                .baseUrl(props.getBaseUrl())
                .requestFactory(rf)
                .build();
    }

    @Bean
    @ConditionalOnProperty(prefix = "app.provider.gemini", name = "enabled", havingValue = "true")
    public LexiconModelClient geminiLexiconClient(
            RestClient geminiRestClient,
            GeminiProperties props,
            ObjectMapper om,
            ProviderTelemetry telemetry
    ) {
        // 啟動就抓到設定缺失
        String k = props.getApiKey();
        if (k == null || k.isBlank()) throw new IllegalStateException("GEMINI_API_KEY_MISSING");
        if (props.getBaseUrl() == null || props.getBaseUrl().isBlank()) throw new IllegalStateException("GEMINI_BASE_URL_MISSING");
        if (props.getModel() == null || props.getModel().isBlank()) throw new IllegalStateException("GEMINI_MODEL_MISSING");

        return new GeminiLexiconClient(geminiRestClient, props, om, telemetry);
    }
}
