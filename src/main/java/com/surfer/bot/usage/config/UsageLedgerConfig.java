package com.surfer.bot.usage.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.surfer.bot.usage.ledger.DisabledUsageLedger;
import com.surfer.bot.usage.ledger.RemoteUsageLedger;
import com.surfer.bot.usage.ledger.UsageLedger;
import com.surfer.bot.usage.store.FirebaseCounterStoreClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.net.http.HttpClient;
import java.time.Clock;

/**
 * 啟動時決定一次 ledger 策略：
 * - app.store.base-url 有值：RemoteUsageLedger（Firebase REST）
 * - 沒有值：DisabledUsageLedger（全部回預設值，不擋使用者）
 */
@Slf4j
@Configuration
public class UsageLedgerConfig {

    @Bean
    public UsageLedger usageLedger(
            StoreProperties storeProps,
            UsageProperties usageProps,
            ObjectMapper om,
            Clock clock
    ) {
        if (!storeProps.isConfigured()) {
            log.warn("usage_store_unconfigured ledger=disabled defaultDailyLimit={}", usageProps.getDefaultDailyLimit());
            return new DisabledUsageLedger(usageProps.getDefaultDailyLimit());
        }

        RestClient http = storeRestClient(storeProps);
        FirebaseCounterStoreClient store = new FirebaseCounterStoreClient(http, om, storeProps.getAuthToken());

        log.info("usage_store_configured ledger=remote zone={}", usageProps.resolveZone());
        return new RemoteUsageLedger(store, clock, usageProps.resolveZone(), usageProps.getDefaultDailyLimit());
    }

    static RestClient storeRestClient(StoreProperties props) {
        HttpClient hc = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(props.getConnectTimeout())
                .build();

        JdkClientHttpRequestFactory rf = new JdkClientHttpRequestFactory(hc);
        rf.setReadTimeout(props.getReadTimeout());

        String base = props.getBaseUrl().trim();
        if (base.endsWith("/")) base = base.substring(0, base.length() - 1);

        return RestClient.builder()
                .baseUrl(base)
                .requestFactory(rf)
                .build();
    }
}
