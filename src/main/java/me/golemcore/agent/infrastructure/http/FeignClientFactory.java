package me.golemcore.agent.infrastructure.http;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import com.fasterxml.jackson.databind.ObjectMapper;
import feign.Feign;
import feign.Request;
import feign.Retryer;
import feign.jackson.JacksonDecoder;
import feign.okhttp.OkHttpClient;
import lombok.RequiredArgsConstructor;
import me.golemcore.agent.infrastructure.config.AgentProperties;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Read-only JSON clients for capabilities that call third-party APIs.
 *
 * <p>
 * Clients ride on the shared OkHttp pool, take their timeouts from
 * {@code agent.http} and never retry.
 */
@Component
@RequiredArgsConstructor
public class FeignClientFactory {

    static final String USER_AGENT = "golemcore-agent";

    private final okhttp3.OkHttpClient okHttpClient;
    private final ObjectMapper objectMapper;
    private final AgentProperties properties;

    public <T> T create(Class<T> apiType, String baseUrl) {
        AgentProperties.HttpProperties http = properties.getHttp();
        return Feign.builder()
                .client(new OkHttpClient(okHttpClient))
                .decoder(new JacksonDecoder(objectMapper))
                .retryer(Retryer.NEVER_RETRY)
                .options(new Request.Options(http.getConnectTimeout(), TimeUnit.MILLISECONDS,
                        http.getReadTimeout(), TimeUnit.MILLISECONDS, true))
                .requestInterceptor(template -> template.header("User-Agent", USER_AGENT))
                .target(apiType, baseUrl);
    }
}
