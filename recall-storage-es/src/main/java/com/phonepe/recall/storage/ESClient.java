/*
 * Copyright (c) 2025 Original Author(s), PhonePe India Pvt. Ltd.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.phonepe.recall.storage;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.json.jackson.JacksonJsonpMapper;
import co.elastic.clients.transport.ElasticsearchTransport;
import co.elastic.clients.transport.rest_client.RestClientTransport;
import com.google.common.base.Strings;
import com.phonepe.recall.core.utils.EnvLoader;
import com.phonepe.recall.core.utils.JsonUtils;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import org.apache.http.Header;
import org.apache.http.HttpHost;
import org.apache.http.message.BasicHeader;
import org.elasticsearch.client.RestClient;

/**
 * Elasticsearch client shared by all stores. Documents are mapped with the same Jackson setup as the rest of the
 * code.
 */
public class ESClient implements AutoCloseable {
    public static final String ES_URL_VARIABLE = "RECALL_ES_URL";
    public static final String ES_API_KEY_VARIABLE = "RECALL_ES_API_KEY";

    @Getter
    private final ElasticsearchClient elasticsearchClient;

    /**
     * @param apiKey Optional. Sent as an {@code ApiKey} authorization header when present.
     */
    @Builder
    public ESClient(@NonNull String serverUrl, String apiKey) {
        final var builder = RestClient.builder(HttpHost.create(serverUrl));
        if (!Strings.isNullOrEmpty(apiKey)) {
            builder.setDefaultHeaders(new Header[]{
                    new BasicHeader("Authorization", "ApiKey " + apiKey)
            });
        }
        final ElasticsearchTransport transport = new RestClientTransport(
                builder.build(), new JacksonJsonpMapper(JsonUtils.createMapper()));
        this.elasticsearchClient = new ElasticsearchClient(transport);
    }

    /**
     * Connects to the cluster named by {@code RECALL_ES_URL}, authenticating with {@code RECALL_ES_API_KEY} if set
     */
    public static ESClient fromEnvironment() {
        return ESClient.builder()
                .serverUrl(EnvLoader.readEnv(ES_URL_VARIABLE))
                .apiKey(EnvLoader.readEnv(ES_API_KEY_VARIABLE, null))
                .build();
    }

    @Override
    public void close() throws Exception {
        elasticsearchClient.close();
    }
}
