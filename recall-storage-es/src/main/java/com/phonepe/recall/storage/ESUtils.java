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

import co.elastic.clients.elasticsearch._types.ElasticsearchException;
import co.elastic.clients.elasticsearch._types.mapping.TypeMapping;
import co.elastic.clients.util.ObjectBuilder;
import com.google.common.base.Strings;
import com.phonepe.recall.core.errors.ErrorType;
import com.phonepe.recall.core.errors.RecallException;
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.function.Function;

/**
 * Index naming, index creation and error translation shared by the stores
 */
@Slf4j
@UtilityClass
public class ESUtils {
    public static final int MAX_RESULT_WINDOW = 10_000;

    private static final int CONFLICT = 409;
    private static final String ALREADY_EXISTS = "resource_already_exists_exception";

    /**
     * A call to Elasticsearch
     */
    @FunctionalInterface
    public interface ESCall<T> {
        T call() throws IOException;
    }

    public static String indexName(String indexPrefix, String baseName) {
        return Strings.isNullOrEmpty(indexPrefix) ? baseName : "%s.%s".formatted(indexPrefix, baseName);
    }

    /**
     * Runs the call, mapping version conflicts to {@link ErrorType#CONFLICT_RETRYABLE} and every other failure to
     * {@link ErrorType#UPSTREAM_UNAVAILABLE}
     */
    public static <T> T execute(String operation, ESCall<T> call) {
        try {
            return call.call();
        }
        catch (ElasticsearchException e) {
            if (e.status() == CONFLICT) {
                throw RecallException.error(ErrorType.CONFLICT_RETRYABLE, e, operation);
            }
            log.error("Elasticsearch error during {}: {}", operation, e.getMessage());
            throw RecallException.error(ErrorType.UPSTREAM_UNAVAILABLE, e, operation + ": " + e.getMessage());
        }
        catch (IOException e) {
            log.error("Could not reach Elasticsearch during {}: {}", operation, e.getMessage());
            throw RecallException.error(ErrorType.UPSTREAM_UNAVAILABLE, e, operation + ": " + e.getMessage());
        }
    }

    public static void ensureIndex(
            ESClient client,
            String indexName,
            IndexSettings indexSettings,
            Function<TypeMapping.Builder, ObjectBuilder<TypeMapping>> mappings) {
        final var elasticsearchClient = client.getElasticsearchClient();
        execute("create index " + indexName, () -> {
            if (elasticsearchClient.indices().exists(ex -> ex.index(indexName)).value()) {
                log.info("Index {} already exists", indexName);
                return null;
            }
            log.info("Creating index {}", indexName);
            try {
                final var created = elasticsearchClient.indices()
                        .create(ex -> ex.index(indexName)
                                .mappings(mappings)
                                .settings(s -> s.numberOfShards(Integer.toString(indexSettings.getShards()))
                                        .numberOfReplicas(Integer.toString(indexSettings.getReplicas()))
                                        .refreshInterval(t -> t.time(indexSettings.getRefreshInterval()))))
                        .acknowledged();
                log.info("Index creation status for index {}: {}", indexName, created);
            }
            catch (ElasticsearchException e) {
                if (!ALREADY_EXISTS.equals(e.error().type())) {
                    throw e;
                }
                log.info("Index {} was created concurrently", indexName);
            }
            return null;
        });
    }
}
