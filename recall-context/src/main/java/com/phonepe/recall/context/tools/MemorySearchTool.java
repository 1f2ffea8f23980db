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

package com.phonepe.recall.context.tools;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Strings;
import com.phonepe.recall.context.PromptFormatter;
import com.phonepe.recall.core.errors.ErrorType;
import com.phonepe.recall.core.errors.RecallException;
import com.phonepe.recall.core.model.memory.MemoryCategory;
import com.phonepe.recall.core.utils.JsonUtils;
import com.phonepe.recall.memory.retrieval.MemoryRetriever;
import com.phonepe.recall.memory.retrieval.ScoredMemory;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Objects;

/**
 * Lets the model search long term memory on demand, in addition to what was retrieved up front
 */
@Slf4j
public class MemorySearchTool {
    public static final String NAME = "memory_search";
    public static final int DEFAULT_LIMIT = 10;

    private static final String DESCRIPTION = "Search project memory for relevant context, decisions, or patterns "
            + "using full-text search. Use when you need to recall previous decisions, patterns, or context from "
            + "earlier sessions.";

    private static final String PARAMETER_SCHEMA = """
            {
              "type": "object",
              "properties": {
                "query": {
                  "type": "string",
                  "description": "Natural language query"
                },
                "scope": {
                  "type": "string",
                  "enum": ["namespace", "all"],
                  "description": "namespace searches the memories of the current agent, all searches every namespace"
                },
                "category": {
                  "type": "string",
                  "enum": ["facts", "preferences", "rules", "skills", "context"],
                  "description": "Filter by memory category"
                },
                "limit": {
                  "type": "integer",
                  "default": 10,
                  "description": "Maximum results to return"
                }
              },
              "required": ["query"]
            }""";

    /**
     * Arguments sent by the model
     */
    public record Arguments(String query, String scope, MemoryCategory category, Integer limit) {
    }

    private final MemoryRetriever retriever;
    private final ObjectMapper mapper;
    private final ToolSpec spec;

    public MemorySearchTool(@NonNull MemoryRetriever retriever, ObjectMapper mapper) {
        this.retriever = retriever;
        this.mapper = Objects.requireNonNullElseGet(mapper, JsonUtils::createMapper);
        try {
            this.spec = new ToolSpec(NAME, DESCRIPTION, this.mapper.readTree(PARAMETER_SCHEMA));
        }
        catch (JsonProcessingException e) {
            throw RecallException.error(ErrorType.INTERNAL_ERROR, e, "invalid memory_search schema");
        }
    }

    public ToolSpec spec() {
        return spec;
    }

    /**
     * Runs the tool with raw JSON arguments and returns the text handed back to the model
     */
    public String run(@NonNull String namespace, String argumentsJson) {
        final Arguments arguments;
        try {
            arguments = mapper.readValue(Strings.isNullOrEmpty(argumentsJson) ? "{}" : argumentsJson,
                                         Arguments.class);
        }
        catch (JsonProcessingException e) {
            throw RecallException.invalidInput("Unparseable memory_search arguments: " + e.getOriginalMessage());
        }
        final var results = search(namespace, arguments);
        if (results.isEmpty()) {
            return "No memories found for: " + arguments.query();
        }
        return PromptFormatter.formatMemories(results, results.size());
    }

    public List<ScoredMemory> search(@NonNull String namespace, @NonNull Arguments arguments) {
        if (Strings.isNullOrEmpty(arguments.query()) || arguments.query().isBlank()) {
            throw RecallException.invalidInput("memory_search needs a query");
        }
        final var namespaces = "all".equalsIgnoreCase(arguments.scope()) ? List.<String>of() : List.of(namespace);
        final var categories = arguments.category() == null
                               ? List.<MemoryCategory>of()
                               : List.of(arguments.category());
        final var limit = Objects.requireNonNullElse(arguments.limit(), DEFAULT_LIMIT);
        final var results = retriever.search(arguments.query(), namespaces, categories, limit);
        log.debug("memory_search for '{}' in {} returned {} memories", arguments.query(),
                  namespaces.isEmpty() ? "all namespaces" : namespace, results.size());
        return results;
    }
}
