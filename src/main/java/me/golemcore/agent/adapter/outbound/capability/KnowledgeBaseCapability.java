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

package me.golemcore.agent.adapter.outbound.capability;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.agent.domain.component.Capability;
import me.golemcore.agent.domain.exception.CapabilityExecutionException;
import me.golemcore.agent.domain.exception.CapabilityValidationException;
import me.golemcore.agent.domain.model.CapabilityResult;
import me.golemcore.agent.infrastructure.config.AgentProperties;
import me.golemcore.agent.port.outbound.StoragePort;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.regex.Pattern;

/**
 * Read-only access to local documents.
 *
 * <p>
 * Operations:
 * <ul>
 * <li>list - names of the supported documents
 * <li>read - full text of {@code document}
 * <li>search - case-insensitive line match of {@code query} across all
 * documents; matches in .csv/.tsv files carry their line number
 * </ul>
 *
 * <p>
 * Documents live in {@code {base-path}/{agent.capabilities.knowledge-base.directory}}
 * and must end in .txt, .md, .csv or .tsv.
 */
@Component
@Slf4j
public class KnowledgeBaseCapability implements Capability {

    public static final String NAME = "knowledge_base";

    private static final Set<String> SUPPORTED_EXTENSIONS = Set.of(".txt", ".md", ".csv", ".tsv");
    private static final Pattern DOCUMENT_NAME = Pattern.compile("^[\\p{L}\\p{N}_.\\- ]{1,128}$");

    private final StoragePort storagePort;
    private final String directory;
    private final boolean enabled;

    public KnowledgeBaseCapability(StoragePort storagePort, AgentProperties properties) {
        this.storagePort = storagePort;
        AgentProperties.KnowledgeBaseProperties config = properties.getCapabilities().getKnowledgeBase();
        this.directory = config.getDirectory();
        this.enabled = config.isEnabled();
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String getDescription() {
        return "Local document store. Params: operation (list|read|search), document (for read), query (for search).";
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public CompletableFuture<CapabilityResult> execute(Map<String, Object> parameters) {
        String operation = stringParam(parameters, "operation");
        if (operation == null) {
            return CompletableFuture.failedFuture(new CapabilityValidationException("Missing parameter: operation"));
        }

        return switch (operation.toLowerCase(Locale.ROOT)) {
        case "list" -> listDocuments();
        case "read" -> {
            String document = stringParam(parameters, "document");
            if (document == null) {
                yield CompletableFuture.failedFuture(new CapabilityValidationException("Missing parameter: document"));
            }
            yield readDocument(document);
        }
        case "search" -> {
            String query = stringParam(parameters, "query");
            if (query == null) {
                yield CompletableFuture.failedFuture(new CapabilityValidationException("Missing parameter: query"));
            }
            yield searchDocuments(query);
        }
        default -> CompletableFuture.failedFuture(
                new CapabilityValidationException("Unsupported operation: " + operation));
        };
    }

    private CompletableFuture<CapabilityResult> listDocuments() {
        return documentNames().thenApply(names -> {
            if (names.isEmpty()) {
                return CapabilityResult.success("The knowledge base has no documents");
            }
            return CapabilityResult.success(names);
        });
    }

    private CompletableFuture<CapabilityResult> readDocument(String document) {
        if (!isSupportedName(document)) {
            return CompletableFuture.completedFuture(CapabilityResult.failure("Unsupported document: " + document));
        }
        return storagePort.getText(directory, document).handle((content, error) -> {
            if (error != null) {
                throw new CapabilityExecutionException("Failed to read document " + document, unwrap(error));
            }
            if (content == null) {
                return CapabilityResult.failure("Document not found: " + document);
            }
            return CapabilityResult.success(content);
        });
    }

    private CompletableFuture<CapabilityResult> searchDocuments(String query) {
        String needle = query.toLowerCase(Locale.ROOT);
        return documentNames().thenApply(names -> {
            Map<String, List<String>> results = new LinkedHashMap<>();
            for (String name : names) {
                String content = readQuietly(name);
                if (content == null) {
                    continue;
                }
                List<String> matches = matchLines(name, content, needle);
                if (!matches.isEmpty()) {
                    results.put(name, matches);
                }
            }
            if (results.isEmpty()) {
                return CapabilityResult.success("No matches found for: " + query);
            }
            return CapabilityResult.success(results);
        });
    }

    private List<String> matchLines(String name, String content, String needle) {
        boolean tabular = isTabular(name);
        String[] lines = content.split("\\R", -1);
        List<String> matches = new ArrayList<>();
        for (int i = 0; i < lines.length; i++) {
            if (lines[i].toLowerCase(Locale.ROOT).contains(needle)) {
                matches.add(tabular ? "line " + (i + 1) + ": " + lines[i] : lines[i]);
            }
        }
        return matches;
    }

    private String readQuietly(String name) {
        try {
            return storagePort.getText(directory, name).join();
        } catch (CompletionException e) {
            log.warn("[Tools] Skipping unreadable document {}: {}", name, unwrap(e).getMessage());
            return null;
        }
    }

    private CompletableFuture<List<String>> documentNames() {
        return storagePort.ensureDirectory(directory)
                .thenCompose(ignored -> storagePort.listObjects(directory))
                .thenApply(names -> names.stream()
                        .filter(this::isSupportedName)
                        .toList());
    }

    private boolean isSupportedName(String name) {
        if (name == null || !DOCUMENT_NAME.matcher(name).matches() || name.contains("..")) {
            return false;
        }
        String lower = name.toLowerCase(Locale.ROOT);
        return SUPPORTED_EXTENSIONS.stream().anyMatch(lower::endsWith);
    }

    private static boolean isTabular(String name) {
        String lower = name.toLowerCase(Locale.ROOT);
        return lower.endsWith(".csv") || lower.endsWith(".tsv");
    }

    private static String stringParam(Map<String, Object> parameters, String key) {
        Object value = parameters.get(key);
        if (value instanceof String text && !text.isBlank()) {
            return text.trim();
        }
        return null;
    }

    private static Throwable unwrap(Throwable error) {
        return error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    }
}
