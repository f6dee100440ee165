package me.golemcore.agent.port.outbound;

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

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Text file storage rooted at the agent workspace.
 */
public interface StoragePort {

    /**
     * Read text content from file.
     *
     * @return the content, or null when the file does not exist
     */
    CompletableFuture<String> getText(String directory, String path);

    /**
     * Atomically write text content to file: the content goes to a temporary
     * file first and is then moved over the target, so readers never observe a
     * partial write.
     *
     * @param directory
     *            subdirectory (e.g., "conversations", "knowledge")
     * @param path
     *            relative path within directory
     * @param content
     *            text content to write
     */
    CompletableFuture<Void> putTextAtomic(String directory, String path, String content);

    /**
     * Check if file exists.
     */
    CompletableFuture<Boolean> exists(String directory, String path);

    /**
     * Delete a file. Deleting a missing file is not an error.
     */
    CompletableFuture<Void> deleteObject(String directory, String path);

    /**
     * List regular files directly under {@code directory}, as names relative to
     * it.
     */
    CompletableFuture<List<String>> listObjects(String directory);

    /**
     * Ensure directory exists.
     */
    CompletableFuture<Void> ensureDirectory(String directory);
}
