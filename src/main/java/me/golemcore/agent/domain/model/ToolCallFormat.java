package me.golemcore.agent.domain.model;

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

/**
 * Textual shape a tool call was written in by the model.
 */
public enum ToolCallFormat {

    /** A bare JSON object with {@code tool} and {@code params} fields. */
    STRUCTURED,

    /** A {@code ```tool:NAME} fenced block. */
    FENCED,

    /** A marker phrase at the start of a line followed by the tool name. */
    LEGACY_MARKER
}
