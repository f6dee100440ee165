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

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Outcome of a capability invocation: either a success value or a failure
 * description, never both.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class CapabilityResult {

    @SuppressWarnings("PMD.AvoidFieldNameMatchingMethodName") // Lombok generates isSuccess()
    boolean success;
    Object value;
    String error;

    public static CapabilityResult success(Object value) {
        return new CapabilityResult(true, value, null);
    }

    public static CapabilityResult failure(String error) {
        return new CapabilityResult(false, null, error != null ? error : "unknown error");
    }
}
