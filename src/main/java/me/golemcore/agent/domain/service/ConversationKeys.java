package me.golemcore.agent.domain.service;

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

import me.golemcore.agent.domain.model.Conversation;

import java.security.SecureRandom;
import java.util.Comparator;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Conversation id and handle helpers.
 *
 * <p>
 * Internal ids must match {@code ^[a-zA-Z0-9_-]{1,64}$} since they become
 * file names. Caller handles are opaque and only need to be non-blank.
 */
public final class ConversationKeys {

    private static final Pattern KEY_PATTERN = Pattern.compile("^[a-zA-Z0-9_-]{1,64}$");
    private static final String HANDLE_ALPHABET = "abcdefghijklmnopqrstuvwxyz0123456789";
    private static final int HANDLE_SUFFIX_LENGTH = 12;
    private static final SecureRandom RANDOM = new SecureRandom();

    private ConversationKeys() {
    }

    /**
     * Internal id for a new durable conversation.
     */
    public static String newConversationId() {
        return "conv_" + UUID.randomUUID().toString().replace("-", "");
    }

    /**
     * Caller-facing handle minted when a request arrives without one.
     */
    public static String newHandle() {
        StringBuilder sb = new StringBuilder("chat_");
        for (int i = 0; i < HANDLE_SUFFIX_LENGTH; i++) {
            sb.append(HANDLE_ALPHABET.charAt(RANDOM.nextInt(HANDLE_ALPHABET.length())));
        }
        return sb.toString();
    }

    public static boolean isValidKey(String value) {
        return value != null && KEY_PATTERN.matcher(value).matches();
    }

    /**
     * Most recently updated first; conversations without timestamps last.
     */
    public static Comparator<Conversation> byRecentActivity() {
        return Comparator.comparing(
                (Conversation conversation) -> conversation.getUpdatedAt() != null ? conversation.getUpdatedAt()
                        : conversation.getCreatedAt(),
                Comparator.nullsFirst(Comparator.naturalOrder()))
                .reversed();
    }
}
