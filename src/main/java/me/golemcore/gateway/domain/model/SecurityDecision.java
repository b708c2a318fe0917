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

package me.golemcore.gateway.domain.model;

/**
 * Verdict of a security or access policy. The reason is present if and only if
 * the request is denied.
 */
public record SecurityDecision(boolean allowed, String reason) {

    private static final SecurityDecision ALLOWED = new SecurityDecision(true, null);

    public SecurityDecision {
        if (allowed && reason != null) {
            throw new IllegalArgumentException("An allowed decision carries no reason");
        }
        if (!allowed && (reason == null || reason.isBlank())) {
            throw new IllegalArgumentException("A denied decision requires a reason");
        }
    }

    public static SecurityDecision allow() {
        return ALLOWED;
    }

    public static SecurityDecision deny(String reason) {
        return new SecurityDecision(false, reason);
    }

    public boolean denied() {
        return !allowed;
    }
}
