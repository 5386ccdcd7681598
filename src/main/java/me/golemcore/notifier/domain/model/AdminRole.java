package me.golemcore.notifier.domain.model;

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

import java.util.Locale;

/**
 * Governance role of an admin.
 */
public enum AdminRole {
    OWNER, ADMIN;

    /**
     * @throws IllegalArgumentException
     *             if the value names no role
     */
    public static AdminRole parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Role cannot be empty");
        }
        return AdminRole.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
