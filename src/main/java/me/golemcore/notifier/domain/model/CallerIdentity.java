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

/**
 * Identity of whoever issued a command, as resolved by the channel adapter.
 * {@code username} is null when the platform gave none; such callers are
 * never authorized.
 */
public record CallerIdentity(String username, String userId) {

    public boolean isResolved() {
        return username != null && !username.isBlank();
    }
}
