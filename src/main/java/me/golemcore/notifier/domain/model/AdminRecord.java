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

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A user allowed to mutate schedules. Owners may also change the roster.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AdminRecord {

    private String username;
    private AdminRole role;
    private String addedBy;
    private Instant addedAt;

    @JsonIgnore
    public boolean isOwner() {
        return role == AdminRole.OWNER;
    }
}
