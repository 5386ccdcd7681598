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

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * The full admin set, kept as a single document so that roster invariants
 * (unique usernames, at least one owner) are checked and written in one
 * conditional update.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class AdminRoster {

    @Builder.Default
    private List<AdminRecord> admins = new ArrayList<>();

    @JsonIgnore
    private long version;

    public Optional<AdminRecord> find(String username) {
        return admins.stream()
                .filter(a -> a.getUsername().equals(username))
                .findFirst();
    }

    @JsonIgnore
    public long getOwnerCount() {
        return admins.stream().filter(AdminRecord::isOwner).count();
    }
}
