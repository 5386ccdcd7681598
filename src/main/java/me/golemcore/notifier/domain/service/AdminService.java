package me.golemcore.notifier.domain.service;

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

import me.golemcore.notifier.domain.model.AdminRoster;
import me.golemcore.notifier.domain.model.StoredDocument;
import me.golemcore.notifier.port.outbound.DocumentStorePort;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Reads and writes the admin roster document ({@code governance/admins}).
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AdminService {

    public static final String COLLECTION = "governance";
    public static final String ROSTER_ID = "admins";

    private final DocumentStorePort documentStore;
    private final ObjectMapper objectMapper;

    public Optional<AdminRoster> loadRoster() {
        return DocumentStoreSupport.await(documentStore.get(COLLECTION, ROSTER_ID))
                .map(this::toRoster);
    }

    /**
     * Write the roster conditional on {@link AdminRoster#getVersion()};
     * {@link StoredDocument#ABSENT} creates it.
     */
    public AdminRoster saveRoster(AdminRoster roster) {
        StoredDocument stored = DocumentStoreSupport.await(
                documentStore.put(COLLECTION, ROSTER_ID, toJson(roster), roster.getVersion()));
        log.debug("[Governance] Roster written at v{}", stored.version());
        return roster.toBuilder().version(stored.version()).build();
    }

    private AdminRoster toRoster(StoredDocument document) {
        try {
            AdminRoster roster = objectMapper.readValue(document.content(), AdminRoster.class);
            roster.setVersion(document.version());
            return roster;
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt roster document", e);
        }
    }

    private String toJson(AdminRoster roster) {
        try {
            return objectMapper.writeValueAsString(roster);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize roster", e);
        }
    }
}
