package me.golemcore.kanban.adapter.outbound.persistence;

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

import feign.Headers;
import feign.Param;
import feign.RequestLine;
import me.golemcore.kanban.domain.model.RemoteWorkflowRecord;
import me.golemcore.kanban.domain.model.RemoteWorkflowUpdate;

/**
 * Workflow record endpoints of the ADW database service.
 */
@Headers({
        "Content-Type: application/json",
        "Accept: application/json"
})
interface AdwRecordsApi {

    @RequestLine("POST /api/adws")
    RemoteWorkflowRecord create(RemoteWorkflowRecord record);

    @RequestLine("PATCH /api/adws/{adwId}")
    RemoteWorkflowRecord update(@Param("adwId") String adwId, RemoteWorkflowUpdate update);

    @RequestLine("DELETE /api/adws/{adwId}")
    void delete(@Param("adwId") String adwId);
}
