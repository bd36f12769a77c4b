package me.golemcore.kanban.domain.model;

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
 * Well-known keys of {@link Task#getMetadata()}. They match the snake_case
 * field names the backend uses.
 */
public final class MetadataKeys {

    public static final String ADW_ID = "adw_id";
    public static final String ADW_IDS = "adw_ids";
    public static final String WORKFLOW_NAME = "workflow_name";
    public static final String WORKFLOW_STATUS = "workflow_status";
    public static final String WORKFLOW_MESSAGE = "workflow_message";
    public static final String WORKFLOW_PROGRESS = "workflow_progress";
    public static final String WORKFLOW_STEP = "workflow_step";
    public static final String WORKFLOW_COMPLETE = "workflow_complete";
    public static final String WORKFLOW_ERROR = "workflow_error";
    public static final String LOGS_PATH = "logs_path";
    public static final String PLAN_FILE = "plan_file";
    public static final String BRANCH_NAME = "branch_name";
    public static final String PATCH_FILE = "patch_file";
    public static final String PATCH_HISTORY = "patch_history";
    public static final String TRIGGER_STATUS = "trigger_status";
    public static final String TRIGGER_MESSAGE = "trigger_message";
    public static final String TRIGGERED_AT = "triggered_at";
    public static final String MERGE_TRIGGERED = "merge_triggered";
    public static final String MERGE_TRIGGERED_AT = "merge_triggered_at";
    public static final String MERGE_IN_PROGRESS = "merge_in_progress";
    public static final String MERGE_COMPLETED = "merge_completed";
    public static final String MERGE_COMPLETED_AT = "merge_completed_at";
    public static final String MERGED_BRANCH = "merged_branch";
    public static final String MERGE_METHOD = "merge_method";
    public static final String MERGE_ERROR = "merge_error";
    public static final String MERGE_ERROR_AT = "merge_error_at";

    public static final String STATUS_FAILED = "failed";
    public static final String STATUS_COMPLETED = "completed";
    public static final String STATUS_STARTED = "started";
    public static final String STATUS_ACCEPTED = "accepted";

    private MetadataKeys() {
    }
}
