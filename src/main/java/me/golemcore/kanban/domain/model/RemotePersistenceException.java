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

import lombok.Getter;

/**
 * Failure of a call to the remote ADW records API. {@link #getDetail()} is the
 * human-readable reason, taken from the server's {@code detail} field when it
 * sent one.
 */
@Getter
public class RemotePersistenceException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final int status;
    private final String detail;

    public RemotePersistenceException(int status, String detail) {
        super(detail);
        this.status = status;
        this.detail = detail;
    }

    public RemotePersistenceException(int status, String detail, Throwable cause) {
        super(detail, cause);
        this.status = status;
        this.detail = detail;
    }
}
