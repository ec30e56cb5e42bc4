package me.golemcore.relay.domain.model;

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
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Data;

@Data
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ToolResult {

    @JsonProperty("tool_call_id")
    private String callId;
    private ToolResultStatus status;
    private String content;

    @JsonProperty("failure_kind")
    private ToolFailureKind failureKind;

    public static ToolResult success(String content) {
        return ToolResult.builder()
                .status(ToolResultStatus.OK)
                .content(content)
                .build();
    }

    public static ToolResult failure(ToolFailureKind kind, String content) {
        return ToolResult.builder()
                .status(ToolResultStatus.ERROR)
                .failureKind(kind)
                .content(content)
                .build();
    }

    @JsonIgnore
    public boolean isSuccess() {
        return status == ToolResultStatus.OK;
    }

    /**
     * Returns a copy bound to the given call id.
     */
    public ToolResult forCall(String id) {
        return toBuilder().callId(id).build();
    }
}
