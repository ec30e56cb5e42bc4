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

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Conversation entry for a single turn. Roles: system, user, assistant, tool.
 */
@Data
@Builder
public class Message {

    private String role;
    private String content;
    private List<ToolCall> toolCalls;
    private String toolCallId;
    private String toolName;

    public boolean hasToolCalls() {
        return toolCalls != null && !toolCalls.isEmpty();
    }

    public static Message system(String content) {
        return Message.builder().role("system").content(content).build();
    }

    public static Message user(String content) {
        return Message.builder().role("user").content(content).build();
    }

    public static Message assistant(String content, List<ToolCall> toolCalls) {
        return Message.builder().role("assistant").content(content).toolCalls(toolCalls).build();
    }

    public static Message toolResult(ToolCall call, ToolResult result) {
        return Message.builder()
                .role("tool")
                .toolCallId(call.getCallId())
                .toolName(call.getName())
                .content(result.getContent())
                .build();
    }
}
