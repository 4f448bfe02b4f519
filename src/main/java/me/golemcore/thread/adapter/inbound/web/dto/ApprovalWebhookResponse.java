package me.golemcore.thread.adapter.inbound.web.dto;

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

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Reply to an approval webhook delivery.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApprovalWebhookResponse {

    private String status;
    private String token;
    private Boolean approved;
    private String error;

    public static ApprovalWebhookResponse accepted(String token, boolean approved) {
        return ApprovalWebhookResponse.builder()
                .status("accepted")
                .token(token)
                .approved(approved)
                .build();
    }

    public static ApprovalWebhookResponse duplicate(String token) {
        return ApprovalWebhookResponse.builder()
                .status("already-resolved")
                .token(token)
                .build();
    }

    public static ApprovalWebhookResponse error(String message) {
        return ApprovalWebhookResponse.builder()
                .status("error")
                .error(message)
                .build();
    }
}
