package me.golemcore.thread.adapter.outbound.approval;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.thread.domain.model.ActionApprovalEvent;
import me.golemcore.thread.domain.service.ApprovalTokens;
import me.golemcore.thread.infrastructure.config.ThreadProperties;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Approval source fed by {@link ActionApprovalEvent}s published inside the
 * application.
 */
@Component
@Slf4j
public class HookApprovalAdapter extends PendingApprovalRegistry {

    public HookApprovalAdapter(Clock clock, ThreadProperties properties) {
        super(clock, properties);
    }

    @Override
    public String getSourceName() {
        return ApprovalTokens.HOOK_SOURCE;
    }

    @EventListener
    public void onApproval(ActionApprovalEvent event) {
        if (!ApprovalTokens.belongsTo(event.token(), getSourceName())) {
            log.debug("[Approval] Ignoring event for foreign token {}", event.token());
            return;
        }
        resolve(event.token(), event.decision());
    }
}
