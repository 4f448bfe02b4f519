package me.golemcore.thread.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for the thread engine, bound from
 * application.properties under the {@code thread.*} prefix.
 *
 * <ul>
 * <li>{@link LoopProperties} - turn defaults (iteration cap, sink behavior)</li>
 * <li>{@link StreamProperties} - previews, raw chunk limits, replay buffer</li>
 * <li>{@link ActionsProperties} - action timeouts and approval waits</li>
 * <li>{@link EffectsProperties} - effect journal retention</li>
 * <li>{@link CoordinatorProperties} - per-context turn queue</li>
 * <li>{@link GenerationProperties} - live generation provider</li>
 * </ul>
 */
@Component
@ConfigurationProperties(prefix = "thread")
@Data
public class ThreadProperties {

    private LoopProperties loop = new LoopProperties();
    private StreamProperties stream = new StreamProperties();
    private ActionsProperties actions = new ActionsProperties();
    private EffectsProperties effects = new EffectsProperties();
    private CoordinatorProperties coordinator = new CoordinatorProperties();
    private GenerationProperties generation = new GenerationProperties();

    @Data
    public static class LoopProperties {
        private int maxIterations = 20;
        private int maxModelSteps = 1;
        private boolean sendFinish = true;
        private boolean preventClose = false;
        private boolean silent = false;
    }

    @Data
    public static class StreamProperties {
        private int previewChars = 240;
        private int maxRawStringChars = 20_000;
        private int replayBufferSize = 256;
    }

    @Data
    public static class ActionsProperties {
        private long timeoutSeconds = 300;
        /** 0 waits without a deadline. */
        private long approvalTimeoutSeconds = 3600;
        private long approvalRetentionMinutes = 120;
    }

    @Data
    public static class EffectsProperties {
        private long retentionMinutes = 60;
    }

    @Data
    public static class CoordinatorProperties {
        private int maxQueuedTurns = 100;
    }

    @Data
    public static class GenerationProperties {
        private String provider = "openai";
        private String apiKey;
        private String baseUrl;
        private String model = "gpt-4o-mini";
        private long timeoutMs = 120_000;
        private Double temperature;
        private int maxRetries = 2;
    }
}
