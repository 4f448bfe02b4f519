package me.golemcore.thread;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class of the thread engine service.
 *
 * <p>
 * Hosts the durable agent loop: a thread definition supplies prompts and
 * actions, a reactor produces each iteration, and every state change is
 * persisted and streamed to subscribers of the context.
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports & Adapters):
 *
 * <pre>
 * Input Layer        → stream, approval and query controllers
 * Domain Layer       → ThreadEngine, ContextRunCoordinator, action services
 * Infrastructure     → store, effect journal, stream and LLM adapters
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under the
 * {@code thread.*} prefix.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class ThreadApplication {

    public static void main(String[] args) {
        SpringApplication.run(ThreadApplication.class, args);
    }

}
