package me.golemcore.thread.domain.component;

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

import me.golemcore.thread.domain.model.ReactorRequest;
import me.golemcore.thread.domain.model.ReactorResult;

/**
 * Pluggable reasoning unit invoked once per loop iteration.
 *
 * <p>
 * A reactor turns the context, prompt and available actions into a reaction
 * fragment plus the actions it wants executed. It may publish chunks through
 * {@link ReactorRequest#chunks()} while it works but never persists anything;
 * the loop controller owns all state.
 */
public interface ThreadReactor {

    /**
     * Provider name stamped on the chunks this reactor publishes.
     */
    String getProvider();

    ReactorResult react(ReactorRequest request);
}
