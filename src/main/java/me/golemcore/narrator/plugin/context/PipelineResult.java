package me.golemcore.narrator.plugin.context;

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

import me.golemcore.narrator.domain.model.NarrationEvent;
import me.golemcore.narrator.plugin.api.PipelineContext;
import me.golemcore.narrator.plugin.api.PluginProcessException;

import java.util.List;

/**
 * Outcome of one pipeline pass.
 *
 * @param event
 *            the event as left by the last plugin that ran
 * @param status
 *            how the pass ended
 * @param haltReason
 *            reason given by the halting plugin
 * @param haltedBy
 *            id of the halting plugin
 * @param failure
 *            required-plugin failure, set only for {@link Status#FAILED}
 * @param completed
 *            ids of plugins that processed the event
 * @param failed
 *            ids of plugins that threw
 */
public record PipelineResult(
        NarrationEvent<?> event,
        Status status,
        String haltReason,
        String haltedBy,
        PluginProcessException failure,
        List<String> completed,
        List<String> failed
) {

    public enum Status {
        COMPLETED, HALTED, FAILED
    }

    public boolean isCompleted() {
        return status == Status.COMPLETED;
    }

    static PipelineResult completed(NarrationEvent<?> event, PipelineContext context) {
        return new PipelineResult(event, Status.COMPLETED, null, null, null,
                List.copyOf(context.getCompleted()), List.copyOf(context.getFailed()));
    }

    static PipelineResult halted(NarrationEvent<?> event, PipelineContext context) {
        return new PipelineResult(event, Status.HALTED, context.getHaltReason(), context.getHaltedBy(), null,
                List.copyOf(context.getCompleted()), List.copyOf(context.getFailed()));
    }

    static PipelineResult failed(NarrationEvent<?> event, PluginProcessException failure,
            PipelineContext context) {
        return new PipelineResult(event, Status.FAILED, null, null, failure,
                List.copyOf(context.getCompleted()), List.copyOf(context.getFailed()));
    }
}
