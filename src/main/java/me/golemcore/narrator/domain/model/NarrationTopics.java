package me.golemcore.narrator.domain.model;

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
 * All bus channels known to the core.
 *
 * <p>
 * {@code tts:*} topics carry requests and collaborator lifecycle signals,
 * {@code queue:*} topics are notifications for presentation collaborators and
 * {@code audio:*} topics are commands for the playback collaborator.
 */
public final class NarrationTopics {

    public static final Topic<SpeechRequest> REQUEST = Topic.of("tts:request", SpeechRequest.class);
    public static final Topic<SessionRef> STARTED = Topic.of("tts:started", SessionRef.class);
    public static final Topic<SessionProgress> PROGRESS = Topic.of("tts:progress", SessionProgress.class);
    public static final Topic<SessionRef> COMPLETED = Topic.of("tts:completed", SessionRef.class);
    public static final Topic<SessionError> ERROR = Topic.of("tts:error", SessionError.class);
    public static final Topic<SynthesisRequest> SYNTHESIZE = Topic.of("tts:synthesize", SynthesisRequest.class);

    public static final Topic<SessionStarted> QUEUE_STARTED = Topic.of("queue:started", SessionStarted.class);
    public static final Topic<SessionStopped> QUEUE_STOPPED = Topic.of("queue:stopped", SessionStopped.class);
    public static final Topic<SessionRef> QUEUE_PAUSED = Topic.of("queue:paused", SessionRef.class);
    public static final Topic<SessionRef> QUEUE_RESUMED = Topic.of("queue:resumed", SessionRef.class);
    public static final Topic<SessionRef> QUEUE_COMPLETED = Topic.of("queue:completed", SessionRef.class);
    public static final Topic<RequestQueued> QUEUE_ENQUEUED = Topic.of("queue:enqueued", RequestQueued.class);
    public static final Topic<RequestRejected> QUEUE_REJECTED = Topic.of("queue:rejected", RequestRejected.class);
    public static final Topic<QueueFailure> QUEUE_ERROR = Topic.of("queue:error", QueueFailure.class);

    public static final Topic<SessionRef> AUDIO_STOP = Topic.of("audio:stop", SessionRef.class);
    public static final Topic<SessionRef> AUDIO_PAUSE = Topic.of("audio:pause", SessionRef.class);
    public static final Topic<SessionRef> AUDIO_RESUME = Topic.of("audio:resume", SessionRef.class);

    public static final Topic<PluginRegistered> PLUGIN_REGISTERED = Topic.of("plugin:registered",
            PluginRegistered.class);
    public static final Topic<PipelineFailure> PIPELINE_ERROR = Topic.of("pipeline:error", PipelineFailure.class);
    public static final Topic<CoreInitialized> CORE_INITIALIZED = Topic.of("core:initialized",
            CoreInitialized.class);

    private NarrationTopics() {
    }
}
