package dev.mars.pagelift.transfer;

/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
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
 */


import dev.mars.pagelift.core.ProgressRecord;
import dev.mars.pagelift.core.SessionResult;

/**
 * Display sink for the progress of an upload session.
 * Callbacks are never concurrent and arrive in order.
 */
public interface ProgressListener {

    ProgressListener NONE = record -> { };

    default void onStart(boolean resuming) {
    }

    void onProgress(ProgressRecord record);

    default void onComplete(ProgressRecord finalRecord, SessionResult result) {
    }
}
