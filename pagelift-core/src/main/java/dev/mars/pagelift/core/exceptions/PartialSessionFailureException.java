package dev.mars.pagelift.core.exceptions;

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


import dev.mars.pagelift.core.SessionResult;

/**
 * Exception raised for a session that ended with one or more permanently failed ranges.
 * Running the upload again is safe and only sends the ranges still missing remotely.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class PartialSessionFailureException extends PageliftException {

    private final SessionResult result;

    public PartialSessionFailureException(SessionResult result) {
        super(result.getMessage().orElse("Upload incomplete"));
        this.result = result;
    }

    public SessionResult getResult() {
        return result;
    }

    public int getFailedRequestCount() {
        return result.getFailedRequestCount();
    }
}
