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


/**
 * Exception thrown when the source image cannot be positioned or read.
 * A session cannot recover from it: no further chunk can be produced correctly, so the
 * session is aborted and the failure is never retried.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class SourceReadException extends PageliftException {

    private final long offset;

    public SourceReadException(long offset, String message, Throwable cause) {
        super(message, cause);
        this.offset = offset;
    }

    /**
     * Offset in the source image at which the failing seek or read started.
     */
    public long getOffset() {
        return offset;
    }
}
