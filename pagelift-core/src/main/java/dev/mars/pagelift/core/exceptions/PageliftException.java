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
 * Base exception class for all Pagelift-related exceptions.
 * Provides a common hierarchy for error handling throughout the upload engine.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class PageliftException extends Exception {

    public PageliftException(String message) {
        super(message);
    }

    public PageliftException(String message, Throwable cause) {
        super(message, cause);
    }

    public PageliftException(Throwable cause) {
        super(cause);
    }
}
