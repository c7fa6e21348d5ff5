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


import java.util.List;

/**
 * Exception thrown before any transfer starts when an existing destination object cannot
 * be resumed, either because it carries no upload metadata or because that metadata does
 * not describe the local image. The caller has to start over with overwrite enabled.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class ReconciliationPrecheckException extends PageliftException {

    private final List<String> mismatches;

    public ReconciliationPrecheckException(String message) {
        this(message, List.of());
    }

    public ReconciliationPrecheckException(String message, List<String> mismatches) {
        super(message);
        this.mismatches = List.copyOf(mismatches);
    }

    public List<String> getMismatches() {
        return mismatches;
    }

    @Override
    public String getMessage() {
        if (mismatches.isEmpty()) {
            return super.getMessage();
        }
        return super.getMessage() + ": " + String.join("; ", mismatches);
    }
}
