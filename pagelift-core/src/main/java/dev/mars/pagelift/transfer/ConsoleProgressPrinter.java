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

import java.io.PrintStream;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;

/**
 * Prints progress as a single self-overwriting console line with a spinner.
 */
public class ConsoleProgressPrinter implements ProgressListener {

    private static final char[] SPINNER = {'\\', '|', '/', '-'};
    private static final double ONE_MB = 1024.0 * 1024.0;

    private final PrintStream out;
    private int spinIndex;

    public ConsoleProgressPrinter() {
        this(System.out);
    }

    public ConsoleProgressPrinter(PrintStream out) {
        this.out = Objects.requireNonNull(out, "out");
    }

    @Override
    public void onStart(boolean resuming) {
        out.println();
        out.println(resuming ? "Resuming image upload.." : "Uploading the image..");
    }

    @Override
    public void onProgress(ProgressRecord record) {
        out.print(formatLine(record, SPINNER[spinIndex]));
        spinIndex = (spinIndex + 1) % SPINNER.length;
        out.flush();
    }

    @Override
    public void onComplete(ProgressRecord finalRecord, SessionResult result) {
        out.print(formatLine(finalRecord, ' '));
        out.println();
        if (!result.isSuccessful()) {
            result.getMessage().ifPresent(out::println);
        }
        out.flush();
    }

    static String formatLine(ProgressRecord record, char spinner) {
        return String.format(Locale.ROOT, "\r Completed: %3d%% [%10.2f MB] RemainingTime: %s Throughput: %d Mb/sec  %c ",
                (int) record.getPercentComplete(),
                record.getBytesProcessed() / ONE_MB,
                record.getRemainingDuration().map(ConsoleProgressPrinter::formatDuration).orElse("--h:--m:--s"),
                (int) record.getAverageThroughputMbPerSecond(),
                spinner);
    }

    static String formatDuration(Duration duration) {
        long seconds = duration.getSeconds();
        return String.format(Locale.ROOT, "%02dh:%02dm:%02ds", seconds / 3600, (seconds % 3600) / 60, seconds % 60);
    }
}
