package io.diskjockey.core.workspace;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import java.io.IOException;

/// The simulator could not be started or exited abnormally.
public class SimulatorException extends IOException {

    private final int exitCode;

    public SimulatorException(String message, int exitCode) {
        super(message);
        this.exitCode = exitCode;
    }

    public SimulatorException(String message, Throwable cause) {
        super(message, cause);
        this.exitCode = -1;
    }

    /// The process exit code, or -1 if the process never ran to completion.
    public int exitCode() {
        return exitCode;
    }
}
