package io.diskjockey.core;

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

/// Base of the recoverable failures raised while evaluating one parameter vector.
///
/// A probability evaluation that fails with a subtype of this exception yields
/// zero posterior density for that vector. Anything else is an infrastructure
/// fault and terminates the run.
///
/// @see io.diskjockey.core.model.ModelException
/// @see io.diskjockey.core.image.ImageException
public abstract class DiskJockeyException extends Exception {

    protected DiskJockeyException(String message) {
        super(message);
    }

    protected DiskJockeyException(String message, Throwable cause) {
        super(message, cause);
    }
}
