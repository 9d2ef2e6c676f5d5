package io.diskjockey.core.pipeline;

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

import java.util.Objects;

/// Outcome of one probability evaluation.
///
/// | outcome    | meaning                                              | log-probability |
/// |------------|------------------------------------------------------|-----------------|
/// | `OK`       | the model was simulated and scored                   | finite          |
/// | `REJECTED` | the vector has zero posterior density                | `-∞`            |
/// | `FATAL`    | an infrastructure fault; the run must stop           | none            |
///
/// An `OK` result never carries NaN or an infinite value; [#ok(double)] turns
/// those into `REJECTED`.
public final class EvaluationResult {

    public enum Outcome {
        OK,
        REJECTED,
        FATAL
    }

    private final Outcome outcome;
    private final double lnProbability;
    private final String reason;
    private final Throwable cause;

    private EvaluationResult(Outcome outcome, double lnProbability, String reason, Throwable cause) {
        this.outcome = outcome;
        this.lnProbability = lnProbability;
        this.reason = reason;
        this.cause = cause;
    }

    /// A scored result, or a rejection if the value is not finite.
    public static EvaluationResult ok(double lnProbability) {
        if (!Double.isFinite(lnProbability)) {
            return rejected("non-finite log-probability " + lnProbability);
        }
        return new EvaluationResult(Outcome.OK, lnProbability, null, null);
    }

    public static EvaluationResult rejected(String reason) {
        return new EvaluationResult(Outcome.REJECTED, Double.NEGATIVE_INFINITY, reason, null);
    }

    public static EvaluationResult fatal(Throwable cause) {
        Objects.requireNonNull(cause, "cause");
        return new EvaluationResult(Outcome.FATAL, Double.NaN, cause.toString(), cause);
    }

    public Outcome outcome() {
        return outcome;
    }

    public boolean isFatal() {
        return outcome == Outcome.FATAL;
    }

    /// The log-probability: finite for `OK`, `-∞` for `REJECTED`.
    ///
    /// @throws IllegalStateException for a `FATAL` result
    public double lnProbability() {
        if (outcome == Outcome.FATAL) {
            throw new IllegalStateException("Fatal result has no log-probability", cause);
        }
        return lnProbability;
    }

    /// Why the vector was rejected or the evaluation failed, `null` for `OK`.
    public String reason() {
        return reason;
    }

    /// The fault behind a `FATAL` result, otherwise `null`.
    public Throwable cause() {
        return cause;
    }

    @Override
    public String toString() {
        return switch (outcome) {
            case OK -> "OK(" + lnProbability + ")";
            case REJECTED -> "REJECTED(" + reason + ")";
            case FATAL -> "FATAL(" + reason + ")";
        };
    }
}
