/*
 * Copyright 2026 copayj contributors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.copayj.chain;

/**
 * Options for size and fee estimation. Conservative estimates add safety margins; they are used for
 * payment protocol proposals, where an underestimated fee makes the merchant reject the payment.
 */
public final class EstimationOptions {
    public static final EstimationOptions DEFAULT = new EstimationOptions(false);
    public static final EstimationOptions CONSERVATIVE = new EstimationOptions(true);

    private final boolean conservative;

    private EstimationOptions(boolean conservative) {
        this.conservative = conservative;
    }

    public static EstimationOptions of(boolean conservative) {
        return conservative ? CONSERVATIVE : DEFAULT;
    }

    public boolean isConservative() {
        return conservative;
    }

    @Override
    public String toString() {
        return conservative ? "conservative" : "default";
    }
}
