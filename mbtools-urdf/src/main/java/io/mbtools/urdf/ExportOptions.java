package io.mbtools.urdf;

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

/// Options controlling the consistency checks of [MultibodyUrdfSerializer].
///
/// @param verifyBodyOrder check the request's body index against the plant enumeration
/// @param verifyLinkBinding check that links and bodies of each model correspond one-to-one
public record ExportOptions(boolean verifyBodyOrder, boolean verifyLinkBinding) {

    /// @return body order verification on, link binding verification off
    public static ExportOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Builder for [ExportOptions].
    public static final class Builder {
        private boolean verifyBodyOrder = true;
        private boolean verifyLinkBinding = false;

        private Builder() {
        }

        public Builder verifyBodyOrder(boolean verifyBodyOrder) {
            this.verifyBodyOrder = verifyBodyOrder;
            return this;
        }

        public Builder verifyLinkBinding(boolean verifyLinkBinding) {
            this.verifyLinkBinding = verifyLinkBinding;
            return this;
        }

        public ExportOptions build() {
            return new ExportOptions(verifyBodyOrder, verifyLinkBinding);
        }
    }
}
