package io.mbtools.model.inertia;

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

/// Conversion between the 10-entry pi parameterization of a body and its
/// URDF inertial form.
///
/// Implementations are pure functions. The URDF exporter only calls
/// [#piToUrdf(double[])]; [#urdfToPi(UrdfInertia)] serves analysis tooling
/// that reads learned parameters back out of exported documents.
public interface InertialParameterConverter {

    /// Length of a pi parameter row
    int PI_LENGTH = 10;

    /// Converts one pi row to mass, center of mass and inertia about the center of mass.
    ///
    /// @param pi a 10-entry row
    /// @return the URDF inertial form
    /// @throws IllegalArgumentException if the row is malformed or the mass is not positive
    UrdfInertia piToUrdf(double[] pi);

    /// Converts URDF inertial properties back to a pi row.
    ///
    /// @param inertia the URDF inertial form
    /// @return a new 10-entry row
    double[] urdfToPi(UrdfInertia inertia);
}
