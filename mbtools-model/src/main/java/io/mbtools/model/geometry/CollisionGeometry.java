package io.mbtools.model.geometry;

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

/// Collision geometry attached to a body.
///
/// ## Variants
///
/// | Variant | Parameters | Exportable to URDF |
/// |---------|------------|--------------------|
/// | {@link Box} | half lengths per axis | yes, as `<box size="..."/>` |
/// | {@link Sphere} | radius | yes, as `<sphere radius="..."/>` |
/// | {@link Polygon} | vertex list | no, contact computation only |
/// | {@link HalfSpace} | none | no, world ground plane |
///
/// The set of variants is closed. Consumers dispatch through
/// [GeometryVisitor], so adding a variant breaks every consumer at compile
/// time until it handles the new case.
///
/// Geometries are pure data descriptions. The URDF encoding of a geometry
/// lives in the urdf module, not here.
///
/// @see GeometryVisitor
/// @see CollisionGeometryTypeAdapterFactory
public sealed interface CollisionGeometry permits Box, Sphere, Polygon, HalfSpace {

    /// Dispatches to the visitor method for this variant.
    ///
    /// @param visitor the visitor
    /// @param <R> the visitor result type
    /// @return the visitor result
    <R> R accept(GeometryVisitor<R> visitor);

    /// Returns the variant name used in diagnostics and JSON type fields.
    ///
    /// @return the variant name, e.g. "box"
    default String getGeometryType() {
        GeometryType annotation = getClass().getAnnotation(GeometryType.class);
        return annotation != null ? annotation.value() : getClass().getSimpleName();
    }
}
