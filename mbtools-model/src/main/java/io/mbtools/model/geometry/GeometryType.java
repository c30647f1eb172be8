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

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Declares the type name of a {@link CollisionGeometry} variant.
 *
 * <p>The name is written as the "type" field when geometries are serialized to
 * JSON, and is used in error messages naming a variant.
 *
 * <pre>{@code
 * {
 *   "type": "box",
 *   "half_lengths": {"x": 0.05, "y": 0.05, "z": 0.05}
 * }
 * }</pre>
 *
 * @see CollisionGeometryTypeAdapterFactory
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
public @interface GeometryType {
    /**
     * The lowercase variant name, unique across all geometry variants.
     *
     * @return the type discriminator string
     */
    String value();
}
