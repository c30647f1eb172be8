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

import org.dom4j.Attribute;
import org.dom4j.DocumentHelper;
import org.dom4j.Element;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Finds a child element of a given type, or synthesizes its default subtree.
///
/// ```text
///  parent ──► first child with tag == type.tag() ──► Resolution(child, false, n)
///     │
///     └─ none ──► generateDefault(type) ──────────► Resolution(detached, true, 0)
///                   │
///                   ├─ attributes from UrdfDefaultSchema
///                   └─ required children, depth-first
/// ```
///
/// Only direct children are matched. When several children share the tag the
/// first one in document order wins and the others are left alone.
public final class UrdfFindOrDefault {

    /// Result of looking a child up.
    ///
    /// @param element the existing child, or a detached default subtree
    /// @param synthesized whether `element` was generated rather than found
    /// @param matchCount how many direct children have the requested tag
    public record Resolution(Element element, boolean synthesized, int matchCount) {
    }

    private UrdfFindOrDefault() {
    }

    /// Looks up a child without modifying `parent`.
    ///
    /// @param parent the element to search
    /// @param type the child type
    /// @return the resolution
    public static Resolution resolve(Element parent, UrdfElementType type) {
        Objects.requireNonNull(parent, "parent cannot be null");
        Objects.requireNonNull(type, "type cannot be null");
        List<Element> matches = parent.elements(type.tag());
        if (!matches.isEmpty()) {
            return new Resolution(matches.get(0), false, matches.size());
        }
        return new Resolution(generateDefault(type), true, 0);
    }

    /// Returns the first child of the given type, appending a default subtree
    /// to `parent` first if there is none.
    ///
    /// @param parent the element to search
    /// @param type the child type
    /// @return the child, now attached to `parent`
    public static Element findOrDefault(Element parent, UrdfElementType type) {
        Resolution resolution = resolve(parent, type);
        if (resolution.synthesized()) {
            parent.add(resolution.element());
        }
        return resolution.element();
    }

    /// Builds the detached default subtree for a type.
    ///
    /// @param type the element type
    /// @return a new element with default attributes and required children
    public static Element generateDefault(UrdfElementType type) {
        UrdfDefaultSchema.ElementDefaults defaults = UrdfDefaultSchema.get(type);
        Element element = DocumentHelper.createElement(type.tag());
        for (Map.Entry<String, String> attribute : defaults.attributes().entrySet()) {
            element.addAttribute(attribute.getKey(), attribute.getValue());
        }
        for (UrdfElementType child : defaults.children()) {
            element.add(generateDefault(child));
        }
        return element;
    }

    /// Replaces every attribute of `element` with `attributes`, written in map order.
    ///
    /// @param element the element to rewrite
    /// @param attributes the new attributes
    public static void replaceAttributes(Element element, Map<String, String> attributes) {
        for (Attribute existing : new ArrayList<>(element.attributes())) {
            element.remove(existing);
        }
        for (Map.Entry<String, String> attribute : attributes.entrySet()) {
            element.addAttribute(attribute.getKey(), attribute.getValue());
        }
    }
}
