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

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.TypeAdapter;
import com.google.gson.TypeAdapterFactory;
import com.google.gson.internal.Streams;
import com.google.gson.reflect.TypeToken;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonWriter;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * GSON TypeAdapterFactory for polymorphic {@link CollisionGeometry} serialization.
 *
 * <p>Each geometry is written as a JSON object whose first field is "type",
 * holding the {@link GeometryType} name of the variant, followed by the
 * variant's own fields:
 *
 * <pre>{@code
 *  Box(half_lengths=(0.5, 1, 1.5))      { "type": "box",
 *        │                                "half_lengths": {"x":0.5,"y":1.0,"z":1.5} }
 *        ▼                                         │
 *  1. Look up @GeometryType("box")       1. Read "type" field
 *  2. Serialize record components        2. Look up registered variant
 *  3. Prepend "type" field               3. Deserialize with delegate
 * }</pre>
 *
 * <h2>Usage</h2>
 *
 * <pre>{@code
 * Gson gson = new GsonBuilder()
 *     .registerTypeAdapterFactory(CollisionGeometryTypeAdapterFactory.create())
 *     .create();
 * CollisionGeometry restored = gson.fromJson("{\"type\":\"sphere\",\"radius\":0.1}", CollisionGeometry.class);
 * }</pre>
 *
 * @see GeometryType
 */
public final class CollisionGeometryTypeAdapterFactory implements TypeAdapterFactory {

    private static final String TYPE_FIELD = "type";

    private final Map<String, Class<? extends CollisionGeometry>> typeToClass = new LinkedHashMap<>();
    private final Map<Class<? extends CollisionGeometry>, String> classToType = new LinkedHashMap<>();

    private CollisionGeometryTypeAdapterFactory() {
    }

    /**
     * Creates a new factory with every geometry variant registered.
     *
     * @return a configured factory
     */
    public static CollisionGeometryTypeAdapterFactory create() {
        CollisionGeometryTypeAdapterFactory factory = new CollisionGeometryTypeAdapterFactory();
        for (Class<?> permitted : CollisionGeometry.class.getPermittedSubclasses()) {
            factory.registerType(permitted.asSubclass(CollisionGeometry.class));
        }
        return factory;
    }

    /**
     * Registers a geometry variant by its {@link GeometryType} annotation.
     *
     * @param geometryClass the variant class
     * @throws IllegalArgumentException if the class is not annotated or the
     *         type name is already registered
     */
    public void registerType(Class<? extends CollisionGeometry> geometryClass) {
        GeometryType annotation = geometryClass.getAnnotation(GeometryType.class);
        if (annotation == null) {
            throw new IllegalArgumentException(
                "Class " + geometryClass.getName() + " has no @GeometryType annotation");
        }
        String typeName = annotation.value();
        if (typeToClass.containsKey(typeName)) {
            throw new IllegalArgumentException(
                "Type '" + typeName + "' is already registered to " + typeToClass.get(typeName).getName());
        }
        typeToClass.put(typeName, geometryClass);
        classToType.put(geometryClass, typeName);
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T> TypeAdapter<T> create(Gson gson, TypeToken<T> type) {
        if (!CollisionGeometry.class.isAssignableFrom(type.getRawType())) {
            return null;
        }

        return new TypeAdapter<T>() {
            @Override
            public void write(JsonWriter out, T value) throws IOException {
                if (value == null) {
                    out.nullValue();
                    return;
                }

                String typeName = classToType.get(value.getClass());
                if (typeName == null) {
                    typeName = ((CollisionGeometry) value).getGeometryType();
                }

                TypeAdapter<T> concreteDelegate = (TypeAdapter<T>) gson.getDelegateAdapter(
                    CollisionGeometryTypeAdapterFactory.this,
                    TypeToken.get(value.getClass())
                );
                JsonElement tree = concreteDelegate.toJsonTree(value);

                JsonObject result = new JsonObject();
                result.addProperty(TYPE_FIELD, typeName);
                if (tree.isJsonObject()) {
                    for (Map.Entry<String, JsonElement> entry : tree.getAsJsonObject().entrySet()) {
                        if (!TYPE_FIELD.equals(entry.getKey())) {
                            result.add(entry.getKey(), entry.getValue());
                        }
                    }
                }
                Streams.write(result, out);
            }

            @Override
            public T read(JsonReader in) throws IOException {
                JsonElement element = JsonParser.parseReader(in);
                if (element.isJsonNull()) {
                    return null;
                }
                if (!element.isJsonObject()) {
                    throw new JsonParseException("Expected a geometry object but found: " + element);
                }

                JsonObject obj = element.getAsJsonObject();
                if (!obj.has(TYPE_FIELD)) {
                    throw new JsonParseException("Missing '" + TYPE_FIELD + "' field in geometry JSON: " + obj);
                }

                String typeName = obj.get(TYPE_FIELD).getAsString();
                Class<? extends CollisionGeometry> targetClass = typeToClass.get(typeName);
                if (targetClass == null) {
                    throw new JsonParseException(
                        "Unknown geometry type: '" + typeName + "'. Known types: " + typeToClass.keySet());
                }

                JsonObject fields = obj.deepCopy();
                fields.remove(TYPE_FIELD);
                TypeAdapter<? extends CollisionGeometry> targetAdapter =
                    gson.getDelegateAdapter(CollisionGeometryTypeAdapterFactory.this, TypeToken.get(targetClass));
                return (T) targetAdapter.fromJsonTree(fields);
            }
        };
    }
}
