/*
 * ColumnType.java
 *
 * This source file is part of the emschema open source project
 *
 * Copyright 2026 the emschema project authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.emschema.models.metadata;

import com.google.common.base.Preconditions;
import io.emschema.annotation.API;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * The storage type of a column.
 *
 * <p>
 * Scalar types are shared constants. Geometry types carry the geometry tag supplied by the schema (for example
 * {@code POINTZ}) and a dimension; the compiler does not interpret the tag, it only hands it to the storage engine.
 * </p>
 */
@API(API.Status.UNSTABLE)
public final class ColumnType {
    /**
     * Kinds of column type.
     */
    public enum Code {
        NUMERIC,
        INTEGER,
        FLOAT,
        STRING,
        BOOLEAN,
        GEOMETRY
    }

    public static final ColumnType NUMERIC = new ColumnType(Code.NUMERIC, null, 0);
    public static final ColumnType INTEGER = new ColumnType(Code.INTEGER, null, 0);
    public static final ColumnType FLOAT = new ColumnType(Code.FLOAT, null, 0);
    public static final ColumnType STRING = new ColumnType(Code.STRING, null, 0);
    public static final ColumnType BOOLEAN = new ColumnType(Code.BOOLEAN, null, 0);

    @Nonnull
    private final Code code;
    @Nullable
    private final String geometryTag;
    private final int dimension;

    private ColumnType(@Nonnull Code code, @Nullable String geometryTag, int dimension) {
        this.code = code;
        this.geometryTag = geometryTag;
        this.dimension = dimension;
    }

    /**
     * A geometry type.
     *
     * @param geometryTag the geometry tag, such as {@code POINTZ}
     * @param dimension number of coordinates per point
     * @return the geometry column type
     */
    @Nonnull
    public static ColumnType geometry(@Nonnull String geometryTag, int dimension) {
        Preconditions.checkArgument(dimension >= 2 && dimension <= 4, "unsupported geometry dimension %s", dimension);
        return new ColumnType(Code.GEOMETRY, geometryTag, dimension);
    }

    @Nonnull
    public Code getCode() {
        return code;
    }

    public boolean isGeometry() {
        return code == Code.GEOMETRY;
    }

    /**
     * The geometry tag of a geometry type.
     * @return the tag, or {@code null} for scalar types
     */
    @Nullable
    public String getGeometryTag() {
        return geometryTag;
    }

    /**
     * The dimension of a geometry type.
     * @return the dimension, or {@code 0} for scalar types
     */
    public int getDimension() {
        return dimension;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ColumnType that = (ColumnType)o;
        return code == that.code && dimension == that.dimension && Objects.equals(geometryTag, that.geometryTag);
    }

    @Override
    public int hashCode() {
        return Objects.hash(code, geometryTag, dimension);
    }

    @Override
    public String toString() {
        if (isGeometry()) {
            return code + "(" + geometryTag + ", " + dimension + ")";
        }
        return code.toString();
    }
}
