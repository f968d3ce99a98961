/*
 * BuiltInSchemas.java
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

package io.emschema.models.schema;

import io.emschema.annotation.API;

import javax.annotation.Nonnull;

/**
 * The annotation schemas that ship with the compiler, and the point records they are built from.
 *
 * <p>
 * Points are stored as 3-D PostGIS geometries. A <em>bound</em> point additionally records the supervoxel and the
 * root segment it falls in; its {@code root_id} is what ties an annotation row to the dataset's root table.
 * </p>
 */
@API(API.Status.UNSTABLE)
public final class BuiltInSchemas {
    public static final String POINTZ = "POINTZ";

    /** A position in voxel space. */
    public static final AnnotationSchema SPATIAL_POINT = AnnotationSchema.newBuilder("SpatialPoint")
            .addField("position", FieldDescriptor.newBuilder(FieldKind.LIST)
                    .setPostgisGeometry(POINTZ)
                    .setIndexed(true)
                    .setDescription("spatial position in voxels of x,y,z of annotation")
                    .build())
            .build();

    /** A position bound to the segmentation it falls in. */
    public static final AnnotationSchema BOUND_SPATIAL_POINT = SPATIAL_POINT.extend("BoundSpatialPoint")
            .addField("supervoxel_id", FieldDescriptor.newBuilder(FieldKind.NUMERIC)
                    .setIndexed(true)
                    .setDescription("supervoxel id of this point")
                    .build())
            .addField("root_id", FieldDescriptor.newBuilder(FieldKind.NUMERIC)
                    .setIndexed(true)
                    .setDescription("root id of the bound point")
                    .build())
            .build();

    /** Fields shared by every annotation. */
    public static final AnnotationSchema ANNOTATION = AnnotationSchema.newBuilder("Annotation")
            .addField("type", FieldDescriptor.newBuilder(FieldKind.STRING)
                    .setDropColumn(true)
                    .setDescription("type of annotation")
                    .build())
            .addField("valid", FieldDescriptor.newBuilder(FieldKind.BOOLEAN)
                    .setDescription("is this annotation valid")
                    .build())
            .build();

    public static final AnnotationSchema SYNAPSE = ANNOTATION.extend("synapse")
            .addField("pre_pt", FieldDescriptor.nested(BOUND_SPATIAL_POINT)
                    .setDescription("a point on the pre-synaptic side of the synapse")
                    .build())
            .addField("ctr_pt", FieldDescriptor.nested(SPATIAL_POINT)
                    .setDescription("a point at the center of the synapse")
                    .build())
            .addField("post_pt", FieldDescriptor.nested(BOUND_SPATIAL_POINT)
                    .setDescription("a point on the post-synaptic side of the synapse")
                    .build())
            .addField("size", FieldDescriptor.newBuilder(FieldKind.FLOAT)
                    .setDescription("size of synapse")
                    .build())
            .build();

    /** Adjacency between two root segments. Compiled into the optional contact table of a dataset. */
    public static final AnnotationSchema CONTACT = ANNOTATION.extend("contact")
            .addField("sidea_pt", FieldDescriptor.nested(BOUND_SPATIAL_POINT)
                    .setDescription("a point on side A of the contact")
                    .build())
            .addField("sideb_pt", FieldDescriptor.nested(BOUND_SPATIAL_POINT)
                    .setDescription("a point on side B of the contact")
                    .build())
            .addField("ctr_pt", FieldDescriptor.nested(SPATIAL_POINT)
                    .setDescription("a point at the center of the contact")
                    .build())
            .addField("size", FieldDescriptor.newBuilder(FieldKind.FLOAT)
                    .setDescription("size of the contact")
                    .build())
            .build();

    public static final AnnotationSchema CELL_TYPE_LOCAL = ANNOTATION.extend("cell_type_local")
            .addField("cell_type", FieldDescriptor.newBuilder(FieldKind.STRING)
                    .setIndexed(true)
                    .setDescription("cell type name")
                    .build())
            .addField("classification_system", FieldDescriptor.newBuilder(FieldKind.STRING)
                    .setDescription("classification system the cell type belongs to")
                    .build())
            .addField("pt", FieldDescriptor.nested(BOUND_SPATIAL_POINT)
                    .setDescription("location of the cell")
                    .build())
            .build();

    public static final AnnotationSchema MICRONS_FUNC_COREG = ANNOTATION.extend("microns_func_coreg")
            .addField("func_id", FieldDescriptor.newBuilder(FieldKind.INTEGER)
                    .setDescription("functional cell id")
                    .build())
            .addField("pt", FieldDescriptor.nested(BOUND_SPATIAL_POINT)
                    .setDescription("location of the cell body")
                    .build())
            .build();

    /** Base of the reference schemas: annotations that point at a synapse. */
    public static final AnnotationSchema SYNAPSE_REFERENCE = ANNOTATION.extend("SynapseReference")
            .addField(AnnotationSchema.TARGET_ID, FieldDescriptor.newBuilder(FieldKind.REFERENCE)
                    .setReferenceType("synapse")
                    .setDescription("id of the synapse this annotation references")
                    .build())
            .setReference(true)
            .build();

    public static final AnnotationSchema PRESYNAPTIC_BOUTON_TYPE = SYNAPSE_REFERENCE.extend("presynaptic_bouton_type")
            .addField("bouton_type", FieldDescriptor.newBuilder(FieldKind.STRING)
                    .setDescription("type of presynaptic bouton")
                    .build())
            .build();

    public static final AnnotationSchema POSTSYNAPTIC_COMPARTMENT = SYNAPSE_REFERENCE.extend("postsynaptic_compartment")
            .addField("compartment", FieldDescriptor.newBuilder(FieldKind.STRING)
                    .setDescription("compartment of the postsynaptic side")
                    .build())
            .build();

    private BuiltInSchemas() {
    }

    /**
     * A registry holding every built-in annotation schema under its name. The point records and
     * {@link #CONTACT} are not registered: the former are not annotations, the latter is compiled on request by
     * dataset assembly.
     *
     * @return a new registry of the built-in annotation schemas
     */
    @Nonnull
    public static InMemorySchemaRegistry registry() {
        return InMemorySchemaRegistry.newBuilder()
                .register(SYNAPSE)
                .register(CELL_TYPE_LOCAL)
                .register(MICRONS_FUNC_COREG)
                .register(PRESYNAPTIC_BOUTON_TYPE)
                .register(POSTSYNAPTIC_COMPARTMENT)
                .build();
    }
}
