/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 */
package com.hellblazer.stepwise.geometry.processors;

import com.hellblazer.stepwise.parser.EntityId;
import com.hellblazer.stepwise.parser.StepException;
import org.junit.jupiter.api.Test;

import static com.hellblazer.stepwise.geometry.GeometryFixtures.model;
import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class TriangulatedFaceSetProcessorTest {

    private static final String FACE_SETS = """
                                            #1=IFCCARTESIANPOINTLIST3D(((0.,0.,0.),(1.,0.,0.),(1.,1.,0.),(0.,1.,0.)));
                                            #2=IFCTRIANGULATEDFACESET(#1,$,.T.,((1,2,3),(1,3,4)),$);
                                            #3=IFCTRIANGULATEDFACESET(#1,$,.T.,((1,2,5)),$);
                                            #4=IFCTRIANGULATEDFACESET(#1,$,.T.,((1,2)),$);
                                            #5=IFCTRIANGULATEDFACESET(#1,$,.T.,((0,1,2)),$);
                                            #6=IFCCARTESIANPOINTLIST2D(((0.,0.),(2.,0.),(0.,2.)));
                                            #7=IFCTRIANGULATEDFACESET(#6,$,$,((1,2,3)),$);
                                            """;

    private final TriangulatedFaceSetProcessor processor = new TriangulatedFaceSetProcessor();

    @Test
    void testBadIndices() {
        var model = model(FACE_SETS);
        for (var id : new long[] { 3, 4, 5 }) {
            var e = assertThrows(StepException.InvalidAttribute.class,
                                 () -> processor.process(model.resolve(EntityId.of(id)), model));
            assertEquals(3, e.getIndex());
            assertEquals(EntityId.of(id), e.getEntityId().orElseThrow());
        }
    }

    @Test
    void testOneBasedIndices() {
        var model = model(FACE_SETS);
        var mesh = processor.process(model.resolve(EntityId.of(2)), model);
        assertEquals(4, mesh.vertexCount());
        assertEquals(2, mesh.triangleCount());
        assertArrayEquals(new int[] { 0, 1, 2, 0, 2, 3 }, mesh.getIndices().toArray());
        assertEquals(1.0, mesh.area(), 1e-9);
        assertEquals(1.0, mesh.getNormal(3).z, 1e-6);
    }

    @Test
    void testPlanarCoordinates() {
        var model = model(FACE_SETS);
        var mesh = processor.process(model.resolve(EntityId.of(7)), model);
        assertEquals(2.0, mesh.area(), 1e-9);
        assertEquals(0.0, mesh.getPosition(2).z, 1e-12);
    }
}
