/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 */
package com.hellblazer.stepwise.geometry.processors;

import com.hellblazer.stepwise.parser.EntityId;
import org.junit.jupiter.api.Test;

import javax.vecmath.Point3d;
import java.util.List;

import static com.hellblazer.stepwise.geometry.GeometryFixtures.assertOutward;
import static com.hellblazer.stepwise.geometry.GeometryFixtures.mixedGeometry;
import static com.hellblazer.stepwise.geometry.GeometryFixtures.model;
import static com.hellblazer.stepwise.geometry.GeometryFixtures.signedVolume;
import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class FacetedBrepProcessorTest {

    private static final String FACES = """
                                        #1=IFCCARTESIANPOINT((0.,0.,0.));
                                        #2=IFCCARTESIANPOINT((4.,0.,0.));
                                        #3=IFCCARTESIANPOINT((4.,4.,0.));
                                        #4=IFCCARTESIANPOINT((0.,4.,0.));
                                        #5=IFCCARTESIANPOINT((1.,1.,0.));
                                        #6=IFCCARTESIANPOINT((3.,1.,0.));
                                        #7=IFCCARTESIANPOINT((3.,3.,0.));
                                        #8=IFCCARTESIANPOINT((1.,3.,0.));
                                        #10=IFCPOLYLOOP((#1,#2,#3,#4));
                                        #11=IFCPOLYLOOP((#5,#6,#7,#8));
                                        #12=IFCPOLYLOOP((#1,#2));
                                        #20=IFCFACEOUTERBOUND(#10,.T.);
                                        #21=IFCFACEBOUND(#11,.T.);
                                        #22=IFCFACEBOUND(#12,.T.);
                                        #30=IFCFACE((#20,#21));
                                        #31=IFCFACE((#21,#20));
                                        #32=IFCFACE((#22));
                                        #40=IFCCLOSEDSHELL((#30));
                                        #41=IFCCLOSEDSHELL((#31,#32));
                                        #50=IFCFACETEDBREP(#40);
                                        #51=IFCFACETEDBREP(#41);
                                        """;

    private final FacetedBrepProcessor processor = new FacetedBrepProcessor();

    @Test
    void testCube() {
        var model = mixedGeometry().resolver();
        var mesh = processor.process(model.resolve(EntityId.of(203)), model);
        assertEquals(12, mesh.triangleCount());
        assertEquals(24, mesh.vertexCount());
        assertEquals(6.0, mesh.area(), 1e-6);
        // the reversed top face is flipped back by its false orientation
        assertOutward(mesh);
        assertEquals(1.0, signedVolume(mesh), 1e-6);
    }

    @Test
    void testDegenerateFaceFansOrSkips() {
        var collinear = List.of(new Point3d(0, 0, 0), new Point3d(1, 0, 0), new Point3d(2, 0, 0),
                                new Point3d(3, 0, 0), new Point3d(4, 0, 0));
        assertEquals(3, FacetedBrepProcessor.triangulateFace(collinear, List.of()).size() / 3);

        var quad = List.of(new Point3d(0, 0, 0), new Point3d(1, 0, 0), new Point3d(1, 1, 0), new Point3d(0, 1, 0));
        assertEquals(2, FacetedBrepProcessor.triangulateFace(quad, List.of()).size() / 3);
    }

    @Test
    void testFaceWithHole() {
        var model = model(FACES);
        var mesh = processor.process(model.resolve(EntityId.of(50)), model);
        assertEquals(8, mesh.triangleCount());
        assertEquals(12.0, mesh.area(), 1e-6);
        assertEquals(1.0, mesh.getNormal(0).z, 1e-6);
    }

    @Test
    void testOuterBoundAfterInner() {
        var model = model(FACES);
        // the two point bound of the second face is skipped, and with it the face
        var mesh = processor.process(model.resolve(EntityId.of(51)), model);
        assertEquals(8, mesh.triangleCount());
        assertEquals(12.0, mesh.area(), 1e-6);
        var bounds = mesh.bounds().orElseThrow();
        assertEquals(4.0, bounds.max().x, 1e-6);
    }
}
