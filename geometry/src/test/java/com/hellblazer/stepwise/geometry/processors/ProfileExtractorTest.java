/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 */
package com.hellblazer.stepwise.geometry.processors;

import com.hellblazer.stepwise.geometry.GeometryConfig;
import com.hellblazer.stepwise.geometry.GeometryException;
import com.hellblazer.stepwise.geometry.profile.ProfileType;
import com.hellblazer.stepwise.parser.EntityId;
import com.hellblazer.stepwise.parser.StepException;
import com.hellblazer.stepwise.parser.StepModel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static com.hellblazer.stepwise.geometry.GeometryFixtures.model;
import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class ProfileExtractorTest {

    private static final String PROFILES = """
                                           #1=IFCCARTESIANPOINT((0.,0.));
                                           #2=IFCCARTESIANPOINT((4.,0.));
                                           #3=IFCCARTESIANPOINT((4.,3.));
                                           #4=IFCCARTESIANPOINT((0.,3.));
                                           #5=IFCCARTESIANPOINT((1.,1.));
                                           #6=IFCCARTESIANPOINT((2.,1.));
                                           #7=IFCCARTESIANPOINT((2.,2.));
                                           #8=IFCCARTESIANPOINT((10.,20.));
                                           #9=IFCDIRECTION((0.,1.));
                                           #10=IFCPOLYLINE((#1,#2,#3,#4,#1));
                                           #11=IFCPOLYLINE((#5,#6,#7,#5));
                                           #12=IFCPOLYLINE((#5,#6));
                                           #13=IFCCARTESIANPOINTLIST2D(((0.,0.),(4.,0.),(4.,3.),(0.,3.)));
                                           #14=IFCINDEXEDPOLYCURVE(#13,$,.F.);
                                           #15=IFCTRIMMEDCURVE($,$,$,.T.,.CARTESIAN.);
                                           #16=IFCAXIS2PLACEMENT2D(#8,#9);
                                           #20=IFCRECTANGLEPROFILEDEF(.AREA.,$,$,2.,1.);
                                           #21=IFCRECTANGLEPROFILEDEF(.AREA.,$,#16,2.,1.);
                                           #22=IFCRECTANGLEPROFILEDEF(.AREA.,$,$,0.,1.);
                                           #23=IFCCIRCLEPROFILEDEF(.AREA.,$,$,2.);
                                           #24=IFCCIRCLEPROFILEDEF(.AREA.,$,$,-1.);
                                           #25=IFCCIRCLEHOLLOWPROFILEDEF(.AREA.,$,$,2.,0.5);
                                           #26=IFCCIRCLEHOLLOWPROFILEDEF(.AREA.,$,$,1.,1.);
                                           #30=IFCARBITRARYCLOSEDPROFILEDEF(.AREA.,$,#10);
                                           #31=IFCARBITRARYCLOSEDPROFILEDEF(.AREA.,$,#14);
                                           #32=IFCARBITRARYPROFILEDEFWITHVOIDS(.AREA.,$,#10,(#11,#12));
                                           #33=IFCARBITRARYCLOSEDPROFILEDEF(.AREA.,$,#15);
                                           #40=IFCISHAPEPROFILEDEF(.AREA.,$,$,0.2,0.4,0.01,0.02,$,$,$);
                                           #41=IFCLSHAPEPROFILEDEF(.AREA.,$,$,0.1,$,0.01,$,$,$,$);
                                           #42=IFCTSHAPEPROFILEDEF(.AREA.,$,$,0.3,0.2,0.02,0.03,$,$,$,$,$,$);
                                           #43=IFCISHAPEPROFILEDEF(.AREA.,$,$,0.2,0.4,0.,0.02,$,$,$);
                                           #50=IFCELLIPSEPROFILEDEF(.AREA.,$,$,2.,1.);
                                           """;

    private StepModel        model;
    private ProfileExtractor extractor;

    @BeforeEach
    void setUp() {
        model = model(PROFILES);
        extractor = new ProfileExtractor(GeometryConfig.defaultConfig());
    }

    @Test
    void testArbitraryClosed() {
        var profile = extractor.extract(model.resolve(EntityId.of(30)), model);
        assertEquals(ProfileType.ARBITRARY, profile.getType());
        // closing duplicate dropped
        assertEquals(4, profile.vertexCount());
        assertEquals(12.0, profile.area(), 1e-9);

        var indexed = extractor.extract(model.resolve(EntityId.of(31)), model);
        assertEquals(4, indexed.vertexCount());
        assertEquals(12.0, indexed.area(), 1e-9);
    }

    @Test
    void testCircles() {
        var circle = extractor.extract(model.resolve(EntityId.of(23)), model);
        assertEquals(ProfileType.CIRCLE, circle.getType());
        assertEquals(12, circle.vertexCount());

        var hollow = extractor.extract(model.resolve(EntityId.of(25)), model);
        assertEquals(ProfileType.HOLLOW_CIRCLE, hollow.getType());
        assertEquals(1, hollow.getHoles().size());
        // inner radius 1.5
        assertEquals(10, hollow.getHoles().get(0).size());

        assertThrows(GeometryException.Profile.class, () -> extractor.extract(model.resolve(EntityId.of(24)), model));
        assertThrows(GeometryException.Profile.class, () -> extractor.extract(model.resolve(EntityId.of(26)), model));
    }

    @Test
    void testCirclesFollowConfiguredSegments() {
        var coarse = new ProfileExtractor(GeometryConfig.builder().withCircleSegments(3, 6).build());
        assertEquals(6, coarse.extract(model.resolve(EntityId.of(23)), model).vertexCount());
    }

    @Test
    void testCurvePoints() {
        var closed3D = extractor.curvePoints3D(EntityId.of(10), model);
        assertEquals(5, closed3D.size());
        assertEquals(0.0, closed3D.get(4).z, 1e-12);
        assertEquals(4, extractor.curvePoints2D(EntityId.of(10), model).size());
        assertThrows(GeometryException.UnsupportedType.class, () -> extractor.curvePoints2D(EntityId.of(15), model));
    }

    @Test
    void testPlacedRectangle() {
        var rect = extractor.extract(model.resolve(EntityId.of(20)), model);
        assertEquals(ProfileType.RECTANGLE, rect.getType());
        assertEquals(-1.0, rect.getOuter().get(0).x, 1e-12);

        // quarter turn about (10, 20): (-1, -0.5) becomes (10.5, 19)
        var placed = extractor.extract(model.resolve(EntityId.of(21)), model);
        assertEquals(10.5, placed.getOuter().get(0).x, 1e-12);
        assertEquals(19.0, placed.getOuter().get(0).y, 1e-12);
        assertEquals(2.0, placed.area(), 1e-12);

        assertThrows(GeometryException.Profile.class, () -> extractor.extract(model.resolve(EntityId.of(22)), model));
    }

    @Test
    void testShapes() {
        var i = extractor.extract(model.resolve(EntityId.of(40)), model);
        assertEquals(12, i.vertexCount());
        assertEquals(2 * 0.2 * 0.02 + (0.4 - 2 * 0.02) * 0.01, i.area(), 1e-12);

        // width defaults to depth
        var l = extractor.extract(model.resolve(EntityId.of(41)), model);
        assertEquals(6, l.vertexCount());
        assertEquals(0.01 * (0.1 + 0.1 - 0.01), l.area(), 1e-12);

        var t = extractor.extract(model.resolve(EntityId.of(42)), model);
        assertEquals(8, t.vertexCount());
        assertEquals(0.2 * 0.03 + (0.3 - 0.03) * 0.02, t.area(), 1e-12);

        assertThrows(GeometryException.Profile.class, () -> extractor.extract(model.resolve(EntityId.of(43)), model));
    }

    @Test
    void testUnsupported() {
        var e = assertThrows(GeometryException.UnsupportedType.class,
                             () -> extractor.extract(model.resolve(EntityId.of(50)), model));
        assertEquals("IFCELLIPSEPROFILEDEF", e.getTypeName());
        assertThrows(GeometryException.UnsupportedType.class,
                     () -> extractor.extract(model.resolve(EntityId.of(33)), model));
        assertThrows(StepException.EntityNotFound.class, () -> extractor.curvePoints2D(EntityId.of(99), model));
    }

    @Test
    void testWithVoids() {
        var profile = extractor.extract(model.resolve(EntityId.of(32)), model);
        // the two point inner curve is skipped
        assertEquals(1, profile.getHoles().size());
        assertEquals(12.0 - 0.5, profile.area(), 1e-9);
    }
}
