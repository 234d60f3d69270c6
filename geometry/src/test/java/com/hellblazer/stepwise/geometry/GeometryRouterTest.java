/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 */
package com.hellblazer.stepwise.geometry;

import com.hellblazer.stepwise.parser.EntityId;
import com.hellblazer.stepwise.parser.StepException;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static com.hellblazer.stepwise.geometry.GeometryFixtures.assertOutward;
import static com.hellblazer.stepwise.geometry.GeometryFixtures.assertPoint;
import static com.hellblazer.stepwise.geometry.GeometryFixtures.mixedGeometry;
import static com.hellblazer.stepwise.geometry.GeometryFixtures.simpleWall;
import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class GeometryRouterTest {

    private static String mappedSquare(double size) {
        return String.format("""
                             #1=IFCCARTESIANPOINT((0.,0.,0.));
                             #2=IFCAXIS2PLACEMENT3D(#1,$,$);
                             #3=IFCCARTESIANPOINTLIST3D(((0.,0.,0.),(%1$s,0.,0.),(%1$s,%1$s,0.),(0.,%1$s,0.)));
                             #4=IFCTRIANGULATEDFACESET(#3,$,.T.,((1,2,3),(1,3,4)),$);
                             #5=IFCSHAPEREPRESENTATION($,'Body','Tessellation',(#4));
                             #6=IFCREPRESENTATIONMAP(#2,#5);
                             #7=IFCCARTESIANTRANSFORMATIONOPERATOR3D($,$,#1,$,$);
                             #8=IFCMAPPEDITEM(#6,#7);
                             #9=IFCSHAPEREPRESENTATION($,'Body','MappedRepresentation',(#8));
                             #10=IFCFURNITURE('g',$,'Chair',$,$,$,#11,$,$);
                             #11=IFCPRODUCTDEFINITIONSHAPE($,$,(#9));
                             """, Double.toString(size));
    }

    @Test
    void testColumnPlacedThroughParents() {
        var model = mixedGeometry();
        var router = GeometryRouter.forModel(model, GeometryConfig.defaultConfig());
        var mesh = router.processElement(EntityId.of(100), model.resolver());
        // the bounding box item is skipped, the axis representation filtered
        assertEquals(6 + 6 + 16, mesh.triangleCount());
        var bounds = mesh.bounds().orElseThrow();
        assertPoint(9.8, -0.2, 3, bounds.min());
        assertPoint(10.2, 0.2, 5.5, bounds.max());
        assertOutward(mesh);
    }

    @Test
    void testDanglingRepresentation() {
        var model = mixedGeometry();
        var router = GeometryRouter.forModel(model, GeometryConfig.defaultConfig());
        var e = assertThrows(StepException.EntityNotFound.class,
                             () -> router.processElement(EntityId.of(500), model.resolver()));
        assertEquals(EntityId.of(999), e.getEntityId());
    }

    @Test
    void testMappedItems() {
        var model = mixedGeometry();
        var router = GeometryRouter.forModel(model, GeometryConfig.defaultConfig());
        var first = router.processElement(EntityId.of(410), model.resolver());
        assertEquals(2, first.triangleCount());
        var bounds = first.bounds().orElseThrow();
        assertPoint(5, 5, 0, bounds.min());
        assertPoint(7, 7, 0, bounds.max());
        assertEquals(4.0, first.area(), 1e-6);

        // the cached representation is copied, never handed out
        first.scale(100);
        var second = router.processElement(EntityId.of(420), model.resolver());
        bounds = second.bounds().orElseThrow();
        assertPoint(0, 0, 0, bounds.min());
        assertPoint(1, 1, 0, bounds.max());

        router.clearCache();
        var again = router.processElement(EntityId.of(410), model.resolver());
        assertEquals(7.0, again.bounds().orElseThrow().max().x, 1e-6);
    }

    @Test
    void testMappedCacheIsPerModel() {
        var router = new GeometryRouter();
        var small = GeometryFixtures.model(mappedSquare(1.0));
        var large = GeometryFixtures.model(mappedSquare(10.0));

        var first = router.processElement(EntityId.of(10), small);
        assertPoint(1, 1, 0, first.bounds().orElseThrow().max());
        var second = router.processElement(EntityId.of(10), large);
        assertPoint(10, 10, 0, second.bounds().orElseThrow().max());
        assertEquals(100.0, second.area(), 1e-9);
        // the first model still sees its own geometry
        assertPoint(1, 1, 0, router.processElement(EntityId.of(10), small).bounds().orElseThrow().max());
    }

    @Test
    void testRepresentationFilter() {
        var model = mixedGeometry();
        var axisOnly = GeometryConfig.builder().withRepresentations(Set.of("Axis")).build();
        var router = GeometryRouter.forModel(model, axisOnly);
        // the polyline of the axis representation has no processor
        assertTrue(router.processElement(EntityId.of(100), model.resolver()).isEmpty());
        assertTrue(router.processElement(EntityId.of(200), model.resolver()).isEmpty());
    }

    @Test
    void testSimpleWallInMillimeters() {
        var model = simpleWall();
        var router = GeometryRouter.forModel(model, GeometryConfig.defaultConfig());
        assertEquals(0.001, router.getUnitScale(), 1e-12);
        var mesh = router.processElement(EntityId.of(100), model.resolver());
        assertEquals(12, mesh.triangleCount());
        var bounds = mesh.bounds().orElseThrow();
        assertPoint(-1, -0.5, 0, bounds.min());
        assertPoint(1, 0.5, 3, bounds.max());

        // the wall's placement is the identity, so the bare item lands in the same place
        var item = router.process(EntityId.of(122), model.resolver());
        assertEquals(12, item.triangleCount());
        assertPoint(1, 0.5, 3, item.bounds().orElseThrow().max());

        // a slab without representation
        assertTrue(router.processElement(EntityId.of(101), model.resolver()).isEmpty());
    }

    @Test
    void testUnitScaleOverride() {
        var model = simpleWall();
        var config = GeometryConfig.builder().withUnitScale(1.0).build();
        var router = GeometryRouter.forModel(model, config);
        assertEquals(1.0, router.getUnitScale(), 1e-12);
        var bounds = router.processElement(EntityId.of(100), model.resolver()).bounds().orElseThrow();
        assertPoint(1000, 500, 3000, bounds.max());
    }

    @Test
    void testUnsupportedType() {
        var model = mixedGeometry();
        var router = new GeometryRouter();
        assertTrue(router.supports("IFCEXTRUDEDAREASOLID"));
        assertFalse(router.supports("IFCBOUNDINGBOX"));
        var e = assertThrows(GeometryException.UnsupportedType.class,
                             () -> router.process(EntityId.of(105), model.resolver()));
        assertEquals("IFCBOUNDINGBOX", e.getTypeName());
    }
}
