/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 */
package com.hellblazer.stepwise.geometry;

import com.hellblazer.stepwise.parser.EntityId;
import com.hellblazer.stepwise.parser.StepException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.hellblazer.stepwise.geometry.GeometryFixtures.assertPoint;
import static com.hellblazer.stepwise.geometry.GeometryFixtures.mixedGeometry;
import static com.hellblazer.stepwise.geometry.GeometryFixtures.model;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * @author hal.hildebrand
 */
public class ModelTessellatorTest {

    private ModelTessellator tessellator;

    @BeforeEach
    void setUp() {
        tessellator = new ModelTessellator(GeometryConfig.builder().withParallelism(2).build());
    }

    @AfterEach
    void tearDown() {
        tessellator.shutdown();
    }

    @Test
    void testFailuresAreCollected() throws Exception {
        var resolver = model("""
                             #1=IFCWALL('a',$,$,$,$,$,$,$,$);
                             #2=IFCSLAB('b',$,$,$,$,$,$,$,$);
                             #3=IFCBEAM('c',$,$,$,$,$,$,$,$);
                             """);
        var router = mock(GeometryRouter.class);
        var square = new Mesh();
        square.addVertex(0, 0, 0, 0, 0, 1);
        square.addVertex(1, 0, 0, 0, 0, 1);
        square.addVertex(0, 1, 0, 0, 0, 1);
        square.addTriangle(0, 1, 2);
        when(router.processElement(eq(EntityId.of(1)), any())).thenReturn(square);
        when(router.processElement(eq(EntityId.of(2)), any())).thenThrow(new GeometryException.Csg("boom"));
        when(router.processElement(eq(EntityId.of(3)), any())).thenReturn(new Mesh());

        var result = tessellator.tessellate(resolver, router, List.of(EntityId.of(1), EntityId.of(2),
                                                                       EntityId.of(3)));
        assertEquals(List.of(EntityId.of(1)), List.copyOf(result.meshes().keySet()));
        assertEquals(1, result.failures().size());
        var failure = result.failures().get(0);
        assertEquals(EntityId.of(2), failure.id());
        assertEquals("IFCSLAB", failure.typeName());
        assertInstanceOf(GeometryException.Csg.class, failure.cause());
        verify(router, times(3)).processElement(any(), any());
    }

    @Test
    void testMixedModel() throws Exception {
        var result = tessellator.tessellate(mixedGeometry());
        assertEquals(List.of(EntityId.of(100), EntityId.of(200), EntityId.of(300), EntityId.of(410),
                             EntityId.of(420)), List.copyOf(result.meshes().keySet()));
        assertTrue(result.hasFailures());
        var failure = result.failures().get(0);
        assertEquals(EntityId.of(500), failure.id());
        assertEquals("IFCBEAM", failure.typeName());
        assertInstanceOf(StepException.EntityNotFound.class, failure.cause());

        assertEquals(28 + 12 + 2 + 2 + 2, result.triangleCount());
        var bounds = result.bounds().orElseThrow();
        assertPoint(0, -0.2, 0, bounds.min());
        assertPoint(10.2, 7, 5.5, bounds.max());

        var data = result.toMeshData();
        assertEquals(5, data.size());
        assertEquals(12, data.get(EntityId.of(200)).triangleCount());
    }

    @Test
    void testProductElements() {
        var model = mixedGeometry();
        assertEquals(List.of(EntityId.of(100), EntityId.of(200), EntityId.of(300), EntityId.of(410),
                             EntityId.of(420), EntityId.of(500)), ModelTessellator.productElements(model.resolver()));
    }

    @Test
    void testSimpleWall() throws Exception {
        var result = tessellator.tessellate(GeometryFixtures.simpleWall());
        assertFalse(result.hasFailures());
        assertEquals(1, result.meshes().size());
        assertPoint(1, 0.5, 3, result.bounds().orElseThrow().max());
    }
}
