/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 */
package com.hellblazer.stepwise.parser.spatial;

import com.hellblazer.stepwise.parser.EntityId;
import com.hellblazer.stepwise.parser.StepModel;
import com.hellblazer.stepwise.parser.TestFixtures;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class SpatialTreeBuilderTest {

    private static EntityId id(long value) {
        return EntityId.of(value);
    }

    @Test
    void testHierarchy() {
        var tree = SpatialTreeBuilder.build(StepModel.scan(TestFixtures.simpleWall()));
        var root = tree.root().orElseThrow();
        assertEquals(SpatialNodeType.PROJECT, root.getType());
        assertEquals("Test Project", root.getName());
        assertEquals(List.of(id(30)), root.getChildren());

        var building = tree.node(id(40)).orElseThrow();
        assertEquals(SpatialNodeType.BUILDING, building.getType());
        assertEquals(List.of(id(51), id(50)), building.getChildren());
        assertEquals(id(30), tree.parent(id(40)).orElseThrow().getId());

        var ground = tree.node(id(50)).orElseThrow();
        assertEquals(0.0, ground.getElevation().orElseThrow());
        assertEquals(List.of(id(100), id(101)), ground.getChildren());

        var wall = tree.node(id(100)).orElseThrow();
        assertEquals(SpatialNodeType.ELEMENT, wall.getType());
        assertEquals("IFCWALL", wall.getTypeName());
        assertTrue(wall.hasGeometry());
        assertFalse(tree.node(id(101)).orElseThrow().hasGeometry());
        assertEquals(7, tree.size());
    }

    @Test
    void testStoreysSortedByElevation() {
        var tree = SpatialTreeBuilder.build(StepModel.scan(TestFixtures.simpleWall()));
        var storeys = tree.storeys();
        assertEquals(2, storeys.size());
        assertEquals(new StoreyInfo(id(50), "Ground Floor", 0.0, 2), storeys.get(0));
        assertEquals(new StoreyInfo(id(51), "First Floor", 3000.0, 0), storeys.get(1));
        assertEquals(List.of(id(100), id(101)), tree.elementsInStorey(id(50)));
        assertEquals(List.of(), tree.elementsInStorey(id(40)));
        assertEquals(id(50), tree.containingStorey(id(100)).orElseThrow().getId());
        assertTrue(tree.containingStorey(id(40)).isEmpty());
    }

    @Test
    void testQueries() {
        var tree = SpatialTreeBuilder.build(StepModel.scan(TestFixtures.simpleWall()));
        assertEquals(List.of(id(100)), tree.elementsByType("IFCWALL").stream().map(SpatialNode::getId).toList());
        assertEquals(List.of(id(51), id(50)), tree.search("floor").stream().map(SpatialNode::getId).toList());
        assertEquals(1, tree.search("ifcslab").size());

        var visited = new ArrayList<EntityId>();
        tree.walk(n -> visited.add(n.getId()));
        assertEquals(List.of(id(1), id(30), id(40), id(51), id(50), id(100), id(101)), visited);
        assertEquals(List.of(id(51), id(50)),
                     tree.children(id(40)).stream().map(SpatialNode::getId).toList());
    }

    @Test
    void testFirstClaimWins() {
        var content = """
                      DATA;
                      #1=IFCPROJECT('p',$,'Project',$,$,$,$,$,$);
                      #2=IFCBUILDINGSTOREY('s1',$,'Level 1',$,$,$,$,$,.ELEMENT.,0.);
                      #3=IFCBUILDINGSTOREY('s2',$,'Level 2',$,$,$,$,$,.ELEMENT.,4.);
                      #4=IFCWALL('w',$,'Wall',$,$,$,$,$,$);
                      #10=IFCRELAGGREGATES('a',$,$,$,#1,(#2,#3));
                      #11=IFCRELCONTAINEDINSPATIALSTRUCTURE('c1',$,$,$,(#4),#2);
                      #12=IFCRELCONTAINEDINSPATIALSTRUCTURE('c2',$,$,$,(#4),#3);
                      ENDSEC;
                      """;
        var tree = SpatialTreeBuilder.build(StepModel.scan(content));
        assertEquals(id(2), tree.parent(id(4)).orElseThrow().getId());
        assertEquals(List.of(id(4)), tree.node(id(2)).orElseThrow().getChildren());
        assertEquals(List.of(), tree.node(id(3)).orElseThrow().getChildren());
        assertEquals(4, tree.size());
    }

    @Test
    void testCyclesAndDanglingChildrenIgnored() {
        var content = """
                      DATA;
                      #1=IFCPROJECT('p',$,'Project',$,$,$,$,$,$);
                      #2=IFCSITE('s',$,'Site',$,$,$,$,$,$,$,$,$,$,$);
                      #3=IFCBUILDING('b',$,'Building',$,$,$,$,$,$,$,$,$);
                      #10=IFCRELAGGREGATES('a',$,$,$,#1,(#2));
                      #11=IFCRELAGGREGATES('b',$,$,$,#2,(#3,#77));
                      #12=IFCRELAGGREGATES('c',$,$,$,#3,(#2,#1));
                      ENDSEC;
                      """;
        var tree = SpatialTreeBuilder.build(StepModel.scan(content));
        assertEquals(3, tree.size());
        assertEquals(List.of(id(3)), tree.node(id(2)).orElseThrow().getChildren());
        assertEquals(List.of(), tree.node(id(3)).orElseThrow().getChildren());
        assertTrue(tree.parent(id(1)).isEmpty());
        assertTrue(tree.storeys().isEmpty());
    }

    @Test
    void testNoProject() {
        var tree = SpatialTreeBuilder.build(StepModel.scan("DATA;\n#1=IFCWALL('w');\nENDSEC;"));
        assertTrue(tree.isEmpty());
        assertTrue(tree.root().isEmpty());
        assertEquals(0, tree.size());
        assertTrue(tree.search("w").isEmpty());
    }
}
